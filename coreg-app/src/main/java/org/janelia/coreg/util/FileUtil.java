package org.janelia.coreg.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.janelia.coreg.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File helpers for selected outputs and summaries.
 */
public class FileUtil {

    public static void saveJsonFile(final Path path,
                                    final Object data)
            throws IOException {
        saveJsonFile(path, data, JsonUtils.MAPPER);
    }

    /**
     * Writes the data to a sibling temporary file first and then moves it into place,
     * so readers never see a partially written file.
     */
    public static void saveJsonFile(final Path path,
                                    final Object data,
                                    final ObjectMapper mapper)
            throws IOException {

        final Path toPath = path.toAbsolutePath();
        final Path tmpPath = toPath.resolveSibling(toPath.getFileName() + ".tmp");

        try (final Writer writer = Files.newBufferedWriter(tmpPath, StandardCharsets.UTF_8)) {
            mapper.writeValue(writer, data);
        } catch (final JsonProcessingException e) {
            Files.deleteIfExists(tmpPath);
            throw new IOException("failed to serialize data for " + toPath, e);
        }

        Files.move(tmpPath, toPath, StandardCopyOption.REPLACE_EXISTING);

        LOG.info("saveJsonFile: wrote {}", toPath);
    }

    /**
     * Copies a file into a directory, replacing the file's base name with the specified name
     * but keeping its original extension (e.g. "bbregister.lta" becomes "selected_transform.lta").
     *
     * @return path of the copy.
     */
    public static Path copyWithBaseName(final Path source,
                                        final Path toDirectory,
                                        final String baseName)
            throws IOException {

        final Path toPath = toDirectory.resolve(baseName + getExtension(source));
        Files.copy(source, toPath, StandardCopyOption.REPLACE_EXISTING);

        LOG.info("copyWithBaseName: copied {} to {}", source, toPath);

        return toPath;
    }

    /**
     * @return extension (including the leading dot) of the specified path's file name,
     *         handling double extensions like ".nii.gz", or an empty string if there is none.
     */
    public static String getExtension(final Path path) {
        final String name = path.getFileName().toString();
        final String extension;
        if (name.endsWith(".nii.gz")) {
            extension = ".nii.gz";
        } else {
            final int lastDot = name.lastIndexOf('.');
            extension = lastDot > 0 ? name.substring(lastDot) : "";
        }
        return extension;
    }

    /**
     * Creates the directory (and any missing parents) if needed.
     *
     * @throws IllegalArgumentException
     *   if the path exists but is not a writable directory.
     */
    public static void ensureWritableDirectory(final Path directory)
            throws IOException, IllegalArgumentException {
        if (Files.exists(directory) && (! Files.isDirectory(directory))) {
            throw new IllegalArgumentException(directory + " exists but is not a directory");
        }
        Files.createDirectories(directory);
        if (! Files.isWritable(directory)) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    /**
     * Deletes the path and everything below it, deepest entries first.
     *
     * @return true if everything was deleted (or nothing existed); otherwise false.
     */
    public static boolean deleteRecursive(final Path path) {

        if (! Files.exists(path)) {
            return true;
        }

        final List<Path> deleteOrder;
        try (final Stream<Path> walk = Files.walk(path)) {
            deleteOrder = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (final IOException e) {
            LOG.warn("deleteRecursive: failed to list {}", path, e);
            return false;
        }

        int failureCount = 0;
        for (final Path p : deleteOrder) {
            try {
                Files.delete(p);
            } catch (final IOException e) {
                LOG.warn("deleteRecursive: failed to delete {}", p, e);
                failureCount++;
            }
        }

        LOG.info("deleteRecursive: removed {} entries under {}, {} failures",
                 deleteOrder.size() - failureCount, path, failureCount);

        return failureCount == 0;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);
}
