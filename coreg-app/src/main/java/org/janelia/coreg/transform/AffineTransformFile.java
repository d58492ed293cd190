package org.janelia.coreg.transform;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes affine transform files.
 */
public class AffineTransformFile {

    public static AffineTransform3D load(final Path path)
            throws IOException, IllegalArgumentException {
        return load(path, TransformFileFormat.fromPath(path));
    }

    /**
     * @return transform loaded from the specified file.
     *
     * @throws IOException
     *   if the file cannot be read.
     *
     * @throws IllegalArgumentException
     *   if the file does not contain a valid 4x4 matrix.
     */
    public static AffineTransform3D load(final Path path,
                                         final TransformFileFormat format)
            throws IOException, IllegalArgumentException {

        final List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);

        final AffineTransform3D transform;
        try {
            transform = parse(lines, format);
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("failed to parse " + format + " transform " + path + ", " +
                                               e.getMessage(), e);
        }

        LOG.debug("load: loaded {} from {}", transform, path);

        return transform;
    }

    public static AffineTransform3D parse(final List<String> lines,
                                          final TransformFileFormat format)
            throws IllegalArgumentException {
        final AffineTransform3D transform;
        switch (format) {
            case LTA:
                transform = parseLta(lines);
                break;
            case PLAIN:
            default:
                transform = parsePlain(lines);
                break;
        }
        return transform;
    }

    /**
     * @return type recorded in the specified LTA file, or null if the file has no type line.
     *
     * @throws IllegalArgumentException
     *   if the type line holds an unsupported value.
     */
    public static LtaType loadLtaType(final Path path)
            throws IOException, IllegalArgumentException {
        final List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        try {
            return parseLtaType(lines);
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("failed to parse type of " + path + ", " + e.getMessage(), e);
        }
    }

    /**
     * @return type from the first "type = N" line before the matrix, or null if there is none.
     */
    public static LtaType parseLtaType(final List<String> lines)
            throws IllegalArgumentException {
        LtaType type = null;
        for (final String line : lines) {
            final String trimmedLine = line.trim();
            if (LTA_DIMENSIONS.matcher(trimmedLine).matches()) {
                break;
            }
            final Matcher m = LTA_TYPE.matcher(trimmedLine);
            if (m.matches()) {
                type = LtaType.fromCode(Integer.parseInt(m.group(1)));
                break;
            }
        }
        return type;
    }

    /**
     * Writes the specified transform as a plain row-major 4x4 matrix.
     * Values are written with full precision so that loading the file returns an identical transform.
     */
    public static void savePlain(final AffineTransform3D transform,
                                 final Path path)
            throws IOException {

        try (final BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            for (int row = 0; row < AffineTransform3D.SIZE; row++) {
                for (int column = 0; column < AffineTransform3D.SIZE; column++) {
                    if (column > 0) {
                        writer.write(' ');
                    }
                    writer.write(String.valueOf(transform.get(row, column)));
                }
                writer.newLine();
            }
        }

        LOG.info("savePlain: wrote {}", path);
    }

    private static AffineTransform3D parsePlain(final List<String> lines)
            throws IllegalArgumentException {
        final List<String> tokens = new ArrayList<>();
        for (final String line : lines) {
            final String trimmedLine = line.trim();
            if ((trimmedLine.length() > 0) && (! trimmedLine.startsWith("#"))) {
                tokens.addAll(Arrays.asList(WHITESPACE.split(trimmedLine)));
            }
        }
        if (tokens.size() != VALUE_COUNT) {
            throw new IllegalArgumentException("expected " + VALUE_COUNT + " matrix values but found " +
                                               tokens.size());
        }
        return new AffineTransform3D(parseTokens(tokens));
    }

    private static AffineTransform3D parseLta(final List<String> lines)
            throws IllegalArgumentException {

        int matrixStart = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (LTA_DIMENSIONS.matcher(lines.get(i).trim()).matches()) {
                matrixStart = i + 1;
                break;
            }
        }

        if (matrixStart < 0) {
            throw new IllegalArgumentException("missing '1 4 4' matrix dimension line");
        }

        final List<String> matrixLines = new ArrayList<>();
        for (int i = matrixStart; (i < lines.size()) && (matrixLines.size() < AffineTransform3D.SIZE); i++) {
            final String trimmedLine = lines.get(i).trim();
            if (trimmedLine.length() > 0) {
                matrixLines.add(trimmedLine);
            }
        }

        return new AffineTransform3D(parseRows(matrixLines));
    }

    private static double[] parseRows(final List<String> matrixLines)
            throws IllegalArgumentException {

        if (matrixLines.size() != AffineTransform3D.SIZE) {
            throw new IllegalArgumentException("expected " + AffineTransform3D.SIZE + " matrix rows but found " +
                                               matrixLines.size());
        }

        final List<String> tokens = new ArrayList<>();
        for (int row = 0; row < matrixLines.size(); row++) {
            final String[] rowTokens = WHITESPACE.split(matrixLines.get(row));
            if (rowTokens.length != AffineTransform3D.SIZE) {
                throw new IllegalArgumentException("expected " + AffineTransform3D.SIZE + " values in row " +
                                                   row + " but found " + rowTokens.length);
            }
            tokens.addAll(Arrays.asList(rowTokens));
        }

        return parseTokens(tokens);
    }

    private static double[] parseTokens(final List<String> tokens)
            throws IllegalArgumentException {
        final double[] values = new double[tokens.size()];
        for (int i = 0; i < values.length; i++) {
            try {
                values[i] = Double.parseDouble(tokens.get(i));
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException("invalid matrix value '" + tokens.get(i) + "'", e);
            }
        }
        return values;
    }

    private static final int VALUE_COUNT = AffineTransform3D.SIZE * AffineTransform3D.SIZE;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LTA_DIMENSIONS = Pattern.compile("1\\s+4\\s+4");
    private static final Pattern LTA_TYPE = Pattern.compile("type\\s*=\\s*(\\d+)(\\s*#.*)?");

    private static final Logger LOG = LoggerFactory.getLogger(AffineTransformFile.class);
}
