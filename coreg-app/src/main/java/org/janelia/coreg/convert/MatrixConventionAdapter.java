package org.janelia.coreg.convert;

import java.io.IOException;
import java.nio.file.Path;

import org.janelia.coreg.transform.AffineTransform3D;

/**
 * Boundary between a registration method's native transform files and the rest of the pipeline.
 * Each adapter knows how to read its native matrices and how to re-express a selected
 * transform in the consumer (ITK) convention.
 */
public interface MatrixConventionAdapter {

    /**
     * @return name of the native convention (for logging).
     */
    String getConventionName();

    /**
     * @return matrix (target = M * source) held in the specified native transform file.
     */
    AffineTransform3D readMatrix(final Path transformFile)
            throws IOException, IllegalArgumentException;

    /**
     * @return space the native matrix maps between as recorded in the file,
     *         or null if the convention does not record one.
     */
    String readMatrixType(final Path transformFile)
            throws IOException, IllegalArgumentException;

    /**
     * @throws IllegalArgumentException
     *   if the context lacks anything this adapter needs for export.
     */
    void validateContext(final ConversionContext context)
            throws IllegalArgumentException;

    /**
     * Converts the selected native transform into forward and inverse consumer transforms.
     *
     * @param  selectedTransform  native transform chosen by arbitration.
     * @param  context            reference images and transforms needed by the conversion tools.
     * @param  outputDirectory    directory for converted (and intermediate) files.
     */
    ExportedTransforms export(final Path selectedTransform,
                              final ConversionContext context,
                              final Path outputDirectory)
            throws IOException, IllegalArgumentException;
}
