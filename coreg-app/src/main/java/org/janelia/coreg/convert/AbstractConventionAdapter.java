package org.janelia.coreg.convert;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

import org.janelia.coreg.transform.AffineTransform3D;
import org.janelia.coreg.transform.AffineTransformFile;
import org.janelia.coreg.transform.TransformFileFormat;

/**
 * Shared logic for adapters whose consumer transforms are produced by
 * converting FSL matrices into ITK transforms with c3d_affine_tool.
 */
public abstract class AbstractConventionAdapter
        implements MatrixConventionAdapter {

    public static final String C3D_AFFINE_TOOL = "c3d_affine_tool";

    public static final String FORWARD_ITK_FILE_NAME = "source_to_target_itk.txt";
    public static final String INVERSE_ITK_FILE_NAME = "target_to_source_itk.txt";

    private final TransformFileFormat nativeFormat;
    protected final CommandRunner commandRunner;

    protected AbstractConventionAdapter(final TransformFileFormat nativeFormat,
                                        final CommandRunner commandRunner) {
        this.nativeFormat = nativeFormat;
        this.commandRunner = commandRunner;
    }

    @Override
    public String getConventionName() {
        return nativeFormat.name();
    }

    @Override
    public AffineTransform3D readMatrix(final Path transformFile)
            throws IOException, IllegalArgumentException {
        return AffineTransformFile.load(transformFile, nativeFormat);
    }

    /**
     * @return null since plain matrices do not record their space.
     */
    @Override
    public String readMatrixType(final Path transformFile)
            throws IOException, IllegalArgumentException {
        return null;
    }

    @Override
    public void validateContext(final ConversionContext context)
            throws IllegalArgumentException {
        if (context == null) {
            throw new IllegalArgumentException("conversion context must be specified");
        }
        context.validateImages();
    }

    /**
     * Converts an FSL matrix that maps movingImage onto referenceImage into an ITK transform.
     */
    protected void convertFslToItk(final Path fslMatrix,
                                   final Path referenceImage,
                                   final Path movingImage,
                                   final Path itkTransform)
            throws IOException {
        commandRunner.run(Arrays.asList(C3D_AFFINE_TOOL,
                                        "-ref", referenceImage.toString(),
                                        "-src", movingImage.toString(),
                                        fslMatrix.toString(),
                                        "-fsl2ras",
                                        "-oitk", itkTransform.toString()));
    }
}
