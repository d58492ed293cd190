package org.janelia.coreg.convert;

import java.io.IOException;
import java.nio.file.Path;

import org.janelia.coreg.transform.AffineTransform3D;
import org.janelia.coreg.transform.AffineTransformFile;
import org.janelia.coreg.transform.TransformFileFormat;
import org.janelia.coreg.transform.TransformMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapter for FSL FLIRT matrices.
 *
 * FLIRT only produces the source to target direction, so the target to source matrix is
 * derived by inverting the selected matrix before both are converted to ITK transforms.
 */
public class FslConventionAdapter
        extends AbstractConventionAdapter {

    public FslConventionAdapter(final CommandRunner commandRunner) {
        super(TransformFileFormat.PLAIN, commandRunner);
    }

    @Override
    public ExportedTransforms export(final Path selectedTransform,
                                     final ConversionContext context,
                                     final Path outputDirectory)
            throws IOException, IllegalArgumentException {

        validateContext(context);

        final AffineTransform3D inverse = TransformMath.invert(readMatrix(selectedTransform));
        final Path inverseFsl = outputDirectory.resolve("target_to_source_fsl.mat");
        AffineTransformFile.savePlain(inverse, inverseFsl);

        final ExportedTransforms exported = new ExportedTransforms(outputDirectory.resolve(FORWARD_ITK_FILE_NAME),
                                                                   outputDirectory.resolve(INVERSE_ITK_FILE_NAME));

        convertFslToItk(selectedTransform, context.getTargetImage(), context.getSourceImage(), exported.getForward());
        convertFslToItk(inverseFsl, context.getSourceImage(), context.getTargetImage(), exported.getInverse());

        LOG.info("export: converted {} to {}", selectedTransform, exported);

        return exported;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FslConventionAdapter.class);
}
