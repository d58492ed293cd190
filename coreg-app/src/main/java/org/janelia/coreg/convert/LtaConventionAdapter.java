package org.janelia.coreg.convert;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

import org.janelia.coreg.transform.AffineTransformFile;
import org.janelia.coreg.transform.LtaType;
import org.janelia.coreg.transform.TransformFileFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapter for FreeSurfer LTA transforms (bbregister and mri_coreg).
 *
 * The selected LTA is first concatenated with the FreeSurfer native to target reverse transform,
 * then converted to forward and inverse FSL matrices with lta_convert and finally converted
 * to ITK transforms.
 */
public class LtaConventionAdapter
        extends AbstractConventionAdapter {

    public static final String CONCATENATE_TOOL = "mri_concatenate_lta";
    public static final String LTA_CONVERT_TOOL = "lta_convert";

    public LtaConventionAdapter(final CommandRunner commandRunner) {
        super(TransformFileFormat.LTA, commandRunner);
    }

    @Override
    public String readMatrixType(final Path transformFile)
            throws IOException, IllegalArgumentException {
        final LtaType type = AffineTransformFile.loadLtaType(transformFile);
        return type == null ? null : type.name();
    }

    @Override
    public void validateContext(final ConversionContext context)
            throws IllegalArgumentException {
        super.validateContext(context);
        if (context.getFsnativeReverseTransform() == null) {
            throw new IllegalArgumentException("fsnative reverse transform must be specified for LTA conversion");
        }
    }

    @Override
    public ExportedTransforms export(final Path selectedTransform,
                                     final ConversionContext context,
                                     final Path outputDirectory)
            throws IOException, IllegalArgumentException {

        validateContext(context);

        final Path concatenated = outputDirectory.resolve("selected_concatenated.lta");
        commandRunner.run(Arrays.asList(CONCATENATE_TOOL,
                                        selectedTransform.toString(),
                                        context.getFsnativeReverseTransform().toString(),
                                        concatenated.toString()));

        final Path forwardFsl = outputDirectory.resolve("source_to_target_fsl.mat");
        commandRunner.run(Arrays.asList(LTA_CONVERT_TOOL,
                                        "--inlta", concatenated.toString(),
                                        "--outfsl", forwardFsl.toString()));

        final Path inverseFsl = outputDirectory.resolve("target_to_source_fsl.mat");
        commandRunner.run(Arrays.asList(LTA_CONVERT_TOOL,
                                        "--inlta", concatenated.toString(),
                                        "--outfsl", inverseFsl.toString(),
                                        "--invert"));

        final ExportedTransforms exported = new ExportedTransforms(outputDirectory.resolve(FORWARD_ITK_FILE_NAME),
                                                                   outputDirectory.resolve(INVERSE_ITK_FILE_NAME));

        convertFslToItk(forwardFsl, context.getTargetImage(), context.getSourceImage(), exported.getForward());
        convertFslToItk(inverseFsl, context.getSourceImage(), context.getTargetImage(), exported.getInverse());

        LOG.info("export: converted {} to {}", selectedTransform, exported);

        return exported;
    }

    private static final Logger LOG = LoggerFactory.getLogger(LtaConventionAdapter.class);
}
