package org.janelia.coreg.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.janelia.coreg.client.parameter.CommandLineParameters;
import org.janelia.coreg.client.parameter.QualityThresholdParameters;
import org.janelia.coreg.quality.QualityGate;
import org.janelia.coreg.quality.QualityVerdict;
import org.janelia.coreg.transform.AffineTransform3D;
import org.janelia.coreg.transform.AffineTransformFile;
import org.janelia.coreg.transform.TransformFileFormat;
import org.janelia.coreg.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for judging a refined registration transform against a fallback transform
 * without selecting or exporting anything.
 */
public class CompareTransformsClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--refinedTransform",
                description = "Transform file produced by the refined registration",
                required = true)
        public String refinedTransform;

        @Parameter(
                names = "--fallbackTransform",
                description = "Transform file produced by the fallback registration",
                required = true)
        public String fallbackTransform;

        @Parameter(
                names = "--format",
                description = "Transform file format (default: derived from file extension)")
        public TransformFileFormat format;

        @Parameter(
                names = "--verdictFile",
                description = "Write verdict as JSON to this file")
        public String verdictFile;

        @ParametersDelegate
        public QualityThresholdParameters quality = new QualityThresholdParameters();
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final CompareTransformsClient client = new CompareTransformsClient(parameters);
                client.compare();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public CompareTransformsClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    public QualityVerdict compare()
            throws IOException {

        final QualityGate qualityGate = new QualityGate(parameters.quality.buildThresholds(),
                                                        parameters.quality.decompositionMethod);

        final AffineTransform3D refined = load(parameters.refinedTransform);
        final AffineTransform3D fallback = load(parameters.fallbackTransform);

        final QualityVerdict verdict = qualityGate.evaluate(refined, fallback);

        if (parameters.verdictFile != null) {
            FileUtil.saveJsonFile(Paths.get(parameters.verdictFile), verdict);
        }

        LOG.info("compare: exit, verdict is {}", verdict.toJson());

        return verdict;
    }

    private AffineTransform3D load(final String transformPath)
            throws IOException {
        final Path path = Paths.get(transformPath);
        final TransformFileFormat format = parameters.format == null ?
                                           TransformFileFormat.fromPath(path) : parameters.format;
        return AffineTransformFile.load(path, format);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CompareTransformsClient.class);
}
