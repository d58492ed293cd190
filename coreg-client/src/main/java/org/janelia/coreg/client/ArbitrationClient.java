package org.janelia.coreg.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.janelia.coreg.client.parameter.CommandLineParameters;
import org.janelia.coreg.client.parameter.DofValidator;
import org.janelia.coreg.client.parameter.QualityThresholdParameters;
import org.janelia.coreg.convert.CommandRunner;
import org.janelia.coreg.convert.ConversionContext;
import org.janelia.coreg.convert.ProcessCommandRunner;
import org.janelia.coreg.pipeline.ArbitrationPipeline;
import org.janelia.coreg.pipeline.ArbitrationResult;
import org.janelia.coreg.pipeline.RegistrationStrategy;
import org.janelia.coreg.quality.QualityGate;
import org.janelia.coreg.selection.CandidateSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for choosing between a refined and a fallback registration and exporting
 * the chosen transform (with its matching report) for downstream consumers.
 */
public class ArbitrationClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--strategy",
                description = "Registration strategy that produced the candidates",
                required = true)
        public RegistrationStrategy strategy;

        @Parameter(
                names = "--dof",
                description = "Degrees of freedom used by the refined registration (6, 9 or 12)",
                validateWith = DofValidator.class)
        public Integer dof = 9;

        @Parameter(
                names = "--transform",
                description = "Candidate transform file, specify refined candidate first and fallback candidate second",
                required = true)
        public List<String> transforms = new ArrayList<>();

        @Parameter(
                names = "--report",
                description = "Candidate report file, specify in the same order as --transform",
                required = true)
        public List<String> reports = new ArrayList<>();

        @Parameter(
                names = "--candidateName",
                description = "Candidate names in the same order as --transform (default: strategy method names)")
        public List<String> candidateNames;

        @Parameter(
                names = "--sourceImage",
                description = "Image that was registered (e.g. reference BOLD volume)",
                required = true)
        public String sourceImage;

        @Parameter(
                names = "--targetImage",
                description = "Image that was registered to (e.g. skull-stripped T1w volume)",
                required = true)
        public String targetImage;

        @Parameter(
                names = "--fsnativeTransform",
                description = "LTA transform from FreeSurfer native space to target image space " +
                              "(required for BBREGISTER strategy)")
        public String fsnativeTransform;

        @Parameter(
                names = "--outputDirectory",
                description = "Directory for selected, exported and summary files",
                required = true)
        public String outputDirectory;

        @ParametersDelegate
        public QualityThresholdParameters quality = new QualityThresholdParameters();

        public List<String> getCandidateNames() {
            return candidateNames == null ?
                   Arrays.asList(strategy.getRefinedName(), strategy.getFallbackName()) : candidateNames;
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final ArbitrationClient client = new ArbitrationClient(parameters, new ProcessCommandRunner());
                client.arbitrate();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final CommandRunner commandRunner;

    public ArbitrationClient(final Parameters parameters,
                             final CommandRunner commandRunner) {
        this.parameters = parameters;
        this.commandRunner = commandRunner;
    }

    public ArbitrationResult arbitrate()
            throws IOException {

        final QualityGate qualityGate = new QualityGate(parameters.quality.buildThresholds(),
                                                        parameters.quality.decompositionMethod);

        final ArbitrationPipeline pipeline = ArbitrationPipeline.forStrategy(parameters.strategy,
                                                                             parameters.dof,
                                                                             qualityGate,
                                                                             commandRunner);

        final CandidateSet candidates = CandidateSet.fromParallelLists(parameters.getCandidateNames(),
                                                                       toPaths(parameters.transforms),
                                                                       toPaths(parameters.reports));

        final ConversionContext context =
                new ConversionContext(Paths.get(parameters.sourceImage),
                                      Paths.get(parameters.targetImage),
                                      parameters.fsnativeTransform == null ?
                                      null : Paths.get(parameters.fsnativeTransform));

        final ArbitrationResult result = pipeline.run(candidates,
                                                      context,
                                                      Paths.get(parameters.outputDirectory).toAbsolutePath());

        LOG.info("arbitrate: exit, fallback={}, verdict={}, summary written to {}",
                 result.isRejectRefined(), result.getSelection().getVerdict(), result.getSummaryFile());

        return result;
    }

    private static List<Path> toPaths(final List<String> names) {
        return names.stream().map(Paths::get).collect(Collectors.toList());
    }

    private static final Logger LOG = LoggerFactory.getLogger(ArbitrationClient.class);
}
