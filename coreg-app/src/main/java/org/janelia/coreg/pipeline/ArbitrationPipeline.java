package org.janelia.coreg.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.janelia.coreg.convert.CommandRunner;
import org.janelia.coreg.convert.ConversionContext;
import org.janelia.coreg.convert.ExportedTransforms;
import org.janelia.coreg.convert.MatrixConventionAdapter;
import org.janelia.coreg.quality.QualityGate;
import org.janelia.coreg.quality.QualityVerdict;
import org.janelia.coreg.selection.CandidateSelector;
import org.janelia.coreg.selection.CandidateSet;
import org.janelia.coreg.selection.CandidateSetMismatchException;
import org.janelia.coreg.selection.RegistrationCandidate;
import org.janelia.coreg.selection.SelectionResult;
import org.janelia.coreg.transform.AffineTransform3D;
import org.janelia.coreg.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Arbitrates between a refined and a fallback registration and exports the winner.
 *
 * Each run is a single linear pass: both candidate matrices are read, the quality gate
 * judges the refined matrix against the fallback matrix, one candidate (transform and
 * report together) is selected, and only then is the selected transform converted into
 * the consumer convention.  Only the {@link MatrixConventionAdapter} differs between
 * registration strategies.
 */
public class ArbitrationPipeline {

    public static final String SELECTED_TRANSFORM_BASE_NAME = "selected_transform";
    public static final String SELECTED_REPORT_BASE_NAME = "selected_report";
    public static final String SUMMARY_FILE_NAME = "arbitration.json";

    private final String name;
    private final Integer dof;
    private final Integer fallbackDof;
    private final MatrixConventionAdapter adapter;
    private final QualityGate qualityGate;
    private final CandidateSelector candidateSelector;

    /**
     * @param  name         name of this pipeline (for logging and the summary).
     * @param  dof          degrees of freedom used by the refined registration (for labeling only, may be null).
     * @param  fallbackDof  degrees of freedom used by the fallback registration (for labeling only, may be null).
     * @param  adapter      reads and exports transforms in the registration method's native convention.
     * @param  qualityGate  judges the refined registration.
     */
    public ArbitrationPipeline(final String name,
                               final Integer dof,
                               final Integer fallbackDof,
                               final MatrixConventionAdapter adapter,
                               final QualityGate qualityGate) {
        this.name = name;
        this.dof = dof;
        this.fallbackDof = fallbackDof;
        this.adapter = adapter;
        this.qualityGate = qualityGate;
        this.candidateSelector = new CandidateSelector();
    }

    public static ArbitrationPipeline forStrategy(final RegistrationStrategy strategy,
                                                  final int dof,
                                                  final QualityGate qualityGate,
                                                  final CommandRunner commandRunner) {
        return new ArbitrationPipeline(strategy.name(),
                                       dof,
                                       strategy.getFallbackDof(dof),
                                       strategy.buildAdapter(commandRunner),
                                       qualityGate);
    }

    public String getName() {
        return name;
    }

    /**
     * Reads both candidate matrices, evaluates the refined candidate and selects a candidate.
     *
     * @throws IOException
     *   if either transform file cannot be read.
     *
     * @throws CandidateSetMismatchException
     *   if the candidate files record matrices in different spaces (e.g. voxel vs. RAS).
     *
     * @throws org.janelia.coreg.transform.SingularTransformException
     *   if either matrix is degenerate.
     */
    public SelectionResult arbitrate(final CandidateSet candidates)
            throws IOException {

        LOG.info("arbitrate: entry, pipeline {} ({} convention, dof {}, fallback dof {}), candidates {}",
                 name, adapter.getConventionName(), dof, fallbackDof, candidates);

        validateMatrixTypes(candidates);

        final AffineTransform3D refined = adapter.readMatrix(candidates.getPrimary().getTransform());
        final AffineTransform3D fallback = adapter.readMatrix(candidates.getFallback().getTransform());

        final QualityVerdict verdict = qualityGate.evaluate(refined, fallback);

        return candidateSelector.select(candidates, verdict);
    }

    /**
     * Arbitrates and then writes the selected transform and report copies, the exported
     * forward and inverse transforms, and a JSON summary to the output directory.
     */
    public ArbitrationResult run(final CandidateSet candidates,
                                 final ConversionContext context,
                                 final Path outputDirectory)
            throws IOException {

        // fail before doing any work if export is going to fail
        adapter.validateContext(context);
        FileUtil.ensureWritableDirectory(outputDirectory);

        final SelectionResult selection = arbitrate(candidates);

        final Path transformCopy = FileUtil.copyWithBaseName(selection.getSelectedTransform(),
                                                             outputDirectory,
                                                             SELECTED_TRANSFORM_BASE_NAME);
        final Path reportCopy = FileUtil.copyWithBaseName(selection.getSelectedReport(),
                                                          outputDirectory,
                                                          SELECTED_REPORT_BASE_NAME);

        final ExportedTransforms exported = adapter.export(selection.getSelectedTransform(),
                                                           context,
                                                           outputDirectory);

        final ArbitrationSummary summary = new ArbitrationSummary(name,
                                                                  dof,
                                                                  fallbackDof,
                                                                  candidates,
                                                                  selection,
                                                                  qualityGate.getThresholds(),
                                                                  qualityGate.getDecompositionMethod(),
                                                                  exported);
        final Path summaryFile = outputDirectory.resolve(SUMMARY_FILE_NAME);
        FileUtil.saveJsonFile(summaryFile, summary);

        final ArbitrationResult result = new ArbitrationResult(selection, transformCopy, reportCopy, exported, summaryFile);

        LOG.info("run: exit, fallback is {}, selected {}", selection.isRejectRefined(), selection.getSelected().getName());

        return result;
    }

    /**
     * Waits for two independent upstream registrations to complete and then runs arbitration.
     * Both registrations are submitted to the executor so they can run concurrently.
     * If either registration fails, the other is cancelled and the failure is propagated.
     */
    public ArbitrationResult run(final Callable<RegistrationCandidate> refinedRegistration,
                                 final Callable<RegistrationCandidate> fallbackRegistration,
                                 final ExecutorService executorService,
                                 final ConversionContext context,
                                 final Path outputDirectory)
            throws IOException, InterruptedException {

        final Future<RegistrationCandidate> refinedFuture = executorService.submit(refinedRegistration);
        final Future<RegistrationCandidate> fallbackFuture = executorService.submit(fallbackRegistration);

        final RegistrationCandidate refined;
        final RegistrationCandidate fallback;
        try {
            refined = getUpstreamResult("refined", refinedFuture);
            fallback = getUpstreamResult("fallback", fallbackFuture);
        } finally {
            refinedFuture.cancel(true);
            fallbackFuture.cancel(true);
        }

        return run(new CandidateSet(refined, fallback), context, outputDirectory);
    }

    private void validateMatrixTypes(final CandidateSet candidates)
            throws IOException, CandidateSetMismatchException {

        final String primaryType = adapter.readMatrixType(candidates.getPrimary().getTransform());
        final String fallbackType = adapter.readMatrixType(candidates.getFallback().getTransform());

        if ((primaryType != null) && (fallbackType != null) && (! primaryType.equals(fallbackType))) {
            throw new CandidateSetMismatchException(
                    "cannot compare " + candidates.getPrimary().getName() + " " + primaryType +
                    " matrix with " + candidates.getFallback().getName() + " " + fallbackType + " matrix");
        }

        if ((primaryType == null) != (fallbackType == null)) {
            LOG.warn("validateMatrixTypes: only one candidate records its matrix type ({} vs. {}), comparing anyway",
                     primaryType, fallbackType);
        }
    }

    private static RegistrationCandidate getUpstreamResult(final String context,
                                                           final Future<RegistrationCandidate> future)
            throws IOException, InterruptedException {
        try {
            return future.get();
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            LOG.error("getUpstreamResult: {} registration failed", context, cause);
            if (cause instanceof IOException) {
                throw (IOException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IOException(context + " registration failed", cause);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ArbitrationPipeline.class);
}
