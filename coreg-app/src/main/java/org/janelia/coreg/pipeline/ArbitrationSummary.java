package org.janelia.coreg.pipeline;

import java.io.Serializable;

import org.janelia.coreg.convert.ExportedTransforms;
import org.janelia.coreg.quality.QualityThresholds;
import org.janelia.coreg.quality.QualityVerdict;
import org.janelia.coreg.selection.CandidateSet;
import org.janelia.coreg.selection.SelectionResult;
import org.janelia.coreg.transform.DecompositionMethod;

/**
 * Audit record of one arbitration, written as JSON next to the selected outputs.
 */
public class ArbitrationSummary
        implements Serializable {

    private String strategy;
    private Integer dof;
    private Integer fallbackDof;
    private String refinedCandidate;
    private String fallbackCandidate;
    private String selectedCandidate;
    private boolean fallback;
    private QualityVerdict verdict;
    private QualityThresholds thresholds;
    private DecompositionMethod decompositionMethod;
    private String selectedTransform;
    private String selectedReport;
    private String forwardTransform;
    private String inverseTransform;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private ArbitrationSummary() {
    }

    public ArbitrationSummary(final String strategy,
                              final Integer dof,
                              final Integer fallbackDof,
                              final CandidateSet candidates,
                              final SelectionResult selection,
                              final QualityThresholds thresholds,
                              final DecompositionMethod decompositionMethod,
                              final ExportedTransforms exported) {
        this.strategy = strategy;
        this.dof = dof;
        this.fallbackDof = fallbackDof;
        this.refinedCandidate = candidates.getPrimary().getName();
        this.fallbackCandidate = candidates.getFallback().getName();
        this.selectedCandidate = selection.getSelected().getName();
        this.fallback = selection.isRejectRefined();
        this.verdict = selection.getVerdict();
        this.thresholds = thresholds;
        this.decompositionMethod = decompositionMethod;
        this.selectedTransform = selection.getSelectedTransform().toString();
        this.selectedReport = selection.getSelectedReport().toString();
        if (exported != null) {
            this.forwardTransform = exported.getForward().toString();
            this.inverseTransform = exported.getInverse().toString();
        }
    }

    public String getStrategy() {
        return strategy;
    }

    public Integer getDof() {
        return dof;
    }

    public Integer getFallbackDof() {
        return fallbackDof;
    }

    public String getSelectedCandidate() {
        return selectedCandidate;
    }

    public boolean isFallback() {
        return fallback;
    }

    public QualityVerdict getVerdict() {
        return verdict;
    }

    public DecompositionMethod getDecompositionMethod() {
        return decompositionMethod;
    }

    public String getSelectedTransform() {
        return selectedTransform;
    }

    public String getSelectedReport() {
        return selectedReport;
    }

    public String getForwardTransform() {
        return forwardTransform;
    }

    public String getInverseTransform() {
        return inverseTransform;
    }
}
