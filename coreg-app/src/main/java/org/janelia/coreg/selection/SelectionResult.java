package org.janelia.coreg.selection;

import java.nio.file.Path;

import org.janelia.coreg.quality.CandidateChoice;
import org.janelia.coreg.quality.QualityVerdict;

/**
 * The candidate chosen by arbitration along with the verdict that justifies the choice.
 */
public class SelectionResult {

    private final RegistrationCandidate selected;
    private final CandidateChoice choice;
    private final QualityVerdict verdict;

    public SelectionResult(final RegistrationCandidate selected,
                           final CandidateChoice choice,
                           final QualityVerdict verdict) {
        this.selected = selected;
        this.choice = choice;
        this.verdict = verdict;
    }

    public RegistrationCandidate getSelected() {
        return selected;
    }

    public Path getSelectedTransform() {
        return selected.getTransform();
    }

    public Path getSelectedReport() {
        return selected.getReport();
    }

    public CandidateChoice getChoice() {
        return choice;
    }

    public boolean isRejectRefined() {
        return choice.isFallback();
    }

    /**
     * @return verdict behind this selection, or null if the selection was made from a bare flag.
     */
    public QualityVerdict getVerdict() {
        return verdict;
    }

    @Override
    public String toString() {
        return "{choice: " + choice + ", selected: " + selected + ", verdict: " + verdict + '}';
    }
}
