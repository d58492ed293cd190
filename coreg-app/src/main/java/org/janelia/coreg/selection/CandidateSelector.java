package org.janelia.coreg.selection;

import org.janelia.coreg.quality.CandidateChoice;
import org.janelia.coreg.quality.QualityVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the refined or the fallback candidate based upon a quality verdict.
 * Transform and report are always taken from the same candidate.
 */
public class CandidateSelector {

    public SelectionResult select(final CandidateSet candidates,
                                  final QualityVerdict verdict) {
        return select(candidates, verdict.getChoice(), verdict);
    }

    public SelectionResult select(final CandidateSet candidates,
                                  final boolean rejectRefined) {
        return select(candidates, CandidateChoice.forRejectRefined(rejectRefined), null);
    }

    private SelectionResult select(final CandidateSet candidates,
                                   final CandidateChoice choice,
                                   final QualityVerdict verdict) {

        if (candidates == null) {
            throw new CandidateSetMismatchException("candidates must be specified");
        }

        final RegistrationCandidate selected = candidates.get(choice);

        LOG.info("select: choice is {}, using {} transform {} and report {}",
                 choice, selected.getName(), selected.getTransform(), selected.getReport());

        return new SelectionResult(selected, choice, verdict);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CandidateSelector.class);
}
