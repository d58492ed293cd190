package org.janelia.coreg.selection;

/**
 * Thrown when competing registration candidates cannot be proven to form one ordered
 * (refined, fallback) pair.  This is a caller contract violation.
 */
public class CandidateSetMismatchException
        extends IllegalArgumentException {

    public CandidateSetMismatchException(final String message) {
        super(message);
    }
}
