package org.janelia.coreg.quality;

/**
 * Which of two competing registration candidates downstream consumers should use.
 */
public enum CandidateChoice {

    /** The refined registration passed the quality gate. */
    PRIMARY,

    /** The refined registration was rejected, use the fallback registration. */
    FALLBACK;

    public static CandidateChoice forRejectRefined(final boolean rejectRefined) {
        return rejectRefined ? FALLBACK : PRIMARY;
    }

    public boolean isFallback() {
        return this == FALLBACK;
    }
}
