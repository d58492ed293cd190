package org.janelia.coreg.selection;

import java.nio.file.Path;
import java.util.List;

import org.janelia.coreg.quality.CandidateChoice;

/**
 * Ordered pair of competing registration candidates: the refined (primary) candidate
 * and the fallback candidate.
 */
public class CandidateSet {

    private final RegistrationCandidate primary;
    private final RegistrationCandidate fallback;

    /**
     * @throws CandidateSetMismatchException
     *   if either candidate is missing or both slots reference the same registration.
     */
    public CandidateSet(final RegistrationCandidate primary,
                        final RegistrationCandidate fallback)
            throws CandidateSetMismatchException {

        if ((primary == null) || (fallback == null)) {
            throw new CandidateSetMismatchException("both primary and fallback candidates must be specified");
        }
        if (primary.getName().equals(fallback.getName())) {
            throw new CandidateSetMismatchException("primary and fallback candidates are both named '" +
                                                    primary.getName() + "'");
        }
        if (primary.getTransform().equals(fallback.getTransform())) {
            throw new CandidateSetMismatchException("primary and fallback candidates share transform " +
                                                    primary.getTransform());
        }

        this.primary = primary;
        this.fallback = fallback;
    }

    /**
     * Builds a candidate set from parallel lists where index 0 is the refined candidate and
     * index 1 is the fallback candidate.
     *
     * @throws CandidateSetMismatchException
     *   if the lists do not each contain exactly two non-null elements.
     */
    public static CandidateSet fromParallelLists(final List<String> names,
                                                 final List<Path> transforms,
                                                 final List<Path> reports)
            throws CandidateSetMismatchException {

        requirePair("names", names);
        requirePair("transforms", transforms);
        requirePair("reports", reports);

        return new CandidateSet(new RegistrationCandidate(names.get(0), transforms.get(0), reports.get(0)),
                                new RegistrationCandidate(names.get(1), transforms.get(1), reports.get(1)));
    }

    public RegistrationCandidate getPrimary() {
        return primary;
    }

    public RegistrationCandidate getFallback() {
        return fallback;
    }

    public RegistrationCandidate get(final CandidateChoice choice) {
        final RegistrationCandidate candidate;
        switch (choice) {
            case PRIMARY:
                candidate = primary;
                break;
            case FALLBACK:
                candidate = fallback;
                break;
            default:
                throw new IllegalArgumentException("unsupported choice " + choice);
        }
        return candidate;
    }

    @Override
    public String toString() {
        return "{primary: " + primary + ", fallback: " + fallback + '}';
    }

    private static void requirePair(final String context,
                                    final List<?> values)
            throws CandidateSetMismatchException {
        if ((values == null) || (values.size() != 2)) {
            throw new CandidateSetMismatchException(
                    context + " must contain exactly 2 elements (refined, fallback) but contains " +
                    (values == null ? 0 : values.size()));
        }
        if ((values.get(0) == null) || (values.get(1) == null)) {
            throw new CandidateSetMismatchException(context + " contains a null element");
        }
    }
}
