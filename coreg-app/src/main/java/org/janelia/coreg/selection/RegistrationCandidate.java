package org.janelia.coreg.selection;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Transform and diagnostic report produced by a single registration attempt.
 * Keeping both in one record guarantees they are always selected together.
 */
public class RegistrationCandidate {

    private final String name;
    private final Path transform;
    private final Path report;

    /**
     * @param  name       name of the registration method that produced this candidate (e.g. "bbregister").
     * @param  transform  affine transform file produced by the registration.
     * @param  report     diagnostic report produced by the same registration (treated as an opaque reference).
     */
    public RegistrationCandidate(final String name,
                                 final Path transform,
                                 final Path report) {
        this.name = Objects.requireNonNull(name, "candidate name must be specified");
        this.transform = Objects.requireNonNull(transform, name + " transform must be specified");
        this.report = Objects.requireNonNull(report, name + " report must be specified");
    }

    public String getName() {
        return name;
    }

    public Path getTransform() {
        return transform;
    }

    public Path getReport() {
        return report;
    }

    @Override
    public String toString() {
        return "{name: '" + name + "', transform: '" + transform + "', report: '" + report + "'}";
    }
}
