package org.janelia.coreg.convert;

import java.nio.file.Path;

/**
 * Forward (source to target) and inverse (target to source) transforms written in a consumer convention.
 */
public class ExportedTransforms {

    private final Path forward;
    private final Path inverse;

    public ExportedTransforms(final Path forward,
                              final Path inverse) {
        this.forward = forward;
        this.inverse = inverse;
    }

    public Path getForward() {
        return forward;
    }

    public Path getInverse() {
        return inverse;
    }

    @Override
    public String toString() {
        return "{forward: " + forward + ", inverse: " + inverse + '}';
    }
}
