package org.janelia.coreg.transform;

import java.nio.file.Path;

/**
 * On-disk conventions for affine transform files.
 */
public enum TransformFileFormat {

    /** Row-major 4x4 matrix of whitespace separated numbers (e.g. FSL .mat files), '#' starts a comment line. */
    PLAIN,

    /** FreeSurfer linear transform array where the matrix follows a "1 4 4" dimension line. */
    LTA;

    /**
     * @return format implied by the specified file's extension (.lta files are {@link #LTA},
     *         everything else is {@link #PLAIN}).
     */
    public static TransformFileFormat fromPath(final Path path) {
        final String name = path.getFileName().toString().toLowerCase();
        return name.endsWith(".lta") ? LTA : PLAIN;
    }
}
