package org.janelia.coreg.transform;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Translation, rotation, scale and shear components of an affine transform.
 * Instances are derived fresh for each comparison and are never modified.
 */
public class AffineDecomposition
        implements Serializable {

    private final double[] translation;
    private final double[][] rotation;
    private final double[] scales;
    private final double[] shears;

    /**
     * @param  translation  x, y, z translation.
     * @param  rotation     3x3 proper rotation matrix (orthonormal, determinant +1).
     * @param  scales       x, y, z scale factors.
     * @param  shears       xy, xz, yz shear factors.
     */
    public AffineDecomposition(final double[] translation,
                               final double[][] rotation,
                               final double[] scales,
                               final double[] shears) {
        this.translation = checkedCopy("translation", translation);
        this.rotation = new double[3][];
        if ((rotation == null) || (rotation.length != 3)) {
            throw new IllegalArgumentException("rotation must be a 3x3 matrix");
        }
        for (int row = 0; row < 3; row++) {
            this.rotation[row] = checkedCopy("rotation row " + row, rotation[row]);
        }
        this.scales = checkedCopy("scales", scales);
        this.shears = checkedCopy("shears", shears);
    }

    public double[] getTranslation() {
        return translation.clone();
    }

    public double[][] getRotation() {
        final double[][] copy = new double[3][];
        for (int row = 0; row < 3; row++) {
            copy[row] = rotation[row].clone();
        }
        return copy;
    }

    public double[] getScales() {
        return scales.clone();
    }

    public double[] getShears() {
        return shears.clone();
    }

    @Override
    public String toString() {
        return "{translation: " + Arrays.toString(translation) +
               ", rotation: " + Arrays.deepToString(rotation) +
               ", scales: " + Arrays.toString(scales) +
               ", shears: " + Arrays.toString(shears) + '}';
    }

    private static double[] checkedCopy(final String context,
                                        final double[] values) {
        if ((values == null) || (values.length != 3)) {
            throw new IllegalArgumentException(context + " must have 3 values");
        }
        return values.clone();
    }
}
