package org.janelia.coreg.transform;

import Jama.Matrix;
import Jama.SingularValueDecomposition;

/**
 * Supported procedures for splitting the linear block of an affine transform into
 * rotation, scale and shear components.
 */
public enum DecompositionMethod {

    /**
     * Polar decomposition L = R * S where R is a proper rotation and S is the symmetric stretch.
     * Scales are the diagonal of S and shears are its off-diagonal (xy, xz, yz) entries.
     * A reflection is folded into the stretch along its least significant direction.
     */
    POLAR {
        @Override
        AffineDecomposition decompose(final double[] translation,
                                      final Matrix linear) {

            final SingularValueDecomposition svd = linear.svd();
            final Matrix u = svd.getU();
            final Matrix vTranspose = svd.getV().transpose();

            Matrix sigma = svd.getS();
            Matrix rotation = u.times(vTranspose);

            if (rotation.det() < 0) {
                // Jama sorts singular values in descending order, so index 2 is the least significant
                final Matrix flip = Matrix.identity(3, 3);
                flip.set(2, 2, -1.0);
                rotation = u.times(flip).times(vTranspose);
                sigma = flip.times(sigma);
            }

            final Matrix stretch = svd.getV().times(sigma).times(vTranspose);

            final double[] scales = { stretch.get(0, 0), stretch.get(1, 1), stretch.get(2, 2) };
            final double[] shears = { stretch.get(0, 1), stretch.get(0, 2), stretch.get(1, 2) };

            return new AffineDecomposition(translation, rotation.getArray(), scales, shears);
        }
    },

    /**
     * Column-wise Gram-Schmidt orthogonalisation (scale, then shear, then rotation).
     * Shears are expressed relative to the preceding scale factors.
     * A reflection is expressed by negating the x scale.
     */
    GRAM_SCHMIDT {
        @Override
        AffineDecomposition decompose(final double[] translation,
                                      final Matrix linear) {

            final double[] m0 = column(linear, 0);
            final double[] m1 = column(linear, 1);
            final double[] m2 = column(linear, 2);

            double sx = norm(m0);
            divideInPlace(m0, sx);

            final double sxSxy = dot(m0, m1);
            addScaledInPlace(m1, m0, -sxSxy);
            final double sy = norm(m1);
            divideInPlace(m1, sy);
            final double sxy = sxSxy / sx;

            final double sxSxz = dot(m0, m2);
            final double sySyz = dot(m1, m2);
            addScaledInPlace(m2, m0, -sxSxz);
            addScaledInPlace(m2, m1, -sySyz);
            final double sz = norm(m2);
            divideInPlace(m2, sz);
            final double sxz = sxSxz / sx;
            final double syz = sySyz / sy;

            final double[][] rotation = new double[3][3];
            for (int row = 0; row < 3; row++) {
                rotation[row][0] = m0[row];
                rotation[row][1] = m1[row];
                rotation[row][2] = m2[row];
            }

            if (new Matrix(rotation).det() < 0) {
                sx = -sx;
                for (int row = 0; row < 3; row++) {
                    rotation[row][0] = -rotation[row][0];
                }
            }

            return new AffineDecomposition(translation,
                                           rotation,
                                           new double[] { sx, sy, sz },
                                           new double[] { sxy, sxz, syz });
        }
    };

    /**
     * @param  translation  translation component of the transform being decomposed.
     * @param  linear       invertible 3x3 linear block of the transform being decomposed.
     *
     * @return decomposition of the transform.
     */
    abstract AffineDecomposition decompose(final double[] translation,
                                           final Matrix linear);

    private static double[] column(final Matrix matrix,
                                   final int index) {
        return new double[] { matrix.get(0, index), matrix.get(1, index), matrix.get(2, index) };
    }

    private static double dot(final double[] a,
                              final double[] b) {
        return (a[0] * b[0]) + (a[1] * b[1]) + (a[2] * b[2]);
    }

    private static double norm(final double[] a) {
        return Math.sqrt(dot(a, a));
    }

    private static void divideInPlace(final double[] a,
                                      final double divisor) {
        for (int i = 0; i < a.length; i++) {
            a[i] /= divisor;
        }
    }

    private static void addScaledInPlace(final double[] target,
                                         final double[] source,
                                         final double factor) {
        for (int i = 0; i < target.length; i++) {
            target[i] += factor * source[i];
        }
    }
}
