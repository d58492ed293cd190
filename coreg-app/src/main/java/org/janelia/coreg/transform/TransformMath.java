package org.janelia.coreg.transform;

import java.util.Arrays;

import Jama.LUDecomposition;
import Jama.Matrix;
import Jama.SingularValueDecomposition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Linear algebra for comparing two affine estimates of the same registration.
 *
 * Given a fallback matrix M1 and a refined matrix M2 (each satisfying target = M * source),
 * the relative transform M2 * pinv(M1) describes how far the refined estimate deviates from
 * the fallback estimate.  Identical estimates produce the identity.
 *
 * All methods are pure functions of their immutable inputs and are safe to call from any thread.
 */
public class TransformMath {

    /** Singular values at or below this fraction of the largest one are dropped by the pseudo-inverse. */
    public static final double PSEUDO_INVERSE_RCOND = 1.0e-15;

    /** Linear blocks whose smallest/largest singular value ratio falls at or below this are singular. */
    public static final double SINGULAR_TOLERANCE = 1.0e-10;

    /**
     * @return decomposition of the transform that maps the fallback estimate onto the refined estimate.
     *
     * @throws SingularTransformException
     *   if either estimate or their composition has a singular linear block.
     */
    public static AffineDecomposition composeAndDecompose(final AffineTransform3D refined,
                                                          final AffineTransform3D fallback)
            throws SingularTransformException {
        return composeAndDecompose(refined, fallback, DecompositionMethod.POLAR);
    }

    public static AffineDecomposition composeAndDecompose(final AffineTransform3D refined,
                                                          final AffineTransform3D fallback,
                                                          final DecompositionMethod method)
            throws SingularTransformException {
        return decompose(relativeTransform(refined, fallback), method);
    }

    /**
     * @return refined * pinv(fallback).
     *
     * @throws SingularTransformException
     *   if either estimate or their composition has a singular linear block.
     */
    public static AffineTransform3D relativeTransform(final AffineTransform3D refined,
                                                      final AffineTransform3D fallback)
            throws SingularTransformException {

        requireInvertibleLinearBlock("refined", refined);
        requireInvertibleLinearBlock("fallback", fallback);

        final Matrix composed = refined.toMatrix().times(pseudoInverse(fallback.toMatrix()));
        final AffineTransform3D relative = AffineTransform3D.fromMatrix(composed);

        requireInvertibleLinearBlock("relative", relative);

        LOG.debug("relativeTransform: returning {}", relative);

        return relative;
    }

    public static AffineDecomposition decompose(final AffineTransform3D transform)
            throws SingularTransformException {
        return decompose(transform, DecompositionMethod.POLAR);
    }

    /**
     * @return translation, rotation, scale and shear components of the specified transform.
     *
     * @throws SingularTransformException
     *   if the transform's linear block is singular.
     */
    public static AffineDecomposition decompose(final AffineTransform3D transform,
                                                final DecompositionMethod method)
            throws SingularTransformException {
        requireInvertibleLinearBlock("decomposed", transform);
        return method.decompose(transform.getTranslation(), transform.toLinearMatrix());
    }

    /**
     * @return Moore-Penrose pseudo-inverse of the specified matrix computed from its
     *         singular value decomposition.
     *
     * @throws SingularTransformException
     *   if every singular value of the matrix is zero.
     */
    public static Matrix pseudoInverse(final Matrix matrix)
            throws SingularTransformException {

        // Jama's SVD requires at least as many rows as columns
        final boolean isWide = matrix.getRowDimension() < matrix.getColumnDimension();
        final Matrix tall = isWide ? matrix.transpose() : matrix;

        final SingularValueDecomposition svd = tall.svd();
        final double[] singularValues = svd.getSingularValues();
        final double largest = singularValues.length == 0 ? 0.0 : singularValues[0];
        if (largest == 0.0) {
            throw new SingularTransformException("cannot pseudo-invert matrix, all singular values are zero",
                                                 singularValues);
        }

        final double cutoff = PSEUDO_INVERSE_RCOND * largest;
        final Matrix sigmaPlus = new Matrix(singularValues.length, singularValues.length);
        for (int i = 0; i < singularValues.length; i++) {
            if (singularValues[i] > cutoff) {
                sigmaPlus.set(i, i, 1.0 / singularValues[i]);
            }
        }

        final Matrix tallInverse = svd.getV().times(sigmaPlus).times(svd.getU().transpose());

        return isWide ? tallInverse.transpose() : tallInverse;
    }

    /**
     * @return strict inverse of the specified transform.
     *
     * @throws SingularTransformException
     *   if the transform's linear block is singular.
     */
    public static AffineTransform3D invert(final AffineTransform3D transform)
            throws SingularTransformException {
        requireInvertibleLinearBlock("inverted", transform);
        final Matrix matrix = transform.toMatrix();
        final LUDecomposition lu = new LUDecomposition(matrix);
        if (! lu.isNonsingular()) {
            // possible when the homogeneous row is not [0 0 0 1]
            throw new SingularTransformException("inverted transform " + transform + " is singular",
                                                 matrix.svd().getSingularValues());
        }
        return AffineTransform3D.fromMatrix(lu.solve(Matrix.identity(AffineTransform3D.SIZE,
                                                                     AffineTransform3D.SIZE)));
    }

    /**
     * @throws SingularTransformException
     *   if the linear block of the specified transform is singular beyond numerical tolerance.
     */
    public static void requireInvertibleLinearBlock(final String context,
                                                    final AffineTransform3D transform)
            throws SingularTransformException {

        final double[] singularValues = transform.toLinearMatrix().svd().getSingularValues();
        final double largest = singularValues[0];
        final double smallest = singularValues[singularValues.length - 1];

        if ((largest == 0.0) || (smallest <= SINGULAR_TOLERANCE * largest)) {
            throw new SingularTransformException(
                    context + " transform has a singular linear block (singular values " +
                    Arrays.toString(singularValues) + "), transform is " + transform,
                    singularValues);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(TransformMath.class);
}
