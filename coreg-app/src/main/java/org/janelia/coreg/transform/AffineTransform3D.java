package org.janelia.coreg.transform;

import java.io.Serializable;
import java.util.Arrays;

import Jama.Matrix;

/**
 * Immutable 4x4 homogeneous affine matrix that maps source coordinates to target coordinates
 * (target = M * source).  The translation is held in the last column and the upper left 3x3
 * block encodes rotation, scale and shear.
 */
public class AffineTransform3D
        implements Serializable {

    public static final int SIZE = 4;

    private final double[] rowMajorValues;

    /**
     * @param  rowMajorValues  the 16 matrix values in row-major order.
     *
     * @throws IllegalArgumentException
     *   if the wrong number of values are specified or any value is not finite.
     */
    public AffineTransform3D(final double[] rowMajorValues)
            throws IllegalArgumentException {

        if ((rowMajorValues == null) || (rowMajorValues.length != SIZE * SIZE)) {
            throw new IllegalArgumentException(
                    "affine matrix requires " + (SIZE * SIZE) + " values but " +
                    (rowMajorValues == null ? "none were" : rowMajorValues.length + " were") + " specified");
        }
        for (int i = 0; i < rowMajorValues.length; i++) {
            if (! Double.isFinite(rowMajorValues[i])) {
                throw new IllegalArgumentException("affine matrix value " + i + " (" + rowMajorValues[i] +
                                                   ") is not finite");
            }
        }
        this.rowMajorValues = rowMajorValues.clone();
    }

    public static AffineTransform3D identity() {
        return translation(0, 0, 0);
    }

    public static AffineTransform3D translation(final double dx,
                                                final double dy,
                                                final double dz) {
        return new AffineTransform3D(new double[] {
                1, 0, 0, dx,
                0, 1, 0, dy,
                0, 0, 1, dz,
                0, 0, 0, 1
        });
    }

    /**
     * @return transform with the specified 3x3 linear block and translation.
     */
    public static AffineTransform3D fromLinearAndTranslation(final double[][] linear,
                                                             final double[] translation) {
        final double[] values = new double[SIZE * SIZE];
        for (int row = 0; row < 3; row++) {
            for (int column = 0; column < 3; column++) {
                values[row * SIZE + column] = linear[row][column];
            }
            values[row * SIZE + 3] = translation[row];
        }
        values[15] = 1.0;
        return new AffineTransform3D(values);
    }

    static AffineTransform3D fromMatrix(final Matrix matrix) {
        if ((matrix.getRowDimension() != SIZE) || (matrix.getColumnDimension() != SIZE)) {
            throw new IllegalArgumentException("expected " + SIZE + "x" + SIZE + " matrix but found " +
                                               matrix.getRowDimension() + "x" + matrix.getColumnDimension());
        }
        return new AffineTransform3D(matrix.getRowPackedCopy());
    }

    public double get(final int row,
                      final int column) {
        return rowMajorValues[row * SIZE + column];
    }

    public double[] getRowMajorValues() {
        return rowMajorValues.clone();
    }

    /**
     * @return copy of the upper left 3x3 block.
     */
    public double[][] getLinearBlock() {
        final double[][] linear = new double[3][3];
        for (int row = 0; row < 3; row++) {
            for (int column = 0; column < 3; column++) {
                linear[row][column] = get(row, column);
            }
        }
        return linear;
    }

    public double[] getTranslation() {
        return new double[] { get(0, 3), get(1, 3), get(2, 3) };
    }

    Matrix toMatrix() {
        return new Matrix(rowMajorValues, SIZE).transpose();
    }

    Matrix toLinearMatrix() {
        return new Matrix(getLinearBlock());
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        return Arrays.equals(rowMajorValues, ((AffineTransform3D) o).rowMajorValues);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(rowMajorValues);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("[");
        for (int row = 0; row < SIZE; row++) {
            sb.append(row == 0 ? "[" : ", [");
            for (int column = 0; column < SIZE; column++) {
                if (column > 0) {
                    sb.append(", ");
                }
                sb.append(get(row, column));
            }
            sb.append(']');
        }
        return sb.append(']').toString();
    }
}
