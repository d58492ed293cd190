package org.janelia.coreg.transform;

/**
 * Thrown when the linear block of an affine transform cannot be inverted, even approximately.
 * This indicates a degenerate upstream registration and is never retried.
 */
public class SingularTransformException
        extends RuntimeException {

    private final double[] singularValues;

    public SingularTransformException(final String message,
                                      final double[] singularValues) {
        super(message);
        this.singularValues = singularValues == null ? new double[0] : singularValues.clone();
    }

    public double[] getSingularValues() {
        return singularValues.clone();
    }
}
