package org.janelia.coreg.transform;

import Jama.Matrix;

import org.janelia.coreg.quality.QualityGate;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link DecompositionMethod} class.
 */
public class DecompositionMethodTest {

    @Test
    public void testIdentity() {
        for (final DecompositionMethod method : DecompositionMethod.values()) {
            final AffineDecomposition decomposition = decompose(method, IDENTITY);
            assertMatrixEquals(method + " rotation", IDENTITY, decomposition.getRotation());
            Assert.assertArrayEquals(method + " scales", new double[] { 1, 1, 1 }, decomposition.getScales(), DELTA);
            Assert.assertArrayEquals(method + " shears", new double[] { 0, 0, 0 }, decomposition.getShears(), DELTA);
        }
    }

    @Test
    public void testAxisScales() {
        final double[][] linear = { { 2, 0, 0 }, { 0, 3, 0 }, { 0, 0, 4 } };
        for (final DecompositionMethod method : DecompositionMethod.values()) {
            final AffineDecomposition decomposition = decompose(method, linear);
            assertMatrixEquals(method + " rotation", IDENTITY, decomposition.getRotation());
            Assert.assertArrayEquals(method + " scales", new double[] { 2, 3, 4 }, decomposition.getScales(), DELTA);
            Assert.assertArrayEquals(method + " shears", new double[] { 0, 0, 0 }, decomposition.getShears(), DELTA);
        }
    }

    @Test
    public void testPureRotation() {
        final double angle = Math.toRadians(12.5);
        final double[][] linear = {
                { Math.cos(angle), -Math.sin(angle), 0 },
                { Math.sin(angle),  Math.cos(angle), 0 },
                { 0,                0,               1 }
        };
        for (final DecompositionMethod method : DecompositionMethod.values()) {
            final AffineDecomposition decomposition = decompose(method, linear);
            assertMatrixEquals(method + " rotation", linear, decomposition.getRotation());
            Assert.assertEquals(method + " rotation angle",
                                angle, QualityGate.getRotationAngle(decomposition.getRotation()), DELTA);
            Assert.assertArrayEquals(method + " scales", new double[] { 1, 1, 1 }, decomposition.getScales(), DELTA);
        }
    }

    @Test
    public void testGramSchmidtShear() {
        final double[][] linear = { { 1, 0.5, 0 }, { 0, 1, 0 }, { 0, 0, 1 } };
        final AffineDecomposition decomposition = decompose(DecompositionMethod.GRAM_SCHMIDT, linear);
        assertMatrixEquals("rotation", IDENTITY, decomposition.getRotation());
        Assert.assertArrayEquals("scales", new double[] { 1, 1, 1 }, decomposition.getScales(), DELTA);
        Assert.assertArrayEquals("shears", new double[] { 0.5, 0, 0 }, decomposition.getShears(), DELTA);
    }

    @Test
    public void testPolarShear() {
        final double[][] linear = { { 1.1, 0.05, 0.02 }, { 0.05, 0.95, -0.03 }, { 0.02, -0.03, 1.0 } };
        final AffineDecomposition decomposition = decompose(DecompositionMethod.POLAR, linear);
        // symmetric positive definite input is all stretch
        assertMatrixEquals("rotation", IDENTITY, decomposition.getRotation());
        Assert.assertArrayEquals("scales", new double[] { 1.1, 0.95, 1.0 }, decomposition.getScales(), DELTA);
        Assert.assertArrayEquals("shears", new double[] { 0.05, 0.02, -0.03 }, decomposition.getShears(), DELTA);
    }

    @Test
    public void testReconstruction() {
        for (final DecompositionMethod method : DecompositionMethod.values()) {
            for (final double[][] linear : new double[][][] { GENERAL_LINEAR, REFLECTED_LINEAR }) {

                final AffineDecomposition decomposition = decompose(method, linear);
                final Matrix rotation = new Matrix(decomposition.getRotation());

                Assert.assertEquals(method + " rotation should be proper", 1.0, rotation.det(), DELTA);
                assertMatrixEquals(method + " rotation should be orthonormal",
                                   IDENTITY, rotation.transpose().times(rotation).getArray());

                final Matrix reconstructed = rotation.times(buildScaleShearMatrix(method, decomposition));
                assertMatrixEquals(method + " reconstruction", linear, reconstructed.getArray());
            }
        }
    }

    @Test
    public void testGramSchmidtReflection() {
        final double[][] mirror = { { -1, 0, 0 }, { 0, 1, 0 }, { 0, 0, 1 } };
        final AffineDecomposition decomposition = decompose(DecompositionMethod.GRAM_SCHMIDT, mirror);
        assertMatrixEquals("rotation", IDENTITY, decomposition.getRotation());
        Assert.assertArrayEquals("x scale should be negated",
                                 new double[] { -1, 1, 1 }, decomposition.getScales(), DELTA);
    }

    @Test
    public void testShearAndFlipVerdictsDependOnMethod() {

        final QualityGate gate = new QualityGate();

        // polar folds half of a 0.2 xy shear into rotation, atan(0.1) exceeds the 5 degree limit
        final double[][] shear = { { 1, 0.2, 0 }, { 0, 1, 0 }, { 0, 0, 1 } };

        final AffineDecomposition polarShear = decompose(DecompositionMethod.POLAR, shear);
        Assert.assertEquals("polar shear rotation",
                            Math.atan(0.1), QualityGate.getRotationAngle(polarShear.getRotation()), DELTA);
        Assert.assertTrue("polar shear should be rejected", gate.evaluate(polarShear).isRotationExceeded());

        final AffineDecomposition gramSchmidtShear = decompose(DecompositionMethod.GRAM_SCHMIDT, shear);
        Assert.assertEquals("gram schmidt shear rotation",
                            0.0, QualityGate.getRotationAngle(gramSchmidtShear.getRotation()), DELTA);
        Assert.assertFalse("gram schmidt shear should be accepted", gate.evaluate(gramSchmidtShear).isRejectRefined());

        // an x flip becomes a half turn for polar but a negative scale for gram schmidt
        final double[][] flip = { { -1, 0, 0 }, { 0, 1, 0 }, { 0, 0, 1 } };

        final AffineDecomposition polarFlip = decompose(DecompositionMethod.POLAR, flip);
        Assert.assertEquals("polar flip rotation",
                            Math.PI, QualityGate.getRotationAngle(polarFlip.getRotation()), DELTA);
        Assert.assertTrue("polar flip should be rejected", gate.evaluate(polarFlip).isRejectRefined());

        final AffineDecomposition gramSchmidtFlip = decompose(DecompositionMethod.GRAM_SCHMIDT, flip);
        Assert.assertEquals("gram schmidt flip rotation",
                            0.0, QualityGate.getRotationAngle(gramSchmidtFlip.getRotation()), DELTA);
        Assert.assertFalse("gram schmidt flip should be accepted", gate.evaluate(gramSchmidtFlip).isRejectRefined());
    }

    private static AffineDecomposition decompose(final DecompositionMethod method,
                                                 final double[][] linear) {
        return method.decompose(new double[] { 0, 0, 0 }, new Matrix(linear));
    }

    private static Matrix buildScaleShearMatrix(final DecompositionMethod method,
                                                final AffineDecomposition decomposition) {
        final double[] s = decomposition.getScales();
        final double[] h = decomposition.getShears();
        final double[][] values;
        if (method == DecompositionMethod.POLAR) {
            values = new double[][] {
                    { s[0], h[0], h[1] },
                    { h[0], s[1], h[2] },
                    { h[1], h[2], s[2] }
            };
        } else {
            values = new double[][] {
                    { s[0], s[0] * h[0], s[0] * h[1] },
                    { 0,    s[1],        s[1] * h[2] },
                    { 0,    0,           s[2] }
            };
        }
        return new Matrix(values);
    }

    private static void assertMatrixEquals(final String message,
                                           final double[][] expected,
                                           final double[][] actual) {
        for (int row = 0; row < expected.length; row++) {
            Assert.assertArrayEquals(message + " row " + row, expected[row], actual[row], DELTA);
        }
    }

    private static final double DELTA = 1.0e-10;

    private static final double[][] IDENTITY = { { 1, 0, 0 }, { 0, 1, 0 }, { 0, 0, 1 } };

    private static final double[][] GENERAL_LINEAR = {
            { 0.9, -0.3, 0.1 }, { 0.25, 1.1, -0.05 }, { -0.1, 0.2, 0.95 }
    };

    private static final double[][] REFLECTED_LINEAR = {
            { -0.9, -0.3, 0.1 }, { -0.25, 1.1, -0.05 }, { 0.1, 0.2, 0.95 }
    };
}
