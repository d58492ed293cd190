package org.janelia.coreg.quality;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import java.nio.file.Paths;
import java.util.List;

import org.janelia.coreg.transform.AffineDecomposition;
import org.janelia.coreg.transform.AffineTransform3D;
import org.janelia.coreg.transform.AffineTransformFile;
import org.janelia.coreg.transform.DecompositionMethod;
import org.janelia.coreg.transform.SingularTransformException;
import org.janelia.coreg.util.LogbackTestTools;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link QualityGate} class.
 */
public class QualityGateTest {

    private final QualityGate gate = new QualityGate();

    @After
    public void tearDown() {
        LogbackTestTools.detachCaptureAppender(QualityGate.class);
    }

    @Test
    public void testIdenticalEstimates() {
        final AffineTransform3D estimate = AffineTransform3D.fromLinearAndTranslation(
                new double[][] { { 1.02, 0.01, 0 }, { -0.01, 0.99, 0.02 }, { 0, 0.03, 1.01 } },
                new double[] { 1.5, -2.25, 0.75 });

        final QualityVerdict verdict = gate.evaluate(estimate, estimate);

        Assert.assertFalse("identical estimates should be accepted", verdict.isRejectRefined());
        Assert.assertEquals("invalid shift", 0.0, verdict.getShiftMagnitude(), 1.0e-12);
        Assert.assertEquals("invalid rotation", 0.0, verdict.getRotationAngle(), 1.0e-7);
        Assert.assertEquals("invalid scale", 1.0, verdict.getMaxScale(), 1.0e-12);
        Assert.assertEquals("invalid choice", CandidateChoice.PRIMARY, verdict.getChoice());
    }

    @Test
    public void testShiftBoundary() {

        final QualityVerdict atLimit = gate.evaluate(AffineTransform3D.translation(3, 4, 0),
                                                     AffineTransform3D.identity());
        Assert.assertEquals("invalid shift", 5.0, atLimit.getShiftMagnitude(), 1.0e-12);
        Assert.assertFalse("shift at limit should be accepted", atLimit.isRejectRefined());

        final QualityVerdict beyondLimit = gate.evaluate(AffineTransform3D.translation(0, 0, 5.0001),
                                                         AffineTransform3D.identity());
        Assert.assertTrue("shift beyond limit should be rejected", beyondLimit.isRejectRefined());
        Assert.assertTrue("shift should be flagged", beyondLimit.isShiftExceeded());
        Assert.assertFalse("rotation should not be flagged", beyondLimit.isRotationExceeded());
        Assert.assertFalse("scale should not be flagged", beyondLimit.isScaleExceeded());
        Assert.assertEquals("invalid choice", CandidateChoice.FALLBACK, beyondLimit.getChoice());
    }

    @Test
    public void testShiftIsMeasuredBetweenEstimates() {
        // both estimates are far from identity but only 1mm from each other
        final QualityVerdict verdict = gate.evaluate(AffineTransform3D.translation(21, 0, 0),
                                                     AffineTransform3D.translation(20, 0, 0));
        Assert.assertEquals("invalid shift", 1.0, verdict.getShiftMagnitude(), 1.0e-12);
        Assert.assertFalse("small relative shift should be accepted", verdict.isRejectRefined());
    }

    @Test
    public void testRotationBoundary() {

        final double limit = QualityThresholds.DEFAULT_ROTATION_THRESHOLD_RAD;

        final QualityVerdict atLimit = gate.evaluate(rotationAboutZ(limit), AffineTransform3D.identity());
        Assert.assertEquals("invalid rotation", limit, atLimit.getRotationAngle(), 1.0e-12);
        Assert.assertFalse("rotation at limit should be accepted", atLimit.isRejectRefined());

        final QualityVerdict beyondLimit = gate.evaluate(rotationAboutZ(limit + 1.0e-6),
                                                         AffineTransform3D.identity());
        Assert.assertTrue("rotation beyond limit should be rejected", beyondLimit.isRejectRefined());
        Assert.assertTrue("rotation should be flagged", beyondLimit.isRotationExceeded());
        Assert.assertFalse("shift should not be flagged", beyondLimit.isShiftExceeded());
    }

    @Test
    public void testScaleBoundary() {

        final QualityVerdict atLimit = gate.evaluate(scale(1.1, 1.0, 1.0), AffineTransform3D.identity());
        Assert.assertEquals("invalid scale", 1.1, atLimit.getMaxScale(), 1.0e-12);
        Assert.assertFalse("scale at limit should be accepted", atLimit.isRejectRefined());

        final QualityVerdict beyondLimit = gate.evaluate(scale(1.0, 1.1 + 1.0e-6, 1.0),
                                                         AffineTransform3D.identity());
        Assert.assertTrue("scale beyond limit should be rejected", beyondLimit.isRejectRefined());
        Assert.assertTrue("scale should be flagged", beyondLimit.isScaleExceeded());
    }

    @Test
    public void testComparisonTolerance() {

        final double epsilon = 1.0e-10;
        final AffineDecomposition shiftJustBeyond = decomposition(new double[] { 0, 0, 5.0 + epsilon }, 1.0);
        final AffineDecomposition scaleJustBeyond = decomposition(new double[] { 0, 0, 0 }, 1.1 + epsilon);

        Assert.assertFalse("default tolerance should absorb tiny shift excess",
                           gate.evaluate(shiftJustBeyond).isRejectRefined());
        Assert.assertFalse("default tolerance should absorb tiny scale excess",
                           gate.evaluate(scaleJustBeyond).isRejectRefined());

        final QualityGate strictGate = new QualityGate(new QualityThresholds(5.0, Math.PI / 36.0, 1.1, 0.0));

        Assert.assertTrue("zero tolerance should reject any shift excess",
                          strictGate.evaluate(shiftJustBeyond).isShiftExceeded());
        Assert.assertTrue("zero tolerance should reject any scale excess",
                          strictGate.evaluate(scaleJustBeyond).isScaleExceeded());

        final QualityVerdict atLimits = strictGate.evaluate(decomposition(new double[] { 3, 4, 0 }, 1.1));
        Assert.assertFalse("zero tolerance should still accept values exactly at limits",
                           atLimits.isRejectRefined());
    }

    @Test
    public void testRepeatedEvaluationIsIdentical() {

        final AffineTransform3D refined = AffineTransform3D.fromLinearAndTranslation(
                new double[][] { { 1.03, -0.06, 0.02 }, { 0.05, 0.98, -0.04 }, { -0.01, 0.05, 1.02 } },
                new double[] { 2.75, -1.5, 3.125 });
        final AffineTransform3D fallback = AffineTransform3D.fromLinearAndTranslation(
                new double[][] { { 0.99, 0.02, 0 }, { -0.02, 1.01, 0.01 }, { 0, -0.01, 1.0 } },
                new double[] { 0.5, 0.25, -0.75 });

        final QualityVerdict first = gate.evaluate(refined, fallback);
        final QualityVerdict second = gate.evaluate(refined, fallback);
        final QualityVerdict fromNewGate = new QualityGate().evaluate(refined, fallback);

        for (final QualityVerdict repeat : new QualityVerdict[] { second, fromNewGate }) {
            Assert.assertEquals("shift should be identical", first.getShiftMagnitude(), repeat.getShiftMagnitude(), 0.0);
            Assert.assertEquals("rotation should be identical", first.getRotationAngle(), repeat.getRotationAngle(), 0.0);
            Assert.assertEquals("scale should be identical", first.getMaxScale(), repeat.getMaxScale(), 0.0);
            Assert.assertEquals("shift flag should be identical", first.isShiftExceeded(), repeat.isShiftExceeded());
            Assert.assertEquals("rotation flag should be identical",
                                first.isRotationExceeded(), repeat.isRotationExceeded());
            Assert.assertEquals("scale flag should be identical", first.isScaleExceeded(), repeat.isScaleExceeded());
            Assert.assertEquals("decision should be identical", first.isRejectRefined(), repeat.isRejectRefined());
            Assert.assertEquals("JSON should be identical", first.toJson(), repeat.toJson());
        }
    }

    @Test
    public void testShrinkIsNotLimited() {
        final QualityVerdict verdict = gate.evaluate(scale(1.0, 1.0, 0.85), AffineTransform3D.identity());
        Assert.assertEquals("shrink should not change max scale", 1.0, verdict.getMaxScale(), 1.0e-12);
        Assert.assertFalse("shrink should be accepted", verdict.isRejectRefined());
    }

    @Test
    public void testCustomThresholds() throws Exception {

        final AffineTransform3D refined =
                AffineTransformFile.load(Paths.get(TRANSFORMS_DIR, "shift_6mm.mat"));
        final AffineTransform3D fallback =
                AffineTransformFile.load(Paths.get(TRANSFORMS_DIR, "identity.mat"));

        Assert.assertTrue("6mm shift should be rejected with default thresholds",
                          gate.evaluate(refined, fallback).isRejectRefined());

        final QualityGate lenientGate = new QualityGate(new QualityThresholds().withShiftThresholdMm(10.0),
                                                        DecompositionMethod.GRAM_SCHMIDT);
        Assert.assertFalse("6mm shift should be accepted with 10mm threshold",
                           lenientGate.evaluate(refined, fallback).isRejectRefined());
    }

    @Test
    public void testInvalidThresholds() {
        try {
            new QualityGate(new QualityThresholds(0.0, Math.PI / 36.0, 1.1));
            Assert.fail("zero shift threshold should cause exception");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue(true); // test passed
        }
    }

    @Test
    public void testDegenerateEstimate() {
        final AffineTransform3D collapsed = scale(1.0, 1.0, 0.0);
        try {
            gate.evaluate(AffineTransform3D.identity(), collapsed);
            Assert.fail("collapsed fallback estimate should cause exception");
        } catch (final SingularTransformException e) {
            Assert.assertTrue(true); // test passed
        }
    }

    @Test
    public void testGetRotationAngle() {
        final double[][] halfTurn = { { -1, 0, 0 }, { 0, -1, 0 }, { 0, 0, 1 } };
        Assert.assertEquals("invalid half turn angle", Math.PI, QualityGate.getRotationAngle(halfTurn), 1.0e-12);

        final double[][] identity = { { 1, 0, 0 }, { 0, 1, 0 }, { 0, 0, 1 } };
        Assert.assertEquals("invalid identity angle", 0.0, QualityGate.getRotationAngle(identity), 0.0);
    }

    @Test
    public void testRejectionIsLogged() {

        final ListAppender<ILoggingEvent> appender = LogbackTestTools.attachCaptureAppender(QualityGate.class);

        gate.evaluate(AffineTransform3D.translation(0, 6, 0), AffineTransform3D.identity());

        final List<String> messages = LogbackTestTools.getFormattedMessages(appender);
        Assert.assertEquals("invalid number of messages logged: " + messages, 2, messages.size());
        Assert.assertEquals("invalid metrics message",
                            "evaluate: shift 6.0000mm, rotation 0.0000°, scale 1.0000", messages.get(0));
        Assert.assertEquals("invalid decision message",
                            "evaluate: rejecting refined registration, shift > 5.0mm", messages.get(1));
    }

    private static AffineTransform3D rotationAboutZ(final double angle) {
        return AffineTransform3D.fromLinearAndTranslation(
                new double[][] {
                        { Math.cos(angle), -Math.sin(angle), 0 },
                        { Math.sin(angle),  Math.cos(angle), 0 },
                        { 0,                0,               1 }
                },
                new double[] { 0, 0, 0 });
    }

    private static AffineDecomposition decomposition(final double[] translation,
                                                     final double maxScale) {
        return new AffineDecomposition(translation,
                                       new double[][] { { 1, 0, 0 }, { 0, 1, 0 }, { 0, 0, 1 } },
                                       new double[] { 1.0, maxScale, 1.0 },
                                       new double[] { 0, 0, 0 });
    }

    private static AffineTransform3D scale(final double sx,
                                           final double sy,
                                           final double sz) {
        return AffineTransform3D.fromLinearAndTranslation(
                new double[][] { { sx, 0, 0 }, { 0, sy, 0 }, { 0, 0, sz } },
                new double[] { 0, 0, 0 });
    }

    static final String TRANSFORMS_DIR = "src/test/resources/transforms";
}
