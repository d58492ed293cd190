package org.janelia.coreg.quality;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.janelia.coreg.transform.AffineDecomposition;
import org.janelia.coreg.transform.AffineTransform3D;
import org.janelia.coreg.transform.DecompositionMethod;
import org.janelia.coreg.transform.SingularTransformException;
import org.janelia.coreg.transform.TransformMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a refined registration deviates too far from its fallback registration.
 *
 * The refined registration is rejected when the relative transform between the two
 * estimates shifts by more than {@link QualityThresholds#getShiftThresholdMm()},
 * rotates by more than {@link QualityThresholds#getRotationThresholdRad()} or scales
 * any axis by more than {@link QualityThresholds#getScaleThreshold()}.
 * All comparisons are strict, so a metric exactly at its limit passes.
 *
 * Gates hold no mutable state and may be shared across threads.
 */
public class QualityGate {

    private final QualityThresholds thresholds;
    private final DecompositionMethod decompositionMethod;

    public QualityGate() {
        this(new QualityThresholds());
    }

    public QualityGate(final QualityThresholds thresholds) {
        this(thresholds, DecompositionMethod.POLAR);
    }

    /**
     * @throws IllegalArgumentException
     *   if the thresholds are invalid.
     */
    public QualityGate(final QualityThresholds thresholds,
                       final DecompositionMethod decompositionMethod)
            throws IllegalArgumentException {
        thresholds.validate();
        this.thresholds = thresholds;
        this.decompositionMethod = decompositionMethod;
    }

    public QualityThresholds getThresholds() {
        return thresholds;
    }

    public DecompositionMethod getDecompositionMethod() {
        return decompositionMethod;
    }

    /**
     * Composes and decomposes the two estimates and then evaluates the result.
     *
     * @throws SingularTransformException
     *   if either estimate (or their composition) is degenerate.
     */
    public QualityVerdict evaluate(final AffineTransform3D refined,
                                   final AffineTransform3D fallback)
            throws SingularTransformException {
        return evaluate(TransformMath.composeAndDecompose(refined, fallback, decompositionMethod));
    }

    public QualityVerdict evaluate(final AffineDecomposition decomposition) {

        final double shiftMagnitude = getShiftMagnitude(decomposition.getTranslation());
        final double rotationAngle = getRotationAngle(decomposition.getRotation());
        final double maxScale = getMaxAbsoluteScale(decomposition.getScales());

        final QualityVerdict verdict =
                new QualityVerdict(shiftMagnitude,
                                   rotationAngle,
                                   maxScale,
                                   exceeds(shiftMagnitude, thresholds.getShiftThresholdMm()),
                                   exceeds(rotationAngle, thresholds.getRotationThresholdRad()),
                                   exceeds(maxScale, thresholds.getScaleThreshold()));

        logVerdict(verdict);

        return verdict;
    }

    /**
     * @return euclidean norm of the specified translation.
     */
    public static double getShiftMagnitude(final double[] translation) {
        return Math.sqrt((translation[0] * translation[0]) +
                         (translation[1] * translation[1]) +
                         (translation[2] * translation[2]));
    }

    /**
     * @return angle (0 to pi radians) of the axis-angle representation of the specified rotation matrix.
     */
    public static double getRotationAngle(final double[][] rotation) {
        // |axis| is 2 sin(angle) and trace - 1 is 2 cos(angle)
        final double x = rotation[2][1] - rotation[1][2];
        final double y = rotation[0][2] - rotation[2][0];
        final double z = rotation[1][0] - rotation[0][1];
        final double twiceSine = Math.sqrt((x * x) + (y * y) + (z * z));
        final double twiceCosine = rotation[0][0] + rotation[1][1] + rotation[2][2] - 1.0;
        return Math.atan2(twiceSine, twiceCosine);
    }

    public static double getMaxAbsoluteScale(final double[] scales) {
        double max = 0.0;
        for (final double scale : scales) {
            max = Math.max(max, Math.abs(scale));
        }
        return max;
    }

    private boolean exceeds(final double value,
                            final double limit) {
        return (value - limit) > thresholds.getComparisonTolerance();
    }

    private void logVerdict(final QualityVerdict verdict) {

        LOG.info("evaluate: shift {}mm, rotation {}°, scale {}",
                 formatMetric(verdict.getShiftMagnitude()),
                 formatMetric(verdict.getRotationAngleDegrees()),
                 formatMetric(verdict.getMaxScale()));

        if (verdict.isRejectRefined()) {
            final List<String> exceededLimits = new ArrayList<>();
            if (verdict.isShiftExceeded()) {
                exceededLimits.add("shift > " + thresholds.getShiftThresholdMm() + "mm");
            }
            if (verdict.isRotationExceeded()) {
                exceededLimits.add("rotation > " +
                                   formatMetric(Math.toDegrees(thresholds.getRotationThresholdRad())) + "°");
            }
            if (verdict.isScaleExceeded()) {
                exceededLimits.add("scale > " + thresholds.getScaleThreshold());
            }
            LOG.info("evaluate: rejecting refined registration, {}", String.join(", ", exceededLimits));
        } else {
            LOG.info("evaluate: accepting refined registration");
        }
    }

    private static String formatMetric(final double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private static final Logger LOG = LoggerFactory.getLogger(QualityGate.class);
}
