package org.janelia.coreg.quality;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.nio.file.Path;

import org.janelia.coreg.json.JsonUtils;

/**
 * Limits that a refined registration may deviate from its fallback before the refined
 * registration is rejected.  Default values are 5mm of shift, 5 degrees of rotation and
 * a 1.1 scale factor.
 *
 * Metrics within {@link #getComparisonTolerance() comparisonTolerance} of a limit are
 * considered to be at the limit (and pass) so that floating point noise from the
 * decomposition does not flip boundary decisions.
 */
public class QualityThresholds
        implements Serializable {

    public static final double DEFAULT_SHIFT_THRESHOLD_MM = 5.0;
    public static final double DEFAULT_ROTATION_THRESHOLD_RAD = Math.PI / 36.0;
    public static final double DEFAULT_SCALE_THRESHOLD = 1.1;
    public static final double DEFAULT_COMPARISON_TOLERANCE = 1.0e-9;

    private double shiftThresholdMm;
    private double rotationThresholdRad;
    private double scaleThreshold;
    private double comparisonTolerance;

    public QualityThresholds() {
        this(DEFAULT_SHIFT_THRESHOLD_MM,
             DEFAULT_ROTATION_THRESHOLD_RAD,
             DEFAULT_SCALE_THRESHOLD,
             DEFAULT_COMPARISON_TOLERANCE);
    }

    public QualityThresholds(final double shiftThresholdMm,
                             final double rotationThresholdRad,
                             final double scaleThreshold) {
        this(shiftThresholdMm, rotationThresholdRad, scaleThreshold, DEFAULT_COMPARISON_TOLERANCE);
    }

    public QualityThresholds(final double shiftThresholdMm,
                             final double rotationThresholdRad,
                             final double scaleThreshold,
                             final double comparisonTolerance) {
        this.shiftThresholdMm = shiftThresholdMm;
        this.rotationThresholdRad = rotationThresholdRad;
        this.scaleThreshold = scaleThreshold;
        this.comparisonTolerance = comparisonTolerance;
    }

    public double getShiftThresholdMm() {
        return shiftThresholdMm;
    }

    public double getRotationThresholdRad() {
        return rotationThresholdRad;
    }

    public double getScaleThreshold() {
        return scaleThreshold;
    }

    public double getComparisonTolerance() {
        return comparisonTolerance;
    }

    public QualityThresholds withShiftThresholdMm(final double shiftThresholdMm) {
        return new QualityThresholds(shiftThresholdMm, rotationThresholdRad, scaleThreshold, comparisonTolerance);
    }

    public QualityThresholds withRotationThresholdRad(final double rotationThresholdRad) {
        return new QualityThresholds(shiftThresholdMm, rotationThresholdRad, scaleThreshold, comparisonTolerance);
    }

    public QualityThresholds withScaleThreshold(final double scaleThreshold) {
        return new QualityThresholds(shiftThresholdMm, rotationThresholdRad, scaleThreshold, comparisonTolerance);
    }

    /**
     * @throws IllegalArgumentException
     *   if any limit is not a positive finite number or the tolerance is negative.
     */
    public void validate()
            throws IllegalArgumentException {
        requirePositive("shiftThresholdMm", shiftThresholdMm);
        requirePositive("rotationThresholdRad", rotationThresholdRad);
        requirePositive("scaleThreshold", scaleThreshold);
        if ((! Double.isFinite(comparisonTolerance)) || (comparisonTolerance < 0)) {
            throw new IllegalArgumentException("comparisonTolerance must be a non-negative number");
        }
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return "{shiftThresholdMm: " + shiftThresholdMm +
               ", rotationThresholdRad: " + rotationThresholdRad +
               ", scaleThreshold: " + scaleThreshold +
               ", comparisonTolerance: " + comparisonTolerance + '}';
    }

    public static QualityThresholds fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    /**
     * @return validated thresholds loaded from the specified JSON file.
     *         Attributes missing from the file retain their default values.
     */
    public static QualityThresholds load(final Path path)
            throws IOException, IllegalArgumentException {
        final QualityThresholds thresholds = JSON_HELPER.load(path);
        thresholds.validate();
        return thresholds;
    }

    private static void requirePositive(final String context,
                                        final double value)
            throws IllegalArgumentException {
        if ((! Double.isFinite(value)) || (value <= 0)) {
            throw new IllegalArgumentException(context + " must be a positive number but is " + value);
        }
    }

    private static final JsonUtils.Helper<QualityThresholds> JSON_HELPER =
            new JsonUtils.Helper<>(QualityThresholds.class);
}
