package org.janelia.coreg.quality;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

import org.janelia.coreg.json.JsonUtils;

/**
 * Outcome of comparing a refined registration against its fallback:
 * the three deviation metrics and whether the refined registration is rejected.
 */
@JsonIgnoreProperties(value = { "rejectRefined", "choice" }, allowGetters = true)
public class QualityVerdict
        implements Serializable {

    private final double shiftMagnitude;
    private final double rotationAngle;
    private final double maxScale;
    private final boolean shiftExceeded;
    private final boolean rotationExceeded;
    private final boolean scaleExceeded;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private QualityVerdict() {
        this(0.0, 0.0, 0.0, false, false, false);
    }

    /**
     * @param  shiftMagnitude    euclidean norm of the relative translation (mm).
     * @param  rotationAngle     angle of the relative rotation (radians, 0 to pi).
     * @param  maxScale          largest absolute relative scale factor.
     * @param  shiftExceeded     true if the shift limit was exceeded.
     * @param  rotationExceeded  true if the rotation limit was exceeded.
     * @param  scaleExceeded     true if the scale limit was exceeded.
     */
    public QualityVerdict(final double shiftMagnitude,
                          final double rotationAngle,
                          final double maxScale,
                          final boolean shiftExceeded,
                          final boolean rotationExceeded,
                          final boolean scaleExceeded) {
        this.shiftMagnitude = shiftMagnitude;
        this.rotationAngle = rotationAngle;
        this.maxScale = maxScale;
        this.shiftExceeded = shiftExceeded;
        this.rotationExceeded = rotationExceeded;
        this.scaleExceeded = scaleExceeded;
    }

    public double getShiftMagnitude() {
        return shiftMagnitude;
    }

    public double getRotationAngle() {
        return rotationAngle;
    }

    public double getRotationAngleDegrees() {
        return Math.toDegrees(rotationAngle);
    }

    public double getMaxScale() {
        return maxScale;
    }

    public boolean isShiftExceeded() {
        return shiftExceeded;
    }

    public boolean isRotationExceeded() {
        return rotationExceeded;
    }

    public boolean isScaleExceeded() {
        return scaleExceeded;
    }

    @JsonProperty("rejectRefined")
    public boolean isRejectRefined() {
        return shiftExceeded || rotationExceeded || scaleExceeded;
    }

    @JsonProperty("choice")
    public CandidateChoice getChoice() {
        return CandidateChoice.forRejectRefined(isRejectRefined());
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return "{shiftMagnitude: " + shiftMagnitude +
               ", rotationAngle: " + rotationAngle +
               ", maxScale: " + maxScale +
               ", rejectRefined: " + isRejectRefined() + '}';
    }

    public static QualityVerdict fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<QualityVerdict> JSON_HELPER =
            new JsonUtils.Helper<>(QualityVerdict.class);
}
