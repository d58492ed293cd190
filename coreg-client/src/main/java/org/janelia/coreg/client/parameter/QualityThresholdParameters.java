package org.janelia.coreg.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Paths;

import org.janelia.coreg.quality.QualityThresholds;
import org.janelia.coreg.transform.DecompositionMethod;

/**
 * Parameters for configuring the registration quality gate.
 */
public class QualityThresholdParameters
        implements Serializable {

    @Parameter(
            names = "--thresholdsJson",
            description = "JSON file with shiftThresholdMm, rotationThresholdRad, scaleThreshold and/or " +
                          "comparisonTolerance values (explicit threshold options override file values)")
    public String thresholdsJson;

    @Parameter(
            names = "--shiftThreshold",
            description = "Reject refined registrations that shift more than this many millimeters " +
                          "(default: 5.0)")
    public Double shiftThresholdMm;

    @Parameter(
            names = "--rotationThreshold",
            description = "Reject refined registrations that rotate more than this many radians " +
                          "(default: pi/36, 5 degrees)")
    public Double rotationThresholdRad;

    @Parameter(
            names = "--scaleThreshold",
            description = "Reject refined registrations that scale any axis by more than this factor " +
                          "(default: 1.1)")
    public Double scaleThreshold;

    @Parameter(
            names = "--decomposition",
            description = "Affine decomposition procedure")
    public DecompositionMethod decompositionMethod = DecompositionMethod.POLAR;

    /**
     * @return validated thresholds built from these parameters.
     *
     * @throws IOException
     *   if a thresholds JSON file is specified but cannot be read.
     *
     * @throws IllegalArgumentException
     *   if the resulting thresholds are invalid.
     */
    public QualityThresholds buildThresholds()
            throws IOException, IllegalArgumentException {

        QualityThresholds thresholds = thresholdsJson == null ?
                                       new QualityThresholds() : QualityThresholds.load(Paths.get(thresholdsJson));

        if (shiftThresholdMm != null) {
            thresholds = thresholds.withShiftThresholdMm(shiftThresholdMm);
        }
        if (rotationThresholdRad != null) {
            thresholds = thresholds.withRotationThresholdRad(rotationThresholdRad);
        }
        if (scaleThreshold != null) {
            thresholds = thresholds.withScaleThreshold(scaleThreshold);
        }

        thresholds.validate();

        return thresholds;
    }
}
