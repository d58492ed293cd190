package org.janelia.coreg.client.parameter;

import com.beust.jcommander.JCommander;

import org.janelia.coreg.quality.QualityThresholds;
import org.janelia.coreg.transform.DecompositionMethod;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link QualityThresholdParameters} class.
 */
public class QualityThresholdParametersTest {

    @Test
    public void testDefaults() throws Exception {

        final QualityThresholdParameters parameters = parse();
        final QualityThresholds thresholds = parameters.buildThresholds();

        Assert.assertEquals("invalid shift",
                            QualityThresholds.DEFAULT_SHIFT_THRESHOLD_MM, thresholds.getShiftThresholdMm(), 0.0);
        Assert.assertEquals("invalid decomposition", DecompositionMethod.POLAR, parameters.decompositionMethod);
    }

    @Test
    public void testOverridesApplyAfterJson() throws Exception {

        final QualityThresholdParameters parameters = parse("--thresholdsJson", THRESHOLDS_JSON,
                                                            "--scaleThreshold", "1.2",
                                                            "--decomposition", "GRAM_SCHMIDT");
        final QualityThresholds thresholds = parameters.buildThresholds();

        Assert.assertEquals("json shift should be used", 2.0, thresholds.getShiftThresholdMm(), 0.0);
        Assert.assertEquals("option should override json scale", 1.2, thresholds.getScaleThreshold(), 0.0);
        Assert.assertEquals("default rotation should be retained",
                            QualityThresholds.DEFAULT_ROTATION_THRESHOLD_RAD, thresholds.getRotationThresholdRad(), 0.0);
        Assert.assertEquals("invalid decomposition", DecompositionMethod.GRAM_SCHMIDT, parameters.decompositionMethod);
    }

    @Test
    public void testInvalidOverride() throws Exception {
        final QualityThresholdParameters parameters = parse("--rotationThreshold", "0");
        try {
            parameters.buildThresholds();
            Assert.fail("zero rotation threshold should cause exception");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue(true); // test passed
        }
    }

    private static QualityThresholdParameters parse(final String... args) {
        final QualityThresholdParameters parameters = new QualityThresholdParameters();
        JCommander.newBuilder().addObject(parameters).build().parse(args);
        return parameters;
    }

    private static final String THRESHOLDS_JSON = "src/test/resources/transforms/thresholds.json";
}
