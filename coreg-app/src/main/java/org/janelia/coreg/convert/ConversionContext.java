package org.janelia.coreg.convert;

import java.nio.file.Path;

/**
 * Fixed reference data needed to express a selected transform in other coordinate conventions.
 */
public class ConversionContext {

    private final Path sourceImage;
    private final Path targetImage;
    private final Path fsnativeReverseTransform;

    /**
     * @param  sourceImage               image that was registered (e.g. reference BOLD volume).
     * @param  targetImage               image registered to (e.g. skull-stripped T1w volume).
     * @param  fsnativeReverseTransform  LTA transform from FreeSurfer native space back to target image space
     *                                   (only needed for LTA based registrations, may be null).
     */
    public ConversionContext(final Path sourceImage,
                             final Path targetImage,
                             final Path fsnativeReverseTransform) {
        this.sourceImage = sourceImage;
        this.targetImage = targetImage;
        this.fsnativeReverseTransform = fsnativeReverseTransform;
    }

    public Path getSourceImage() {
        return sourceImage;
    }

    public Path getTargetImage() {
        return targetImage;
    }

    public Path getFsnativeReverseTransform() {
        return fsnativeReverseTransform;
    }

    /**
     * @throws IllegalArgumentException
     *   if either image is missing.
     */
    public void validateImages()
            throws IllegalArgumentException {
        if (sourceImage == null) {
            throw new IllegalArgumentException("source image must be specified for transform conversion");
        }
        if (targetImage == null) {
            throw new IllegalArgumentException("target image must be specified for transform conversion");
        }
    }

    @Override
    public String toString() {
        return "{sourceImage: " + sourceImage +
               ", targetImage: " + targetImage +
               ", fsnativeReverseTransform: " + fsnativeReverseTransform + '}';
    }
}
