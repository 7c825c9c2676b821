package org.janelia.stars.mask;

import ij.process.FloatProcessor;

import java.io.Serializable;

import org.janelia.stars.error.InvalidParameterException;
import org.janelia.stars.error.ShapeMismatchException;
import org.janelia.stars.image.LuminanceProjection;
import org.janelia.stars.image.SampleArray;

/**
 * Builds an alpha mask from what erosion removed instead of from detected stars.
 * <p>
 * The absolute luminance difference between the original and eroded images is blurred,
 * scaled by its maximum, thresholded and (optionally) blurred a second time.
 * Compact bright features lose the most to erosion, so they dominate the mask.
 */
public class DifferenceMaskBuilder
        implements Serializable {

    /** Keeps the scaling finite for images that erosion did not change. */
    public static final double SCALE_EPSILON = 1e-8;

    private final double sigma;
    private final double threshold;
    private final double secondPassSigma;
    private final LuminanceProjection.Policy luminancePolicy;

    public DifferenceMaskBuilder(final double sigma,
                                 final double threshold,
                                 final double secondPassSigma,
                                 final LuminanceProjection.Policy luminancePolicy)
            throws InvalidParameterException {

        InvalidParameterException.requirePositive("sigma", sigma);
        if (! ((threshold >= 0.0) && (threshold <= 1.0))) {
            throw new InvalidParameterException("'threshold' must be between 0 and 1 but was " + threshold);
        }
        if (! (secondPassSigma >= 0.0) || Double.isInfinite(secondPassSigma)) {
            throw new InvalidParameterException("'secondPassSigma' must be 0 (disabled) or positive but was " +
                                                secondPassSigma);
        }

        this.sigma = sigma;
        this.threshold = threshold;
        this.secondPassSigma = secondPassSigma;
        this.luminancePolicy = luminancePolicy;
    }

    /**
     * @return new alpha mask in [0,1] for the specified normalized original and eroded images.
     *
     * @throws ShapeMismatchException
     *   if the images differ in size.
     */
    public FloatProcessor build(final SampleArray original,
                                final SampleArray eroded)
            throws ShapeMismatchException {

        if (! original.hasSameSpatialShape(eroded)) {
            throw new ShapeMismatchException("original " + original.getShapeString() +
                                             " and eroded " + eroded.getShapeString() + " images differ in size");
        }

        final float[] originalLuminance = (float[]) LuminanceProjection.project(original, luminancePolicy).getPixels();
        final float[] erodedLuminance = (float[]) LuminanceProjection.project(eroded, luminancePolicy).getPixels();

        final float[] pixels = new float[originalLuminance.length];
        for (int i = 0; i < pixels.length; i++) {
            final float difference = Math.abs(originalLuminance[i] - erodedLuminance[i]);
            pixels[i] = Float.isFinite(difference) ? difference : 0.0f;
        }

        final FloatProcessor alpha = new FloatProcessor(original.getWidth(), original.getHeight(), pixels);
        MaskSmoother.blur(alpha, sigma);

        double max = 0.0;
        for (final float value : pixels) {
            max = Math.max(max, value);
        }
        final double scale = max + SCALE_EPSILON;
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = (float) (pixels[i] / scale);
        }

        MaskSmoother.applyThreshold(alpha, threshold);

        if (secondPassSigma > 0.0) {
            MaskSmoother.blur(alpha, secondPassSigma);
        }

        return alpha;
    }

}
