package org.janelia.stars.mask;

import ij.plugin.filter.GaussianBlur;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import java.io.Serializable;

import org.janelia.stars.error.InvalidParameterException;

/**
 * Turns a binary star mask into a continuous alpha mask.
 * <p>
 * The mask is blurred with an isotropic Gaussian (ImageJ {@link GaussianBlur}, edge pixels replicated)
 * and every value that is not greater than the threshold is set to exactly 0.
 * The result is deliberately not renormalized, so its maximum may stay below 1.
 * <p>
 * When secondPassSigma is positive, the thresholded mask is blurred once more
 * (the double smoothing variant of the interactive tool).
 */
public class MaskSmoother
        implements Serializable {

    /** Kernel accuracy ImageJ uses for float images. */
    public static final double GAUSSIAN_ACCURACY = 0.0002;

    private final double sigma;
    private final double threshold;
    private final double secondPassSigma;

    public MaskSmoother(final double sigma,
                        final double threshold) {
        this(sigma, threshold, 0.0);
    }

    public MaskSmoother(final double sigma,
                        final double threshold,
                        final double secondPassSigma)
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
    }

    public double getSigma() {
        return sigma;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getSecondPassSigma() {
        return secondPassSigma;
    }

    /**
     * @param  binaryMask  mask with 0 for background and any non-zero value for stars.
     *
     * @return new alpha mask in [0,1].
     */
    public FloatProcessor smooth(final ByteProcessor binaryMask) {
        final byte[] maskPixels = (byte[]) binaryMask.getPixels();
        final float[] pixels = new float[maskPixels.length];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = (maskPixels[i] == 0) ? 0.0f : 1.0f;
        }
        return smoothInPlace(new FloatProcessor(binaryMask.getWidth(), binaryMask.getHeight(), pixels));
    }

    /**
     * @param  mask  continuous mask in [0,1] (not modified).
     *
     * @return new alpha mask in [0,1].
     */
    public FloatProcessor smooth(final FloatProcessor mask) {
        return smoothInPlace((FloatProcessor) mask.duplicate());
    }

    private FloatProcessor smoothInPlace(final FloatProcessor alpha) {
        blur(alpha, sigma);
        applyThreshold(alpha, threshold);
        if (secondPassSigma > 0.0) {
            blur(alpha, secondPassSigma);
            clamp(alpha);
        }
        return alpha;
    }

    /**
     * Blurs the specified plane in place and clamps the result into [0,1].
     */
    static void blur(final FloatProcessor plane,
                     final double sigma) {
        final GaussianBlur gaussianBlur = new GaussianBlur();
        gaussianBlur.blurGaussian(plane, sigma, sigma, GAUSSIAN_ACCURACY);
        clamp(plane);
    }

    /**
     * Sets every value that is not greater than the threshold to 0.
     */
    static void applyThreshold(final FloatProcessor plane,
                               final double threshold) {
        final float[] pixels = (float[]) plane.getPixels();
        for (int i = 0; i < pixels.length; i++) {
            if (! (pixels[i] > threshold)) {
                pixels[i] = 0.0f;
            }
        }
    }

    private static void clamp(final FloatProcessor plane) {
        final float[] pixels = (float[]) plane.getPixels();
        for (int i = 0; i < pixels.length; i++) {
            if (pixels[i] < 0.0f) {
                pixels[i] = 0.0f;
            } else if (pixels[i] > 1.0f) {
                pixels[i] = 1.0f;
            }
        }
    }

}
