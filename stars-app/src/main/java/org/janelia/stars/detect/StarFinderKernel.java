package org.janelia.stars.detect;

import java.io.Serializable;

import org.janelia.stars.error.InvalidParameterException;

/**
 * Circular Gaussian point spread kernel used by {@link StarFinder}.
 * <p>
 * The kernel covers a square of (2 * radius + 1) pixels on a side.
 * Its footprint is the disk of pixels within sigmaRadius standard deviations of the center.
 * The matched kernel is the footprint-masked Gaussian shifted to zero sum and scaled so that correlating
 * it with an image gives, at the center of a source with the kernel's width,
 * the least-squares amplitude of that source above a flat background.
 */
public class StarFinderKernel
        implements Serializable {

    /** Conversion factor from full width at half maximum to standard deviation: 1 / (2 * sqrt(2 * ln(2))). */
    public static final double FWHM_TO_SIGMA = 1.0 / (2.0 * Math.sqrt(2.0 * Math.log(2.0)));

    private final double fwhm;
    private final double sigma;
    private final int radius;
    private final int size;

    private final double[] gaussian;
    private final boolean[] footprint;
    private final int footprintCount;
    private final double[] matched;

    public StarFinderKernel(final double fwhm,
                            final double sigmaRadius)
            throws InvalidParameterException {

        InvalidParameterException.requirePositive("fwhm", fwhm);
        InvalidParameterException.requirePositive("sigmaRadius", sigmaRadius);

        this.fwhm = fwhm;
        this.sigma = fwhm * FWHM_TO_SIGMA;
        this.radius = Math.max(2, (int) Math.floor((sigmaRadius * sigma) + 0.5));
        this.size = (2 * radius) + 1;

        final int n = size * size;
        final double twoSigmaSquared = 2.0 * sigma * sigma;
        final double maxExponent = 0.5 * sigmaRadius * sigmaRadius;

        this.gaussian = new double[n];
        this.footprint = new boolean[n];

        int count = 0;
        double sum = 0.0;
        double sumOfSquares = 0.0;
        for (int dy = -radius; dy <= radius; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                final int i = index(dx, dy);
                final double exponent = ((dx * dx) + (dy * dy)) / twoSigmaSquared;
                gaussian[i] = Math.exp(-exponent);
                if (exponent <= maxExponent) {
                    footprint[i] = true;
                    count++;
                    sum += gaussian[i];
                    sumOfSquares += gaussian[i] * gaussian[i];
                }
            }
        }

        this.footprintCount = count;

        final double denominator = sumOfSquares - ((sum * sum) / count);
        if (! (denominator > 0)) {
            throw new InvalidParameterException("fwhm " + fwhm + " is too small to build a detection kernel");
        }

        final double mean = sum / count;
        this.matched = new double[n];
        for (int i = 0; i < n; i++) {
            if (footprint[i]) {
                matched[i] = (gaussian[i] - mean) / denominator;
            }
        }
    }

    public double getFwhm() {
        return fwhm;
    }

    public double getSigma() {
        return sigma;
    }

    /**
     * @return half size of the kernel (pixels from the center to the edge).
     */
    public int getRadius() {
        return radius;
    }

    public int getSize() {
        return size;
    }

    public int getFootprintCount() {
        return footprintCount;
    }

    /**
     * @return index into the kernel arrays for the specified offset from the center.
     */
    public int index(final int dx,
                     final int dy) {
        return ((dy + radius) * size) + dx + radius;
    }

    public boolean isInFootprint(final int dx,
                                 final int dy) {
        return footprint[index(dx, dy)];
    }

    /**
     * @return unmasked Gaussian value (1 at the center) for the specified offset.
     */
    public double getGaussian(final int dx,
                              final int dy) {
        return gaussian[index(dx, dy)];
    }

    /**
     * @return matched (zero sum) kernel value for the specified offset (0 outside the footprint).
     */
    public double getMatched(final int dx,
                             final int dy) {
        return matched[index(dx, dy)];
    }

}
