package org.janelia.stars.stats;

import ij.process.FloatProcessor;

import java.io.Serializable;
import java.util.Arrays;

import org.janelia.stars.error.EmptyInputException;
import org.janelia.stars.error.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates {@link BackgroundStatistics} by iterative sigma clipping.
 * <p>
 * Each pass computes the median and (population) standard deviation of the surviving samples and drops
 * every sample farther than clipSigma standard deviations from the median.
 * Clipping stops once a pass drops nothing or after maxIterations passes.
 * Non-finite samples are ignored.
 */
public class SigmaClippedStatistics
        implements Serializable {

    public static final double DEFAULT_CLIP_SIGMA = 3.0;
    public static final int DEFAULT_MAX_ITERATIONS = 5;

    private final double clipSigma;
    private final int maxIterations;

    public SigmaClippedStatistics() {
        this(DEFAULT_CLIP_SIGMA, DEFAULT_MAX_ITERATIONS);
    }

    public SigmaClippedStatistics(final double clipSigma,
                                  final int maxIterations)
            throws InvalidParameterException {
        InvalidParameterException.requirePositive("clipSigma", clipSigma);
        InvalidParameterException.requireAtLeast("maxIterations", maxIterations, 1);
        this.clipSigma = clipSigma;
        this.maxIterations = maxIterations;
    }

    public double getClipSigma() {
        return clipSigma;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public BackgroundStatistics compute(final FloatProcessor luminance)
            throws EmptyInputException {
        return compute((float[]) luminance.getPixels());
    }

    public BackgroundStatistics compute(final float[] values)
            throws EmptyInputException {

        if (values.length == 0) {
            throw new EmptyInputException("cannot compute statistics for an empty array");
        }

        double[] survivors = new double[values.length];
        int count = 0;
        for (final float value : values) {
            if (Float.isFinite(value)) {
                survivors[count++] = value;
            }
        }

        if (count == 0) {
            throw new EmptyInputException("cannot compute statistics for an array without finite values");
        }

        // sorted once, filtering below keeps the order
        survivors = Arrays.copyOf(survivors, count);
        Arrays.sort(survivors);

        int iterations = 0;
        while (iterations < maxIterations) {

            iterations++;

            final double median = median(survivors);
            final double limit = clipSigma * stddev(survivors, mean(survivors));

            int keptCount = 0;
            final double[] kept = new double[survivors.length];
            for (final double value : survivors) {
                if (Math.abs(value - median) <= limit) {
                    kept[keptCount++] = value;
                }
            }

            if ((keptCount == survivors.length) || (keptCount == 0)) {
                break;
            }

            survivors = Arrays.copyOf(kept, keptCount);
        }

        final double mean = mean(survivors);
        final BackgroundStatistics statistics = new BackgroundStatistics(mean,
                                                                         median(survivors),
                                                                         stddev(survivors, mean),
                                                                         survivors.length,
                                                                         iterations);

        LOG.debug("compute: returning {} for {} finite of {} samples", statistics, count, values.length);

        return statistics;
    }

    private static double mean(final double[] sortedValues) {
        double sum = 0.0;
        for (final double value : sortedValues) {
            sum += value;
        }
        return sum / sortedValues.length;
    }

    private static double median(final double[] sortedValues) {
        final int middle = sortedValues.length / 2;
        return (sortedValues.length % 2 == 0) ? (sortedValues[middle - 1] + sortedValues[middle]) / 2.0 :
               sortedValues[middle];
    }

    private static double stddev(final double[] values,
                                 final double mean) {
        double sumOfSquares = 0.0;
        for (final double value : values) {
            final double delta = value - mean;
            sumOfSquares += delta * delta;
        }
        return Math.sqrt(sumOfSquares / values.length);
    }

    private static final Logger LOG = LoggerFactory.getLogger(SigmaClippedStatistics.class);
}
