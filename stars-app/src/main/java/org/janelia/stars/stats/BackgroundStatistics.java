package org.janelia.stars.stats;

import java.io.Serializable;

/**
 * Robust background level and noise estimate for an image.
 */
public class BackgroundStatistics
        implements Serializable {

    private final double mean;
    private final double median;
    private final double stddev;
    private final int sampleCount;
    private final int iterations;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private BackgroundStatistics() {
        this(0.0, 0.0, 0.0, 0, 0);
    }

    public BackgroundStatistics(final double mean,
                                final double median,
                                final double stddev,
                                final int sampleCount,
                                final int iterations) {
        this.mean = mean;
        this.median = median;
        this.stddev = stddev;
        this.sampleCount = sampleCount;
        this.iterations = iterations;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getStddev() {
        return stddev;
    }

    /**
     * @return number of samples that survived clipping.
     */
    public int getSampleCount() {
        return sampleCount;
    }

    /**
     * @return number of clipping passes that were performed.
     */
    public int getIterations() {
        return iterations;
    }

    @Override
    public String toString() {
        return "{mean: " + mean +
               ", median: " + median +
               ", stddev: " + stddev +
               ", sampleCount: " + sampleCount +
               ", iterations: " + iterations +
               '}';
    }
}
