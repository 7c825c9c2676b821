package org.janelia.stars.image;

/**
 * Result of {@link ImageNormalizer#normalize}: the normalized array along with
 * the finite range that was mapped onto [0,1].
 */
public class NormalizedImage {

    private final SampleArray image;
    private final double min;
    private final double max;

    public NormalizedImage(final SampleArray image,
                           final double min,
                           final double max) {
        this.image = image;
        this.min = min;
        this.max = max;
    }

    public SampleArray getImage() {
        return image;
    }

    /**
     * @return minimum finite source value (NaN if the source had no finite values).
     */
    public double getMin() {
        return min;
    }

    /**
     * @return maximum finite source value (NaN if the source had no finite values).
     */
    public double getMax() {
        return max;
    }

    /**
     * @return true if the source was flat (or had no finite values) and was therefore passed through unchanged.
     */
    public boolean isDegenerate() {
        return ! (max > min);
    }

    @Override
    public String toString() {
        return "{image: " + image + ", min: " + min + ", max: " + max + ", degenerate: " + isDegenerate() + '}';
    }
}
