package org.janelia.stars.image;

import ij.process.FloatProcessor;

/**
 * Reduces a (possibly multi-channel) {@link SampleArray} to the 2-D plane used for detection.
 * No perceptual weighting is applied.
 */
public class LuminanceProjection {

    public enum Policy {
        /** Per-pixel mean of all channels. */
        CHANNEL_MEAN,
        /** First channel only. */
        FIRST_CHANNEL
    }

    /**
     * @return new plane holding the projection of the specified array
     *         (a copy of the only channel for single channel arrays).
     */
    public static FloatProcessor project(final SampleArray source,
                                         final Policy policy) {

        final FloatProcessor luminance;

        if ((source.getChannelCount() == 1) || (policy == Policy.FIRST_CHANNEL)) {

            luminance = (FloatProcessor) source.getChannel(0).duplicate();

        } else {

            final int channelCount = source.getChannelCount();
            final float[] pixels = new float[source.getPixelCount()];
            for (int i = 0; i < pixels.length; i++) {
                double sum = 0.0;
                for (int c = 0; c < channelCount; c++) {
                    sum += source.getPixels(c)[i];
                }
                pixels[i] = (float) (sum / channelCount);
            }
            luminance = new FloatProcessor(source.getWidth(), source.getHeight(), pixels);

        }

        return luminance;
    }

}
