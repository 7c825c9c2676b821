package org.janelia.stars.image;

import ij.process.FloatProcessor;

import java.util.Arrays;

import org.janelia.stars.error.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps raw sample data into canonical channel-last orientation and the [0,1] intensity range.
 * <p>
 * Supported raw shapes are (H,W), (3,H,W) and (H,W,C).
 * A 3-D shape whose first axis is 3 is always treated as channel-first and transposed,
 * so an (H,W,3) array with H == 3 is read as channel-first too.
 */
public class ImageNormalizer {

    /**
     * Converts row-major raw data with the specified shape into a canonical {@link SampleArray}.
     *
     * @param  data   raw samples (row-major, last axis varies fastest).
     * @param  shape  (H,W), (3,H,W) or (H,W,C).
     *
     * @throws InvalidParameterException
     *   if the shape is not supported or does not match the data length.
     */
    public static SampleArray canonicalize(final float[] data,
                                           final int... shape)
            throws InvalidParameterException {

        if ((shape == null) || (shape.length < 2) || (shape.length > 3)) {
            throw new InvalidParameterException("shape must have 2 or 3 dimensions but was " +
                                                Arrays.toString(shape));
        }

        long expectedLength = 1;
        for (final int dimension : shape) {
            if (dimension < 1) {
                throw new InvalidParameterException("shape " + Arrays.toString(shape) +
                                                    " contains a non-positive dimension");
            }
            expectedLength *= dimension;
        }

        if (data.length != expectedLength) {
            throw new InvalidParameterException("data length " + data.length + " does not match shape " +
                                                Arrays.toString(shape));
        }

        final SampleArray sampleArray;
        if (shape.length == 2) {
            sampleArray = SampleArray.forPlane(shape[1], shape[0], data.clone());
        } else if (shape[0] == 3) {
            sampleArray = fromChannelFirst(data, shape[0], shape[1], shape[2]);
        } else {
            sampleArray = fromChannelLast(data, shape[0], shape[1], shape[2]);
        }

        return sampleArray;
    }

    /**
     * Rescales the finite range of the specified array onto [0,1].
     * Non-finite samples are ignored when computing the range and stay non-finite.
     * Flat arrays (and arrays without finite samples) are returned unchanged and flagged as degenerate.
     */
    public static NormalizedImage normalize(final SampleArray source) {

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int c = 0; c < source.getChannelCount(); c++) {
            for (final float value : source.getPixels(c)) {
                if (Float.isFinite(value)) {
                    if (value < min) {
                        min = value;
                    }
                    if (value > max) {
                        max = value;
                    }
                }
            }
        }

        final NormalizedImage normalizedImage;

        if (max > min) {

            final double range = max - min;
            final FloatProcessor[] planes = new FloatProcessor[source.getChannelCount()];
            for (int c = 0; c < planes.length; c++) {
                final float[] sourcePixels = source.getPixels(c);
                final float[] pixels = new float[sourcePixels.length];
                for (int i = 0; i < pixels.length; i++) {
                    pixels[i] = (float) ((sourcePixels[i] - min) / range);
                }
                planes[c] = new FloatProcessor(source.getWidth(), source.getHeight(), pixels);
            }
            normalizedImage = new NormalizedImage(new SampleArray(planes), min, max);

        } else {

            if (min > max) { // no finite values
                min = Double.NaN;
                max = Double.NaN;
            }

            LOG.warn("normalize: {} is degenerate (min={}, max={}), returning it unchanged", source, min, max);

            normalizedImage = new NormalizedImage(source, min, max);
        }

        return normalizedImage;
    }

    /**
     * Convenience method that canonicalizes and then normalizes raw data.
     */
    public static NormalizedImage prepare(final float[] data,
                                          final int... shape)
            throws InvalidParameterException {
        return normalize(canonicalize(data, shape));
    }

    private static SampleArray fromChannelFirst(final float[] data,
                                                final int channelCount,
                                                final int height,
                                                final int width) {
        final int planeSize = width * height;
        final FloatProcessor[] planes = new FloatProcessor[channelCount];
        for (int c = 0; c < channelCount; c++) {
            final float[] pixels = Arrays.copyOfRange(data, c * planeSize, (c + 1) * planeSize);
            planes[c] = new FloatProcessor(width, height, pixels);
        }
        return new SampleArray(planes);
    }

    private static SampleArray fromChannelLast(final float[] data,
                                               final int height,
                                               final int width,
                                               final int channelCount) {
        final int planeSize = width * height;
        final FloatProcessor[] planes = new FloatProcessor[channelCount];
        for (int c = 0; c < channelCount; c++) {
            final float[] pixels = new float[planeSize];
            for (int i = 0; i < planeSize; i++) {
                pixels[i] = data[(i * channelCount) + c];
            }
            planes[c] = new FloatProcessor(width, height, pixels);
        }
        return new SampleArray(planes);
    }

    private static final Logger LOG = LoggerFactory.getLogger(ImageNormalizer.class);
}
