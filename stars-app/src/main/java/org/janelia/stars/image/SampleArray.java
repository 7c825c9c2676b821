package org.janelia.stars.image;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import org.janelia.stars.error.InvalidParameterException;

/**
 * Grid of float intensities with one or more channels (channel-last semantics, H x W x C).
 * Each channel is held as a {@link FloatProcessor} plane and all planes share the same dimensions.
 * <p>
 * Instances are treated as immutable values: processing stages read the planes returned by
 * {@link #getChannel(int)} but never modify them, so callers must not modify them either.
 */
public class SampleArray {

    private final int width;
    private final int height;
    private final FloatProcessor[] channels;

    public SampleArray(final FloatProcessor... channels)
            throws InvalidParameterException {

        if ((channels == null) || (channels.length == 0)) {
            throw new InvalidParameterException("at least one channel must be specified");
        }

        this.width = channels[0].getWidth();
        this.height = channels[0].getHeight();

        for (int c = 1; c < channels.length; c++) {
            if ((channels[c].getWidth() != width) || (channels[c].getHeight() != height)) {
                throw new InvalidParameterException(
                        "channel " + c + " is " + channels[c].getWidth() + "x" + channels[c].getHeight() +
                        " but channel 0 is " + width + "x" + height);
            }
        }

        this.channels = channels.clone();
    }

    /**
     * @return single channel array wrapping the specified row-major pixels.
     */
    public static SampleArray forPlane(final int width,
                                       final int height,
                                       final float[] pixels) {
        return new SampleArray(new FloatProcessor(width, height, pixels));
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getPixelCount() {
        return width * height;
    }

    public int getChannelCount() {
        return channels.length;
    }

    public boolean isMultiChannel() {
        return channels.length > 1;
    }

    /**
     * @return the plane for the specified channel (do not modify it).
     */
    public FloatProcessor getChannel(final int channel) {
        return channels[channel];
    }

    /**
     * @return the pixel array for the specified channel (do not modify it).
     */
    public float[] getPixels(final int channel) {
        return (float[]) channels[channel].getPixels();
    }

    public float getf(final int x,
                      final int y,
                      final int channel) {
        return channels[channel].getf(x, y);
    }

    public boolean hasSameSpatialShape(final SampleArray that) {
        return (width == that.width) && (height == that.height);
    }

    public boolean hasSameSpatialShape(final ImageProcessor ip) {
        return (width == ip.getWidth()) && (height == ip.getHeight());
    }

    public boolean hasSameShape(final SampleArray that) {
        return hasSameSpatialShape(that) && (channels.length == that.channels.length);
    }

    /**
     * @return deep copy of this array.
     */
    public SampleArray duplicate() {
        final FloatProcessor[] copies = new FloatProcessor[channels.length];
        for (int c = 0; c < channels.length; c++) {
            copies[c] = (FloatProcessor) channels[c].duplicate();
        }
        return new SampleArray(copies);
    }

    /**
     * @return shape in (H,W) or (H,W,C) form.
     */
    public String getShapeString() {
        return isMultiChannel() ? "(" + height + "," + width + "," + channels.length + ")" :
               "(" + height + "," + width + ")";
    }

    @Override
    public String toString() {
        return "SampleArray" + getShapeString();
    }
}
