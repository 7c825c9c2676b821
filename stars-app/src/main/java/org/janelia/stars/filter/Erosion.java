package org.janelia.stars.filter;

import ij.process.FloatProcessor;

import java.io.Serializable;

import org.janelia.stars.error.InvalidParameterException;
import org.janelia.stars.image.SampleArray;

/**
 * Grayscale morphological erosion with a flat square structuring element.
 * <p>
 * Each pass replaces every sample with the minimum of its kernelSize x kernelSize neighborhood
 * (channels are eroded independently) and passes are repeated iterations times.
 * Pixels outside the image are ignored rather than treated as dark, so image borders are not eroded
 * any more than the interior.
 * <p>
 * The square minimum is separable, so each pass is implemented as a horizontal then a vertical 1-D minimum.
 */
public class Erosion
        implements Serializable {

    private final int kernelSize;
    private final int iterations;
    private final boolean quantize8Bit;

    public Erosion(final int kernelSize,
                   final int iterations) {
        this(kernelSize, iterations, false);
    }

    /**
     * @param  kernelSize    odd side length of the structuring element.
     * @param  iterations    number of erosion passes.
     * @param  quantize8Bit  if true, samples are quantized to 256 levels (floor(v * 255) / 255) before eroding.
     */
    public Erosion(final int kernelSize,
                   final int iterations,
                   final boolean quantize8Bit)
            throws InvalidParameterException {

        InvalidParameterException.requireAtLeast("kernelSize", kernelSize, 1);
        if (kernelSize % 2 == 0) {
            throw new InvalidParameterException("'kernelSize' must be odd but was " + kernelSize);
        }
        InvalidParameterException.requireAtLeast("iterations", iterations, 1);

        this.kernelSize = kernelSize;
        this.iterations = iterations;
        this.quantize8Bit = quantize8Bit;
    }

    public int getKernelSize() {
        return kernelSize;
    }

    public int getIterations() {
        return iterations;
    }

    /**
     * @return new eroded copy of the specified image.
     */
    public SampleArray erode(final SampleArray image) {
        final FloatProcessor[] planes = new FloatProcessor[image.getChannelCount()];
        for (int c = 0; c < planes.length; c++) {
            planes[c] = erode(image.getChannel(c));
        }
        return new SampleArray(planes);
    }

    /**
     * @return new eroded copy of the specified plane.
     */
    public FloatProcessor erode(final FloatProcessor plane) {

        final int width = plane.getWidth();
        final int height = plane.getHeight();
        final int radius = kernelSize / 2;

        float[] current = ((float[]) plane.getPixels()).clone();
        if (quantize8Bit) {
            quantize(current);
        }

        float[] scratch = new float[current.length];
        for (int i = 0; i < iterations; i++) {
            minimumX(current, scratch, width, height, radius);
            minimumY(scratch, current, width, height, radius);
        }

        return new FloatProcessor(width, height, current);
    }

    private static void minimumX(final float[] in,
                                 final float[] out,
                                 final int width,
                                 final int height,
                                 final int radius) {
        for (int y = 0; y < height; y++) {
            final int rowStart = y * width;
            for (int x = 0; x < width; x++) {
                final int minX = Math.max(0, x - radius);
                final int maxX = Math.min(width - 1, x + radius);
                float min = in[rowStart + minX];
                for (int xx = minX + 1; xx <= maxX; xx++) {
                    min = Math.min(min, in[rowStart + xx]);
                }
                out[rowStart + x] = min;
            }
        }
    }

    private static void minimumY(final float[] in,
                                 final float[] out,
                                 final int width,
                                 final int height,
                                 final int radius) {
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                final int minY = Math.max(0, y - radius);
                final int maxY = Math.min(height - 1, y + radius);
                float min = in[(minY * width) + x];
                for (int yy = minY + 1; yy <= maxY; yy++) {
                    min = Math.min(min, in[(yy * width) + x]);
                }
                out[(y * width) + x] = min;
            }
        }
    }

    private static void quantize(final float[] pixels) {
        for (int i = 0; i < pixels.length; i++) {
            if (Float.isFinite(pixels[i])) {
                final double level = Math.max(0, Math.min(255, Math.floor(pixels[i] * 255.0)));
                pixels[i] = (float) (level / 255.0);
            }
        }
    }

}
