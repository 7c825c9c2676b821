package org.janelia.stars.mask;

import ij.process.ByteProcessor;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collection;

import org.janelia.stars.detect.StarCandidate;
import org.janelia.stars.error.InvalidParameterException;

/**
 * Burns a filled disk around each star into a binary mask.
 * The mask is 0 where there are no stars and 255 within radius pixels of a star's (rounded) centroid.
 * Overlapping disks are simply unioned, so the result does not depend upon star order.
 */
public class StarMaskRasterizer
        implements Serializable {

    public static final int MASKED = 255;

    private final double radius;

    // disk offsets are computed once and reused for every star
    private final int[] offsetX;
    private final int[] offsetY;

    public StarMaskRasterizer(final double radius)
            throws InvalidParameterException {

        InvalidParameterException.requirePositive("radius", radius);

        this.radius = radius;

        final int extent = (int) Math.floor(radius);
        final double radiusSquared = radius * radius;

        int count = 0;
        final int[] xs = new int[(2 * extent + 1) * (2 * extent + 1)];
        final int[] ys = new int[xs.length];
        for (int dy = -extent; dy <= extent; dy++) {
            for (int dx = -extent; dx <= extent; dx++) {
                if ((dx * dx) + (dy * dy) <= radiusSquared) {
                    xs[count] = dx;
                    ys[count] = dy;
                    count++;
                }
            }
        }

        this.offsetX = Arrays.copyOf(xs, count);
        this.offsetY = Arrays.copyOf(ys, count);
    }

    public double getRadius() {
        return radius;
    }

    /**
     * @return number of pixels in a disk that is not clipped by the image edge.
     */
    public int getDiskPixelCount() {
        return offsetX.length;
    }

    /**
     * @return new width x height mask with a disk burned in for every star whose rounded centroid is in bounds.
     */
    public ByteProcessor rasterize(final Collection<StarCandidate> stars,
                                   final int width,
                                   final int height) {

        final ByteProcessor mask = new ByteProcessor(width, height);
        final byte[] pixels = (byte[]) mask.getPixels();

        for (final StarCandidate star : stars) {

            final int x = star.getRoundedX();
            final int y = star.getRoundedY();

            if ((x >= 0) && (x < width) && (y >= 0) && (y < height)) {
                for (int k = 0; k < offsetX.length; k++) {
                    final int xx = x + offsetX[k];
                    final int yy = y + offsetY[k];
                    if ((xx >= 0) && (xx < width) && (yy >= 0) && (yy < height)) {
                        pixels[(yy * width) + xx] = (byte) MASKED;
                    }
                }
            }
        }

        return mask;
    }

}
