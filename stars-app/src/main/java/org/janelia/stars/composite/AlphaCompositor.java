package org.janelia.stars.composite;

import ij.process.FloatProcessor;

import org.janelia.stars.error.ShapeMismatchException;
import org.janelia.stars.image.SampleArray;

/**
 * Blends an eroded image over its original with a 2-D alpha mask:
 * <pre>
 *     final = alpha * eroded + (1 - alpha) * original
 * </pre>
 * The same alpha plane is applied to every channel.
 * Samples where alpha is exactly 0 or 1 are copied from the original or eroded image respectively,
 * so those pixels match their source bit for bit.
 */
public class AlphaCompositor {

    /**
     * @return new composited image with the shape of the original.
     *
     * @throws ShapeMismatchException
     *   if the original and eroded images do not have the same shape or
     *   if the alpha mask does not have their width and height.
     */
    public static SampleArray composite(final SampleArray original,
                                        final SampleArray eroded,
                                        final FloatProcessor alpha)
            throws ShapeMismatchException {

        if (! original.hasSameShape(eroded)) {
            throw new ShapeMismatchException("original " + original.getShapeString() +
                                             " and eroded " + eroded.getShapeString() +
                                             " images have different shapes");
        }
        if (! original.hasSameSpatialShape(alpha)) {
            throw new ShapeMismatchException("alpha mask (" + alpha.getHeight() + "," + alpha.getWidth() +
                                             ") does not match image " + original.getShapeString());
        }

        final float[] alphaPixels = (float[]) alpha.getPixels();
        final FloatProcessor[] planes = new FloatProcessor[original.getChannelCount()];

        for (int c = 0; c < planes.length; c++) {

            final float[] originalPixels = original.getPixels(c);
            final float[] erodedPixels = eroded.getPixels(c);
            final float[] pixels = new float[originalPixels.length];

            for (int i = 0; i < pixels.length; i++) {
                final float a = alphaPixels[i];
                if (a == 0.0f) {
                    pixels[i] = originalPixels[i];
                } else if (a == 1.0f) {
                    pixels[i] = erodedPixels[i];
                } else {
                    pixels[i] = (float) ((a * (double) erodedPixels[i]) + ((1.0 - a) * originalPixels[i]));
                }
            }

            planes[c] = new FloatProcessor(original.getWidth(), original.getHeight(), pixels);
        }

        return new SampleArray(planes);
    }

}
