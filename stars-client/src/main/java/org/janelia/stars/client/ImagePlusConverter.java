package org.janelia.stars.client;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import org.janelia.stars.image.ImageNormalizer;
import org.janelia.stars.image.SampleArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between ImageJ images and {@link SampleArray} instances.
 */
public class ImagePlusConverter {

    /**
     * Converts the specified image:
     * <ul>
     *     <li>RGB images become 3 channel arrays,</li>
     *     <li>3 slice stacks (e.g. color FITS cubes) become 3 channel arrays,</li>
     *     <li>everything else becomes a single channel array of the current slice.</li>
     * </ul>
     */
    public static SampleArray toSampleArray(final ImagePlus imagePlus) {

        final SampleArray sampleArray;

        if (imagePlus.getType() == ImagePlus.COLOR_RGB) {

            final ColorProcessor colorProcessor = (ColorProcessor) imagePlus.getProcessor();
            final FloatProcessor[] planes = new FloatProcessor[3];
            for (int c = 0; c < planes.length; c++) {
                planes[c] = colorProcessor.toFloat(c, null);
            }
            sampleArray = new SampleArray(planes);

        } else if (imagePlus.getStackSize() == 3) {

            final ImageStack stack = imagePlus.getStack();
            final int width = stack.getWidth();
            final int height = stack.getHeight();
            final int planeSize = width * height;
            final float[] data = new float[3 * planeSize];
            for (int c = 0; c < 3; c++) {
                final float[] pixels = (float[]) toFloat(stack.getProcessor(c + 1)).getPixels();
                System.arraycopy(pixels, 0, data, c * planeSize, planeSize);
            }
            sampleArray = ImageNormalizer.canonicalize(data, 3, height, width);

        } else {

            if (imagePlus.getStackSize() > 1) {
                LOG.warn("toSampleArray: {} has {} slices, only using slice {}",
                         imagePlus.getTitle(), imagePlus.getStackSize(), imagePlus.getCurrentSlice());
            }
            sampleArray = new SampleArray(toFloat(imagePlus.getProcessor()));

        }

        LOG.debug("toSampleArray: converted {} to {}", imagePlus.getTitle(), sampleArray);

        return sampleArray;
    }

    /**
     * @return 32-bit image with one slice per channel (slices share the underlying pixel arrays).
     */
    public static ImagePlus toImagePlus(final String title,
                                        final SampleArray sampleArray) {
        final ImageStack stack = new ImageStack(sampleArray.getWidth(), sampleArray.getHeight());
        for (int c = 0; c < sampleArray.getChannelCount(); c++) {
            stack.addSlice("channel-" + c, sampleArray.getChannel(c));
        }
        return new ImagePlus(title, stack);
    }

    private static FloatProcessor toFloat(final ImageProcessor imageProcessor) {
        final FloatProcessor floatProcessor;
        if (imageProcessor instanceof FloatProcessor) {
            floatProcessor = (FloatProcessor) imageProcessor.duplicate();
        } else {
            floatProcessor = imageProcessor.convertToFloatProcessor();
        }
        return floatProcessor;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ImagePlusConverter.class);
}
