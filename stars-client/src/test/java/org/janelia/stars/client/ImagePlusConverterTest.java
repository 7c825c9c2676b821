package org.janelia.stars.client;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;

import org.janelia.stars.image.SampleArray;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ImagePlusConverter} class.
 */
public class ImagePlusConverterTest {

    @Test
    public void testGray() {

        final ByteProcessor byteProcessor = new ByteProcessor(3, 2);
        byteProcessor.set(1, 1, 200);

        final SampleArray sampleArray = ImagePlusConverter.toSampleArray(new ImagePlus("gray", byteProcessor));

        Assert.assertEquals("invalid channel count", 1, sampleArray.getChannelCount());
        Assert.assertEquals("invalid value", 200.0f, sampleArray.getf(1, 1, 0), 0.0f);
    }

    @Test
    public void testRgb() {

        final ColorProcessor colorProcessor = new ColorProcessor(2, 2);
        colorProcessor.set(1, 0, (10 << 16) | (20 << 8) | 30);

        final SampleArray sampleArray = ImagePlusConverter.toSampleArray(new ImagePlus("rgb", colorProcessor));

        Assert.assertEquals("invalid channel count", 3, sampleArray.getChannelCount());
        Assert.assertEquals("invalid red value", 10.0f, sampleArray.getf(1, 0, 0), 0.0f);
        Assert.assertEquals("invalid green value", 20.0f, sampleArray.getf(1, 0, 1), 0.0f);
        Assert.assertEquals("invalid blue value", 30.0f, sampleArray.getf(1, 0, 2), 0.0f);
    }

    @Test
    public void testThreeSliceStack() {

        final ImageStack stack = new ImageStack(4, 3);
        for (int c = 0; c < 3; c++) {
            final FloatProcessor slice = new FloatProcessor(4, 3);
            slice.setf(2, 1, c + 1.5f);
            stack.addSlice("c" + c, slice);
        }

        final SampleArray sampleArray = ImagePlusConverter.toSampleArray(new ImagePlus("cube", stack));

        Assert.assertEquals("invalid channel count", 3, sampleArray.getChannelCount());
        Assert.assertEquals("invalid width", 4, sampleArray.getWidth());
        Assert.assertEquals("invalid height", 3, sampleArray.getHeight());
        for (int c = 0; c < 3; c++) {
            Assert.assertEquals("invalid value for channel " + c, c + 1.5f, sampleArray.getf(2, 1, c), 0.0f);
        }
    }

    @Test
    public void testToImagePlus() {

        final SampleArray sampleArray = new SampleArray(new FloatProcessor(5, 4),
                                                        new FloatProcessor(5, 4),
                                                        new FloatProcessor(5, 4));

        final ImagePlus imagePlus = ImagePlusConverter.toImagePlus("test", sampleArray);

        Assert.assertEquals("invalid slice count", 3, imagePlus.getStackSize());
        Assert.assertEquals("invalid width", 5, imagePlus.getWidth());
        Assert.assertEquals("invalid bit depth", 32, imagePlus.getBitDepth());
    }

}
