package org.janelia.stars.composite;

import ij.process.FloatProcessor;

import org.janelia.stars.SyntheticImages;
import org.janelia.stars.error.ShapeMismatchException;
import org.janelia.stars.filter.Erosion;
import org.janelia.stars.image.SampleArray;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link AlphaCompositor} class.
 */
public class AlphaCompositorTest {

    private static final int WIDTH = 20;
    private static final int HEIGHT = 15;

    @Test
    public void testZeroAlphaCopiesOriginal() {

        final SampleArray original = new SampleArray(SyntheticImages.random(WIDTH, HEIGHT, 1L));
        final SampleArray eroded = new Erosion(3, 2).erode(original);

        final SampleArray result = AlphaCompositor.composite(original, eroded, new FloatProcessor(WIDTH, HEIGHT));

        Assert.assertArrayEquals("zero alpha should give original",
                                 original.getPixels(0), result.getPixels(0), 0.0f);
    }

    @Test
    public void testFullAlphaCopiesEroded() {

        final SampleArray original = new SampleArray(SyntheticImages.random(WIDTH, HEIGHT, 2L));
        final SampleArray eroded = new Erosion(3, 2).erode(original);

        final SampleArray result =
                AlphaCompositor.composite(original, eroded, SyntheticImages.constant(WIDTH, HEIGHT, 1.0f));

        Assert.assertArrayEquals("full alpha should give eroded",
                                 eroded.getPixels(0), result.getPixels(0), 0.0f);
    }

    @Test
    public void testResultIsConvex() {

        final SampleArray original = new SampleArray(SyntheticImages.random(WIDTH, HEIGHT, 3L));
        final SampleArray eroded = new Erosion(3, 1).erode(original);
        final FloatProcessor alpha = SyntheticImages.random(WIDTH, HEIGHT, 4L);

        final SampleArray result = AlphaCompositor.composite(original, eroded, alpha);

        for (int i = 0; i < original.getPixelCount(); i++) {
            final float o = original.getPixels(0)[i];
            final float e = eroded.getPixels(0)[i];
            final float r = result.getPixels(0)[i];
            Assert.assertTrue("pixel " + i + " value " + r + " is not between " + e + " and " + o,
                              (r >= Math.min(o, e)) && (r <= Math.max(o, e)));
        }
    }

    @Test
    public void testAlphaIsBroadcastAcrossChannels() {

        final SampleArray original = new SampleArray(SyntheticImages.constant(2, 1, 1.0f),
                                                     SyntheticImages.constant(2, 1, 0.5f),
                                                     SyntheticImages.constant(2, 1, 0.0f));
        final SampleArray eroded = new SampleArray(SyntheticImages.constant(2, 1, 0.0f),
                                                   SyntheticImages.constant(2, 1, 0.0f),
                                                   SyntheticImages.constant(2, 1, 0.0f));
        final FloatProcessor alpha = new FloatProcessor(2, 1, new float[] { 0.0f, 0.5f });

        final SampleArray result = AlphaCompositor.composite(original, eroded, alpha);

        Assert.assertEquals("invalid channel count", 3, result.getChannelCount());
        Assert.assertEquals("invalid channel 0 value", 0.5f, result.getf(1, 0, 0), 1e-7f);
        Assert.assertEquals("invalid channel 1 value", 0.25f, result.getf(1, 0, 1), 1e-7f);
        Assert.assertEquals("invalid channel 2 value", 0.0f, result.getf(1, 0, 2), 1e-7f);
        Assert.assertEquals("zero alpha pixel should keep original", 0.5f, result.getf(0, 0, 1), 0.0f);
    }

    @Test(expected = ShapeMismatchException.class)
    public void testAlphaShapeMismatch() {
        final SampleArray image = new SampleArray(new FloatProcessor(4, 4));
        AlphaCompositor.composite(image, image, new FloatProcessor(4, 5));
    }

    @Test(expected = ShapeMismatchException.class)
    public void testChannelCountMismatch() {
        final SampleArray gray = new SampleArray(new FloatProcessor(4, 4));
        final SampleArray color = new SampleArray(new FloatProcessor(4, 4),
                                                  new FloatProcessor(4, 4),
                                                  new FloatProcessor(4, 4));
        AlphaCompositor.composite(gray, color, new FloatProcessor(4, 4));
    }

}
