package org.janelia.stars.image;

import org.janelia.stars.error.InvalidParameterException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ImageNormalizer} class.
 */
public class ImageNormalizerTest {

    @Test
    public void testNormalize() {

        final NormalizedImage normalized = ImageNormalizer.prepare(new float[] { 2, 4, 6, 10 }, 2, 2);

        Assert.assertFalse("image should not be degenerate", normalized.isDegenerate());
        Assert.assertEquals("invalid min", 2.0, normalized.getMin(), 0.0);
        Assert.assertEquals("invalid max", 10.0, normalized.getMax(), 0.0);
        Assert.assertArrayEquals("invalid normalized values",
                                 new float[] { 0.0f, 0.25f, 0.5f, 1.0f },
                                 normalized.getImage().getPixels(0),
                                 0.0f);
    }

    @Test
    public void testNormalizeIsIdempotent() {

        final float[] data = { -3.5f, 17.25f, 0.125f, 1000.0f, 42.0f, -0.75f };
        final SampleArray once = ImageNormalizer.prepare(data, 2, 3).getImage();
        final NormalizedImage twice = ImageNormalizer.normalize(once);

        Assert.assertArrayEquals("second normalization changed values",
                                 once.getPixels(0),
                                 twice.getImage().getPixels(0),
                                 1e-7f);
    }

    @Test
    public void testNonFiniteValuesAreIgnored() {

        final NormalizedImage normalized =
                ImageNormalizer.prepare(new float[] { Float.NaN, 1, 3, Float.POSITIVE_INFINITY }, 2, 2);

        Assert.assertEquals("invalid min", 1.0, normalized.getMin(), 0.0);
        Assert.assertEquals("invalid max", 3.0, normalized.getMax(), 0.0);

        final float[] pixels = normalized.getImage().getPixels(0);
        Assert.assertTrue("NaN should stay NaN", Float.isNaN(pixels[0]));
        Assert.assertEquals("invalid low value", 0.0f, pixels[1], 0.0f);
        Assert.assertEquals("invalid high value", 1.0f, pixels[2], 0.0f);
        Assert.assertFalse("infinity should stay non-finite", Float.isFinite(pixels[3]));
    }

    @Test
    public void testDegenerateImageIsReturnedUnchanged() {

        final SampleArray flat = SampleArray.forPlane(3, 2, new float[] { 7, 7, 7, 7, 7, 7 });
        final NormalizedImage normalized = ImageNormalizer.normalize(flat);

        Assert.assertTrue("flat image should be degenerate", normalized.isDegenerate());
        Assert.assertSame("flat image should be returned as is", flat, normalized.getImage());
    }

    @Test
    public void testChannelFirstOrientation() {

        final float[] data = new float[12];
        for (int i = 0; i < data.length; i++) {
            data[i] = i;
        }

        // 3 channels of 2 rows x 2 columns
        final SampleArray image = ImageNormalizer.canonicalize(data, 3, 2, 2);

        Assert.assertEquals("invalid channel count", 3, image.getChannelCount());
        Assert.assertEquals("invalid width", 2, image.getWidth());
        Assert.assertEquals("invalid height", 2, image.getHeight());
        Assert.assertEquals("invalid shape string", "(2,2,3)", image.getShapeString());
        for (int c = 0; c < 3; c++) {
            Assert.assertEquals("invalid value for channel " + c + " at (1,0)",
                                (c * 4) + 1, image.getf(1, 0, c), 0.0f);
            Assert.assertEquals("invalid value for channel " + c + " at (0,1)",
                                (c * 4) + 2, image.getf(0, 1, c), 0.0f);
        }
    }

    @Test
    public void testChannelLastOrientation() {

        final float[] data = new float[2 * 4 * 3];
        for (int i = 0; i < data.length; i++) {
            data[i] = i;
        }

        // 2 rows x 4 columns x 3 channels
        final SampleArray image = ImageNormalizer.canonicalize(data, 2, 4, 3);

        Assert.assertEquals("invalid width", 4, image.getWidth());
        Assert.assertEquals("invalid height", 2, image.getHeight());
        for (int c = 0; c < 3; c++) {
            final int expectedIndex = (((1 * 4) + 2) * 3) + c;
            Assert.assertEquals("invalid value for channel " + c + " at (2,1)",
                                expectedIndex, image.getf(2, 1, c), 0.0f);
        }
    }

    @Test(expected = InvalidParameterException.class)
    public void testShapeDoesNotMatchData() {
        ImageNormalizer.canonicalize(new float[5], 2, 2);
    }

    @Test(expected = InvalidParameterException.class)
    public void testUnsupportedDimensionCount() {
        ImageNormalizer.canonicalize(new float[8], 2, 2, 1, 2);
    }

}
