package org.janelia.stars.util;

import ij.process.FloatProcessor;

import org.janelia.stars.StarReducer;
import org.janelia.stars.StarReductionParameters;
import org.janelia.stars.StarReductionResult;
import org.janelia.stars.SyntheticImages;
import org.janelia.stars.error.ShapeMismatchException;
import org.janelia.stars.image.SampleArray;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link StarReductionCache} class.
 */
public class StarReductionCacheTest {

    @Test
    public void testGet() {

        final StarReductionCache cache = new StarReductionCache(new StarReducer(), 2, true);
        final SampleArray image = new SampleArray(SyntheticImages.singlePixel(21, 21, 10, 10, 1.0f));
        final StarReductionParameters parameters = new StarReductionParameters();

        final StarReductionResult first = cache.get(image, image, parameters);
        final StarReductionResult second = cache.get(image, image, new StarReductionParameters());

        Assert.assertSame("equivalent parameters should return cached result", first, second);
        Assert.assertEquals("invalid hit count", 1, cache.getStats().hitCount());
        Assert.assertEquals("invalid size", 1, cache.size());

        parameters.mask.maskRadius = 5.0;
        final StarReductionResult third = cache.get(image, image, parameters);

        Assert.assertNotSame("changed parameters should not return cached result", first, third);
        Assert.assertEquals("invalid size", 2, cache.size());

        final SampleArray copy = image.duplicate();
        final StarReductionResult fourth = cache.get(copy, copy, parameters);

        Assert.assertNotSame("different source instances should not share results", third, fourth);
        Assert.assertEquals("cache should not grow beyond maximum size", 2, cache.size());

        cache.invalidateAll();
        Assert.assertEquals("invalid size after invalidate", 0, cache.size());
    }

    @Test(expected = ShapeMismatchException.class)
    public void testFailureIsRethrown() {
        final StarReductionCache cache = new StarReductionCache(new StarReducer());
        cache.get(new SampleArray(new FloatProcessor(8, 8)),
                  new SampleArray(new FloatProcessor(9, 8)),
                  new StarReductionParameters());
    }

}
