package org.janelia.stars.detect;

import ij.process.FloatProcessor;

import java.util.List;

import org.janelia.stars.SyntheticImages;
import org.janelia.stars.error.InvalidParameterException;
import org.janelia.stars.stats.BackgroundStatistics;
import org.janelia.stars.stats.SigmaClippedStatistics;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link StarFinder} class.
 */
public class StarFinderTest {

    private static final int SIZE = 64;
    private static final double FWHM = 3.0;

    @Test
    public void testFlatImageHasNoStars() {

        final FloatProcessor flat = new FloatProcessor(10, 10);
        final BackgroundStatistics statistics = new SigmaClippedStatistics().compute(flat);

        Assert.assertEquals("invalid median", 0.0, statistics.getMedian(), 0.0);
        Assert.assertEquals("invalid stddev", 0.0, statistics.getStddev(), 0.0);

        final List<StarCandidate> stars = new StarFinder(FWHM, 5.0).find(flat, statistics);

        Assert.assertTrue("flat image should not have stars", stars.isEmpty());
    }

    @Test
    public void testSingleStarIsFound() {

        final double starX = 32.3;
        final double starY = 31.8;
        final double amplitude = 10.0 * SyntheticImages.rampStandardDeviation(SIZE);

        final FloatProcessor image = SyntheticImages.ramp(SIZE, SIZE, 100.0);
        SyntheticImages.addStar(image, starX, starY, amplitude, FWHM);

        final List<StarCandidate> stars = findStars(image, new StarFinder(FWHM, 5.0));

        Assert.assertEquals("invalid number of stars found, stars are " + stars, 1, stars.size());

        final StarCandidate star = stars.get(0);
        Assert.assertEquals("invalid x for " + star, starX, star.getX(), 1.0);
        Assert.assertEquals("invalid y for " + star, starY, star.getY(), 1.0);
        Assert.assertEquals("invalid flux for " + star, amplitude, star.getFlux(), amplitude * 0.1);
    }

    @Test
    public void testSingleStarIsFoundInNoise() {

        final double starX = 32.3;
        final double starY = 31.6;
        final double noiseStddev = 1.0;

        for (long seed = 0; seed < 200; seed++) {

            final FloatProcessor image = SyntheticImages.gaussianNoise(SIZE, SIZE, 100.0, noiseStddev, seed);
            SyntheticImages.addStar(image, starX, starY, 10.0 * noiseStddev, FWHM);

            final List<StarCandidate> stars = findStars(image, new StarFinder(FWHM, 5.0));

            Assert.assertEquals("invalid number of stars found for seed " + seed + ", stars are " + stars,
                                1, stars.size());

            final StarCandidate star = stars.get(0);
            Assert.assertEquals("invalid x for seed " + seed + ", star is " + star, starX, star.getX(), 1.0);
            Assert.assertEquals("invalid y for seed " + seed + ", star is " + star, starY, star.getY(), 1.0);
        }
    }

    @Test
    public void testNearbySeedsAreMerged() {

        final FloatProcessor image = new FloatProcessor(SIZE, SIZE);
        image.setf(30, 32, 1.0f);
        image.setf(32, 32, 1.0f);

        final List<StarCandidate> stars = findStars(image, new StarFinder(FWHM, 5.0));

        Assert.assertEquals("seeds closer than fwhm should be merged, stars are " + stars, 1, stars.size());
        Assert.assertEquals("invalid x for " + stars.get(0), 31.0, stars.get(0).getX(), 1.0);
        Assert.assertEquals("invalid y for " + stars.get(0), 32.0, stars.get(0).getY(), 1e-9);
    }

    @Test
    public void testMaxCandidatesKeepsStrongestSeeds() {

        final FloatProcessor image = buildFourStarImage();
        final BackgroundStatistics statistics = new SigmaClippedStatistics().compute(image);

        for (final double thresholdSigma : new double[] { 3.0, 20.0 }) {

            final StarFinder finder = new StarFinder(new StarFinderKernel(FWHM, StarFinder.DEFAULT_SIGMA_RADIUS),
                                                     thresholdSigma,
                                                     StarFinder.DEFAULT_SHARP_LO,
                                                     StarFinder.DEFAULT_SHARP_HI,
                                                     StarFinder.DEFAULT_ROUND_LO,
                                                     StarFinder.DEFAULT_ROUND_HI,
                                                     0,
                                                     false,
                                                     1);

            final List<StarCandidate> stars = finder.find(image, statistics);

            Assert.assertEquals("invalid number of stars for threshold " + thresholdSigma, 1, stars.size());
            Assert.assertEquals("strongest star should be kept", 48.3, stars.get(0).getX(), 1.0);
            Assert.assertEquals("strongest star should be kept", 48.1, stars.get(0).getY(), 1.0);
        }
    }

    @Test
    public void testSinglePixel() {

        final FloatProcessor image = SyntheticImages.singlePixel(101, 101, 50, 50, 1.0f);

        final List<StarCandidate> stars = findStars(image, new StarFinder(FWHM, 5.0));

        Assert.assertEquals("invalid number of stars found, stars are " + stars, 1, stars.size());

        final StarCandidate star = stars.get(0);
        Assert.assertEquals("invalid x", 50.0, star.getX(), 1e-9);
        Assert.assertEquals("invalid y", 50.0, star.getY(), 1e-9);
        Assert.assertEquals("invalid flux", 1.0, star.getFlux(), 1e-9);
        Assert.assertEquals("invalid sharpness", 0.598, star.getSharpness(), 0.001);
        Assert.assertEquals("invalid roundness2", 0.0, star.getRoundness2(), 1e-9);
    }

    @Test
    public void testStreakIsRejected() {

        final FloatProcessor image = new FloatProcessor(SIZE, SIZE);
        for (int x = 10; x <= 54; x++) {
            image.setf(x, 32, 1.0f);
        }

        final List<StarCandidate> stars = findStars(image, new StarFinder(FWHM, 5.0));

        Assert.assertTrue("streak should not be found as a star, stars are " + stars, stars.isEmpty());
    }

    @Test
    public void testHigherThresholdFindsSubset() {

        final FloatProcessor image = buildFourStarImage();
        final BackgroundStatistics statistics = new SigmaClippedStatistics().compute(image);

        final double[] thresholds = { 3.0, 5.0, 10.0, 20.0, 40.0 };
        List<StarCandidate> previousStars = null;
        for (final double thresholdSigma : thresholds) {

            final List<StarCandidate> stars = new StarFinder(FWHM, thresholdSigma).find(image, statistics);

            if (previousStars != null) {
                Assert.assertTrue("threshold " + thresholdSigma + " found more stars than lower threshold",
                                  stars.size() <= previousStars.size());
                for (final StarCandidate star : stars) {
                    Assert.assertTrue("star " + star + " found with threshold " + thresholdSigma +
                                      " is missing for lower threshold",
                                      containsStarAt(previousStars, star.getX(), star.getY()));
                }
            }

            previousStars = stars;
        }

        Assert.assertEquals("invalid number of stars for lowest threshold",
                            4, new StarFinder(FWHM, thresholds[0]).find(image, statistics).size());
        Assert.assertEquals("invalid number of stars for highest threshold",
                            1, new StarFinder(FWHM, thresholds[thresholds.length - 1]).find(image, statistics).size());
    }

    @Test
    public void testBrightest() {

        final FloatProcessor image = buildFourStarImage();

        final StarFinder finder = new StarFinder(new StarFinderKernel(FWHM, StarFinder.DEFAULT_SIGMA_RADIUS),
                                                 3.0,
                                                 StarFinder.DEFAULT_SHARP_LO,
                                                 StarFinder.DEFAULT_SHARP_HI,
                                                 StarFinder.DEFAULT_ROUND_LO,
                                                 StarFinder.DEFAULT_ROUND_HI,
                                                 2,
                                                 false,
                                                 StarFinder.DEFAULT_MAX_CANDIDATES);

        final List<StarCandidate> stars = findStars(image, finder);

        Assert.assertEquals("invalid number of stars", 2, stars.size());
        Assert.assertEquals("brightest star should be first", 48.3, stars.get(0).getX(), 1.0);
        Assert.assertEquals("brightest star should be first", 48.1, stars.get(0).getY(), 1.0);
        Assert.assertEquals("second brightest star should be second", 47.4, stars.get(1).getY(), 1.0);
    }

    @Test(expected = InvalidParameterException.class)
    public void testInvalidFwhm() {
        new StarFinder(0.0, 5.0);
    }

    @Test(expected = InvalidParameterException.class)
    public void testInvalidThreshold() {
        new StarFinder(FWHM, -1.0);
    }

    private static List<StarCandidate> findStars(final FloatProcessor image,
                                                 final StarFinder finder) {
        final BackgroundStatistics statistics = new SigmaClippedStatistics().compute(image);
        return finder.find(image, statistics);
    }

    private static FloatProcessor buildFourStarImage() {
        final double sigma = SyntheticImages.rampStandardDeviation(SIZE);
        final FloatProcessor image = SyntheticImages.ramp(SIZE, SIZE, 100.0);
        SyntheticImages.addStar(image, 16.2, 15.7, 8.0 * sigma, FWHM);
        SyntheticImages.addStar(image, 47.6, 16.3, 15.0 * sigma, FWHM);
        SyntheticImages.addStar(image, 15.8, 47.4, 30.0 * sigma, FWHM);
        SyntheticImages.addStar(image, 48.3, 48.1, 60.0 * sigma, FWHM);
        return image;
    }

    private static boolean containsStarAt(final List<StarCandidate> stars,
                                          final double x,
                                          final double y) {
        for (final StarCandidate star : stars) {
            if ((star.getX() == x) && (star.getY() == y)) {
                return true;
            }
        }
        return false;
    }

}
