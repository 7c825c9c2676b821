package org.janelia.stars.detect;

import ij.process.FloatProcessor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.janelia.stars.error.EmptyInputException;
import org.janelia.stars.error.InvalidParameterException;
import org.janelia.stars.stats.BackgroundStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds round point sources in a single plane following the DAOFIND approach.
 * <p>
 * The background (median) subtracted image is correlated with a zero sum Gaussian {@link StarFinderKernel}.
 * Pixels that are maxima of the kernel footprint in the correlated image, whose correlated amplitude and
 * background subtracted value both exceed thresholdSigma standard deviations, become seeds.
 * Each seed is then screened with three shape statistics
 * (a rejected seed is retried once from its brightest footprint neighbor, if that neighbor is brighter):
 * <ul>
 *     <li>sharpness: peak height above the mean of the surrounding footprint relative to the fitted amplitude
 *         (rejects hot pixels and broad blobs),</li>
 *     <li>roundness1: quadrant symmetry of the correlated image around the peak,</li>
 *     <li>roundness2: relative difference of 1-D Gaussian amplitudes fitted to the x and y marginals
 *         (rejects streaks and elongated sources).</li>
 * </ul>
 * Centroids are refined with the marginal fits.
 * Accepted candidates closer than fwhm to a candidate with a larger correlated amplitude are merged into it.
 */
public class StarFinder
        implements Serializable {

    public static final double DEFAULT_SIGMA_RADIUS = 1.5;
    public static final double DEFAULT_SHARP_LO = 0.2;
    public static final double DEFAULT_SHARP_HI = 1.0;
    public static final double DEFAULT_ROUND_LO = -1.0;
    public static final double DEFAULT_ROUND_HI = 1.0;
    public static final int DEFAULT_MAX_CANDIDATES = 100000;

    private final StarFinderKernel kernel;
    private final double thresholdSigma;
    private final double sharpLo;
    private final double sharpHi;
    private final double roundLo;
    private final double roundHi;
    private final int brightest;
    private final boolean excludeBorder;
    private final int maxCandidates;

    // footprint offsets (excluding the center) and matched kernel weights (including the center)
    private final int[] neighborX;
    private final int[] neighborY;
    private final int[] weightX;
    private final int[] weightY;
    private final double[] weight;

    public StarFinder(final double fwhm,
                      final double thresholdSigma) {
        this(new StarFinderKernel(fwhm, DEFAULT_SIGMA_RADIUS),
             thresholdSigma,
             DEFAULT_SHARP_LO,
             DEFAULT_SHARP_HI,
             DEFAULT_ROUND_LO,
             DEFAULT_ROUND_HI,
             0,
             false,
             DEFAULT_MAX_CANDIDATES);
    }

    /**
     * @param  kernel          point spread kernel.
     * @param  thresholdSigma  detection threshold in background standard deviations.
     * @param  sharpLo         exclusive lower sharpness bound.
     * @param  sharpHi         exclusive upper sharpness bound.
     * @param  roundLo         exclusive lower bound for both roundness statistics.
     * @param  roundHi         exclusive upper bound for both roundness statistics.
     * @param  brightest       number of brightest sources to keep (0 keeps all).
     * @param  excludeBorder   if true, seeds closer to the image edge than the kernel radius are skipped.
     * @param  maxCandidates   maximum number of seeds to examine.
     */
    public StarFinder(final StarFinderKernel kernel,
                      final double thresholdSigma,
                      final double sharpLo,
                      final double sharpHi,
                      final double roundLo,
                      final double roundHi,
                      final int brightest,
                      final boolean excludeBorder,
                      final int maxCandidates)
            throws InvalidParameterException {

        InvalidParameterException.requirePositive("thresholdSigma", thresholdSigma);
        if (! (sharpLo < sharpHi)) {
            throw new InvalidParameterException("sharpLo (" + sharpLo + ") must be less than sharpHi (" +
                                                sharpHi + ")");
        }
        if (! (roundLo < roundHi)) {
            throw new InvalidParameterException("roundLo (" + roundLo + ") must be less than roundHi (" +
                                                roundHi + ")");
        }
        InvalidParameterException.requireAtLeast("brightest", brightest, 0);
        InvalidParameterException.requireAtLeast("maxCandidates", maxCandidates, 1);

        this.kernel = kernel;
        this.thresholdSigma = thresholdSigma;
        this.sharpLo = sharpLo;
        this.sharpHi = sharpHi;
        this.roundLo = roundLo;
        this.roundHi = roundHi;
        this.brightest = brightest;
        this.excludeBorder = excludeBorder;
        this.maxCandidates = maxCandidates;

        final int radius = kernel.getRadius();
        final List<int[]> neighbors = new ArrayList<>();
        for (int dy = -radius; dy <= radius; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                if (kernel.isInFootprint(dx, dy)) {
                    neighbors.add(new int[] {dx, dy});
                }
            }
        }

        this.weightX = new int[neighbors.size()];
        this.weightY = new int[neighbors.size()];
        this.weight = new double[neighbors.size()];
        this.neighborX = new int[neighbors.size() - 1];
        this.neighborY = new int[neighbors.size() - 1];

        int n = 0;
        for (int k = 0; k < neighbors.size(); k++) {
            final int dx = neighbors.get(k)[0];
            final int dy = neighbors.get(k)[1];
            weightX[k] = dx;
            weightY[k] = dy;
            weight[k] = kernel.getMatched(dx, dy);
            if ((dx != 0) || (dy != 0)) {
                neighborX[n] = dx;
                neighborY[n] = dy;
                n++;
            }
        }
    }

    public StarFinderKernel getKernel() {
        return kernel;
    }

    public double getThresholdSigma() {
        return thresholdSigma;
    }

    /**
     * Finds point sources in the specified plane.
     *
     * @param  luminance   plane to search (not modified).
     * @param  statistics  background statistics for the plane.
     *
     * @return list of detected sources (empty if none were found).
     *
     * @throws EmptyInputException
     *   if the plane has no pixels.
     */
    public List<StarCandidate> find(final FloatProcessor luminance,
                                    final BackgroundStatistics statistics)
            throws EmptyInputException {

        final int width = luminance.getWidth();
        final int height = luminance.getHeight();
        if ((width == 0) || (height == 0)) {
            throw new EmptyInputException("cannot find stars in an empty image");
        }

        final float[] pixels = (float[]) luminance.getPixels();
        final double background = statistics.getMedian();
        final double threshold = thresholdSigma * statistics.getStddev();

        final double[] data = new double[pixels.length];
        for (int i = 0; i < data.length; i++) {
            data[i] = pixels[i] - background;
        }

        final double[] convolved = correlate(data, width, height);

        final List<Integer> seeds = findSeeds(data, convolved, width, height, threshold);

        final List<StarCandidate> measured = new ArrayList<>(seeds.size());
        int rejectedCount = 0;
        for (final Integer seed : seeds) {
            StarCandidate candidate = measure(data, convolved, width, height, seed);
            if (candidate == null) {
                // noise can pull the correlated peak off the brightest pixel of a real source
                final int alternate = findBrightestNeighbor(data, width, height, seed);
                if ((data[alternate] > data[seed]) &&
                    (convolved[alternate] > threshold) && (data[alternate] > threshold)) {
                    candidate = measure(data, convolved, width, height, alternate);
                }
            }
            if (candidate == null) {
                rejectedCount++;
            } else {
                measured.add(candidate);
            }
        }

        List<StarCandidate> stars = mergeNearbyCandidates(measured);
        final int mergedCount = measured.size() - stars.size();

        if ((brightest > 0) && (stars.size() > brightest)) {
            stars.sort(Comparator.comparingDouble(StarCandidate::getFlux).reversed());
            stars = new ArrayList<>(stars.subList(0, brightest));
        }

        LOG.debug("find: returning {} stars for {}x{} image, threshold={}, {} seeds, {} rejected by shape, {} merged",
                  stars.size(), width, height, threshold, seeds.size(), rejectedCount, mergedCount);

        return stars;
    }

    /**
     * @return the specified data correlated with the matched kernel (outside pixels are treated as zero).
     */
    double[] correlate(final double[] data,
                       final int width,
                       final int height) {
        final double[] convolved = new double[data.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double sum = 0.0;
                for (int k = 0; k < weight.length; k++) {
                    final int xx = x + weightX[k];
                    final int yy = y + weightY[k];
                    if ((xx >= 0) && (xx < width) && (yy >= 0) && (yy < height)) {
                        sum += weight[k] * data[(yy * width) + xx];
                    }
                }
                convolved[(y * width) + x] = sum;
            }
        }
        return convolved;
    }

    /**
     * Once more than maxCandidates seeds are found, only the maxCandidates seeds with the largest
     * correlated amplitude are kept.
     */
    private List<Integer> findSeeds(final double[] data,
                                    final double[] convolved,
                                    final int width,
                                    final int height,
                                    final double threshold) {

        final int border = excludeBorder ? kernel.getRadius() : 0;
        final List<Integer> seeds = new ArrayList<>();

        for (int y = border; y < height - border; y++) {
            for (int x = border; x < width - border; x++) {
                final int i = (y * width) + x;
                if ((convolved[i] > threshold) && (data[i] > threshold) &&
                    isFootprintMaximum(convolved, width, height, x, y)) {
                    seeds.add(i);
                }
            }
        }

        if (seeds.size() > maxCandidates) {
            LOG.warn("findSeeds: found {} seeds, only the {} with the largest correlated amplitude are examined",
                     seeds.size(), maxCandidates);
            seeds.sort(Comparator.comparingDouble((Integer i) -> convolved[i]).reversed());
            return new ArrayList<>(seeds.subList(0, maxCandidates));
        }

        return seeds;
    }

    /**
     * @return index of the brightest footprint neighbor of the specified pixel
     *         (or the pixel itself if no neighbor is brighter).
     */
    private int findBrightestNeighbor(final double[] data,
                                      final int width,
                                      final int height,
                                      final int i) {
        final int x = i % width;
        final int y = i / width;
        int brightestIndex = i;
        for (int k = 0; k < neighborX.length; k++) {
            final int xx = x + neighborX[k];
            final int yy = y + neighborY[k];
            if ((xx >= 0) && (xx < width) && (yy >= 0) && (yy < height)) {
                final int j = (yy * width) + xx;
                if (data[j] > data[brightestIndex]) {
                    brightestIndex = j;
                }
            }
        }
        return brightestIndex;
    }

    /**
     * Seeds closer than fwhm to each other belong to the same source.
     * Of each such group, only the candidate with the largest correlated amplitude is kept.
     */
    private List<StarCandidate> mergeNearbyCandidates(final List<StarCandidate> candidates) {

        final List<StarCandidate> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingDouble(StarCandidate::getConvolvedPeak).reversed());

        final double minDistanceSquared = kernel.getFwhm() * kernel.getFwhm();
        final List<StarCandidate> kept = new ArrayList<>(sorted.size());
        for (final StarCandidate candidate : sorted) {
            boolean isSeparate = true;
            for (final StarCandidate keptCandidate : kept) {
                final double dx = candidate.getX() - keptCandidate.getX();
                final double dy = candidate.getY() - keptCandidate.getY();
                if (((dx * dx) + (dy * dy)) < minDistanceSquared) {
                    isSeparate = false;
                    break;
                }
            }
            if (isSeparate) {
                kept.add(candidate);
            }
        }

        return kept;
    }

    /**
     * Plateaus are resolved to their first pixel in raster order:
     * earlier neighbors must be strictly smaller, later neighbors must not be larger.
     */
    private boolean isFootprintMaximum(final double[] convolved,
                                       final int width,
                                       final int height,
                                       final int x,
                                       final int y) {
        final int i = (y * width) + x;
        final double value = convolved[i];
        for (int k = 0; k < neighborX.length; k++) {
            final int xx = x + neighborX[k];
            final int yy = y + neighborY[k];
            if ((xx >= 0) && (xx < width) && (yy >= 0) && (yy < height)) {
                final int j = (yy * width) + xx;
                final double neighbor = convolved[j];
                if ((j < i) ? (neighbor >= value) : (neighbor > value)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * @return candidate for the specified seed or null if the seed does not look like a point source.
     */
    private StarCandidate measure(final double[] data,
                                  final double[] convolved,
                                  final int width,
                                  final int height,
                                  final int seed) {

        final int radius = kernel.getRadius();
        final int size = kernel.getSize();
        final int peakX = seed % width;
        final int peakY = seed / width;

        final double[] cutout = new double[size * size];
        final double[] convolvedCutout = new double[size * size];
        for (int dy = -radius; dy <= radius; dy++) {
            final int yy = peakY + dy;
            for (int dx = -radius; dx <= radius; dx++) {
                final int xx = peakX + dx;
                if ((xx >= 0) && (xx < width) && (yy >= 0) && (yy < height)) {
                    final int k = kernel.index(dx, dy);
                    cutout[k] = data[(yy * width) + xx];
                    convolvedCutout[k] = convolved[(yy * width) + xx];
                }
            }
        }

        final double dataPeak = data[seed];
        final double convolvedPeak = convolved[seed];

        final double sharpness = sharpness(cutout, dataPeak, convolvedPeak);
        if (! ((sharpness > sharpLo) && (sharpness < sharpHi))) {
            return null;
        }

        final double roundness1 = roundness1(convolvedCutout);
        if (! ((roundness1 > roundLo) && (roundness1 < roundHi))) {
            return null;
        }

        final MarginalFit xFit = fitMarginal(cutout, true);
        final MarginalFit yFit = fitMarginal(cutout, false);
        if ((xFit == null) || (yFit == null)) {
            return null;
        }

        final double roundness2 = 2.0 * (xFit.amplitude - yFit.amplitude) / (xFit.amplitude + yFit.amplitude);
        if (! ((roundness2 > roundLo) && (roundness2 < roundHi))) {
            return null;
        }

        final double x = peakX + xFit.shift;
        final double y = peakY + yFit.shift;
        if (! (Double.isFinite(x) && Double.isFinite(y))) {
            return null;
        }

        return new StarCandidate(x, y, dataPeak, convolvedPeak, sharpness, roundness1, roundness2);
    }

    private double sharpness(final double[] cutout,
                             final double dataPeak,
                             final double convolvedPeak) {
        final int radius = kernel.getRadius();
        double footprintSum = 0.0;
        for (int dy = -radius; dy <= radius; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                if (kernel.isInFootprint(dx, dy)) {
                    footprintSum += cutout[kernel.index(dx, dy)];
                }
            }
        }
        final double surroundingMean = (footprintSum - dataPeak) / (kernel.getFootprintCount() - 1);
        return (dataPeak - surroundingMean) / convolvedPeak;
    }

    /**
     * Compares the correlated values in the four pinwheel quadrants around the (excluded) center.
     * Each quadrant includes one half axis, so a source stretched along x or y gives a non-zero result.
     */
    private double roundness1(final double[] convolvedCutout) {
        final int radius = kernel.getRadius();
        double sum2 = 0.0;
        double sum4 = 0.0;
        for (int dy = -radius; dy <= radius; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                if ((dx == 0) && (dy == 0)) {
                    continue;
                }
                final double value = convolvedCutout[kernel.index(dx, dy)];
                sum4 += Math.abs(value);
                if ((dx > 0) && (dy <= 0)) {
                    sum2 -= value;
                } else if ((dx <= 0) && (dy < 0)) {
                    sum2 += value;
                } else if ((dx < 0) && (dy >= 0)) {
                    sum2 -= value;
                } else {
                    sum2 += value;
                }
            }
        }

        final double roundness;
        if (sum2 == 0.0) {
            roundness = 0.0;
        } else if (sum4 <= 0.0) {
            roundness = Double.NaN;
        } else {
            roundness = 2.0 * sum2 / sum4;
        }
        return roundness;
    }

    /**
     * Fits sky + amplitude * kernel to the triangle weighted marginal of the cutout along one axis
     * and linearizes the profile around the peak to estimate the centroid shift.
     *
     * @return the fit or null if the fitted amplitude is not positive.
     */
    private MarginalFit fitMarginal(final double[] cutout,
                                    final boolean alongX) {

        final int radius = kernel.getRadius();
        final int size = kernel.getSize();
        final double sigmaSquared = kernel.getSigma() * kernel.getSigma();

        final double[] triangle = new double[size];
        for (int i = 0; i < size; i++) {
            triangle[i] = radius - Math.abs(i - radius) + 1;
        }

        final double[] kernelMarginal = new double[size];
        final double[] dataMarginal = new double[size];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                final int dx = alongX ? i - radius : j - radius;
                final int dy = alongX ? j - radius : i - radius;
                kernelMarginal[i] += triangle[j] * kernel.getGaussian(dx, dy);
                dataMarginal[i] += triangle[j] * cutout[kernel.index(dx, dy)];
            }
        }

        double weightSum = 0.0;
        double kernelSum = 0.0;
        double kernelSquaredSum = 0.0;
        double dataSum = 0.0;
        double dataKernelSum = 0.0;
        for (int i = 0; i < size; i++) {
            weightSum += triangle[i];
            kernelSum += triangle[i] * kernelMarginal[i];
            kernelSquaredSum += triangle[i] * kernelMarginal[i] * kernelMarginal[i];
            dataSum += triangle[i] * dataMarginal[i];
            dataKernelSum += triangle[i] * dataMarginal[i] * kernelMarginal[i];
        }

        final double amplitudeNumerator = dataKernelSum - (dataSum * kernelSum / weightSum);
        final double amplitudeDenominator = kernelSquaredSum - (kernelSum * kernelSum / weightSum);
        if (! ((amplitudeNumerator > 0.0) && (amplitudeDenominator > 0.0))) {
            return null;
        }

        final double amplitude = amplitudeNumerator / amplitudeDenominator;
        final double sky = (dataSum - (amplitude * kernelSum)) / weightSum;

        // derivative of the marginal with respect to a shift of the source center
        double residualDerivativeSum = 0.0;
        double derivativeSquaredSum = 0.0;
        for (int i = 0; i < size; i++) {
            final double derivative = kernelMarginal[i] * (i - radius) / sigmaSquared;
            final double residual = dataMarginal[i] - sky - (amplitude * kernelMarginal[i]);
            residualDerivativeSum += triangle[i] * residual * derivative;
            derivativeSquaredSum += triangle[i] * derivative * derivative;
        }

        final double halfSize = size / 2.0;
        double shift = residualDerivativeSum / (amplitude * derivativeSquaredSum);

        if (! (Math.abs(shift) <= halfSize)) {
            // fall back to the first moment of the marginal
            double momentSum = 0.0;
            for (int i = 0; i < size; i++) {
                momentSum += triangle[i] * dataMarginal[i] * (i - radius);
            }
            shift = (dataSum == 0.0) ? 0.0 : momentSum / dataSum;
            if (! (Math.abs(shift) <= halfSize)) {
                shift = 0.0;
            }
        }

        return new MarginalFit(amplitude, shift);
    }

    private static class MarginalFit {

        private final double amplitude;
        private final double shift;

        MarginalFit(final double amplitude,
                    final double shift) {
            this.amplitude = amplitude;
            this.shift = shift;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(StarFinder.class);
}
