package org.janelia.stars;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.janelia.stars.composite.AlphaCompositor;
import org.janelia.stars.detect.StarCandidate;
import org.janelia.stars.error.EmptyInputException;
import org.janelia.stars.error.InvalidParameterException;
import org.janelia.stars.error.ShapeMismatchException;
import org.janelia.stars.filter.Erosion;
import org.janelia.stars.image.LuminanceProjection;
import org.janelia.stars.image.SampleArray;
import org.janelia.stars.mask.StarMaskParameters;
import org.janelia.stars.stats.BackgroundStatistics;
import org.janelia.stars.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces the apparent size and brightness of stars in an image.
 * <p>
 * Stars are detected in the luminance of the raw source, a disk is masked around each one,
 * and the mask is smoothed into alpha weights for blending an eroded copy of the display source
 * over the display source itself. Extended structure away from stars is left untouched.
 * <p>
 * Detection and erosion do not depend upon each other.
 * When the reducer has an executor, erosion is submitted to it while detection runs on the calling thread.
 */
public class StarReducer {

    private final ExecutorService executorService;

    /**
     * Constructs a reducer that runs every stage on the calling thread.
     */
    public StarReducer() {
        this(null);
    }

    /**
     * @param  executorService  executor for the erosion stage (or null to run it on the calling thread).
     *                          The executor is not shut down by this reducer.
     */
    public StarReducer(final ExecutorService executorService) {
        this.executorService = executorService;
    }

    /**
     * @param  rawLuminanceSource       source used for detection (any intensity range).
     * @param  normalizedDisplaySource  [0,1] source that is eroded and composited.
     * @param  parameters               reduction parameters.
     *
     * @return result of the reduction.
     *
     * @throws InvalidParameterException
     *   if any parameter is out of range.
     *
     * @throws ShapeMismatchException
     *   if the sources do not have the same width and height.
     *
     * @throws EmptyInputException
     *   if the raw source has no finite samples.
     */
    public StarReductionResult reduceStars(final SampleArray rawLuminanceSource,
                                           final SampleArray normalizedDisplaySource,
                                           final StarReductionParameters parameters)
            throws InvalidParameterException, ShapeMismatchException, EmptyInputException {

        parameters.validate();

        if (! rawLuminanceSource.hasSameSpatialShape(normalizedDisplaySource)) {
            throw new ShapeMismatchException("raw source " + rawLuminanceSource.getShapeString() +
                                             " and display source " + normalizedDisplaySource.getShapeString() +
                                             " differ in size");
        }

        LOG.debug("reduceStars: entry, raw={}, display={}, parameters={}",
                  rawLuminanceSource, normalizedDisplaySource, parameters);

        final ProcessTimer timer = new ProcessTimer();
        final Erosion erosion = parameters.erosion.buildErosion();

        Future<SampleArray> erodedFuture = null;
        SampleArray erodedImage = null;
        if (executorService == null) {
            erodedImage = erosion.erode(normalizedDisplaySource);
            timer.lap("erode");
        } else {
            erodedFuture = executorService.submit(() -> erosion.erode(normalizedDisplaySource));
        }

        final BackgroundStatistics statistics;
        final List<StarCandidate> stars;
        final ByteProcessor binaryMask;
        try {

            final FloatProcessor luminance = LuminanceProjection.project(rawLuminanceSource,
                                                                         parameters.luminancePolicy);
            statistics = parameters.detection.buildStatistics().compute(luminance);
            stars = parameters.detection.buildStarFinder().find(luminance, statistics);
            binaryMask = parameters.mask.buildRasterizer().rasterize(stars,
                                                                     luminance.getWidth(),
                                                                     luminance.getHeight());
            timer.lap("detect");

        } catch (final RuntimeException | Error e) {
            if (erodedFuture != null) {
                erodedFuture.cancel(true);
            }
            throw e;
        }

        if (erodedImage == null) {
            erodedImage = waitForErosion(erodedFuture);
            timer.lap("erode");
        }

        final FloatProcessor alphaMask;
        if (parameters.mask.maskSource == StarMaskParameters.MaskSource.DIFFERENCE) {
            alphaMask = parameters.mask.buildDifferenceMaskBuilder(parameters.luminancePolicy)
                    .build(normalizedDisplaySource, erodedImage);
        } else {
            alphaMask = parameters.mask.buildSmoother().smooth(binaryMask);
        }
        timer.lap("smooth");

        final SampleArray finalImage = AlphaCompositor.composite(normalizedDisplaySource, erodedImage, alphaMask);
        timer.lap("composite");

        LOG.info("reduceStars: found {} stars in {} image, background={}, processing took {}",
                 stars.size(), normalizedDisplaySource.getShapeString(), statistics, timer);

        return new StarReductionResult(finalImage, alphaMask, binaryMask, erodedImage, stars, statistics);
    }

    private static SampleArray waitForErosion(final Future<SampleArray> erodedFuture) {
        try {
            return erodedFuture.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            erodedFuture.cancel(true);
            throw new IllegalStateException("interrupted while waiting for erosion", e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("erosion failed", cause);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(StarReducer.class);
}
