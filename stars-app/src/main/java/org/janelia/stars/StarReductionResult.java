package org.janelia.stars;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import java.util.Collections;
import java.util.List;

import org.janelia.stars.detect.StarCandidate;
import org.janelia.stars.image.SampleArray;
import org.janelia.stars.stats.BackgroundStatistics;

/**
 * Everything produced by one {@link StarReducer#reduceStars} call.
 * Results may be shared through a cache, so the returned images must not be modified.
 */
public class StarReductionResult {

    private final SampleArray finalImage;
    private final FloatProcessor alphaMask;
    private final ByteProcessor binaryMask;
    private final SampleArray erodedImage;
    private final List<StarCandidate> stars;
    private final BackgroundStatistics backgroundStatistics;

    public StarReductionResult(final SampleArray finalImage,
                               final FloatProcessor alphaMask,
                               final ByteProcessor binaryMask,
                               final SampleArray erodedImage,
                               final List<StarCandidate> stars,
                               final BackgroundStatistics backgroundStatistics) {
        this.finalImage = finalImage;
        this.alphaMask = alphaMask;
        this.binaryMask = binaryMask;
        this.erodedImage = erodedImage;
        this.stars = Collections.unmodifiableList(stars);
        this.backgroundStatistics = backgroundStatistics;
    }

    /**
     * @return display image with stars reduced.
     */
    public SampleArray getFinalImage() {
        return finalImage;
    }

    /**
     * @return [0,1] blend weights of the eroded image.
     */
    public FloatProcessor getAlphaMask() {
        return alphaMask;
    }

    /**
     * @return 0/255 disk mask of detected stars.
     */
    public ByteProcessor getBinaryMask() {
        return binaryMask;
    }

    public SampleArray getErodedImage() {
        return erodedImage;
    }

    public List<StarCandidate> getStars() {
        return stars;
    }

    public int getStarCount() {
        return stars.size();
    }

    public BackgroundStatistics getBackgroundStatistics() {
        return backgroundStatistics;
    }

    @Override
    public String toString() {
        return "{finalImage: " + finalImage +
               ", starCount: " + stars.size() +
               ", backgroundStatistics: " + backgroundStatistics +
               '}';
    }
}
