package org.janelia.stars;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.Serializable;

import org.janelia.stars.detect.StarDetectionParameters;
import org.janelia.stars.error.InvalidParameterException;
import org.janelia.stars.filter.ErosionParameters;
import org.janelia.stars.image.LuminanceProjection;
import org.janelia.stars.json.JsonUtils;
import org.janelia.stars.mask.StarMaskParameters;

/**
 * All parameters for {@link StarReducer#reduceStars}.
 * <p>
 * The same instance can be populated programmatically or parsed from the command line with JCommander.
 */
public class StarReductionParameters
        implements Serializable {

    @ParametersDelegate
    public StarDetectionParameters detection = new StarDetectionParameters();

    @ParametersDelegate
    public ErosionParameters erosion = new ErosionParameters();

    @ParametersDelegate
    public StarMaskParameters mask = new StarMaskParameters();

    @Parameter(
            names = "--luminancePolicy",
            description = "How multi-channel images are reduced to a single plane for detection"
    )
    public LuminanceProjection.Policy luminancePolicy = LuminanceProjection.Policy.CHANNEL_MEAN;

    /**
     * @return parameters with the core values specified and defaults for everything else.
     */
    public static StarReductionParameters build(final double fwhm,
                                                final double thresholdSigma,
                                                final double maskRadius,
                                                final int kernelSize,
                                                final int erosionIterations,
                                                final double smoothSigma,
                                                final double smoothThreshold) {
        final StarReductionParameters parameters = new StarReductionParameters();
        parameters.detection.fwhm = fwhm;
        parameters.detection.thresholdSigma = thresholdSigma;
        parameters.mask.maskRadius = maskRadius;
        parameters.erosion.kernelSize = kernelSize;
        parameters.erosion.erosionIterations = erosionIterations;
        parameters.mask.smoothSigma = smoothSigma;
        parameters.mask.smoothThreshold = smoothThreshold;
        return parameters;
    }

    /**
     * @throws InvalidParameterException
     *   if any parameter is out of range.
     */
    public void validate()
            throws InvalidParameterException {
        InvalidParameterException.requireSpecified("luminancePolicy", luminancePolicy);
        InvalidParameterException.requireSpecified("detection", detection);
        InvalidParameterException.requireSpecified("erosion", erosion);
        InvalidParameterException.requireSpecified("mask", mask);
        detection.validate();
        erosion.validate();
        mask.validate();
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    public static StarReductionParameters fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<StarReductionParameters> JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.FAST_MAPPER, StarReductionParameters.class);
}
