package org.janelia.stars.mask;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.stars.error.InvalidParameterException;
import org.janelia.stars.image.LuminanceProjection;

/**
 * Parameters for building the binary star mask and the alpha mask derived from it.
 */
public class StarMaskParameters
        implements Serializable {

    public enum MaskSource {
        /** Alpha mask is the smoothed disk mask of detected stars. */
        STARS,
        /** Alpha mask is derived from the difference between the original and eroded images. */
        DIFFERENCE
    }

    public StarMaskParameters() {
        setDefaults();
    }

    @Parameter(
            names = "--maskRadius",
            description = "Radius (in pixels) of the disk masked around each star"
    )
    public Double maskRadius;

    @Parameter(
            names = "--smoothSigma",
            description = "Standard deviation (in pixels) of the Gaussian blur applied to the mask"
    )
    public Double smoothSigma;

    @Parameter(
            names = "--smoothThreshold",
            description = "Blurred mask values not above this threshold are set to 0"
    )
    public Double smoothThreshold;

    @Parameter(
            names = "--secondPassSigma",
            description = "Standard deviation of an additional blur applied after thresholding (0 disables it)"
    )
    public Double secondPassSigma;

    @Parameter(
            names = "--maskSource",
            description = "Source of the alpha mask"
    )
    public MaskSource maskSource;

    @Parameter(
            names = "--differenceSecondPassSigma",
            description = "Standard deviation of the blur applied after thresholding a DIFFERENCE mask (0 disables it)"
    )
    public Double differenceSecondPassSigma;

    void setDefaults() {
        if (maskRadius == null) {
            maskRadius = 3.5;
        }
        if (smoothSigma == null) {
            smoothSigma = 2.0;
        }
        if (smoothThreshold == null) {
            smoothThreshold = 0.1;
        }
        if (secondPassSigma == null) {
            secondPassSigma = 0.0;
        }
        if (maskSource == null) {
            maskSource = MaskSource.STARS;
        }
        if (differenceSecondPassSigma == null) {
            differenceSecondPassSigma = 2.0;
        }
    }

    public void validate()
            throws InvalidParameterException {
        InvalidParameterException.requireSpecified("maskRadius", maskRadius);
        InvalidParameterException.requireSpecified("smoothSigma", smoothSigma);
        InvalidParameterException.requireSpecified("smoothThreshold", smoothThreshold);
        InvalidParameterException.requireSpecified("secondPassSigma", secondPassSigma);
        InvalidParameterException.requireSpecified("maskSource", maskSource);
        InvalidParameterException.requireSpecified("differenceSecondPassSigma", differenceSecondPassSigma);
        buildRasterizer();
        buildSmoother();
        buildDifferenceMaskBuilder(LuminanceProjection.Policy.CHANNEL_MEAN);
    }

    public StarMaskRasterizer buildRasterizer() {
        return new StarMaskRasterizer(maskRadius);
    }

    public MaskSmoother buildSmoother() {
        return new MaskSmoother(smoothSigma, smoothThreshold, secondPassSigma);
    }

    public DifferenceMaskBuilder buildDifferenceMaskBuilder(final LuminanceProjection.Policy luminancePolicy) {
        return new DifferenceMaskBuilder(smoothSigma, smoothThreshold, differenceSecondPassSigma, luminancePolicy);
    }

}
