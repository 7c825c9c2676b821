package org.janelia.stars.detect;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.stars.error.InvalidParameterException;
import org.janelia.stars.stats.SigmaClippedStatistics;

/**
 * Parameters for background estimation and star detection.
 */
public class StarDetectionParameters
        implements Serializable {

    public StarDetectionParameters() {
        setDefaults();
    }

    @Parameter(
            names = "--fwhm",
            description = "Expected full width at half maximum of stars (in pixels)"
    )
    public Double fwhm;

    @Parameter(
            names = "--thresholdSigma",
            description = "Number of background standard deviations a star's peak must exceed"
    )
    public Double thresholdSigma;

    @Parameter(
            names = "--clipSigma",
            description = "Clip level (in standard deviations) for background statistics"
    )
    public Double clipSigma;

    @Parameter(
            names = "--maxClipIterations",
            description = "Maximum number of sigma clipping passes for background statistics"
    )
    public Integer maxClipIterations;

    @Parameter(
            names = "--sigmaRadius",
            description = "Radius of the detection kernel footprint in Gaussian standard deviations"
    )
    public Double sigmaRadius;

    @Parameter(
            names = "--sharpLo",
            description = "Exclusive lower bound on star sharpness"
    )
    public Double sharpLo;

    @Parameter(
            names = "--sharpHi",
            description = "Exclusive upper bound on star sharpness"
    )
    public Double sharpHi;

    @Parameter(
            names = "--roundLo",
            description = "Exclusive lower bound on star roundness"
    )
    public Double roundLo;

    @Parameter(
            names = "--roundHi",
            description = "Exclusive upper bound on star roundness"
    )
    public Double roundHi;

    @Parameter(
            names = "--brightest",
            description = "Only keep this many of the brightest stars (0 keeps all)"
    )
    public Integer brightest;

    @Parameter(
            names = "--excludeBorder",
            description = "Skip stars closer to the image edge than the detection kernel radius",
            arity = 0
    )
    public boolean excludeBorder = false;

    @Parameter(
            names = "--maxCandidates",
            description = "Maximum number of local maxima to examine"
    )
    public Integer maxCandidates;

    void setDefaults() {
        if (fwhm == null) {
            fwhm = 3.0;
        }
        if (thresholdSigma == null) {
            thresholdSigma = 5.5;
        }
        if (clipSigma == null) {
            clipSigma = SigmaClippedStatistics.DEFAULT_CLIP_SIGMA;
        }
        if (maxClipIterations == null) {
            maxClipIterations = SigmaClippedStatistics.DEFAULT_MAX_ITERATIONS;
        }
        if (sigmaRadius == null) {
            sigmaRadius = StarFinder.DEFAULT_SIGMA_RADIUS;
        }
        if (sharpLo == null) {
            sharpLo = StarFinder.DEFAULT_SHARP_LO;
        }
        if (sharpHi == null) {
            sharpHi = StarFinder.DEFAULT_SHARP_HI;
        }
        if (roundLo == null) {
            roundLo = StarFinder.DEFAULT_ROUND_LO;
        }
        if (roundHi == null) {
            roundHi = StarFinder.DEFAULT_ROUND_HI;
        }
        if (brightest == null) {
            brightest = 0;
        }
        if (maxCandidates == null) {
            maxCandidates = StarFinder.DEFAULT_MAX_CANDIDATES;
        }
    }

    public void validate()
            throws InvalidParameterException {
        InvalidParameterException.requireSpecified("fwhm", fwhm);
        InvalidParameterException.requireSpecified("thresholdSigma", thresholdSigma);
        InvalidParameterException.requireSpecified("clipSigma", clipSigma);
        InvalidParameterException.requireSpecified("maxClipIterations", maxClipIterations);
        InvalidParameterException.requireSpecified("sigmaRadius", sigmaRadius);
        InvalidParameterException.requireSpecified("sharpLo", sharpLo);
        InvalidParameterException.requireSpecified("sharpHi", sharpHi);
        InvalidParameterException.requireSpecified("roundLo", roundLo);
        InvalidParameterException.requireSpecified("roundHi", roundHi);
        InvalidParameterException.requireSpecified("brightest", brightest);
        InvalidParameterException.requireSpecified("maxCandidates", maxCandidates);
        buildStatistics();
        buildStarFinder();
    }

    public SigmaClippedStatistics buildStatistics() {
        return new SigmaClippedStatistics(clipSigma, maxClipIterations);
    }

    public StarFinder buildStarFinder() {
        return new StarFinder(new StarFinderKernel(fwhm, sigmaRadius),
                              thresholdSigma,
                              sharpLo,
                              sharpHi,
                              roundLo,
                              roundHi,
                              brightest,
                              excludeBorder,
                              maxCandidates);
    }

}
