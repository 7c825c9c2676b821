package org.janelia.stars.filter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.stars.error.InvalidParameterException;

/**
 * Parameters for {@link Erosion}.
 */
public class ErosionParameters
        implements Serializable {

    public ErosionParameters() {
        setDefaults();
    }

    @Parameter(
            names = "--kernelSize",
            description = "Side length (odd, in pixels) of the square erosion kernel"
    )
    public Integer kernelSize;

    @Parameter(
            names = "--erosionIterations",
            description = "Number of erosion passes"
    )
    public Integer erosionIterations;

    @Parameter(
            names = "--erosionQuantize8Bit",
            description = "Quantize samples to 256 levels before eroding",
            arity = 0
    )
    public boolean erosionQuantize8Bit = false;

    void setDefaults() {
        if (kernelSize == null) {
            kernelSize = 3;
        }
        if (erosionIterations == null) {
            erosionIterations = 2;
        }
    }

    public void validate()
            throws InvalidParameterException {
        InvalidParameterException.requireSpecified("kernelSize", kernelSize);
        InvalidParameterException.requireSpecified("erosionIterations", erosionIterations);
        buildErosion();
    }

    public Erosion buildErosion() {
        return new Erosion(kernelSize, erosionIterations, erosionQuantize8Bit);
    }

}
