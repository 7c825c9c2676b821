package org.janelia.stars.detect;

import java.io.Serializable;

/**
 * Point source found by a {@link StarFinder}.
 * Coordinates are in pixel units with pixel centers at integer positions.
 */
public class StarCandidate
        implements Serializable {

    private final double x;
    private final double y;
    private final double flux;
    private final double convolvedPeak;
    private final double sharpness;
    private final double roundness1;
    private final double roundness2;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private StarCandidate() {
        this(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }

    public StarCandidate(final double x,
                         final double y,
                         final double flux,
                         final double convolvedPeak,
                         final double sharpness,
                         final double roundness1,
                         final double roundness2) {
        this.x = x;
        this.y = y;
        this.flux = flux;
        this.convolvedPeak = convolvedPeak;
        this.sharpness = sharpness;
        this.roundness1 = roundness1;
        this.roundness2 = roundness2;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    /**
     * @return peak amplitude above background.
     */
    public double getFlux() {
        return flux;
    }

    /**
     * @return peak of the matched-filter image (fitted amplitude of the point spread profile).
     */
    public double getConvolvedPeak() {
        return convolvedPeak;
    }

    public double getSharpness() {
        return sharpness;
    }

    /**
     * @return symmetry based roundness (0 for a round source).
     */
    public double getRoundness1() {
        return roundness1;
    }

    /**
     * @return marginal fit based roundness (0 for a round source).
     */
    public double getRoundness2() {
        return roundness2;
    }

    public int getRoundedX() {
        return (int) Math.round(x);
    }

    public int getRoundedY() {
        return (int) Math.round(y);
    }

    @Override
    public String toString() {
        return "{x: " + x + ", y: " + y + ", flux: " + flux + ", sharpness: " + sharpness +
               ", roundness1: " + roundness1 + ", roundness2: " + roundness2 + '}';
    }
}
