package org.janelia.stars.error;

/**
 * Thrown when arrays that are combined pixel by pixel disagree in spatial shape or channel count.
 */
public class ShapeMismatchException
        extends IllegalArgumentException {

    public ShapeMismatchException(final String message) {
        super(message);
    }

}
