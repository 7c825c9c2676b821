package org.janelia.stars.error;

/**
 * Thrown when a zero-sized array (or one without any finite samples) is passed
 * to a stage that needs data to work with.
 */
public class EmptyInputException
        extends IllegalArgumentException {

    public EmptyInputException(final String message) {
        super(message);
    }

}
