package org.janelia.stars.error;

/**
 * Thrown when a processing parameter is out of its valid range
 * (e.g. a non-positive radius or an even kernel size).
 */
public class InvalidParameterException
        extends IllegalArgumentException {

    public InvalidParameterException(final String message) {
        super(message);
    }

    /**
     * @throws InvalidParameterException
     *   if the specified value is null.
     */
    public static void requireSpecified(final String parameterName,
                                        final Object value)
            throws InvalidParameterException {
        if (value == null) {
            throw new InvalidParameterException("'" + parameterName + "' must be specified");
        }
    }

    /**
     * @throws InvalidParameterException
     *   if the specified value is not a finite number greater than zero.
     */
    public static void requirePositive(final String parameterName,
                                       final double value)
            throws InvalidParameterException {
        if (! (Double.isFinite(value) && (value > 0))) {
            throw new InvalidParameterException("'" + parameterName + "' must be positive but was " + value);
        }
    }

    /**
     * @throws InvalidParameterException
     *   if the specified value is less than the specified minimum.
     */
    public static void requireAtLeast(final String parameterName,
                                      final int value,
                                      final int minimumValue)
            throws InvalidParameterException {
        if (value < minimumValue) {
            throw new InvalidParameterException("'" + parameterName + "' must be at least " + minimumValue +
                                                " but was " + value);
        }
    }

}
