package org.cargo.exceptions;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * For errors caused by bad input from the caller: distribution parameters, trial counts and samples
 * that the distribution cannot accept.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    /**
     * Thrown when a distribution cannot be built from the supplied parameter vector.
     */
    public static class InvalidParameter extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidParameter(final String message) {
            super(String.format("Invalid distribution parameter: %s", message));
        }
    }

    public static class InvalidArgument extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidArgument(final String argumentName, final String value, final String reason) {
            super(String.format("Invalid argument value '%s' for %s: %s", value, argumentName, reason));
        }
    }

    public static class DimensionMismatch extends UserException {
        private static final long serialVersionUID = 0L;

        public DimensionMismatch(final int expected, final int actual) {
            super(String.format("Dimension mismatch: expected a vector of length %d but got one of length %d.",
                    expected, actual));
        }
    }
}
