package org.cargo.exceptions;

/**
 * <p/>
 * Class CargoException.
 * <p/>
 * This exception is for errors that are beyond the user's control, i.e. a broken internal invariant.
 */
public class CargoException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public CargoException(final String msg) {
        super(msg);
    }

    public CargoException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    /**
     * A draw or derived quantity was observed in a state that correct arithmetic cannot produce.
     */
    public static class InternalConsistency extends CargoException {
        private static final long serialVersionUID = 0L;

        public InternalConsistency(final String msg) {
            super(msg);
        }
    }
}
