package com.phillippitts.bes3t.exception;

/**
 * Base exception for all decoder-specific errors.
 * All domain exceptions extend this class so callers can handle decoder failures uniformly.
 */
public class Bes3tException extends RuntimeException {

    public Bes3tException(String message) {
        super(message);
    }

    public Bes3tException(String message, Throwable cause) {
        super(message, cause);
    }

    public Bes3tException(Throwable cause) {
        super(cause);
    }
}
