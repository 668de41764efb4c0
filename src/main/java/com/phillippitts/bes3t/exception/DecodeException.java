package com.phillippitts.bes3t.exception;

/**
 * Thrown when binary samples cannot be decoded under the attempted layout.
 */
public class DecodeException extends Bes3tException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
