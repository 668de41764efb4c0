package com.phillippitts.bes3t.exception;

/**
 * Thrown when a descriptor lacks the fields needed to describe a payload
 * (for example a missing or non-positive {@code XPTS}).
 */
public class InvalidDescriptorException extends Bes3tException {

    private final String field;

    public InvalidDescriptorException(String field, String message) {
        super("Invalid descriptor field " + field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
