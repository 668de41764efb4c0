package com.phillippitts.bes3t.exception;

/**
 * Thrown when the byte length implied by a descriptor differs from the actual data file length.
 */
public class LayoutMismatchException extends Bes3tException {

    private final long expectedBytes;
    private final long actualBytes;

    public LayoutMismatchException(long expectedBytes, long actualBytes) {
        super("Size mismatch: expected " + expectedBytes + " bytes, got " + actualBytes);
        this.expectedBytes = expectedBytes;
        this.actualBytes = actualBytes;
    }

    public long getExpectedBytes() {
        return expectedBytes;
    }

    public long getActualBytes() {
        return actualBytes;
    }
}
