package com.phillippitts.bes3t.service.layout;

import java.nio.ByteBuffer;
import java.util.Locale;

/**
 * Numeric element encodings a BES3T data file can declare through {@code IRFMT}.
 */
public enum ElementType {

    /** {@code F}: IEEE 754 single precision. */
    FLOAT32(4),
    /** {@code D}: IEEE 754 double precision. */
    FLOAT64(8),
    /** {@code I}: two's-complement 32-bit integer. */
    INT32(4);

    private final int size;

    ElementType(int size) {
        this.size = size;
    }

    /** Element size in bytes. */
    public int size() {
        return size;
    }

    /**
     * Reads the next element from {@code buffer} (using the buffer's byte order) as a double.
     */
    public double read(ByteBuffer buffer) {
        return switch (this) {
            case FLOAT32 -> buffer.getFloat();
            case FLOAT64 -> buffer.getDouble();
            case INT32 -> buffer.getInt();
        };
    }

    /**
     * Maps an {@code IRFMT} entry to an element type. {@code D} selects double precision,
     * {@code I} integer; anything else (normally {@code F}) is single precision.
     */
    public static ElementType fromFormatCode(String code) {
        String upper = code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
        if (upper.contains("D")) {
            return FLOAT64;
        }
        if (upper.contains("I")) {
            return INT32;
        }
        return FLOAT32;
    }
}
