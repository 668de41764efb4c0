package com.phillippitts.bes3t.service.layout;

import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Binary layout of one dataset (channel) inside a data file.
 *
 * @param complex     whether each point carries a real and an imaginary value
 * @param elementType numeric encoding of each value
 * @param byteOrder   declared byte order
 * @param byteCount   bytes occupied by this dataset in the payload
 * @param pointCount  logical points ({@code XPTS * YPTS})
 */
public record ChannelConfig(
        boolean complex,
        ElementType elementType,
        ByteOrder byteOrder,
        long byteCount,
        int pointCount
) {

    public ChannelConfig {
        Objects.requireNonNull(elementType, "Element type must not be null");
        Objects.requireNonNull(byteOrder, "Byte order must not be null");
        if (byteCount < 0) {
            throw new IllegalArgumentException("Byte count must not be negative, got: " + byteCount);
        }
    }
}
