package com.phillippitts.bes3t.service.decode;

import java.util.List;
import java.util.Objects;

/**
 * Result of decoding one data file.
 *
 * @param channels         decoded datasets in payload order
 * @param quadInterleaved  whether the quad-interleaved fast path produced {@code channels}
 * @param fastPathFailure  why the fast path was abandoned, or null if it was not attempted or succeeded
 */
public record DecodeOutcome(List<DecodedChannel> channels, boolean quadInterleaved, String fastPathFailure) {

    public DecodeOutcome {
        channels = List.copyOf(Objects.requireNonNull(channels, "Channels must not be null"));
    }

    public boolean fastPathFailed() {
        return fastPathFailure != null;
    }
}
