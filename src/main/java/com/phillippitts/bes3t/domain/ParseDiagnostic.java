package com.phillippitts.bes3t.domain;

import java.util.Objects;

/**
 * One recoverable anomaly met while decoding an archive.
 *
 * <p>Returned with every {@link ParseResult} so callers can surface decoder notes (for
 * example as import-job logs) without hooking into the logging backend.
 *
 * @param entryName archive entry the note refers to
 * @param kind      category of the anomaly
 * @param message   human-readable detail
 */
public record ParseDiagnostic(String entryName, Kind kind, String message) {

    public enum Kind {
        /** Descriptor has no paired data file; pair skipped. */
        MISSING_DATA_FILE,
        /** Declared layout disagrees with the payload length; pair skipped. */
        SIZE_MISMATCH,
        /** Descriptor cannot describe any payload; pair skipped. */
        INVALID_DESCRIPTOR,
        /** Quad-interleaved fast path failed; standard decoding used instead. */
        FAST_PATH_FALLBACK,
        /** Declared byte order produced implausible magnitudes and was reversed. */
        ENDIAN_SWAPPED,
        /** Noisy redundant channels were discarded. */
        CHANNELS_DROPPED,
        /** Unexpected failure; pair skipped. */
        PAIR_FAILED;

        /** True when the pair produced no spectra because of this anomaly. */
        public boolean skipsPair() {
            return this == MISSING_DATA_FILE || this == SIZE_MISMATCH
                    || this == INVALID_DESCRIPTOR || this == PAIR_FAILED;
        }
    }

    public ParseDiagnostic {
        Objects.requireNonNull(entryName, "Entry name must not be null");
        Objects.requireNonNull(kind, "Kind must not be null");
        Objects.requireNonNull(message, "Message must not be null");
    }
}
