package com.phillippitts.bes3t.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Caller-side bounds on archive imports ({@code decoder.import.*}).
 */
@Validated
@ConfigurationProperties(prefix = "decoder.import")
public class ImportProperties {

    static final long DEFAULT_MAX_ARCHIVE_SIZE_BYTES = 256L * 1024 * 1024;
    static final long DEFAULT_MAX_ENTRY_SIZE_BYTES = 128L * 1024 * 1024;

    /** Largest archive buffer accepted (security cap). */
    @Positive
    private final long maxArchiveSizeBytes;

    /** Largest single decompressed entry. */
    @Positive
    private final long maxEntrySizeBytes;

    @ConstructorBinding
    public ImportProperties(Long maxArchiveSizeBytes, Long maxEntrySizeBytes) {
        this.maxArchiveSizeBytes = maxArchiveSizeBytes == null ? DEFAULT_MAX_ARCHIVE_SIZE_BYTES : maxArchiveSizeBytes;
        this.maxEntrySizeBytes = maxEntrySizeBytes == null ? DEFAULT_MAX_ENTRY_SIZE_BYTES : maxEntrySizeBytes;
    }

    public long getMaxArchiveSizeBytes() {
        return maxArchiveSizeBytes;
    }

    public long getMaxEntrySizeBytes() {
        return maxEntrySizeBytes;
    }
}
