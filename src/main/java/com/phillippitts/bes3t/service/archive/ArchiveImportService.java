package com.phillippitts.bes3t.service.archive;

import com.phillippitts.bes3t.config.properties.ImportProperties;
import com.phillippitts.bes3t.domain.ParseDiagnostic;
import com.phillippitts.bes3t.domain.ParseResult;
import com.phillippitts.bes3t.exception.InvalidArchiveException;
import com.phillippitts.bes3t.service.events.ArchiveParsedEvent;
import com.phillippitts.bes3t.service.events.PairSkippedEvent;
import com.phillippitts.bes3t.service.metrics.DecoderMetricsPublisher;
import com.phillippitts.bes3t.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Caller-facing entry point for archive imports.
 *
 * <p>Wraps {@link ArchiveParser} with the concerns the pure core leaves to its caller:
 * <ul>
 *   <li>bounding the archive size before anything is decompressed</li>
 *   <li>an {@code importId} in the Log4j2 {@link ThreadContext} for the duration of one import</li>
 *   <li>Micrometer metrics via {@link DecoderMetricsPublisher}</li>
 *   <li>{@link ArchiveParsedEvent} and {@link PairSkippedEvent} for listeners</li>
 * </ul>
 */
@Service
public class ArchiveImportService {

    private static final Logger LOG = LogManager.getLogger(ArchiveImportService.class);

    static final String IMPORT_ID_KEY = "importId";

    private final ArchiveParser parser;
    private final ImportProperties properties;
    private final DecoderMetricsPublisher metricsPublisher;
    private final ApplicationEventPublisher publisher;

    public ArchiveImportService(ArchiveParser parser,
                                ImportProperties properties,
                                DecoderMetricsPublisher metricsPublisher,
                                ApplicationEventPublisher publisher) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.metricsPublisher = metricsPublisher == null ? DecoderMetricsPublisher.NOOP : metricsPublisher;
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    /**
     * Decodes an archive held in memory.
     *
     * @throws InvalidArchiveException if the buffer is null, too large or not a readable archive
     */
    public ParseResult importArchive(byte[] archive) {
        String importId = UUID.randomUUID().toString();
        ThreadContext.put(IMPORT_ID_KEY, importId);
        long start = System.nanoTime();
        try {
            checkSize(archive);
            LOG.info("Importing archive ({} bytes)", archive.length);

            ParseResult result = parser.parse(archive);
            long elapsedNanos = System.nanoTime() - start;

            metricsPublisher.recordSuccess(result, elapsedNanos);
            Instant now = Instant.now();
            for (ParseDiagnostic diagnostic : result.diagnostics()) {
                if (diagnostic.kind().skipsPair()) {
                    publisher.publishEvent(new PairSkippedEvent(diagnostic.entryName(), diagnostic.kind(), now));
                }
            }
            long elapsedMs = TimeUtils.nanosToMillis(elapsedNanos);
            publisher.publishEvent(new ArchiveParsedEvent(result.sampleName(), result.spectraCount(),
                    result.skippedPairs(), elapsedMs));
            LOG.info("Imported '{}': {} spectra {} in {} ms", result.sampleName(), result.spectraCount(),
                    result.countsByType(), elapsedMs);
            return result;
        } catch (InvalidArchiveException e) {
            metricsPublisher.recordFailure("invalid_archive");
            LOG.warn("Rejected archive: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metricsPublisher.recordFailure("unexpected_error");
            LOG.error("Archive import failed after {} ms", TimeUtils.elapsedMillis(start), e);
            throw e;
        } finally {
            ThreadContext.remove(IMPORT_ID_KEY);
        }
    }

    /**
     * Reads and decodes an archive from disk. The file size is checked before reading.
     *
     * @throws InvalidArchiveException if the file cannot be read or fails {@link #importArchive(byte[])}
     */
    public ParseResult importArchive(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        byte[] archive;
        try {
            long size = Files.size(path);
            if (size > properties.getMaxArchiveSizeBytes()) {
                metricsPublisher.recordFailure("invalid_archive");
                throw new InvalidArchiveException(size, "exceeds limit of "
                        + properties.getMaxArchiveSizeBytes() + " bytes");
            }
            archive = Files.readAllBytes(path);
        } catch (IOException e) {
            metricsPublisher.recordFailure("invalid_archive");
            throw new InvalidArchiveException("Cannot read archive " + path.getFileName() + ": " + e.getMessage(), e);
        }
        return importArchive(archive);
    }

    private void checkSize(byte[] archive) {
        if (archive == null) {
            throw new InvalidArchiveException("Archive buffer must not be null");
        }
        if (archive.length > properties.getMaxArchiveSizeBytes()) {
            throw new InvalidArchiveException(archive.length, "exceeds limit of "
                    + properties.getMaxArchiveSizeBytes() + " bytes");
        }
    }
}
