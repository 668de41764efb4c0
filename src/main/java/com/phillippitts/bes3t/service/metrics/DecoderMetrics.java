package com.phillippitts.bes3t.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for archive imports.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code bes3t.import.latency} - time to decode one archive</li>
 *   <li>{@code bes3t.spectra.parsed} - spectra produced, tagged by {@code type}</li>
 *   <li>{@code bes3t.pairs.skipped} - descriptor/data pairs skipped, tagged by {@code reason}</li>
 *   <li>{@code bes3t.import.failure} - imports rejected as a whole, tagged by {@code reason}</li>
 * </ul>
 */
@Component
public class DecoderMetrics {

    private static final String METRIC_PREFIX = "bes3t";

    private final MeterRegistry registry;

    public DecoderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".import.latency")
                .description("Time taken to decode one archive")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param type  spectrum type label (CW, 2D T1, ...)
     * @param count spectra of that type in one archive
     */
    public void incrementSpectraParsed(String type, int count) {
        Counter.builder(METRIC_PREFIX + ".spectra.parsed")
                .description("Number of spectra decoded")
                .tag("type", type)
                .register(registry)
                .increment(count);
    }

    /**
     * @param reason diagnostic kind that caused the skip (size_mismatch, missing_data_file, ...)
     */
    public void incrementPairsSkipped(String reason) {
        Counter.builder(METRIC_PREFIX + ".pairs.skipped")
                .description("Number of descriptor/data pairs skipped")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".import.failure")
                .description("Number of archives rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
