package com.phillippitts.bes3t.service.metrics;

import com.phillippitts.bes3t.domain.ParseDiagnostic;
import com.phillippitts.bes3t.domain.ParseResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Records import outcomes on {@link DecoderMetrics}.
 *
 * <p>All methods tolerate a missing {@link DecoderMetrics}, so the import service can run
 * without a meter registry.
 *
 * @see DecoderMetrics
 */
@Component
public final class DecoderMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(DecoderMetricsPublisher.class);

    /**
     * No-op instance for callers that do not track metrics.
     */
    public static final DecoderMetricsPublisher NOOP = new DecoderMetricsPublisher(null);

    private final DecoderMetrics metrics;

    /**
     * @param metrics metrics service (nullable)
     */
    public DecoderMetricsPublisher(DecoderMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("DecoderMetricsPublisher created without metrics");
        }
    }

    /**
     * Records latency, spectra per type and skipped pairs for a decoded archive.
     */
    public void recordSuccess(ParseResult result, long durationNanos) {
        if (metrics == null) {
            return;
        }

        metrics.recordLatency(durationNanos);
        for (Map.Entry<String, Integer> e : result.countsByType().entrySet()) {
            metrics.incrementSpectraParsed(e.getKey(), e.getValue());
        }
        for (ParseDiagnostic diagnostic : result.diagnostics()) {
            if (diagnostic.kind().skipsPair()) {
                metrics.incrementPairsSkipped(diagnostic.kind().name().toLowerCase(Locale.ROOT));
            }
        }
    }

    /**
     * @param reason failure category (e.g. "invalid_archive", "unexpected_error")
     */
    public void recordFailure(String reason) {
        if (metrics == null) {
            return;
        }

        metrics.incrementFailure(reason);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
