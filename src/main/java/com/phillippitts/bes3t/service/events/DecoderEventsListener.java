package com.phillippitts.bes3t.service.events;

import com.phillippitts.bes3t.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central log sink for import events. Throttled per key to avoid log spam when many
 * archives share the same defect.
 */
@Component
class DecoderEventsListener {
    private static final Logger LOG = LogManager.getLogger(DecoderEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onArchiveParsed(ArchiveParsedEvent e) {
        if (e.spectraCount() == 0 && shouldLog("empty-archive")) {
            LOG.warn("Archive '{}' produced no spectra ({} pair(s) skipped). Check that .DSC/.DTA files are paired.",
                    LogSanitizer.sanitize(e.sampleName()), e.skippedPairs());
        } else {
            LOG.debug("Archive '{}' decoded: spectra={}, skipped={}, elapsedMs={}",
                    LogSanitizer.sanitize(e.sampleName()), e.spectraCount(), e.skippedPairs(), e.elapsedMs());
        }
    }

    @EventListener
    void onPairSkipped(PairSkippedEvent e) {
        String key = "pair-skipped-" + e.kind();
        if (shouldLog(key)) {
            LOG.warn("Skipped descriptor '{}': reason={}", LogSanitizer.sanitize(e.entryName()), e.kind());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
