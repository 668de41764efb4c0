package com.phillippitts.bes3t.service.quality;

import com.phillippitts.bes3t.service.decode.DecodedChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Discards noise-like channels when one descriptor yields several.
 *
 * <p>A channel is clean when its real-component smoothness score is below the threshold.
 * Channels are dropped only if at least one is clean and at least one is not; a single
 * channel, an all-clean set and an all-noisy set pass through unchanged.
 */
public final class QualityFilter {

    private static final Logger LOG = LogManager.getLogger(QualityFilter.class);

    private final double threshold;

    public QualityFilter(double threshold) {
        if (!(threshold > 0.0)) {
            throw new IllegalArgumentException("threshold must be > 0");
        }
        this.threshold = threshold;
    }

    public List<DecodedChannel> filter(List<DecodedChannel> channels) {
        Objects.requireNonNull(channels, "channels must not be null");
        if (channels.size() <= 1) {
            return channels;
        }
        List<DecodedChannel> clean = channels.stream()
                .filter(this::isClean)
                .collect(Collectors.toList());
        if (clean.isEmpty() || clean.size() == channels.size()) {
            return channels;
        }
        LOG.info("Dropped {} noisy channel(s) of {}", channels.size() - clean.size(), channels.size());
        return List.copyOf(clean);
    }

    public boolean isClean(DecodedChannel channel) {
        return channel.realScore() < threshold;
    }

    public double threshold() {
        return threshold;
    }
}
