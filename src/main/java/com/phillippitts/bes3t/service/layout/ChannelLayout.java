package com.phillippitts.bes3t.service.layout;

import java.util.List;
import java.util.Objects;

/**
 * Resolved layout of a whole data file: the datasets in payload order plus the grid size.
 *
 * @param xPoints         samples along the x axis ({@code XPTS})
 * @param yPoints         rows ({@code YPTS}), 1 for a single trace
 * @param channels        datasets packed consecutively in the payload
 * @param complexDeclared whether the descriptor itself lists a {@code CPLX} dataset in {@code IKKF};
 *                        false when complexity only comes from the {@code IKKF} default
 */
public record ChannelLayout(int xPoints, int yPoints, List<ChannelConfig> channels, boolean complexDeclared) {

    public ChannelLayout {
        channels = List.copyOf(Objects.requireNonNull(channels, "Channels must not be null"));
    }

    /**
     * Layout whose complexity is taken as declared exactly when some dataset is complex.
     */
    public ChannelLayout(int xPoints, int yPoints, List<ChannelConfig> channels) {
        this(xPoints, yPoints, channels,
                Objects.requireNonNull(channels, "Channels must not be null").stream().anyMatch(ChannelConfig::complex));
    }

    public int pointCount() {
        return xPoints * yPoints;
    }

    public boolean isTwoDimensional() {
        return yPoints > 1;
    }

    /** Sum of all dataset byte spans. */
    public long totalBytes() {
        return channels.stream().mapToLong(ChannelConfig::byteCount).sum();
    }
}
