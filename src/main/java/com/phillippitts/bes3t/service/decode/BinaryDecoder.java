package com.phillippitts.bes3t.service.decode;

import com.phillippitts.bes3t.exception.DecodeException;
import com.phillippitts.bes3t.service.DecoderSettings;
import com.phillippitts.bes3t.service.layout.ChannelConfig;
import com.phillippitts.bes3t.service.layout.ChannelLayout;
import com.phillippitts.bes3t.service.layout.ElementType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Extracts numeric samples from a BES3T data file.
 *
 * <p>Two paths:
 * <ol>
 *   <li><b>Quad-interleaved fast path</b>: when the payload holds exactly four doubles per
 *       point and {@code IKKF} explicitly lists a complex dataset, the file is read as one
 *       big-endian double array of {@code [R1, I1, R2, I2]} quadruplets and only the first channel's pair is kept (values
 *       at offsets 0 and 2 of each quadruplet). Values are taken as read, without byte-order
 *       repair. Only a failed read falls through to the standard path.</li>
 *   <li><b>Standard path</b>: each dataset is sliced in declared order and decoded with its own
 *       element type, then repaired by magnitude-based byte-order recovery, interleaved-versus-block
 *       resolution for complex data, truncation to the point count, and zeroing of a noisy
 *       imaginary part next to a clean real part.</li>
 * </ol>
 *
 * <p>Stateless apart from its settings; safe to share between threads.
 */
public final class BinaryDecoder {

    private static final Logger LOG = LogManager.getLogger(BinaryDecoder.class);

    private static final int QUAD = 4;

    private final DecoderSettings settings;

    public BinaryDecoder(DecoderSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Decodes {@code payload} according to {@code layout}. The layout must already account for
     * exactly {@code payload.length} bytes.
     */
    public DecodeOutcome decode(byte[] payload, ChannelLayout layout) {
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(layout, "layout must not be null");

        String fastPathFailure = null;
        if (isQuadInterleaved(payload, layout)) {
            try {
                DecodedChannel merged = decodeQuadInterleaved(payload, layout.pointCount());
                LOG.info("Detected quad-interleaved data ({} values/point), decoded as one spectrum", QUAD);
                return new DecodeOutcome(List.of(merged), true, null);
            } catch (RuntimeException e) {
                fastPathFailure = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                LOG.warn("Quad-interleave decode failed: {}. Falling back to standard decoding.", fastPathFailure);
            }
        }

        List<DecodedChannel> channels = new ArrayList<>(layout.channels().size());
        int offset = 0;
        for (int i = 0; i < layout.channels().size(); i++) {
            ChannelConfig config = layout.channels().get(i);
            int length = Math.toIntExact(config.byteCount());
            channels.add(decodeChannel(i, payload, offset, length, config, layout.xPoints()));
            offset += length;
        }
        return new DecodeOutcome(channels, false, fastPathFailure);
    }

    boolean isQuadInterleaved(byte[] payload, ChannelLayout layout) {
        return settings.quadInterleaveEnabled()
                && layout.complexDeclared()
                && payload.length / Double.BYTES == (long) QUAD * layout.pointCount();
    }

    /**
     * @throws DecodeException if the payload is too short for {@code pointCount} quadruplets
     */
    DecodedChannel decodeQuadInterleaved(byte[] payload, int pointCount) {
        long required = (long) QUAD * pointCount * Double.BYTES;
        if (payload.length < required) {
            throw new DecodeException("Payload of " + payload.length + " bytes is shorter than "
                    + required + " bytes required for " + pointCount + " quad-interleaved points");
        }
        ByteBuffer buffer = ByteBuffer.wrap(payload).order(ByteOrder.BIG_ENDIAN);
        double[] real = new double[pointCount];
        double[] imag = new double[pointCount];
        for (int i = 0; i < pointCount; i++) {
            int base = i * QUAD * Double.BYTES;
            real[i] = buffer.getDouble(base);
            imag[i] = buffer.getDouble(base + 2 * Double.BYTES);
        }

        double score = SignalStatistics.smoothness(real, settings.smoothnessWindow());
        return new DecodedChannel(0, real, imag, score, false, false, false);
    }

    DecodedChannel decodeChannel(int index, byte[] payload, int offset, int length,
                                 ChannelConfig config, int xPoints) {
        double[] values = readValues(payload, offset, length, config.elementType(), config.byteOrder());

        boolean swapped = false;
        if (values.length > 0) {
            double magnitude = SignalStatistics.maxAbs(values);
            if (!SignalStatistics.isPlausibleMagnitude(magnitude, settings.endianMagnitudeLimit())) {
                ByteOrder other = opposite(config.byteOrder());
                double[] reversed = readValues(payload, offset, length, config.elementType(), other);
                double reversedMagnitude = SignalStatistics.maxAbs(reversed);
                if (prefer(reversedMagnitude, magnitude)) {
                    LOG.warn("Ch{}: suspicious values (max={}), decoding as {} instead",
                            index + 1, String.format("%.2e", magnitude), other);
                    values = reversed;
                    swapped = true;
                }
            }
        }

        double[] real;
        double[] imag;
        boolean block = false;
        if (config.complex() && values.length >= 2L * xPoints) {
            double[] realInterleaved = stride(values, 0, 2);
            double[] imagInterleaved = stride(values, 1, 2);
            int mid = values.length / 2;
            double[] realBlock = Arrays.copyOfRange(values, 0, mid);
            double[] imagBlock = Arrays.copyOfRange(values, mid, values.length);

            double interleavedScore = SignalStatistics.smoothness(realInterleaved, settings.smoothnessWindow());
            double blockScore = SignalStatistics.smoothness(realBlock, settings.smoothnessWindow());
            block = blockScore < interleavedScore
                    && blockScore <= settings.blockPreferenceRatio() * interleavedScore;
            LOG.debug("Ch{}: smoothness interleaved={}, block={} -> {}", index + 1,
                    interleavedScore, blockScore, block ? "block" : "interleaved");

            real = block ? realBlock : realInterleaved;
            imag = block ? imagBlock : imagInterleaved;
        } else {
            real = values;
            imag = new double[values.length];
        }

        int pointCount = config.pointCount();
        if (real.length > pointCount) {
            real = Arrays.copyOf(real, pointCount);
        }
        if (imag.length > pointCount) {
            imag = Arrays.copyOf(imag, pointCount);
        }

        double realScore = SignalStatistics.smoothness(real, settings.smoothnessWindow());
        double imagScore = SignalStatistics.smoothness(imag, settings.smoothnessWindow());
        boolean cleared = false;
        if (realScore < settings.cleanRealThreshold() && imagScore > settings.noisyImagThreshold()) {
            imag = new double[real.length];
            cleared = true;
        }

        return new DecodedChannel(index, real, imag, realScore, swapped, block, cleared);
    }

    /**
     * Decodes {@code length} bytes starting at {@code offset} into doubles.
     */
    static double[] readValues(byte[] payload, int offset, int length, ElementType type, ByteOrder order) {
        ByteBuffer buffer = ByteBuffer.wrap(payload, offset, length).slice().order(order);
        double[] values = new double[length / type.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = type.read(buffer);
        }
        return values;
    }

    static ByteOrder opposite(ByteOrder order) {
        return order == ByteOrder.BIG_ENDIAN ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN;
    }

    private boolean prefer(double candidate, double current) {
        if (SignalStatistics.isPlausibleMagnitude(candidate, settings.endianMagnitudeLimit())) {
            return true;
        }
        if (Double.isNaN(current)) {
            return !Double.isNaN(candidate);
        }
        return !Double.isNaN(candidate) && candidate < current;
    }

    private static double[] stride(double[] values, int start, int step) {
        int n = (values.length - start + step - 1) / step;
        double[] out = new double[Math.max(n, 0)];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[start + i * step];
        }
        return out;
    }
}
