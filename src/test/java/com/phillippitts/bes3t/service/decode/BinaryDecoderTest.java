package com.phillippitts.bes3t.service.decode;

import com.phillippitts.bes3t.exception.DecodeException;
import com.phillippitts.bes3t.service.DecoderSettings;
import com.phillippitts.bes3t.service.layout.ChannelConfig;
import com.phillippitts.bes3t.service.layout.ChannelLayout;
import com.phillippitts.bes3t.service.layout.ElementType;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;
import java.util.List;

import static com.phillippitts.bes3t.testutil.ArchiveFixtures.doubles;
import static com.phillippitts.bes3t.testutil.ArchiveFixtures.floats;
import static com.phillippitts.bes3t.testutil.ArchiveFixtures.ints;
import static com.phillippitts.bes3t.testutil.ArchiveFixtures.smoothComplexFloats;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BinaryDecoderTest {

    private final BinaryDecoder decoder = new BinaryDecoder(DecoderSettings.defaults());

    private static ChannelLayout layout(int xpts, ChannelConfig... channels) {
        return new ChannelLayout(xpts, 1, List.of(channels));
    }

    private static ChannelConfig config(boolean complex, ElementType type, ByteOrder order, int points) {
        return new ChannelConfig(complex, type, order, (long) points * (complex ? 2 : 1) * type.size(), points);
    }

    @Test
    void decodesRealFloatsInDeclaredOrder() {
        byte[] payload = floats(ByteOrder.BIG_ENDIAN, 1.5f, -2f, 3f);

        DecodeOutcome out = decoder.decode(payload,
                layout(3, config(false, ElementType.FLOAT32, ByteOrder.BIG_ENDIAN, 3)));

        DecodedChannel ch = out.channels().get(0);
        assertThat(ch.real()).containsExactly(1.5, -2.0, 3.0);
        assertThat(ch.imag()).containsExactly(0, 0, 0);
        assertThat(ch.byteOrderSwapped()).isFalse();
        assertThat(out.quadInterleaved()).isFalse();
    }

    @Test
    void decodesIntegersAndDoubles() {
        DecodeOutcome ints = decoder.decode(ints(ByteOrder.LITTLE_ENDIAN, 7, -3),
                layout(2, config(false, ElementType.INT32, ByteOrder.LITTLE_ENDIAN, 2)));
        DecodeOutcome dbl = decoder.decode(doubles(ByteOrder.BIG_ENDIAN, 0.25, 0.5),
                layout(2, config(false, ElementType.FLOAT64, ByteOrder.BIG_ENDIAN, 2)));

        assertThat(ints.channels().get(0).real()).containsExactly(7, -3);
        assertThat(dbl.channels().get(0).real()).containsExactly(0.25, 0.5);
    }

    @Test
    void recoversFromWrongDeclaredByteOrder() {
        int n = 16;
        float[] values = new float[n];
        for (int i = 0; i < n; i++) {
            // low byte 0x70 becomes the exponent byte when read the other way round
            values[i] = Float.intBitsToFloat(0x40000070 + (i << 8));
        }
        byte[] payload = floats(ByteOrder.LITTLE_ENDIAN, values);
        assertThat(Math.abs(BinaryDecoder.readValues(payload, 0, payload.length,
                ElementType.FLOAT32, ByteOrder.BIG_ENDIAN)[0])).isGreaterThan(1e20);

        DecodeOutcome out = decoder.decode(payload,
                layout(n, config(false, ElementType.FLOAT32, ByteOrder.BIG_ENDIAN, n)));

        DecodedChannel ch = out.channels().get(0);
        assertThat(ch.byteOrderSwapped()).isTrue();
        assertThat(SignalStatistics.maxAbs(ch.real())).isFinite().isLessThan(1e20);
        assertThat(ch.real()[0]).isEqualTo((double) values[0]);
    }

    @Test
    void complexDataDefaultsToInterleaved() {
        byte[] payload = smoothComplexFloats(ByteOrder.BIG_ENDIAN, 8);

        DecodedChannel ch = decoder.decode(payload,
                layout(8, config(true, ElementType.FLOAT32, ByteOrder.BIG_ENDIAN, 8))).channels().get(0);

        assertThat(ch.blockLayout()).isFalse();
        assertThat(ch.real()).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(ch.imag()).containsOnly(1.0);
    }

    @Test
    void detectsBlockLayoutWhenMateriallySmoother() {
        int n = 20;
        float[] values = new float[2 * n];
        for (int i = 0; i < n; i++) {
            values[i] = i;
            values[n + i] = (i / 2) % 2 == 0 ? 0f : 100f;
        }

        DecodedChannel ch = decoder.decode(floats(ByteOrder.BIG_ENDIAN, values),
                layout(n, config(true, ElementType.FLOAT32, ByteOrder.BIG_ENDIAN, n))).channels().get(0);

        assertThat(ch.blockLayout()).isTrue();
        assertThat(ch.real()).hasSize(n);
        assertThat(ch.real()[n - 1]).isEqualTo(n - 1);
        assertThat(ch.imag()[2]).isEqualTo(100.0);
        assertThat(ch.imagCleared()).isFalse();
    }

    @Test
    void zeroesNoisyImaginaryNextToCleanReal() {
        int n = 100;
        float[] values = new float[2 * n];
        for (int i = 0; i < n; i++) {
            values[2 * i] = i;
            values[2 * i + 1] = i % 2;
        }

        DecodedChannel ch = decoder.decode(floats(ByteOrder.BIG_ENDIAN, values),
                layout(n, config(true, ElementType.FLOAT32, ByteOrder.BIG_ENDIAN, n))).channels().get(0);

        assertThat(ch.imagCleared()).isTrue();
        assertThat(ch.imag()).containsOnly(0.0);
        assertThat(ch.realScore()).isLessThan(0.05);
    }

    @Test
    void truncatesOverProducedValues() {
        ChannelConfig config = new ChannelConfig(false, ElementType.FLOAT32, ByteOrder.BIG_ENDIAN, 16, 3);
        byte[] payload = floats(ByteOrder.BIG_ENDIAN, 1f, 2f, 3f, 4f);

        DecodedChannel ch = decoder.decodeChannel(0, payload, 0, 16, config, 3);

        assertThat(ch.real()).containsExactly(1, 2, 3);
        assertThat(ch.imag()).hasSize(3);
    }

    @Test
    void quadInterleavedFastPathKeepsOffsetsZeroAndTwo() {
        int n = 3;
        double[] quads = {1, 91, 10, 92, 2, 93, 20, 94, 3, 95, 30, 96};
        ChannelLayout layout = layout(n,
                config(true, ElementType.FLOAT64, ByteOrder.BIG_ENDIAN, n),
                config(true, ElementType.FLOAT64, ByteOrder.BIG_ENDIAN, n));

        DecodeOutcome out = decoder.decode(doubles(ByteOrder.BIG_ENDIAN, quads), layout);

        assertThat(out.quadInterleaved()).isTrue();
        assertThat(out.channels()).hasSize(1);
        assertThat(out.channels().get(0).real()).containsExactly(1, 2, 3);
        assertThat(out.channels().get(0).imag()).containsExactly(10, 20, 30);
    }

    @Test
    void fastPathKeepsHugeValuesAsRead() {
        int n = 3;
        double[] quads = {1e25, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11};
        ChannelLayout layout = layout(n,
                config(true, ElementType.FLOAT64, ByteOrder.BIG_ENDIAN, n),
                config(true, ElementType.FLOAT64, ByteOrder.BIG_ENDIAN, n));

        DecodeOutcome out = decoder.decode(doubles(ByteOrder.BIG_ENDIAN, quads), layout);

        assertThat(out.quadInterleaved()).isTrue();
        assertThat(out.fastPathFailed()).isFalse();
        assertThat(out.channels()).hasSize(1);
        assertThat(out.channels().get(0).real()).containsExactly(1e25, 4, 8);
        assertThat(out.channels().get(0).imag()).containsExactly(2, 6, 10);
        assertThat(out.channels().get(0).byteOrderSwapped()).isFalse();
    }

    @Test
    void fastPathNeedsExplicitlyDeclaredComplexData() {
        int n = 3;
        double[] quads = {1, 91, 10, 92, 2, 93, 20, 94, 3, 95, 30, 96};
        ChannelLayout layout = new ChannelLayout(n, 1, List.of(
                config(true, ElementType.FLOAT64, ByteOrder.BIG_ENDIAN, n),
                config(true, ElementType.FLOAT64, ByteOrder.BIG_ENDIAN, n)), false);

        DecodeOutcome out = decoder.decode(doubles(ByteOrder.BIG_ENDIAN, quads), layout);

        assertThat(out.quadInterleaved()).isFalse();
        assertThat(out.channels()).hasSize(2);
    }

    @Test
    void fastPathCanBeDisabled() {
        DecoderSettings d = DecoderSettings.defaults();
        DecoderSettings settings = new DecoderSettings(d.smoothnessWindow(), d.endianMagnitudeLimit(),
                d.blockPreferenceRatio(), d.cleanRealThreshold(), d.noisyImagThreshold(),
                d.qualityThreshold(), false, d.defaultSampleName());
        int n = 3;
        ChannelLayout layout = layout(n,
                config(true, ElementType.FLOAT64, ByteOrder.BIG_ENDIAN, n),
                config(true, ElementType.FLOAT64, ByteOrder.BIG_ENDIAN, n));

        DecodeOutcome out = new BinaryDecoder(settings).decode(new byte[12 * Double.BYTES], layout);

        assertThat(out.quadInterleaved()).isFalse();
        assertThat(out.fastPathFailed()).isFalse();
        assertThat(out.channels()).hasSize(2);
    }

    @Test
    void fastPathRejectsShortPayload() {
        assertThatThrownBy(() -> decoder.decodeQuadInterleaved(new byte[8], 3))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("shorter");
    }
}
