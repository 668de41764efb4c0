package com.phillippitts.bes3t.service.metrics;

import com.phillippitts.bes3t.domain.ParseDiagnostic;
import com.phillippitts.bes3t.domain.ParseResult;
import com.phillippitts.bes3t.domain.Spectrum1D;
import com.phillippitts.bes3t.domain.SpectrumType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class DecoderMetricsPublisherTest {

    private static ParseResult result() {
        Spectrum1D s = new Spectrum1D("a", SpectrumType.T2, Optional.empty(), "x", "y",
                new double[] {0}, new double[] {1}, new double[] {0});
        return new ParseResult("Ag", List.of(s), List.of(
                new ParseDiagnostic("b.DSC", ParseDiagnostic.Kind.SIZE_MISMATCH, "m"),
                new ParseDiagnostic("a.DTA", ParseDiagnostic.Kind.FAST_PATH_FALLBACK, "m")));
    }

    @Test
    void recordsOnlyPairSkipsAsSkipped() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        DecoderMetricsPublisher publisher = new DecoderMetricsPublisher(new DecoderMetrics(registry));

        publisher.recordSuccess(result(), 1_000_000L);

        assertThat(registry.find("bes3t.spectra.parsed").tag("type", "T2").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("bes3t.pairs.skipped").counters()).hasSize(1);
        assertThat(registry.find("bes3t.pairs.skipped").tag("reason", "size_mismatch").counter()).isNotNull();
        assertThat(publisher.isEnabled()).isTrue();
    }

    @Test
    void noopPublisherIgnoresEverything() {
        assertThat(DecoderMetricsPublisher.NOOP.isEnabled()).isFalse();
        assertThatCode(() -> {
            DecoderMetricsPublisher.NOOP.recordSuccess(result(), 1L);
            DecoderMetricsPublisher.NOOP.recordFailure("invalid_archive");
        }).doesNotThrowAnyException();
    }
}
