package com.phillippitts.bes3t.service.quality;

import com.phillippitts.bes3t.service.decode.DecodedChannel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QualityFilterTest {

    private final QualityFilter filter = new QualityFilter(0.15);

    private static DecodedChannel channel(int index, double score) {
        return new DecodedChannel(index, new double[] {1}, new double[] {0}, score, false, false, false);
    }

    @Test
    void dropsNoisyChannelsWhenACleanOneExists() {
        List<DecodedChannel> kept = filter.filter(List.of(channel(0, 0.02), channel(1, 0.8), channel(2, 0.1)));

        assertThat(kept).extracting(DecodedChannel::index).containsExactly(0, 2);
    }

    @Test
    void keepsEverythingWhenAllAreNoisy() {
        List<DecodedChannel> input = List.of(channel(0, 0.5), channel(1, 0.8));

        assertThat(filter.filter(input)).isEqualTo(input);
    }

    @Test
    void keepsEverythingWhenAllAreClean() {
        List<DecodedChannel> input = List.of(channel(0, 0.01), channel(1, 0.02));

        assertThat(filter.filter(input)).hasSize(2);
    }

    @Test
    void singleChannelIsNeverFiltered() {
        assertThat(filter.filter(List.of(channel(0, 0.9)))).hasSize(1);
    }

    @Test
    void thresholdIsExclusive() {
        assertThat(filter.isClean(channel(0, 0.15))).isFalse();
        assertThat(filter.isClean(channel(0, 0.149))).isTrue();
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new QualityFilter(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
