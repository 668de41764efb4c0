package com.phillippitts.bes3t.service.inference;

import com.phillippitts.bes3t.domain.AcquisitionParams;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FilenameParamExtractorTest {

    @Test
    void extractsTemperatureAndField() {
        AcquisitionParams p = FilenameParamExtractor.extract("Ag_4p5K_200G_test.DSC");

        assertThat(p.sampleName()).isEqualTo("Ag");
        assertThat(p.temperatureK()).hasValue(4.5);
        assertThat(p.fieldG()).hasValue(200.0);
        assertThat(p.amplifierDb()).isEmpty();
        assertThat(p.tokens()).containsExactly("Ag", "4p5K", "200G", "test");
    }

    @Test
    void extractsAmplifierPulseAndSpectralWidth() {
        AcquisitionParams p = FilenameParamExtractor.extract("run/Cu_hpa20dB_p16_sw2p5_10K.DTA");

        assertThat(p.sampleName()).isEqualTo("Cu");
        assertThat(p.amplifierDb()).hasValue(20.0);
        assertThat(p.pulseWidth()).hasValue(16.0);
        assertThat(p.spectralWidth()).hasValue(2.5);
        assertThat(p.temperatureK()).hasValue(10.0);
    }

    @Test
    void bareAmplifierTokenWithoutDbSuffix() {
        AcquisitionParams p = FilenameParamExtractor.extract("Cu_hpa30.DSC");

        assertThat(p.amplifierDb()).hasValue(30.0);
    }

    @Test
    void dbWithoutPrefixAlsoCounts() {
        AcquisitionParams p = FilenameParamExtractor.extract("Cu_12dB.DSC");

        assertThat(p.amplifierDb()).hasValue(12.0);
    }

    @Test
    void emptyTokensAreDropped() {
        AcquisitionParams p = FilenameParamExtractor.extract("Fe__3400G_.DSC");

        assertThat(p.tokens()).containsExactly("Fe", "3400G");
        assertThat(p.fieldG()).hasValue(3400.0);
    }

    @Test
    void unmatchedTokensContributeNothing() {
        AcquisitionParams p = FilenameParamExtractor.extract("sample_test.DSC");

        assertThat(p.temperatureK()).isEmpty();
        assertThat(p.fieldG()).isEmpty();
        assertThat(p.pulseWidth()).isEmpty();
        assertThat(p.spectralWidth()).isEmpty();
    }

    @Test
    void pActsAsDecimalPoint() {
        assertThat(FilenameParamExtractor.parseLiteral("4p5")).isEqualTo(4.5);
        assertThat(FilenameParamExtractor.parseLiteral("10.25")).isEqualTo(10.25);
    }
}
