package com.phillippitts.bes3t.service.inference;

import com.phillippitts.bes3t.domain.Metadata;
import com.phillippitts.bes3t.domain.SpectrumType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SpectrumTypeInferencerTest {

    @Test
    void nameMarkerDecidesForOneDimensionalData() {
        assertThat(SpectrumTypeInferencer.infer("sample_T1_test", Metadata.empty(), false))
                .isEqualTo(SpectrumType.T1);
    }

    @Test
    void matrixDataPromotesType() {
        assertThat(SpectrumTypeInferencer.infer("sample_T1_test", Metadata.empty(), true))
                .isEqualTo(SpectrumType.TWO_D_T1);
        assertThat(SpectrumTypeInferencer.infer("mystery", Metadata.empty(), true))
                .isEqualTo(SpectrumType.TWO_D);
        assertThat(SpectrumTypeInferencer.infer("Cu_HYSCORE", Metadata.empty(), true))
                .isEqualTo(SpectrumType.HYSCORE);
        assertThat(SpectrumTypeInferencer.infer("Cu_edfs", Metadata.empty(), true))
                .isEqualTo(SpectrumType.TWO_D_EDFS);
    }

    @Test
    void mislabeledOneDimensionalTwoDFallsBackToCw() {
        assertThat(SpectrumTypeInferencer.infer("sample_2D", Metadata.empty(), false))
                .isEqualTo(SpectrumType.CW);
    }

    @Test
    void markersFollowPriorityOrder() {
        assertThat(SpectrumTypeInferencer.baseType("EDFS_T1_cw", Metadata.empty())).isEqualTo(SpectrumType.EDFS);
        assertThat(SpectrumTypeInferencer.baseType("rabi_t2", Metadata.empty())).isEqualTo(SpectrumType.RABI);
        assertThat(SpectrumTypeInferencer.baseType("x_T2_2d", Metadata.empty())).isEqualTo(SpectrumType.T2);
        assertThat(SpectrumTypeInferencer.baseType("x_2D_cw", Metadata.empty())).isEqualTo(SpectrumType.TWO_D);
    }

    @Test
    void experimentFamilyIsTheFallback() {
        assertThat(SpectrumTypeInferencer.baseType("Ag_sample", Metadata.of(Map.of("EXPT", "CW"))))
                .isEqualTo(SpectrumType.CW);
        assertThat(SpectrumTypeInferencer.baseType("Ag_sample", Metadata.of(Map.of("EXPT", "PULSED"))))
                .isEqualTo(SpectrumType.T1);
        assertThat(SpectrumTypeInferencer.baseType("Ag_sample", Metadata.empty()))
                .isEqualTo(SpectrumType.UNKNOWN);
    }
}
