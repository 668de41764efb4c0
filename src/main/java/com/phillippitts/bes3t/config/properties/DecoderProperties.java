package com.phillippitts.bes3t.config.properties;

import com.phillippitts.bes3t.service.DecoderSettings;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the decoder heuristics ({@code decoder.*}). Unset values fall back to
 * {@link DecoderSettings#defaults()}.
 */
@Validated
@ConfigurationProperties(prefix = "decoder")
public class DecoderProperties {

    /** Leading samples scored by the smoothness metric. */
    @Min(2)
    private final int smoothnessWindow;

    /** Decoded magnitudes above this are treated as byte-order garbage. */
    @Positive
    private final double endianMagnitudeLimit;

    /** Block split wins only if its score is at most this fraction of the interleaved score. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private final double blockPreferenceRatio;

    @PositiveOrZero
    private final double cleanRealThreshold;

    @PositiveOrZero
    private final double noisyImagThreshold;

    @Positive
    private final double qualityThreshold;

    private final boolean quadInterleaveEnabled;

    @NotBlank
    private final String defaultSampleName;

    @ConstructorBinding
    public DecoderProperties(Integer smoothnessWindow,
                             Double endianMagnitudeLimit,
                             Double blockPreferenceRatio,
                             Double cleanRealThreshold,
                             Double noisyImagThreshold,
                             Double qualityThreshold,
                             Boolean quadInterleaveEnabled,
                             String defaultSampleName) {
        this.smoothnessWindow = smoothnessWindow == null
                ? DecoderSettings.DEFAULT_SMOOTHNESS_WINDOW : smoothnessWindow;
        this.endianMagnitudeLimit = endianMagnitudeLimit == null
                ? DecoderSettings.DEFAULT_ENDIAN_MAGNITUDE_LIMIT : endianMagnitudeLimit;
        this.blockPreferenceRatio = blockPreferenceRatio == null
                ? DecoderSettings.DEFAULT_BLOCK_PREFERENCE_RATIO : blockPreferenceRatio;
        this.cleanRealThreshold = cleanRealThreshold == null
                ? DecoderSettings.DEFAULT_CLEAN_REAL_THRESHOLD : cleanRealThreshold;
        this.noisyImagThreshold = noisyImagThreshold == null
                ? DecoderSettings.DEFAULT_NOISY_IMAG_THRESHOLD : noisyImagThreshold;
        this.qualityThreshold = qualityThreshold == null
                ? DecoderSettings.DEFAULT_QUALITY_THRESHOLD : qualityThreshold;
        this.quadInterleaveEnabled = quadInterleaveEnabled == null || quadInterleaveEnabled;
        this.defaultSampleName = defaultSampleName == null
                ? DecoderSettings.DEFAULT_SAMPLE_NAME : defaultSampleName;
    }

    public DecoderSettings toSettings() {
        return new DecoderSettings(smoothnessWindow, endianMagnitudeLimit, blockPreferenceRatio,
                cleanRealThreshold, noisyImagThreshold, qualityThreshold, quadInterleaveEnabled,
                defaultSampleName);
    }

    public int getSmoothnessWindow() {
        return smoothnessWindow;
    }

    public double getEndianMagnitudeLimit() {
        return endianMagnitudeLimit;
    }

    public double getBlockPreferenceRatio() {
        return blockPreferenceRatio;
    }

    public double getCleanRealThreshold() {
        return cleanRealThreshold;
    }

    public double getNoisyImagThreshold() {
        return noisyImagThreshold;
    }

    public double getQualityThreshold() {
        return qualityThreshold;
    }

    public boolean isQuadInterleaveEnabled() {
        return quadInterleaveEnabled;
    }

    public String getDefaultSampleName() {
        return defaultSampleName;
    }
}
