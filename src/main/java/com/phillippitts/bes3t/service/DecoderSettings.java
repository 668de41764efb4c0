package com.phillippitts.bes3t.service;

/**
 * Heuristic thresholds used by the decoder core.
 *
 * <p>Plain value so the core can run without Spring; {@code DecoderConfig} builds one from
 * {@code decoder.*} properties. {@link #defaults()} holds the values the heuristics were tuned with.
 *
 * @param smoothnessWindow      leading samples considered by the smoothness score
 * @param endianMagnitudeLimit  magnitude above which decoded values are treated as byte-order garbage
 * @param blockPreferenceRatio  block split chosen only if its score is at most this fraction of the interleaved score
 * @param cleanRealThreshold    real component counts as clean below this score
 * @param noisyImagThreshold    imaginary component counts as noise above this score
 * @param qualityThreshold      channels scoring below this survive multi-channel filtering
 * @param quadInterleaveEnabled whether the quad-interleaved fast path is attempted
 * @param defaultSampleName     sample name reported when nothing decoded
 */
public record DecoderSettings(
        int smoothnessWindow,
        double endianMagnitudeLimit,
        double blockPreferenceRatio,
        double cleanRealThreshold,
        double noisyImagThreshold,
        double qualityThreshold,
        boolean quadInterleaveEnabled,
        String defaultSampleName
) {

    public static final int DEFAULT_SMOOTHNESS_WINDOW = 1000;
    public static final double DEFAULT_ENDIAN_MAGNITUDE_LIMIT = 1e20;
    public static final double DEFAULT_BLOCK_PREFERENCE_RATIO = 0.5;
    public static final double DEFAULT_CLEAN_REAL_THRESHOLD = 0.05;
    public static final double DEFAULT_NOISY_IMAG_THRESHOLD = 0.15;
    public static final double DEFAULT_QUALITY_THRESHOLD = 0.15;
    public static final String DEFAULT_SAMPLE_NAME = "Uploaded Sample";

    public DecoderSettings {
        if (smoothnessWindow < 2) {
            throw new IllegalArgumentException("Smoothness window must be at least 2, got: " + smoothnessWindow);
        }
        if (!(endianMagnitudeLimit > 0)) {
            throw new IllegalArgumentException("Endian magnitude limit must be positive, got: " + endianMagnitudeLimit);
        }
        if (blockPreferenceRatio <= 0 || blockPreferenceRatio > 1) {
            throw new IllegalArgumentException("Block preference ratio must be in (0, 1], got: " + blockPreferenceRatio);
        }
        if (defaultSampleName == null || defaultSampleName.isBlank()) {
            throw new IllegalArgumentException("Default sample name must not be blank");
        }
    }

    public static DecoderSettings defaults() {
        return new DecoderSettings(
                DEFAULT_SMOOTHNESS_WINDOW,
                DEFAULT_ENDIAN_MAGNITUDE_LIMIT,
                DEFAULT_BLOCK_PREFERENCE_RATIO,
                DEFAULT_CLEAN_REAL_THRESHOLD,
                DEFAULT_NOISY_IMAG_THRESHOLD,
                DEFAULT_QUALITY_THRESHOLD,
                true,
                DEFAULT_SAMPLE_NAME);
    }
}
