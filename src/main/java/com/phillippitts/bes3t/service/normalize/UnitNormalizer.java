package com.phillippitts.bes3t.service.normalize;

import com.phillippitts.bes3t.domain.SpectrumType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Rewrites an x axis into canonical units: zero-based for time sweeps, Gauss for field sweeps.
 *
 * <p>Time correction runs first, then field scaling. Applying {@link #normalize} to its own
 * output changes nothing: a shifted axis already starts at zero and the canonical field label
 * matches no convertible unit.
 */
public final class UnitNormalizer {

    private static final Logger LOG = LogManager.getLogger(UnitNormalizer.class);

    public static final String FIELD_LABEL = "Magnetic Field (G)";

    private static final Set<SpectrumType> TIME_TYPES = EnumSet.of(SpectrumType.T1, SpectrumType.T2, SpectrumType.RABI);
    private static final Set<String> TIME_WORDS = Set.of("time", "tau", "s", "ms", "us", "ns");

    private static final double TESLA_TO_GAUSS = 10_000.0;
    private static final double MILLITESLA_TO_GAUSS = 10.0;
    private static final double KILOGAUSS_TO_GAUSS = 1_000.0;
    private static final double EDFS_KILOGAUSS_CEILING = 20.0;

    private UnitNormalizer() {}

    public static NormalizedAxis normalize(String label, double[] values, SpectrumType type) {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(type, "type must not be null");

        double[] corrected = zeroCorrectTime(label, values, type);
        return scaleField(label, corrected, type);
    }

    /**
     * Shifts the axis so its minimum is zero for time sweeps. EDFS is a field sweep and is
     * never shifted, even when its label names a time unit.
     */
    static double[] zeroCorrectTime(String label, double[] values, SpectrumType type) {
        if (type == SpectrumType.EDFS || values.length == 0) {
            return values;
        }
        if (!TIME_TYPES.contains(type) && !hasTimeUnit(label)) {
            return values;
        }
        double min = Arrays.stream(values).min().orElse(0.0);
        if (min == 0.0) {
            return values;
        }
        double[] shifted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            shifted[i] = values[i] - min;
        }
        return shifted;
    }

    static NormalizedAxis scaleField(String label, double[] values, SpectrumType type) {
        if (values.length == 0 || !isFieldAxis(label, type)) {
            return new NormalizedAxis(label, values);
        }
        String lower = label.toLowerCase(Locale.ROOT);
        if (label.contains("(T)") || label.contains("(Tesla)")) {
            return new NormalizedAxis(FIELD_LABEL, scale(values, TESLA_TO_GAUSS));
        }
        if (label.contains("(mT)")) {
            return new NormalizedAxis(FIELD_LABEL, scale(values, MILLITESLA_TO_GAUSS));
        }
        if (label.contains("(kG)") || lower.contains("(kg)")) {
            return new NormalizedAxis(FIELD_LABEL, scale(values, KILOGAUSS_TO_GAUSS));
        }
        // EDFS sweeps are often exported in kG under a bogus unit
        if (type == SpectrumType.EDFS && !FIELD_LABEL.equals(label)) {
            double max = Arrays.stream(values).max().orElse(0.0);
            if (max <= EDFS_KILOGAUSS_CEILING) {
                LOG.info("Applied EDFS field correction (max={}, label='{}')", max, label);
                return new NormalizedAxis(FIELD_LABEL, scale(values, KILOGAUSS_TO_GAUSS));
            }
        }
        return new NormalizedAxis(label, values);
    }

    static boolean isFieldAxis(String label, SpectrumType type) {
        String lower = label.toLowerCase(Locale.ROOT);
        return lower.contains("gauss") || lower.contains("field") || label.contains("G")
                || type == SpectrumType.EDFS;
    }

    /** Whole-word match, so {@code Gauss} does not read as {@code us}. */
    static boolean hasTimeUnit(String label) {
        for (String word : label.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
            if (TIME_WORDS.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static double[] scale(double[] values, double factor) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] * factor;
        }
        return out;
    }
}
