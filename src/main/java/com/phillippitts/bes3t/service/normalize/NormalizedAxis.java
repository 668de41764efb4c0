package com.phillippitts.bes3t.service.normalize;

import java.util.Objects;

/**
 * An axis after unit normalization.
 *
 * @param label  possibly rewritten label
 * @param values rescaled or shifted values
 */
public record NormalizedAxis(String label, double[] values) {

    public NormalizedAxis {
        Objects.requireNonNull(label, "Label must not be null");
        Objects.requireNonNull(values, "Values must not be null");
    }
}
