package com.phillippitts.bes3t.domain;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Acquisition parameters recovered from an instrument export file name.
 *
 * @param sampleName    first underscore-separated token of the file name
 * @param temperatureK  temperature in Kelvin ({@code 4p5K})
 * @param fieldG        static field in Gauss ({@code 3400G})
 * @param amplifierDb   amplifier gain in dB ({@code hpa20dB}, {@code 20dB}, {@code hpa20})
 * @param pulseWidth    pulse width ({@code p16})
 * @param spectralWidth spectral width ({@code sw200})
 * @param tokens        every non-empty token, matched or not, in file-name order
 */
public record AcquisitionParams(
        String sampleName,
        OptionalDouble temperatureK,
        OptionalDouble fieldG,
        OptionalDouble amplifierDb,
        OptionalDouble pulseWidth,
        OptionalDouble spectralWidth,
        List<String> tokens
) {

    public AcquisitionParams {
        Objects.requireNonNull(sampleName, "Sample name must not be null");
        Objects.requireNonNull(temperatureK, "temperatureK must not be null (use OptionalDouble.empty())");
        Objects.requireNonNull(fieldG, "fieldG must not be null (use OptionalDouble.empty())");
        Objects.requireNonNull(amplifierDb, "amplifierDb must not be null (use OptionalDouble.empty())");
        Objects.requireNonNull(pulseWidth, "pulseWidth must not be null (use OptionalDouble.empty())");
        Objects.requireNonNull(spectralWidth, "spectralWidth must not be null (use OptionalDouble.empty())");
        tokens = List.copyOf(Objects.requireNonNull(tokens, "Tokens must not be null"));
    }
}
