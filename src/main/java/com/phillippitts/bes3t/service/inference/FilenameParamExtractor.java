package com.phillippitts.bes3t.service.inference;

import com.phillippitts.bes3t.domain.AcquisitionParams;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts acquisition parameters from instrument export file names such as
 * {@code Ag_4p5K_3400G_hpa20dB_p16_sw200.DSC}.
 *
 * <p>The extension is stripped, the remainder split on {@code _}. The first token is the sample
 * name. Each token is then tested against every pattern below, anchored at the token start;
 * one token may set several parameters. In numeric literals {@code p} stands for the decimal
 * point ({@code 4p5} = 4.5).
 */
public final class FilenameParamExtractor {

    private static final String NUMBER = "([0-9]+(?:[p.][0-9]+)?)";

    private static final Pattern EXTENSION = Pattern.compile("\\.[^.]+$");
    private static final Pattern TEMPERATURE = Pattern.compile(NUMBER + "k");
    private static final Pattern FIELD = Pattern.compile(NUMBER + "g");
    private static final Pattern AMPLIFIER_DB = Pattern.compile("(?:hpa)?" + NUMBER + "db");
    private static final Pattern AMPLIFIER_BARE = Pattern.compile("hpa" + NUMBER);
    private static final Pattern PULSE_WIDTH = Pattern.compile("p" + NUMBER);
    private static final Pattern SPECTRAL_WIDTH = Pattern.compile("sw" + NUMBER);

    private FilenameParamExtractor() {}

    /**
     * @param fileName file name with or without directory; one trailing extension is removed
     * @return parsed parameters; unmatched tokens are kept in {@link AcquisitionParams#tokens()}
     */
    public static AcquisitionParams extract(String fileName) {
        String name = fileName == null ? "" : fileName;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        String base = EXTENSION.matcher(name).replaceFirst("");

        List<String> tokens = new ArrayList<>();
        for (String token : base.split("_")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        String sampleName = tokens.isEmpty() ? base : tokens.get(0);

        OptionalDouble temperature = OptionalDouble.empty();
        OptionalDouble field = OptionalDouble.empty();
        OptionalDouble amplifier = OptionalDouble.empty();
        OptionalDouble pulseWidth = OptionalDouble.empty();
        OptionalDouble spectralWidth = OptionalDouble.empty();

        for (String token : tokens) {
            String lower = token.toLowerCase(Locale.ROOT);

            OptionalDouble value = leadingNumber(TEMPERATURE, lower);
            if (value.isPresent()) {
                temperature = value;
            }
            value = leadingNumber(FIELD, lower);
            if (value.isPresent()) {
                field = value;
            }
            value = leadingNumber(AMPLIFIER_DB, lower);
            if (value.isEmpty()) {
                value = leadingNumber(AMPLIFIER_BARE, lower);
            }
            if (value.isPresent()) {
                amplifier = value;
            }
            value = leadingNumber(PULSE_WIDTH, lower);
            if (value.isPresent()) {
                pulseWidth = value;
            }
            value = leadingNumber(SPECTRAL_WIDTH, lower);
            if (value.isPresent()) {
                spectralWidth = value;
            }
        }

        return new AcquisitionParams(sampleName, temperature, field, amplifier, pulseWidth, spectralWidth, tokens);
    }

    /**
     * Parses a literal that may use {@code p} as its decimal point.
     */
    static double parseLiteral(String literal) {
        return Double.parseDouble(literal.replace('p', '.'));
    }

    private static OptionalDouble leadingNumber(Pattern pattern, String token) {
        Matcher m = pattern.matcher(token);
        if (!m.lookingAt()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(parseLiteral(m.group(1)));
    }
}
