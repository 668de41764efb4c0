package com.phillippitts.bes3t.service.inference;

import com.phillippitts.bes3t.domain.Metadata;
import com.phillippitts.bes3t.domain.SpectrumType;

import java.util.List;
import java.util.Locale;

/**
 * Classifies a spectrum from its file name, descriptor and dimensionality.
 *
 * <p>File-name markers are checked case-insensitively in a fixed priority; the first hit wins.
 * Without a marker the descriptor's {@code EXPT} family decides ({@code CW} or {@code PULSED}),
 * and failing that the type is {@link SpectrumType#UNKNOWN}. The base type is then adjusted to
 * the actual dimensionality so a 1-D payload is never tagged with a matrix type.
 */
public final class SpectrumTypeInferencer {

    /** Name markers in priority order. */
    private static final List<NameMarker> NAME_MARKERS = List.of(
            new NameMarker("edfs", SpectrumType.EDFS),
            new NameMarker("rabi", SpectrumType.RABI),
            new NameMarker("t1", SpectrumType.T1),
            new NameMarker("t2", SpectrumType.T2),
            new NameMarker("hyscore", SpectrumType.HYSCORE),
            new NameMarker("2d", SpectrumType.TWO_D),
            new NameMarker("cw", SpectrumType.CW)
    );

    private SpectrumTypeInferencer() {}

    /**
     * @param name          descriptor base name (no directory, extension optional)
     * @param meta          descriptor metadata
     * @param twoDimensional whether the payload is a matrix ({@code YPTS > 1})
     */
    public static SpectrumType infer(String name, Metadata meta, boolean twoDimensional) {
        SpectrumType base = baseType(name, meta);
        return twoDimensional ? base.toTwoDimensional() : base.toOneDimensional();
    }

    /**
     * Classification before dimensionality is taken into account.
     */
    public static SpectrumType baseType(String name, Metadata meta) {
        String lower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        for (NameMarker marker : NAME_MARKERS) {
            if (lower.contains(marker.token())) {
                return marker.type();
            }
        }

        String family = meta.getString("EXPT", "").toUpperCase(Locale.ROOT);
        if (family.contains("CW")) {
            return SpectrumType.CW;
        }
        if (family.contains("PULSED")) {
            return SpectrumType.T1;
        }
        return SpectrumType.UNKNOWN;
    }

    private record NameMarker(String token, SpectrumType type) { }
}
