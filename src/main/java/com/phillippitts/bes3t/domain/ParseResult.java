package com.phillippitts.bes3t.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of decoding one archive.
 *
 * @param sampleName  sample name taken from the first decoded spectrum, or the configured placeholder
 * @param spectra     decoded spectra in archive order
 * @param diagnostics recoverable anomalies, in the order they were met
 */
public record ParseResult(String sampleName, List<Spectrum> spectra, List<ParseDiagnostic> diagnostics) {

    public ParseResult {
        Objects.requireNonNull(sampleName, "Sample name must not be null");
        spectra = List.copyOf(Objects.requireNonNull(spectra, "Spectra must not be null"));
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "Diagnostics must not be null"));
    }

    public int spectraCount() {
        return spectra.size();
    }

    /** Number of descriptor/data pairs that produced nothing. */
    public int skippedPairs() {
        return (int) diagnostics.stream().filter(d -> d.kind().skipsPair()).count();
    }

    /**
     * Counts spectra per type label, in first-seen order.
     */
    public Map<String, Integer> countsByType() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Spectrum spectrum : spectra) {
            counts.merge(spectrum.type().label(), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }
}
