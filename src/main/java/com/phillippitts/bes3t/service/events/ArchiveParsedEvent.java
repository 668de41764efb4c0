package com.phillippitts.bes3t.service.events;

/**
 * Emitted after an archive has been decoded.
 *
 * @param sampleName   sample name of the result
 * @param spectraCount spectra produced
 * @param skippedPairs descriptor/data pairs that produced nothing
 * @param elapsedMs    decode time in milliseconds
 */
public record ArchiveParsedEvent(
        String sampleName,
        int spectraCount,
        int skippedPairs,
        long elapsedMs
) {}
