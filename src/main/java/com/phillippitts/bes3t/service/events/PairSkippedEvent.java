package com.phillippitts.bes3t.service.events;

import com.phillippitts.bes3t.domain.ParseDiagnostic;

import java.time.Instant;

/**
 * Emitted once per descriptor/data pair dropped during an import.
 *
 * @param entryName archive entry of the descriptor
 * @param kind      why the pair was dropped
 * @param at        when the import finished
 */
public record PairSkippedEvent(
        String entryName,
        ParseDiagnostic.Kind kind,
        Instant at
) {}
