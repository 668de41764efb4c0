package com.phillippitts.bes3t.service.metadata;

import com.phillippitts.bes3t.domain.Metadata;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses BES3T descriptor text into {@link Metadata}.
 *
 * <p>Per line: blank lines and {@code *} comments are skipped; {@code KEY=VALUE} splits on the
 * first {@code =}; otherwise {@code KEY VALUE} splits on the first whitespace run. Anything
 * else is ignored. Malformed input yields a smaller map, never an exception.
 */
public final class MetadataTextParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private MetadataTextParser() {}

    public static Metadata parse(String text) {
        if (text == null || text.isEmpty()) {
            return Metadata.empty();
        }
        Map<String, String> entries = new HashMap<>();
        for (String line : text.split("\\R")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("*")) {
                continue;
            }

            int eq = trimmed.indexOf('=');
            if (eq >= 0) {
                put(entries, trimmed.substring(0, eq), trimmed.substring(eq + 1));
                continue;
            }

            String[] parts = WHITESPACE.split(trimmed, 2);
            if (parts.length == 2) {
                put(entries, parts[0], parts[1]);
            }
        }
        return Metadata.of(entries);
    }

    private static void put(Map<String, String> entries, String key, String value) {
        String k = key.strip();
        if (k.isEmpty()) {
            return;
        }
        // Metadata.of upper-cases; do it here too so later duplicates overwrite earlier ones
        entries.put(k.toUpperCase(Locale.ROOT), value.strip());
    }
}
