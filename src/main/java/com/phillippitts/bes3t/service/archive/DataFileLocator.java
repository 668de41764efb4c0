package com.phillippitts.bes3t.service.archive;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Pairs a descriptor entry with its data entry.
 *
 * <p>Exact substitution of the four-character extension with {@code .DTA} then {@code .dta}
 * wins; otherwise the first data entry in the same directory whose file name contains the
 * descriptor's base name (case-insensitive) is used.
 */
public final class DataFileLocator {

    private static final String DATA_SUFFIX = ".dta";

    private DataFileLocator() {}

    public static Optional<String> locate(String descriptorName, Collection<String> entryNames) {
        String base = stripExtension(descriptorName);
        for (String candidate : new String[] {base + ".DTA", base + ".dta"}) {
            if (entryNames.contains(candidate)) {
                return Optional.of(candidate);
            }
        }

        String folder = directoryOf(descriptorName);
        String needle = fileNameOf(base).toLowerCase(Locale.ROOT);
        for (String name : entryNames) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.endsWith(DATA_SUFFIX)
                    && directoryOf(name).equals(folder)
                    && fileNameOf(lower).contains(needle)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    public static boolean isDescriptor(String entryName) {
        return entryName.toLowerCase(Locale.ROOT).endsWith(".dsc");
    }

    /** Entry name without its last four characters ({@code .DSC}). */
    static String stripExtension(String descriptorName) {
        return descriptorName.length() >= 4
                ? descriptorName.substring(0, descriptorName.length() - 4)
                : descriptorName;
    }

    static String directoryOf(String entryName) {
        int slash = entryName.lastIndexOf('/');
        return slash < 0 ? "" : entryName.substring(0, slash);
    }

    static String fileNameOf(String entryName) {
        return entryName.substring(entryName.lastIndexOf('/') + 1);
    }
}
