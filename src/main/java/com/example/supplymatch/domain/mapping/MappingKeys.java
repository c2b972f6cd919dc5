package com.example.supplymatch.domain.mapping;

import java.util.regex.Pattern;

/**
 * Normalization of invoice line texts into learned-mapping keys.
 */
public final class MappingKeys {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private MappingKeys() {
    }

    /**
     * Trims the text and collapses every run of whitespace into a single space, so two invoice
     * names that differ only in spacing share one entry.
     *
     * @param lineText raw line text
     * @return normalized key, empty for {@code null} or blank input
     */
    public static String normalize(String lineText) {
        if (lineText == null) {
            return "";
        }
        String trimmed = lineText.strip();
        return trimmed.isEmpty() ? "" : WHITESPACE.matcher(trimmed).replaceAll(" ");
    }
}
