package com.example.supplymatch.domain.matching;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Versioned table of misspellings seen on supplier invoices and the catalog spelling to search
 * for instead. Corrections replace whole words only.
 */
public final class TypoCorrections {

    public static final String DEFAULT_VERSION = "2";

    private final String version;
    private final Map<String, String> entries;
    private final Map<Pattern, String> patterns;

    public TypoCorrections(String version, Map<String, String> entries) {
        this.version = version;
        Map<String, String> normalized = new LinkedHashMap<>();
        entries.forEach((typo, correct) -> {
            if (typo != null && !typo.isBlank() && correct != null) {
                normalized.put(typo.strip().toLowerCase(Locale.ROOT), correct.strip().toLowerCase(Locale.ROOT));
            }
        });
        this.entries = Collections.unmodifiableMap(normalized);
        Map<Pattern, String> compiled = new LinkedHashMap<>();
        normalized.forEach((typo, correct) -> compiled.put(
                Pattern.compile("\\b" + Pattern.quote(typo) + "\\b", Pattern.UNICODE_CHARACTER_CLASS),
                Matcher.quoteReplacement(correct)));
        this.patterns = compiled;
    }

    public static TypoCorrections defaults() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("авакадо", "авокадо");
        entries.put("нохот", "нори");
        entries.put("мачёный", "маринованный");
        return new TypoCorrections(DEFAULT_VERSION, entries);
    }

    public static TypoCorrections none() {
        return new TypoCorrections("0", Map.of());
    }

    /**
     * Returns a table with the extra entries added on top of this one; the version becomes
     * {@code <version>+<n>} so logs show that the defaults were extended.
     */
    public TypoCorrections withAdditional(Map<String, String> additional) {
        if (additional == null || additional.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(entries);
        merged.putAll(additional);
        return new TypoCorrections(version + "+" + additional.size(), merged);
    }

    /**
     * Parses {@code typo=correction} pairs as they appear in configuration.
     *
     * @param pairs entries in {@code typo=correction} form; blank entries are ignored
     * @return corrections in declaration order
     * @throws IllegalArgumentException when an entry has no {@code =} or an empty side
     */
    public static Map<String, String> parseEntries(List<String> pairs) {
        Map<String, String> entries = new LinkedHashMap<>();
        if (pairs == null) {
            return entries;
        }
        for (String pair : pairs) {
            if (pair == null || pair.isBlank()) {
                continue;
            }
            int separator = pair.indexOf('=');
            String typo = separator < 0 ? "" : pair.substring(0, separator).strip();
            String correct = separator < 0 ? "" : pair.substring(separator + 1).strip();
            if (typo.isEmpty() || correct.isEmpty()) {
                throw new IllegalArgumentException("Typo correction must look like 'typo=correction': " + pair);
            }
            entries.put(typo, correct);
        }
        return entries;
    }

    /**
     * @param lowerQuery lower-cased query text
     * @return the query with every known typo replaced by its correction
     */
    public String apply(String lowerQuery) {
        String corrected = lowerQuery;
        for (Map.Entry<Pattern, String> entry : patterns.entrySet()) {
            corrected = entry.getKey().matcher(corrected).replaceAll(entry.getValue());
        }
        return corrected;
    }

    public String version() {
        return version;
    }

    public Map<String, String> entries() {
        return entries;
    }
}
