package com.example.supplymatch.domain.matching;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits a query into its significant words and counts how many of them a catalog name covers.
 */
final class QueryTokenizer {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s/\\-()]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Set<String> STOP_WORDS = Set.of("для", "или", "и", "в", "на", "с", "по", "из", "от", "до", "без");
    private static final int MIN_WORD_LENGTH = 3;
    private static final int PREFIX_LENGTH = 5;

    private QueryTokenizer() {
    }

    static List<String> significantWords(String query) {
        return Arrays.stream(SEPARATORS.split(query.toLowerCase(Locale.ROOT)))
                .filter(word -> word.length() >= MIN_WORD_LENGTH && !STOP_WORDS.contains(word))
                .toList();
    }

    static List<String> whitespaceWords(String query, int minLength) {
        return Arrays.stream(WHITESPACE.split(query.strip()))
                .filter(word -> word.length() >= minLength)
                .toList();
    }

    /**
     * A word is present when it, or its 5-character stem for longer words, occurs in the name.
     */
    static boolean present(String word, String lowerName) {
        return lowerName.contains(word)
                || (word.length() >= PREFIX_LENGTH && lowerName.contains(word.substring(0, PREFIX_LENGTH)));
    }

    static int countPresent(List<String> words, String lowerName) {
        int count = 0;
        for (String word : words) {
            if (present(word, lowerName)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Minimum number of significant words a candidate name has to cover.
     */
    static int requiredMatches(int wordCount) {
        return wordCount >= 2 ? Math.min(2, wordCount) : 1;
    }
}
