package com.example.supplymatch.domain.matching;

import com.example.supplymatch.domain.model.CatalogItem;
import com.example.supplymatch.domain.model.MatchCandidate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Ranks catalog items against an invoice line or a manual search query.
 * <p>
 * The search runs in stages and the first stage that finds anything wins:
 * <ol>
 *     <li>code lookup, when the query carries a numeric article code;</li>
 *     <li>fuzzy scoring of every item, gated by keyword coverage;</li>
 *     <li>relaxed retries with the first two words, the longest word, and one known phrase.</li>
 * </ol>
 * The engine is stateless apart from its typo table and does no I/O; callers pass the already
 * filtered pool of searchable items.
 */
public class MatchingEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);

    public static final int DEFAULT_LIMIT = 10;
    public static final int DEFAULT_MIN_SCORE = 38;

    private static final int MIN_CODE_LENGTH = 3;
    private static final int PRUNE_SCORE = 35;
    private static final int BOUNDARY_MATCH_SCORE = 95;
    private static final int EXACT_SCORE = 100;
    private static final int MIN_LONGEST_WORD = 4;
    private static final String FRYING_OIL = "масло фритюра";

    private final TypoCorrections typoCorrections;

    public MatchingEngine(TypoCorrections typoCorrections) {
        this.typoCorrections = typoCorrections;
    }

    public TypoCorrections typoCorrections() {
        return typoCorrections;
    }

    /**
     * Searches the catalog.
     *
     * @param query    invoice line text, catalog name fragment or numeric code
     * @param catalog  searchable items; groups are skipped if present
     * @param limit    maximum number of candidates
     * @param minScore candidates below this score are dropped after truncation
     * @return candidates sorted by descending score, then ascending name length
     */
    public List<MatchCandidate> search(String query, Collection<CatalogItem> catalog, int limit, int minScore) {
        if (query == null || query.isBlank() || catalog == null || catalog.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<CatalogItem> items = catalog.stream().filter(item -> !item.isGroup()).toList();
        String normalized = typoCorrections.apply(query.strip().toLowerCase(Locale.ROOT));

        Optional<List<MatchCandidate>> byCode = searchByCode(normalized, items, limit);
        if (byCode.isPresent()) {
            return byCode.get();
        }

        List<MatchCandidate> result = fuzzySearch(items, normalized, limit, minScore);
        List<String> words = List.of();
        if (result.isEmpty()) {
            words = QueryTokenizer.significantWords(normalized);
            if (words.isEmpty()) {
                words = QueryTokenizer.whitespaceWords(normalized, 2);
            }
            if (!words.isEmpty()) {
                String shortQuery = words.size() >= 2 ? words.get(0) + " " + words.get(1) : words.get(0);
                if (!shortQuery.equals(normalized)) {
                    log.debug("No match for '{}', retrying with '{}'", normalized, shortQuery);
                    result = fuzzySearch(items, shortQuery, limit, minScore);
                }
            }
        }
        if (result.isEmpty() && !words.isEmpty()) {
            String longest = longestWord(words);
            if (longest.length() >= MIN_LONGEST_WORD) {
                log.debug("No match for '{}', retrying with longest word '{}'", normalized, longest);
                result = fuzzySearch(items, longest, limit, minScore);
            }
        }
        if (result.isEmpty() && normalized.contains("масло") && normalized.contains("фритюр")) {
            result = fuzzySearch(items, FRYING_OIL, limit, minScore);
        }
        return result;
    }

    public List<MatchCandidate> search(String query, Collection<CatalogItem> catalog) {
        return search(query, catalog, DEFAULT_LIMIT, DEFAULT_MIN_SCORE);
    }

    private Optional<List<MatchCandidate>> searchByCode(String query, List<CatalogItem> items, int limit) {
        Optional<String> codeToken = QueryTokenizer.whitespaceWords(query, MIN_CODE_LENGTH).stream()
                .filter(MatchingEngine::isNumeric)
                .findFirst();
        if (codeToken.isPresent()) {
            List<MatchCandidate> exact = collect(items, code -> code.equals(codeToken.get()), codeToken.get(), limit);
            if (!exact.isEmpty()) {
                return Optional.of(exact);
            }
        }

        String compact = withoutSpaces(query);
        if (isNumeric(compact)) {
            List<MatchCandidate> exact = collect(items, code -> code.equals(compact), compact, limit);
            if (!exact.isEmpty()) {
                return Optional.of(exact);
            }
            List<MatchCandidate> partial = collect(items, code -> code.contains(compact), compact, limit);
            if (!partial.isEmpty()) {
                return Optional.of(partial);
            }
        }
        return Optional.empty();
    }

    private List<MatchCandidate> collect(List<CatalogItem> items, Predicate<String> codeTest, String code, int limit) {
        List<MatchCandidate> matches = new ArrayList<>();
        for (CatalogItem item : items) {
            String itemCode = withoutSpaces(item.code());
            if (itemCode.isEmpty() || !codeTest.test(itemCode)) {
                continue;
            }
            int score = itemCode.equals(code) ? EXACT_SCORE : SimilarityScorer.ratio(code, itemCode);
            matches.add(new MatchCandidate(item.id(), item.name(), item.code(), score));
        }
        matches.sort(MatchCandidate.RANKING);
        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : List.copyOf(matches);
    }

    private List<MatchCandidate> fuzzySearch(List<CatalogItem> items, String query, int limit, int minScore) {
        List<String> words = QueryTokenizer.significantWords(query);
        int required = QueryTokenizer.requiredMatches(words.size());
        List<MatchCandidate> matches = new ArrayList<>();
        for (CatalogItem item : items) {
            String name = item.name() == null ? "" : item.name().toLowerCase(Locale.ROOT);
            String code = item.code().toLowerCase(Locale.ROOT);
            int score = SimilarityScorer.productScore(query, name, code);
            if (!code.isEmpty() && query.equals(code)) {
                score = EXACT_SCORE;
            } else if (name.equals(query) || name.startsWith(query + " ") || name.endsWith(" " + query)) {
                score = Math.max(score, BOUNDARY_MATCH_SCORE);
            } else if (score <= PRUNE_SCORE) {
                continue;
            }
            if (!passesKeywordGate(words, required, name)) {
                continue;
            }
            matches.add(new MatchCandidate(item.id(), item.name(), item.code(), score));
        }
        matches.sort(MatchCandidate.RANKING);
        return matches.stream()
                .limit(limit)
                .filter(candidate -> candidate.score() >= minScore)
                .toList();
    }

    private static boolean passesKeywordGate(List<String> words, int required, String lowerName) {
        boolean anyPresent = words.isEmpty() || words.stream().anyMatch(word -> QueryTokenizer.present(word, lowerName));
        return anyPresent && QueryTokenizer.countPresent(words, lowerName) >= required;
    }

    private static String longestWord(List<String> words) {
        String longest = words.get(0);
        for (String word : words) {
            if (word.length() > longest.length()) {
                longest = word;
            }
        }
        return longest;
    }

    private static boolean isNumeric(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }

    private static String withoutSpaces(String value) {
        return value == null ? "" : value.replace(" ", "");
    }
}
