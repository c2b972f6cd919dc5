package com.example.supplymatch.domain.matching;

import me.xdrop.fuzzywuzzy.FuzzySearch;

/**
 * Composite string similarity: the maximum of several fuzzywuzzy metrics, each of which copes with
 * a different way invoice names drift from catalog names (word order, extra qualifiers,
 * truncation). Inputs are expected lower-cased.
 */
public final class SimilarityScorer {

    private SimilarityScorer() {
    }

    /**
     * Score of a product query against a catalog item's name and code.
     */
    public static int productScore(String query, String name, String code) {
        return Math.max(ratio(query, code), nameScore(query, name));
    }

    /**
     * Score of a supplier name against a known supplier.
     */
    public static int nameScore(String query, String name) {
        if (isBlank(query) || isBlank(name)) {
            return 0;
        }
        return Math.max(
                Math.max(FuzzySearch.ratio(query, name), FuzzySearch.partialRatio(query, name)),
                Math.max(FuzzySearch.tokenSetRatio(query, name), FuzzySearch.tokenSortRatio(query, name)));
    }

    static int ratio(String left, String right) {
        if (isBlank(left) || isBlank(right)) {
            return 0;
        }
        return FuzzySearch.ratio(left, right);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
