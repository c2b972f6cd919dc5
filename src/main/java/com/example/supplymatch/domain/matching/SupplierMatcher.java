package com.example.supplymatch.domain.matching;

import com.example.supplymatch.domain.model.Supplier;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the known supplier that best matches the name printed on an invoice.
 */
public class SupplierMatcher {

    static final int THRESHOLD = 50;
    private static final int MIN_NAME_LENGTH = 3;

    /**
     * A supplier must beat the threshold, and every later supplier must strictly beat the best
     * so far, so on ties the first one listed wins.
     *
     * @param candidateName supplier name read from the document
     * @param suppliers     known suppliers
     * @return best supplier scoring above the threshold
     */
    public Optional<Supplier> match(String candidateName, List<Supplier> suppliers) {
        if (candidateName == null || suppliers == null || suppliers.isEmpty()) {
            return Optional.empty();
        }
        String query = candidateName.strip().toLowerCase(Locale.ROOT);
        if (query.length() < MIN_NAME_LENGTH) {
            return Optional.empty();
        }
        Supplier best = null;
        int bestScore = THRESHOLD;
        for (Supplier supplier : suppliers) {
            if (supplier == null || supplier.name() == null || supplier.name().isBlank()) {
                continue;
            }
            int score = SimilarityScorer.nameScore(query, supplier.name().toLowerCase(Locale.ROOT));
            if (score > bestScore) {
                bestScore = score;
                best = supplier;
            }
        }
        return Optional.ofNullable(best);
    }
}
