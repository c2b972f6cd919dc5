package com.example.supplymatch.domain.model;

import java.util.Comparator;

/**
 * Ranked catalog candidate for a query. Scores range from 0 to 100.
 */
public record MatchCandidate(String id, String name, String code, int score) {

    /**
     * Highest score first; on equal scores the shorter, more specific name wins.
     */
    public static final Comparator<MatchCandidate> RANKING = Comparator
            .comparingInt(MatchCandidate::score).reversed()
            .thenComparingInt(candidate -> candidate.name().length());
}
