package com.example.supplymatch.domain.model;

/**
 * Human-confirmed association between an invoice line text and a catalog item.
 * The key is the normalized line text the mapping is stored under.
 */
public record LearnedMapping(
        String key,
        String id,
        String name,
        String code
) {

    public MatchCandidate toCandidate() {
        return new MatchCandidate(id, name == null ? "" : name, code == null ? "" : code, 100);
    }
}
