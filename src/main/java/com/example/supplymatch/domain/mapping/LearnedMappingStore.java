package com.example.supplymatch.domain.mapping;

import com.example.supplymatch.domain.model.LearnedMapping;

import java.util.Map;
import java.util.Optional;

/**
 * Persistent cache of human-confirmed matches keyed by normalized invoice line text.
 * <p>
 * Implementations normalize keys with {@link MappingKeys#normalize(String)}. Storage failures are
 * not reported to callers: a failed read behaves like a miss and a failed write like a no-op.
 * The store does not check entries against the catalog; callers validate a returned id and
 * {@link #remove(String)} it when it has gone stale.
 */
public interface LearnedMappingStore {

    Optional<LearnedMapping> get(String lineText);

    void remove(String lineText);

    /**
     * Merges the given entries into the stored data. Entries with a blank key or without a
     * catalog id are ignored; existing entries under other keys are kept.
     *
     * @param mappings line text to confirmed catalog item
     */
    void save(Map<String, LearnedMapping> mappings);
}
