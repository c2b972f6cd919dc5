package com.example.supplymatch.domain.catalog;

import com.example.supplymatch.domain.model.CatalogItem;
import com.example.supplymatch.domain.model.CatalogItemType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Computes the ids hidden from matching: the excluded categories and everything below them.
 */
public class CatalogExclusionBuilder {

    private static final Logger log = LoggerFactory.getLogger(CatalogExclusionBuilder.class);
    static final int MAX_PASSES = 20;

    private final ExclusionRules rules;

    public CatalogExclusionBuilder(ExclusionRules rules) {
        this.rules = rules;
    }

    /**
     * Seeds the set with categories (typed groups or untyped entries) named by the rules, then
     * adds every item whose parent is already excluded until nothing changes. The number of passes
     * is capped so a cyclic hierarchy still terminates.
     *
     * @param items full catalog snapshot
     * @return ids to hide, never {@code null}
     */
    public Set<String> buildExclusions(Collection<CatalogItem> items) {
        Set<String> excluded = new HashSet<>();
        if (items == null || items.isEmpty()) {
            return excluded;
        }
        for (CatalogItem item : items) {
            if (item.type() != CatalogItemType.ITEM && rules.matches(item.name())) {
                excluded.add(item.id());
            }
        }
        int seeds = excluded.size();
        int passes = 0;
        while (passes < MAX_PASSES) {
            passes++;
            int added = 0;
            for (CatalogItem item : items) {
                if (!excluded.contains(item.id())
                        && !item.parentId().isEmpty()
                        && excluded.contains(item.parentId())) {
                    excluded.add(item.id());
                    added++;
                }
            }
            if (added == 0) {
                break;
            }
        }
        log.debug("Excluded {} catalog entries from {} seed categories in {} pass(es)", excluded.size(), seeds, passes);
        return excluded;
    }
}
