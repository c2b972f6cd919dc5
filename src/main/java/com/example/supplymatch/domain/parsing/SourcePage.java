package com.example.supplymatch.domain.parsing;

import java.util.List;

/**
 * One page of a source document with the tables found on it, in reading order.
 *
 * @param number 1-based page number
 * @param tables tables on the page
 */
public record SourcePage(int number, List<SourceTable> tables) {

    public SourcePage {
        tables = tables == null ? List.of() : List.copyOf(tables);
    }
}
