package com.example.supplymatch.domain.parsing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A table as read from a document: rows of cell strings. Rows may have different lengths and
 * cells may be {@code null}.
 */
public record SourceTable(List<List<String>> rows) {

    public SourceTable {
        rows = rows == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(rows));
    }
}
