package com.example.supplymatch.domain.parsing;

import com.example.supplymatch.domain.model.DocumentFormat;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Everything the {@link TableExtractor} needs to know about one source format: its header
 * vocabulary, the column positions assumed before the header is read, the words that mark
 * non-product rows and how far down a table the header may sit.
 */
public record ExtractionProfile(
        DocumentFormat format,
        HeaderVocabulary vocabulary,
        Map<ColumnRole, Integer> defaultColumns,
        Set<String> skipWords,
        int headerLookahead
) {

    public static final int DEFAULT_HEADER_LOOKAHEAD = 30;

    public ExtractionProfile {
        if (headerLookahead <= 0) {
            throw new IllegalArgumentException("headerLookahead must be positive");
        }
        defaultColumns = Map.copyOf(defaultColumns);
        skipWords = Set.copyOf(skipWords);
    }

    public static ExtractionProfile invoicePdf() {
        return new ExtractionProfile(DocumentFormat.PDF, HeaderVocabulary.invoicePdf(), defaults(9),
                Set.of("итого", "всего", "total", "сумма", "купля-продажа"), DEFAULT_HEADER_LOOKAHEAD);
    }

    public static ExtractionProfile invoiceSpreadsheet() {
        return new ExtractionProfile(DocumentFormat.SPREADSHEET, HeaderVocabulary.invoiceSpreadsheet(), defaults(8),
                Set.of("итого", "всего", "total", "сумма"), DEFAULT_HEADER_LOOKAHEAD);
    }

    public ExtractionProfile withHeaderLookahead(int lookahead) {
        return new ExtractionProfile(format, vocabulary, defaultColumns, skipWords, lookahead);
    }

    /**
     * @return a fresh mutable column map seeded with this profile's default positions
     */
    public Map<ColumnRole, Integer> newColumnMap() {
        Map<ColumnRole, Integer> columns = new EnumMap<>(ColumnRole.class);
        columns.putAll(defaultColumns);
        return columns;
    }

    private static Map<ColumnRole, Integer> defaults(int totalWithTaxIndex) {
        Map<ColumnRole, Integer> columns = new EnumMap<>(ColumnRole.class);
        columns.put(ColumnRole.ROW_NUMBER, 0);
        columns.put(ColumnRole.NAME, 1);
        columns.put(ColumnRole.CODE, 2);
        columns.put(ColumnRole.UNIT, 3);
        columns.put(ColumnRole.QUANTITY, 4);
        columns.put(ColumnRole.UNIT_PRICE, 5);
        columns.put(ColumnRole.TOTAL_WITH_TAX, totalWithTaxIndex);
        return columns;
    }
}
