package com.example.supplymatch.domain.parsing;

import java.util.List;
import java.util.Optional;

import static com.example.supplymatch.domain.parsing.ColumnMarker.allOf;
import static com.example.supplymatch.domain.parsing.ColumnMarker.allOfExcept;
import static com.example.supplymatch.domain.parsing.ColumnMarker.anyOf;
import static com.example.supplymatch.domain.parsing.ColumnMarker.exactly;
import static com.example.supplymatch.domain.parsing.ColumnMarker.shortCellWith;

/**
 * Ordered {@code (marker, role)} table used to recognize an invoice header row and to assign
 * column roles to its cells. The first marker that matches a cell decides the cell's role, so the
 * order matters: more specific rules come first.
 *
 * @param nameMarkers     fragments that identify the product name column in the joined header text
 * @param quantityMarkers fragments that identify the quantity column in the joined header text
 * @param markers         per-cell role rules, evaluated in order
 */
public record HeaderVocabulary(List<String> nameMarkers, List<String> quantityMarkers, List<ColumnMarker> markers) {

    public HeaderVocabulary {
        nameMarkers = List.copyOf(nameMarkers);
        quantityMarkers = List.copyOf(quantityMarkers);
        markers = List.copyOf(markers);
    }

    /**
     * @param joinedLowerText all header cells joined with spaces and lower-cased
     * @return {@code true} when the text names both the product and the quantity columns
     */
    public boolean looksLikeHeader(String joinedLowerText) {
        if (joinedLowerText == null || joinedLowerText.isEmpty()) {
            return false;
        }
        return nameMarkers.stream().anyMatch(joinedLowerText::contains)
                && quantityMarkers.stream().anyMatch(joinedLowerText::contains);
    }

    /**
     * Resolves the role of a single header cell.
     *
     * @param lowerCell lower-cased, trimmed cell text
     * @return role of the first matching marker
     */
    public Optional<ColumnRole> roleOf(String lowerCell) {
        for (ColumnMarker marker : markers) {
            if (marker.matches(lowerCell)) {
                return Optional.of(marker.role());
            }
        }
        return Optional.empty();
    }

    /**
     * Vocabulary of Russian invoice PDFs (счёт-фактура, УПД) with the English labels seen on
     * bilingual forms.
     */
    public static HeaderVocabulary invoicePdf() {
        return new HeaderVocabulary(
                List.of("наименование", "description"),
                List.of("количество", "кол-во", "quantity", "qty"),
                List.of(
                        shortCellWith(ColumnRole.ROW_NUMBER, "№", 3),
                        exactly(ColumnRole.ROW_NUMBER, "no", "no.", "#"),
                        allOf(ColumnRole.NAME, "наименование", "товар"),
                        allOf(ColumnRole.NAME, "наименование", "услуг"),
                        anyOf(ColumnRole.NAME, "description"),
                        anyOf(ColumnRole.QUANTITY, "количество", "кол-во", "quantity", "qty"),
                        allOfExcept(ColumnRole.UNIT_PRICE, List.of("цена"), List.of("ндс")),
                        allOfExcept(ColumnRole.UNIT_PRICE, List.of("price"), List.of("total")),
                        allOf(ColumnRole.TOTAL_WITH_TAX, "ндс", "учетом"),
                        allOfExcept(ColumnRole.TOTAL_WITH_TAX, List.of("стоимость", "ндс"), List.of("без")),
                        allOf(ColumnRole.TOTAL_WITH_TAX, "стоимость", "поставки", "учётом"),
                        allOf(ColumnRole.TOTAL_WITH_TAX, "стоимость", "с налогом"),
                        allOfExcept(ColumnRole.TOTAL_WITH_TAX, List.of("total"), List.of("excl", "without", "net")),
                        anyOf(ColumnRole.CODE, "идентификацион"),
                        allOfExcept(ColumnRole.CODE, List.of("код"), List.of("штрих")),
                        anyOf(ColumnRole.CODE, "code", "sku"),
                        anyOf(ColumnRole.UNIT, "ед.", "единиц", "измер"),
                        exactly(ColumnRole.UNIT, "ед", "unit", "uom")
                ));
    }

    /**
     * Vocabulary of spreadsheet invoices, whose headers are usually shorter than on printed forms.
     */
    public static HeaderVocabulary invoiceSpreadsheet() {
        return new HeaderVocabulary(
                List.of("наименование"),
                List.of("кол", "количество"),
                List.of(
                        shortCellWith(ColumnRole.ROW_NUMBER, "№", 3),
                        anyOf(ColumnRole.NAME, "наименование"),
                        anyOf(ColumnRole.QUANTITY, "кол"),
                        allOfExcept(ColumnRole.UNIT_PRICE, List.of("цена"), List.of("ндс")),
                        allOf(ColumnRole.TOTAL_WITH_TAX, "стоимость", "учетом", "ндс"),
                        allOf(ColumnRole.TOTAL_WITH_TAX, "стоимость", "учётом", "ндс"),
                        anyOf(ColumnRole.CODE, "идентификацион"),
                        allOfExcept(ColumnRole.CODE, List.of("код"), List.of("штрих")),
                        anyOf(ColumnRole.UNIT, "ед.", "единиц", "измер"),
                        exactly(ColumnRole.UNIT, "ед")
                ));
    }
}
