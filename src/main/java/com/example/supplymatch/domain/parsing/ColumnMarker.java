package com.example.supplymatch.domain.parsing;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * One entry of the header vocabulary: a test on a lower-cased header cell and the column role it
 * identifies.
 *
 * @param role        column the marker identifies
 * @param description readable form of the rule, used in logs
 * @param test        predicate over the lower-cased, trimmed cell text
 */
public record ColumnMarker(ColumnRole role, String description, Predicate<String> test) {

    public boolean matches(String lowerCell) {
        return lowerCell != null && !lowerCell.isEmpty() && test.test(lowerCell);
    }

    /**
     * Cell contains every fragment.
     */
    public static ColumnMarker allOf(ColumnRole role, String... fragments) {
        List<String> required = List.of(fragments);
        return new ColumnMarker(role, "all" + required, cell -> required.stream().allMatch(cell::contains));
    }

    /**
     * Cell contains at least one fragment.
     */
    public static ColumnMarker anyOf(ColumnRole role, String... fragments) {
        List<String> options = List.of(fragments);
        return new ColumnMarker(role, "any" + options, cell -> options.stream().anyMatch(cell::contains));
    }

    /**
     * Cell contains every required fragment and none of the forbidden ones.
     */
    public static ColumnMarker allOfExcept(ColumnRole role, List<String> required, List<String> forbidden) {
        return new ColumnMarker(role, "all" + required + " except" + forbidden,
                cell -> required.stream().allMatch(cell::contains)
                        && forbidden.stream().noneMatch(cell::contains));
    }

    /**
     * Cell equals one of the given labels.
     */
    public static ColumnMarker exactly(ColumnRole role, String... labels) {
        List<String> accepted = Arrays.asList(labels);
        return new ColumnMarker(role, "exactly" + accepted, accepted::contains);
    }

    /**
     * Short cell (a bare symbol with at most a couple of extra characters) containing {@code symbol}.
     */
    public static ColumnMarker shortCellWith(ColumnRole role, String symbol, int maxLength) {
        return new ColumnMarker(role, "short[" + symbol + "]",
                cell -> cell.equals(symbol) || (cell.length() <= maxLength && cell.contains(symbol)));
    }

    @Override
    public String toString() {
        return role + ":" + description;
    }
}
