package com.example.supplymatch.domain.parsing;

import com.example.supplymatch.domain.model.MeasureUnit;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Leaf helpers that turn raw invoice cell text into units and numbers.
 */
public final class ValueParsers {

    private static final Pattern SPACES = Pattern.compile("[\\s\\u00A0\\u202F]+");
    private static final Pattern KG_ABBREVIATION = Pattern.compile("\\bkgs?\\b");
    private static final Pattern LITER_ABBREVIATION = Pattern.compile("\\b(l|ltr|lt)\\b");

    private ValueParsers() {
    }

    /**
     * Maps a free-form unit cell onto {@link MeasureUnit}. Weight wins over volume, anything
     * unrecognized counts as pieces.
     *
     * @param raw unit text from the invoice (may be {@code null})
     * @return normalized unit, never {@code null}
     */
    public static MeasureUnit normalizeUnit(String raw) {
        if (raw == null || raw.isBlank()) {
            return MeasureUnit.PIECE;
        }
        String unit = raw.toLowerCase(Locale.ROOT);
        if (unit.contains("кг") || unit.contains("kilogram") || unit.contains("килограмм")
                || KG_ABBREVIATION.matcher(unit).find()) {
            return MeasureUnit.KG;
        }
        if (unit.contains("л") || unit.contains("литр") || unit.contains("liter") || unit.contains("litre")
                || LITER_ABBREVIATION.matcher(unit).find()) {
            return MeasureUnit.LITER;
        }
        return MeasureUnit.PIECE;
    }

    /**
     * Parses a locale-formatted decimal such as {@code "1 234,50"}.
     *
     * @param raw cell text
     * @return parsed value, empty when blank or not a number
     */
    public static Optional<BigDecimal> parseDecimal(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String cleaned = SPACES.matcher(raw).replaceAll("").replace(',', '.');
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(cleaned));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    /**
     * Reads the row-number column.
     *
     * @param raw cell text
     * @return positive row number, empty for headers, footers and blanks
     */
    public static Optional<Integer> parseRowNumber(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.strip();
        if (value.isEmpty() || !value.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        try {
            int number = Integer.parseInt(value);
            return number > 0 ? Optional.of(number) : Optional.empty();
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
