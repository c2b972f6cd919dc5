package com.example.supplymatch.domain.parsing;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the seller's name on an invoice, either in the free text of a PDF page or in the header
 * cells of a spreadsheet.
 */
public final class SupplierNameExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final int MIN_NAME_LENGTH = 3;
    private static final int MAX_NAME_LENGTH = 120;

    private static final List<Pattern> TEXT_PATTERNS = List.of(
            Pattern.compile("продавец\\s*[:\\s]+([^\\n]+)", FLAGS),
            Pattern.compile("seller\\s*[:\\s]+([^\\n]+)", FLAGS),
            Pattern.compile("поставщик\\s*[:\\s]+([^\\n]+)", FLAGS),
            Pattern.compile("продавец\\s*\\n\\s*([^\\n]+)", FLAGS),
            Pattern.compile("[\"«]([^\"»]+)[\"»]\\s*[^\\n]*именуемое[^\\n]*исполнитель", FLAGS),
            Pattern.compile("исполнитель[^\\n]*[«\"]([^»\"]+)[»\"]", FLAGS)
    );

    private static final List<String> CELL_MARKERS = List.of("поставщик", "продавец", "seller");
    private static final Pattern CELL_NAME = Pattern.compile("[:\\s]+[«\"“”]?([A-Za-zА-Яа-яЁё0-9\\s\\-.]+)");

    private static final Pattern BUYER_TAIL = Pattern.compile("\\s*[;,]?\\s*покупатель\\s*:.*$", FLAGS);
    private static final Pattern BUYER_TAIL_EN = Pattern.compile("\\s*[;,]?\\s*buyer\\s*:.*$", FLAGS);
    private static final Pattern INN_TAIL = Pattern.compile("\\s*[,;]\\s*и[\\sн]+\\.?\\s*\\d+.*", FLAGS);
    private static final Pattern KPP_TAIL = Pattern.compile("\\s*[,;]\\s*к[\\sп]+п\\.?\\s*\\d+.*", FLAGS);
    private static final Pattern ADDRESS_TAIL = Pattern.compile("\\s*,\\s*[\\d\\s\\-]+.*");
    private static final Pattern NOT_A_NAME = Pattern.compile("^[\\d\\s\\-.]+$");

    private SupplierNameExtractor() {
    }

    /**
     * Searches page text for the seller block of a счёт-фактура or a contract-style invoice.
     *
     * @param text text of the first page
     * @return cleaned supplier name
     */
    public static Optional<String> fromText(String text) {
        if (text == null || text.length() < 5) {
            return Optional.empty();
        }
        for (Pattern pattern : TEXT_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                continue;
            }
            String name = matcher.group(1).strip();
            name = BUYER_TAIL.matcher(name).replaceAll("");
            name = BUYER_TAIL_EN.matcher(name).replaceAll("");
            name = INN_TAIL.matcher(name).replaceAll("");
            name = KPP_TAIL.matcher(name).replaceAll("");
            name = ADDRESS_TAIL.matcher(name).replaceAll("");
            name = name.replace("\"", "").strip();
            if (name.length() >= MIN_NAME_LENGTH && !NOT_A_NAME.matcher(name).matches()) {
                return Optional.of(truncate(name));
            }
        }
        return Optional.empty();
    }

    /**
     * Searches spreadsheet header cells, typically the first column of the first rows, for a
     * {@code Поставщик: ...} style label.
     *
     * @param cells cell texts in row order
     * @return cleaned supplier name
     */
    public static Optional<String> fromHeaderCells(List<String> cells) {
        if (cells == null) {
            return Optional.empty();
        }
        for (String cell : cells) {
            if (cell == null || cell.isBlank()) {
                continue;
            }
            String lowered = cell.toLowerCase(Locale.ROOT);
            for (String marker : CELL_MARKERS) {
                int position = lowered.indexOf(marker);
                if (position < 0) {
                    continue;
                }
                Matcher matcher = CELL_NAME.matcher(cell.substring(position + marker.length()));
                if (!matcher.find()) {
                    continue;
                }
                String name = stripQuotes(matcher.group(1).strip());
                name = BUYER_TAIL.matcher(name).replaceAll("");
                if (name.length() >= MIN_NAME_LENGTH) {
                    return Optional.of(truncate(name));
                }
            }
        }
        return Optional.empty();
    }

    private static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isQuote(value.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '«' || c == '»' || c == '“' || c == '”';
    }

    private static String truncate(String name) {
        return name.length() > MAX_NAME_LENGTH ? name.substring(0, MAX_NAME_LENGTH) : name;
    }
}
