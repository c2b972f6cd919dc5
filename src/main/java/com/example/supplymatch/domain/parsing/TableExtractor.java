package com.example.supplymatch.domain.parsing;

import com.example.supplymatch.domain.model.LineItem;
import com.example.supplymatch.domain.model.MeasureUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns tables of cell strings into normalized {@link LineItem}s.
 * <p>
 * A table contributes rows only after a header row has been recognized; the header's column map
 * then stays active for the following tables of the same page, since long invoices continue the
 * product table in a separate table without repeating the header. The map is dropped at every
 * page boundary.
 */
public class TableExtractor {

    private static final Logger log = LoggerFactory.getLogger(TableExtractor.class);
    private static final Pattern ARTICLE_SUFFIX = Pattern.compile("\\s*\\*[\\p{L}\\p{N}_]+\\s*$");
    private static final Pattern DIGITS_ONLY = Pattern.compile("\\d+");
    private static final int MIN_HEADER_CELLS = 3;
    private static final int MAX_SOURCE_CODE_LENGTH = 80;

    private final ExtractionProfile profile;

    public TableExtractor(ExtractionProfile profile) {
        this.profile = profile;
    }

    /**
     * Extracts line items from every table of every page, in document order.
     *
     * @param pages pages of the source document
     * @return extracted items, empty when no header was found
     */
    public List<LineItem> extract(List<SourcePage> pages) {
        List<LineItem> items = new ArrayList<>();
        if (pages == null) {
            return items;
        }
        boolean headerSeen = false;
        for (SourcePage page : pages) {
            Map<ColumnRole, Integer> columns = null;
            for (SourceTable table : page.tables()) {
                List<List<String>> rows = table.rows();
                for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
                    List<String> row = rows.get(rowIndex);
                    if (row == null || row.isEmpty()) {
                        continue;
                    }
                    if (rowIndex < profile.headerLookahead() && isHeaderRow(row)) {
                        columns = resolveColumns(row);
                        headerSeen = true;
                        log.debug("Header on page {} mapped to columns {}", page.number(), columns);
                        continue;
                    }
                    if (columns == null) {
                        continue;
                    }
                    toLineItem(row, columns).ifPresent(items::add);
                }
            }
        }
        if (!headerSeen) {
            log.warn("No product table header found in {} page(s) of the {} document.", pages.size(), profile.format());
        }
        return items;
    }

    /**
     * Extracts line items from a single table treated as a one-page document.
     */
    public List<LineItem> extract(SourceTable table) {
        return extract(List.of(new SourcePage(1, List.of(table))));
    }

    boolean isHeaderRow(List<String> row) {
        long nonEmpty = row.stream().filter(cell -> cell != null && !cell.isBlank()).count();
        if (nonEmpty < MIN_HEADER_CELLS) {
            return false;
        }
        StringBuilder joined = new StringBuilder();
        for (String cell : row) {
            if (joined.length() > 0) {
                joined.append(' ');
            }
            joined.append(lower(cell));
        }
        return profile.vocabulary().looksLikeHeader(joined.toString());
    }

    Map<ColumnRole, Integer> resolveColumns(List<String> headerRow) {
        Map<ColumnRole, Integer> columns = profile.newColumnMap();
        HeaderVocabulary vocabulary = profile.vocabulary();
        for (int i = 0; i < headerRow.size(); i++) {
            int index = i;
            vocabulary.roleOf(lower(headerRow.get(i)).strip())
                    .ifPresent(role -> columns.put(role, index));
        }
        return columns;
    }

    private Optional<LineItem> toLineItem(List<String> row, Map<ColumnRole, Integer> columns) {
        String rowNumber = cell(row, columns, ColumnRole.ROW_NUMBER);
        if (ValueParsers.parseRowNumber(rowNumber).isEmpty()) {
            return Optional.empty();
        }

        String name = cleanName(cell(row, columns, ColumnRole.NAME));
        if (name.isEmpty() || DIGITS_ONLY.matcher(name).matches() || containsSkipWord(name)) {
            log.debug("Skipping row {}: name '{}' is not a product", rowNumber.strip(), name);
            return Optional.empty();
        }

        Optional<BigDecimal> quantity = ValueParsers.parseDecimal(cell(row, columns, ColumnRole.QUANTITY));
        if (quantity.isEmpty() || quantity.get().signum() <= 0) {
            log.debug("Skipping row {} ('{}'): quantity missing or not positive", rowNumber.strip(), name);
            return Optional.empty();
        }

        MeasureUnit unit = ValueParsers.normalizeUnit(cell(row, columns, ColumnRole.UNIT));
        BigDecimal price = unitPrice(quantity.get(),
                ValueParsers.parseDecimal(cell(row, columns, ColumnRole.TOTAL_WITH_TAX)),
                ValueParsers.parseDecimal(cell(row, columns, ColumnRole.UNIT_PRICE)));
        String code = cell(row, columns, ColumnRole.CODE).strip();
        if (code.length() > MAX_SOURCE_CODE_LENGTH) {
            code = code.substring(0, MAX_SOURCE_CODE_LENGTH);
        }
        return Optional.of(new LineItem(name, unit, quantity.get(), price, code));
    }

    private BigDecimal unitPrice(BigDecimal quantity, Optional<BigDecimal> total, Optional<BigDecimal> price) {
        if (total.isPresent() && total.get().signum() > 0) {
            return total.get().divide(quantity, 2, RoundingMode.HALF_UP);
        }
        if (price.isPresent() && price.get().signum() > 0) {
            return price.get().setScale(2, RoundingMode.HALF_UP);
        }
        return BigDecimal.ZERO.setScale(2);
    }

    private boolean containsSkipWord(String name) {
        String lowered = name.toLowerCase(Locale.ROOT);
        return profile.skipWords().stream().anyMatch(lowered::contains);
    }

    static String cleanName(String raw) {
        String name = raw.strip().replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
        return ARTICLE_SUFFIX.matcher(name).replaceAll("").strip();
    }

    private static String cell(List<String> row, Map<ColumnRole, Integer> columns, ColumnRole role) {
        Integer index = columns.get(role);
        if (index == null || index < 0 || index >= row.size()) {
            return "";
        }
        String value = row.get(index);
        return value == null ? "" : value;
    }

    private static String lower(String cell) {
        return cell == null ? "" : cell.toLowerCase(Locale.ROOT);
    }
}
