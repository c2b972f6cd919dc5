package com.example.supplymatch.infrastructure.pdf;

import com.example.supplymatch.domain.parsing.HeaderVocabulary;
import com.example.supplymatch.domain.parsing.SourceTable;
import com.example.supplymatch.domain.parsing.ValueParsers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rebuilds table rows from the positioned lines of a PDF page.
 * <p>
 * The header is found as a band of up to four lines that names both the product and the quantity
 * columns. Its words give the column geometry and the row-number column, which is the first one
 * unless a header cell is labelled as such. Below it, every line whose row-number column holds a
 * row number starts a new row, and lines directly underneath that carry no number at all are
 * wrapped text of that row. A page without a header of its own is read with the layout of the
 * previous page.
 */
public class TableLineAssembler {

    private static final Logger log = LoggerFactory.getLogger(TableLineAssembler.class);
    static final int MAX_HEADER_LINES = 4;
    static final float CONTINUATION_GAP = 12f;
    private static final int MIN_HEADER_COLUMNS = 3;
    private static final Pattern NUMERIC_CELL = Pattern.compile("[-+]?[\\d\\s\\u00A0\\u202F]+([.,]\\d+)?");

    private final HeaderVocabulary vocabulary;

    public TableLineAssembler(HeaderVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * Assembles the rows of every page.
     *
     * @param pages lines of each page, top to bottom
     * @return one table per page, the header row first; pages before the first header yield an empty table
     */
    public List<SourceTable> assemble(List<List<TableLine>> pages) {
        List<SourceTable> tables = new ArrayList<>();
        ColumnLayout layout = null;
        for (int pageIndex = 0; pageIndex < pages.size(); pageIndex++) {
            List<TableLine> lines = pages.get(pageIndex);
            int bodyStart = 0;
            HeaderBand band = findHeaderBand(lines);
            if (band != null) {
                layout = ColumnLayout.fromHeader(lines.subList(band.start(), band.end()), vocabulary);
                bodyStart = band.end();
                log.debug("Page {}: header with {} column(s) {}, row numbers in column {}", pageIndex + 1,
                        layout.columnCount(), layout.headerCells(), layout.rowNumberColumn() + 1);
            } else if (layout != null) {
                log.debug("Page {}: no header, continuing with the previous page's columns", pageIndex + 1);
            }
            if (layout == null) {
                tables.add(new SourceTable(List.of()));
                continue;
            }
            tables.add(new SourceTable(assembleRows(layout, lines.subList(bodyStart, lines.size()))));
        }
        return tables;
    }

    List<List<String>> assembleRows(ColumnLayout layout, List<TableLine> body) {
        List<List<String>> rows = new ArrayList<>();
        rows.add(layout.headerCells());
        List<String> currentRow = null;
        TableLine previous = null;
        for (TableLine line : body) {
            List<String> cells = layout.cellsOf(line);
            if (layout.startsRow(cells)) {
                currentRow = new ArrayList<>(cells);
                rows.add(currentRow);
            } else if (currentRow != null && continues(previous, line, cells)) {
                appendContinuation(currentRow, cells);
            } else {
                currentRow = null;
            }
            previous = line;
        }
        return rows;
    }

    private HeaderBand findHeaderBand(List<TableLine> lines) {
        for (int start = 0; start < lines.size(); start++) {
            if (startsWithRowNumber(lines.get(start)) || !mentionsColumn(lines.get(start))) {
                continue;
            }
            StringBuilder text = new StringBuilder();
            int end = start;
            while (end < lines.size() && end - start < MAX_HEADER_LINES) {
                TableLine line = lines.get(end);
                if (end > start && startsWithRowNumber(line)) {
                    break;
                }
                text.append(' ').append(line.text().toLowerCase(Locale.ROOT));
                end++;
                if (vocabulary.looksLikeHeader(text.toString())) {
                    ColumnLayout candidate = ColumnLayout.fromHeader(lines.subList(start, end), vocabulary);
                    if (candidate.columnCount() >= MIN_HEADER_COLUMNS) {
                        return new HeaderBand(start, extendBand(lines, end, start, candidate));
                    }
                }
            }
        }
        return null;
    }

    /**
     * Keeps adding lines to a recognized header until the first row number or the band limit, so
     * header cells that wrap onto further lines stay in the header.
     */
    private int extendBand(List<TableLine> lines, int end, int start, ColumnLayout candidate) {
        int extended = end;
        while (extended < lines.size()
                && extended - start < MAX_HEADER_LINES
                && !startsWithRowNumber(lines.get(extended))
                && !candidate.startsRow(candidate.cellsOf(lines.get(extended)))
                && !hasNumericToken(lines.get(extended))) {
            extended++;
        }
        return extended;
    }

    /**
     * A header band has to begin on a line naming the product or the quantity column, so titles
     * and seller blocks above the table never become header cells.
     */
    private boolean mentionsColumn(TableLine line) {
        String text = line.text().toLowerCase(Locale.ROOT);
        return vocabulary.nameMarkers().stream().anyMatch(text::contains)
                || vocabulary.quantityMarkers().stream().anyMatch(text::contains);
    }

    /**
     * Row test used while no column geometry is known yet: the leftmost word is a row number.
     */
    private static boolean startsWithRowNumber(TableLine line) {
        List<PositionedToken> tokens = line.tokens();
        return !tokens.isEmpty() && ValueParsers.parseRowNumber(tokens.get(0).text()).isPresent();
    }

    private static boolean hasNumericToken(TableLine line) {
        return line.tokens().stream().anyMatch(token -> NUMERIC_CELL.matcher(token.text().strip()).matches());
    }

    private static boolean continues(TableLine previous, TableLine line, List<String> cells) {
        if (previous == null || line.y() - previous.y() > CONTINUATION_GAP) {
            return false;
        }
        return cells.stream().noneMatch(cell -> !cell.isBlank() && NUMERIC_CELL.matcher(cell.strip()).matches());
    }

    private static void appendContinuation(List<String> row, List<String> cells) {
        for (int i = 0; i < cells.size() && i < row.size(); i++) {
            String addition = cells.get(i);
            if (addition.isBlank()) {
                continue;
            }
            String existing = row.get(i);
            row.set(i, existing.isEmpty() ? addition : existing + "\n" + addition);
        }
    }

    private record HeaderBand(int start, int end) {
    }
}
