package com.example.supplymatch.infrastructure.pdf;

import com.example.supplymatch.domain.parsing.ColumnRole;
import com.example.supplymatch.domain.parsing.HeaderVocabulary;
import com.example.supplymatch.domain.parsing.ValueParsers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Column geometry derived from a table header: one column per horizontal cluster of header words,
 * split at the midpoints of the gaps between neighbouring clusters.
 */
final class ColumnLayout {

    private static final float CLUSTER_GAP = 3f;

    private final List<Float> boundaries;
    private final List<String> headerCells;
    private final int rowNumberColumn;

    private ColumnLayout(List<Float> boundaries, List<String> headerCells, int rowNumberColumn) {
        this.boundaries = List.copyOf(boundaries);
        this.headerCells = List.copyOf(headerCells);
        this.rowNumberColumn = rowNumberColumn;
    }

    /**
     * Clusters the words of the header band by their horizontal extent. Words that overlap or sit
     * closer than a few points belong to the same column; a column's header text joins its words
     * line by line.
     *
     * @param headerBand header lines, top to bottom
     * @param vocabulary  vocabulary whose row-number markers locate the row-number column
     * @return layout with one column per cluster
     */
    static ColumnLayout fromHeader(List<TableLine> headerBand, HeaderVocabulary vocabulary) {
        List<HeaderWord> words = new ArrayList<>();
        for (int lineIndex = 0; lineIndex < headerBand.size(); lineIndex++) {
            for (PositionedToken token : headerBand.get(lineIndex).tokens()) {
                words.add(new HeaderWord(lineIndex, token));
            }
        }
        words.sort(Comparator.comparing(word -> word.token().x()));

        List<Cluster> clusters = new ArrayList<>();
        Cluster current = null;
        for (HeaderWord word : words) {
            if (current == null || word.token().x() > current.endX + CLUSTER_GAP) {
                current = new Cluster();
                clusters.add(current);
            }
            current.add(word);
        }

        List<Float> boundaries = new ArrayList<>();
        for (int i = 0; i + 1 < clusters.size(); i++) {
            boundaries.add(midpoint(clusters.get(i).endX, clusters.get(i + 1).startX));
        }
        List<String> headerCells = clusters.stream().map(Cluster::text).toList();
        return new ColumnLayout(boundaries, headerCells, findRowNumberColumn(headerCells, vocabulary));
    }

    /**
     * Column whose header cell carries a row-number marker, or column 0 when none does.
     */
    private static int findRowNumberColumn(List<String> headerCells, HeaderVocabulary vocabulary) {
        for (int i = 0; i < headerCells.size(); i++) {
            String cell = headerCells.get(i).toLowerCase(Locale.ROOT).strip();
            if (vocabulary.roleOf(cell).filter(role -> role == ColumnRole.ROW_NUMBER).isPresent()) {
                return i;
            }
        }
        return 0;
    }

    int columnCount() {
        return headerCells.size();
    }

    List<String> headerCells() {
        return headerCells;
    }

    int rowNumberColumn() {
        return rowNumberColumn;
    }

    /**
     * @return {@code true} when the row-number column of {@code cells} holds a positive integer
     */
    boolean startsRow(List<String> cells) {
        return rowNumberColumn < cells.size() && ValueParsers.parseRowNumber(cells.get(rowNumberColumn)).isPresent();
    }

    /**
     * Index of the column whose span contains {@code center}. Everything left of the first
     * boundary falls in column 0 and everything right of the last one in the last column.
     */
    int locateColumn(float center) {
        for (int i = 0; i < boundaries.size(); i++) {
            if (center < boundaries.get(i)) {
                return i;
            }
        }
        return boundaries.size();
    }

    /**
     * Distributes the tokens of a line over the columns.
     *
     * @return cell texts, one per column, empty where the line has nothing
     */
    List<String> cellsOf(TableLine line) {
        List<StringBuilder> builders = new ArrayList<>(columnCount());
        for (int i = 0; i < columnCount(); i++) {
            builders.add(new StringBuilder());
        }
        for (PositionedToken token : line.tokens()) {
            String raw = token.text().strip();
            if (raw.isEmpty()) {
                continue;
            }
            StringBuilder builder = builders.get(locateColumn(token.center()));
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(raw);
        }
        return builders.stream().map(StringBuilder::toString).collect(Collectors.toList());
    }

    private static float midpoint(float left, float right) {
        return left + ((right - left) / 2f);
    }

    private record HeaderWord(int lineIndex, PositionedToken token) {
    }

    private static final class Cluster {
        private final List<HeaderWord> words = new ArrayList<>();
        private float startX = Float.MAX_VALUE;
        private float endX = -Float.MAX_VALUE;

        void add(HeaderWord word) {
            words.add(word);
            startX = Math.min(startX, word.token().x());
            endX = Math.max(endX, word.token().endX());
        }

        String text() {
            return words.stream()
                    .sorted(Comparator.comparingInt(HeaderWord::lineIndex)
                            .thenComparing(word -> word.token().x()))
                    .map(word -> word.token().text().strip())
                    .collect(Collectors.joining(" "));
        }
    }
}
