package com.example.supplymatch.infrastructure.pdf;

import com.example.supplymatch.domain.model.LineItem;
import com.example.supplymatch.domain.parsing.ExtractionProfile;
import com.example.supplymatch.domain.parsing.HeaderVocabulary;
import com.example.supplymatch.domain.parsing.SourceTable;
import com.example.supplymatch.domain.parsing.TableExtractor;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TableLineAssemblerTest {

    private final TableLineAssembler assembler = new TableLineAssembler(HeaderVocabulary.invoicePdf());

    @Test
    void buildsRowsFromHeaderGeometryAndJoinsWrappedText() {
        List<TableLine> page = List.of(
                line(60, token(20, 70, "Invoice"), token(75, 90, "42")),
                header(100),
                line(114, token(20, 26, "1"), token(60, 80, "Milk"), token(205, 211, "2"), token(262, 290, "80.00")),
                line(124, token(60, 90, "whole")),
                line(138, token(20, 26, "2"), token(60, 85, "Bread"), token(205, 211, "1"), token(262, 290, "40.00")),
                line(170, token(60, 85, "Total"), token(262, 295, "120.00")));

        List<SourceTable> tables = assembler.assemble(List.of(page));

        assertThat(tables).singleElement().satisfies(table -> assertThat(table.rows()).containsExactly(
                List.of("No", "Description", "Qty", "Price"),
                List.of("1", "Milk\nwhole", "2", "80.00"),
                List.of("2", "Bread", "1", "40.00")));
    }

    @Test
    void distantOrNumericLinesAreNotContinuations() {
        List<TableLine> page = List.of(
                header(100),
                line(114, token(20, 26, "1"), token(60, 80, "Milk"), token(205, 211, "2"), token(262, 290, "80.00")),
                line(124, token(262, 290, "96.00")),
                line(160, token(60, 90, "note")));

        List<List<String>> rows = assembler.assemble(List.of(page)).get(0).rows();

        assertThat(rows).hasSize(2);
        assertThat(rows.get(1)).containsExactly("1", "Milk", "2", "80.00");
    }

    @Test
    void pagesWithoutHeaderReuseThePreviousLayout() {
        List<TableLine> titlePage = List.of(line(60, token(20, 70, "Invoice")));
        List<TableLine> first = List.of(
                header(100),
                line(114, token(20, 26, "1"), token(60, 80, "Milk"), token(205, 211, "2"), token(262, 290, "80.00")));
        List<TableLine> second = List.of(
                line(40, token(20, 26, "2"), token(60, 80, "Eggs"), token(202, 214, "10"), token(265, 285, "5.00")));

        List<SourceTable> tables = assembler.assemble(List.of(titlePage, first, second));

        assertThat(tables).hasSize(3);
        assertThat(tables.get(0).rows()).isEmpty();
        assertThat(tables.get(2).rows()).containsExactly(
                List.of("No", "Description", "Qty", "Price"),
                List.of("2", "Eggs", "10", "5.00"));
    }

    @Test
    void headerCellsWrappedOverTwoLinesStayTogether() {
        List<TableLine> page = List.of(
                line(100, token(20, 32, "No"), token(60, 120, "Description"), token(200, 230, "Quantity"),
                        token(260, 288, "Price")),
                line(110, token(60, 90, "of"), token(95, 120, "goods")),
                line(124, token(20, 26, "1"), token(60, 80, "Milk"), token(205, 211, "2"), token(262, 290, "80.00")));

        List<List<String>> rows = assembler.assemble(List.of(page)).get(0).rows();

        assertThat(rows.get(0)).containsExactly("No", "Description of goods", "Quantity", "Price");
        assertThat(rows.get(1)).containsExactly("1", "Milk", "2", "80.00");
    }

    @Test
    void rowNumberColumnIsTakenFromTheHeaderWhenItIsNotTheFirstOne() {
        List<TableLine> page = List.of(
                line(100, token(20, 40, "Код"), token(60, 68, "№"), token(90, 170, "Наименование"),
                        token(172, 210, "товара"), token(240, 300, "Количество"), token(330, 360, "Цена")),
                line(114, token(62, 66, "1"), token(90, 130, "Молоко"), token(265, 271, "2"), token(335, 360, "80,00")),
                line(128, token(20, 40, "4607"), token(62, 66, "2"), token(90, 120, "Хлеб"), token(265, 271, "3"),
                        token(335, 360, "40,00")));

        SourceTable table = assembler.assemble(List.of(page)).get(0);

        assertThat(table.rows()).containsExactly(
                List.of("Код", "№", "Наименование товара", "Количество", "Цена"),
                List.of("", "1", "Молоко", "2", "80,00"),
                List.of("4607", "2", "Хлеб", "3", "40,00"));

        List<LineItem> items = new TableExtractor(ExtractionProfile.invoicePdf()).extract(table);
        assertThat(items).extracting(LineItem::name).containsExactly("Молоко", "Хлеб");
        assertThat(items.get(1).quantity()).isEqualByComparingTo(new BigDecimal("3"));
        assertThat(items.get(1).sourceCode()).isEqualTo("4607");
    }

    private static TableLine header(float y) {
        return line(y, token(20, 32, "No"), token(60, 120, "Description"), token(200, 218, "Qty"), token(260, 288, "Price"));
    }

    private static TableLine line(float y, PositionedToken... tokens) {
        TableLine line = new TableLine(y);
        for (PositionedToken token : tokens) {
            line.addToken(token);
        }
        return line;
    }

    private static PositionedToken token(float x, float endX, String text) {
        return new PositionedToken(x, endX, text);
    }
}
