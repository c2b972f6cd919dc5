package com.example.supplymatch.infrastructure.spreadsheet;

import com.example.supplymatch.domain.model.DocumentFormat;
import com.example.supplymatch.domain.model.LineItem;
import com.example.supplymatch.domain.model.MeasureUnit;
import com.example.supplymatch.domain.model.ParsedDocument;
import com.example.supplymatch.domain.parsing.ExtractionProfile;
import com.example.supplymatch.infrastructure.exception.DocumentProcessingException;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SpreadsheetInvoiceAdapterTest {

    private final SpreadsheetInvoiceAdapter adapter = new SpreadsheetInvoiceAdapter(ExtractionProfile.invoiceSpreadsheet());

    @Test
    void extractsLineItemsAndSupplierFromActiveSheet() throws Exception {
        byte[] workbook = createWorkbook();

        ParsedDocument document = adapter.read(workbook, "invoice.xlsx");

        assertThat(document.format()).isEqualTo(DocumentFormat.SPREADSHEET);
        assertThat(document.supplierName()).isEqualTo("Ромашка");
        assertThat(document.lineItems()).extracting(LineItem::name)
                .containsExactly("Молоко 3,2%", "Сыр Моцарелла");

        LineItem milk = document.lineItems().get(0);
        assertThat(milk.unit()).isEqualTo(MeasureUnit.PIECE);
        assertThat(milk.quantity()).isEqualByComparingTo("10");
        assertThat(milk.unitPriceWithTax()).isEqualTo(new BigDecimal("96.00"));
        assertThat(milk.sourceCode()).isEqualTo("375");

        LineItem cheese = document.lineItems().get(1);
        assertThat(cheese.unit()).isEqualTo(MeasureUnit.KG);
        assertThat(cheese.quantity()).isEqualByComparingTo("2.5");
        assertThat(cheese.unitPriceWithTax()).isEqualTo(new BigDecimal("720.00"));
    }

    @Test
    void garbageBytesRaiseProcessingError() {
        byte[] garbage = "not a workbook".getBytes(StandardCharsets.UTF_8);

        assertThrows(DocumentProcessingException.class, () -> adapter.read(garbage, "broken.xlsx"));
    }

    @Test
    void supportsSpreadsheetExtensionsAndContentTypes() {
        assertThat(adapter.supports("invoice.XLSX", null)).isTrue();
        assertThat(adapter.supports("legacy.xls", null)).isTrue();
        assertThat(adapter.supports("upload", "application/vnd.ms-excel")).isTrue();
        assertThat(adapter.supports("invoice.pdf", "application/pdf")).isFalse();
    }

    private byte[] createWorkbook() throws IOException {
        try (Workbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Накладная");
            sheet.createRow(0).createCell(0).setCellValue("Поставщик: «Ромашка»");
            sheet.createRow(1).createCell(0).setCellValue("Покупатель: ООО Кафе");

            Row header = sheet.createRow(3);
            String[] labels = {"№", "Наименование", "Код", "Ед.", "Кол-во", "Цена", "Сумма без НДС", "НДС",
                    "Стоимость с учетом НДС"};
            for (int i = 0; i < labels.length; i++) {
                header.createCell(i).setCellValue(labels[i]);
            }

            Row milk = sheet.createRow(4);
            milk.createCell(0).setCellValue(1);
            milk.createCell(1).setCellValue("Молоко 3,2%");
            milk.createCell(2).setCellValue(375);
            milk.createCell(3).setCellValue("шт");
            milk.createCell(4).setCellValue(10);
            milk.createCell(5).setCellValue(80);
            milk.createCell(8).setCellValue(960);

            Row cheese = sheet.createRow(5);
            cheese.createCell(0).setCellValue(2);
            cheese.createCell(1).setCellValue("Сыр Моцарелла");
            cheese.createCell(3).setCellValue("кг");
            cheese.createCell(4).setCellValue(2.5);
            cheese.createCell(5).setCellValue(600);
            cheese.createCell(8).setCellValue(1800);

            Row total = sheet.createRow(7);
            total.createCell(1).setCellValue("Итого");
            total.createCell(8).setCellValue(2760);

            workbook.write(outputStream);
            return outputStream.toByteArray();
        }
    }
}
