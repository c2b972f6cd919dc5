package com.example.supplymatch.infrastructure.spreadsheet;

import com.example.supplymatch.application.port.DocumentAdapter;
import com.example.supplymatch.domain.model.DocumentFormat;
import com.example.supplymatch.domain.model.LineItem;
import com.example.supplymatch.domain.model.ParsedDocument;
import com.example.supplymatch.domain.parsing.ExtractionProfile;
import com.example.supplymatch.domain.parsing.SourcePage;
import com.example.supplymatch.domain.parsing.SourceTable;
import com.example.supplymatch.domain.parsing.SupplierNameExtractor;
import com.example.supplymatch.domain.parsing.TableExtractor;
import com.example.supplymatch.infrastructure.exception.DocumentProcessingException;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads spreadsheet invoices ({@code .xlsx} and legacy {@code .xls}) with Apache POI. The active
 * sheet is treated as a single table.
 */
public class SpreadsheetInvoiceAdapter implements DocumentAdapter {

    static final int SUPPLIER_SEARCH_ROWS = 14;
    private static final Set<String> CONTENT_TYPES = Set.of(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
            "application/vnd.ms-excel");

    private final TableExtractor extractor;

    public SpreadsheetInvoiceAdapter(ExtractionProfile profile) {
        this.extractor = new TableExtractor(profile);
    }

    @Override
    public DocumentFormat format() {
        return DocumentFormat.SPREADSHEET;
    }

    @Override
    public boolean supports(String fileName, String contentType) {
        if (contentType != null && CONTENT_TYPES.contains(contentType.toLowerCase(Locale.ROOT))) {
            return true;
        }
        if (fileName == null) {
            return false;
        }
        String lowered = fileName.toLowerCase(Locale.ROOT);
        return lowered.endsWith(".xlsx") || lowered.endsWith(".xls");
    }

    @Override
    public ParsedDocument read(byte[] content, String fileName) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            Sheet sheet = workbook.getSheetAt(workbook.getActiveSheetIndex());
            List<List<String>> rows = readRows(sheet);
            String supplierName = SupplierNameExtractor.fromHeaderCells(firstColumn(rows)).orElse(null);
            List<LineItem> items = extractor.extract(List.of(new SourcePage(1, List.of(new SourceTable(rows)))));
            return new ParsedDocument(fileName, DocumentFormat.SPREADSHEET, items, supplierName);
        } catch (IOException | RuntimeException e) {
            throw new DocumentProcessingException("Unable to process the spreadsheet " + fileName + ".", e);
        }
    }

    private List<List<String>> readRows(Sheet sheet) {
        List<List<String>> rows = new ArrayList<>();
        for (int rowIndex = 0; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
            Row row = sheet.getRow(rowIndex);
            List<String> cells = new ArrayList<>();
            if (row != null) {
                for (int cellIndex = 0; cellIndex < row.getLastCellNum(); cellIndex++) {
                    cells.add(cellText(row.getCell(cellIndex)));
                }
            }
            rows.add(cells);
        }
        return rows;
    }

    private List<String> firstColumn(List<List<String>> rows) {
        List<String> cells = new ArrayList<>();
        for (int i = 0; i < rows.size() && i < SUPPLIER_SEARCH_ROWS; i++) {
            List<String> row = rows.get(i);
            cells.add(row.isEmpty() ? "" : row.get(0));
        }
        return cells;
    }

    static String cellText(Cell cell) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING:
                return cell.getStringCellValue().strip();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate().toString();
                }
                return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return "";
        }
    }
}
