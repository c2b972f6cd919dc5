package com.example.supplymatch.domain.parsing;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SupplierNameExtractorTest {

    @Test
    void readsSellerLineAndDropsTaxIdentifiers() {
        String text = "Счёт-фактура № 15 от 01.02.2024\n"
                + "Продавец: ООО \"Ромашка\", ИНН 7701234567\n"
                + "Покупатель: ООО Кафе\n";

        assertThat(SupplierNameExtractor.fromText(text)).contains("ООО Ромашка");
    }

    @Test
    void readsEnglishSellerAndDropsAddress() {
        String text = "Invoice 42\nSeller: Fresh Farm LLC, 12 Main street\nBuyer: Cafe\n";

        assertThat(SupplierNameExtractor.fromText(text)).contains("Fresh Farm LLC");
    }

    @Test
    void readsContractorFromContractStyleInvoice() {
        String text = "Общество с ограниченной ответственностью «Ромашка», именуемое в дальнейшем Исполнитель, и заказчик\n";

        assertThat(SupplierNameExtractor.fromText(text)).contains("Ромашка");
    }

    @Test
    void rejectsNumericOrMissingNames() {
        assertThat(SupplierNameExtractor.fromText("Продавец: 12345\nИтого")).isEmpty();
        assertThat(SupplierNameExtractor.fromText("Товарная накладная\nИтого 100")).isEmpty();
        assertThat(SupplierNameExtractor.fromText(null)).isEmpty();
    }

    @Test
    void readsSupplierFromSpreadsheetHeaderCells() {
        List<String> cells = Arrays.asList("", null, "Поставщик: «Ромашка»", "Покупатель: ООО Кафе");

        assertThat(SupplierNameExtractor.fromHeaderCells(cells)).contains("Ромашка");
    }

    @Test
    void headerCellsWithoutSellerLabelYieldNothing() {
        assertThat(SupplierNameExtractor.fromHeaderCells(List.of("Накладная № 7", "Дата: 01.02.2024"))).isEmpty();
    }
}
