package com.example.supplymatch.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LineItemTest {

    @Test
    void acceptsPositiveQuantity() {
        LineItem item = new LineItem("Молоко", MeasureUnit.PIECE, new BigDecimal("0.5"), new BigDecimal("80.00"), "");

        assertThat(item.quantity()).isEqualByComparingTo("0.5");
    }

    @Test
    void rejectsMissingZeroOrNegativeQuantity() {
        assertThatThrownBy(() -> new LineItem("Молоко", MeasureUnit.PIECE, null, BigDecimal.ONE, ""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LineItem("Молоко", MeasureUnit.PIECE, BigDecimal.ZERO, BigDecimal.ONE, ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("quantity must be positive");
        assertThatThrownBy(() -> new LineItem("Молоко", MeasureUnit.PIECE, new BigDecimal("-2"), BigDecimal.ONE, ""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
