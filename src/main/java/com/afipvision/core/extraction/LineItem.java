package com.afipvision.core.extraction;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Строка товара/услуги. Необязательные суммы — null.
 * source = COMPUTED, если subtotal или taxAmount вычислены; deviation — относительное отклонение
 * от имеющегося итога (строки или документа), null если сравнивать не с чем.
 */
public record LineItem(String code, String description, BigDecimal quantity, BigDecimal unitPrice,
                       BigDecimal discountPercent, BigDecimal discountAmount, BigDecimal subtotal,
                       BigDecimal taxRate, BigDecimal taxAmount, FieldSource source, Double deviation) {
    public LineItem {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(source, "source");
        if (description.isBlank()) throw new IllegalArgumentException("description is blank");
        if (source == FieldSource.RECOVERY_OCR) {
            throw new IllegalArgumentException("line items are never produced by recovery OCR");
        }
    }

    public LineItem withDeviation(Double d) {
        return new LineItem(code, description, quantity, unitPrice, discountPercent, discountAmount,
                subtotal, taxRate, taxAmount, source, d);
    }
}
