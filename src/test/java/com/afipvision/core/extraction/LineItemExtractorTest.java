package com.afipvision.core.extraction;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineItemExtractorTest {

    private static BigDecimal bd(String s) {
        return new BigDecimal(s);
    }

    @Test
    void numberedRowsWithAndWithoutSubtotal() {
        String text = """
                1. Teclado USB 2 x 1.500,00 = 3.000,00
                2. Mouse inalámbrico 4 x 250,00
                3. TECLADO usb 1 x 10,00
                """;
        List<LineItem> items = LineItemExtractor.extract(text);
        // третья строка повторяет описание первой
        assertEquals(2, items.size());

        LineItem first = items.get(0);
        assertEquals("Teclado USB", first.description());
        assertEquals(0, bd("3000.00").compareTo(first.subtotal()));
        assertEquals(FieldSource.GENERAL_OCR, first.source());
        assertEquals(0.0, first.deviation(), 1e-9);

        LineItem second = items.get(1);
        assertEquals(FieldSource.COMPUTED, second.source());
        assertEquals(0, bd("1000.00").compareTo(second.subtotal()));
        assertNull(second.deviation());

        assertEquals(bd("4000.00"), LineItemExtractor.sumSubtotals(items));
    }

    @Test
    void documentDeviationOnlyForComputedRows() {
        List<LineItem> items = LineItemExtractor.extract("""
                1. Teclado USB 2 x 1.500,00 = 3.000,00
                2. Mouse inalámbrico 4 x 250,00
                """);
        List<LineItem> out = LineItemExtractor.withDocumentDeviation(items, bd("4100.00"));
        assertEquals(0.0, out.get(0).deviation(), 1e-9);
        assertEquals(100.0 / 4100.0, out.get(1).deviation(), 1e-5);

        // без подытога документа ничего не меняется
        assertSame(items, LineItemExtractor.withDocumentDeviation(items, null));
    }

    @Test
    void columnRow() {
        List<LineItem> items = LineItemExtractor.extract("Resma A4  10  4.500,00  45.000,00");
        assertEquals(1, items.size());
        LineItem it = items.get(0);
        assertEquals("Resma A4", it.description());
        assertEquals(0, bd("10").compareTo(it.quantity()));
        assertEquals(0, bd("45000.00").compareTo(it.subtotal()));
        assertEquals(FieldSource.GENERAL_OCR, it.source());
    }

    @Test
    void pipeRowWithTaxRateIsComputed() {
        List<LineItem> items = LineItemExtractor.extract("| Servicio de soporte | 2 | 500,00 | 1000,00 | 21 % |");
        assertEquals(1, items.size());
        LineItem it = items.get(0);
        assertEquals("Servicio de soporte", it.description());
        assertEquals(0, bd("210.00").compareTo(it.taxAmount()));
        assertEquals(0, bd("21").compareTo(it.taxRate()));
        assertEquals(FieldSource.COMPUTED, it.source());
    }

    @Test
    void afipRowWithUnitAndDiscounts() {
        List<LineItem> items = LineItemExtractor.extract(
                "001 Servicio mensual 1,00 unidades 1000,00 0,00 0,00 1000,00");
        assertEquals(1, items.size());
        LineItem it = items.get(0);
        assertEquals("001", it.code());
        assertEquals("Servicio mensual", it.description());
        assertEquals(0, bd("1000.00").compareTo(it.subtotal()));
        assertEquals(FieldSource.GENERAL_OCR, it.source());
        assertEquals(0.0, it.deviation(), 1e-9);
    }

    @Test
    void labelsAndFreeTextAreNotRows() {
        assertTrue(LineItemExtractor.extract("Importe Total: $ 1.234,56\nCAE N°: 20241015123456").isEmpty());
        assertTrue(LineItemExtractor.extract("").isEmpty());
        assertTrue(LineItemExtractor.extract(null).isEmpty());
    }

    @Test
    void descriptionKeyIgnoresCaseAndAccents() {
        assertEquals(LineItemExtractor.descriptionKey("Mouse  Inalámbrico"),
                LineItemExtractor.descriptionKey("mouse inalambrico"));
    }
}
