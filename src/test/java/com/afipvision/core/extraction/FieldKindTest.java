package com.afipvision.core.extraction;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldKindTest {

    @Test
    void invoiceLetterFromLetterOrAfipCode() {
        assertEquals("A", FieldKind.INVOICE_LETTER.normalize("a"));
        assertEquals("A", FieldKind.INVOICE_LETTER.normalize("001"));
        assertEquals("B", FieldKind.INVOICE_LETTER.normalize("6"));
        assertEquals("C", FieldKind.INVOICE_LETTER.normalize("011"));
        assertEquals("M", FieldKind.INVOICE_LETTER.normalize("51"));
        assertNull(FieldKind.INVOICE_LETTER.normalize("99"));
        assertNull(FieldKind.INVOICE_LETTER.normalize("X"));
    }

    @Test
    void digitKindsDropSeparators() {
        assertEquals("30712345671", FieldKind.CUIT.normalize("30-71234567-1"));
        assertEquals("30712345671", FieldKind.CUIT.normalize("30.71234567.1"));
        assertEquals("12345678", FieldKind.DNI.normalize("12.345.678"));
        assertNull(FieldKind.CAE.normalize("N/A"));
    }

    @Test
    void decimalAndCode() {
        assertEquals("8.75", FieldKind.DECIMAL.normalize("8,75"));
        assertEquals("F", FieldKind.CODE.normalize("f."));
        assertEquals("1234.56", FieldKind.AMOUNT.normalize("$ 1.234,56"));
        assertEquals("05/03/2024", FieldKind.DATE.normalize("5/3/2024"));
    }

    @Test
    void onlyChecksumKindsAreRecoverable() {
        assertTrue(FieldKind.CAE.isRecoverable());
        assertTrue(FieldKind.CUIT.isRecoverable());
        assertTrue(FieldKind.AMOUNT.isRecoverable());
        assertFalse(FieldKind.DATE.isRecoverable());
        assertFalse(FieldKind.NAME.isRecoverable());
    }
}
