package com.afipvision.core.extraction;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTypeDetectorTest {

    @Test
    void invoiceByIndicators() {
        String text = """
                Razón Social: ACME S.A.
                Domicilio Comercial: Av. Siempreviva 742
                Punto de Venta: 00001  Comp. Nro: 00000123
                Fecha de Emisión: 15/10/2024
                Importe Total: $ 1.210,00
                """;
        assertEquals(DocumentType.AFIP_INVOICE, DocumentTypeDetector.detect(text));
    }

    @Test
    void keywordFallbacks() {
        assertEquals(DocumentType.RECEIPT, DocumentTypeDetector.detect("RECIBO N° 123"));
        assertEquals(DocumentType.DNI, DocumentTypeDetector.detect("DOCUMENTO NACIONAL DE IDENTIDAD"));
        assertEquals(DocumentType.ACADEMIC_CERTIFICATE,
                DocumentTypeDetector.detect("Universidad de Buenos Aires\nCertificado analítico"));
        assertEquals(DocumentType.FORM, DocumentTypeDetector.detect("Formulario 931"));
        assertEquals(DocumentType.AFIP_INVOICE, DocumentTypeDetector.detect("Factura B"));
    }

    @Test
    void unknownTextIsGeneric() {
        assertEquals(DocumentType.GENERIC, DocumentTypeDetector.detect("hola mundo"));
        assertEquals(DocumentType.GENERIC, DocumentTypeDetector.detect(""));
        assertEquals(DocumentType.GENERIC, DocumentTypeDetector.detect(null));
    }

    @Test
    void parseAcceptsAliases() {
        assertEquals(DocumentType.AFIP_INVOICE, DocumentType.parse("factura").orElseThrow());
        assertEquals(DocumentType.AFIP_INVOICE, DocumentType.parse("afip-invoice").orElseThrow());
        assertEquals(DocumentType.DNI, DocumentType.parse("dni").orElseThrow());
        assertTrue(DocumentType.parse("pasaporte").isEmpty());
        assertTrue(DocumentType.parse(" ").isEmpty());
    }
}
