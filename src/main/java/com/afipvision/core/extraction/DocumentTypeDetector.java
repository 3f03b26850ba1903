package com.afipvision.core.extraction;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Определение типа документа по тексту, когда вызывающий не передал подсказку.
 */
public final class DocumentTypeDetector {

    /** Признаки электронной фактуры AFIP (сравнение без диакритики, в нижнем регистре). */
    static final List<String> AFIP_INDICATORS = List.of(
            "afip", "comprobante autorizado", "cae", "punto de venta", "comp. nro",
            "fecha de emision", "condicion frente al iva", "responsable monotributo",
            "consumidor final", "cuit:", "razon social", "domicilio comercial",
            "importe total", "subtotal");

    static final int AFIP_MIN_INDICATORS = 5;

    private static final Pattern DNI = Pattern.compile("documento nacional de identidad|\\bd\\.?n\\.?i\\b");
    private static final Pattern ACADEMIC = Pattern.compile("universidad|\\btitulo\\b|certificado analitico|analitico de materias");

    private DocumentTypeDetector() {
        // no-op
    }

    public static DocumentType detect(String text) {
        if (text == null || text.isBlank()) return DocumentType.GENERIC;
        String t = fold(text);
        if (afipIndicators(t) >= AFIP_MIN_INDICATORS) return DocumentType.AFIP_INVOICE;
        if (t.contains("recibo")) return DocumentType.RECEIPT;
        if (DNI.matcher(t).find()) return DocumentType.DNI;
        if (ACADEMIC.matcher(t).find()) return DocumentType.ACADEMIC_CERTIFICATE;
        if (t.contains("formulario")) return DocumentType.FORM;
        if (t.contains("factura")) return DocumentType.AFIP_INVOICE;
        return DocumentType.GENERIC;
    }

    static int afipIndicators(String folded) {
        int n = 0;
        for (String ind : AFIP_INDICATORS) if (folded.contains(ind)) n++;
        return n;
    }

    private static String fold(String s) {
        return Normalizer.normalize(s, Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[ \\t]+", " ");
    }
}
