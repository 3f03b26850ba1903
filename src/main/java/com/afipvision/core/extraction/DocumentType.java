package com.afipvision.core.extraction;

import java.util.Locale;
import java.util.Optional;

/** Тип распознаваемого документа. */
public enum DocumentType {
    AFIP_INVOICE,
    RECEIPT,
    FORM,
    DNI,
    ACADEMIC_CERTIFICATE,
    GENERIC;

    /** Финансовые документы: для них на MEDIUM выбирается точный облачный провайдер. */
    public boolean isFinancial() {
        return this == AFIP_INVOICE || this == RECEIPT;
    }

    public boolean isForm() {
        return this == FORM;
    }

    /** Разбор из CLI/конфига: "afip_invoice", "AFIP-INVOICE", "factura" и т.п. */
    public static Optional<DocumentType> parse(String s) {
        if (s == null || s.isBlank()) return Optional.empty();
        String k = s.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        switch (k) {
            case "FACTURA", "INVOICE", "AFIP" -> { return Optional.of(AFIP_INVOICE); }
            case "RECIBO" -> { return Optional.of(RECEIPT); }
            case "FORMULARIO" -> { return Optional.of(FORM); }
            case "TITULO", "CERTIFICADO", "ACADEMIC" -> { return Optional.of(ACADEMIC_CERTIFICATE); }
            default -> { }
        }
        for (DocumentType t : values()) {
            if (t.name().equals(k)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
