package com.afipvision.core.extraction;

import com.afipvision.core.validation.ChecksumValidators;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Вид поля: задаёт нормализацию и форму значения.
 */
public enum FieldKind {
    CAE,
    CUIT,
    AMOUNT,
    DATE,
    POINT_OF_SALE,
    INVOICE_NUMBER,
    DOC_NUMBER,
    DNI,
    INVOICE_LETTER,
    CODE,
    DECIMAL,
    NAME,
    TEXT;

    /** Поля с контрольной суммой, которые SpecializedFieldRecovery умеет дочитывать. */
    public boolean isRecoverable() {
        return this == CAE || this == CUIT || this == AMOUNT;
    }

    public boolean isNumeric() {
        return switch (this) {
            case CAE, CUIT, AMOUNT, POINT_OF_SALE, INVOICE_NUMBER, DOC_NUMBER, DNI, DECIMAL -> true;
            default -> false;
        };
    }

    public FieldShape shape(ChecksumValidators v) {
        return switch (this) {
            case CAE -> FieldShape.digits(ChecksumValidators.CAE_LENGTH, Pattern.compile("\\d{14}"), v::isValidCae);
            case CUIT -> FieldShape.digits(ChecksumValidators.CUIT_LENGTH, Pattern.compile("\\d{11}"), v::isValidCuit);
            case AMOUNT -> new FieldShape(4, 16, 4, 16, Pattern.compile("[0-9.]"),
                    Pattern.compile("\\d+\\.\\d{2}"), null, false, List.of());
            case DATE -> new FieldShape(10, 10, 10, 10, Pattern.compile("[0-9/]"),
                    Pattern.compile("\\d{2}/\\d{2}/\\d{4}"), Dates::isCalendarValid, false, List.of());
            case POINT_OF_SALE -> FieldShape.digits(1, 5);
            case INVOICE_NUMBER -> FieldShape.digits(1, 8);
            case DOC_NUMBER -> FieldShape.digits(1, 16);
            case DNI -> FieldShape.digits(7, 8);
            case INVOICE_LETTER -> new FieldShape(1, 1, 1, 1, Pattern.compile("[ABCEM]"), null, null, false, List.of());
            case CODE -> new FieldShape(1, 3, 1, 3, Pattern.compile("[A-Z0-9]"), null, null, false, List.of());
            case DECIMAL -> new FieldShape(1, 8, 1, 8, Pattern.compile("[0-9.]"),
                    Pattern.compile("\\d+(\\.\\d+)?"), null, false, List.of());
            case NAME -> FieldShape.text(2, 120, true);
            case TEXT -> FieldShape.text(2, 200, false);
        };
    }

    /**
     * Приведение очищенного кандидата к канонической форме. null — не приводится.
     */
    public String normalize(String cleaned) {
        if (cleaned == null || cleaned.isBlank()) return null;
        String s = cleaned.trim();
        return switch (this) {
            case CAE, CUIT, POINT_OF_SALE, INVOICE_NUMBER, DOC_NUMBER, DNI -> {
                String d = s.replaceAll("[^0-9]", "");
                yield d.isEmpty() ? null : d;
            }
            case AMOUNT -> Amounts.normalize(s);
            case DATE -> Dates.normalize(s);
            case INVOICE_LETTER -> invoiceLetter(s);
            case CODE -> s.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
            case DECIMAL -> {
                String d = s.replace(',', '.').replaceAll("[^0-9.]", "");
                yield d.isEmpty() ? null : d;
            }
            case NAME, TEXT -> s;
        };
    }

    /** Буква типа счёта: "C" или код AFIP ("011" → C). */
    private static String invoiceLetter(String s) {
        String up = s.toUpperCase(Locale.ROOT);
        if (up.matches("[ABCEM]")) return up;
        if (!up.matches("\\d{1,3}")) return null;
        return switch (Integer.parseInt(up)) {
            case 1, 2, 3 -> "A";
            case 6, 7, 8 -> "B";
            case 11, 12, 13 -> "C";
            case 19, 20, 21 -> "E";
            case 51, 52, 53 -> "M";
            default -> null;
        };
    }
}
