package com.afipvision.report;

import com.afipvision.core.extraction.FieldValue;
import com.afipvision.core.extraction.LineItem;
import com.afipvision.core.pipeline.ProcessedDocument;
import com.afipvision.core.validation.FieldValidation;
import com.afipvision.core.validation.ValidationVerdict;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Текстовый отчёт по обработанному документу для CLI. */
public final class ReportFormat {

    private ReportFormat() {
        // no-op
    }

    public static List<String> format(ProcessedDocument p) {
        List<String> out = new ArrayList<>();
        ValidationVerdict v = p.verdict();
        out.add("== " + (p.documentId() == null ? "-" : p.documentId())
                + " | " + p.documentType()
                + " | " + (v.overallValid() ? "VALID" : "INVALID"));
        if (p.complexity() != null) {
            out.add(String.format(Locale.ROOT, "complexity: %.2f %s", p.complexity().value(), p.complexity().tier()));
        }
        if (p.ocr() != null) {
            out.add(String.format(Locale.ROOT, "ocr: %s conf=%.2f cost=%.4f %d ms",
                    p.ocr().providerUsed(), p.ocr().confidence(), p.ocr().costUnits(), p.ocr().elapsedMs()));
        }
        for (Map.Entry<String, FieldValue> e : p.document().fields().entrySet()) {
            out.add(formatField(e.getKey(), e.getValue(), v.fieldResults().get(e.getKey())));
        }
        // обязательные поля, которых нет в документе
        for (Map.Entry<String, FieldValidation> e : v.fieldResults().entrySet()) {
            if (!p.document().fields().containsKey(e.getKey())) {
                out.add("  " + e.getKey() + " = <missing> !! " + e.getValue().message());
            }
        }
        int i = 1;
        for (LineItem it : p.document().lineItems()) {
            out.add(formatItem(i++, it));
        }
        for (String e : v.errors()) out.add("ERROR " + e);
        for (String w : v.warnings()) out.add("WARN  " + w);
        return out;
    }

    /** "  name = value [SOURCE 0.95]" и пометка "!! причина" для непрошедшего поля. */
    static String formatField(String name, FieldValue value, FieldValidation check) {
        String line = String.format(Locale.ROOT, "  %s = %s [%s %.2f]",
                name, value.normalized(), value.source(), value.confidence());
        if (check != null && !check.valid()) line += " !! " + check.message();
        return line;
    }

    static String formatItem(int n, LineItem it) {
        StringBuilder sb = new StringBuilder("  #").append(n).append(' ');
        if (it.code() != null) sb.append('[').append(it.code()).append("] ");
        sb.append(it.description())
                .append(" | qty=").append(plain(it.quantity()))
                .append(" | price=").append(plain(it.unitPrice()))
                .append(" | subtotal=").append(plain(it.subtotal()));
        if (it.taxAmount() != null) sb.append(" | tax=").append(plain(it.taxAmount()));
        sb.append(" | ").append(it.source());
        if (it.deviation() != null) sb.append(String.format(Locale.ROOT, " dev=%.4f", it.deviation()));
        return sb.toString();
    }

    private static String plain(BigDecimal v) {
        return v == null ? "-" : v.stripTrailingZeros().toPlainString();
    }
}
