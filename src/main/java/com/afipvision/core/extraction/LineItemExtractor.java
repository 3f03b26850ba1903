package com.afipvision.core.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Разбор табличных строк товаров/услуг. Строка сопоставляется с первым подходящим шаблоном
 * (AFIP, через "|", нумерованный список, колонки через 2+ пробела).
 */
public final class LineItemExtractor {
    private static final Logger log = LoggerFactory.getLogger(LineItemExtractor.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private record RowPattern(String name, Pattern pattern, Set<String> groups) {}

    private static final String H = "[ \\t]";
    private static final String NUM = "\\d[\\d.,]*";

    private static final List<RowPattern> ROWS = List.of(
            row("afip",
                    "^" + H + "*(?<code>\\S+)" + H + "+(?<desc>\\p{L}.*?)" + H + "+(?<qty>\\d+[.,]\\d+)"
                            + H + "+(?<unit>\\p{L}+)" + H + "+(?<price>" + NUM + ")" + H + "+(?<discPct>\\d+[.,]\\d+)"
                            + H + "+(?<discAmt>" + NUM + ")" + H + "+(?<sub>" + NUM + ")" + H + "*$",
                    "code", "desc", "qty", "unit", "price", "discPct", "discAmt", "sub"),
            row("pipe",
                    "^" + H + "*\\|?" + H + "*(?:(?<code>[A-Za-z0-9\\-]{1,12})" + H + "*\\|" + H + "*)?"
                            + "(?<desc>\\p{L}[^|]*?)" + H + "*\\|" + H + "*(?<qty>\\d+(?:[.,]\\d+)?)" + H + "*\\|"
                            + H + "*\\$?" + H + "*(?<price>" + NUM + ")" + H + "*"
                            + "(?:\\|" + H + "*\\$?" + H + "*(?<sub>" + NUM + ")" + H + "*)?"
                            + "(?:\\|" + H + "*(?<rate>\\d{1,2}(?:[.,]\\d+)?)" + H + "*%" + H + "*)?\\|?" + H + "*$",
                    "code", "desc", "qty", "price", "sub", "rate"),
            row("numbered",
                    "^" + H + "*\\d{1,3}[.)]" + H + "+(?<desc>\\p{L}.*?)" + H + "+(?<qty>\\d+(?:[.,]\\d+)?)" + H
                            + "*[xX×]" + H + "*\\$?" + H + "*(?<price>" + NUM + ")"
                            + "(?:" + H + "*=" + H + "*\\$?" + H + "*(?<sub>" + NUM + "))?" + H + "*$",
                    "desc", "qty", "price", "sub"),
            row("columns",
                    "^" + H + "*(?<desc>\\p{L}[\\p{L}\\d .\\-/]*?)" + H + "{2,}(?<qty>\\d+(?:[.,]\\d+)?)" + H
                            + "{2,}\\$?" + H + "*(?<price>" + NUM + ")"
                            + "(?:" + H + "{2,}\\$?" + H + "*(?<sub>" + NUM + "))?" + H + "*$",
                    "desc", "qty", "price", "sub"));

    private LineItemExtractor() {
        // no-op
    }

    private static RowPattern row(String name, String re, String... groups) {
        return new RowPattern(name, Pattern.compile(re, Pattern.UNICODE_CASE), Set.of(groups));
    }

    public static List<LineItem> extract(String text) {
        List<LineItem> out = new ArrayList<>();
        if (text == null || text.isBlank()) return out;
        Set<String> seen = new HashSet<>();
        for (String line : text.split("\\R")) {
            if (line.isBlank()) continue;
            for (RowPattern rp : ROWS) {
                Matcher m = rp.pattern().matcher(line);
                if (!m.matches()) continue;
                LineItem item = toItem(rp, m);
                if (item == null) break;
                String key = descriptionKey(item.description());
                if (seen.add(key)) {
                    out.add(item);
                    log.debug("line item [{}]: {}", rp.name(), item);
                } else {
                    log.debug("line item duplicate skipped: '{}'", item.description());
                }
                break;
            }
        }
        return out;
    }

    /**
     * Для вычисленных строк проставляет отклонение суммы строк от извлечённого подытога документа.
     */
    public static List<LineItem> withDocumentDeviation(List<LineItem> items, BigDecimal documentSubtotal) {
        if (documentSubtotal == null || documentSubtotal.signum() <= 0 || items.isEmpty()) return items;
        BigDecimal sum = sumSubtotals(items);
        double dev = relativeDeviation(sum, documentSubtotal);
        List<LineItem> out = new ArrayList<>(items.size());
        for (LineItem it : items) {
            out.add(it.source() == FieldSource.COMPUTED ? it.withDeviation(dev) : it);
        }
        return out;
    }

    public static BigDecimal sumSubtotals(List<LineItem> items) {
        BigDecimal sum = BigDecimal.ZERO;
        for (LineItem it : items) {
            if (it.subtotal() != null) sum = sum.add(it.subtotal());
        }
        return sum.setScale(2, RoundingMode.HALF_UP);
    }

    static double relativeDeviation(BigDecimal actual, BigDecimal expected) {
        if (expected.signum() == 0) return actual.signum() == 0 ? 0.0 : 1.0;
        return actual.subtract(expected).abs()
                .divide(expected.abs(), 6, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private static LineItem toItem(RowPattern rp, Matcher m) {
        String desc = CandidateScorer.clean(group(rp, m, "desc"));
        BigDecimal qty = amount(group(rp, m, "qty"));
        BigDecimal price = amount(group(rp, m, "price"));
        if (desc.isEmpty() || qty == null || price == null) return null;

        BigDecimal discPct = amount(group(rp, m, "discPct"));
        BigDecimal discAmt = amount(group(rp, m, "discAmt"));
        BigDecimal sub = amount(group(rp, m, "sub"));
        BigDecimal rate = amount(group(rp, m, "rate"));

        BigDecimal gross = qty.multiply(price);
        BigDecimal discount = discAmt != null && discAmt.signum() > 0
                ? discAmt
                : (discPct != null ? gross.multiply(discPct).divide(HUNDRED, 6, RoundingMode.HALF_UP) : BigDecimal.ZERO);
        BigDecimal expected = gross.subtract(discount).setScale(2, RoundingMode.HALF_UP);

        boolean computed = false;
        Double deviation = null;
        if (sub == null) {
            sub = expected;
            computed = true;
        } else if (sub.signum() > 0) {
            deviation = relativeDeviation(expected, sub);
        }
        BigDecimal tax = null;
        if (rate != null) {
            tax = sub.multiply(rate).divide(HUNDRED, 2, RoundingMode.HALF_UP);
            computed = true;
        }
        return new LineItem(group(rp, m, "code"), desc, qty, price, discPct, discAmt, sub, rate, tax,
                computed ? FieldSource.COMPUTED : FieldSource.GENERAL_OCR, deviation);
    }

    private static String group(RowPattern rp, Matcher m, String name) {
        return rp.groups().contains(name) ? m.group(name) : null;
    }

    private static BigDecimal amount(String s) {
        return s == null ? null : Amounts.parse(s).orElse(null);
    }

    static String descriptionKey(String desc) {
        return Normalizer.normalize(desc, Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ")
                .trim();
    }
}
