package com.afipvision.core.extraction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Нормализация денежных сумм: "1.234,56", "1,234.56", "$ 1234,56" → "1234.56".
 * Каноническая форма — десятичная запись с точкой и двумя знаками после неё.
 */
public final class Amounts {

    private Amounts() {
        // no-op
    }

    public static String normalize(String raw) {
        return parse(raw).map(Amounts::format).orElse(null);
    }

    public static String format(BigDecimal v) {
        return v.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    public static Optional<BigDecimal> parse(String raw) {
        if (raw == null) return Optional.empty();
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if ((c >= '0' && c <= '9') || c == '.' || c == ',') sb.append(c);
        }
        String s = sb.toString();
        // хвостовые разделители от пунктуации предложения
        while (!s.isEmpty() && (s.endsWith(".") || s.endsWith(","))) s = s.substring(0, s.length() - 1);
        while (!s.isEmpty() && (s.startsWith(".") || s.startsWith(","))) s = s.substring(1);
        if (s.isEmpty()) return Optional.empty();

        int lastDot = s.lastIndexOf('.');
        int lastComma = s.lastIndexOf(',');
        String plain;
        if (lastDot >= 0 && lastComma >= 0) {
            // десятичный — последний из двух
            char dec = lastDot > lastComma ? '.' : ',';
            char thou = dec == '.' ? ',' : '.';
            plain = s.replace(String.valueOf(thou), "");
            if (plain.indexOf(dec) != plain.lastIndexOf(dec)) return Optional.empty();
            plain = plain.replace(dec, '.');
        } else if (lastComma >= 0) {
            plain = single(s, ',');
        } else if (lastDot >= 0) {
            plain = single(s, '.');
        } else {
            plain = s;
        }
        try {
            return Optional.of(new BigDecimal(plain).setScale(2, RoundingMode.HALF_UP));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Один вид разделителя: единственное вхождение с хвостом не из 3 цифр — десятичный,
     * иначе разделитель тысяч.
     */
    private static String single(String s, char sep) {
        int first = s.indexOf(sep);
        int last = s.lastIndexOf(sep);
        int tail = s.length() - last - 1;
        if (first == last && tail != 3) {
            return s.replace(sep, '.');
        }
        return s.replace(String.valueOf(sep), "");
    }
}
