package com.afipvision.core.extraction;

import java.text.Normalizer;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Нормализация дат к DD/MM/YYYY с проверкой календаря (включая високосные годы). */
public final class Dates {

    private static final Pattern NUMERIC = Pattern.compile("^(\\d{1,2})[/.\\-](\\d{1,2})[/.\\-](\\d{4}|\\d{2})$");
    private static final Pattern SPANISH = Pattern.compile(
            "^(\\d{1,2})\\s+de\\s+(\\p{L}+)\\s+(?:de|del)\\s+(\\d{4})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CANONICAL = Pattern.compile("^(\\d{2})/(\\d{2})/(\\d{4})$");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("enero", 1), Map.entry("febrero", 2), Map.entry("marzo", 3),
            Map.entry("abril", 4), Map.entry("mayo", 5), Map.entry("junio", 6),
            Map.entry("julio", 7), Map.entry("agosto", 8), Map.entry("septiembre", 9),
            Map.entry("setiembre", 9), Map.entry("octubre", 10), Map.entry("noviembre", 11),
            Map.entry("diciembre", 12));

    private Dates() {
        // no-op
    }

    /** Возвращает DD/MM/YYYY или null, если строка не является датой календаря. */
    public static String normalize(String raw) {
        if (raw == null) return null;
        String s = raw.trim().replaceAll("\\s+", " ");
        int d, m, y;
        Matcher n = NUMERIC.matcher(s);
        Matcher sp = SPANISH.matcher(s);
        if (n.matches()) {
            d = Integer.parseInt(n.group(1));
            m = Integer.parseInt(n.group(2));
            y = Integer.parseInt(n.group(3));
            if (n.group(3).length() == 2) y += 2000;
        } else if (sp.matches()) {
            Integer month = MONTHS.get(fold(sp.group(2)));
            if (month == null) return null;
            d = Integer.parseInt(sp.group(1));
            m = month;
            y = Integer.parseInt(sp.group(3));
        } else {
            return null;
        }
        if (!isCalendarValid(d, m, y)) return null;
        return String.format(Locale.ROOT, "%02d/%02d/%04d", d, m, y);
    }

    public static boolean isCalendarValid(String canonical) {
        return parse(canonical).isPresent();
    }

    /** Разбор канонической DD/MM/YYYY. */
    public static Optional<LocalDate> parse(String canonical) {
        if (canonical == null) return Optional.empty();
        Matcher c = CANONICAL.matcher(canonical);
        if (!c.matches()) return Optional.empty();
        int d = Integer.parseInt(c.group(1));
        int m = Integer.parseInt(c.group(2));
        int y = Integer.parseInt(c.group(3));
        if (!isCalendarValid(d, m, y)) return Optional.empty();
        return Optional.of(LocalDate.of(y, m, d));
    }

    static boolean isCalendarValid(int d, int m, int y) {
        if (y < 1 || m < 1 || m > 12 || d < 1) return false;
        return YearMonth.of(y, m).isValidDay(d);
    }

    private static String fold(String s) {
        return Normalizer.normalize(s, Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT);
    }
}
