package com.afipvision.core.validation;

import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Формальные проверки CUIT (mod-11) и CAE (закодированная дата YYYYMMDDHHMMSS).
 * Каждая проверка перечисляет все сработавшие правила, а не только первое.
 */
public final class ChecksumValidators {

    private static final int[] CUIT_WEIGHTS = {5, 4, 3, 2, 7, 6, 5, 4, 3, 2};
    /** Допустимые префиксы CUIT: физлица 20/23/24/25/26/27, юрлица 30/33/34. */
    public static final Set<String> CUIT_PREFIXES = Set.of("20", "23", "24", "25", "26", "27", "30", "33", "34");

    public static final int CUIT_LENGTH = 11;
    public static final int CAE_LENGTH = 14;

    /** Результат проверки: нормализованные цифры и список нарушенных правил. */
    public record Check(boolean valid, String digits, List<String> failures) {
        public Check {
            failures = List.copyOf(failures);
        }
    }

    private final int caeYearMin;
    private final int caeYearMax;

    public ChecksumValidators(int caeYearMin, int caeYearMax) {
        if (caeYearMin > caeYearMax) {
            throw new IllegalArgumentException("caeYearMin > caeYearMax: " + caeYearMin + " > " + caeYearMax);
        }
        this.caeYearMin = caeYearMin;
        this.caeYearMax = caeYearMax;
    }

    public static ChecksumValidators defaults() {
        return new ChecksumValidators(2000, 2035);
    }

    public int caeYearMin() { return caeYearMin; }
    public int caeYearMax() { return caeYearMax; }

    public boolean isValidCuit(String raw) {
        return checkCuit(raw).valid();
    }

    public boolean isValidCae(String raw) {
        return checkCae(raw).valid();
    }

    public Check checkCuit(String raw) {
        String d = digitsOnly(raw);
        List<String> failures = new ArrayList<>();
        if (d.length() != CUIT_LENGTH) {
            failures.add("CUIT must have 11 digits, got " + d.length());
            return new Check(false, d, failures);
        }
        String prefix = d.substring(0, 2);
        if (!CUIT_PREFIXES.contains(prefix)) {
            failures.add("CUIT prefix " + prefix + " is not allowed");
        }
        int expected = cuitCheckDigit(d);
        int actual = d.charAt(10) - '0';
        if (expected != actual) {
            failures.add("CUIT check digit mismatch: expected " + expected + ", got " + actual);
        }
        return new Check(failures.isEmpty(), d, failures);
    }

    /** Контрольная цифра по первым 10 цифрам: остаток<2 ? остаток : 11-остаток. */
    static int cuitCheckDigit(String digits) {
        int sum = 0;
        for (int i = 0; i < CUIT_WEIGHTS.length; i++) {
            sum += (digits.charAt(i) - '0') * CUIT_WEIGHTS[i];
        }
        int remainder = sum % 11;
        return remainder < 2 ? remainder : 11 - remainder;
    }

    public Check checkCae(String raw) {
        String d = digitsOnly(raw);
        List<String> failures = new ArrayList<>();
        if (d.length() != CAE_LENGTH) {
            failures.add("CAE must have 14 digits, got " + d.length());
            return new Check(false, d, failures);
        }
        int year = Integer.parseInt(d.substring(0, 4));
        int month = Integer.parseInt(d.substring(4, 6));
        int day = Integer.parseInt(d.substring(6, 8));
        int hour = Integer.parseInt(d.substring(8, 10));
        int minute = Integer.parseInt(d.substring(10, 12));
        int second = Integer.parseInt(d.substring(12, 14));

        if (year < caeYearMin || year > caeYearMax) {
            failures.add("CAE year " + year + " outside " + caeYearMin + ".." + caeYearMax);
        }
        if (month < 1 || month > 12) {
            failures.add("CAE month " + month + " out of range");
        } else if (day < 1 || !YearMonth.of(year, month).isValidDay(day)) {
            failures.add("CAE day " + day + " invalid for " + year + "-" + month);
        }
        if (hour > 23) failures.add("CAE hour " + hour + " out of range");
        if (minute > 59) failures.add("CAE minute " + minute + " out of range");
        if (second > 59) failures.add("CAE second " + second + " out of range");
        return new Check(failures.isEmpty(), d, failures);
    }

    /** Дата-время, закодированное в валидном CAE. */
    public Optional<LocalDateTime> caeTimestamp(String raw) {
        Check c = checkCae(raw);
        if (!c.valid()) return Optional.empty();
        String d = c.digits();
        return Optional.of(LocalDateTime.of(
                Integer.parseInt(d.substring(0, 4)),
                Integer.parseInt(d.substring(4, 6)),
                Integer.parseInt(d.substring(6, 8)),
                Integer.parseInt(d.substring(8, 10)),
                Integer.parseInt(d.substring(10, 12)),
                Integer.parseInt(d.substring(12, 14))));
    }

    /** Каноническая запись CUIT: XX-XXXXXXXX-X. */
    public static String formatCuit(String raw) {
        String d = digitsOnly(raw);
        if (d.length() != CUIT_LENGTH) return d;
        return d.substring(0, 2) + "-" + d.substring(2, 10) + "-" + d.substring(10);
    }

    static String digitsOnly(String raw) {
        if (raw == null) return "";
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c >= '0' && c <= '9') sb.append(c);
        }
        return sb.toString();
    }
}
