package com.afipvision.core.extraction;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Ожидаемая форма нормализованного значения поля.
 * minLength/maxLength и charset — жёсткие границы приёма; plausibleMin/plausibleMax — полоса,
 * за попадание в которую CandidateScorer даёт бонус.
 *
 * @param charset         класс одного символа (например {@code [0-9]}), null — любой
 * @param format          полный шаблон значения, null — без проверки
 * @param checksum        контрольная проверка, null — нет
 * @param requiresLetters бонус за наличие букв (имена, названия)
 * @param keywords        ключевые слова, дающие бонус (сравнение без учёта регистра и диакритики)
 */
public record FieldShape(int minLength, int maxLength, int plausibleMin, int plausibleMax,
                         Pattern charset, Pattern format, Predicate<String> checksum,
                         boolean requiresLetters, List<String> keywords) {

    public FieldShape {
        if (minLength < 1 || maxLength < minLength) {
            throw new IllegalArgumentException("bad length bounds: " + minLength + ".." + maxLength);
        }
        if (plausibleMin < minLength || plausibleMax > maxLength || plausibleMax < plausibleMin) {
            throw new IllegalArgumentException("plausible band outside length bounds");
        }
        keywords = List.copyOf(Objects.requireNonNull(keywords, "keywords"));
    }

    public static FieldShape digits(int exact, Pattern format, Predicate<String> checksum) {
        return new FieldShape(exact, exact, exact, exact, Pattern.compile("[0-9]"), format, checksum, false, List.of());
    }

    public static FieldShape digits(int min, int max) {
        return new FieldShape(min, max, min, max, Pattern.compile("[0-9]"),
                Pattern.compile("\\d{" + min + "," + max + "}"), null, false, List.of());
    }

    public static FieldShape text(int min, int max, boolean requiresLetters) {
        return new FieldShape(min, max, Math.max(min, 5), Math.min(max, 100), null, null, null, requiresLetters, List.of());
    }

    public FieldShape withKeywords(List<String> kw) {
        return new FieldShape(minLength, maxLength, plausibleMin, plausibleMax, charset, format, checksum, requiresLetters, kw);
    }

    /** Жёсткая проверка формы: длина и допустимые символы. */
    public boolean accepts(String value) {
        if (value == null) return false;
        int len = value.length();
        if (len < minLength || len > maxLength) return false;
        return charset == null || allCharsMatch(value);
    }

    boolean allCharsMatch(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (!charset.matcher(String.valueOf(value.charAt(i))).matches()) return false;
        }
        return true;
    }
}
