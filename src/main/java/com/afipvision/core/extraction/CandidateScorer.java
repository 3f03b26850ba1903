package com.afipvision.core.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;

/**
 * Общая оценка кандидата относительно формы поля. Используется и регулярным проходом,
 * и точечным дочитыванием, поэтому оценки сравнимы между собой.
 * Результат — доля набранных баллов от максимума для данной формы, в [0,1].
 */
public final class CandidateScorer {
    private static final Logger log = LoggerFactory.getLogger(CandidateScorer.class);

    static final Set<String> STOP_WORDS = Set.of(
            "el", "la", "los", "las", "de", "del", "en", "con", "por", "para",
            "se", "que", "es", "son", "y", "o", "a");

    private static final double W_LENGTH = 1.0;
    private static final double W_CLEAN = 0.5;
    private static final double W_CHARSET = 0.5;
    private static final double W_LETTERS = 0.5;
    private static final double W_FORMAT = 1.0;
    private static final double W_CHECKSUM = 1.0;
    private static final double W_KEYWORD = 1.0;

    private CandidateScorer() {
        // no-op
    }

    public static double score(String candidate, FieldShape shape) {
        if (candidate == null || candidate.isEmpty()) return 0.0;
        double got = 0, max = 0;
        int len = candidate.length();

        max += W_LENGTH;
        if (len >= shape.plausibleMin() && len <= shape.plausibleMax()) got += W_LENGTH;

        // доля посторонних символов < 30%
        max += W_CLEAN;
        if (specialChars(candidate) < 0.3 * len) got += W_CLEAN;

        if (shape.charset() != null) {
            max += W_CHARSET;
            if (shape.allCharsMatch(candidate)) got += W_CHARSET;
        }
        if (shape.requiresLetters()) {
            max += W_LETTERS;
            if (candidate.codePoints().anyMatch(Character::isLetter)) got += W_LETTERS;
        }
        if (shape.format() != null) {
            max += W_FORMAT;
            if (shape.format().matcher(candidate).matches()) got += W_FORMAT;
        }
        if (shape.checksum() != null) {
            max += W_CHECKSUM;
            if (shape.checksum().test(candidate)) got += W_CHECKSUM;
        }
        if (!shape.keywords().isEmpty()) {
            max += W_KEYWORD;
            if (containsKeyword(candidate, shape)) got += W_KEYWORD;
        }
        double s = got / max;
        if (log.isTraceEnabled()) log.trace("score '{}' = {}", candidate, s);
        return s;
    }

    /** Минимальная пригодность: непусто, не стоп-слово, проходит жёсткую форму. */
    public static boolean isAcceptable(String candidate, FieldShape shape) {
        if (candidate == null || candidate.isBlank()) return false;
        if (STOP_WORDS.contains(candidate.trim().toLowerCase(Locale.ROOT))) return false;
        return shape.accepts(candidate);
    }

    /** Схлопывает пробелы и срезает крайнюю пунктуацию .,:; */
    public static String clean(String raw) {
        if (raw == null) return "";
        String s = raw.replaceAll("\\s+", " ").trim();
        s = s.replaceAll("^[.,:;\\s]+", "").replaceAll("[.,:;\\s]+$", "");
        return s;
    }

    private static int specialChars(String s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!Character.isLetterOrDigit(c) && !Character.isWhitespace(c)) n++;
        }
        return n;
    }

    private static boolean containsKeyword(String candidate, FieldShape shape) {
        String f = fold(candidate);
        for (String kw : shape.keywords()) {
            if (f.contains(fold(kw))) return true;
        }
        return false;
    }

    static String fold(String s) {
        return Normalizer.normalize(s, Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "")
                .toUpperCase(Locale.ROOT);
    }
}
