package com.afipvision.core.recovery;

import java.util.List;
import java.util.Map;

/**
 * Замены часто путаемых OCR глифов на цифры: O→0, I/l→1, S→5, B→8, G→6, Z→2, T→7.
 * Таблица подобрана вручную и не претендует на оптимальность.
 */
public final class CorrectionMap {

    static final Map<Character, Character> TO_DIGIT = Map.ofEntries(
            Map.entry('O', '0'), Map.entry('o', '0'), Map.entry('Q', '0'),
            Map.entry('I', '1'), Map.entry('l', '1'), Map.entry('i', '1'), Map.entry('|', '1'),
            Map.entry('S', '5'), Map.entry('s', '5'),
            Map.entry('B', '8'),
            Map.entry('G', '6'),
            Map.entry('Z', '2'), Map.entry('z', '2'),
            Map.entry('T', '7'));

    private CorrectionMap() {
        // no-op
    }

    /** Замена во всей строке без условий. */
    public static String apply(String s) {
        if (s == null) return null;
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            sb.append(TO_DIGIT.getOrDefault(c, c));
        }
        return sb.toString();
    }

    /**
     * Замена только в токенах, где уже есть цифра: "2O24IO15" → "20241015", а метки вида "CAE"
     * остаются как есть.
     */
    public static String toDigits(String raw) {
        if (raw == null) return null;
        StringBuilder out = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            int j = i;
            boolean space = Character.isWhitespace(raw.charAt(i));
            while (j < raw.length() && Character.isWhitespace(raw.charAt(j)) == space) j++;
            String token = raw.substring(i, j);
            out.append(!space && hasDigit(token) ? apply(token) : token);
            i = j;
        }
        return out.toString();
    }

    /**
     * Исправленные версии сырого текста: сначала по токенам с цифрами, затем полная замена
     * (для полностью искажённых чисел вроде "IOIS"). Дубликаты убираются.
     */
    public static List<String> variants(String raw) {
        if (raw == null) return List.of();
        String byToken = toDigits(raw);
        String full = apply(raw);
        return byToken.equals(full) ? List.of(byToken) : List.of(byToken, full);
    }

    private static boolean hasDigit(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= '0' && c <= '9') return true;
        }
        return false;
    }
}
