package com.afipvision.core.ocr;

/**
 * Настройки одного вызова движка.
 *
 * @param psm               Page Segmentation Mode (6 — блок, 7 — строка, 8 — слово, 13 — сырая строка)
 * @param whitelist         допустимые символы, null — без ограничения
 * @param measureConfidence считать ли среднюю уверенность по словам (дорого для Tesseract)
 */
public record OcrConfig(int psm, String whitelist, boolean measureConfidence) {
    public static final String DIGITS = "0123456789";
    public static final String AMOUNT_CHARS = "0123456789.,$";

    public OcrConfig {
        if (psm < 0 || psm > 13) throw new IllegalArgumentException("psm out of 0..13: " + psm);
    }

    /** Полная страница: блок текста, уверенность нужна для выбора стратегии. */
    public static OcrConfig page(int psm) {
        return new OcrConfig(psm, null, true);
    }

    public static OcrConfig region(int psm, String whitelist) {
        return new OcrConfig(psm, whitelist, false);
    }
}
