package com.afipvision.core.ocr;

import java.util.Objects;

/** Результат общего OCR документа. */
public record RawOcrResult(String text, double confidence, Provider providerUsed, double costUnits, long elapsedMs) {
    public RawOcrResult {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(providerUsed, "providerUsed");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
        if (costUnits < 0) throw new IllegalArgumentException("costUnits < 0");
        if (elapsedMs < 0) throw new IllegalArgumentException("elapsedMs < 0");
    }

    /** Пустой текст с нулевой уверенностью: терминальный результат низкого качества. */
    public static RawOcrResult empty(Provider provider, long elapsedMs) {
        return new RawOcrResult("", 0.0, provider, 0.0, elapsedMs);
    }

    public boolean isEmpty() {
        return text.isBlank();
    }
}
