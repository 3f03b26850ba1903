package com.afipvision.core.ocr;

import java.util.Objects;

/**
 * Текст от движка и его собственная оценка уверенности в [0,1]; -1 — движок оценку не дал.
 */
public record OcrText(String text, double confidence) {
    public static final double UNKNOWN = -1.0;

    public OcrText {
        Objects.requireNonNull(text, "text");
        if (confidence != UNKNOWN && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
    }

    public static OcrText of(String text) {
        return new OcrText(text == null ? "" : text, UNKNOWN);
    }

    public boolean hasConfidence() {
        return confidence != UNKNOWN;
    }
}
