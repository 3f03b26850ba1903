package com.afipvision.core.extraction;

import java.util.Objects;

/**
 * Значение поля: сырой фрагмент, нормализованная форма и источник.
 * confidence — оценка извлечения в [0,1], переносится в отчёт валидации.
 */
public record FieldValue(String raw, String normalized, FieldSource source, double confidence) {
    public FieldValue {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(normalized, "normalized");
        Objects.requireNonNull(source, "source");
        if (normalized.isEmpty()) throw new IllegalArgumentException("normalized is empty");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
    }
}
