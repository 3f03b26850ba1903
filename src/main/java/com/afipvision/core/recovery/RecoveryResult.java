package com.afipvision.core.recovery;

import java.util.Objects;

/** Итог точечного дочитывания: нормализованное значение и уверенность; пустое значение — не найдено. */
public record RecoveryResult(String value, double confidence) {
    public RecoveryResult {
        Objects.requireNonNull(value, "value");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
        if (value.isEmpty() && confidence != 0.0) {
            throw new IllegalArgumentException("empty value must have zero confidence");
        }
    }

    public static RecoveryResult empty() {
        return new RecoveryResult("", 0.0);
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }
}
