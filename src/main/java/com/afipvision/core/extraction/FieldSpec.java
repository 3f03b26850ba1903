package com.afipvision.core.extraction;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Описание поля документа: упорядоченные регулярные выражения (сначала точные, потом свободные),
 * вид и форма значения, флаги обязательности и критичности.
 *
 * @param ordinal для полей с общей меткой (CUIT продавца и покупателя): индекс n-го различного
 *                совпадения по порядку в тексте; -1 — выбирается лучший по оценке
 */
public record FieldSpec(String name, FieldKind kind, FieldShape shape, List<Pattern> patterns,
                        boolean required, boolean critical, int ordinal) {
    public FieldSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(shape, "shape");
        patterns = List.copyOf(Objects.requireNonNull(patterns, "patterns"));
        if (ordinal < -1) throw new IllegalArgumentException("ordinal < -1");
    }

    public boolean isOrdinal() {
        return ordinal >= 0;
    }
}
