package com.afipvision.core.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Вердикт по документу. overallValid ложен ровно тогда, когда не прошло хотя бы одно обязательное поле.
 * errors и warnings перечисляют все сработавшие правила, а не только первое.
 */
public record ValidationVerdict(boolean overallValid, Map<String, FieldValidation> fieldResults,
                                List<String> errors, List<String> warnings) {
    public ValidationVerdict {
        fieldResults = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fieldResults, "fieldResults")));
        errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
    }

    public Optional<FieldValidation> field(String name) {
        return Optional.ofNullable(fieldResults.get(name));
    }
}
