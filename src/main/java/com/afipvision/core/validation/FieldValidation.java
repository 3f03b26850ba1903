package com.afipvision.core.validation;

/**
 * Итог проверки одного поля.
 *
 * @param confidence уверенность извлечения для прошедшего поля; для непрошедшего — оценка валидатора
 * @param message    причина отказа или null
 */
public record FieldValidation(boolean valid, double confidence, String message) {
    public FieldValidation {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
    }

    public static FieldValidation pass(double confidence) {
        return new FieldValidation(true, confidence, null);
    }

    public static FieldValidation fail(double confidence, String message) {
        return new FieldValidation(false, confidence, message);
    }
}
