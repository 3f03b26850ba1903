package com.afipvision.core.extraction;

/** Откуда получено значение поля. */
public enum FieldSource {
    /** Регулярный проход по общему тексту OCR. */
    GENERAL_OCR,
    /** Точечное повторное OCR областей изображения. */
    RECOVERY_OCR,
    /** Вычислено из других значений. */
    COMPUTED
}
