package com.afipvision.core.image;

/** Уровень сложности OCR. Порядок объявления совпадает с ростом оценки. */
public enum ComplexityTier {
    SIMPLE,
    MEDIUM,
    COMPLEX;

    /** Монотонное разбиение [0,1] двумя порогами: [0,simpleBelow) [simpleBelow,mediumBelow) [mediumBelow,1]. */
    public static ComplexityTier of(double value, double simpleBelow, double mediumBelow) {
        if (value < simpleBelow) return SIMPLE;
        if (value < mediumBelow) return MEDIUM;
        return COMPLEX;
    }
}
