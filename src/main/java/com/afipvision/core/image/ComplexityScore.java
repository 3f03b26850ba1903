package com.afipvision.core.image;

import com.afipvision.app.Config;

import java.util.Objects;

/**
 * Эвристическая оценка трудности OCR в [0,1]. Это не калиброванная вероятность:
 * веса и пороги подобраны вручную и вынесены в конфигурацию.
 */
public record ComplexityScore(double value, ComplexityTier tier) {
    public ComplexityScore {
        Objects.requireNonNull(tier, "tier");
        if (value < 0.0 || value > 1.0) throw new IllegalArgumentException("value out of [0,1]: " + value);
    }

    public static ComplexityScore of(double value, Config.ComplexityConf cfg) {
        double v = Math.max(0.0, Math.min(1.0, value));
        return new ComplexityScore(v, ComplexityTier.of(v, cfg.simpleBelow(), cfg.mediumBelow()));
    }

    /** Для нечитаемого изображения: середина диапазона MEDIUM. */
    public static ComplexityScore unreadable(Config.ComplexityConf cfg) {
        return of((cfg.simpleBelow() + cfg.mediumBelow()) / 2.0, cfg);
    }
}
