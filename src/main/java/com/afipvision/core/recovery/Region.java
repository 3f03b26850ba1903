package com.afipvision.core.recovery;

import org.bytedeco.opencv.opencv_core.Rect;

/**
 * Область документа в долях ширины/высоты (0..1), не зависит от разрешения снимка.
 */
public record Region(double x, double y, double w, double h) {
    public Region {
        if (x < 0 || y < 0 || w <= 0 || h <= 0 || x + w > 1.0001 || y + h > 1.0001) {
            throw new IllegalArgumentException("region out of unit square: " + x + "," + y + "," + w + "," + h);
        }
    }

    /** Прямоугольник в пикселях, обрезанный по границам изображения. */
    public Rect toRect(int cols, int rows) {
        int rx = clamp((int) Math.round(cols * x), 0, cols - 1);
        int ry = clamp((int) Math.round(rows * y), 0, rows - 1);
        int rw = clamp((int) Math.round(cols * w), 1, cols - rx);
        int rh = clamp((int) Math.round(rows * h), 1, rows - ry);
        return new Rect(rx, ry, rw, rh);
    }

    private static int clamp(int v, int lo, int hi) { return Math.max(lo, Math.min(hi, v)); }
}
