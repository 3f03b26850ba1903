package com.afipvision.core.ocr;

/** OCR-провайдеры. Порядок объявления облачных — порядок приоритета при понижении. */
public enum Provider {
    /** Облачный провайдер общего назначения повышенной точности. */
    CLOUD_A,
    /** Облачный провайдер для форм и структурированной разметки. */
    CLOUD_B,
    /** Локальный движок (Tesseract): без квоты, последнее звено цепочки. */
    LOCAL;

    public boolean isCloud() {
        return this != LOCAL;
    }
}
