package com.afipvision.core.ocr;

/** Временный отказ OCR-движка (недоступен, ошибка распознавания, сбой SDK). */
public class OcrBackendException extends Exception {
    public OcrBackendException(String message) {
        super(message);
    }

    public OcrBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
