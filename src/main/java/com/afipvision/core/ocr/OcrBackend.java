package com.afipvision.core.ocr;

import java.awt.image.BufferedImage;

/**
 * Контракт OCR-движка (локального или облачного): распознать изображение или его фрагмент.
 * Любой сбой сообщается через {@link OcrBackendException}; вызывающий трактует его как
 * временный отказ провайдера.
 */
@FunctionalInterface
public interface OcrBackend {
    OcrText recognize(BufferedImage image, OcrConfig config) throws OcrBackendException;
}
