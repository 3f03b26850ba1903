package com.afipvision.core.pipeline;

import com.afipvision.core.extraction.DocumentType;
import com.afipvision.core.extraction.StructuredDocument;
import com.afipvision.core.image.ComplexityScore;
import com.afipvision.core.ocr.RawOcrResult;
import com.afipvision.core.validation.ValidationVerdict;

import java.util.Objects;

/**
 * Итог обработки одного документа.
 *
 * @param documentId непрозрачный идентификатор вызывающей стороны, передаётся без изменений
 * @param complexity null, если обработка начиналась с готового текста
 * @param ocr        null, если обработка начиналась с готового текста
 */
public record ProcessedDocument(String documentId, ComplexityScore complexity, RawOcrResult ocr,
                                DocumentType documentType, StructuredDocument document,
                                ValidationVerdict verdict) {
    public ProcessedDocument {
        Objects.requireNonNull(documentType, "documentType");
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(verdict, "verdict");
    }
}
