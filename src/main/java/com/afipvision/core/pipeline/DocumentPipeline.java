package com.afipvision.core.pipeline;

import com.afipvision.core.extraction.DocumentType;
import com.afipvision.core.extraction.DocumentTypeDetector;
import com.afipvision.core.extraction.StructuredDocument;
import com.afipvision.core.extraction.StructuredFieldExtractor;
import com.afipvision.core.image.ComplexityAnalyzer;
import com.afipvision.core.image.ComplexityScore;
import com.afipvision.core.ocr.OcrStrategySelector;
import com.afipvision.core.ocr.ProviderChoice;
import com.afipvision.core.ocr.RawOcrResult;
import com.afipvision.core.validation.ValidationEngine;
import com.afipvision.core.validation.ValidationVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Полный проход по документу: сложность → выбор OCR → распознавание → тип → извлечение
 * (с дочитыванием критичных полей) → проверка. Плохой вход не бросает исключений:
 * нечитаемое изображение даёт пустой текст и вердикт со списком недостающих полей.
 */
public final class DocumentPipeline {
    private static final Logger log = LoggerFactory.getLogger(DocumentPipeline.class);

    private final ComplexityAnalyzer analyzer;
    private final OcrStrategySelector selector;
    private final StructuredFieldExtractor extractor;
    private final ValidationEngine validator;

    public DocumentPipeline(ComplexityAnalyzer analyzer, OcrStrategySelector selector,
                            StructuredFieldExtractor extractor, ValidationEngine validator) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public ProcessedDocument process(String documentId, Path image, DocumentType hint) {
        BufferedImage img = null;
        try {
            img = image == null ? null : ImageIO.read(image.toFile());
            if (img == null) log.warn("doc={}: unsupported or missing image {}", documentId, image);
        } catch (IOException e) {
            log.warn("doc={}: cannot read {}: {}", documentId, image, e.getMessage());
        }
        return process(documentId, img, hint);
    }

    /**
     * @param hint тип документа, если известен; null — определить по тексту
     */
    public ProcessedDocument process(String documentId, BufferedImage image, DocumentType hint) {
        long t0 = System.currentTimeMillis();
        ComplexityScore cx = analyzer.analyze(image);
        ProviderChoice choice = selector.select(cx, hint);
        RawOcrResult ocr = selector.execute(choice, image);
        DocumentType type = hint != null ? hint : DocumentTypeDetector.detect(ocr.text());
        StructuredDocument doc = extractor.extract(ocr.text(), type, image);
        ValidationVerdict verdict = validator.validate(doc, type);
        log.info("doc={} done: tier={} provider={} type={} fields={} valid={} in {} ms",
                documentId, cx.tier(), ocr.providerUsed(), type, doc.fields().size(),
                verdict.overallValid(), System.currentTimeMillis() - t0);
        return new ProcessedDocument(documentId, cx, ocr, type, doc, verdict);
    }

    /** Вход с готовым текстом: без OCR и без дочитывания. */
    public ProcessedDocument processText(String documentId, String rawText, DocumentType hint) {
        String text = rawText == null ? "" : rawText;
        DocumentType type = hint != null ? hint : DocumentTypeDetector.detect(text);
        StructuredDocument doc = extractor.extract(text, type);
        ValidationVerdict verdict = validator.validate(doc, type);
        log.info("doc={} done (text): type={} fields={} valid={}",
                documentId, type, doc.fields().size(), verdict.overallValid());
        return new ProcessedDocument(documentId, null, null, type, doc, verdict);
    }
}
