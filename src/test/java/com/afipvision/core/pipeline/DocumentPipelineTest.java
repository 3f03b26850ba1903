package com.afipvision.core.pipeline;

import com.afipvision.app.Config;
import com.afipvision.core.extraction.DocumentType;
import com.afipvision.core.extraction.FieldPatternLibrary;
import com.afipvision.core.extraction.StructuredFieldExtractor;
import com.afipvision.core.image.ComplexityAnalyzer;
import com.afipvision.core.image.ComplexityTier;
import com.afipvision.core.ocr.InMemoryQuotaStore;
import com.afipvision.core.ocr.OcrBackend;
import com.afipvision.core.ocr.OcrStrategySelector;
import com.afipvision.core.ocr.OcrText;
import com.afipvision.core.ocr.Provider;
import com.afipvision.core.validation.ChecksumValidators;
import com.afipvision.core.validation.ValidationEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentPipelineTest {

    static final String INVOICE = """
            FACTURA A
            Razón Social: ACME S.A.
            CUIT: 30-71234567-1
            Punto de Venta: 00001  Comp. Nro: 00000123
            Fecha de Emisión: 15/10/2024
            CUIT: 20123456786
            Condición frente al IVA: Consumidor Final
            Subtotal: $ 1.000,00
            IVA 21%: $ 210,00
            Importe Total: $ 1.210,00
            CAE N°: 20241015123456
            """;

    private final Config cfg = Config.defaults();
    private final ChecksumValidators validators = ChecksumValidators.defaults();
    private final FieldPatternLibrary library = FieldPatternLibrary.defaults(validators);
    private OcrStrategySelector selector;

    @AfterEach
    void close() {
        if (selector != null) selector.close();
    }

    private DocumentPipeline pipeline(OcrBackend local) {
        Map<Provider, OcrBackend> backends = local == null ? Map.of() : Map.of(Provider.LOCAL, local);
        selector = new OcrStrategySelector(backends, new InMemoryQuotaStore(), cfg.providers(), cfg.ocr());
        return new DocumentPipeline(new ComplexityAnalyzer(cfg.complexity()), selector,
                new StructuredFieldExtractor(library, cfg.extraction(), null),
                new ValidationEngine(library, validators, cfg.validation(), Clock.systemDefaultZone()));
    }

    private static BufferedImage page() {
        BufferedImage img = new BufferedImage(300, 200, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, 300, 200);
        g.setColor(Color.BLACK);
        for (int y = 20; y < 180; y += 20) g.fillRect(20, y, 200, 4);
        g.dispose();
        return img;
    }

    @Test
    void simpleScanGoesThroughLocalEngine() {
        ProcessedDocument p = pipeline((img, c) -> new OcrText(INVOICE, 0.92)).process("doc-1", page(), null);
        assertEquals("doc-1", p.documentId());
        assertEquals(ComplexityTier.SIMPLE, p.complexity().tier());
        assertEquals(Provider.LOCAL, p.ocr().providerUsed());
        assertEquals(DocumentType.AFIP_INVOICE, p.documentType());
        assertEquals("20241015123456", p.document().value("cae_number"));
        assertEquals("1210.00", p.document().value("total_amount"));
        assertTrue(p.verdict().overallValid(), () -> p.verdict().errors().toString());
    }

    @Test
    void hintOverridesDetection() {
        ProcessedDocument p = pipeline((img, c) -> new OcrText("RECIBO N° 55\nTotal: $ 100,00", 0.9))
                .process("doc-2", page(), DocumentType.GENERIC);
        assertEquals(DocumentType.GENERIC, p.documentType());
    }

    @Test
    void unreadableImageGivesInvalidVerdictNotException(@TempDir Path dir) {
        ProcessedDocument p = pipeline((img, c) -> OcrText.of("no debería llamarse"))
                .process("doc-3", dir.resolve("missing.png"), DocumentType.AFIP_INVOICE);
        assertEquals(ComplexityTier.MEDIUM, p.complexity().tier());
        assertTrue(p.ocr().isEmpty());
        assertEquals(0.0, p.ocr().confidence());
        assertFalse(p.verdict().overallValid());
        assertTrue(p.verdict().errors().contains("cae_number: missing required field"));
    }

    @Test
    void textInputSkipsOcr() {
        DocumentPipeline pipeline = pipeline(null);
        ProcessedDocument p = pipeline.processText("t-1",
                "CAE N°: 20241015123456\nImporte Total: $ 1.234,56", null);
        assertNull(p.ocr());
        assertNull(p.complexity());
        assertEquals("1234.56", p.document().value("total_amount"));
        assertEquals(DocumentType.GENERIC, p.documentType());

        ProcessedDocument typed = pipeline.processText("t-2",
                "CAE N°: 20241015123456\nImporte Total: $ 1.234,56", DocumentType.AFIP_INVOICE);
        assertTrue(typed.verdict().overallValid());
        assertTrue(typed.verdict().warnings().isEmpty());
    }
}
