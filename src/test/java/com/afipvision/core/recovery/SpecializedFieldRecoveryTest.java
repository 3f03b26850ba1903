package com.afipvision.core.recovery;

import com.afipvision.app.Config;
import com.afipvision.core.extraction.FieldKind;
import com.afipvision.core.ocr.OcrBackendException;
import com.afipvision.core.ocr.OcrConfig;
import com.afipvision.core.ocr.OcrText;
import com.afipvision.core.validation.ChecksumValidators;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SpecializedFieldRecoveryTest {

    private final ChecksumValidators validators = ChecksumValidators.defaults();
    private final Config.RecoveryConf cfg = Config.defaults().recovery();

    private static BufferedImage page() {
        BufferedImage img = new BufferedImage(300, 200, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, 300, 200);
        g.setColor(Color.BLACK);
        g.fillRect(160, 160, 120, 15);
        g.dispose();
        return img;
    }

    @Test
    void caeRecoveredFromGarbledGlyphs() {
        try (SpecializedFieldRecovery r = new SpecializedFieldRecovery(
                (img, c) -> OcrText.of("CAE N: 2O24IO15I23456"), validators, cfg, Duration.ofSeconds(20))) {
            RecoveryResult res = r.recover(page(), FieldKind.CAE);
            assertEquals("20241015123456", res.value());
            assertEquals(1.0, res.confidence(), 1e-9);
        }
    }

    @Test
    void caeWithoutAnyDigitIsRecovered() {
        // все 14 знаков искажены в буквы: 2021-10-16 12:15:20
        try (SpecializedFieldRecovery r = new SpecializedFieldRecovery(
                (img, c) -> OcrText.of("CAE ZOZIIOIGIZISZO"), validators, cfg, Duration.ofSeconds(20))) {
            RecoveryResult res = r.recover(page(), FieldKind.CAE);
            assertEquals("20211016121520", res.value());
        }
    }

    @Test
    void cuitFromDashedText() {
        try (SpecializedFieldRecovery r = new SpecializedFieldRecovery(
                (img, c) -> OcrText.of("CUIT 3O-7I234567-1"), validators, cfg, Duration.ofSeconds(20))) {
            RecoveryResult res = r.recover(page(), FieldKind.CUIT, List.of(new Region(0, 0, 1, 1)));
            assertEquals("30712345671", res.value());
        }
    }

    @Test
    void nothingUsefulGivesEmpty() {
        AtomicInteger calls = new AtomicInteger();
        try (SpecializedFieldRecovery r = new SpecializedFieldRecovery(
                (img, c) -> {
                    // каждая вторая ячейка падает, остальные читают мусор
                    if (calls.incrementAndGet() % 2 == 0) throw new OcrBackendException("boom");
                    return OcrText.of("sin datos");
                }, validators, cfg, Duration.ofSeconds(20))) {
            RecoveryResult res = r.recover(page(), FieldKind.CAE);
            assertTrue(res.isEmpty());
            assertEquals(0.0, res.confidence());
            assertTrue(calls.get() > 0);
        }
    }

    @Test
    void unsupportedInputIsEmptyWithoutCallingEngine() {
        AtomicInteger calls = new AtomicInteger();
        try (SpecializedFieldRecovery r = new SpecializedFieldRecovery(
                (img, c) -> {
                    calls.incrementAndGet();
                    return OcrText.of("20241015123456");
                }, validators, cfg, Duration.ofSeconds(5))) {
            assertTrue(r.recover(null, FieldKind.CAE).isEmpty());
            assertTrue(r.recover(page(), FieldKind.DATE).isEmpty());
            assertEquals(0, calls.get());
        }
    }

    @Test
    void candidatesUseWindowsOnlyForNearMisses() {
        // лишняя цифра рядом с CUIT: окна
        assertTrue(SpecializedFieldRecovery.candidates("207123456718", FieldKind.CUIT).contains("20712345671"));
        // цепочка длины CAE на CUIT не режется
        assertTrue(SpecializedFieldRecovery.candidates("20241015123456", FieldKind.CUIT).isEmpty());
        assertEquals(List.of("20241015123456"), SpecializedFieldRecovery.candidates("CAE 20241015123456", FieldKind.CAE));
        assertEquals(List.of("1234.56"), SpecializedFieldRecovery.candidates("TOTAL $ 1.234,56", FieldKind.AMOUNT));
    }

    @Test
    void gridCoversRegionsAndConfigs() {
        assertEquals(3, SpecializedFieldRecovery.defaultRegions(FieldKind.CAE).size());
        assertEquals(4, SpecializedFieldRecovery.defaultRegions(FieldKind.CUIT).size());
        List<OcrConfig> digits = SpecializedFieldRecovery.configsFor(FieldKind.CAE);
        assertEquals(OcrConfig.DIGITS, digits.get(0).whitelist());
        assertEquals(OcrConfig.AMOUNT_CHARS, SpecializedFieldRecovery.configsFor(FieldKind.AMOUNT).get(0).whitelist());
    }

    @Test
    void regionIsClampedToImage() {
        var rect = new Region(0.5, 0.5, 0.5, 0.5).toRect(101, 51);
        assertTrue(rect.x() + rect.width() <= 101);
        assertTrue(rect.y() + rect.height() <= 51);
        assertThrows(IllegalArgumentException.class, () -> new Region(0.6, 0, 0.6, 1));
    }
}
