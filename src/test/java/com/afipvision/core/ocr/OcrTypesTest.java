package com.afipvision.core.ocr;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OcrTypesTest {

    @Test
    void choiceChainMustEndWithLocal() {
        assertThrows(IllegalArgumentException.class, () ->
                new ProviderChoice(Provider.CLOUD_A, Provider.CLOUD_A, List.of(Provider.CLOUD_B), "x"));
        assertThrows(IllegalArgumentException.class, () ->
                new ProviderChoice(Provider.CLOUD_A, Provider.CLOUD_A, List.of(), "x"));
        assertThrows(IllegalArgumentException.class, () ->
                new ProviderChoice(Provider.LOCAL, Provider.CLOUD_A, List.of(Provider.LOCAL), "x"));
        ProviderChoice ok = new ProviderChoice(Provider.LOCAL, Provider.LOCAL, List.of(), null);
        assertEquals("", ok.reason());
        assertFalse(ok.isDemoted());
    }

    @Test
    void confidenceBounds() {
        assertThrows(IllegalArgumentException.class, () -> new OcrText("x", 1.2));
        assertFalse(OcrText.of("x").hasConfidence());
        assertThrows(IllegalArgumentException.class, () -> new RawOcrResult("x", -0.1, Provider.LOCAL, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> OcrConfig.page(14));
        RawOcrResult empty = RawOcrResult.empty(Provider.LOCAL, 3);
        assertTrue(empty.isEmpty());
        assertEquals(0.0, empty.confidence());
    }

    @Test
    void attemptHoldsExactlyOneOutcome() {
        assertTrue(OcrAttempt.ok(RawOcrResult.empty(Provider.LOCAL, 0)).isOk());
        assertFalse(OcrAttempt.failed(new ProviderError(Provider.CLOUD_A, ProviderError.Kind.TIMEOUT, null)).isOk());
    }
}
