package com.afipvision.core.ocr;

import com.afipvision.app.Config;
import com.afipvision.core.extraction.DocumentType;
import com.afipvision.core.image.ComplexityScore;
import com.afipvision.core.image.ComplexityTier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OcrStrategySelectorTest {

    static final ComplexityScore SIMPLE = new ComplexityScore(0.1, ComplexityTier.SIMPLE);
    static final ComplexityScore MEDIUM = new ComplexityScore(0.45, ComplexityTier.MEDIUM);
    static final ComplexityScore COMPLEX = new ComplexityScore(0.8, ComplexityTier.COMPLEX);

    static final Config.OcrConf OCR = new Config.OcrConf("./tessdata", "spa", 6, 3, 2_000, 0.7, 0.5);
    static final Config.ProvidersConf PROVIDERS = new Config.ProvidersConf(
            new Config.CloudConf(2, 0.0015, 0.95),
            new Config.CloudConf(1, 0.002, 0.90));

    private final BufferedImage image = new BufferedImage(10, 10, BufferedImage.TYPE_BYTE_GRAY);
    private final InMemoryQuotaStore quota = new InMemoryQuotaStore();
    private OcrStrategySelector selector;

    @AfterEach
    void close() {
        if (selector != null) selector.close();
    }

    private OcrStrategySelector selector(Map<Provider, OcrBackend> backends) {
        selector = new OcrStrategySelector(backends, quota, PROVIDERS, OCR);
        return selector;
    }

    private static OcrBackend text(String s) {
        return (img, c) -> OcrText.of(s);
    }

    private static Map<Provider, OcrBackend> all() {
        Map<Provider, OcrBackend> m = new EnumMap<>(Provider.class);
        m.put(Provider.CLOUD_A, text("cloud a"));
        m.put(Provider.CLOUD_B, text("cloud b"));
        m.put(Provider.LOCAL, (img, c) -> new OcrText("local", 0.9));
        return m;
    }

    @Test
    void policyMatrix() {
        OcrStrategySelector s = selector(all());
        assertEquals(Provider.LOCAL, s.select(SIMPLE, DocumentType.AFIP_INVOICE).provider());
        assertEquals(Provider.LOCAL, s.select(SIMPLE, DocumentType.FORM).provider());
        assertEquals(Provider.CLOUD_A, s.select(MEDIUM, DocumentType.AFIP_INVOICE).provider());
        assertEquals(Provider.CLOUD_A, s.select(MEDIUM, DocumentType.RECEIPT).provider());
        assertEquals(Provider.LOCAL, s.select(MEDIUM, DocumentType.DNI).provider());
        assertEquals(Provider.LOCAL, s.select(MEDIUM, null).provider());
        assertEquals(Provider.CLOUD_B, s.select(COMPLEX, DocumentType.FORM).provider());
        assertEquals(Provider.CLOUD_A, s.select(COMPLEX, DocumentType.DNI).provider());
        assertEquals(Provider.CLOUD_A, s.select(COMPLEX, null).provider());

        ProviderChoice c = s.select(COMPLEX, DocumentType.FORM);
        assertEquals(List.of(Provider.CLOUD_A, Provider.LOCAL), c.fallbacks());
        assertFalse(c.isDemoted());
        assertTrue(s.select(SIMPLE, null).fallbacks().isEmpty());
    }

    @Test
    void chainAlwaysEndsWithLocal() {
        assertEquals(List.of(Provider.LOCAL), OcrStrategySelector.chain(Provider.LOCAL));
        assertEquals(List.of(Provider.CLOUD_A, Provider.CLOUD_B, Provider.LOCAL), OcrStrategySelector.chain(Provider.CLOUD_A));
        assertEquals(List.of(Provider.CLOUD_B, Provider.CLOUD_A, Provider.LOCAL), OcrStrategySelector.chain(Provider.CLOUD_B));
    }

    @Test
    void exhaustedQuotaDemotes() {
        OcrStrategySelector s = selector(all());
        quota.increment(Provider.CLOUD_A);
        quota.increment(Provider.CLOUD_A);
        ProviderChoice c = s.select(COMPLEX, null);
        assertEquals(Provider.CLOUD_B, c.provider());
        assertEquals(Provider.CLOUD_A, c.preferred());
        assertTrue(c.isDemoted());
        assertEquals(List.of(Provider.LOCAL), c.fallbacks());

        quota.increment(Provider.CLOUD_B);
        assertEquals(Provider.LOCAL, s.select(COMPLEX, null).provider());
    }

    @Test
    void unregisteredCloudIsSkipped() {
        OcrStrategySelector s = selector(Map.of(Provider.LOCAL, text("local")));
        ProviderChoice c = s.select(COMPLEX, DocumentType.FORM);
        assertEquals(Provider.LOCAL, c.provider());
        assertEquals(Provider.CLOUD_B, c.preferred());
        assertTrue(c.reason().contains("demoted"));
    }

    @Test
    void brokenQuotaStoreKeepsCloudOff() {
        ProviderQuotaStore broken = new ProviderQuotaStore() {
            @Override
            public int increment(Provider provider) {
                throw new IllegalStateException("db down");
            }

            @Override
            public int currentCount(Provider provider) {
                throw new IllegalStateException("db down");
            }
        };
        selector = new OcrStrategySelector(all(), broken, PROVIDERS, OCR);
        ProviderChoice c = selector.select(COMPLEX, null);
        assertEquals(Provider.LOCAL, c.provider());
        assertEquals("local", selector.execute(c, image).text());
    }

    @Test
    void successCountsQuotaAndCost() {
        OcrStrategySelector s = selector(all());
        RawOcrResult r = s.execute(s.select(COMPLEX, null), image);
        assertEquals("cloud a", r.text());
        assertEquals(Provider.CLOUD_A, r.providerUsed());
        // движок не дал уверенность — берётся номинальная
        assertEquals(0.95, r.confidence(), 1e-9);
        assertEquals(0.0015, r.costUnits(), 1e-12);
        assertEquals(1, quota.currentCount(Provider.CLOUD_A));
        assertEquals(0, quota.currentCount(Provider.CLOUD_B));
    }

    @Test
    void failureFallsBackWithoutCounting() {
        Map<Provider, OcrBackend> m = all();
        m.put(Provider.CLOUD_A, (img, c) -> {
            throw new OcrBackendException("HTTP 503");
        });
        OcrStrategySelector s = selector(m);
        RawOcrResult r = s.execute(s.select(COMPLEX, null), image);
        assertEquals(Provider.CLOUD_B, r.providerUsed());
        assertEquals("cloud b", r.text());
        assertEquals(0, quota.currentCount(Provider.CLOUD_A));
        assertEquals(1, quota.currentCount(Provider.CLOUD_B));
    }

    @Test
    void timeoutFallsBack() {
        Map<Provider, OcrBackend> m = all();
        m.put(Provider.CLOUD_A, (img, c) -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OcrBackendException("interrupted", e);
            }
            return OcrText.of("late");
        });
        OcrStrategySelector s = selector(m);
        long t0 = System.nanoTime();
        RawOcrResult r = s.execute(s.select(COMPLEX, null), image, Duration.ofMillis(100));
        assertEquals(Provider.CLOUD_B, r.providerUsed());
        assertTrue(System.nanoTime() - t0 < 4_000_000_000L, "timeout was not applied");
        assertEquals(0, quota.currentCount(Provider.CLOUD_A));
    }

    @Test
    void blankCloudTextDemotes() {
        Map<Provider, OcrBackend> m = all();
        m.put(Provider.CLOUD_A, text("   "));
        m.put(Provider.CLOUD_B, text(""));
        OcrStrategySelector s = selector(m);
        RawOcrResult r = s.execute(s.select(COMPLEX, null), image);
        assertEquals(Provider.LOCAL, r.providerUsed());
        assertEquals("local", r.text());
    }

    @Test
    void localFailureGivesEmptyResult() {
        OcrStrategySelector s = selector(Map.of(Provider.LOCAL, (img, c) -> {
            throw new OcrBackendException("tessdata missing");
        }));
        RawOcrResult r = s.execute(s.select(SIMPLE, null), image);
        assertEquals(Provider.LOCAL, r.providerUsed());
        assertTrue(r.isEmpty());
        assertEquals(0.0, r.confidence());
        assertEquals(0.0, r.costUnits());
    }

    @Test
    void noEngineAtAllGivesEmptyResult() {
        OcrStrategySelector s = selector(Map.of());
        RawOcrResult r = s.execute(s.select(COMPLEX, null), image);
        assertEquals(Provider.LOCAL, r.providerUsed());
        assertTrue(r.isEmpty());
    }

    @Test
    void lowLocalConfidenceTriesOtherSegmentation() {
        OcrStrategySelector s = selector(Map.of(Provider.LOCAL, (img, c) ->
                c.psm() == 3 ? new OcrText("mejor", 0.85) : new OcrText("peor", 0.4)));
        RawOcrResult r = s.execute(s.select(SIMPLE, null), image);
        assertEquals("mejor", r.text());
        assertEquals(0.85, r.confidence(), 1e-9);
    }

    @Test
    void localWithoutConfidenceUsesDefault() {
        OcrStrategySelector s = selector(Map.of(Provider.LOCAL, text("texto")));
        RawOcrResult r = s.execute(s.select(SIMPLE, null), image);
        assertEquals("texto", r.text());
        assertEquals(0.5, r.confidence(), 1e-9);
    }

    @Test
    void concurrentDocumentsDoNotExceedDailyQuota() throws Exception {
        // облачный вызов висит, пока не откроем шлюз: все 8 документов приходят до первого учёта
        CountDownLatch gate = new CountDownLatch(1);
        AtomicInteger callsA = new AtomicInteger();
        AtomicInteger callsB = new AtomicInteger();
        Map<Provider, OcrBackend> m = all();
        m.put(Provider.CLOUD_A, (img, c) -> {
            callsA.incrementAndGet();
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OcrBackendException("interrupted", e);
            }
            return OcrText.of("cloud a");
        });
        m.put(Provider.CLOUD_B, (img, c) -> {
            callsB.incrementAndGet();
            return OcrText.of("cloud b");
        });
        OcrStrategySelector s = selector(m);

        ExecutorService docs = Executors.newFixedThreadPool(8);
        try {
            List<Future<RawOcrResult>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(docs.submit(() -> s.execute(s.select(COMPLEX, null), image, Duration.ofSeconds(10))));
            }
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (callsA.get() < 2 && System.nanoTime() < deadline) Thread.sleep(10);
            gate.countDown();

            int byA = 0;
            for (Future<RawOcrResult> f : results) {
                RawOcrResult r = f.get(15, TimeUnit.SECONDS);
                assertFalse(r.isEmpty());
                if (r.providerUsed() == Provider.CLOUD_A) byA++;
            }
            // лимит CLOUD_A = 2, CLOUD_B = 1
            assertEquals(2, callsA.get());
            assertEquals(2, byA);
            assertEquals(2, quota.currentCount(Provider.CLOUD_A));
            assertTrue(callsB.get() <= 1, "CLOUD_B calls: " + callsB.get());
            assertTrue(quota.currentCount(Provider.CLOUD_B) <= 1);
        } finally {
            docs.shutdownNow();
        }
    }
}
