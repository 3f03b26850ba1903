package com.afipvision.core.ocr;

import com.afipvision.app.Config;
import com.afipvision.core.extraction.DocumentType;
import com.afipvision.core.image.ComplexityScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Выбор и запуск OCR-провайдера.
 * <p>
 * Политика: SIMPLE → LOCAL; MEDIUM → CLOUD_A для финансовых документов, иначе LOCAL;
 * COMPLEX → CLOUD_B для форм, иначе CLOUD_A. Облачный провайдер без квоты или без адаптера
 * пропускается, цепочка понижения всегда заканчивается LOCAL. Ошибки провайдеров не бросаются,
 * а возвращаются как {@link ProviderError} и ведут к следующему звену.
 * Счётчик квоты увеличивается только после успешного вызова. Пока вызов идёт, он занимает слот квоты:
 * проверка и резерв выполняются под замком провайдера, поэтому параллельные документы не превышают
 * дневной лимит в пределах процесса.
 */
public final class OcrStrategySelector implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OcrStrategySelector.class);

    /** Порядок понижения после предпочтительного провайдера. */
    private static final List<Provider> PRIORITY = List.of(Provider.CLOUD_A, Provider.CLOUD_B, Provider.LOCAL);
    /** Дополнительные режимы сегментации для локального движка при низкой уверенности. */
    private static final int[] LOCAL_SWEEP_PSM = {3, 4};

    private final Map<Provider, OcrBackend> backends;
    private final ProviderQuotaStore quota;
    private final Config.ProvidersConf providers;
    private final Config.OcrConf ocr;
    private final ExecutorService pool;
    /** Занятые слоты квоты: вызовы облачных провайдеров, ещё не отражённые в счётчике. */
    private final Map<Provider, AtomicInteger> inFlight = new EnumMap<>(Provider.class);

    public OcrStrategySelector(Map<Provider, OcrBackend> backends, ProviderQuotaStore quota,
                               Config.ProvidersConf providers, Config.OcrConf ocr) {
        Objects.requireNonNull(backends, "backends");
        this.backends = backends.isEmpty() ? new EnumMap<>(Provider.class) : new EnumMap<>(backends);
        this.quota = Objects.requireNonNull(quota, "quota");
        this.providers = Objects.requireNonNull(providers, "providers");
        this.ocr = Objects.requireNonNull(ocr, "ocr");
        for (Provider p : Provider.values()) inFlight.put(p, new AtomicInteger());
        AtomicInteger n = new AtomicInteger();
        this.pool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "av-ocr-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("OCR selector: providers={}", this.backends.keySet());
    }

    /** Детерминированный выбор провайдера по сложности, подсказке типа и квотам. */
    public ProviderChoice select(ComplexityScore complexity, DocumentType hint) {
        Objects.requireNonNull(complexity, "complexity");
        Provider preferred;
        String reason;
        switch (complexity.tier()) {
            case SIMPLE -> {
                preferred = Provider.LOCAL;
                reason = "simple image";
            }
            case MEDIUM -> {
                boolean financial = hint != null && hint.isFinancial();
                preferred = financial ? Provider.CLOUD_A : Provider.LOCAL;
                reason = financial ? "medium image, financial document" : "medium image";
            }
            default -> {
                boolean form = hint != null && hint.isForm();
                preferred = form ? Provider.CLOUD_B : Provider.CLOUD_A;
                reason = form ? "complex image, form layout" : "complex image";
            }
        }

        List<Provider> chain = chain(preferred);
        for (int i = 0; i < chain.size(); i++) {
            Provider p = chain.get(i);
            String skip = unavailableReason(p);
            if (skip == null) {
                ProviderChoice choice = new ProviderChoice(p, preferred, chain.subList(i + 1, chain.size()),
                        p == preferred ? reason : reason + "; demoted from " + preferred);
                if (choice.isDemoted()) {
                    log.warn("OCR select: {} -> {} ({})", preferred, p, choice.reason());
                } else {
                    log.info("OCR select: {} ({}, complexity={})", p, reason,
                            String.format("%.2f", complexity.value()));
                }
                return choice;
            }
            log.debug("OCR select: skip {}: {}", p, skip);
        }
        // LOCAL всегда доступен, сюда не попадаем
        throw new IllegalStateException("no OCR provider available");
    }

    /** Предпочтительный провайдер, затем остальные в порядке приоритета; LOCAL последним. */
    static List<Provider> chain(Provider preferred) {
        if (preferred == Provider.LOCAL) return List.of(Provider.LOCAL);
        List<Provider> out = new ArrayList<>(PRIORITY.size());
        out.add(preferred);
        for (Provider p : PRIORITY) if (p != preferred) out.add(p);
        return out;
    }

    private String unavailableReason(Provider p) {
        if (p == Provider.LOCAL) return null;
        if (!backends.containsKey(p)) return "no adapter registered";
        return quotaExhausted(p);
    }

    /** null, если с учётом занятых слотов вызов ещё укладывается в лимит. */
    private String quotaExhausted(Provider p) {
        int limit = cloud(p).dailyLimit();
        int used;
        try {
            used = quota.currentCount(p);
        } catch (RuntimeException e) {
            // без счётчика облако не трогаем
            log.warn("OCR: quota store unavailable for {}: {}", p, e.toString());
            return "quota store unavailable";
        }
        int busy = inFlight.get(p).get();
        return used + busy >= limit
                ? "daily quota exhausted (" + used + " used + " + busy + " in flight / " + limit + ")" : null;
    }

    /** Занимает слот квоты; null при успехе, иначе причина отказа. */
    private String reserve(Provider p) {
        AtomicInteger slots = inFlight.get(p);
        synchronized (slots) {
            String skip = quotaExhausted(p);
            if (skip == null) slots.incrementAndGet();
            return skip;
        }
    }

    /** Освобождает слот; при успехе сначала учитывает вызов в счётчике. */
    private int release(Provider p, boolean counted) {
        AtomicInteger slots = inFlight.get(p);
        synchronized (slots) {
            try {
                return counted ? quota.increment(p) : -1;
            } catch (RuntimeException e) {
                log.warn("OCR {}: usage not recorded: {}", p, e.toString());
                return -1;
            } finally {
                slots.decrementAndGet();
            }
        }
    }

    public RawOcrResult execute(ProviderChoice choice, BufferedImage image) {
        return execute(choice, image, Duration.ofMillis(ocr.callTimeoutMs()));
    }

    /**
     * Запускает выбранного провайдера и при отказе спускается по цепочке.
     * Никогда не бросает: худший исход — пустой текст LOCAL с уверенностью 0.
     */
    public RawOcrResult execute(ProviderChoice choice, BufferedImage image, Duration timeout) {
        Objects.requireNonNull(choice, "choice");
        Objects.requireNonNull(timeout, "timeout");
        List<Provider> order = new ArrayList<>();
        order.add(choice.provider());
        order.addAll(choice.fallbacks());
        long t0 = System.nanoTime();
        for (Provider p : order) {
            OcrAttempt a = attempt(p, image, timeout);
            if (a.isOk()) return a.result();
            ProviderError e = a.error();
            log.warn("OCR {} failed [{}]: {}; demoting", e.provider(), e.kind(), e.message());
        }
        return RawOcrResult.empty(Provider.LOCAL, elapsedMs(t0));
    }

    /** Одна попытка провайдера без понижения. */
    OcrAttempt attempt(Provider p, BufferedImage image, Duration timeout) {
        if (p == Provider.LOCAL) return OcrAttempt.ok(runLocal(image, timeout));

        OcrBackend backend = backends.get(p);
        if (backend == null) return OcrAttempt.failed(new ProviderError(p, ProviderError.Kind.UNAVAILABLE, "no adapter"));
        Config.CloudConf c = cloud(p);
        if (image == null) return OcrAttempt.failed(new ProviderError(p, ProviderError.Kind.FAILURE, "image is null"));
        // между select и execute слот мог занять другой поток
        String skip = reserve(p);
        if (skip != null) {
            return OcrAttempt.failed(new ProviderError(p, ProviderError.Kind.QUOTA_EXHAUSTED, skip));
        }

        long t0 = System.nanoTime();
        OcrText t = null;
        ProviderError error = null;
        int used = -1;
        try {
            t = call(backend, image, OcrConfig.page(ocr.psm()), timeout);
            if (t.text().isBlank()) error = new ProviderError(p, ProviderError.Kind.FAILURE, "empty text");
        } catch (TimeoutException e) {
            error = new ProviderError(p, ProviderError.Kind.TIMEOUT, "no response within " + timeout.toMillis() + " ms");
        } catch (OcrBackendException e) {
            error = new ProviderError(p, ProviderError.Kind.FAILURE, e.getMessage());
        } finally {
            used = release(p, t != null && error == null);
        }
        if (error != null) return OcrAttempt.failed(error);
        if (used > c.dailyLimit()) log.warn("OCR {}: quota overshoot {}/{}", p, used, c.dailyLimit());
        double conf = t.hasConfidence() ? t.confidence() : c.nominalConfidence();
        RawOcrResult r = new RawOcrResult(t.text(), conf, p, c.costUnits(), elapsedMs(t0));
        log.info("OCR {}: {} chars conf={} in {} ms (quota {}/{})", p, r.text().length(),
                String.format("%.2f", conf), r.elapsedMs(), used, c.dailyLimit());
        return OcrAttempt.ok(r);
    }

    private RawOcrResult runLocal(BufferedImage image, Duration timeout) {
        long t0 = System.nanoTime();
        OcrBackend local = backends.get(Provider.LOCAL);
        if (local == null || image == null) {
            log.warn("OCR LOCAL: {}", local == null ? "no local engine" : "image is null");
            return RawOcrResult.empty(Provider.LOCAL, elapsedMs(t0));
        }
        OcrText best;
        try {
            best = withDefaultConfidence(call(local, image, OcrConfig.page(ocr.psm()), timeout));
        } catch (TimeoutException e) {
            log.warn("OCR LOCAL: timeout after {} ms, returning empty text", timeout.toMillis());
            return RawOcrResult.empty(Provider.LOCAL, elapsedMs(t0));
        } catch (OcrBackendException e) {
            log.warn("OCR LOCAL failed, returning empty text: {}", e.getMessage());
            return RawOcrResult.empty(Provider.LOCAL, elapsedMs(t0));
        }
        if (best.confidence() < ocr.localRetryBelow()) {
            for (int psm : LOCAL_SWEEP_PSM) {
                if (psm == ocr.psm()) continue;
                try {
                    OcrText alt = withDefaultConfidence(call(local, image, OcrConfig.page(psm), timeout));
                    log.debug("OCR LOCAL psm={}: conf={}", psm, String.format("%.2f", alt.confidence()));
                    if (!alt.text().isBlank() && alt.confidence() > best.confidence()) best = alt;
                } catch (TimeoutException | OcrBackendException e) {
                    log.debug("OCR LOCAL psm={} skipped: {}", psm, e.toString());
                }
            }
        }
        double conf = best.text().isBlank() ? 0.0 : best.confidence();
        RawOcrResult r = new RawOcrResult(best.text(), conf, Provider.LOCAL, 0.0, elapsedMs(t0));
        log.info("OCR LOCAL: {} chars conf={} in {} ms", r.text().length(), String.format("%.2f", conf), r.elapsedMs());
        return r;
    }

    private OcrText withDefaultConfidence(OcrText t) {
        return t.hasConfidence() ? t : new OcrText(t.text(), ocr.localDefaultConfidence());
    }

    /** Вызов движка в пуле с ограничением по времени. */
    private OcrText call(OcrBackend backend, BufferedImage image, OcrConfig config, Duration timeout)
            throws OcrBackendException, TimeoutException {
        Future<OcrText> f = pool.submit(() -> backend.recognize(image, config));
        try {
            OcrText t = f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return t == null ? OcrText.of("") : t;
        } catch (TimeoutException e) {
            f.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            throw new OcrBackendException("interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof OcrBackendException obe) throw obe;
            throw new OcrBackendException("backend crashed: " + cause, cause);
        }
    }

    private Config.CloudConf cloud(Provider p) {
        return switch (p) {
            case CLOUD_A -> providers.cloudA();
            case CLOUD_B -> providers.cloudB();
            case LOCAL -> throw new IllegalArgumentException("LOCAL has no cloud settings");
        };
    }

    private static long elapsedMs(long t0) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
