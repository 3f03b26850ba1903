package com.afipvision.core.recovery;

import com.afipvision.app.Config;
import com.afipvision.core.extraction.Amounts;
import com.afipvision.core.extraction.CandidateScorer;
import com.afipvision.core.extraction.FieldKind;
import com.afipvision.core.extraction.FieldShape;
import com.afipvision.core.image.ImageVariants;
import com.afipvision.core.image.Mats;
import com.afipvision.core.ocr.OcrBackend;
import com.afipvision.core.ocr.OcrBackendException;
import com.afipvision.core.ocr.OcrConfig;
import com.afipvision.core.validation.ChecksumValidators;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Точечное дочитывание критичных полей (CAE, CUIT, итог): перебор сетки
 * область × предобработка × настройка движка, коррекция глифов, оценка через CandidateScorer,
 * глобальный максимум. Ячейки сетки независимы и выполняются параллельно; поиск прекращается,
 * как только найден кандидат с верной контрольной суммой. Никогда не бросает исключений.
 */
public final class SpecializedFieldRecovery implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SpecializedFieldRecovery.class);

    private static final Pattern DIGIT_RUN = Pattern.compile("\\d[\\d \\-.]*\\d|\\d");
    private static final Pattern AMOUNT = Pattern.compile("\\d{1,3}(?:[.,]\\d{3})+[.,]\\d{2}|\\d+[.,]\\d{2}");
    /** Сколько лишних цифр допускается в цепочке, чтобы резать её окнами. */
    private static final int MAX_EXTRA_DIGITS = 2;

    /** Кандидат одной ячейки сетки; index — порядок ячейки для детерминированной ничьей. */
    private record Cell(int index, String value, double score, boolean checksumValid, String tag) {}

    private final OcrBackend engine;
    private final ChecksumValidators validators;
    private final Config.RecoveryConf cfg;
    private final Duration timeout;
    private final ExecutorService pool;

    public SpecializedFieldRecovery(OcrBackend engine, ChecksumValidators validators,
                                    Config.RecoveryConf cfg, Duration timeout) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.validators = Objects.requireNonNull(validators, "validators");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        AtomicInteger n = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(cfg.parallelism(), r -> {
            Thread t = new Thread(r, "av-recovery-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public RecoveryResult recover(BufferedImage image, FieldKind kind) {
        return recover(image, kind, null);
    }

    /**
     * @param regions области поиска; null или пусто — стандартные для вида поля
     */
    public RecoveryResult recover(BufferedImage image, FieldKind kind, List<Region> regions) {
        if (image == null || kind == null || !kind.isRecoverable()) return RecoveryResult.empty();
        List<Region> rs = (regions == null || regions.isEmpty()) ? defaultRegions(kind) : regions;
        FieldShape shape = kind.shape(validators);
        try {
            List<Job> jobs = prepareJobs(image, kind, rs);
            Cell best = search(jobs, kind, shape);
            if (best == null || best.score() < cfg.minScore()) {
                log.debug("recovery {}: nothing above {} (best={})", kind, cfg.minScore(), best);
                return RecoveryResult.empty();
            }
            log.info("recovery {}: '{}' score={} at {}", kind, best.value(),
                    String.format("%.2f", best.score()), best.tag());
            return new RecoveryResult(best.value(), Math.min(1.0, best.score()));
        } catch (RuntimeException | LinkageError e) {
            log.warn("recovery {} failed: {}", kind, e.toString());
            return RecoveryResult.empty();
        }
    }

    /** Одна ячейка сетки: готовое изображение варианта и настройка движка. */
    private record Job(int index, BufferedImage image, OcrConfig config, String tag) {}

    private List<Job> prepareJobs(BufferedImage image, FieldKind kind, List<Region> regions) {
        List<Job> jobs = new ArrayList<>();
        List<OcrConfig> configs = configsFor(kind);
        Mat gray = Mats.toGray(image);
        try {
            int ri = 0;
            for (Region region : regions) {
                Rect r = region.toRect(gray.cols(), gray.rows());
                Mat roi = new Mat(gray, r).clone();
                List<ImageVariants.Variant> variants = ImageVariants.battery(roi, cfg.scaleMinWidth());
                try {
                    for (ImageVariants.Variant v : variants) {
                        BufferedImage bi = Mats.toImage(v.mat());
                        if (bi == null) continue;
                        for (OcrConfig c : configs) {
                            jobs.add(new Job(jobs.size(), bi, c,
                                    "region#" + ri + "/" + v.name() + "/psm" + c.psm()));
                        }
                    }
                } finally {
                    for (ImageVariants.Variant v : variants) v.mat().release();
                    roi.release();
                }
                ri++;
            }
        } finally {
            gray.release();
        }
        return jobs;
    }

    private Cell search(List<Job> jobs, FieldKind kind, FieldShape shape) {
        if (jobs.isEmpty()) return null;
        CompletionService<Cell> cs = new ExecutorCompletionService<>(pool);
        List<Future<Cell>> futures = new ArrayList<>(jobs.size());
        for (Job j : jobs) futures.add(cs.submit(() -> runCell(j, kind, shape)));

        long deadline = System.nanoTime() + timeout.toNanos();
        Cell best = null;
        try {
            for (int done = 0; done < futures.size(); done++) {
                long left = deadline - System.nanoTime();
                Future<Cell> f = left > 0 ? cs.poll(left, TimeUnit.NANOSECONDS) : null;
                if (f == null) {
                    log.warn("recovery {}: timeout after {} of {} cells", kind, done, futures.size());
                    break;
                }
                Cell c;
                try {
                    c = f.get();
                } catch (ExecutionException e) {
                    log.warn("recovery {}: cell failed: {}", kind, String.valueOf(e.getCause()));
                    continue;
                }
                if (c == null) continue;
                if (best == null || c.score() > best.score()
                        || (c.score() == best.score() && c.index() < best.index())) {
                    best = c;
                }
                if (best.checksumValid()) break;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("recovery {}: interrupted", kind);
        } finally {
            for (Future<Cell> f : futures) f.cancel(true);
        }
        return best;
    }

    private Cell runCell(Job job, FieldKind kind, FieldShape shape) {
        String raw;
        try {
            raw = engine.recognize(job.image(), job.config()).text();
        } catch (OcrBackendException e) {
            log.debug("recovery cell {} engine error: {}", job.tag(), e.getMessage());
            return null;
        }
        if (raw == null || raw.isBlank()) return null;
        List<String> corrected = CorrectionMap.variants(raw);
        Set<String> seen = new LinkedHashSet<>();
        Cell best = null;
        for (String text : corrected) {
            for (String cand : candidates(text, kind)) {
                if (!seen.add(cand) || !CandidateScorer.isAcceptable(cand, shape)) continue;
                double s = CandidateScorer.score(cand, shape);
                boolean valid = shape.checksum() != null && shape.checksum().test(cand);
                if (best == null || s > best.score()) best = new Cell(job.index(), cand, s, valid, job.tag());
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("recovery cell {}: raw='{}' corrected={} best={}",
                    job.tag(), raw.replace('\n', ' '), corrected, best);
        }
        return best;
    }

    /** Кандидаты из исправленного текста: окна нужной длины для цифровых полей, суммы для итога. */
    static List<String> candidates(String corrected, FieldKind kind) {
        Set<String> out = new LinkedHashSet<>();
        if (corrected == null) return List.of();
        if (kind == FieldKind.AMOUNT) {
            Matcher m = AMOUNT.matcher(corrected);
            while (m.find()) {
                String n = Amounts.normalize(m.group());
                if (n != null) out.add(n);
            }
            return List.copyOf(out);
        }
        int len = kind == FieldKind.CAE ? ChecksumValidators.CAE_LENGTH : ChecksumValidators.CUIT_LENGTH;
        Matcher m = DIGIT_RUN.matcher(corrected);
        while (m.find()) {
            String d = m.group().replaceAll("[^0-9]", "");
            if (d.length() == len) {
                out.add(d);
            } else if (d.length() > len && d.length() <= len + MAX_EXTRA_DIGITS) {
                // скользящее окно; более длинная цепочка — другое поле (CAE не режем на CUIT)
                for (int i = 0; i + len <= d.length(); i++) out.add(d.substring(i, i + len));
            }
        }
        return List.copyOf(out);
    }

    /** Типичные места полей на фактуре AFIP (x, y, w, h в долях). */
    static List<Region> defaultRegions(FieldKind kind) {
        return switch (kind) {
            // CAE внизу справа
            case CAE -> List.of(
                    new Region(0.5, 0.5, 0.5, 0.5),
                    new Region(0.0, 0.75, 1.0, 0.25),
                    new Region(2 / 3.0, 2 / 3.0, 1 / 3.0, 1 / 3.0));
            // CUIT продавца слева, покупателя справа
            case CUIT -> List.of(
                    new Region(0.0, 0.25, 0.5, 0.5),
                    new Region(0.0, 1 / 3.0, 0.5, 1 / 3.0),
                    new Region(0.5, 0.25, 0.5, 0.5),
                    new Region(0.5, 1 / 3.0, 0.5, 1 / 3.0));
            case AMOUNT -> List.of(
                    new Region(0.5, 0.75, 0.5, 0.25),
                    new Region(2 / 3.0, 2 / 3.0, 1 / 3.0, 1 / 3.0));
            default -> List.of(new Region(0.0, 0.0, 1.0, 1.0));
        };
    }

    /** Настройки движка под вид поля: только цифры, строка, слово, блок. */
    static List<OcrConfig> configsFor(FieldKind kind) {
        if (kind == FieldKind.AMOUNT) {
            return List.of(
                    OcrConfig.region(7, OcrConfig.AMOUNT_CHARS),
                    OcrConfig.region(8, OcrConfig.AMOUNT_CHARS),
                    OcrConfig.region(6, null));
        }
        return List.of(
                OcrConfig.region(7, OcrConfig.DIGITS),
                OcrConfig.region(8, OcrConfig.DIGITS),
                OcrConfig.region(6, null),
                OcrConfig.region(13, null));
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
