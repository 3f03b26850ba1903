package com.afipvision.app;

import com.afipvision.core.db.PgQuotaStore;
import com.afipvision.core.extraction.DocumentType;
import com.afipvision.core.extraction.FieldPatternLibrary;
import com.afipvision.core.extraction.StructuredFieldExtractor;
import com.afipvision.core.image.ComplexityAnalyzer;
import com.afipvision.core.importer.DocumentScanner;
import com.afipvision.core.ocr.InMemoryQuotaStore;
import com.afipvision.core.ocr.OcrBackend;
import com.afipvision.core.ocr.OcrStrategySelector;
import com.afipvision.core.ocr.Provider;
import com.afipvision.core.ocr.ProviderQuotaStore;
import com.afipvision.core.ocr.TesseractBackend;
import com.afipvision.core.pipeline.DocumentPipeline;
import com.afipvision.core.pipeline.ProcessedDocument;
import com.afipvision.core.recovery.SpecializedFieldRecovery;
import com.afipvision.core.validation.ChecksumValidators;
import com.afipvision.core.validation.ValidationEngine;
import com.afipvision.report.ReportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CLI: {@code --file=<image>}, {@code --dir=<folder>} или {@code --text=<file.txt>} (готовый текст OCR),
 * необязательно {@code --type=factura|recibo|dni|...} и {@code --id=<correlation id>}.
 * Код выхода 2 — неверные аргументы.
 */
public final class Boot {
    private static final Logger log = LoggerFactory.getLogger(Boot.class);

    static final String USAGE =
            "usage: afip-vision (--file=<image> | --dir=<folder> | --text=<file.txt>) [--type=<doc type>] [--id=<id>]";

    private Boot() {
        // no-op
    }

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) System.exit(code);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, String> a = parseArgs(args);
        int modes = (a.containsKey("file") ? 1 : 0) + (a.containsKey("dir") ? 1 : 0) + (a.containsKey("text") ? 1 : 0);
        if (modes != 1) {
            err.println(USAGE);
            return 2;
        }
        DocumentType hint = null;
        if (a.containsKey("type")) {
            Optional<DocumentType> t = DocumentType.parse(a.get("type"));
            if (t.isEmpty()) {
                err.println("unknown --type: " + a.get("type"));
                return 2;
            }
            hint = t.get();
        }

        Config cfg = Config.load();
        ChecksumValidators validators = new ChecksumValidators(cfg.validation().caeYearMin(), cfg.validation().caeYearMax());
        FieldPatternLibrary library = FieldPatternLibrary.defaults(validators);
        ValidationEngine validation = new ValidationEngine(library, validators, cfg.validation(), Clock.systemDefaultZone());

        if (a.containsKey("text")) {
            Path txt = Path.of(a.get("text"));
            String raw;
            try {
                raw = Files.readString(txt, StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("cannot read " + txt + ": " + e.getMessage());
                return 2;
            }
            StructuredFieldExtractor extractor = new StructuredFieldExtractor(library, cfg.extraction(), null);
            try (OcrStrategySelector selector = new OcrStrategySelector(Map.of(), new InMemoryQuotaStore(),
                    cfg.providers(), cfg.ocr())) {
                DocumentPipeline pipeline = new DocumentPipeline(
                        new ComplexityAnalyzer(cfg.complexity()), selector, extractor, validation);
                print(out, pipeline.processText(a.getOrDefault("id", txt.getFileName().toString()), raw, hint));
            }
            return 0;
        }

        List<Path> files = new ArrayList<>();
        if (a.containsKey("file")) {
            Path f = Path.of(a.get("file"));
            if (!Files.isRegularFile(f)) {
                err.println("not a file: " + f);
                return 2;
            }
            files.add(f);
        } else {
            Path dir = Path.of(a.get("dir"));
            if (!Files.isDirectory(dir)) {
                err.println("not a directory: " + dir);
                return 2;
            }
            files.addAll(new DocumentScanner(cfg.imp().patterns()).scan(dir));
        }

        Map<Provider, OcrBackend> backends = new EnumMap<>(Provider.class);
        OcrBackend local = localEngine(cfg);
        if (local != null) backends.put(Provider.LOCAL, local);
        // облачные адаптеры подключаются через OcrBackend; без них выбор всегда понижается до LOCAL
        Duration timeout = Duration.ofMillis(cfg.ocr().callTimeoutMs());

        ProviderQuotaStore quota = quotaStore(cfg);
        try (OcrStrategySelector selector = new OcrStrategySelector(backends, quota, cfg.providers(), cfg.ocr());
             SpecializedFieldRecovery recovery = local == null ? null
                     : new SpecializedFieldRecovery(local, validators, cfg.recovery(), timeout)) {
            StructuredFieldExtractor extractor = new StructuredFieldExtractor(library, cfg.extraction(), recovery);
            DocumentPipeline pipeline = new DocumentPipeline(
                    new ComplexityAnalyzer(cfg.complexity()), selector, extractor, validation);
            for (Path f : files) {
                String id = files.size() == 1 && a.containsKey("id") ? a.get("id") : f.getFileName().toString();
                print(out, pipeline.process(id, f, hint));
            }
        } finally {
            if (quota instanceof PgQuotaStore pg) pg.close();
        }
        return 0;
    }

    private static OcrBackend localEngine(Config cfg) {
        try {
            return new TesseractBackend(cfg.ocr());
        } catch (IllegalStateException e) {
            log.warn("local OCR disabled: {}", e.getMessage());
            return null;
        }
    }

    private static ProviderQuotaStore quotaStore(Config cfg) {
        String store = cfg.quota().store();
        if ("postgres".equalsIgnoreCase(store)) return new PgQuotaStore(cfg.db());
        if (store != null && !"memory".equalsIgnoreCase(store)) {
            throw new IllegalStateException("quota.store must be memory|postgres, got " + store);
        }
        return new InMemoryQuotaStore();
    }

    private static void print(PrintStream out, ProcessedDocument p) {
        for (String line : ReportFormat.format(p)) out.println(line);
        out.println();
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        for (String s : args) {
            int i = s.indexOf('=');
            if (i > 0) m.put(s.substring(0, i).replaceFirst("^--", ""), s.substring(i + 1));
        }
        return m;
    }
}
