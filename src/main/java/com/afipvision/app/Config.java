package com.afipvision.app;

import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.List;
import java.util.Map;


public record Config(OcrConf ocr, ProvidersConf providers, ComplexityConf complexity,
                     RecoveryConf recovery, ExtractionConf extraction, ValidationConf validation,
                     QuotaConf quota, Db db, ImportConf imp) {

    public record OcrConf(String tessdataDir, String languages, int psm, int oem,
                          long callTimeoutMs, double localRetryBelow, double localDefaultConfidence) {}

    /** Лимиты и стоимость одного облачного провайдера. */
    public record CloudConf(int dailyLimit, double costUnits, double nominalConfidence) {
        public CloudConf {
            if (dailyLimit < 0) throw new IllegalStateException("dailyLimit < 0");
            if (costUnits < 0) throw new IllegalStateException("costUnits < 0");
            requireUnit("nominalConfidence", nominalConfidence);
        }
    }

    public record ProvidersConf(CloudConf cloudA, CloudConf cloudB) {}

    /**
     * Веса и пороги эвристики сложности. Значения подобраны вручную, это настройка, а не калибровка.
     */
    public record ComplexityConf(long resolutionPixels, double resolutionWeight,
                                 double contrastStd, double contrastWeight,
                                 double cannyLow, double cannyHigh,
                                 double edgeDensity, double edgeWeight,
                                 double textDensityWeight,
                                 double simpleBelow, double mediumBelow) {
        public ComplexityConf {
            requireUnit("simpleBelow", simpleBelow);
            requireUnit("mediumBelow", mediumBelow);
            if (simpleBelow >= mediumBelow) {
                throw new IllegalStateException("complexity.simpleBelow must be < mediumBelow");
            }
        }
    }

    public record RecoveryConf(double minScore, int parallelism, int scaleMinWidth) {
        public RecoveryConf {
            requireUnit("recovery.minScore", minScore);
            if (parallelism < 1) throw new IllegalStateException("recovery.parallelism < 1");
        }
    }

    public record ExtractionConf(double minScore) {
        public ExtractionConf {
            requireUnit("extraction.minScore", minScore);
        }
    }

    public record ValidationConf(int caeYearMin, int caeYearMax, double totalTolerance,
                                 double itemsTolerance, double lowConfidence) {
        public ValidationConf {
            if (caeYearMin > caeYearMax) throw new IllegalStateException("caeYearMin > caeYearMax");
            requireUnit("validation.totalTolerance", totalTolerance);
            requireUnit("validation.itemsTolerance", itemsTolerance);
            requireUnit("validation.lowConfidence", lowConfidence);
        }
    }

    public record QuotaConf(String store) {}
    public record Db(String url, String user, String pass) {}
    public record ImportConf(List<String> patterns) {}

    /** Конфигурация со значениями по умолчанию (без файла). */
    public static Config defaults() {
        return fromMap(Map.of());
    }

    public static Config load() {
        try (InputStream in = Config.class.getResourceAsStream("/application.yaml")) {
            if (in == null) {
                throw new IllegalStateException("application.yaml not found on classpath");
            }
            return load(in);
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load application.yaml", e);
        }
    }

    public static Config load(InputStream in) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(in);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse configuration yaml", e);
        }
        return fromMap(root == null ? Map.of() : root);
    }

    @SuppressWarnings("unchecked")
    static Config fromMap(Map<String, Object> root) {
        Map<String, Object> ocr = section(root, "ocr");
        Map<String, Object> prov = section(root, "providers");
        Map<String, Object> cx = section(root, "complexity");
        Map<String, Object> rec = section(root, "recovery");
        Map<String, Object> ext = section(root, "extraction");
        Map<String, Object> val = section(root, "validation");
        Map<String, Object> quota = section(root, "quota");
        Map<String, Object> db = section(root, "db");
        Map<String, Object> imp = section(root, "import");

        // -D переопределения для локального движка
        String tessdataDir = System.getProperty("av.ocr.tessdataDir", str(ocr, "tessdataDir", "./tessdata"));
        String languages = System.getProperty("av.ocr.lang", str(ocr, "languages", "spa"));
        int psm = Integer.getInteger("av.ocr.psm", num(ocr, "psm", 6).intValue());
        int oem = Integer.getInteger("av.ocr.oem", num(ocr, "oem", 3).intValue());

        List<String> patterns = imp.get("patterns") != null
                ? List.copyOf((List<String>) imp.get("patterns"))
                : List.of("**/*.png", "**/*.jpg", "**/*.jpeg", "**/*.tif", "**/*.tiff");

        return new Config(
                new OcrConf(tessdataDir, languages, psm, oem,
                        num(ocr, "callTimeoutMs", 30_000).longValue(),
                        num(ocr, "localRetryBelow", 0.7).doubleValue(),
                        num(ocr, "localDefaultConfidence", 0.5).doubleValue()),
                new ProvidersConf(
                        cloud(section(prov, "cloudA"), 200, 0.0015, 0.95),
                        cloud(section(prov, "cloudB"), 100, 0.0015, 0.90)),
                new ComplexityConf(
                        num(cx, "resolutionPixels", 2_000_000).longValue(),
                        num(cx, "resolutionWeight", 0.2).doubleValue(),
                        num(cx, "contrastStd", 30).doubleValue(),
                        num(cx, "contrastWeight", 0.3).doubleValue(),
                        num(cx, "cannyLow", 50).doubleValue(),
                        num(cx, "cannyHigh", 150).doubleValue(),
                        num(cx, "edgeDensity", 0.1).doubleValue(),
                        num(cx, "edgeWeight", 0.3).doubleValue(),
                        num(cx, "textDensityWeight", 0.2).doubleValue(),
                        num(cx, "simpleBelow", 0.3).doubleValue(),
                        num(cx, "mediumBelow", 0.6).doubleValue()),
                new RecoveryConf(
                        num(rec, "minScore", 0.8).doubleValue(),
                        num(rec, "parallelism", 4).intValue(),
                        num(rec, "scaleMinWidth", 800).intValue()),
                new ExtractionConf(num(ext, "minScore", 0.5).doubleValue()),
                new ValidationConf(
                        num(val, "caeYearMin", 2000).intValue(),
                        num(val, "caeYearMax", 2035).intValue(),
                        num(val, "totalTolerance", 0.01).doubleValue(),
                        num(val, "itemsTolerance", 0.005).doubleValue(),
                        num(val, "lowConfidence", 0.7).doubleValue()),
                new QuotaConf(str(quota, "store", "memory")),
                new Db(str(db, "url", null), str(db, "user", null), str(db, "pass", null)),
                new ImportConf(patterns)
        );
    }

    private static CloudConf cloud(Map<String, Object> m, int limit, double cost, double conf) {
        return new CloudConf(
                num(m, "dailyLimit", limit).intValue(),
                num(m, "costUnits", cost).doubleValue(),
                num(m, "nominalConfidence", conf).doubleValue());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> root, String key) {
        Object v = root.get(key);
        if (v == null) return Map.of();
        if (!(v instanceof Map)) throw new IllegalStateException("config section '" + key + "' is not a map");
        return (Map<String, Object>) v;
    }

    private static Number num(Map<String, Object> m, String key, Number def) {
        Object v = m.get(key);
        if (v == null) return def;
        if (!(v instanceof Number)) throw new IllegalStateException("config key '" + key + "' is not a number: " + v);
        return (Number) v;
    }

    private static String str(Map<String, Object> m, String key, String def) {
        Object v = m.get(key);
        return v != null ? v.toString() : def;
    }

    private static void requireUnit(String name, double v) {
        if (v < 0.0 || v > 1.0) throw new IllegalStateException(name + " must be within [0,1]: " + v);
    }
}
