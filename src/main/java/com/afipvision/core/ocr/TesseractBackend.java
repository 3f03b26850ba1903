package com.afipvision.core.ocr;

import com.afipvision.app.Config;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Локальный OCR на Tess4J.
 * Экземпляр Tesseract не потокобезопасен, поэтому у каждого потока свой (ThreadLocal):
 * дочитывание полей идёт параллельно.
 */
public final class TesseractBackend implements OcrBackend {
    private static final Logger log = LoggerFactory.getLogger(TesseractBackend.class);

    private final Path datapath;
    private final String languages;
    private final int oem;
    private final ThreadLocal<Tesseract> engines;

    public TesseractBackend(Config.OcrConf cfg) {
        Objects.requireNonNull(cfg, "cfg");
        // Путь к tessdata: cfg.tessdataDir (уже с учётом -Dav.ocr.tessdataDir) → ENV TESSDATA_PREFIX
        String dir = cfg.tessdataDir();
        if (dir == null || dir.isBlank()) dir = System.getenv("TESSDATA_PREFIX");
        Path dp = Path.of(Objects.requireNonNull(dir, "tessdataDir is required"))
                .toAbsolutePath().normalize();
        if (!Files.isDirectory(dp)) {
            throw new IllegalStateException("tessdataDir not found: " + dp);
        }
        this.datapath = dp;
        this.languages = cfg.languages();
        this.oem = cfg.oem();
        this.engines = ThreadLocal.withInitial(this::newEngine);
        log.info("OCR: init datapath={} languages={} oem={}", dp, languages, oem);
    }

    private Tesseract newEngine() {
        Tesseract t = new Tesseract();
        t.setDatapath(datapath.toString());
        t.setLanguage(languages);
        t.setOcrEngineMode(oem);
        // без словарей: номера и суммы не из словаря
        t.setVariable("load_system_dawg", "F");
        t.setVariable("load_freq_dawg", "F");
        t.setVariable("user_defined_dpi", "300");
        t.setVariable("preserve_interword_spaces", "1");
        return t;
    }

    @Override
    public OcrText recognize(BufferedImage image, OcrConfig config) throws OcrBackendException {
        if (image == null) throw new OcrBackendException("image is null");
        Tesseract tess = engines.get();
        tess.setPageSegMode(config.psm());
        tess.setVariable("tessedit_char_whitelist", config.whitelist() == null ? "" : config.whitelist());
        try {
            String raw = tess.doOCR(image);
            String text = raw == null ? "" : raw.strip();
            if (!config.measureConfidence()) return OcrText.of(text);
            return new OcrText(text, meanWordConfidence(tess, image));
        } catch (TesseractException e) {
            throw new OcrBackendException("tesseract failed: " + e.getMessage(), e);
        } catch (RuntimeException | LinkageError e) {
            // JNA/нативные сбои приходят как unchecked
            throw new OcrBackendException("tesseract native failure: " + e, e);
        }
    }

    /** Средняя уверенность по словам / 100; без слов — неизвестно. */
    private static double meanWordConfidence(Tesseract tess, BufferedImage image) {
        List<Word> words = tess.getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
        if (words == null || words.isEmpty()) return OcrText.UNKNOWN;
        double sum = 0;
        int n = 0;
        for (Word w : words) {
            if (w.getText() == null || w.getText().isBlank()) continue;
            sum += w.getConfidence();
            n++;
        }
        if (n == 0) return OcrText.UNKNOWN;
        return Math.max(0.0, Math.min(1.0, sum / n / 100.0));
    }
}
