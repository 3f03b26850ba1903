package com.afipvision.core.image;

import com.afipvision.app.Config;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Оценка трудности OCR по пикселям: разрешение, контраст, плотность границ, плотность текста.
 * Каждый признак добавляет свой вес из конфигурации, сумма ограничена 1.0.
 * Нечитаемое изображение даёт MEDIUM: не эскалируем к дорогим провайдерам и не упрощаем обработку.
 */
public final class ComplexityAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private final Config.ComplexityConf cfg;

    public ComplexityAnalyzer(Config.ComplexityConf cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    public ComplexityScore analyze(Path file) {
        if (file == null) return ComplexityScore.unreadable(cfg);
        try {
            BufferedImage img = ImageIO.read(file.toFile());
            if (img == null) {
                log.warn("complexity: unsupported image {}", file);
                return ComplexityScore.unreadable(cfg);
            }
            return analyze(img);
        } catch (IOException e) {
            log.warn("complexity: cannot read {}: {}", file, e.getMessage());
            return ComplexityScore.unreadable(cfg);
        }
    }

    public ComplexityScore analyze(BufferedImage image) {
        if (image == null || image.getWidth() == 0 || image.getHeight() == 0) {
            return ComplexityScore.unreadable(cfg);
        }
        Mat gray = null, mean = null, stddev = null, edges = null, bin = null, hierarchy = null;
        MatVector contours = null;
        try {
            gray = Mats.toGray(image);
            double pixels = (double) gray.rows() * gray.cols();
            double value = 0.0;

            // 1) разрешение
            if (pixels > cfg.resolutionPixels()) value += cfg.resolutionWeight();

            // 2) контраст через стандартное отклонение яркости
            mean = new Mat();
            stddev = new Mat();
            opencv_core.meanStdDev(gray, mean, stddev);
            double std = stddev.createIndexer().getDouble(0);
            if (std < cfg.contrastStd()) value += cfg.contrastWeight();

            // 3) плотность границ (Canny)
            edges = new Mat();
            opencv_imgproc.Canny(gray, edges, cfg.cannyLow(), cfg.cannyHigh());
            double edgeDensity = opencv_core.countNonZero(edges) / pixels;
            if (edgeDensity > cfg.edgeDensity()) value += cfg.edgeWeight();

            // 4) плотность текста: площадь внешних контуров тёмных объектов
            bin = new Mat();
            opencv_imgproc.threshold(gray, bin, 0, 255, opencv_imgproc.THRESH_BINARY_INV | opencv_imgproc.THRESH_OTSU);
            contours = new MatVector();
            hierarchy = new Mat();
            opencv_imgproc.findContours(bin, contours, hierarchy,
                    opencv_imgproc.RETR_EXTERNAL, opencv_imgproc.CHAIN_APPROX_SIMPLE);
            double area = 0;
            for (long i = 0; i < contours.size(); i++) {
                area += opencv_imgproc.contourArea(contours.get(i));
            }
            double textDensity = Math.min(1.0, area / pixels);
            value += textDensity * cfg.textDensityWeight();

            ComplexityScore score = ComplexityScore.of(Math.min(1.0, value), cfg);
            log.debug("complexity: {}x{} std={} edges={} text={} -> {} {}",
                    gray.cols(), gray.rows(), String.format("%.1f", std), String.format("%.3f", edgeDensity),
                    String.format("%.3f", textDensity), String.format("%.3f", score.value()), score.tier());
            return score;
        } catch (RuntimeException | LinkageError e) {
            log.warn("complexity: analysis failed, using MEDIUM: {}", e.toString());
            return ComplexityScore.unreadable(cfg);
        } finally {
            Mats.release(gray, mean, stddev, edges, bin, hierarchy);
            if (contours != null) contours.close();
        }
    }
}
