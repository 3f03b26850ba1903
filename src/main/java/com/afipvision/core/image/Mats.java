package com.afipvision.core.image;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/** Переходы BufferedImage ↔ OpenCV Mat и освобождение нативной памяти. */
public final class Mats {
    private static final Logger log = LoggerFactory.getLogger(Mats.class);

    private Mats() {
        // no-op
    }

    /** Серое 8-битное Mat. Яркость считается явно (0.299R+0.587G+0.114B), без гамма-коррекции Java2D. */
    public static Mat toGray(BufferedImage src) {
        int w = src.getWidth(), h = src.getHeight();
        byte[] data = new byte[w * h];
        if (src.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            int[] px = src.getRaster().getPixels(0, 0, w, h, (int[]) null);
            for (int i = 0; i < px.length; i++) data[i] = (byte) px[i];
        } else {
            int i = 0;
            for (int y = 0; y < h; y++)
                for (int x = 0; x < w; x++) {
                    int rgb = src.getRGB(x, y);
                    int r = (rgb >> 16) & 0xFF, g = (rgb >> 8) & 0xFF, b = rgb & 0xFF;
                    data[i++] = (byte) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
                }
        }
        Mat m = new Mat(h, w, opencv_core.CV_8UC1);
        m.data().put(data);
        return m;
    }

    /** Mat → BufferedImage через PNG-кодек. null при ошибке кодирования. */
    public static BufferedImage toImage(Mat m) {
        BytePointer buf = new BytePointer();
        try {
            boolean ok = opencv_imgcodecs.imencode(".png", m, buf);
            if (!ok) return null;
            byte[] bytes = new byte[(int) buf.limit()];
            buf.get(bytes);
            return ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            log.warn("Mat->image decode failed: {}", e.getMessage());
            return null;
        } finally {
            buf.deallocate();
        }
    }

    public static void release(Mat... mats) {
        for (Mat m : mats) if (m != null) m.release();
    }
}
