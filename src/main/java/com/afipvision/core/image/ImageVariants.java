package com.afipvision.core.image;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_imgproc.CLAHE;

import java.util.ArrayList;
import java.util.List;

/**
 * Фиксированный набор предобработок фрагмента для точечного OCR.
 * Порядок не важен: перебираются все варианты.
 */
public final class ImageVariants {

    /** Вариант предобработки; Mat принадлежит вызывающему и освобождается им. */
    public record Variant(String name, Mat mat) {}

    private ImageVariants() {
        // no-op
    }

    /**
     * @param gray          серый фрагмент (не изменяется)
     * @param scaleMinWidth фрагменты уже этой ширины дополнительно увеличиваются
     */
    public static List<Variant> battery(Mat gray, int scaleMinWidth) {
        List<Variant> out = new ArrayList<>(7);
        out.add(new Variant("gray", gray.clone()));

        // контраст: CLAHE
        CLAHE clahe = opencv_imgproc.createCLAHE(2.0, new Size(8, 8));
        Mat eq = new Mat();
        clahe.apply(gray, eq);
        out.add(new Variant("contrast", eq));

        // адаптивный порог: мелкое окно под строку цифр
        Mat adapt = new Mat();
        opencv_imgproc.adaptiveThreshold(gray, adapt, 255,
                opencv_imgproc.ADAPTIVE_THRESH_GAUSSIAN_C, opencv_imgproc.THRESH_BINARY, 11, 2);
        out.add(new Variant("adaptive", adapt));

        // резкость: unsharp mask
        Mat blur = new Mat();
        opencv_imgproc.GaussianBlur(gray, blur, new Size(0, 0), 3);
        Mat sharp = new Mat();
        opencv_core.addWeighted(gray, 1.5, blur, -0.5, 0, sharp);
        blur.release();
        out.add(new Variant("sharpen", sharp));

        // морфологическое замыкание для склейки разрывов символов
        Mat k = opencv_imgproc.getStructuringElement(opencv_imgproc.MORPH_RECT, new Size(2, 2));
        Mat closed = new Mat();
        opencv_imgproc.morphologyEx(gray, closed, opencv_imgproc.MORPH_CLOSE, k);
        k.release();
        out.add(new Variant("closed", closed));

        // Otsu как запасная бинаризация
        Mat otsu = new Mat();
        opencv_imgproc.threshold(gray, otsu, 0, 255, opencv_imgproc.THRESH_BINARY | opencv_imgproc.THRESH_OTSU);
        out.add(new Variant("otsu", otsu));

        if (gray.cols() > 0 && gray.cols() < scaleMinWidth) {
            double f = scaleMinWidth / (double) gray.cols();
            int newH = Math.max(1, (int) Math.round(gray.rows() * f));
            Mat up = new Mat();
            opencv_imgproc.resize(gray, up, new Size(scaleMinWidth, newH), 0, 0, opencv_imgproc.INTER_CUBIC);
            out.add(new Variant("scaled", up));
        }
        return out;
    }
}
