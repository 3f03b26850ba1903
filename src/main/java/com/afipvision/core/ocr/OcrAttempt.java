package com.afipvision.core.ocr;

/** Итог одной попытки провайдера: либо результат, либо ошибка. */
public record OcrAttempt(RawOcrResult result, ProviderError error) {
    public OcrAttempt {
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of result/error must be set");
        }
    }

    public static OcrAttempt ok(RawOcrResult r) {
        return new OcrAttempt(r, null);
    }

    public static OcrAttempt failed(ProviderError e) {
        return new OcrAttempt(null, e);
    }

    public boolean isOk() {
        return result != null;
    }
}
