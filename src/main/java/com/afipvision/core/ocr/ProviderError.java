package com.afipvision.core.ocr;

import java.util.Objects;

/** Ожидаемый отказ провайдера; вызывает понижение к следующему в цепочке. */
public record ProviderError(Provider provider, Kind kind, String message) {
    public enum Kind { QUOTA_EXHAUSTED, UNAVAILABLE, TIMEOUT, FAILURE }

    public ProviderError {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
    }
}
