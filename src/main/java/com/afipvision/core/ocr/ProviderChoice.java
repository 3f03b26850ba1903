package com.afipvision.core.ocr;

import java.util.List;
import java.util.Objects;

/**
 * Выбранный провайдер и оставшаяся цепочка понижения (всегда заканчивается LOCAL).
 *
 * @param preferred провайдер по политике до проверки квот
 */
public record ProviderChoice(Provider provider, Provider preferred, List<Provider> fallbacks, String reason) {
    public ProviderChoice {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(preferred, "preferred");
        fallbacks = List.copyOf(Objects.requireNonNull(fallbacks, "fallbacks"));
        if (fallbacks.contains(provider)) throw new IllegalArgumentException("provider repeated in fallbacks");
        if (provider != Provider.LOCAL && (fallbacks.isEmpty() || fallbacks.get(fallbacks.size() - 1) != Provider.LOCAL)) {
            throw new IllegalArgumentException("fallback chain must end with LOCAL");
        }
        reason = reason == null ? "" : reason;
    }

    public boolean isDemoted() {
        return provider != preferred;
    }
}
