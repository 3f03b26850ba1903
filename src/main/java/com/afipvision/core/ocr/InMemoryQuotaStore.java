package com.afipvision.core.ocr;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Счётчики в памяти процесса: (провайдер, день) → AtomicInteger.
 * Новый день начинается с нуля; записи прошлых дней вычищаются при обращении.
 */
public final class InMemoryQuotaStore implements ProviderQuotaStore {

    private record Key(Provider provider, LocalDate day) {}

    private final Map<Key, AtomicInteger> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryQuotaStore() {
        this(Clock.systemDefaultZone());
    }

    public InMemoryQuotaStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public int increment(Provider provider) {
        Key k = key(provider);
        evictOlderThan(k.day());
        return counters.computeIfAbsent(k, x -> new AtomicInteger()).incrementAndGet();
    }

    @Override
    public int currentCount(Provider provider) {
        AtomicInteger c = counters.get(key(provider));
        return c == null ? 0 : c.get();
    }

    private Key key(Provider provider) {
        return new Key(Objects.requireNonNull(provider, "provider"), LocalDate.now(clock));
    }

    private void evictOlderThan(LocalDate day) {
        counters.keySet().removeIf(k -> k.day().isBefore(day));
    }
}
