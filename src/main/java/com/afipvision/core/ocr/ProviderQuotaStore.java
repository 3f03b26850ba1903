package com.afipvision.core.ocr;

/**
 * Внешний счётчик дневного использования провайдеров (ключ — провайдер и календарный день).
 * Ядро только читает и увеличивает; сброс выполняет внешний планировщик или смена дня.
 * Реализации обязаны увеличивать счётчик атомарно.
 */
public interface ProviderQuotaStore {
    int increment(Provider provider);

    int currentCount(Provider provider);
}
