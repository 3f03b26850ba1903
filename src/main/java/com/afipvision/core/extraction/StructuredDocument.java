package com.afipvision.core.extraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Результат извлечения: поля документа (имя → значение) и строки товаров/услуг.
 * Неизменяем после построения; порядок полей — порядок описания в библиотеке шаблонов.
 */
public record StructuredDocument(DocumentType type, Map<String, FieldValue> fields, List<LineItem> lineItems) {
    public StructuredDocument {
        Objects.requireNonNull(type, "type");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
        lineItems = List.copyOf(Objects.requireNonNull(lineItems, "lineItems"));
    }

    public static StructuredDocument empty(DocumentType type) {
        return new StructuredDocument(type, Map.of(), List.of());
    }

    public Optional<FieldValue> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    /** Нормализованное значение или null. */
    public String value(String name) {
        FieldValue v = fields.get(name);
        return v == null ? null : v.normalized();
    }

    public boolean isEmpty() {
        return fields.isEmpty() && lineItems.isEmpty();
    }

    public static Builder builder(DocumentType type) {
        return new Builder(type);
    }

    public static final class Builder {
        private final DocumentType type;
        private final Map<String, FieldValue> fields = new LinkedHashMap<>();
        private final List<LineItem> items = new ArrayList<>();

        private Builder(DocumentType type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder put(String name, FieldValue value) {
            fields.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Optional<FieldValue> get(String name) {
            return Optional.ofNullable(fields.get(name));
        }

        public Builder items(List<LineItem> lineItems) {
            items.clear();
            items.addAll(lineItems);
            return this;
        }

        public StructuredDocument build() {
            return new StructuredDocument(type, fields, items);
        }
    }
}
