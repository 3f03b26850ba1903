package com.afipvision.core.extraction;

import com.afipvision.app.Config;
import com.afipvision.core.recovery.RecoveryResult;
import com.afipvision.core.recovery.Region;
import com.afipvision.core.recovery.SpecializedFieldRecovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Извлечение полей из сырого текста OCR.
 * <p>
 * Для каждого поля перебираются все непересекающиеся совпадения всех шаблонов, кандидат очищается,
 * нормализуется и оценивается CandidateScorer; остаётся лучший. Для критичных полей (CAE, CUIT, итог),
 * если регулярный проход ничего не дал или значение не прошло контрольную сумму, запускается
 * точечное дочитывание по изображению; его результат заменяет поле, только если уверенность выше
 * оценки регулярного кандидата.
 */
public final class StructuredFieldExtractor {
    private static final Logger log = LoggerFactory.getLogger(StructuredFieldExtractor.class);

    public static final String ITEMS_SUBTOTAL = "items_subtotal";

    /** Области дочитывания для полей, у которых место на бланке отличается от общего для вида. */
    private static final Map<String, List<Region>> FIELD_REGIONS = Map.of(
            "cuit_issuer", List.of(new Region(0.0, 0.0, 0.5, 0.5), new Region(0.0, 0.25, 0.5, 0.5)),
            "cuit_buyer", List.of(new Region(0.0, 0.25, 1.0, 0.35), new Region(0.5, 0.25, 0.5, 0.5)));

    /** Кандидат регулярного прохода; position — начало значения в тексте. */
    record Candidate(String raw, String normalized, double score, int position) {}

    private final FieldPatternLibrary library;
    private final Config.ExtractionConf cfg;
    private final SpecializedFieldRecovery recovery;

    /**
     * @param recovery может быть null: тогда критичные поля не дочитываются
     */
    public StructuredFieldExtractor(FieldPatternLibrary library, Config.ExtractionConf cfg,
                                    SpecializedFieldRecovery recovery) {
        this.library = Objects.requireNonNull(library, "library");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.recovery = recovery;
    }

    public StructuredDocument extract(String rawText, DocumentType type) {
        return extract(rawText, type, null);
    }

    /**
     * @param source исходное изображение для дочитывания критичных полей; null — без дочитывания
     */
    public StructuredDocument extract(String rawText, DocumentType type, BufferedImage source) {
        Objects.requireNonNull(type, "type");
        String text = rawText == null ? "" : rawText;
        StructuredDocument.Builder doc = StructuredDocument.builder(type);

        for (FieldSpec spec : library.specs(type)) {
            Candidate c = text.isBlank() ? null
                    : (spec.isOrdinal() ? ordinalCandidate(text, spec) : bestCandidate(text, spec));
            if (c != null) {
                doc.put(spec.name(), new FieldValue(c.raw(), c.normalized(), FieldSource.GENERAL_OCR, c.score()));
                log.debug("field {}: '{}' -> '{}' score={}", spec.name(), c.raw(), c.normalized(),
                        String.format("%.2f", c.score()));
            }
            if (spec.critical() && source != null && recovery != null && needsRecovery(spec, c)) {
                recoverInto(doc, type, spec, c, source);
            }
        }

        if (!text.isBlank()) {
            List<LineItem> items = LineItemExtractor.extract(text);
            if (!items.isEmpty()) {
                BigDecimal docSubtotal = doc.get("subtotal")
                        .flatMap(v -> Amounts.parse(v.normalized()))
                        .orElse(null);
                items = LineItemExtractor.withDocumentDeviation(items, docSubtotal);
                String sum = Amounts.format(LineItemExtractor.sumSubtotals(items));
                doc.put(ITEMS_SUBTOTAL, new FieldValue(sum, sum, FieldSource.COMPUTED, 1.0));
                doc.items(items);
            }
        }
        StructuredDocument out = doc.build();
        log.info("extract: type={} fields={} items={}", type, out.fields().size(), out.lineItems().size());
        return out;
    }

    private static boolean needsRecovery(FieldSpec spec, Candidate c) {
        if (c == null) return true;
        return spec.shape().checksum() != null && !spec.shape().checksum().test(c.normalized());
    }

    private void recoverInto(StructuredDocument.Builder doc, DocumentType type, FieldSpec spec, Candidate c,
                             BufferedImage source) {
        RecoveryResult r = recovery.recover(source, spec.kind(), FIELD_REGIONS.get(spec.name()));
        double prev = c == null ? 0.0 : c.score();
        if (r.isEmpty() || r.confidence() <= prev) {
            log.debug("field {}: recovery kept regex result (recovered={}, prev={})", spec.name(), r, prev);
            return;
        }
        if (!spec.shape().accepts(r.value())) {
            log.debug("field {}: recovered '{}' rejected by shape", spec.name(), r.value());
            return;
        }
        // одно и то же значение не должно попасть в два поля одного вида (CUIT продавца и покупателя)
        for (FieldSpec other : library.specs(type)) {
            if (other != spec && other.kind() == spec.kind()
                    && doc.get(other.name()).map(v -> v.normalized().equals(r.value())).orElse(false)) {
                log.debug("field {}: recovered '{}' already used by {}", spec.name(), r.value(), other.name());
                return;
            }
        }
        doc.put(spec.name(), new FieldValue(r.value(), r.value(), FieldSource.RECOVERY_OCR, r.confidence()));
        log.info("field {}: recovered '{}' conf={}", spec.name(), r.value(), String.format("%.2f", r.confidence()));
    }

    /** Лучший кандидат по оценке; при равенстве — более ранний шаблон и более раннее совпадение. */
    Candidate bestCandidate(String text, FieldSpec spec) {
        Candidate best = null;
        for (Pattern p : spec.patterns()) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                Candidate c = evaluate(m.group(1), m.start(1), spec);
                if (c != null && (best == null || c.score() > best.score())) best = c;
            }
        }
        return best;
    }

    /** n-е различное приемлемое значение по порядку в тексте (для общих меток). */
    Candidate ordinalCandidate(String text, FieldSpec spec) {
        Map<String, Candidate> byValue = new LinkedHashMap<>();
        for (Pattern p : spec.patterns()) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                Candidate c = evaluate(m.group(1), m.start(1), spec);
                if (c == null) continue;
                byValue.merge(c.normalized(), c, (a, b) -> a.position() <= b.position() ? a : b);
            }
        }
        List<Candidate> ordered = new ArrayList<>(byValue.values());
        ordered.sort(Comparator.comparingInt(Candidate::position));
        return spec.ordinal() < ordered.size() ? ordered.get(spec.ordinal()) : null;
    }

    private Candidate evaluate(String raw, int position, FieldSpec spec) {
        if (raw == null) return null;
        String cleaned = CandidateScorer.clean(raw);
        if (cleaned.isEmpty()) return null;
        String normalized = spec.kind().normalize(cleaned);
        if (!CandidateScorer.isAcceptable(normalized, spec.shape())) return null;
        double score = CandidateScorer.score(normalized, spec.shape());
        if (score < cfg.minScore()) return null;
        return new Candidate(cleaned, normalized, score, position);
    }
}
