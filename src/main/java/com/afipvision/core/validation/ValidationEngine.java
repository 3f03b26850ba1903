package com.afipvision.core.validation;

import com.afipvision.app.Config;
import com.afipvision.core.extraction.Amounts;
import com.afipvision.core.extraction.Dates;
import com.afipvision.core.extraction.DocumentType;
import com.afipvision.core.extraction.FieldPatternLibrary;
import com.afipvision.core.extraction.FieldShape;
import com.afipvision.core.extraction.FieldSpec;
import com.afipvision.core.extraction.FieldValue;
import com.afipvision.core.extraction.LineItem;
import com.afipvision.core.extraction.StructuredDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Проверка извлечённого документа: форма и контрольные суммы каждого поля, затем согласованность
 * между полями (даты, сверка сумм). Нарушение согласованности — всегда предупреждение:
 * OCR часто ошибается, а исправлять значения здесь нельзя.
 */
public final class ValidationEngine {
    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    static final String MISSING = "missing required field";

    private static final double SHAPE_FAILURE_CONFIDENCE = 0.2;
    private static final double CHECK_FAILURE_CONFIDENCE = 0.1;

    private final FieldPatternLibrary library;
    private final ChecksumValidators validators;
    private final Config.ValidationConf cfg;
    private final Clock clock;

    public ValidationEngine(FieldPatternLibrary library, ChecksumValidators validators,
                            Config.ValidationConf cfg, Clock clock) {
        this.library = Objects.requireNonNull(library, "library");
        this.validators = Objects.requireNonNull(validators, "validators");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ValidationVerdict validate(StructuredDocument doc, DocumentType type) {
        Objects.requireNonNull(doc, "doc");
        Objects.requireNonNull(type, "type");
        Map<String, FieldValidation> results = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        boolean overall = true;

        for (FieldSpec spec : library.specs(type)) {
            FieldValue v = doc.fields().get(spec.name());
            if (v == null) {
                if (spec.required()) {
                    results.put(spec.name(), FieldValidation.fail(0.0, MISSING));
                    errors.add(spec.name() + ": " + MISSING);
                    overall = false;
                }
                continue;
            }
            FieldValidation fv = validateField(spec, v);
            results.put(spec.name(), fv);
            if (!fv.valid()) {
                if (spec.required()) {
                    errors.add(spec.name() + ": " + fv.message());
                    overall = false;
                } else {
                    warnings.add("optional field " + spec.name() + " invalid: " + fv.message());
                }
            } else if (v.confidence() < cfg.lowConfidence()) {
                warnings.add(String.format(Locale.ROOT, "%s: low extraction confidence %.2f", spec.name(), v.confidence()));
            }
        }

        Map<String, LocalDate> dates = validDates(doc, results);
        checkCaeDate(doc, results, dates, warnings);
        checkDateOrder(dates, warnings);
        checkTotals(doc, results, warnings);
        checkItemsVsSubtotal(doc, results, warnings);
        checkNames(type, doc, warnings);

        ValidationVerdict verdict = new ValidationVerdict(overall, results, errors, warnings);
        log.info("validate: type={} valid={} errors={} warnings={}", type, overall, errors.size(), warnings.size());
        if (log.isDebugEnabled()) {
            for (String e : errors) log.debug("  error: {}", e);
            for (String w : warnings) log.debug("  warning: {}", w);
        }
        return verdict;
    }

    /** Проверка одного поля по его форме и правилам вида. */
    FieldValidation validateField(FieldSpec spec, FieldValue v) {
        String n = v.normalized();
        FieldShape shape = spec.shape();
        if (!shape.accepts(n)) {
            return FieldValidation.fail(SHAPE_FAILURE_CONFIDENCE, String.format(Locale.ROOT,
                    "value '%s' does not match expected shape (length %d..%d)", n, shape.minLength(), shape.maxLength()));
        }
        switch (spec.kind()) {
            case CUIT -> {
                ChecksumValidators.Check c = validators.checkCuit(n);
                if (!c.valid()) {
                    return FieldValidation.fail(CHECK_FAILURE_CONFIDENCE, String.join("; ", c.failures())
                            + "; expected format XX-XXXXXXXX-X, got " + ChecksumValidators.formatCuit(n));
                }
            }
            case CAE -> {
                ChecksumValidators.Check c = validators.checkCae(n);
                if (!c.valid()) return FieldValidation.fail(CHECK_FAILURE_CONFIDENCE, String.join("; ", c.failures()));
            }
            case DATE -> {
                if (!Dates.isCalendarValid(n)) {
                    return FieldValidation.fail(CHECK_FAILURE_CONFIDENCE, "not a calendar date: " + n + " (expected DD/MM/YYYY)");
                }
            }
            case AMOUNT -> {
                Optional<BigDecimal> a = Amounts.parse(n);
                if (a.isEmpty()) return FieldValidation.fail(SHAPE_FAILURE_CONFIDENCE, "not an amount: " + n);
                if (a.get().signum() <= 0) return FieldValidation.fail(CHECK_FAILURE_CONFIDENCE, "amount must be > 0, got " + n);
            }
            default -> {
                if (shape.format() != null && !shape.format().matcher(n).matches()) {
                    return FieldValidation.fail(SHAPE_FAILURE_CONFIDENCE, "value '" + n + "' has unexpected format");
                }
                if (shape.checksum() != null && !shape.checksum().test(n)) {
                    return FieldValidation.fail(CHECK_FAILURE_CONFIDENCE, "value '" + n + "' failed checksum");
                }
            }
        }
        return FieldValidation.pass(v.confidence());
    }

    private static Map<String, LocalDate> validDates(StructuredDocument doc, Map<String, FieldValidation> results) {
        Map<String, LocalDate> out = new LinkedHashMap<>();
        for (Map.Entry<String, FieldValidation> e : results.entrySet()) {
            if (!e.getValue().valid()) continue;
            Dates.parse(doc.value(e.getKey())).ifPresent(d -> out.put(e.getKey(), d));
        }
        return out;
    }

    // дата внутри CAE не раньше даты выдачи
    private void checkCaeDate(StructuredDocument doc, Map<String, FieldValidation> results,
                              Map<String, LocalDate> dates, List<String> warnings) {
        LocalDate issue = dates.get("issue_date");
        if (issue == null || !isValid(results, "cae_number")) return;
        validators.caeTimestamp(doc.value("cae_number")).ifPresent(ts -> {
            if (ts.toLocalDate().isBefore(issue)) {
                warnings.add("cae_number: embedded date " + ts.toLocalDate()
                        + " precedes issue_date " + doc.value("issue_date"));
            }
        });
    }

    private void checkDateOrder(Map<String, LocalDate> dates, List<String> warnings) {
        LocalDate issue = dates.get("issue_date");
        if (issue != null && issue.isAfter(LocalDate.now(clock))) {
            warnings.add("issue_date " + issue + " is in the future");
        }
        before(dates, "due_date", "issue_date", warnings);
        before(dates, "cae_due_date", "issue_date", warnings);
        before(dates, "billing_period_to", "billing_period_from", warnings);
        before(dates, "expiry_date", "issue_date", warnings);
    }

    private static void before(Map<String, LocalDate> dates, String later, String earlier, List<String> warnings) {
        LocalDate l = dates.get(later);
        LocalDate e = dates.get(earlier);
        if (l != null && e != null && l.isBefore(e)) {
            warnings.add(later + " " + l + " precedes " + earlier + " " + e);
        }
    }

    /**
     * Сверка итога: сумма строк (или подытог) + налог + прочие сборы против итога документа.
     * Итог, равный одному подытогу, допустим только без извлечённого налога (фактура C без IVA).
     */
    private void checkTotals(StructuredDocument doc, Map<String, FieldValidation> results, List<String> warnings) {
        if (!isValid(results, "total_amount")) return;
        BigDecimal total = amount(doc, "total_amount");
        if (total == null) return;

        BigDecimal base;
        String baseName;
        if (!doc.lineItems().isEmpty()) {
            base = itemsSum(doc.lineItems());
            baseName = "items";
        } else {
            base = isValid(results, "subtotal") ? amount(doc, "subtotal") : null;
            baseName = "subtotal";
        }
        if (base == null) return;
        BigDecimal tax = optionalAmount(doc, results, "tax_amount");
        BigDecimal other = optionalAmount(doc, results, "other_taxes_amount");
        BigDecimal reconstructed = base.add(tax).add(other).setScale(2, RoundingMode.HALF_UP);

        double dev = deviation(reconstructed, total);
        if (dev <= cfg.totalTolerance()) return;
        // фактура C: IVA не выделяется, итог равен базе; при извлечённом налоге не применяется
        if (tax.signum() == 0 && deviation(base, total) <= cfg.totalTolerance()) return;
        warnings.add(String.format(Locale.ROOT,
                "total_amount: reconstructed %s (%s %s + tax %s + other %s) differs from extracted %s by %.2f%%",
                Amounts.format(reconstructed), baseName, Amounts.format(base), Amounts.format(tax),
                Amounts.format(other), Amounts.format(total), dev * 100));
    }

    private void checkItemsVsSubtotal(StructuredDocument doc, Map<String, FieldValidation> results, List<String> warnings) {
        if (doc.lineItems().isEmpty() || !isValid(results, "subtotal")) return;
        BigDecimal subtotal = amount(doc, "subtotal");
        if (subtotal == null) return;
        BigDecimal items = itemsSum(doc.lineItems());
        double dev = deviation(items, subtotal);
        if (dev > cfg.itemsTolerance()) {
            warnings.add(String.format(Locale.ROOT, "line items sum %s differs from subtotal %s by %.2f%%",
                    Amounts.format(items), Amounts.format(subtotal), dev * 100));
        }
    }

    private static void checkNames(DocumentType type, StructuredDocument doc, List<String> warnings) {
        if (type != DocumentType.DNI) return;
        String first = doc.value("first_name");
        String last = doc.value("last_name");
        if (first != null && last != null && first.equalsIgnoreCase(last)) {
            warnings.add("first_name equals last_name: " + first);
        }
    }

    private static boolean isValid(Map<String, FieldValidation> results, String name) {
        FieldValidation fv = results.get(name);
        return fv != null && fv.valid();
    }

    private static BigDecimal amount(StructuredDocument doc, String name) {
        return Amounts.parse(doc.value(name)).orElse(null);
    }

    private static BigDecimal optionalAmount(StructuredDocument doc, Map<String, FieldValidation> results, String name) {
        if (!isValid(results, name)) return BigDecimal.ZERO;
        BigDecimal a = amount(doc, name);
        return a == null ? BigDecimal.ZERO : a;
    }

    private static BigDecimal itemsSum(List<LineItem> items) {
        BigDecimal sum = BigDecimal.ZERO;
        for (LineItem it : items) {
            if (it.subtotal() != null) sum = sum.add(it.subtotal());
        }
        return sum.setScale(2, RoundingMode.HALF_UP);
    }

    static double deviation(BigDecimal actual, BigDecimal expected) {
        if (expected.signum() == 0) return actual.signum() == 0 ? 0.0 : 1.0;
        return actual.subtract(expected).abs()
                .divide(expected.abs(), 6, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
