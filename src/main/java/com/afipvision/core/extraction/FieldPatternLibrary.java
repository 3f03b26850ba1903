package com.afipvision.core.extraction;

import com.afipvision.core.validation.ChecksumValidators;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Неизменяемый реестр шаблонов полей по типам документов. Строится один раз при старте.
 * Ошибка в реестре (битый regex, шаблон без группы, дубликат поля) — дефект, а не входные данные,
 * поэтому построение падает с {@link IllegalStateException}.
 */
public final class FieldPatternLibrary {

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.MULTILINE;

    // горизонтальный пробел: метка и значение на одной строке
    private static final String H = "[ \\t]*";
    private static final String DATE = "(\\d{1,2}[/.\\-]\\d{1,2}[/.\\-]\\d{2,4}|\\d{1,2}\\s+de\\s+\\p{L}+\\s+del?\\s+\\d{4})";
    private static final String AMT = "\\$?" + H + "(\\d[\\d.,]*)";
    // значение до конца строки, двойного пробела или следующей метки
    private static final String LINE = "([^\\n,;]{2,200}?)" + H
            + "(?=$|[ \\t]{2,}|[,;]|\\b(?:Domicilio|CUIT|Condici[óo]n|Fecha|Apellido|DNI|Sexo|Nacionalidad)\\b)";
    private static final String CUIT_LABEL = "C\\.?U\\.?I\\.?T\\.?" + H + "(?:N[°º])?" + H + ":?" + H
            + "(\\d{2}[-.\\s]?\\d{8}[-.\\s]?\\d)";
    private static final String CUIT_DASHED = "\\b(\\d{2}-\\d{8}-\\d)\\b";
    private static final String CUIT_DOTTED = "\\b(\\d{2}\\.\\d{8}\\.\\d)\\b";
    private static final String CUIT_PLAIN = "\\b(\\d{11})\\b";
    private static final String DNI_NUM = "(\\d{1,2}\\.?\\d{3}\\.?\\d{3})";

    static final List<String> COMPANY_KEYWORDS = List.of(
            "S.A", "S.R.L", "S.A.S", "SOCIEDAD", "COOPERATIVA", "ASOCIACION", "FUNDACION");
    static final List<String> INSTITUTION_KEYWORDS = List.of(
            "UNIVERSIDAD", "INSTITUTO", "COLEGIO", "ESCUELA", "FACULTAD");
    static final List<String> VAT_KEYWORDS = List.of(
            "RESPONSABLE", "MONOTRIBUTO", "CONSUMIDOR FINAL", "EXENTO", "INSCRIPTO");

    private final Map<DocumentType, List<FieldSpec>> specs;

    private FieldPatternLibrary(Map<DocumentType, List<FieldSpec>> specs) {
        this.specs = specs;
    }

    public List<FieldSpec> specs(DocumentType type) {
        return specs.getOrDefault(type, List.of());
    }

    public Optional<FieldSpec> spec(DocumentType type, String name) {
        return specs(type).stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public Set<String> requiredFields(DocumentType type) {
        Set<String> out = new LinkedHashSet<>();
        for (FieldSpec s : specs(type)) if (s.required()) out.add(s.name());
        return Collections.unmodifiableSet(out);
    }

    public static Builder builder(ChecksumValidators validators) {
        return new Builder(validators);
    }

    /** Стандартный набор шаблонов для всех типов документов. */
    public static FieldPatternLibrary defaults(ChecksumValidators v) {
        Builder b = builder(v);

        // ---- Factura AFIP ----
        DocumentType F = DocumentType.AFIP_INVOICE;
        b.field(F, "invoice_type", FieldKind.INVOICE_LETTER).patterns(
                "FACTURA" + H + "\\b([ABCEM])\\b",
                "COD\\.?" + H + "(?:N[°º])?" + H + "(\\d{1,3})\\b",
                "^" + H + "([ABCEM])" + H + "$");
        b.field(F, "point_of_sale", FieldKind.POINT_OF_SALE).patterns(
                "Punto\\s+de\\s+Venta" + H + ":?" + H + "(\\d{1,5})",
                "Pto\\.?" + H + "(?:de" + H + ")?Vta\\.?" + H + ":?" + H + "(\\d{1,5})",
                "\\bP\\.\\s*V\\." + H + ":?" + H + "(\\d{1,5})",
                "\\bPV" + H + ":?" + H + "(\\d{1,5})",
                "\\b(\\d{4,5})-\\d{8}\\b");
        b.field(F, "invoice_number", FieldKind.INVOICE_NUMBER).patterns(
                "Comp\\.?" + H + "Nro\\.?" + H + ":?" + H + "(\\d{1,8})",
                "Comprobante" + H + "N(?:[°º]|ro\\.?)" + H + ":?" + H + "(\\d{1,8})",
                "N[úu]mero" + H + ":?" + H + "(\\d{1,8})",
                "\\b\\d{4,5}-(\\d{8})\\b");
        b.field(F, "issue_date", FieldKind.DATE).patterns(
                "Fecha\\s+de\\s+Emisi[óo]n" + H + ":?" + H + DATE,
                "Fecha\\s+Emisi[óo]n" + H + ":?" + H + DATE,
                "\\bFecha" + H + ":" + H + DATE);
        b.field(F, "due_date", FieldKind.DATE).patterns(
                "Fecha\\s+de\\s+Vto\\.?\\s+para\\s+el\\s+pago" + H + ":?" + H + DATE,
                "Vencimiento" + H + ":?" + H + DATE);
        b.field(F, "issuer_name", FieldKind.NAME).ordinal(0).keywords(COMPANY_KEYWORDS).patterns(
                "Raz[óo]n\\s+Social" + H + ":" + H + LINE);
        b.field(F, "issuer_address", FieldKind.TEXT).patterns(
                "Domicilio\\s+Comercial" + H + ":" + H + LINE);
        b.field(F, "issuer_vat_condition", FieldKind.TEXT).ordinal(0).keywords(VAT_KEYWORDS).patterns(
                "Condici[óo]n\\s+frente\\s+al\\s+IVA" + H + ":" + H + LINE);
        b.field(F, "cuit_issuer", FieldKind.CUIT).critical().ordinal(0).patterns(
                CUIT_LABEL, CUIT_DASHED, CUIT_DOTTED, CUIT_PLAIN);
        b.field(F, "cuit_buyer", FieldKind.CUIT).critical().ordinal(1).patterns(
                CUIT_LABEL, CUIT_DASHED, CUIT_DOTTED, CUIT_PLAIN);
        b.field(F, "buyer_name", FieldKind.NAME).keywords(COMPANY_KEYWORDS).patterns(
                "Apellido\\s+y\\s+Nombre\\s*/\\s*Raz[óo]n\\s+Social" + H + ":" + H + LINE,
                "Se[ñn]or(?:es)?" + H + ":" + H + LINE,
                "Cliente" + H + ":" + H + LINE);
        b.field(F, "buyer_address", FieldKind.TEXT).patterns(
                "\\bDomicilio" + H + ":" + H + LINE);
        b.field(F, "buyer_vat_condition", FieldKind.TEXT).ordinal(1).keywords(VAT_KEYWORDS).patterns(
                "Condici[óo]n\\s+frente\\s+al\\s+IVA" + H + ":" + H + LINE);
        b.field(F, "sale_condition", FieldKind.TEXT).patterns(
                "Condici[óo]n\\s+de\\s+venta" + H + ":" + H + LINE);
        b.field(F, "gross_income_number", FieldKind.TEXT).patterns(
                "Ingresos\\s+Brutos" + H + ":" + H + LINE);
        b.field(F, "activity_start_date", FieldKind.DATE).patterns(
                "Fecha\\s+de\\s+Inicio\\s+de\\s+Actividades" + H + ":?" + H + DATE);
        b.field(F, "billing_period_from", FieldKind.DATE).patterns(
                "Per[íi]odo\\s+Facturado\\s+Desde" + H + ":?" + H + DATE,
                "\\bDesde" + H + ":?" + H + DATE);
        b.field(F, "billing_period_to", FieldKind.DATE).patterns(
                "\\bHasta" + H + ":?" + H + DATE);
        b.field(F, "subtotal", FieldKind.AMOUNT).patterns(
                "Sub" + H + "total" + H + ":?" + H + AMT,
                "Importe\\s+Neto\\s+Gravado" + H + ":?" + H + AMT);
        b.field(F, "tax_amount", FieldKind.AMOUNT).patterns(
                "Importe\\s+IVA" + H + ":?" + H + AMT,
                "\\bIVA" + H + "\\d{1,2}(?:[.,]\\d+)?" + H + "%" + H + ":?" + H + AMT,
                "\\bIVA" + H + ":" + H + AMT);
        b.field(F, "other_taxes_amount", FieldKind.AMOUNT).patterns(
                "Importe\\s+Otros\\s+Tributos" + H + ":?" + H + AMT,
                "Otros\\s+Tributos" + H + ":?" + H + AMT);
        b.field(F, "total_amount", FieldKind.AMOUNT).required().critical().patterns(
                "Importe\\s+Total" + H + ":?" + H + AMT,
                "\\bTOTAL" + H + ":?" + H + AMT);
        b.field(F, "cae_number", FieldKind.CAE).required().critical().patterns(
                "\\bCAE" + H + "N[°º]?" + H + ":?" + H + "(\\d{14})\\b",
                "\\bC\\.?A\\.?E\\.?" + H + "(?:N[°º]|Nro\\.?)?" + H + ":?" + H + "(\\d[\\d \\t\\-]{12,20}\\d)",
                "C[óo]digo\\s+de\\s+Autorizaci[óo]n\\s+Electr[óo]nica" + H + ":?" + H + "(\\d[\\d \\t\\-]{12,20}\\d)",
                "\\b(\\d{14})\\b");
        b.field(F, "cae_due_date", FieldKind.DATE).patterns(
                "Fecha\\s+de\\s+Vto\\.?\\s+de\\s+CAE" + H + ":?" + H + DATE,
                "Vencimiento\\s+(?:del\\s+)?CAE" + H + ":?" + H + DATE);

        // ---- Recibo ----
        DocumentType R = DocumentType.RECEIPT;
        b.field(R, "receipt_number", FieldKind.DOC_NUMBER).required().patterns(
                "Recibo" + H + "(?:N[°º]|Nro\\.?)" + H + ":?" + H + "([\\d\\-]{1,20})",
                "\\bN[°º]" + H + ":?" + H + "([\\d\\-]{1,20})");
        b.field(R, "issue_date", FieldKind.DATE).patterns(
                "\\bFecha" + H + ":?" + H + DATE);
        b.field(R, "issuer_name", FieldKind.NAME).keywords(COMPANY_KEYWORDS).patterns(
                "Raz[óo]n\\s+Social" + H + ":" + H + LINE,
                "Emisor" + H + ":" + H + LINE);
        b.field(R, "cuit_issuer", FieldKind.CUIT).critical().ordinal(0).patterns(
                CUIT_LABEL, CUIT_DASHED, CUIT_DOTTED, CUIT_PLAIN);
        b.field(R, "payer_name", FieldKind.NAME).patterns(
                "Recib[íi]\\s+de" + H + ":?" + H + LINE,
                "Se[ñn]or(?:es)?" + H + ":?" + H + LINE);
        b.field(R, "total_amount", FieldKind.AMOUNT).required().critical().patterns(
                "\\bTotal" + H + ":?" + H + AMT,
                "la\\s+suma\\s+de\\s+pesos[^$\\d\\n]*" + AMT,
                "\\b(?:Importe|Monto|Suma)" + H + ":?" + H + AMT);
        b.field(R, "payment_method", FieldKind.TEXT).patterns(
                "(?:Forma|Medio)\\s+de\\s+pago" + H + ":" + H + LINE);

        // ---- DNI ----
        DocumentType D = DocumentType.DNI;
        b.field(D, "dni_number", FieldKind.DNI).required().patterns(
                "\\bD\\.?N\\.?I\\.?" + H + "(?:N[°º])?" + H + ":?" + H + DNI_NUM,
                "Documento" + H + ":?" + H + DNI_NUM,
                "\\b(\\d{2}\\.\\d{3}\\.\\d{3})\\b");
        b.field(D, "last_name", FieldKind.NAME).required().patterns(
                "Apellidos?(?:\\s*/\\s*Surname)?" + H + ":?" + H + LINE);
        b.field(D, "first_name", FieldKind.NAME).required().patterns(
                "Nombres?(?:\\s*/\\s*Name)?" + H + ":?" + H + LINE);
        b.field(D, "sex", FieldKind.CODE).patterns(
                "Sexo(?:\\s*/\\s*Sex)?" + H + ":?" + H + "([MFX])\\b");
        b.field(D, "nationality", FieldKind.TEXT).patterns(
                "Nacionalidad(?:\\s*/\\s*Nationality)?" + H + ":?" + H + LINE);
        b.field(D, "birth_date", FieldKind.DATE).patterns(
                "Fecha\\s+de\\s+nacimiento(?:\\s*/\\s*Date\\s+of\\s+birth)?" + H + ":?" + H + DATE);
        b.field(D, "issue_date", FieldKind.DATE).patterns(
                "Fecha\\s+de\\s+emisi[óo]n(?:\\s*/\\s*Date\\s+of\\s+issue)?" + H + ":?" + H + DATE);
        b.field(D, "expiry_date", FieldKind.DATE).patterns(
                "Fecha\\s+de\\s+vencimiento(?:\\s*/\\s*Date\\s+of\\s+expiry)?" + H + ":?" + H + DATE);

        // ---- Título / certificado académico ----
        DocumentType A = DocumentType.ACADEMIC_CERTIFICATE;
        b.field(A, "institution", FieldKind.NAME).required().keywords(INSTITUTION_KEYWORDS).patterns(
                "Instituci[óo]n" + H + ":" + H + LINE,
                "^" + H + "((?:Universidad|Instituto|Colegio|Escuela|Facultad)[^\\n]{3,100}?)" + H + "$");
        b.field(A, "student_name", FieldKind.NAME).required().patterns(
                "(?:Alumno|Alumna|Estudiante|Apellido\\s+y\\s+Nombre)" + H + ":" + H + LINE,
                "certifica\\s+que" + H + "(?:el|la)?" + H + "(?:Sr\\.?|Sra\\.?|se[ñn]or(?:a)?)?" + H + LINE);
        b.field(A, "student_dni", FieldKind.DNI).patterns(
                "\\bD\\.?N\\.?I\\.?" + H + "(?:N[°º])?" + H + ":?" + H + DNI_NUM);
        b.field(A, "degree", FieldKind.TEXT).patterns(
                "(?:t[íi]tulo|carrera|grado)\\s+de" + H + ":?" + H + LINE);
        b.field(A, "issue_date", FieldKind.DATE).patterns(
                "\\bFecha" + H + ":?" + H + DATE,
                ",\\s*(\\d{1,2}\\s+de\\s+\\p{L}+\\s+del?\\s+\\d{4})");
        b.field(A, "average_grade", FieldKind.DECIMAL).patterns(
                "Promedio(?:\\s+general)?" + H + ":?" + H + "(\\d{1,2}(?:[.,]\\d{1,2})?)");

        // ---- Formulario ----
        DocumentType M = DocumentType.FORM;
        b.field(M, "form_number", FieldKind.DOC_NUMBER).patterns(
                "Formulario" + H + "(?:N[°º]|Nro\\.?)?" + H + ":?" + H + "([\\d\\-]{1,20})");
        b.field(M, "applicant_name", FieldKind.NAME).patterns(
                "(?:Solicitante|Apellido\\s+y\\s+Nombre|Nombre)" + H + ":" + H + LINE);
        b.field(M, "cuit", FieldKind.CUIT).critical().ordinal(0).patterns(
                CUIT_LABEL, CUIT_DASHED, CUIT_DOTTED, CUIT_PLAIN);
        b.field(M, "dni_number", FieldKind.DNI).patterns(
                "\\bD\\.?N\\.?I\\.?" + H + ":?" + H + DNI_NUM);
        b.field(M, "issue_date", FieldKind.DATE).patterns(
                "\\bFecha" + H + ":?" + H + DATE);
        b.field(M, "total_amount", FieldKind.AMOUNT).critical().patterns(
                "\\b(?:Total|Importe|Monto)" + H + ":?" + H + AMT);

        // ---- Прочее ----
        DocumentType G = DocumentType.GENERIC;
        b.field(G, "cuit", FieldKind.CUIT).critical().ordinal(0).patterns(
                CUIT_LABEL, CUIT_DASHED, CUIT_DOTTED, CUIT_PLAIN);
        b.field(G, "issue_date", FieldKind.DATE).patterns(
                "\\bFecha" + H + ":?" + H + DATE);
        b.field(G, "total_amount", FieldKind.AMOUNT).critical().patterns(
                "\\b(?:Total|Importe)" + H + ":?" + H + AMT);
        b.field(G, "document_number", FieldKind.DOC_NUMBER).patterns(
                "(?:N[°º]|Nro\\.?|N[úu]mero)" + H + ":?" + H + "([\\d\\-]{1,20})");

        return b.build();
    }

    public static final class Builder {
        private final ChecksumValidators validators;
        private final Map<DocumentType, List<FieldSpec>> specs = new EnumMap<>(DocumentType.class);

        private Builder(ChecksumValidators validators) {
            this.validators = Objects.requireNonNull(validators, "validators");
        }

        public FieldDef field(DocumentType type, String name, FieldKind kind) {
            return new FieldDef(this, type, name, kind);
        }

        void register(DocumentType type, FieldSpec spec) {
            List<FieldSpec> list = specs.computeIfAbsent(type, t -> new ArrayList<>());
            for (FieldSpec s : list) {
                if (s.name().equals(spec.name())) {
                    throw new IllegalStateException("malformed pattern library: duplicate field "
                            + type + "." + spec.name());
                }
            }
            list.add(spec);
        }

        public FieldPatternLibrary build() {
            Map<DocumentType, List<FieldSpec>> frozen = new EnumMap<>(DocumentType.class);
            specs.forEach((t, l) -> frozen.put(t, List.copyOf(l)));
            return new FieldPatternLibrary(Collections.unmodifiableMap(frozen));
        }
    }

    /** Пошаговое описание одного поля; регистрация происходит в {@link #patterns}. */
    public static final class FieldDef {
        private final Builder owner;
        private final DocumentType type;
        private final String name;
        private final FieldKind kind;
        private boolean required;
        private boolean critical;
        private int ordinal = -1;
        private List<String> keywords = List.of();

        private FieldDef(Builder owner, DocumentType type, String name, FieldKind kind) {
            this.owner = owner;
            this.type = Objects.requireNonNull(type, "type");
            this.name = Objects.requireNonNull(name, "name");
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public FieldDef required() { this.required = true; return this; }
        public FieldDef critical() { this.critical = true; return this; }
        public FieldDef ordinal(int n) { this.ordinal = n; return this; }
        public FieldDef keywords(List<String> kw) { this.keywords = kw; return this; }

        public FieldSpec patterns(String... regexes) {
            if (name.isBlank()) throw new IllegalStateException("malformed pattern library: blank field name");
            if (regexes.length == 0) {
                throw new IllegalStateException("malformed pattern library: " + type + "." + name + " has no patterns");
            }
            if (critical && !kind.isRecoverable()) {
                throw new IllegalStateException("malformed pattern library: " + type + "." + name
                        + " is critical but " + kind + " is not recoverable");
            }
            List<Pattern> compiled = new ArrayList<>(regexes.length);
            for (String re : regexes) {
                Pattern p;
                try {
                    p = Pattern.compile(re, FLAGS);
                } catch (PatternSyntaxException e) {
                    throw new IllegalStateException("malformed pattern library: " + type + "." + name
                            + " bad regex: " + re, e);
                }
                if (p.matcher("").groupCount() < 1) {
                    throw new IllegalStateException("malformed pattern library: " + type + "." + name
                            + " pattern has no capture group: " + re);
                }
                compiled.add(p);
            }
            FieldShape shape = kind.shape(owner.validators);
            if (!keywords.isEmpty()) shape = shape.withKeywords(keywords);
            FieldSpec spec = new FieldSpec(name, kind, shape, compiled, required, critical, ordinal);
            owner.register(type, spec);
            return spec;
        }
    }
}
