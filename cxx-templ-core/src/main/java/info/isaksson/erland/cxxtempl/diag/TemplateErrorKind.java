package info.isaksson.erland.cxxtempl.diag;

/**
 * Failure taxonomy of template resolution and instantiation.
 *
 * <p>Codes are stable across versions. Duplicate instantiations and ambiguous partial
 * specializations are soft: they warn and have a deterministic fallback.</p>
 */
public enum TemplateErrorKind {
    UNDEFINED_TEMPLATE("TEMPLATE_UNDEFINED", Severity.ERROR),
    NOT_A_TEMPLATE("TEMPLATE_NOT_A_TEMPLATE", Severity.ERROR),
    ARITY("TEMPLATE_ARITY", Severity.ERROR),
    DUPLICATE_INSTANTIATION("TEMPLATE_DUPLICATE", Severity.WARNING),
    AMBIGUOUS_PARTIAL("TEMPLATE_AMBIGUOUS", Severity.WARNING),
    INTERNAL_CONSISTENCY("TEMPLATE_INTERNAL", Severity.ERROR);

    public final String code;
    public final Severity severity;

    TemplateErrorKind(String code, Severity severity) {
        this.code = code;
        this.severity = severity;
    }
}
