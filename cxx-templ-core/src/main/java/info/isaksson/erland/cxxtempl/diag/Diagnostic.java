package info.isaksson.erland.cxxtempl.diag;

import java.util.Objects;

/** One message reported while resolving or instantiating a template. */
public final class Diagnostic {

    public final Severity severity;

    /** Null for debug traces. */
    public final TemplateErrorKind kind;

    /** Source file of the declaration or instantiation site; may be null. */
    public final String file;
    public final int line;

    public final String message;

    public Diagnostic(Severity severity, TemplateErrorKind kind, String file, int line, String message) {
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.kind = kind;
        this.file = file;
        this.line = line;
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    /** Stable code of {@link #kind}, or null for traces. */
    public String code() {
        return kind == null ? null : kind.code;
    }

    @Override
    public String toString() {
        String where = file == null ? "" : file + ":" + line + ": ";
        String label = switch (severity) {
            case ERROR -> "Error";
            case WARNING -> "Warning";
            case DEBUG -> "Debug";
        };
        return where + label + ": " + message;
    }
}
