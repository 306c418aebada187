package info.isaksson.erland.cxxtempl.diag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one instantiation call, in emission order, and mirrors them to the
 * log. Debug traces are dropped unless tracing was enabled when the collector was created.
 */
public final class Diagnostics {

    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    private final List<Diagnostic> entries = new ArrayList<>();
    private final boolean debug;

    public Diagnostics(boolean debug) {
        this.debug = debug;
    }

    public boolean isDebug() {
        return debug;
    }

    public void error(TemplateErrorKind kind, String file, int line, String format, Object... args) {
        Diagnostic d = new Diagnostic(Severity.ERROR, kind, file, line, String.format(format, args));
        entries.add(d);
        log.error("{}", d);
    }

    public void warning(TemplateErrorKind kind, String file, int line, String format, Object... args) {
        Diagnostic d = new Diagnostic(Severity.WARNING, kind, file, line, String.format(format, args));
        entries.add(d);
        log.warn("{}", d);
    }

    /** Report {@code kind} with its own severity. */
    public void report(TemplateErrorKind kind, String file, int line, String format, Object... args) {
        if (kind.severity == Severity.ERROR) error(kind, file, line, format, args);
        else warning(kind, file, line, format, args);
    }

    public void trace(String format, Object... args) {
        if (!debug) return;
        Diagnostic d = new Diagnostic(Severity.DEBUG, null, null, 0, String.format(format, args));
        entries.add(d);
        log.debug("{}", d.message);
    }

    public List<Diagnostic> all() {
        return Collections.unmodifiableList(entries);
    }

    public List<Diagnostic> errors() {
        return filter(Severity.ERROR);
    }

    public List<Diagnostic> warnings() {
        return filter(Severity.WARNING);
    }

    public List<Diagnostic> traces() {
        return filter(Severity.DEBUG);
    }

    public boolean hasErrors() {
        for (Diagnostic d : entries) {
            if (d.severity == Severity.ERROR) return true;
        }
        return false;
    }

    private List<Diagnostic> filter(Severity severity) {
        List<Diagnostic> out = new ArrayList<>();
        for (Diagnostic d : entries) {
            if (d.severity == severity) out.add(d);
        }
        return Collections.unmodifiableList(out);
    }
}
