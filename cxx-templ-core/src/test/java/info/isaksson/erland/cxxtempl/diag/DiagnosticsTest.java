package info.isaksson.erland.cxxtempl.diag;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DiagnosticsTest {

    @Test
    void tracesAreDroppedUnlessEnabled() {
        Diagnostics quiet = new Diagnostics(false);
        quiet.trace("Template debug: %s", "x");
        assertTrue(quiet.all().isEmpty());

        Diagnostics verbose = new Diagnostics(true);
        verbose.trace("Template debug: %s", "x");
        assertEquals(1, verbose.traces().size());
        assertEquals("Template debug: x", verbose.traces().get(0).message);
        assertNull(verbose.traces().get(0).code());
    }

    @Test
    void reportUsesTheSeverityOfTheKind() {
        Diagnostics d = new Diagnostics(false);
        d.report(TemplateErrorKind.DUPLICATE_INSTANTIATION, "a.i", 3, "dup");
        d.report(TemplateErrorKind.ARITY, "a.i", 4, "arity");

        assertEquals(1, d.warnings().size());
        assertEquals(1, d.errors().size());
        assertTrue(d.hasErrors());
        assertEquals("TEMPLATE_ARITY", d.errors().get(0).code());
    }

    @Test
    void keepsEmissionOrder() {
        Diagnostics d = new Diagnostics(true);
        d.warning(TemplateErrorKind.AMBIGUOUS_PARTIAL, null, 0, "first");
        d.trace("second");
        d.error(TemplateErrorKind.UNDEFINED_TEMPLATE, null, 0, "third");

        assertEquals(3, d.all().size());
        assertEquals("first", d.all().get(0).message);
        assertEquals("second", d.all().get(1).message);
        assertEquals("third", d.all().get(2).message);
        assertThrows(UnsupportedOperationException.class, () -> d.all().clear());
    }

    @Test
    void rendersLocationWhenKnown() {
        Diagnostic located = new Diagnostic(Severity.WARNING, TemplateErrorKind.DUPLICATE_INSTANTIATION,
                "demo.i", 3, "Duplicate template instantiation");
        assertEquals("demo.i:3: Warning: Duplicate template instantiation", located.toString());

        Diagnostic bare = new Diagnostic(Severity.ERROR, TemplateErrorKind.UNDEFINED_TEMPLATE, null, 0, "Template 'X' undefined.");
        assertEquals("Error: Template 'X' undefined.", bare.toString());
    }
}
