package info.isaksson.erland.cxxtempl.templ;

import info.isaksson.erland.cxxtempl.ast.Node;
import info.isaksson.erland.cxxtempl.ast.NodeKind;
import info.isaksson.erland.cxxtempl.ast.PartialSpecialization;
import info.isaksson.erland.cxxtempl.diag.TemplateErrorKind;
import info.isaksson.erland.cxxtempl.symtab.SymbolScope;
import info.isaksson.erland.cxxtempl.types.ParmList;

import java.util.List;

/** Outcome of locating the definition(s) to instantiate for one request. */
public final class Resolution {

    public enum Outcome {
        RESOLVED,
        NOTHING_TO_DO,
        FAILED
    }

    public final Outcome outcome;

    /** Set when the outcome is not {@code RESOLVED}, except for a silent no-op. */
    public final TemplateErrorKind errorKind;

    /** Primary template; null when lookup failed. */
    public final Node primary;

    /** Chosen definitions: one for class templates, every matching overload for function templates. */
    public final List<Node> definitions;

    /** The partial specialization chosen, if any. */
    public final PartialSpecialization partial;

    /** Anonymous earlier instantiation that the new one replaces. */
    public final Node supersedes;

    /** Scope the primary lives in; instantiations are keyed there. */
    public final SymbolScope templateScope;

    /** Argument list after default filling, typedef reduction and qualification. */
    public final ParmList arguments;

    /** Lookup key of the instantiation, e.g. {@code Box<int>}. */
    public final String canonicalName;

    private Resolution(Outcome outcome, TemplateErrorKind errorKind, Node primary, List<Node> definitions,
                       PartialSpecialization partial, Node supersedes, SymbolScope templateScope,
                       ParmList arguments, String canonicalName) {
        this.outcome = outcome;
        this.errorKind = errorKind;
        this.primary = primary;
        this.definitions = definitions == null ? List.of() : List.copyOf(definitions);
        this.partial = partial;
        this.supersedes = supersedes;
        this.templateScope = templateScope;
        this.arguments = arguments;
        this.canonicalName = canonicalName;
    }

    static Resolution resolved(Node primary, List<Node> definitions, PartialSpecialization partial, Node supersedes,
                               SymbolScope templateScope, ParmList arguments, String canonicalName) {
        return new Resolution(Outcome.RESOLVED, null, primary, definitions, partial, supersedes,
                templateScope, arguments, canonicalName);
    }

    static Resolution nothingToDo(Node primary, TemplateErrorKind reason, String canonicalName) {
        return new Resolution(Outcome.NOTHING_TO_DO, reason, primary, null, null, null,
                primary == null ? null : primary.scope, null, canonicalName);
    }

    static Resolution failed(TemplateErrorKind kind, Node primary) {
        return new Resolution(Outcome.FAILED, kind, primary, null, null, null,
                primary == null ? null : primary.scope, null, null);
    }

    public boolean isFunctionTemplate() {
        return primary != null && primary.templateKind != null && primary.templateKind != NodeKind.CLASS;
    }
}
