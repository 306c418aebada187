package info.isaksson.erland.cxxtempl.core;

import info.isaksson.erland.cxxtempl.ast.Node;
import info.isaksson.erland.cxxtempl.diag.Diagnostic;
import info.isaksson.erland.cxxtempl.diag.TemplateErrorKind;

import java.util.List;

/** Result container of {@link TemplateInstantiator#instantiate(InstantiationRequest)}. */
public final class InstantiationResult {

    public enum Status {
        INSTANTIATED,
        NOTHING_TO_DO,
        FAILED
    }

    public final Status status;

    /** Instantiated declarations; one for a class template, one per matching overload for functions. */
    public final List<Node> nodes;

    /** Lookup key of the instantiation, e.g. {@code Box<int>}; null when resolution failed. */
    public final String canonicalName;

    /**
     * Why the request failed or was skipped. Null on success and for a silent no-op (an anonymous
     * request for something already instantiated).
     */
    public final TemplateErrorKind errorKind;

    /** On an internal failure during expansion: the unpublished draft, carrying the error marker. */
    public final Node draft;

    /** Everything reported during the call, in order. */
    public final List<Diagnostic> diagnostics;

    InstantiationResult(Status status, List<Node> nodes, String canonicalName, TemplateErrorKind errorKind,
                        Node draft, List<Diagnostic> diagnostics) {
        this.status = status;
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        this.canonicalName = canonicalName;
        this.errorKind = errorKind;
        this.draft = draft;
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public boolean isInstantiated() {
        return status == Status.INSTANTIATED;
    }

    /** The first instantiated declaration, or null. */
    public Node node() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }
}
