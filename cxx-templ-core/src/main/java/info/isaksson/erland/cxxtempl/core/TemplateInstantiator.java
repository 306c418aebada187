package info.isaksson.erland.cxxtempl.core;

import info.isaksson.erland.cxxtempl.ast.Node;
import info.isaksson.erland.cxxtempl.diag.Diagnostics;
import info.isaksson.erland.cxxtempl.diag.TemplateErrorKind;
import info.isaksson.erland.cxxtempl.symtab.SymbolScope;
import info.isaksson.erland.cxxtempl.templ.Resolution;
import info.isaksson.erland.cxxtempl.templ.SpecializationResolver;
import info.isaksson.erland.cxxtempl.templ.TemplateConsistencyException;
import info.isaksson.erland.cxxtempl.templ.TemplateExpander;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for template instantiation.
 *
 * <p>Resolves the definition, expands an unshared copy of it and, on success only, links the result
 * into the symbol scope. Requests must be serialized by the caller: the scope is read during
 * resolution and written when publishing.</p>
 */
public final class TemplateInstantiator {

    private static final Logger log = LoggerFactory.getLogger(TemplateInstantiator.class);

    private final TemplateOptions options;

    public TemplateInstantiator() {
        this(new TemplateOptions());
    }

    public TemplateInstantiator(TemplateOptions options) {
        this.options = options == null ? new TemplateOptions() : options.copy();
    }

    public void setDebugTemplates(boolean debug) {
        options.debugTemplates = debug;
    }

    public boolean isDebugTemplates() {
        return options.debugTemplates;
    }

    public InstantiationResult instantiate(InstantiationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Diagnostics diagnostics = new Diagnostics(options.debugTemplates);

        Resolution resolution = new SpecializationResolver(diagnostics).resolve(
                request.templateName(), request.arguments(), request.symName(), request.scope(),
                request.file(), request.line());

        switch (resolution.outcome) {
            case FAILED:
                return new InstantiationResult(InstantiationResult.Status.FAILED, null, resolution.canonicalName,
                        resolution.errorKind, null, diagnostics.all());
            case NOTHING_TO_DO:
                return new InstantiationResult(InstantiationResult.Status.NOTHING_TO_DO, null, resolution.canonicalName,
                        resolution.errorKind, null, diagnostics.all());
            default:
                break;
        }

        List<Node> produced = new ArrayList<>();
        for (Node definition : resolution.definitions) {
            definition.instantiate = false;
            Node draft = definition.deepCopy();
            try {
                new TemplateExpander(diagnostics, options.fillNestedDefaults)
                        .expand(draft, resolution.arguments, request.symName(), resolution.templateScope);
            } catch (TemplateConsistencyException e) {
                draft.markError(e.getMessage());
                diagnostics.error(TemplateErrorKind.INTERNAL_CONSISTENCY, request.file(), request.line(),
                        "Template '%s' could not be instantiated: %s", resolution.canonicalName, e.getMessage());
                clearMarks(resolution.definitions);
                return new InstantiationResult(InstantiationResult.Status.FAILED, null, resolution.canonicalName,
                        TemplateErrorKind.INTERNAL_CONSISTENCY, draft, diagnostics.all());
            }
            draft.templateRef = definition;
            if (request.file() != null) {
                draft.file = request.file();
                draft.line = request.line();
            }
            produced.add(draft);
        }

        if (options.publishResults) publish(request, resolution, produced);
        log.debug("Instantiated '{}' ({} declaration(s))", resolution.canonicalName, produced.size());
        return new InstantiationResult(InstantiationResult.Status.INSTANTIATED, produced, resolution.canonicalName,
                null, null, diagnostics.all());
    }

    private static void publish(InstantiationRequest request, Resolution resolution, List<Node> produced) {
        SymbolScope target = resolution.templateScope;
        if (resolution.isFunctionTemplate()) {
            for (Node n : produced) target.insert(n.name, n);
            return;
        }
        Node node = produced.get(0);
        if (resolution.supersedes != null) target.replace(resolution.canonicalName, node);
        else target.insert(resolution.canonicalName, node);
        if (request.symName() != null && !request.symName().equals(resolution.canonicalName)) {
            request.scope().insert(request.symName(), node);
            // insert() rebinds the scope; keep the one the instantiation is keyed in
            node.scope = target;
        }
    }

    private static void clearMarks(List<Node> definitions) {
        for (Node d : definitions) d.instantiate = false;
    }
}
