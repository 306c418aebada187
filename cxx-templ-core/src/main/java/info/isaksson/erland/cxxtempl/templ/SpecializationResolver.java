package info.isaksson.erland.cxxtempl.templ;

import info.isaksson.erland.cxxtempl.ast.Node;
import info.isaksson.erland.cxxtempl.ast.NodeKind;
import info.isaksson.erland.cxxtempl.ast.PartialSpecialization;
import info.isaksson.erland.cxxtempl.diag.Diagnostics;
import info.isaksson.erland.cxxtempl.diag.TemplateErrorKind;
import info.isaksson.erland.cxxtempl.symtab.SymbolScope;
import info.isaksson.erland.cxxtempl.types.Parm;
import info.isaksson.erland.cxxtempl.types.ParmList;
import info.isaksson.erland.cxxtempl.types.TypeString;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Picks the definition to instantiate for a template name and argument list: an explicit
 * specialization, the best-matching partial specialization, or the primary template. Function
 * templates resolve to every overload whose parameter count fits.
 *
 * <p>Ranking of partial specializations is a longest-literal-prefix heuristic, not C++ partial
 * ordering. Ties are broken by declaration order with a warning.</p>
 */
public final class SpecializationResolver {

    private final Diagnostics diagnostics;

    public SpecializationResolver(Diagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
    }

    public Resolution resolve(String name, ParmList actuals, String symName, SymbolScope scope, String file, int line) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("template name must not be empty");
        Objects.requireNonNull(scope, "scope must not be null");
        ParmList args = actuals == null ? new ParmList() : actuals;

        diagnostics.trace("Template debug: Searching for template '%s<%s>'", name, args);
        Node primary = scope.lookup(name);
        if (primary == null) {
            diagnostics.error(TemplateErrorKind.UNDEFINED_TEMPLATE, file, line, "Template '%s' undefined.", name);
            return Resolution.failed(TemplateErrorKind.UNDEFINED_TEMPLATE, null);
        }
        if (!primary.isTemplate()) {
            diagnostics.error(TemplateErrorKind.NOT_A_TEMPLATE, file, line,
                    "'%s' is not defined as a template. (%s)", name, primary.kind.tag);
            return Resolution.failed(TemplateErrorKind.NOT_A_TEMPLATE, primary);
        }
        if (primary.templateKind != NodeKind.CLASS) {
            return resolveFunction(name, primary, args, scope, file, line);
        }
        return resolveClass(primary, args, symName, scope, file, line);
    }

    // ------------------------------------------------------------------ class templates

    private Resolution resolveClass(Node primary, ParmList actuals, String symName,
                                    SymbolScope scope, String file, int line) {
        SymbolScope tscope = Objects.requireNonNullElse(primary.scope, scope);
        ParmList formals = primary.templateParms == null ? new ParmList() : primary.templateParms;

        if (!checkArity(formals, actuals, file, line)) {
            return Resolution.failed(TemplateErrorKind.ARITY, primary);
        }

        ParameterListExpander.Expansion expansion = ParameterListExpander.expand(actuals, formals, true);
        ParmList canonical = canonicalize(expansion.parms(), scope);
        String key = TypeString.scopeLast(TypeString.templatePrefix(primary.name)) + canonical.templateArgs();

        Node found = lookupKey(tscope, key);
        if (found == null) {
            String reducedKey = tscope.typedefReduce(key);
            if (!reducedKey.equals(key)) found = lookupKey(tscope, reducedKey);
        }

        if (found != null) {
            if (found.templateRef != null) {
                if (symName == null) {
                    diagnostics.trace("Template debug: '%s' already instantiated", key);
                    return Resolution.nothingToDo(primary, null, key);
                }
                if (found.symName != null) {
                    diagnostics.warning(TemplateErrorKind.DUPLICATE_INSTANTIATION, file, line,
                            "Duplicate template instantiation of '%s' with name '%s' ignored,", TypeString.str(key), symName);
                    diagnostics.warning(TemplateErrorKind.DUPLICATE_INSTANTIATION, found.file, found.line,
                            "previous instantiation of '%s' with name '%s'.", TypeString.str(key), found.symName);
                    return Resolution.nothingToDo(primary, TemplateErrorKind.DUPLICATE_INSTANTIATION, key);
                }
                diagnostics.trace("Template debug: Superseding anonymous instantiation '%s'", key);
                return Resolution.resolved(primary, List.of(found.templateRef), null, found, tscope, canonical, key);
            }
            if (found.isTemplate()) {
                diagnostics.trace("Template debug: Explicit specialization found: '%s'", key);
                return Resolution.resolved(primary, List.of(found), null, null, tscope, canonical, key);
            }
            diagnostics.error(TemplateErrorKind.NOT_A_TEMPLATE, file, line,
                    "'%s' is not defined as a template. (%s)", TypeString.str(key), found.kind.tag);
            return Resolution.failed(TemplateErrorKind.NOT_A_TEMPLATE, primary);
        }

        PartialSpecialization partial = choosePartial(primary, canonical, tscope, key, file, line);
        if (partial != null) {
            diagnostics.trace("Template debug: Partial specialization found: '%s'", partial.displayName);
            return Resolution.resolved(primary, List.of(partial.definition), partial, null, tscope, canonical, key);
        }
        diagnostics.trace("Template debug: Chosen primary template: '%s'", primary.name);
        return Resolution.resolved(primary, List.of(primary), null, null, tscope, canonical, key);
    }

    /** Local entry under {@code key}, preferring an earlier instantiation over a specialization. */
    private static Node lookupKey(SymbolScope scope, String key) {
        Node first = scope.lookupLocal(key);
        if (first == null || first.templateRef != null) return first;
        for (Node n : scope.lookupOverloads(key)) {
            if (n.templateRef != null && n.scope == scope) return n;
        }
        return first;
    }

    private boolean checkArity(ParmList formals, ParmList actuals, String file, int line) {
        if (formals.isEmpty()) return true;
        boolean variadic = formals.variadicParm() != null;
        if (!variadic && actuals.size() > formals.size()) {
            diagnostics.error(TemplateErrorKind.ARITY, file, line,
                    "Too many template parameters. Maximum of %d.", formals.size());
            return false;
        }
        int required = formals.numRequired();
        // The pack only counts when no default stopped the count before it.
        if (variadic && required == formals.size()) required--;
        if (actuals.size() < required) {
            diagnostics.error(TemplateErrorKind.ARITY, file, line,
                    "Not enough template parameters specified. %d required.", required);
            return false;
        }
        return true;
    }

    /** Copy of {@code parms} with each value or type typedef-reduced and qualified as seen from {@code scope}. */
    static ParmList canonicalize(ParmList parms, SymbolScope scope) {
        ParmList out = parms.copy();
        for (Parm p : out) {
            if (p.value != null) p.value = scope.qualify(scope.typedefReduce(p.value));
            else if (p.type != null) p.type = scope.qualify(scope.typedefReduce(p.type));
        }
        return out;
    }

    private PartialSpecialization choosePartial(Node primary, ParmList args, SymbolScope scope,
                                                String key, String file, int line) {
        List<PartialSpecialization> candidates = new ArrayList<>();
        for (PartialSpecialization ps : primary.partials) {
            if (ps.pattern().size() == args.size()) candidates.add(ps);
        }
        if (candidates.isEmpty()) return null;

        PriorityMatrix matrix = new PriorityMatrix(candidates.size(), args.size());
        for (int r = 0; r < candidates.size(); r++) {
            ParmList pattern = candidates.get(r).pattern();
            for (int c = 0; c < args.size(); c++) {
                ParmMatcher.ParmMatch m = ParmMatcher.match(args.get(c).valueOrType(), pattern.get(c).valueOrType(), scope);
                matrix.set(r, c, m.priority());
                diagnostics.trace("Template debug: '%s' position %d: %s (%d)",
                        candidates.get(r).displayName, c + 1, m.kind(), m.priority());
            }
        }

        List<Integer> qualifying = matrix.qualifying();
        if (qualifying.isEmpty()) return null;
        if (qualifying.size() == 1) return candidates.get(qualifying.get(0));

        List<Integer> best = matrix.bestOf(qualifying);
        if (best.size() == 1) return candidates.get(best.get(0));

        List<Integer> pool = best.isEmpty() ? qualifying : best;
        PartialSpecialization chosen = candidates.get(pool.get(0));
        diagnostics.warning(TemplateErrorKind.AMBIGUOUS_PARTIAL, file, line,
                "Instantiation of template '%s' is ambiguous,", TypeString.str(key));
        diagnostics.warning(TemplateErrorKind.AMBIGUOUS_PARTIAL, chosen.definition.file, chosen.definition.line,
                "  instantiation '%s' used,", TypeString.str(chosen.displayName));
        for (int i = 1; i < pool.size(); i++) {
            PartialSpecialization ignored = candidates.get(pool.get(i));
            diagnostics.warning(TemplateErrorKind.AMBIGUOUS_PARTIAL, ignored.definition.file, ignored.definition.line,
                    "  instantiation '%s' ignored.", TypeString.str(ignored.displayName));
        }
        return chosen;
    }

    // ------------------------------------------------------------------ function templates

    private Resolution resolveFunction(String name, Node primary, ParmList actuals, SymbolScope scope,
                                       String file, int line) {
        SymbolScope tscope = Objects.requireNonNullElse(primary.scope, scope);
        List<Node> overloads = new ArrayList<>();
        for (Node n : scope.lookupOverloads(name)) {
            if (n.isTemplate() && n.templateKind != NodeKind.CLASS) overloads.add(n);
        }

        List<Node> matches = new ArrayList<>();
        for (Node n : overloads) {
            ParmList formals = n.templateParms == null ? new ParmList() : n.templateParms;
            if (formals.variadicParm() == null && formals.size() == actuals.size()) matches.add(n);
        }
        if (matches.isEmpty()) {
            for (Node n : overloads) {
                ParmList formals = n.templateParms == null ? new ParmList() : n.templateParms;
                if (formals.variadicParm() != null && actuals.size() >= formals.size() - 1) matches.add(n);
            }
        }
        if (matches.isEmpty()) {
            diagnostics.error(TemplateErrorKind.UNDEFINED_TEMPLATE, file, line, "Template '%s' undefined.", name);
            return Resolution.failed(TemplateErrorKind.UNDEFINED_TEMPLATE, primary);
        }
        for (Node n : matches) {
            n.instantiate = true;
            diagnostics.trace("Template debug: Function template overload matched: '%s'", n.name);
        }

        Node chosen = matches.get(0);
        ParameterListExpander.Expansion expansion = ParameterListExpander.expand(actuals, chosen.templateParms, false);
        ParmList canonical = canonicalize(expansion.parms(), scope);
        String key = TypeString.scopeLast(name) + canonical.templateArgs();
        return Resolution.resolved(chosen, matches, null, null, tscope, canonical, key);
    }
}
