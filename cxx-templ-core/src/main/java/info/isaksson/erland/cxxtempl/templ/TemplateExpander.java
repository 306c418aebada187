package info.isaksson.erland.cxxtempl.templ;

import info.isaksson.erland.cxxtempl.ast.Node;
import info.isaksson.erland.cxxtempl.ast.NodeKind;
import info.isaksson.erland.cxxtempl.diag.Diagnostics;
import info.isaksson.erland.cxxtempl.symtab.SymbolScope;
import info.isaksson.erland.cxxtempl.types.Identifiers;
import info.isaksson.erland.cxxtempl.types.Parm;
import info.isaksson.erland.cxxtempl.types.ParmList;
import info.isaksson.erland.cxxtempl.types.Placeholders;
import info.isaksson.erland.cxxtempl.types.TypeString;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Turns a private copy of a template definition into its instantiation, in place.
 *
 * <p>One traversal collects the string attributes to rewrite into three worklists: identifier
 * targets (names that already carry template arguments), type targets (encoded types and
 * declarators) and code targets (opaque code text). Parameter packs in parameter lists and base
 * lists are expanded during the traversal. The formal parameters are then substituted one by one
 * across the worklists, the template's own name is replaced by the instantiated name, base classes
 * are qualified and function declarators normalized.</p>
 *
 * <p>An instance handles one call to {@link #expand}; it is not reusable.</p>
 */
public final class TemplateExpander {

    private final Diagnostics diagnostics;
    private final boolean fillNestedDefaults;

    private final List<TextSlot> identifierTargets = new ArrayList<>();
    private final List<TextSlot> typeTargets = new ArrayList<>();
    private final List<TextSlot> codeTargets = new ArrayList<>();

    private Node root;
    private String tname;
    private String templateArgs;
    private String rname;
    private Parm pack;
    private ParmList packArgs;

    public TemplateExpander(Diagnostics diagnostics, boolean fillNestedDefaults) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        this.fillNestedDefaults = fillNestedDefaults;
    }

    /**
     * Instantiate {@code definition} with {@code arguments}.
     *
     * @param definition unshared copy of the chosen definition, mutated in place
     * @param arguments  canonical arguments, defaults included; they also form the instantiated name
     * @param symName    external name of the instantiation, or null
     * @param scope      scope of the template, used for lookups, reduction and qualification
     * @throws TemplateConsistencyException on an internal inconsistency; the definition is then unusable
     */
    public void expand(Node definition, ParmList arguments, String symName, SymbolScope scope) {
        if (root != null) throw new IllegalStateException("TemplateExpander instances are single-use");
        this.root = Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        ParmList args = arguments == null ? new ParmList() : arguments;

        tname = TypeString.templatePrefix(root.name);
        String tbase = TypeString.scopeLast(tname);
        String templateSymName = root.symName != null ? root.symName : tbase;
        templateArgs = args.templateArgs();
        rname = symName;
        String iname = tname + templateArgs;
        SymbolScope tsdecl = Objects.requireNonNullElse(root.scope, scope);

        ParmList formals = root.templateParms == null ? new ParmList() : root.templateParms;
        ParmList actuals = root.partialArgs != null ? deduce(args, root.partialArgs, formals) : args.copy();
        pack = formals.variadicParm();
        packArgs = pack == null ? null : actuals.copyFrom(formals.size() - 1);

        diagnostics.trace("Template debug: Expanding '%s' as '%s'", root.name, iname);
        traverse(root);

        if (pack != null) spliceRemainingPacks();

        boolean baseRenamed = false;
        if (!formals.isEmpty() && !actuals.isEmpty()) {
            for (int i = 0; i < formals.size(); i++) {
                Parm tp = formals.get(i);
                Parm p = i < actuals.size() ? actuals.get(i) : tp;
                if (tp.isVariadic() || tp.name == null || (p == tp && tp.value == null)) continue;
                String value = p.valueOrType();
                if (value == null) continue;

                String dvalue = tsdecl.qualify(tsdecl.typedefReduce(value));
                if (fillNestedDefaults && TypeString.isTemplate(dvalue)) dvalue = TemplateDefaults.fill(dvalue, scope);
                String valuestr = TypeString.str(dvalue);
                diagnostics.trace("Template debug: Substituting '%s' -> '%s'", tp.name, dvalue);

                for (int j = i + 1; j < actuals.size(); j++) {
                    Parm rp = actuals.get(j);
                    if (rp.value != null) rp.value = TypeString.typenameReplace(rp.value, tp.name, dvalue);
                }
                for (TextSlot s : identifierTargets) {
                    s.set(TypeString.typenameReplace(s.get(), tp.name, dvalue));
                }
                for (TextSlot s : typeTargets) {
                    String before = s.get();
                    boolean guarded = refersToOtherSymbol(before, tsdecl, templateSymName);
                    String after = TypeString.typenameReplace(before, tp.name, dvalue);
                    if (!guarded) after = TypeString.typenameReplace(after, tbase, iname);
                    s.set(after);
                }
                baseRenamed = true;
                String stringized = "\"" + valuestr + "\"";
                String renderedName = TypeString.str(iname);
                for (TextSlot s : codeTargets) {
                    String c = Identifiers.replace(s.get(), "#" + tp.name, stringized);
                    c = Identifiers.replace(c, tp.name, valuestr);
                    s.set(Identifiers.replaceUntemplated(c, tbase, renderedName));
                }
            }
        }
        // A lone pack formal never reaches the loop body above.
        if (!baseRenamed) {
            for (TextSlot s : typeTargets) {
                if (!refersToOtherSymbol(s.get(), tsdecl, templateSymName)) {
                    s.set(TypeString.typenameReplace(s.get(), tbase, iname));
                }
            }
        }

        root.name = iname;
        root.kind = root.effectiveKind();
        root.templateKind = null;
        root.templateParms = null;
        root.partialArgs = null;
        root.partials.clear();
        root.instantiate = false;
        root.symName = symName;

        qualifyAll(root.baseList, scope);
        qualifyAll(root.protectedBaseList, scope);
        qualifyAll(root.privateBaseList, scope);

        DeclaratorNormalizer.normalize(root);
    }

    /**
     * Arguments of a partial specialization's own formals: the literal part of each pattern entry is
     * stripped from the actual, and the rest is bound to the formal its placeholder names.
     */
    static ParmList deduce(ParmList args, ParmList pattern, ParmList formals) {
        if (pattern.size() != args.size()) {
            throw new TemplateConsistencyException(String.format(
                    "Partial specialization pattern has %d arguments but %d were supplied.", pattern.size(), args.size()));
        }
        Parm[] bound = new Parm[formals.size()];
        for (int j = 0; j < pattern.size(); j++) {
            String pat = pattern.get(j).valueOrType();
            int k = Placeholders.firstIndex(pat);
            if (k < 1 || k > bound.length || bound[k - 1] != null) continue;
            Parm a = args.get(j);
            String d = Placeholders.deduce(a.valueOrType(), pat);
            Parm b = a.value != null ? Parm.ofValue(d) : Parm.ofType(d);
            b.name = formals.get(k - 1).name;
            bound[k - 1] = b;
        }
        ParmList out = new ParmList();
        for (int i = 0; i < bound.length; i++) out.add(bound[i] != null ? bound[i] : formals.get(i).copy());
        return out;
    }

    // ------------------------------------------------------------------ traversal

    private void traverse(Node n) {
        if (n == null || n.error) return;
        switch (n.effectiveKind()) {
            case CDECL -> {
                type(() -> n.type, v -> n.type = v);
                type(() -> n.decl, v -> n.decl = v);
                identifier(() -> n.value, v -> n.value = v);
                code(() -> n.code, v -> n.code = v);
                if (n.conversionOperator) {
                    code(() -> n.name, v -> n.name = v);
                    code(() -> n.symName, v -> n.symName = v);
                }
                if ("friend".equals(n.storage)) {
                    if (n.symName != null) n.symName = TypeString.templatePrefix(n.symName);
                    type(() -> n.name, v -> n.name = v);
                }
                parms(n.parms, false);
                parms(n.throwsList, false);
            }
            case CLASS -> {
                bases(n.baseList);
                bases(n.protectedBaseList);
                bases(n.privateBaseList);
                for (Node c : n.children()) traverse(c);
            }
            case CONSTRUCTOR -> {
                if (n.templateKind == null) renameConstructor(n);
                code(() -> n.code, v -> n.code = v);
                type(() -> n.decl, v -> n.decl = v);
                parms(n.parms, false);
                parms(n.throwsList, false);
            }
            case DESTRUCTOR -> {
                Node parent = n.parent();
                boolean own = parent == root
                        || (parent != null && parent.kind == NodeKind.EXTEND && parent.parent() == root);
                if (own) renameDestructor(n);
                code(() -> n.code, v -> n.code = v);
            }
            case USING -> {
                if (n.usingName != null && n.usingName.indexOf('<') >= 0) {
                    identifier(() -> n.usingName, v -> n.usingName = v);
                }
            }
            default -> {
                code(() -> n.code, v -> n.code = v);
                type(() -> n.type, v -> n.type = v);
                type(() -> n.decl, v -> n.decl = v);
                parms(n.parms, false);
                parms(n.kwargs, false);
                parms(n.pattern, true);
                parms(n.throwsList, false);
                for (Node c : n.children()) traverse(c);
            }
        }
    }

    private void renameConstructor(Node n) {
        if (n.name != null) {
            String stripped = TypeString.templatePrefix(n.name);
            if (!stripped.isEmpty() && tname.contains(stripped)) n.name = Identifiers.replace(n.name, stripped, tname);
        }
        if (n.symName != null) {
            String stripped = TypeString.templatePrefix(n.symName);
            if (!stripped.isEmpty() && tname.contains(stripped)) n.symName = Identifiers.replace(n.symName, stripped, tname);
        }
        if (n.name != null) {
            if (n.name.indexOf('<') >= 0) identifier(() -> n.name, v -> n.name = v);
            else n.name = n.name + templateArgs;
        }
        if (n.symName != null && rname != null) {
            n.symName = n.symName.indexOf('<') >= 0 ? rname : Identifiers.replace(n.symName, tname, rname);
        }
    }

    private void renameDestructor(Node n) {
        if (n.name != null) {
            if (n.name.indexOf('<') >= 0) identifier(() -> n.name, v -> n.name = v);
            else n.name = n.name + templateArgs;
        }
        if (n.symName != null && rname != null) {
            if (n.symName.indexOf('<') >= 0) n.symName = (n.symName.startsWith("~") ? "~" : "") + rname;
            else n.symName = Identifiers.replace(n.symName, tname, rname);
        }
    }

    private void parms(ParmList list, boolean pattern) {
        if (list == null) return;
        expandPack(list);
        for (Parm p : list) {
            type(() -> p.type, v -> p.type = v);
            if (pattern) type(() -> p.name, v -> p.name = v);
            code(() -> p.value, v -> p.value = v);
        }
    }

    /** Replace a trailing pack expansion of the template's pack by one parameter per pack argument. */
    private void expandPack(ParmList list) {
        if (pack == null) return;
        Parm v = list.variadicParm();
        if (v == null || !TypeString.mentions(v.type, pack.name)) return;
        ParmList expanded = new ParmList();
        for (String t : TypeString.expandPack(v.type, pack.name, packArgs)) expanded.add(new Parm(null, t, null));
        list.replaceLast(expanded);
    }

    private void bases(List<String> bases) {
        for (int i = 0; i < bases.size(); i++) {
            String b = bases.get(i);
            if (!TypeString.isVariadic(b)) {
                typeTargets.add(TextSlot.element(bases, i));
                continue;
            }
            if (i != bases.size() - 1) {
                throw new TemplateConsistencyException("Variadic base class '" + b + "' is not the last base class.");
            }
            bases.remove(i);
            if (pack != null && TypeString.mentions(b, pack.name)) {
                bases.addAll(TypeString.expandPack(b, pack.name, packArgs));
            } else {
                bases.add(b);
            }
            for (int j = i; j < bases.size(); j++) typeTargets.add(TextSlot.element(bases, j));
            return;
        }
    }

    /** Pack expansions inside function parameters and template arguments of type targets. */
    private void spliceRemainingPacks() {
        for (TextSlot s : typeTargets) {
            String t = TypeString.variadicReplace(s.get(), pack.name, packArgs);
            if (TypeString.isVariadic(t) && TypeString.mentions(t, pack.name)) {
                throw new TemplateConsistencyException("Unexpanded parameter pack '" + pack.name + "' in '" + t + "'.");
            }
            s.set(t);
        }
    }

    private boolean refersToOtherSymbol(String s, SymbolScope scope, String templateSymName) {
        Node ty = scope.lookup(s);
        return ty != null && ty != root && templateSymName.equals(ty.symName)
                && !ty.isTemplate() && ty.templateKind == null;
    }

    private static void qualifyAll(List<String> bases, SymbolScope scope) {
        for (int i = 0; i < bases.size(); i++) bases.set(i, scope.qualify(bases.get(i)));
    }

    private void identifier(Supplier<String> get, Consumer<String> set) {
        if (get.get() != null) identifierTargets.add(TextSlot.of(get, set));
    }

    private void type(Supplier<String> get, Consumer<String> set) {
        if (get.get() != null) typeTargets.add(TextSlot.of(get, set));
    }

    private void code(Supplier<String> get, Consumer<String> set) {
        if (get.get() != null) codeTargets.add(TextSlot.of(get, set));
    }
}
