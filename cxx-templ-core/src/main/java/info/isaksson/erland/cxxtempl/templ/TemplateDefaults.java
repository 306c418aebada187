package info.isaksson.erland.cxxtempl.templ;

import info.isaksson.erland.cxxtempl.ast.Node;
import info.isaksson.erland.cxxtempl.ast.NodeKind;
import info.isaksson.erland.cxxtempl.symtab.SymbolScope;
import info.isaksson.erland.cxxtempl.types.Parm;
import info.isaksson.erland.cxxtempl.types.ParmList;
import info.isaksson.erland.cxxtempl.types.TypeString;

/**
 * Fills missing trailing default arguments of template-ids from their primary template, through
 * nested arguments too: {@code vector<int>} becomes {@code vector<int,allocator<int>>}.
 */
public final class TemplateDefaults {

    private static final int MAX_DEPTH = 32;

    private TemplateDefaults() {}

    public static String fill(String type, SymbolScope scope) {
        return fill(type, scope, 0);
    }

    private static String fill(String t, SymbolScope scope, int depth) {
        if (t == null || scope == null || depth > MAX_DEPTH) return t;
        String base = TypeString.base(t);
        if (!TypeString.isTemplate(base)) return t;

        String name = TypeString.templatePrefix(base);
        ParmList args = new ParmList();
        for (String a : TypeString.templateArguments(base)) args.add(Parm.ofType(fill(a, scope, depth + 1)));

        Node primary = scope.lookup(name);
        if (primary != null && primary.isTemplate() && primary.templateKind == NodeKind.CLASS
                && primary.templateParms != null && args.size() < primary.templateParms.size()) {
            ParameterListExpander.Expansion e = ParameterListExpander.expand(args, primary.templateParms, true);
            ParmList filled = new ParmList();
            for (Parm p : e.parms()) {
                if (!p.defaultDerived) {
                    filled.add(p);
                } else if (p.value != null) {
                    filled.add(Parm.ofType(fill(p.value, scope, depth + 1)));
                } else {
                    break;
                }
            }
            args = filled;
        }
        return TypeString.prefix(t) + name + args.templateArgs() + TypeString.templateSuffix(base);
    }
}
