package info.isaksson.erland.cxxtempl.templ;

import info.isaksson.erland.cxxtempl.types.Parm;
import info.isaksson.erland.cxxtempl.types.ParmList;
import info.isaksson.erland.cxxtempl.types.TypeString;

/**
 * Merges actual template arguments with the formal parameter list of a definition.
 *
 * <p>Each actual receives the name of its formal. Class templates also get copies of the trailing
 * formals the caller left out, marked {@link Parm#defaultDerived}; their defaults are rewritten in
 * terms of the earlier arguments so they no longer reference formal names.</p>
 */
public final class ParameterListExpander {

    private ParameterListExpander() {}

    public record Expansion(ParmList parms, boolean variadic) {}

    public static Expansion expand(ParmList actuals, ParmList formals, boolean classTemplate) {
        ParmList out = actuals == null ? new ParmList() : actuals.copy();
        ParmList f = formals == null ? new ParmList() : formals;
        for (int i = 0; i < out.size() && i < f.size(); i++) {
            Parm p = out.get(i);
            Parm tp = f.get(i);
            p.name = tp.name;
            if (p.type == null) p.type = tp.type;
        }
        boolean variadic = f.variadicParm() != null;
        if (classTemplate && !variadic && out.size() < f.size()) {
            int first = out.size();
            for (Parm tp : f.copyFrom(first)) {
                tp.defaultDerived = true;
                out.add(tp);
            }
            expandDefaults(out, first);
        }
        return new Expansion(out, variadic);
    }

    /** Substitute earlier parameter names into the defaults appended from {@code first} on. */
    static void expandDefaults(ParmList parms, int first) {
        for (int i = first; i < parms.size(); i++) {
            Parm p = parms.get(i);
            for (int j = 0; j < i; j++) {
                Parm earlier = parms.get(j);
                String replacement = earlier.valueOrType();
                if (earlier.name == null || replacement == null) continue;
                if (p.value != null) p.value = TypeString.typenameReplace(p.value, earlier.name, replacement);
                else if (p.type != null) p.type = TypeString.typenameReplace(p.type, earlier.name, replacement);
            }
        }
    }
}
