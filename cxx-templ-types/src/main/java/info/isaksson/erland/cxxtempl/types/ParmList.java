package info.isaksson.erland.cxxtempl.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, growable sequence of {@link Parm}s owned by one declaration.
 *
 * <p>Pack expansion is a slice replace ({@link #replaceLast(ParmList)}) rather than sibling splicing.</p>
 */
public final class ParmList implements Iterable<Parm> {

    private final List<Parm> parms = new ArrayList<>();

    public ParmList() {}

    public ParmList(List<Parm> parms) {
        if (parms != null) {
            for (Parm p : parms) {
                if (p != null) this.parms.add(p);
            }
        }
    }

    public static ParmList of(Parm... parms) {
        return new ParmList(List.of(parms));
    }

    /** Actual type arguments, e.g. {@code ofTypes("int", "p.char")}. */
    public static ParmList ofTypes(String... types) {
        ParmList out = new ParmList();
        for (String t : types) out.add(Parm.ofType(t));
        return out;
    }

    public int size() {
        return parms.size();
    }

    public boolean isEmpty() {
        return parms.isEmpty();
    }

    public Parm get(int index) {
        return parms.get(index);
    }

    /** The parameter at {@code index}, or null past the end. */
    public Parm nth(int index) {
        return index >= 0 && index < parms.size() ? parms.get(index) : null;
    }

    public ParmList add(Parm p) {
        if (p != null) parms.add(p);
        return this;
    }

    public ParmList addAll(ParmList other) {
        if (other != null) parms.addAll(other.parms);
        return this;
    }

    public List<Parm> asList() {
        return Collections.unmodifiableList(parms);
    }

    @Override
    public Iterator<Parm> iterator() {
        return asList().iterator();
    }

    /** Deep copy. */
    public ParmList copy() {
        ParmList out = new ParmList();
        for (Parm p : parms) out.parms.add(p.copy());
        return out;
    }

    /** Deep copy of the tail starting at {@code index}; empty when past the end. */
    public ParmList copyFrom(int index) {
        ParmList out = new ParmList();
        for (int i = Math.max(0, index); i < parms.size(); i++) out.parms.add(parms.get(i).copy());
        return out;
    }

    /** The trailing variadic parameter, or null. */
    public Parm variadicParm() {
        if (parms.isEmpty()) return null;
        Parm last = parms.get(parms.size() - 1);
        return last.isVariadic() ? last : null;
    }

    /** Parameters before the first one carrying a value (default); a {@code void} entry ends the count. */
    public int numRequired() {
        int i = 0;
        for (Parm p : parms) {
            if (p.value != null) return i;
            if ("void".equals(p.type)) break;
            i++;
        }
        return i;
    }

    /** Replace the last parameter with the given sequence (which may be empty). */
    public void replaceLast(ParmList replacement) {
        if (parms.isEmpty()) return;
        parms.remove(parms.size() - 1);
        if (replacement != null) parms.addAll(replacement.parms);
    }

    /** Template argument list in encoded form, e.g. {@code <int,p.char>}. */
    public String templateArgs() {
        StringBuilder sb = new StringBuilder("<");
        for (int i = 0; i < parms.size(); i++) {
            if (i > 0) sb.append(',');
            String v = parms.get(i).valueOrType();
            sb.append(v == null ? "" : v);
        }
        return sb.append('>').toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parms.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(parms.get(i));
        }
        return sb.toString();
    }
}
