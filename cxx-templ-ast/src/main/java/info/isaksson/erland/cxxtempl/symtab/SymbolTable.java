package info.isaksson.erland.cxxtempl.symtab;

import info.isaksson.erland.cxxtempl.ast.Node;
import info.isaksson.erland.cxxtempl.types.TypeOperator;
import info.isaksson.erland.cxxtempl.types.TypeString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link SymbolScope}: a tree of named scopes, each holding overload chains of
 * declarations and typedef entries.
 */
public final class SymbolTable implements SymbolScope {

    private static final int MAX_TYPEDEF_DEPTH = 64;

    private final String name;
    private final SymbolTable parent;
    private final Map<String, List<Node>> symbols = new LinkedHashMap<>();
    private final Map<String, String> typedefs = new LinkedHashMap<>();
    private final Map<String, SymbolTable> scopes = new LinkedHashMap<>();

    /** A new global scope. */
    public SymbolTable() {
        this(null, null);
    }

    private SymbolTable(String name, SymbolTable parent) {
        this.name = name;
        this.parent = parent;
    }

    /** Nested scope {@code childName}, created on first use. */
    public SymbolTable childScope(String childName) {
        if (childName == null || childName.isEmpty()) throw new IllegalArgumentException("childName must not be empty");
        return scopes.computeIfAbsent(childName, n -> new SymbolTable(n, this));
    }

    public SymbolTable parent() {
        return parent;
    }

    public SymbolTable global() {
        SymbolTable s = this;
        while (s.parent != null) s = s.parent;
        return s;
    }

    public String name() {
        return name;
    }

    public void addTypedef(String alias, String type) {
        if (alias == null || type == null) throw new IllegalArgumentException("typedef alias and type must not be null");
        typedefs.put(alias, type);
    }

    /** Names declared directly in this scope, in insertion order. */
    public List<String> names() {
        return new ArrayList<>(symbols.keySet());
    }

    // ------------------------------------------------------------------ lookup

    @Override
    public Node lookupLocal(String n) {
        List<Node> chain = symbols.get(n);
        return chain == null || chain.isEmpty() ? null : chain.get(0);
    }

    @Override
    public Node lookup(String n) {
        if (n == null || n.isEmpty()) return null;
        if (n.startsWith("::")) return global().resolve(n.substring(2));
        for (SymbolTable s = this; s != null; s = s.parent) {
            Node found = s.resolve(n);
            if (found != null) return found;
        }
        return null;
    }

    @Override
    public List<Node> lookupOverloads(String n) {
        if (n == null || n.isEmpty()) return List.of();
        if (n.startsWith("::")) return global().resolveAll(n.substring(2));
        for (SymbolTable s = this; s != null; s = s.parent) {
            List<Node> found = s.resolveAll(n);
            if (!found.isEmpty()) return found;
        }
        return List.of();
    }

    private Node resolve(String n) {
        List<Node> all = resolveAll(n);
        return all.isEmpty() ? null : all.get(0);
    }

    private List<Node> resolveAll(String n) {
        List<String> segs = TypeString.splitScope(n);
        SymbolTable target = segs.size() == 1 ? this : scopePath(segs.subList(0, segs.size() - 1));
        if (target == null) return List.of();
        List<Node> chain = target.symbols.get(segs.get(segs.size() - 1));
        return chain == null ? List.of() : new ArrayList<>(chain);
    }

    private SymbolTable scopePath(List<String> segs) {
        SymbolTable cur = this;
        for (String seg : segs) {
            cur = cur.scopes.get(seg);
            if (cur == null) return null;
        }
        return cur;
    }

    /** Scope declaring the last component of {@code n} (symbol or typedef), searching outwards. */
    private SymbolTable declaringScope(String n) {
        boolean global = n.startsWith("::");
        List<String> segs = TypeString.splitScope(global ? n.substring(2) : n);
        String last = segs.get(segs.size() - 1);
        List<String> path = segs.subList(0, segs.size() - 1);
        for (SymbolTable s = global ? global() : this; s != null; s = global ? null : s.parent) {
            SymbolTable target = s.scopePath(path);
            if (target != null && (target.symbols.containsKey(last) || target.typedefs.containsKey(last))) return target;
        }
        return null;
    }

    private String typedefTarget(String n) {
        SymbolTable s = declaringScope(n);
        return s == null ? null : s.typedefs.get(TypeString.scopeLast(n));
    }

    // ------------------------------------------------------------------ type operations

    @Override
    public String typedefReduce(String type) {
        return reduce(type, 0);
    }

    private String reduce(String t, int depth) {
        if (t == null || t.isEmpty() || depth > MAX_TYPEDEF_DEPTH) return t;
        StringBuilder out = new StringBuilder();
        for (String e : TypeString.split(t)) {
            TypeOperator op = TypeString.operatorOf(e);
            if (op == TypeOperator.FUNCTION) {
                List<String> parms = new ArrayList<>();
                for (String p : TypeString.functionParms(e)) parms.add(reduce(p, depth));
                out.append("f(").append(String.join(",", parms)).append(").");
            } else if (op == TypeOperator.MEMBER_POINTER) {
                out.append("m(").append(reduce(TypeString.argument(e), depth)).append(").");
            } else if (op != null) {
                out.append(e);
            } else {
                out.append(reduceBase(e, depth));
            }
        }
        return out.toString();
    }

    private String reduceBase(String b, int depth) {
        String target = typedefTarget(b);
        if (target != null && !target.equals(b)) return reduce(target, depth + 1);
        if (!TypeString.isTemplate(b)) return b;
        List<String> args = new ArrayList<>();
        for (String a : TypeString.templateArguments(b)) args.add(reduce(a, depth));
        return TypeString.templatePrefix(b) + "<" + String.join(",", args) + ">" + TypeString.templateSuffix(b);
    }

    @Override
    public String qualify(String type) {
        if (type == null || type.isEmpty()) return type;
        StringBuilder out = new StringBuilder();
        for (String e : TypeString.split(type)) {
            TypeOperator op = TypeString.operatorOf(e);
            if (op == TypeOperator.FUNCTION) {
                List<String> parms = new ArrayList<>();
                for (String p : TypeString.functionParms(e)) parms.add(qualify(p));
                out.append("f(").append(String.join(",", parms)).append(").");
            } else if (op == TypeOperator.MEMBER_POINTER) {
                out.append("m(").append(qualify(TypeString.argument(e))).append(").");
            } else if (op != null) {
                out.append(e);
            } else {
                out.append(qualifyBase(e));
            }
        }
        return out.toString();
    }

    private String qualifyBase(String b) {
        if (TypeString.isExpression(b)) return b;
        String head = TypeString.templatePrefix(b);
        String rest = b.substring(head.length());
        if (TypeString.isTemplate(b)) {
            List<String> args = new ArrayList<>();
            for (String a : TypeString.templateArguments(b)) args.add(qualify(a));
            rest = "<" + String.join(",", args) + ">" + TypeString.templateSuffix(b);
        }
        if (head.startsWith("::")) return head + rest;
        SymbolTable declaring = declaringScope(head);
        if (declaring == null) return head + rest;
        String qn = declaring.qualifiedName();
        String last = TypeString.scopeLast(head);
        return (qn.isEmpty() ? last : qn + "::" + last) + rest;
    }

    // ------------------------------------------------------------------ mutation

    @Override
    public void insert(String n, Node node) {
        if (n == null || node == null) throw new IllegalArgumentException("name and node must not be null");
        symbols.computeIfAbsent(n, k -> new ArrayList<>()).add(node);
        node.scope = this;
    }

    @Override
    public void replace(String n, Node node) {
        if (n == null || node == null) throw new IllegalArgumentException("name and node must not be null");
        List<Node> chain = new ArrayList<>();
        chain.add(node);
        symbols.put(n, chain);
        node.scope = this;
    }

    @Override
    public String qualifiedName() {
        if (parent == null) return "";
        String outer = parent.qualifiedName();
        return outer.isEmpty() ? name : outer + "::" + name;
    }

    @Override
    public String toString() {
        String qn = qualifiedName();
        return qn.isEmpty() ? "<global>" : qn;
    }
}
