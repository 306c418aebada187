package info.isaksson.erland.cxxtempl.ast;

import info.isaksson.erland.cxxtempl.symtab.SymbolScope;
import info.isaksson.erland.cxxtempl.types.ParmList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One declaration of the declaration tree.
 *
 * <p>Shared attributes live on every node; the kind-specific ones are simply left null where they
 * do not apply. Children are owned; {@link #parent()} is a back reference maintained by
 * {@link #addChild(Node)} and {@link #removeChild(Node)}. {@link #templateRef} and {@link #scope} are
 * non-owning references too and are shared by {@link #deepCopy()}.</p>
 */
public final class Node {

    public NodeKind kind;

    /** Underlying kind of a {@link NodeKind#TEMPLATE} node ({@code CLASS}, {@code CDECL}, ...). */
    public NodeKind templateKind;

    public String name;
    /** External (target-language) symbol name. */
    public String symName;
    public String type;
    /** Declarator operator chain, e.g. {@code f(int).p.}. */
    public String decl;
    public String value;
    public String code;
    public String storage;
    /** Name aliased by a {@code using} declaration. */
    public String usingName;
    public boolean conversionOperator;

    public String file;
    public int line;

    public boolean error;
    public String errorMessage;

    /** Set on function-template overloads selected for instantiation. */
    public boolean instantiate;

    public ParmList parms;
    public ParmList throwsList;
    public ParmList kwargs;
    public ParmList pattern;

    /** Formal template parameters. Empty for an explicit specialization. */
    public ParmList templateParms;
    /** Partial specializations attached to a primary template. */
    public final List<PartialSpecialization> partials = new ArrayList<>();
    /** Pattern arguments of a partial specialization definition, e.g. {@code p.$1}. */
    public ParmList partialArgs;

    /** Back link from an instantiated declaration to the template it came from. */
    public Node templateRef;
    /** Scope this node was inserted into. */
    public SymbolScope scope;

    public final List<String> baseList = new ArrayList<>();
    public final List<String> protectedBaseList = new ArrayList<>();
    public final List<String> privateBaseList = new ArrayList<>();

    private final List<Node> children = new ArrayList<>();
    private Node parent;

    public Node(NodeKind kind) {
        this.kind = kind;
    }

    public Node(NodeKind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    /** Kind used for traversal: the underlying kind for templates, the node kind otherwise. */
    public NodeKind effectiveKind() {
        return kind == NodeKind.TEMPLATE && templateKind != null ? templateKind : kind;
    }

    public boolean isTemplate() {
        return kind == NodeKind.TEMPLATE;
    }

    public Node parent() {
        return parent;
    }

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public Node addChild(Node child) {
        if (child == null) throw new IllegalArgumentException("child must not be null");
        if (child.parent != null) child.parent.removeChild(child);
        children.add(child);
        child.parent = this;
        return child;
    }

    public boolean removeChild(Node child) {
        boolean removed = children.remove(child);
        if (removed) child.parent = null;
        return removed;
    }

    /** First direct child with the given name, or null. */
    public Node child(String childName) {
        for (Node c : children) {
            if (childName.equals(c.name)) return c;
        }
        return null;
    }

    /** Direct children of the given kind, in order. */
    public List<Node> children(NodeKind childKind) {
        List<Node> out = new ArrayList<>();
        for (Node c : children) {
            if (c.kind == childKind) out.add(c);
        }
        return out;
    }

    public void markError(String message) {
        this.error = true;
        this.errorMessage = message;
    }

    /**
     * Unshared copy of this subtree. The copy has no parent; attribute lists and children are copied,
     * while {@link #templateRef}, {@link #scope} and the partial specializations are shared.
     */
    public Node deepCopy() {
        Node n = new Node(kind);
        n.templateKind = templateKind;
        n.name = name;
        n.symName = symName;
        n.type = type;
        n.decl = decl;
        n.value = value;
        n.code = code;
        n.storage = storage;
        n.usingName = usingName;
        n.conversionOperator = conversionOperator;
        n.file = file;
        n.line = line;
        n.error = error;
        n.errorMessage = errorMessage;
        n.instantiate = instantiate;
        n.parms = copy(parms);
        n.throwsList = copy(throwsList);
        n.kwargs = copy(kwargs);
        n.pattern = copy(pattern);
        n.templateParms = copy(templateParms);
        n.partials.addAll(partials);
        n.partialArgs = copy(partialArgs);
        n.templateRef = templateRef;
        n.scope = scope;
        n.baseList.addAll(baseList);
        n.protectedBaseList.addAll(protectedBaseList);
        n.privateBaseList.addAll(privateBaseList);
        for (Node c : children) n.addChild(c.deepCopy());
        return n;
    }

    private static ParmList copy(ParmList l) {
        return l == null ? null : l.copy();
    }

    @Override
    public String toString() {
        return kind.tag + " " + name;
    }
}
