package info.isaksson.erland.cxxtempl.symtab;

import info.isaksson.erland.cxxtempl.ast.Node;

import java.util.List;

/**
 * Name lookup, typedef reduction and qualification for one C++ scope.
 *
 * <p>The template engine reads scopes while resolving and writes to them only when publishing a
 * finished instantiation. Implementations need not be thread-safe; callers serialize requests.</p>
 */
public interface SymbolScope {

    /** Exact-name lookup in this scope only. */
    Node lookupLocal(String name);

    /**
     * Lookup through the enclosing scopes up to the global one. Qualified names resolve relative to
     * each enclosing scope in turn; a leading {@code ::} starts at the global scope.
     */
    Node lookup(String name);

    /** Every declaration sharing {@code name} in the nearest scope declaring it, in declaration order. */
    List<Node> lookupOverloads(String name);

    /** Resolve typedef chains in an encoded type. */
    String typedefReduce(String type);

    /** Prefix names in an encoded type with the scope that declares them. */
    String qualify(String type);

    void insert(String name, Node node);

    /** Replace every declaration under {@code name} with {@code node}. */
    void replace(String name, Node node);

    /** Fully qualified name of this scope; empty for the global scope. */
    String qualifiedName();
}
