package info.isaksson.erland.cxxtempl.templ;

import info.isaksson.erland.cxxtempl.ast.Node;
import info.isaksson.erland.cxxtempl.ast.NodeKind;
import info.isaksson.erland.cxxtempl.types.TypeOperator;
import info.isaksson.erland.cxxtempl.types.TypeString;

import java.util.List;

/**
 * Moves declarator operators that substitution pushed into the type of a function declaration
 * back onto its declarator.
 *
 * <p>Instantiating {@code T f()} with {@code T = char const *} leaves type {@code p.q(const).char}
 * and declarator {@code f().}; the pointer belongs to the declarator, giving {@code f().p.} and
 * {@code q(const).char}. Qualifiers and arrays directly in front of the base stay with the type.</p>
 */
public final class DeclaratorNormalizer {

    private DeclaratorNormalizer() {}

    public static void normalize(Node n) {
        if (n == null || n.error) return;
        if (n.effectiveKind() == NodeKind.CDECL) {
            normalizeFunction(n);
            return;
        }
        for (Node c : n.children()) normalize(c);
    }

    private static void normalizeFunction(Node n) {
        if (n.decl == null || n.type == null || !TypeString.isFunction(n.decl)) return;
        List<String> prefix = TypeString.split(TypeString.prefix(n.type));
        int keep = prefix.size();
        while (keep > 0) {
            TypeOperator op = TypeString.operatorOf(prefix.get(keep - 1));
            if (op != TypeOperator.QUALIFIER && op != TypeOperator.ARRAY) break;
            keep--;
        }
        if (keep == 0) return;
        String moved = String.join("", prefix.subList(0, keep));
        n.decl = n.decl + moved;
        n.type = n.type.substring(moved.length());
    }
}
