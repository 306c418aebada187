package info.isaksson.erland.cxxtempl.types;

/**
 * Prefix operators of an encoded type string.
 *
 * <p>Every operator element ends with a dot: {@code p.}, {@code r.}, {@code z.}, {@code v.} stand alone,
 * while {@code q(..).}, {@code a(..).}, {@code f(..).} and {@code m(..).} carry a parenthesized argument.</p>
 */
public enum TypeOperator {
    POINTER('p', false),
    REFERENCE('r', false),
    RVALUE_REFERENCE('z', false),
    VARIADIC('v', false),
    QUALIFIER('q', true),
    ARRAY('a', true),
    FUNCTION('f', true),
    MEMBER_POINTER('m', true);

    public final char tag;
    public final boolean hasArgument;

    TypeOperator(char tag, boolean hasArgument) {
        this.tag = tag;
        this.hasArgument = hasArgument;
    }

    /** Operator of a single element (or of the first element of a type), or null for a base. */
    public static TypeOperator of(String element) {
        if (element == null || element.length() < 2) return null;
        char c = element.charAt(0);
        char next = element.charAt(1);
        for (TypeOperator op : values()) {
            if (op.tag != c) continue;
            if (op.hasArgument ? next == '(' : next == '.') return op;
        }
        return null;
    }
}
