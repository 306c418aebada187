package info.isaksson.erland.cxxtempl.types;

/**
 * One formal or actual parameter.
 *
 * <p>Template formals use {@link #name} plus {@link #type} ({@code typename}, {@code class} or the
 * type of a non-type parameter) and keep their default in {@link #value}. Actual template arguments
 * carry either a {@link #type} or a {@link #value} and no name until they are merged with the formals.</p>
 */
public final class Parm {
    public String name;
    public String type;
    public String value;
    /** Set on parameters appended from a formal default rather than supplied by the caller. */
    public boolean defaultDerived;

    public String file;
    public int line;

    public Parm(String name, String type, String value) {
        this.name = name;
        this.type = type;
        this.value = value;
    }

    /** Formal parameter, e.g. {@code formal("T", "typename")}. */
    public static Parm formal(String name, String type) {
        return new Parm(name, type, null);
    }

    /** Formal parameter with a default, e.g. {@code formal("N", "int", "5")}. */
    public static Parm formal(String name, String type, String defaultValue) {
        return new Parm(name, type, defaultValue);
    }

    /** Actual type argument. */
    public static Parm ofType(String type) {
        return new Parm(null, type, null);
    }

    /** Actual non-type argument. */
    public static Parm ofValue(String value) {
        return new Parm(null, null, value);
    }

    /** The value when present, otherwise the type. */
    public String valueOrType() {
        return value != null ? value : type;
    }

    public boolean isVariadic() {
        return TypeString.isVariadic(type);
    }

    public Parm copy() {
        Parm p = new Parm(name, type, value);
        p.defaultDerived = defaultDerived;
        p.file = file;
        p.line = line;
        return p;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (type != null) sb.append(TypeString.str(type, name));
        else if (name != null) sb.append(name);
        if (value != null) {
            if (sb.length() > 0) sb.append('=');
            sb.append(value);
        }
        return sb.toString();
    }
}
