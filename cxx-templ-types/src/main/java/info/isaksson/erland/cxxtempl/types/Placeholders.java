package info.isaksson.erland.cxxtempl.types;

/**
 * Placeholders {@code $k} inside partial-specialization patterns.
 *
 * <p>{@code k} is the 1-based index of the partial's own formal parameter, so the pattern
 * {@code p.$1} of {@code template<class T> class Box<T*>} binds {@code T}.</p>
 */
public final class Placeholders {

    private Placeholders() {}

    /** Number of placeholders in {@code s}. */
    public static int count(String s) {
        if (s == null) return 0;
        int n = 0;
        int i = next(s, 0);
        while (i >= 0) {
            n++;
            i = next(s, end(s, i));
        }
        return n;
    }

    /** Replace every placeholder by {@code replacement}. */
    public static String replaceAll(String s, String replacement) {
        if (s == null || replacement == null) return s;
        StringBuilder sb = new StringBuilder(s.length() + replacement.length());
        int from = 0;
        int i = next(s, 0);
        while (i >= 0) {
            sb.append(s, from, i).append(replacement);
            from = end(s, i);
            i = next(s, from);
        }
        return sb.append(s, from, s.length()).toString();
    }

    /** 1-based parameter index of the first placeholder, or -1 when there is none. */
    public static int firstIndex(String s) {
        if (s == null) return -1;
        int i = next(s, 0);
        if (i < 0) return -1;
        try {
            return Integer.parseInt(s.substring(i + 1, end(s, i)));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * The part of {@code actual} bound by the pattern's placeholder: the literal text in front of the
     * placeholder is stripped from the front of {@code actual}. {@code p.$1} against {@code p.int}
     * gives {@code int}. When the literal prefix does not match, {@code actual} is returned unchanged.
     */
    public static String deduce(String actual, String pattern) {
        if (actual == null || pattern == null) return actual;
        int i = next(pattern, 0);
        if (i < 0) return actual;
        String literal = pattern.substring(0, i);
        return actual.startsWith(literal) ? actual.substring(literal.length()) : actual;
    }

    /** Literal text of {@code pattern} with its single placeholder removed. */
    public static String stripped(String pattern) {
        return replaceAll(pattern, "");
    }

    private static int next(String s, int from) {
        for (int i = Math.max(0, from); i + 1 < s.length(); i++) {
            if (s.charAt(i) != '$' || !Character.isDigit(s.charAt(i + 1))) continue;
            if (i > 0 && Identifiers.isIdentifierChar(s.charAt(i - 1))) continue;
            return i;
        }
        return -1;
    }

    private static int end(String s, int start) {
        int j = start + 1;
        while (j < s.length() && Character.isDigit(s.charAt(j))) j++;
        return j;
    }
}
