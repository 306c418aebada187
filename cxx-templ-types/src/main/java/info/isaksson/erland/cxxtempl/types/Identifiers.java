package info.isaksson.erland.cxxtempl.types;

/**
 * Whole-identifier text substitution.
 *
 * <p>An occurrence of {@code id} only counts when it is not glued to other identifier characters:
 * replacing {@code T} in {@code T2 *t} leaves both {@code T2} and {@code t} alone. Identifier
 * characters are letters, digits, {@code _} and {@code $}, so {@code $1} placeholders are matched as
 * identifiers too. A boundary is only checked on a side of {@code id} that itself ends in an
 * identifier character, which lets tokens such as {@code #T} match.</p>
 */
public final class Identifiers {

    private Identifiers() {}

    public static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    /** Number of whole-identifier occurrences of {@code id} in {@code s}. */
    public static int count(String s, String id) {
        if (s == null || id == null || id.isEmpty()) return 0;
        int n = 0;
        int from = 0;
        while (true) {
            int idx = find(s, id, from, false);
            if (idx < 0) return n;
            n++;
            from = idx + id.length();
        }
    }

    public static boolean contains(String s, String id) {
        return find(s, id, 0, false) >= 0;
    }

    /** Replace every whole-identifier occurrence of {@code id} by {@code replacement}. */
    public static String replace(String s, String id, String replacement) {
        return replace(s, id, replacement, false);
    }

    /**
     * Like {@link #replace(String, String, String)} but skips occurrences already followed by a
     * template argument list, so {@code Box} is renamed while {@code Box<int>} is kept.
     */
    public static String replaceUntemplated(String s, String id, String replacement) {
        return replace(s, id, replacement, true);
    }

    private static String replace(String s, String id, String replacement, boolean skipTemplated) {
        if (s == null || id == null || id.isEmpty() || replacement == null) return s;
        int idx = find(s, id, 0, skipTemplated);
        if (idx < 0) return s;
        StringBuilder sb = new StringBuilder(s.length() + 16);
        int from = 0;
        while (idx >= 0) {
            sb.append(s, from, idx).append(replacement);
            from = idx + id.length();
            idx = find(s, id, from, skipTemplated);
        }
        sb.append(s, from, s.length());
        return sb.toString();
    }

    private static int find(String s, String id, int from, boolean skipTemplated) {
        if (s == null || id == null || id.isEmpty()) return -1;
        boolean checkBefore = isIdentifierChar(id.charAt(0));
        boolean checkAfter = isIdentifierChar(id.charAt(id.length() - 1));
        int idx = s.indexOf(id, from);
        while (idx >= 0) {
            int end = idx + id.length();
            boolean ok = true;
            if (checkBefore && idx > 0 && isIdentifierChar(s.charAt(idx - 1))) ok = false;
            if (ok && checkAfter && end < s.length() && isIdentifierChar(s.charAt(end))) ok = false;
            if (ok && skipTemplated && followedByTemplateArgs(s, end)) ok = false;
            if (ok) return idx;
            idx = s.indexOf(id, idx + 1);
        }
        return -1;
    }

    private static boolean followedByTemplateArgs(String s, int pos) {
        int i = pos;
        while (i < s.length() && s.charAt(i) == ' ') i++;
        return i < s.length() && s.charAt(i) == '<';
    }
}
