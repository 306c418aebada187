package info.isaksson.erland.cxxtempl.templ;

import info.isaksson.erland.cxxtempl.symtab.SymbolScope;
import info.isaksson.erland.cxxtempl.types.Placeholders;
import info.isaksson.erland.cxxtempl.types.TypeString;

/**
 * Matches one actual template argument against one entry of a partial-specialization pattern.
 *
 * <p>A position matches exactly when the pattern, with its placeholders filled in by the base of
 * the reduced actual, equals the reduced actual. Failing that, a pattern with exactly one
 * placeholder matches partially when its literal prefix is a prefix of the actual; the priority is
 * the length of that prefix, so more specific patterns rank higher.</p>
 */
public final class ParmMatcher {

    /** Priority of an exact match; larger than any operator-chain prefix. */
    public static final int EXACT_PRIORITY = 99999;

    public enum MatchKind {
        EXACT,
        PARTIAL,
        NONE
    }

    public record ParmMatch(MatchKind kind, int priority) {
        static final ParmMatch NONE = new ParmMatch(MatchKind.NONE, -1);

        public boolean matches() {
            return priority >= 0;
        }
    }

    private ParmMatcher() {}

    public static ParmMatch match(String actual, String pattern, SymbolScope scope) {
        if (actual == null || pattern == null) return ParmMatch.NONE;
        String reduced = scope == null ? actual : scope.typedefReduce(actual);
        String filled = Placeholders.replaceAll(pattern, TypeString.base(reduced));
        if (filled.equals(reduced)) return new ParmMatch(MatchKind.EXACT, EXACT_PRIORITY);
        if (Placeholders.count(pattern) != 1) return ParmMatch.NONE;
        String literal = Placeholders.stripped(pattern);
        if (reduced.startsWith(literal)) return new ParmMatch(MatchKind.PARTIAL, literal.length());
        return ParmMatch.NONE;
    }
}
