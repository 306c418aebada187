package info.isaksson.erland.cxxtempl.templ;

import info.isaksson.erland.cxxtempl.symtab.SymbolTable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ParmMatcherTest {

    @Test
    void filledPatternEqualToActualIsExact() {
        ParmMatcher.ParmMatch m = ParmMatcher.match("p.int", "p.$1", null);
        assertEquals(ParmMatcher.MatchKind.EXACT, m.kind());
        assertEquals(ParmMatcher.EXACT_PRIORITY, m.priority());

        assertEquals(ParmMatcher.MatchKind.EXACT, ParmMatcher.match("int", "$1", null).kind());
        assertEquals(ParmMatcher.MatchKind.EXACT, ParmMatcher.match("int", "int", null).kind());
    }

    @Test
    void literalPrefixGivesPartialMatchRankedByLength() {
        ParmMatcher.ParmMatch ref = ParmMatcher.match("r.q(const).p.int", "r.$1", null);
        ParmMatcher.ParmMatch constRef = ParmMatcher.match("r.q(const).p.int", "r.q(const).$1", null);

        assertEquals(ParmMatcher.MatchKind.PARTIAL, ref.kind());
        assertEquals(2, ref.priority());
        assertEquals(ParmMatcher.MatchKind.PARTIAL, constRef.kind());
        assertEquals(11, constRef.priority());
    }

    @Test
    void mismatchIsNone() {
        ParmMatcher.ParmMatch m = ParmMatcher.match("int", "p.$1", null);
        assertEquals(ParmMatcher.MatchKind.NONE, m.kind());
        assertFalse(m.matches());

        assertFalse(ParmMatcher.match("double", "int", null).matches());
        assertFalse(ParmMatcher.match(null, "$1", null).matches());
    }

    @Test
    void actualIsTypedefReducedFirst() {
        SymbolTable global = new SymbolTable();
        global.addTypedef("IntPtr", "p.int");

        assertEquals(ParmMatcher.MatchKind.EXACT, ParmMatcher.match("IntPtr", "p.$1", global).kind());
        assertFalse(ParmMatcher.match("IntPtr", "p.$1", null).matches());
    }
}
