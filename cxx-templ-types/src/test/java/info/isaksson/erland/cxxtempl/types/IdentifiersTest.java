package info.isaksson.erland.cxxtempl.types;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IdentifiersTest {

    @Test
    void replacesWholeIdentifiersOnly() {
        assertEquals("T2 *t = int(0)", Identifiers.replace("T2 *t = T(0)", "T", "int"));
        assertEquals("my_T", Identifiers.replace("my_T", "T", "int"));
        assertFalse(Identifiers.contains("my_T", "T"));
        assertTrue(Identifiers.contains("a::T", "T"));
    }

    @Test
    void placeholdersAreIdentifiers() {
        assertEquals(1, Identifiers.count("$1 + $10", "$1"));
        assertEquals("int + $10", Identifiers.replace("$1 + $10", "$1", "int"));
    }

    @Test
    void stringizeTokenMatchesWithoutLeadingBoundary() {
        assertEquals("\"int\" + T", Identifiers.replace("#T + T", "#T", "\"int\""));
    }

    @Test
    void untemplatedReplaceSkipsNamesWithArguments() {
        assertEquals("Box<int>(); Box<int> b;", Identifiers.replaceUntemplated("Box(); Box<int> b;", "Box", "Box<int>"));
        assertEquals("Box <int>", Identifiers.replaceUntemplated("Box <int>", "Box", "X"));
    }

    @Test
    void nullAndEmptyAreTolerated() {
        assertNull(Identifiers.replace(null, "T", "int"));
        assertEquals("T", Identifiers.replace("T", "", "int"));
        assertEquals(0, Identifiers.count("T", null));
    }
}
