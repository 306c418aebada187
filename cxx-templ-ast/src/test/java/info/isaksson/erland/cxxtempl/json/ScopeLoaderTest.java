package info.isaksson.erland.cxxtempl.json;

import info.isaksson.erland.cxxtempl.ast.Node;
import info.isaksson.erland.cxxtempl.ast.NodeKind;
import info.isaksson.erland.cxxtempl.symtab.SymbolTable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeLoaderTest {

    @Test
    void loadsDeclarationsTypedefsAndNamespaces() throws Exception {
        SymbolTable global = ScopeLoader.load(NodeJsonTest.resource("json/unit.json"));

        Node box = global.lookup("Box");
        assertNotNull(box);
        assertEquals(NodeKind.TEMPLATE, box.kind);
        assertSame(global, box.scope);
        assertEquals(2, global.lookupOverloads("max").size());
        assertEquals("p.int", global.typedefReduce("IntPtr"));

        assertNotNull(global.lookup("geo::Point"));
        assertEquals("double", global.typedefReduce("geo::coord"));
        assertEquals("geo::Point", global.childScope("geo").qualify("Point"));
    }

    @Test
    void rejectsAnonymousTopLevelDeclarations() {
        String json = "{\"declarations\":[{\"kind\":\"class\"}]}";
        assertThrows(IllegalArgumentException.class, () -> ScopeLoader.loadFromString(json));
    }
}
