package info.isaksson.erland.cxxtempl.templ;

import info.isaksson.erland.cxxtempl.ast.Node;
import info.isaksson.erland.cxxtempl.ast.NodeKind;
import info.isaksson.erland.cxxtempl.testutil.Decls;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DeclaratorNormalizerTest {

    @Test
    void movesPointerFromReturnTypeToDeclarator() {
        Node f = Decls.cdecl("name", "p.q(const).char", "f().");
        DeclaratorNormalizer.normalize(f);
        assertEquals("f().p.", f.decl);
        assertEquals("q(const).char", f.type);
    }

    @Test
    void isIdempotent() {
        Node f = Decls.cdecl("at", "r.p.char", "f(int).");
        DeclaratorNormalizer.normalize(f);
        DeclaratorNormalizer.normalize(f);
        assertEquals("f(int).r.p.", f.decl);
        assertEquals("char", f.type);
    }

    @Test
    void leavesVariablesAndPlainReturnTypesAlone() {
        Node var = Decls.cdecl("items", "p.int", "a(4).");
        Node plain = Decls.cdecl("size", "q(const).int", "f().");
        DeclaratorNormalizer.normalize(var);
        DeclaratorNormalizer.normalize(plain);

        assertEquals("a(4).", var.decl);
        assertEquals("p.int", var.type);
        assertEquals("f().", plain.decl);
        assertEquals("q(const).int", plain.type);
    }

    @Test
    void descendsIntoClasses() {
        Node cls = new Node(NodeKind.CLASS, "Box<p.int>");
        Node get = cls.addChild(Decls.cdecl("get", "p.int", "f()."));
        DeclaratorNormalizer.normalize(cls);
        assertEquals("f().p.", get.decl);
        assertEquals("int", get.type);
    }
}
