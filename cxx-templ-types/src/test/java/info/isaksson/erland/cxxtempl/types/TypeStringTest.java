package info.isaksson.erland.cxxtempl.types;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeStringTest {

    @Test
    void splitsOperatorsAndBase() {
        assertEquals(List.of("p.", "q(const).", "char"), TypeString.split("p.q(const).char"));
        assertEquals(List.of("f(int,p.char).", "void"), TypeString.split("f(int,p.char).void"));
        assertEquals("p.q(const).", TypeString.prefix("p.q(const).char"));
        assertEquals("char", TypeString.base("p.q(const).char"));
        assertEquals("q(const).", TypeString.last("p.q(const)."));
        assertEquals("", TypeString.base("f()."));
    }

    @Test
    void parenthesizedBaseIsNotAnOperator() {
        assertEquals(List.of("a(3)"), TypeString.split("a(3)"));
        assertFalse(TypeString.isArray("a(3)"));
        assertTrue(TypeString.isArray("a(3).int"));
    }

    @Test
    void classifiesOutermostOperator() {
        assertTrue(TypeString.isPointer("p.int"));
        assertTrue(TypeString.isReference("r.int"));
        assertTrue(TypeString.isReference("z.int"));
        assertTrue(TypeString.isQualifier("q(const).int"));
        assertTrue(TypeString.isFunction("f(int).int"));
        assertTrue(TypeString.isMemberPointer("m(Foo).int"));
        assertTrue(TypeString.isVariadic("v.r.T"));
        assertFalse(TypeString.isPointer("int"));
        assertEquals(List.of("int", "p.char"), TypeString.functionParms("f(int,p.char).void"));
    }

    @Test
    void templateIdHelpers() {
        assertTrue(TypeString.isTemplate("p.Box<int>"));
        assertFalse(TypeString.isTemplate("Box"));
        assertEquals("Box", TypeString.templatePrefix("Box<int>"));
        assertEquals(List.of("int", "Box<p.char>"), TypeString.templateArguments("Pair<int,Box<p.char>>"));
        assertEquals("::iterator", TypeString.templateSuffix("Box<int>::iterator"));
        assertEquals("Box<int,5>", TypeString.addTemplate("Box", ParmList.of(Parm.ofType("int"), Parm.ofValue("5"))));
        assertEquals(List.of("ns", "Box<a::b>"), TypeString.splitScope("ns::Box<a::b>"));
        assertEquals("Box", TypeString.scopeLast("ns::Box"));
    }

    @Test
    void rendersCDeclaratorSyntax() {
        assertEquals("char const *", TypeString.str("p.q(const).char"));
        assertEquals("int *const &", TypeString.str("r.q(const).p.int"));
        assertEquals("int *foo(int)", TypeString.str("f(int).p.int", "foo"));
        assertEquals("int (*)(int)", TypeString.str("p.f(int).int"));
        assertEquals("Box<int *>", TypeString.str("Box<p.int>"));
        assertEquals("int x[3]", TypeString.str("a(3).int", "x"));
        assertEquals("T &...", TypeString.str("v.r.T"));
        assertEquals("5", TypeString.str("5"));
    }

    @Test
    void typenameReplaceReachesNestedTypes() {
        assertEquals("p.int", TypeString.typenameReplace("p.T", "T", "int"));
        assertEquals("Box<p.int>", TypeString.typenameReplace("Box<T>", "T", "p.int"));
        assertEquals("f(r.q(const).int,int).p.int", TypeString.typenameReplace("f(r.q(const).T,int).p.T", "T", "int"));
        assertEquals("a(5).int", TypeString.typenameReplace("a(N).int", "N", "5"));
        assertEquals("m(Foo).int", TypeString.typenameReplace("m(T).int", "T", "Foo"));
        assertEquals("int::type", TypeString.typenameReplace("T::type", "T", "int"));
    }

    @Test
    void typenameReplaceMatchesWholeIdentifiersOnly() {
        assertEquals("T2", TypeString.typenameReplace("T2", "T", "int"));
        assertEquals("ns::T", TypeString.typenameReplace("ns::T", "T", "int"));
        assertEquals("p.MyT", TypeString.typenameReplace("p.MyT", "T", "int"));
    }

    @Test
    void templatedNameIsNotRenamedToAnotherTemplateId() {
        assertEquals("Box<int>", TypeString.typenameReplace("Box", "Box", "Box<int>"));
        assertEquals("Box<T>", TypeString.typenameReplace("Box<T>", "Box", "Box<int>"));
        assertEquals("Crate<int>", TypeString.typenameReplace("Box<int>", "Box", "Crate"));
    }

    @Test
    void expressionsGetTheRenderedValue() {
        assertEquals("5+1", TypeString.typenameReplace("N+1", "N", "5"));
        assertEquals("sizeof(int *)", TypeString.typenameReplace("sizeof(T)", "T", "p.int"));
        assertTrue(TypeString.isExpression("N+1"));
        assertFalse(TypeString.isExpression("ns::Foo<int>"));
    }

    @Test
    void mentionsAndDelVariadic() {
        assertTrue(TypeString.mentions("v.r.T", "T"));
        assertTrue(TypeString.mentions("Box<p.T>", "T"));
        assertFalse(TypeString.mentions("p.U", "T"));
        assertEquals("r.T", TypeString.delVariadic("v.r.T"));
        assertEquals("int", TypeString.delVariadic("int"));
    }

    @Test
    void splicesPackIntoFunctionParametersAndTemplateArguments() {
        ParmList pack = ParmList.ofTypes("int", "double");
        assertEquals("f(r.int,r.double).void", TypeString.variadicReplace("f(v.r.T).void", "T", pack));
        assertEquals("tuple<int,double>", TypeString.variadicReplace("tuple<v.T>", "T", pack));
        assertEquals("f(char,int,double).void", TypeString.variadicReplace("f(char,v.T).void", "T", pack));
        assertEquals("f().void", TypeString.variadicReplace("f(v.T).void", "T", new ParmList()));
        assertEquals("f(v.U).void", TypeString.variadicReplace("f(v.U).void", "T", pack));
        assertEquals(List.of("p.int", "p.double"), TypeString.expandPack("v.p.T", "T", pack));
    }
}
