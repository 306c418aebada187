package info.isaksson.erland.cxxtempl.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.cxxtempl.ast.Node;
import info.isaksson.erland.cxxtempl.diag.Severity;
import info.isaksson.erland.cxxtempl.diag.TemplateErrorKind;
import info.isaksson.erland.cxxtempl.json.NodeJson;
import info.isaksson.erland.cxxtempl.json.ScopeLoader;
import info.isaksson.erland.cxxtempl.symtab.SymbolTable;
import info.isaksson.erland.cxxtempl.types.ParmList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

public class TemplateInstantiatorTest {

    private SymbolTable global;
    private TemplateInstantiator instantiator;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = resource("units/demo.json")) {
            global = ScopeLoader.load(in);
        }
        instantiator = new TemplateInstantiator();
    }

    private InstantiationResult instantiate(String name, String symName, String... args) {
        return instantiator.instantiate(InstantiationRequest.of(name, ParmList.ofTypes(args), symName, global));
    }

    @Test
    void instantiatedClassMatchesGolden() throws Exception {
        InstantiationResult result = instantiator.instantiate(
                InstantiationRequest.of("Box", ParmList.ofTypes("CharPtr"), "CharPtrBox", global).at("demo.i", 10));

        assertTrue(result.isInstantiated());
        assertEquals("Box<p.char,4>", result.canonicalName);
        assertTrue(result.diagnostics.isEmpty());

        JsonNode expected;
        try (InputStream in = resource("golden/box-charptr.json")) {
            expected = new ObjectMapper().readTree(in);
        }
        assertEquals(expected, NodeJson.toTree(result.node()));
    }

    @Test
    void resultIsPublishedUnderKeyAndName() {
        InstantiationResult result = instantiate("Box", "IntBox", "int");

        Node node = result.node();
        assertSame(node, global.lookupLocal("Box<int,4>"));
        assertSame(node, global.lookupLocal("IntBox"));
        assertSame(global, node.scope);
        assertSame(global.lookupLocal("Box"), node.templateRef);
        assertEquals("T", global.lookupLocal("Box").child("items").type);
    }

    @Test
    void instantiationIntoNamespaceKeepsTemplateScope() {
        SymbolTable geo = global.childScope("geo");
        InstantiationResult result = instantiator.instantiate(
                InstantiationRequest.of("Box", ParmList.ofTypes("Point"), "PointBox", geo));

        assertEquals("Box<geo::Point,4>", result.canonicalName);
        assertSame(result.node(), global.lookupLocal("Box<geo::Point,4>"));
        assertSame(result.node(), geo.lookupLocal("PointBox"));
        assertSame(global, result.node().scope);
        assertEquals("geo::Point", result.node().child("items").type);
    }

    @Test
    void secondNamedInstantiationIsADuplicate() {
        instantiate("Box", "IntBox", "int");
        InstantiationResult again = instantiate("Box", "OtherBox", "int");

        assertEquals(InstantiationResult.Status.NOTHING_TO_DO, again.status);
        assertEquals(TemplateErrorKind.DUPLICATE_INSTANTIATION, again.errorKind);
        assertEquals(2, again.diagnostics.size());
        assertNull(global.lookupLocal("OtherBox"));
    }

    @Test
    void typedefSpellingIsTheSameInstantiation() {
        instantiate("Box", null, "p.char");
        InstantiationResult again = instantiate("Box", null, "CharPtr");

        assertEquals(InstantiationResult.Status.NOTHING_TO_DO, again.status);
        assertNull(again.errorKind);
        assertTrue(again.diagnostics.isEmpty());
    }

    @Test
    void namedInstantiationReplacesAnonymousOne() {
        InstantiationResult anonymous = instantiate("Box", null, "int");
        assertNull(anonymous.node().symName);

        InstantiationResult named = instantiate("Box", "IntBox", "int");

        assertTrue(named.isInstantiated());
        assertEquals(1, global.lookupOverloads("Box<int,4>").size());
        assertSame(named.node(), global.lookupLocal("Box<int,4>"));
        assertEquals("IntBox", named.node().symName);
    }

    @Test
    void functionTemplateOverloadsAreAllInstantiated() {
        InstantiationResult result = instantiate("max", "maxInt", "int");

        assertEquals(2, result.nodes.size());
        assertEquals("max<int>", result.nodes.get(0).name);
        assertEquals("f(int,int).", result.nodes.get(0).decl);
        assertEquals("f(int,int,int).", result.nodes.get(1).decl);
        assertEquals("int", result.nodes.get(1).parms.get(2).type);
        assertEquals("maxInt", result.nodes.get(0).symName);
        assertEquals(2, global.lookupOverloads("max<int>").size());
        for (Node def : global.lookupOverloads("max")) assertFalse(def.instantiate);
    }

    @Test
    void failedExpansionReturnsMarkedDraftAndPublishesNothing() {
        InstantiationResult result = instantiate("Broken", "B", "int");

        assertEquals(InstantiationResult.Status.FAILED, result.status);
        assertEquals(TemplateErrorKind.INTERNAL_CONSISTENCY, result.errorKind);
        assertTrue(result.nodes.isEmpty());
        assertNotNull(result.draft);
        assertTrue(result.draft.error);
        assertNotNull(result.draft.errorMessage);
        assertNull(global.lookupLocal("Broken<int>"));
        assertNull(global.lookupLocal("B"));
        assertFalse(global.lookupLocal("Broken").error);
    }

    @Test
    void errorsAreReportedWithTheRequestSite() {
        InstantiationResult result = instantiator.instantiate(
                InstantiationRequest.of("Missing", ParmList.ofTypes("int"), "M", global).at("demo.i", 3));

        assertEquals(InstantiationResult.Status.FAILED, result.status);
        assertEquals(TemplateErrorKind.UNDEFINED_TEMPLATE, result.errorKind);
        assertNull(result.canonicalName);
        assertEquals("demo.i:3: Error: Template 'Missing' undefined.", result.diagnostics.get(0).toString());
    }

    @Test
    void debugTracesAreCollectedOnlyWhenEnabled() {
        assertFalse(instantiator.isDebugTemplates());
        assertTrue(instantiate("Box", null, "int").diagnostics.isEmpty());

        instantiator.setDebugTemplates(true);
        InstantiationResult traced = instantiate("Box", null, "double");
        assertFalse(traced.diagnostics.isEmpty());
        traced.diagnostics.forEach(d -> assertEquals(Severity.DEBUG, d.severity));
    }

    @Test
    void publishingCanBeDisabled() {
        TemplateOptions options = new TemplateOptions();
        options.publishResults = false;
        InstantiationResult result = new TemplateInstantiator(options)
                .instantiate(InstantiationRequest.of("Box", ParmList.ofTypes("int"), "IntBox", global));

        assertTrue(result.isInstantiated());
        assertNull(global.lookupLocal("Box<int,4>"));
        assertNull(global.lookupLocal("IntBox"));
    }

    @Test
    void optionsAreCopied() {
        TemplateOptions options = new TemplateOptions();
        TemplateInstantiator inst = new TemplateInstantiator(options);
        options.debugTemplates = true;
        assertFalse(inst.isDebugTemplates());
    }

    @Test
    void requestsValidateTheirInput() {
        assertThrows(IllegalArgumentException.class, () -> InstantiationRequest.of("", null, null, global));
        assertThrows(NullPointerException.class, () -> InstantiationRequest.of("Box", null, null, null));
        assertTrue(InstantiationRequest.of("Box", null, null, global).arguments().isEmpty());
    }

    @Test
    void writeIsDeterministic() throws Exception {
        InstantiationResult result = instantiate("Box", "IntBox", "int");
        assertEquals(NodeJson.toJsonString(result.node()), NodeJson.toJsonString(result.node()));
    }

    private static InputStream resource(String path) {
        InputStream in = TemplateInstantiatorTest.class.getClassLoader().getResourceAsStream(path);
        assertNotNull(in, "missing test resource " + path);
        return in;
    }
}
