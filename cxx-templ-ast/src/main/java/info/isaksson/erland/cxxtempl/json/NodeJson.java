package info.isaksson.erland.cxxtempl.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.cxxtempl.ast.Node;
import info.isaksson.erland.cxxtempl.ast.NodeKind;
import info.isaksson.erland.cxxtempl.ast.PartialSpecialization;
import info.isaksson.erland.cxxtempl.types.Parm;
import info.isaksson.erland.cxxtempl.types.ParmList;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

/**
 * JSON form of declaration trees, for debug dumps, golden files and test fixtures.
 *
 * <p>Output is deterministic: attributes are written in a fixed order, absent attributes are
 * omitted. Parent links and scopes are not written; {@link Node#templateRef} is written as the
 * referenced template's name and not restored on read.</p>
 */
public final class NodeJson {

    static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private NodeJson() {}

    public static Node read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return fromTree(MAPPER.readTree(in));
        }
    }

    /** Parse a declaration tree from a JSON string. */
    public static Node readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return fromTree(MAPPER.readTree(json));
    }

    public static void write(Node node, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, toTree(node));
            out.write('\n');
        }
    }

    public static String toJsonString(Node node) throws IOException {
        return MAPPER.writer(PRETTY).writeValueAsString(toTree(node)) + "\n";
    }

    // ------------------------------------------------------------------ tree mapping

    public static ObjectNode toTree(Node n) {
        if (n == null) throw new IllegalArgumentException("node is null");
        ObjectNode o = MAPPER.createObjectNode();
        o.put("kind", n.kind.tag);
        if (n.templateKind != null) o.put("templateKind", n.templateKind.tag);
        putIfPresent(o, "name", n.name);
        putIfPresent(o, "symName", n.symName);
        putIfPresent(o, "type", n.type);
        putIfPresent(o, "decl", n.decl);
        putIfPresent(o, "value", n.value);
        putIfPresent(o, "code", n.code);
        putIfPresent(o, "storage", n.storage);
        putIfPresent(o, "usingName", n.usingName);
        if (n.conversionOperator) o.put("conversionOperator", true);
        putIfPresent(o, "file", n.file);
        if (n.line > 0) o.put("line", n.line);
        if (n.error) o.put("error", true);
        putIfPresent(o, "errorMessage", n.errorMessage);
        if (n.instantiate) o.put("instantiate", true);
        putParms(o, "parms", n.parms);
        putParms(o, "throws", n.throwsList);
        putParms(o, "kwargs", n.kwargs);
        putParms(o, "pattern", n.pattern);
        putParms(o, "templateParms", n.templateParms);
        putParms(o, "partialArgs", n.partialArgs);
        if (n.templateRef != null) putIfPresent(o, "templateRef", n.templateRef.name);
        putStrings(o, "bases", n.baseList);
        putStrings(o, "protectedBases", n.protectedBaseList);
        putStrings(o, "privateBases", n.privateBaseList);
        if (!n.partials.isEmpty()) {
            ArrayNode arr = o.putArray("partials");
            for (PartialSpecialization ps : n.partials) {
                ObjectNode p = arr.addObject();
                p.put("name", ps.displayName);
                p.set("definition", toTree(ps.definition));
            }
        }
        if (!n.children().isEmpty()) {
            ArrayNode arr = o.putArray("children");
            for (Node c : n.children()) arr.add(toTree(c));
        }
        return o;
    }

    public static Node fromTree(JsonNode o) {
        if (o == null || !o.isObject()) throw new IllegalArgumentException("declaration must be a JSON object");
        Node n = new Node(NodeKind.fromTag(text(o, "kind")));
        n.templateKind = NodeKind.fromTag(text(o, "templateKind"));
        n.name = text(o, "name");
        n.symName = text(o, "symName");
        n.type = text(o, "type");
        n.decl = text(o, "decl");
        n.value = text(o, "value");
        n.code = text(o, "code");
        n.storage = text(o, "storage");
        n.usingName = text(o, "usingName");
        n.conversionOperator = o.path("conversionOperator").asBoolean(false);
        n.file = text(o, "file");
        n.line = o.path("line").asInt(0);
        n.error = o.path("error").asBoolean(false);
        n.errorMessage = text(o, "errorMessage");
        n.instantiate = o.path("instantiate").asBoolean(false);
        n.parms = parms(o, "parms");
        n.throwsList = parms(o, "throws");
        n.kwargs = parms(o, "kwargs");
        n.pattern = parms(o, "pattern");
        n.templateParms = parms(o, "templateParms");
        n.partialArgs = parms(o, "partialArgs");
        strings(o, "bases", n.baseList);
        strings(o, "protectedBases", n.protectedBaseList);
        strings(o, "privateBases", n.privateBaseList);
        for (JsonNode p : o.path("partials")) {
            n.partials.add(new PartialSpecialization(p.path("name").asText(), fromTree(p.get("definition"))));
        }
        for (JsonNode c : o.path("children")) n.addChild(fromTree(c));
        return n;
    }

    private static void putIfPresent(ObjectNode o, String key, String value) {
        if (value != null) o.put(key, value);
    }

    private static void putParms(ObjectNode o, String key, ParmList parms) {
        if (parms == null) return;
        ArrayNode arr = o.putArray(key);
        for (Parm p : parms) {
            ObjectNode po = arr.addObject();
            putIfPresent(po, "name", p.name);
            putIfPresent(po, "type", p.type);
            putIfPresent(po, "value", p.value);
            if (p.defaultDerived) po.put("defaultDerived", true);
        }
    }

    private static void putStrings(ObjectNode o, String key, List<String> values) {
        if (values.isEmpty()) return;
        ArrayNode arr = o.putArray(key);
        for (String v : values) arr.add(v);
    }

    private static String text(JsonNode o, String key) {
        JsonNode v = o.get(key);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static ParmList parms(JsonNode o, String key) {
        JsonNode arr = o.get(key);
        if (arr == null || !arr.isArray()) return null;
        ParmList out = new ParmList();
        for (Iterator<JsonNode> it = arr.elements(); it.hasNext(); ) {
            JsonNode po = it.next();
            Parm p = new Parm(text(po, "name"), text(po, "type"), text(po, "value"));
            p.defaultDerived = po.path("defaultDerived").asBoolean(false);
            out.add(p);
        }
        return out;
    }

    private static void strings(JsonNode o, String key, List<String> into) {
        for (JsonNode v : o.path(key)) into.add(v.asText());
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
