package info.isaksson.erland.cxxtempl.json;

import com.fasterxml.jackson.databind.JsonNode;
import info.isaksson.erland.cxxtempl.ast.Node;
import info.isaksson.erland.cxxtempl.symtab.SymbolTable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Builds a {@link SymbolTable} from a JSON translation unit.
 *
 * <pre>
 * {
 *   "typedefs":     { "Int": "int" },
 *   "declarations": [ { "kind": "template", "name": "Box", ... } ],
 *   "namespaces":   { "ns": { ...same shape... } }
 * }
 * </pre>
 *
 * Each declaration is inserted under its name; declarations sharing a name form an overload chain.
 */
public final class ScopeLoader {

    private ScopeLoader() {}

    public static SymbolTable load(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public static SymbolTable load(InputStream in) throws IOException {
        if (in == null) throw new IllegalArgumentException("input is null");
        return fromTree(NodeJson.MAPPER.readTree(in));
    }

    public static SymbolTable loadFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return fromTree(NodeJson.MAPPER.readTree(json));
    }

    public static SymbolTable fromTree(JsonNode unit) {
        SymbolTable global = new SymbolTable();
        populate(global, unit);
        return global;
    }

    private static void populate(SymbolTable scope, JsonNode unit) {
        if (unit == null || !unit.isObject()) throw new IllegalArgumentException("translation unit must be a JSON object");
        for (Iterator<Map.Entry<String, JsonNode>> it = unit.path("typedefs").fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            scope.addTypedef(e.getKey(), e.getValue().asText());
        }
        for (JsonNode d : unit.path("declarations")) {
            Node n = NodeJson.fromTree(d);
            if (n.name == null) throw new IllegalArgumentException("top-level declaration without a name: " + n.kind.tag);
            scope.insert(n.name, n);
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = unit.path("namespaces").fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            populate(scope.childScope(e.getKey()), e.getValue());
        }
    }
}
