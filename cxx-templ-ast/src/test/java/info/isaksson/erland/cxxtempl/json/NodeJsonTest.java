package info.isaksson.erland.cxxtempl.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.cxxtempl.ast.Node;
import info.isaksson.erland.cxxtempl.ast.NodeKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class NodeJsonTest {

    @Test
    void readsFixtureIntoTree() throws Exception {
        Node box = NodeJson.read(resource("json/box-template.json"));
        assertEquals(NodeKind.TEMPLATE, box.kind);
        assertEquals(NodeKind.CLASS, box.templateKind);
        assertEquals(2, box.templateParms.size());
        assertEquals("4", box.templateParms.get(1).value);
        assertEquals(1, box.partials.size());
        assertEquals("p.$1", box.partials.get(0).pattern().get(0).type);
        assertEquals("$2", box.partials.get(0).pattern().get(1).value);
        assertEquals(4, box.children().size());
        assertSame(box, box.child("value").parent());
        assertTrue(box.child("get").parms.isEmpty());
        assertEquals("Base<T>", box.baseList.get(0));
    }

    @Test
    void writeMatchesFixture() throws Exception {
        assertGoldenRoundTrip("json/box-template.json");
    }

    @Test
    void templateRefIsWrittenByName() throws IOException {
        Node def = new Node(NodeKind.TEMPLATE, "Box");
        Node inst = new Node(NodeKind.CLASS, "Box<int>");
        inst.templateRef = def;
        JsonNode tree = NodeJson.toTree(inst);
        assertEquals("Box", tree.get("templateRef").asText());
        assertNull(NodeJson.readFromString(NodeJson.toJsonString(inst)).templateRef);
    }

    @Test
    void rejectsNonObjects() {
        assertThrows(IllegalArgumentException.class, () -> NodeJson.readFromString("[]"));
        assertThrows(IllegalArgumentException.class, () -> NodeJson.readFromString(null));
    }

    private static void assertGoldenRoundTrip(String resourcePath) throws IOException, URISyntaxException {
        Path goldenPath = resource(resourcePath);
        String golden = Files.readString(goldenPath, StandardCharsets.UTF_8);
        Node node = NodeJson.read(goldenPath);

        ObjectMapper om = new ObjectMapper();
        JsonNode goldenNode = om.readTree(golden);

        String rendered = NodeJson.toJsonString(node);
        assertEquals(goldenNode, om.readTree(rendered), "Rendered JSON must be semantically equal to the fixture.");
        assertTrue(rendered.endsWith("\n"));

        Path tmp = Files.createTempFile("nodejson-", ".json");
        NodeJson.write(node, tmp);
        String written = Files.readString(tmp, StandardCharsets.UTF_8);
        assertEquals(goldenNode, om.readTree(written), "Written JSON must be semantically equal to the fixture.");

        Path tmp2 = Files.createTempFile("nodejson-", ".json");
        NodeJson.write(node, tmp2);
        assertEquals(written, Files.readString(tmp2, StandardCharsets.UTF_8), "Writing twice must produce identical output.");
    }

    static Path resource(String path) throws URISyntaxException {
        return Path.of(NodeJsonTest.class.getClassLoader().getResource(path).toURI());
    }
}
