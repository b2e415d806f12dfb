package io.toonlabs.ast;

import io.toonlabs.NodeUtils;
import io.toonlabs.parser.ToonParseResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.toonlabs.NodeUtils.parse;
import static org.junit.jupiter.api.Assertions.*;

class NodesTest {

    static final String TEXT = "name: Ann\nage: 30\nratio: 0.5\ntags[2]: a,b\nt[1]{x,y}:\n  1,true\nmeta:\n  k: null\n  empty:";

    private static DocumentNode document() {
        ToonParseResult result = parse(TEXT);
        assertTrue(result.isSuccess(), () -> "errors: " + result.getErrors());
        return result.getDocument();
    }

    @Test
    @SuppressWarnings("unchecked")
    void testToJava() {
        Map<String, Object> map = (Map<String, Object>) Nodes.toJava(document());
        assertEquals(List.of("name", "age", "ratio", "tags", "t", "meta"), List.copyOf(map.keySet()));
        assertEquals("Ann", map.get("name"));
        assertEquals(30L, map.get("age"));
        assertEquals(0.5, map.get("ratio"));
        assertEquals(List.of("a", "b"), map.get("tags"));
        assertEquals(List.of(Map.of("x", 1L, "y", true)), map.get("t"));
        Map<String, Object> meta = (Map<String, Object>) map.get("meta");
        assertTrue(meta.containsKey("k"));
        assertNull(meta.get("k"));
        assertEquals(Map.of(), meta.get("empty"));
    }

    @Test
    void testDuplicateKeysLastWins() {
        DocumentNode doc = parse("a: 1\na: 2").getDocument();
        assertEquals(2, doc.properties().size());
        assertEquals(Map.of("a", 2L), Nodes.toJava(doc));
    }

    @Test
    void testToJson() {
        String json = Nodes.toJson(document());
        assertTrue(json.contains("\"name\":\"Ann\""), json);
        NodeUtils.isEqualTo(NodeUtils.fromJson(json), NodeUtils.fromJson(
                "{name:'Ann',age:30,ratio:0.5,tags:['a','b'],t:[{x:1,y:true}],meta:{k:null,empty:{}}}"));
    }

    @Test
    void testAllProperties() {
        List<String> keys = Nodes.allProperties(document()).stream().map(PropertyNode::key).toList();
        assertEquals(List.of("name", "age", "ratio", "tags", "t", "meta", "k", "empty"), keys);
    }

    @Test
    void testAllPropertiesInsideListItems() {
        DocumentNode doc = parse("items[1]:\n  - id: 1\n    tags[0]:").getDocument();
        List<String> keys = Nodes.allProperties(doc).stream().map(PropertyNode::key).toList();
        assertEquals(List.of("items", "id", "tags"), keys);
    }

    @Test
    void testDebugString() {
        String debug = Nodes.toDebugString(document());
        assertTrue(debug.startsWith("DOCUMENT\n"), debug);
        assertTrue(debug.contains("  PROPERTY name @1:1-1:10\n    STRING Ann\n"), debug);
        assertTrue(debug.contains("TABLE_ARRAY [1][x, y]\n"), debug);
        assertTrue(debug.contains("[1, true]\n"), debug);
        assertTrue(debug.contains("NULL null\n"), debug);
    }

    @Test
    void testValueNodes() {
        DocumentNode doc = parse("big: 12345678901234567890\nneg: -7\nexp: 1e3\nzip: 007").getDocument();
        NumberNode big = (NumberNode) doc.get("big").orElseThrow();
        assertTrue(big.integer());
        // too large for a long
        assertEquals(Double.parseDouble("12345678901234567890"), big.toJava());
        assertEquals(-7L, ((NumberNode) doc.get("neg").orElseThrow()).toJava());
        NumberNode exp = (NumberNode) doc.get("exp").orElseThrow();
        assertFalse(exp.integer());
        assertEquals(1000.0, exp.toJava());
        StringNode zip = (StringNode) doc.get("zip").orElseThrow();
        assertEquals("007", zip.value());
    }

}
