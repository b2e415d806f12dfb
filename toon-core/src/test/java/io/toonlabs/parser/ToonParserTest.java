package io.toonlabs.parser;

import io.toonlabs.ast.ArrayNode;
import io.toonlabs.ast.BooleanNode;
import io.toonlabs.ast.DocumentNode;
import io.toonlabs.ast.Node;
import io.toonlabs.ast.NodeType;
import io.toonlabs.ast.NullNode;
import io.toonlabs.ast.NumberNode;
import io.toonlabs.ast.ObjectNode;
import io.toonlabs.ast.PropertyNode;
import io.toonlabs.ast.StringNode;
import io.toonlabs.ast.TableArrayNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.toonlabs.NodeUtils.match;
import static io.toonlabs.NodeUtils.parse;
import static org.junit.jupiter.api.Assertions.*;

class ToonParserTest {

    private static DocumentNode doc(String text) {
        ToonParseResult result = parse(text);
        assertTrue(result.isSuccess(), () -> "unexpected errors: " + result.getErrors());
        return result.getDocument();
    }

    private static Node value(String text, String key) {
        return doc(text).get(key).orElseThrow();
    }

    @Test
    void testSimpleProperties() {
        DocumentNode doc = doc("name: John\nage: 30\nactive: true\nscore: 9.5\nnothing: null");
        match(doc, "{name:'John',age:30,active:true,score:9.5,nothing:null}");
        assertEquals(5, doc.properties().size());
    }

    @Test
    void testLiteralKinds() {
        String text = "a: hello\nb: 42\nc: -1.5e2\nd: false\ne: null\nf: \"quoted\"";
        DocumentNode doc = doc(text);
        assertEquals(NodeType.STRING, doc.get("a").orElseThrow().type());
        NumberNode b = (NumberNode) doc.get("b").orElseThrow();
        assertEquals(42, b.value());
        assertTrue(b.integer());
        NumberNode c = (NumberNode) doc.get("c").orElseThrow();
        assertEquals(-150.0, c.value());
        assertFalse(c.integer());
        assertEquals("-1.5e2", c.raw());
        assertFalse(((BooleanNode) doc.get("d").orElseThrow()).value());
        assertInstanceOf(NullNode.class, doc.get("e").orElseThrow());
        StringNode f = (StringNode) doc.get("f").orElseThrow();
        assertEquals("quoted", f.value());
        assertEquals("\"quoted\"", f.raw());
    }

    @Test
    void testLeadingZeroStaysString() {
        Node node = value("value: 05", "value");
        assertInstanceOf(StringNode.class, node);
        assertEquals("05", ((StringNode) node).value());
        Node zero = value("value: 0", "value");
        assertInstanceOf(NumberNode.class, zero);
        assertEquals(0, ((NumberNode) zero).value());
    }

    @Test
    void testMultiWordValues() {
        assertEquals("New York", ((StringNode) value("city: New York", "city")).value());
        assertEquals("user@example.com", ((StringNode) value("email: user@example.com", "email")).value());
        assertEquals("Hello, world: again", ((StringNode) value("msg: Hello, world: again", "msg")).value());
        // a trailing comment is not part of the value
        assertEquals("San Francisco", ((StringNode) value("city: San Francisco # west coast", "city")).value());
        // several spaces are kept as written
        assertEquals("a   b", ((StringNode) value("text: a   b", "text")).value());
    }

    @Test
    void testQuotedKeys() {
        DocumentNode doc = doc("\"full name\": Jane Doe\n'x-y': 1\n42: answer");
        match(doc, "{'full name':'Jane Doe','x-y':1,'42':'answer'}");
    }

    @Test
    void testNestedObjects() {
        String text = "server:\n  host: localhost\n  port: 8080\n  tls:\n    enabled: true\nname: app";
        DocumentNode doc = doc(text);
        match(doc, "{server:{host:'localhost',port:8080,tls:{enabled:true}},name:'app'}");
        PropertyNode server = doc.properties().get(0);
        assertEquals(0, server.indentLevel());
        ObjectNode object = (ObjectNode) server.value();
        assertEquals(2, object.properties().get(0).indentLevel());
        assertEquals(List.of("host", "port", "tls"), object.keys());
    }

    @Test
    void testEmptyObject() {
        DocumentNode doc = doc("config:\nname: x");
        ObjectNode config = (ObjectNode) doc.get("config").orElseThrow();
        assertTrue(config.isEmpty());
        match(doc, "{config:{},name:'x'}");
        assertInstanceOf(ObjectNode.class, doc("trailing:").get("trailing").orElseThrow());
    }

    @Test
    void testTabIndentation() {
        DocumentNode doc = doc("parent:\n\tchild: value");
        ObjectNode parent = (ObjectNode) doc.get("parent").orElseThrow();
        assertEquals(1, parent.size());
        match(doc, "{parent:{child:'value'}}");
    }

    @Test
    void testCommentsAndBlankLines() {
        String text = "# settings\n\nname: app # inline\n\n// other style\nversion: 2\n";
        match(doc(text), "{name:'app',version:2}");
    }

    @Test
    void testInlineArray() {
        DocumentNode doc = doc("tags[3]: red,green,blue\nnums[3]: 1, 2, 3");
        match(doc, "{tags:['red','green','blue'],nums:[1,2,3]}");
        ArrayNode tags = (ArrayNode) doc.get("tags").orElseThrow();
        assertEquals(3, tags.declaredSize());
        assertEquals(3, tags.size());
    }

    @Test
    void testInlineArrayCells() {
        // empty cells are empty strings, multi word cells keep their spacing
        match(doc("a[3]: x,,z"), "{a:['x','','z']}");
        match(doc("b[2]: New York, Los Angeles"), "{b:['New York','Los Angeles']}");
        match(doc("c[3]: 1,true,null"), "{c:[1,true,null]}");
        match(doc("d[2]: \"a,b\",c"), "{d:['a,b','c']}");
        match(doc("e[3]: x,y,"), "{e:['x','y','']}");
    }

    @Test
    void testEmptyArray() {
        DocumentNode doc = doc("items[0]:\nnext: 1");
        ArrayNode items = (ArrayNode) doc.get("items").orElseThrow();
        assertEquals(0, items.size());
        assertEquals(0, items.declaredSize());
    }

    @Test
    void testInlineArrayContinuation() {
        String text = "nums[6]: 1,2,\n  3,4,\n  5,6\nafter: done";
        DocumentNode doc = doc(text);
        match(doc, "{nums:[1,2,3,4,5,6],after:'done'}");
        String onNextLine = "nums[3]:\n  1,2,3";
        match(doc(onNextLine), "{nums:[1,2,3]}");
    }

    @Test
    void testExpandedArray() {
        String text = "items[3]:\n  - apple\n  - big banana\n  - 42\ncount: 3";
        DocumentNode doc = doc(text);
        match(doc, "{items:['apple','big banana',42],count:3}");
    }

    @Test
    void testExpandedArrayOfObjects() {
        String text = "users[2]:\n"
                + "  - name: Alice\n"
                + "    age: 30\n"
                + "  - name: Bob\n"
                + "    tags[2]: a,b\n"
                + "    address:\n"
                + "      city: Paris\n"
                + "done: true";
        match(doc(text), "{users:[{name:'Alice',age:30},{name:'Bob',tags:['a','b'],address:{city:'Paris'}}],done:true}");
    }

    @Test
    void testExpandedArrayEmptyObjectItem() {
        String text = "items[2]:\n  -\n  - x";
        match(doc(text), "{items:[{},'x']}");
        String nested = "items[1]:\n  -\n    a: 1\n    b: 2";
        match(doc(nested), "{items:[{a:1,b:2}]}");
    }

    @Test
    void testNestedArrays() {
        String text = "matrix[2]:\n  - [2]: 1,2\n  - [3]: 3,4,5";
        match(doc(text), "{matrix:[[1,2],[3,4,5]]}");
        String expanded = "outer[1]:\n  - [2]:\n    - a\n    - b";
        match(doc(expanded), "{outer:[['a','b']]}");
    }

    @Test
    void testTableArray() {
        String text = "users[2]{id,name,active}:\n  1,Alice,true\n  2,Bob Smith,false\ncount: 2";
        DocumentNode doc = doc(text);
        match(doc, "{users:[{id:1,name:'Alice',active:true},{id:2,name:'Bob Smith',active:false}],count:2}");
        TableArrayNode users = (TableArrayNode) doc.get("users").orElseThrow();
        assertEquals(List.of("id", "name", "active"), users.fields());
        assertEquals(2, users.rows().size());
        assertEquals(3, users.rows().get(1).size());
    }

    @Test
    void testTableInsideListItem() {
        String text = "groups[1]:\n  - name: admins\n    members[2]{id,role}:\n      1,owner\n      2,editor";
        match(doc(text), "{groups:[{name:'admins',members:[{id:1,role:'owner'},{id:2,role:'editor'}]}]}");
    }

    @Test
    void testDuplicateKeysKept() {
        DocumentNode doc = doc("a: 1\na: 2");
        assertEquals(2, doc.properties().size());
        assertEquals(2, ((NumberNode) doc.get("a").orElseThrow()).value());
    }

    @Test
    void testFindByPath() {
        DocumentNode doc = doc("db:\n  connection:\n    host: localhost\n    port: 5432");
        assertEquals("localhost", ((StringNode) doc.find("db.connection.host").orElseThrow()).value());
        assertEquals(NodeType.OBJECT, doc.find("db.connection").orElseThrow().type());
        assertTrue(doc.find("db.missing.host").isEmpty());
        assertTrue(doc.find("db.connection.host.deeper").isEmpty());
        assertTrue(doc.find("").isEmpty());
    }

    @Test
    void testSpans() {
        DocumentNode doc = doc("name: John\nserver:\n  port: 80");
        PropertyNode name = doc.properties().get(0);
        assertEquals(1, name.span().startLine());
        assertEquals(1, name.span().startColumn());
        assertEquals(0, name.span().startOffset());
        assertEquals(10, name.span().endOffset());
        PropertyNode server = doc.properties().get(1);
        assertEquals(2, server.span().startLine());
        assertEquals(3, server.span().endLine());
        StringNode john = (StringNode) name.value();
        assertEquals(6, john.span().startOffset());
        assertEquals(4, john.span().length());
        assertTrue(john.span().contains(6));
        assertFalse(john.span().contains(10));
        ObjectNode block = (ObjectNode) server.value();
        assertEquals(List.of("port"), block.keys());
        PropertyNode port = block.getProperty("port").orElseThrow();
        assertEquals(2, port.indentLevel());
        assertEquals(80, ((NumberNode) port.value()).longValue());
    }

    @Test
    void testCommentOnlyDocument() {
        ToonParseResult result = parse("# nothing here\n// or here");
        assertTrue(result.isSuccess());
        assertTrue(result.getDocument().isEmpty());
    }

    @Test
    void testCrLfDocument() {
        match(doc("a: 1\r\nb:\r\n  c: x\r\n"), "{a:1,b:{c:'x'}}");
    }

}
