/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.toonlabs.parser;

import io.toonlabs.ast.ArrayNode;
import io.toonlabs.ast.StringNode;
import io.toonlabs.common.Source;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.toonlabs.NodeUtils.match;
import static io.toonlabs.NodeUtils.parse;
import static org.junit.jupiter.api.Assertions.*;

class DelimiterScopeTest {

    private static List<ErrorCode> codes(ToonParseResult result) {
        return result.getErrors().stream().map(ToonError::getErrorCode).toList();
    }

    private static void success(String text, String json) {
        ToonParseResult result = parse(text);
        assertTrue(result.isSuccess(), () -> "errors: " + result.getErrors());
        match(result.getDocument(), json);
    }

    @Test
    void testCommaIsDefault() {
        success("a[3]: 1,2,3", "{a:[1,2,3]}");
    }

    @Test
    void testPipeMarker() {
        success("a[3|]: 1|2|3", "{a:[1,2,3]}");
        // commas are plain text inside a pipe scope
        success("a[2|]: x,y|z", "{a:['x,y','z']}");
    }

    @Test
    void testTabMarker() {
        success("a[3\t]: 1\t2\t3", "{a:[1,2,3]}");
        success("a[2\t]: New York\tParis", "{a:['New York','Paris']}");
    }

    @Test
    void testExplicitCommaMarker() {
        success("a[2,]: 1,2", "{a:[1,2]}");
    }

    @Test
    void testNestedArrayInheritsDelimiter() {
        success("a[2|]:\n  - [2]: 1|2\n  - [2]: 3|4", "{a:[[1,2],[3,4]]}");
    }

    @Test
    void testNestedMarkerOverridesParent() {
        success("a[1|]:\n  - [2,]: 1,2", "{a:[[1,2]]}");
    }

    @Test
    void testObjectsDoNotOpenScopes() {
        success("outer[1|]:\n  - obj:\n      inner[2]: a|b", "{outer:[{obj:{inner:['a','b']}}]}");
    }

    @Test
    void testNestedTableInheritsDelimiter() {
        success("outer[1|]:\n  - t[1]{a|b}:\n      1|2", "{outer:[{t:[{a:1,b:2}]}]}");
    }

    @Test
    void testScopeEndsWithArray() {
        success("a[1|]:\n  - [2,]: 1,2\nb[2]: x,y\nc[1|]: p,q", "{a:[[1,2]],b:['x','y'],c:['p,q']}");
    }

    @Test
    void testTableUsesArrayDelimiter() {
        success("t[2|]{a|b}:\n  1|x,y\n  2|z", "{t:[{a:1,b:'x,y'},{a:2,b:'z'}]}");
    }

    @Test
    void testMixedDelimitersInInlineArray() {
        ToonParseResult result = parse("a[3]: 1|2|3");
        assertEquals(List.of(ErrorCode.MIXED_DELIMITERS, ErrorCode.ARRAY_SIZE_MISMATCH), codes(result));
        ToonError error = result.getErrors().get(0);
        assertEquals("TOON4001", error.getCode());
        assertTrue(error.getMessage().contains("pipe (|)"), error.getMessage());
        assertTrue(error.getMessage().contains("comma (,)"), error.getMessage());
        // the value is kept as one cell
        ArrayNode array = (ArrayNode) result.getDocument().get("a").orElseThrow();
        assertEquals("1|2|3", ((StringNode) array.get(0)).value());
    }

    @Test
    void testTabInCommaScope() {
        ToonParseResult result = parse("a[2]: x\ty");
        assertEquals(List.of(ErrorCode.MIXED_DELIMITERS, ErrorCode.ARRAY_SIZE_MISMATCH), codes(result));
        assertTrue(result.getErrors().get(0).getMessage().contains("tab character"));
    }

    @Test
    void testMixedDelimitersInTableRow() {
        ToonParseResult result = parse("t[1]{a,b}:\n  1|2");
        assertEquals(List.of(ErrorCode.MIXED_DELIMITERS, ErrorCode.TABLE_ROW_FIELD_MISMATCH), codes(result));
        assertEquals(2, result.getErrors().get(0).getLine());
    }

    @Test
    void testMarkerBeforeSize() {
        ToonParseResult result = parse("a[|3]: 1|2|3");
        assertEquals(List.of(ErrorCode.DELIMITER_MARKER_MISPLACED), codes(result));
        assertEquals("TOON4002", result.getErrors().get(0).getCode());
        assertTrue(result.getErrors().get(0).getMessage().contains("[3|]"));
        // the marker is still honoured
        match(result.getDocument(), "{a:[1,2,3]}");
    }

    @Test
    void testSchemaTrailingMarkerMismatch() {
        ToonParseResult result = parse("t[1|]{a|b,}:\n  1,2");
        assertEquals(List.of(ErrorCode.DELIMITER_MARKER_MISPLACED), codes(result));
        match(result.getDocument(), "{t:[{a:1,b:2}]}");
    }

    @Test
    void testScopeTracker() {
        ScopeTracker scopes = new ScopeTracker(Source.of("a\n  b\n \tc"));
        assertEquals(Delimiter.COMMA, scopes.current());
        assertEquals(Delimiter.PIPE, scopes.push(Delimiter.PIPE));
        assertEquals(Delimiter.PIPE, scopes.push(null));
        scopes.pop();
        assertEquals(Delimiter.PIPE, scopes.current());
        scopes.pop();
        scopes.pop();
        assertEquals(Delimiter.COMMA, scopes.current());
        assertEquals(0, scopes.indentOf(1));
        assertEquals(2, scopes.indentOf(2));
        assertEquals(2, scopes.indentOf(3));
        assertFalse(scopes.hasMixedIndent(2));
        assertTrue(scopes.hasMixedIndent(3));
    }

}
