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

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToonParserOptionsTest {

    @Test
    void testDefaults() {
        ToonParserOptions options = ToonParserOptions.DEFAULT;
        assertEquals(10 * 1024 * 1024, options.getMaxInputSize());
        assertEquals(1_000_000, options.getMaxTokenCount());
        assertEquals(65_536, options.getMaxStringLength());
        assertEquals(100, options.getMaxNestingDepth());
        assertEquals(1_000_000, options.getMaxArraySize());
        assertEquals("ToonParserOptions{maxInputSize=10.0 MB, maxTokenCount=1000000, maxStringLength=65536,"
                + " maxNestingDepth=100, maxArraySize=1000000}", options.toString());
    }

    @Test
    void testUnlimited() {
        ToonParserOptions options = ToonParserOptions.UNLIMITED;
        assertEquals(Integer.MAX_VALUE, options.getMaxInputSize());
        assertEquals(Integer.MAX_VALUE, options.getMaxTokenCount());
        assertEquals(Integer.MAX_VALUE, options.getMaxStringLength());
        assertEquals(Integer.MAX_VALUE, options.getMaxNestingDepth());
        assertEquals(Integer.MAX_VALUE, options.getMaxArraySize());
    }

    @Test
    void testBuilderRejectsValuesBelowOne() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ToonParserOptions.builder().maxNestingDepth(0));
        assertEquals("maxNestingDepth must be at least 1, was: 0", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> ToonParserOptions.builder().maxInputSize(-5));
        assertThrows(IllegalArgumentException.class, () -> ToonParserOptions.builder().maxTokenCount(0));
        assertThrows(IllegalArgumentException.class, () -> ToonParserOptions.builder().maxStringLength(0));
        assertThrows(IllegalArgumentException.class, () -> ToonParserOptions.builder().maxArraySize(0));
    }

    @Test
    void testToBuilder() {
        ToonParserOptions options = ToonParserOptions.DEFAULT.toBuilder().maxArraySize(5).build();
        assertEquals(5, options.getMaxArraySize());
        assertEquals(100, options.getMaxNestingDepth());
        // presets are not affected
        assertEquals(1_000_000, ToonParserOptions.DEFAULT.getMaxArraySize());
    }

    @Test
    void testFromMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("maxNestingDepth", 5);
        map.put("maxArraySize", "10");
        map.put("somethingElse", true);
        ToonParserOptions options = ToonParserOptions.fromMap(map);
        assertEquals(5, options.getMaxNestingDepth());
        assertEquals(10, options.getMaxArraySize());
        assertEquals(ToonParserOptions.DEFAULT_MAX_TOKEN_COUNT, options.getMaxTokenCount());
        assertEquals(ToonParserOptions.DEFAULT_MAX_INPUT_SIZE, ToonParserOptions.fromMap(null).getMaxInputSize());
    }

    @Test
    void testFromMapInvalid() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ToonParserOptions.fromMap(Map.of("maxTokenCount", "lots")));
        assertTrue(e.getMessage().contains("maxTokenCount"));
        assertThrows(IllegalArgumentException.class, () -> ToonParserOptions.fromMap(Map.of("maxStringLength", 0)));
    }

    @Test
    void testFromMapRejectsLossyNumbers() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ToonParserOptions.fromMap(Map.of("maxArraySize", 5_000_000_000L)));
        assertTrue(e.getMessage().contains("maxArraySize"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> ToonParserOptions.fromMap(Map.of("maxNestingDepth", 1.5)));
        assertThrows(IllegalArgumentException.class, () -> ToonParserOptions.fromMap(Map.of("maxNestingDepth", "2.5")));
        // whole numbers of any type are fine
        assertEquals(42, ToonParserOptions.fromMap(Map.of("maxNestingDepth", 42L)).getMaxNestingDepth());
        assertEquals(7, ToonParserOptions.fromMap(Map.of("maxNestingDepth", 7.0)).getMaxNestingDepth());
        assertEquals(9, ToonParserOptions.fromMap(Map.of("maxNestingDepth", " 9 ")).getMaxNestingDepth());
    }

}
