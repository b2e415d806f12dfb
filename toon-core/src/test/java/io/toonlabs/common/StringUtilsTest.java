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
package io.toonlabs.common;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class StringUtilsTest {

    @Test
    void testIsBlank() {
        assertTrue(StringUtils.isBlank(null));
        assertTrue(StringUtils.isBlank(""));
        assertTrue(StringUtils.isBlank(" \t\r\n"));
        assertFalse(StringUtils.isBlank("  a"));
    }

    @Test
    void testTruncate() {
        assertEquals("hel ...", StringUtils.truncate("hello", 3, true));
        assertEquals("hel", StringUtils.truncate("hello", 3, false));
        assertEquals("hi", StringUtils.truncate("hi", 3, true));
        assertEquals("", StringUtils.truncate(null, 3, true));
    }

    @Test
    void testRepeat() {
        assertEquals("---", StringUtils.repeat('-', 3));
        assertEquals("", StringUtils.repeat('-', 0));
    }

    @Test
    void testUtf8Length() {
        String text = "aé€😀";
        assertEquals(text.getBytes(StandardCharsets.UTF_8).length, StringUtils.utf8Length(text));
        assertEquals(10, StringUtils.utf8Length(text));
        // unpaired surrogate
        assertEquals(1, StringUtils.utf8Length("\uD800"));
    }

    @Test
    void testFormatFileSize() {
        assertEquals("512 bytes", StringUtils.formatFileSize(512));
        assertEquals("1.5 KB", StringUtils.formatFileSize(1536));
        assertEquals("10.0 MB", StringUtils.formatFileSize(10 * 1024 * 1024));
    }

    @Test
    void testEscapeForDisplay() {
        assertEquals("a\\tb\\n", StringUtils.escapeForDisplay("a\tb\n"));
        assertEquals("\\u0001x", StringUtils.escapeForDisplay("\u0001x"));
        assertEquals("", StringUtils.escapeForDisplay(null));
    }

}
