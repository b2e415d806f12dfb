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

import io.toonlabs.common.StringUtils;

/**
 * Rejects input before any lexing work is done. These are the only two
 * conditions under which parsing throws instead of collecting errors.
 */
public class SourceGuard {

    private SourceGuard() {
        // only static methods
    }

    public static void check(String text, ToonParserOptions options) {
        if (text == null) {
            throw new ToonException(ErrorMessages.nullSource());
        }
        int max = options.getMaxInputSize();
        // at most 3 utf-8 bytes per char, so the exact count is only needed near the limit
        if ((long) text.length() * 3 <= max) {
            return;
        }
        long size = StringUtils.utf8Length(text);
        if (size > max) {
            throw new ToonException(ErrorMessages.inputTooLarge(size, max));
        }
    }

}
