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

import java.util.Arrays;

/**
 * Immutable TOON source text with an optional name used when logging.
 * Line numbers are 1-based. A line ends at "\n", "\r\n" or a lone "\r".
 */
public class Source {

    private final String name;
    private final String text;

    private int[] lineStarts;

    public static Source of(String text) {
        return new Source(null, text);
    }

    public static Source of(String name, String text) {
        return new Source(name, text);
    }

    private Source(String name, String text) {
        this.name = name;
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public int getLength() {
        return text.length();
    }

    public String getName() {
        return name;
    }

    public int getLineCount() {
        return lineStarts().length;
    }

    /**
     * @param line 1-based line number
     * @return offset of the first character of the line
     */
    public int getLineStart(int line) {
        int[] starts = lineStarts();
        if (line < 1) {
            return 0;
        }
        if (line > starts.length) {
            return text.length();
        }
        return starts[line - 1];
    }

    public String getPathForLog() {
        return name == null ? "(inline)" : name;
    }

    private int[] lineStarts() {
        if (lineStarts == null) {
            int[] starts = new int[16];
            int count = 1;
            int length = text.length();
            for (int i = 0; i < length; i++) {
                char c = text.charAt(i);
                if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                    continue;
                }
                if (c == '\n' || c == '\r') {
                    if (count == starts.length) {
                        starts = Arrays.copyOf(starts, count * 2);
                    }
                    starts[count++] = i + 1;
                }
            }
            lineStarts = Arrays.copyOf(starts, count);
        }
        return lineStarts;
    }

    @Override
    public String toString() {
        return getPathForLog();
    }

}
