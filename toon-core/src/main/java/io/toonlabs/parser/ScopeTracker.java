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

import io.toonlabs.common.Source;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tracks the active delimiter through nested arrays and measures line
 * indentation from the source text.
 * <p>
 * Only array and table headers open a delimiter scope. A header without an
 * explicit marker inherits the delimiter of the nearest enclosing array, so a
 * plain object between two arrays is transparent. The document default is comma.
 */
public class ScopeTracker {

    private final Source source;
    private final Deque<Delimiter> scopes = new ArrayDeque<>();

    public ScopeTracker(Source source) {
        this.source = source;
    }

    public Delimiter current() {
        Delimiter delimiter = scopes.peek();
        return delimiter == null ? Delimiter.COMMA : delimiter;
    }

    /**
     * @param marker explicit delimiter from the header, or null to inherit
     * @return the delimiter now in effect
     */
    public Delimiter push(Delimiter marker) {
        Delimiter delimiter = marker == null ? current() : marker;
        scopes.push(delimiter);
        return delimiter;
    }

    public void pop() {
        if (!scopes.isEmpty()) {
            scopes.pop();
        }
    }

    /**
     * @param line 1-based line number
     * @return count of leading space and tab characters
     */
    public int indentOf(int line) {
        String text = source.getText();
        int start = source.getLineStart(line);
        int pos = start;
        while (pos < text.length() && (text.charAt(pos) == ' ' || text.charAt(pos) == '\t')) {
            pos++;
        }
        return pos - start;
    }

    public boolean hasMixedIndent(int line) {
        String text = source.getText();
        int pos = source.getLineStart(line);
        boolean spaces = false;
        boolean tabs = false;
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == ' ') {
                spaces = true;
            } else if (c == '\t') {
                tabs = true;
            } else {
                break;
            }
        }
        return spaces && tabs;
    }

}
