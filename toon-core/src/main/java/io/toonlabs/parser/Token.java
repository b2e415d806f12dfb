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
 * Immutable lexical token. Line and column are 1-based, the offset is 0-based.
 * The raw text is exactly the slice of source the token covers, so concatenating
 * the text of every token reproduces the input. The value is the decoded form,
 * which differs from the text only for quoted strings.
 */
public class Token {

    public final TokenType type;
    public final String text;
    public final String value;
    public final int pos;
    public final int line;
    public final int col;
    public final int length;

    public Token(TokenType type, String text, String value, int pos, int line, int col) {
        this.type = type;
        this.text = text;
        this.value = value;
        this.pos = pos;
        this.line = line;
        this.col = col;
        this.length = text.length();
    }

    public int getEndPos() {
        return pos + length;
    }

    public String getPositionDisplay() {
        return line + ":" + col;
    }

    public String toDebugString() {
        return type + "(" + StringUtils.escapeForDisplay(text) + ")@" + getPositionDisplay();
    }

    @Override
    public String toString() {
        return switch (type) {
            case WS -> "_";
            case WS_LF -> "_\\n_";
            case TAB -> "_\\t_";
            case DEDENT -> "_DEDENT_";
            case EOF -> "_EOF_";
            default -> text;
        };
    }

}
