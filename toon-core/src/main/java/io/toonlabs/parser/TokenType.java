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

public enum TokenType {

    //==== values
    STRING,
    IDENT,
    NUMBER,
    TRUE,
    FALSE,
    NULL,
    //==== structural
    COLON,
    COMMA,
    PIPE,
    L_BRACKET,
    R_BRACKET,
    L_CURLY,
    R_CURLY,
    //==== layout
    WS_LF, // primary since the grammar is line oriented
    INDENT(false),
    DEDENT(false),
    WS(false),
    TAB, // primary because a tab can be the active delimiter
    //====
    COMMENT(false),
    INVALID(false),
    EOF;

    public final boolean primary;

    TokenType() {
        this(true);
    }

    TokenType(boolean primary) {
        this.primary = primary;
    }

    public boolean isValue() {
        return switch (this) {
            case STRING, IDENT, NUMBER, TRUE, FALSE, NULL -> true;
            default -> false;
        };
    }

    public boolean isStructural() {
        return switch (this) {
            case COLON, COMMA, PIPE, L_BRACKET, R_BRACKET, L_CURLY, R_CURLY -> true;
            default -> false;
        };
    }

    public boolean isLayout() {
        return switch (this) {
            case WS_LF, INDENT, DEDENT, WS, TAB -> true;
            default -> false;
        };
    }

    public boolean oneOf(TokenType... types) {
        for (TokenType type : types) {
            if (this == type) {
                return true;
            }
        }
        return false;
    }

}
