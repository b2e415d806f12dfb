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

/**
 * The three delimiters that separate array values and table fields.
 */
public enum Delimiter {

    COMMA(',', TokenType.COMMA, "comma (,)"),
    TAB('\t', TokenType.TAB, "tab character"),
    PIPE('|', TokenType.PIPE, "pipe (|)");

    public final char symbol;
    public final TokenType tokenType;
    public final String displayName;

    Delimiter(char symbol, TokenType tokenType, String displayName) {
        this.symbol = symbol;
        this.tokenType = tokenType;
        this.displayName = displayName;
    }

    /**
     * @return the delimiter a token represents, or null if it is not a delimiter
     */
    public static Delimiter of(TokenType type) {
        return switch (type) {
            case COMMA -> COMMA;
            case TAB -> TAB;
            case PIPE -> PIPE;
            default -> null;
        };
    }

}
