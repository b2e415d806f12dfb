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

import java.util.ArrayList;
import java.util.List;

import static io.toonlabs.parser.TokenType.*;

/**
 * Abstract base class for lexers. Provides common utilities for character
 * handling, position tracking, error collection and tokenization.
 */
public abstract class BaseLexer {

    protected final Source source;
    protected final String text;
    protected final int length;

    protected int pos;
    protected int line;
    protected int col;
    protected int tokenStart;
    protected int tokenLine;
    protected int tokenCol;

    private final List<ToonError> errors = new ArrayList<>();

    protected BaseLexer(Source source) {
        this.source = source;
        this.text = source.getText();
        this.length = text.length();
        this.pos = 0;
        this.line = 1;
        this.col = 1;
    }

    // ========== Public API ==========

    public abstract Token nextToken();

    /**
     * Tokenizes the whole source, including layout and comment tokens.
     * The last token is always EOF.
     */
    public List<Token> tokenize() {
        List<Token> list = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            list.add(token);
        } while (token.type != EOF);
        return list;
    }

    public List<ToonError> getErrors() {
        return errors;
    }

    // ========== Errors ==========

    protected void error(ErrorCode code, String message, int offset, int errorLength, int errorLine, int errorCol) {
        errors.add(new ToonError(code, message, offset, errorLength, errorLine, errorCol));
    }

    protected void error(Token token, ErrorCode code, String message) {
        errors.add(ToonError.at(token, code, message));
    }

    // ========== Character Utilities ==========

    protected boolean isAtEnd() {
        return pos >= length;
    }

    protected char peek() {
        return pos >= length ? '\0' : text.charAt(pos);
    }

    protected char peek(int offset) {
        int index = pos + offset;
        return (index < 0 || index >= length) ? '\0' : text.charAt(index);
    }

    protected char advance() {
        char c = text.charAt(pos++);
        if (c == '\n' || (c == '\r' && peek() != '\n')) {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    protected boolean match(char expected) {
        if (pos >= length || text.charAt(pos) != expected) {
            return false;
        }
        advance();
        return true;
    }

    protected void markTokenStart() {
        tokenStart = pos;
        tokenLine = line;
        tokenCol = col;
    }

    // ========== Character Classification ==========

    protected static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    protected static boolean isLineEnd(char c) {
        return c == '\n' || c == '\r';
    }

    protected static boolean isInvalid(char c) {
        return Character.isISOControl(c) && c != '\t' && c != '\n' && c != '\r';
    }

}
