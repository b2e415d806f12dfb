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

import java.util.Objects;

/**
 * A recoverable diagnostic recorded while lexing or parsing. Unlike
 * {@link ToonException}, which is thrown for input that is rejected outright,
 * errors are collected so that a best-effort tree is always produced.
 */
public class ToonError {

    private final String message;
    private final ErrorCode code;
    private final int offset;
    private final int length;
    private final int line;
    private final int column;

    public ToonError(ErrorCode code, String message, int offset, int length, int line, int column) {
        this.code = Objects.requireNonNull(code);
        this.message = message;
        this.offset = offset;
        this.length = Math.max(0, length);
        this.line = line;
        this.column = column;
    }

    public static ToonError at(Token token, ErrorCode code, String message) {
        return new ToonError(code, message, token.pos, token.length, token.line, token.col);
    }

    public String getMessage() {
        return message;
    }

    public ErrorCode getErrorCode() {
        return code;
    }

    /**
     * @return the stable code string, for example "TOON3001"
     */
    public String getCode() {
        return code.code;
    }

    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }

    public int getEndOffset() {
        return offset + length;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return "[" + code.code + "] " + message + " (line " + line + ", column " + column + ")";
    }

}
