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

import io.toonlabs.ast.DocumentNode;

import java.util.List;

/**
 * Outcome of a parse. The document is never null: when the input is badly
 * malformed it holds whatever could be recovered and the problems are listed
 * in {@link #getErrors()}, lexer errors first.
 */
public class ToonParseResult {

    private final DocumentNode document;
    private final List<ToonError> errors;
    private final List<Token> tokens;

    public ToonParseResult(DocumentNode document, List<ToonError> errors, List<Token> tokens) {
        this.document = document == null ? DocumentNode.EMPTY : document;
        this.errors = List.copyOf(errors);
        this.tokens = List.copyOf(tokens);
    }

    public static ToonParseResult rejected(String message) {
        ToonError error = new ToonError(ErrorCode.INPUT_REJECTED, message, 0, 0, 1, 1);
        return new ToonParseResult(DocumentNode.EMPTY, List.of(error), List.of());
    }

    public DocumentNode getDocument() {
        return document;
    }

    public List<ToonError> getErrors() {
        return errors;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasError(ErrorCode code) {
        for (ToonError error : errors) {
            if (error.getErrorCode() == code) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ToonParseResult{properties=" + document.properties().size()
                + ", errors=" + errors.size() + ", tokens=" + tokens.size() + "}";
    }

}
