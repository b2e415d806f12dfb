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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static io.toonlabs.parser.TokenType.*;

/**
 * Abstract base class for line oriented parsers. Holds the cursor over the
 * primary tokens, records errors instead of throwing, and provides the single
 * recovery routine used by every failure path.
 */
public abstract class BaseParser {

    static final Logger logger = LoggerFactory.getLogger(BaseParser.class);

    protected final Source source;
    protected final List<Token> tokens;
    private final int size;
    private final Token eof;

    private int position = 0;
    private Token lastSignificant;

    private final List<ToonError> errors = new ArrayList<>();

    protected BaseParser(Source source, List<Token> allTokens) {
        this.source = source;
        List<Token> primary = new ArrayList<>(allTokens.size());
        for (Token token : allTokens) {
            if (token.type.primary) {
                primary.add(token);
            }
        }
        Token last = primary.isEmpty() ? null : primary.get(primary.size() - 1);
        if (last == null || last.type != EOF) {
            int end = source.getLength();
            eof = new Token(EOF, "", "", end, source.getLineCount(), 1);
        } else {
            eof = last;
            primary.remove(primary.size() - 1);
        }
        this.tokens = primary;
        this.size = primary.size();
        this.lastSignificant = eof;
    }

    /**
     * @return count of leading whitespace characters on the token's line
     */
    protected abstract int indentOf(Token token);

    /**
     * Hook for tokens that are layout in the current context, and therefore
     * invisible to {@link #peekToken()}.
     */
    protected boolean isSkipped(Token token) {
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int start = Math.max(0, position - 7);
        int end = Math.min(position + 7, size);
        for (int i = start; i < end; i++) {
            if (i == 0) {
                sb.append("| ");
            }
            if (i == position) {
                sb.append(">>");
            }
            sb.append(tokens.get(i));
            sb.append(' ');
        }
        if (position == size) {
            sb.append(">>");
        }
        sb.append("|");
        return sb.toString();
    }

    // ========== Errors ==========

    protected void error(ErrorCode code, String message) {
        error(peekToken(), code, message);
    }

    protected void error(Token token, ErrorCode code, String message) {
        ToonError error = ToonError.at(token, code, message);
        if (logger.isTraceEnabled()) {
            logger.trace("{} {}, parser state: {}", source.getPathForLog(), error, this);
        }
        errors.add(error);
    }

    protected void error(ToonError error) {
        errors.add(error);
    }

    /**
     * @return list of errors collected during parsing
     */
    public List<ToonError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    // ========== Error Recovery ==========

    /**
     * Skips the rest of the current line, then every following line that is
     * indented deeper than the given level. Parsing resumes at the first line
     * that belongs to the enclosing block.
     */
    protected void recoverToIndent(int indent) {
        skipToLineEnd();
        while (true) {
            Token next = peekPastNewlines();
            if (next.type == EOF || indentOf(next) <= indent) {
                return;
            }
            skipNewlines();
            skipToLineEnd();
        }
    }

    /**
     * Guards block loops: if an iteration consumed nothing, one token is
     * forced forward so that the loop always terminates.
     */
    protected void checkProgress(int startPosition, String where) {
        if (position != startPosition) {
            return;
        }
        Token token = peekToken();
        error(token, ErrorCode.INFINITE_LOOP_DETECTED, ErrorMessages.infiniteLoop(where));
        if (token.type != EOF) {
            position++;
        }
    }

    // ========== Cursor ==========

    protected int getPosition() {
        return position;
    }

    protected TokenType peek() {
        return peekToken().type;
    }

    protected Token peekToken() {
        while (position < size && isSkipped(tokens.get(position))) {
            position++;
        }
        return position == size ? eof : tokens.get(position);
    }

    /**
     * @param ahead 0 for the current token
     */
    protected Token peekToken(int ahead) {
        int index = position;
        int seen = -1;
        while (index < size) {
            Token token = tokens.get(index++);
            if (!isSkipped(token) && ++seen == ahead) {
                return token;
            }
        }
        return eof;
    }

    /**
     * Returns the current token even if the context would normally skip it.
     */
    protected Token peekRaw() {
        return position == size ? eof : tokens.get(position);
    }

    protected Token nextRaw() {
        Token token = peekRaw();
        advanceTo(token);
        return token;
    }

    protected Token next() {
        Token token = peekToken();
        advanceTo(token);
        return token;
    }

    private void advanceTo(Token token) {
        if (position < size) {
            position++;
        }
        if (token.type != WS_LF && token.type != EOF) {
            lastSignificant = token;
        }
    }

    /**
     * @return the last token consumed that is not a line end
     */
    protected Token lastSignificant() {
        return lastSignificant;
    }

    // ========== Lines ==========

    protected boolean atLineEnd() {
        TokenType type = peek();
        return type == WS_LF || type == EOF;
    }

    protected void skipToLineEnd() {
        while (!atLineEnd()) {
            next();
        }
    }

    protected void skipNewlines() {
        while (peek() == WS_LF) {
            next();
        }
    }

    /**
     * Looks past line ends without consuming them.
     */
    protected Token peekPastNewlines() {
        int index = position;
        while (index < size) {
            Token token = tokens.get(index++);
            if (token.type != WS_LF && !isSkipped(token)) {
                return token;
            }
        }
        return eof;
    }

}
