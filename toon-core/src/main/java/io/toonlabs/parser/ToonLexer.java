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

import java.util.List;

import static io.toonlabs.parser.TokenType.*;

/**
 * Hand-rolled, single pass lexer for TOON. Never throws: malformed input is
 * reported through {@link #getErrors()} and still produces tokens, so that the
 * token list always covers the scanned source without gaps.
 */
public class ToonLexer extends BaseLexer {

    private final int maxTokenCount;
    private final int maxStringLength;

    private int tokenCount;
    private Token stopToken;

    // line layout state
    private boolean atLineStart = true;
    private boolean checkDedent;
    private int lineIndent;
    private int previousIndent;

    // decoded value of the token being scanned, null when it equals the raw text
    private String value;

    public ToonLexer(Source source) {
        this(source, ToonParserOptions.DEFAULT);
    }

    public ToonLexer(Source source, ToonParserOptions options) {
        super(source);
        this.maxTokenCount = options.getMaxTokenCount();
        this.maxStringLength = options.getMaxStringLength();
    }

    public static List<Token> tokenize(String text) {
        return new ToonLexer(Source.of(text)).tokenize();
    }

    // ========== Public API ==========

    @Override
    public Token nextToken() {
        if (stopToken != null) {
            return stopToken;
        }
        markTokenStart();
        value = null;
        TokenType type = scanToken();
        String raw = text.substring(tokenStart, pos);
        Token token = new Token(type, raw, value == null ? raw : value, tokenStart, tokenLine, tokenCol);
        if (type == EOF) {
            return token;
        }
        if (++tokenCount > maxTokenCount) {
            error(token, ErrorCode.TOKEN_LIMIT_EXCEEDED, ErrorMessages.tokenLimit(maxTokenCount));
            stopToken = new Token(EOF, "", "", tokenStart, tokenLine, tokenCol);
            return stopToken;
        }
        if ((type == STRING || type == IDENT) && token.value.length() > maxStringLength) {
            error(token, ErrorCode.STRING_LENGTH_EXCEEDED, ErrorMessages.stringLength(token.value.length(), maxStringLength));
        }
        return token;
    }

    public int getTokenCount() {
        return tokenCount;
    }

    // ========== Main Scanner ==========

    protected TokenType scanToken() {
        if (atLineStart) {
            atLineStart = false;
            checkDedent = true;
            while (peek() == ' ' || peek() == '\t') {
                advance();
            }
            lineIndent = pos - tokenStart;
            if (lineIndent > 0) {
                return INDENT;
            }
        }
        if (checkDedent) {
            checkDedent = false;
            if (hasContent()) {
                boolean dedent = lineIndent < previousIndent;
                previousIndent = lineIndent;
                if (dedent) {
                    return DEDENT;
                }
            }
        }
        if (isAtEnd()) {
            return EOF;
        }
        char c = peek();
        switch (c) {
            case '\n':
                advance();
                atLineStart = true;
                return WS_LF;
            case '\r':
                advance();
                match('\n');
                atLineStart = true;
                return WS_LF;
            case ' ':
                while (peek() == ' ') {
                    advance();
                }
                return WS;
            case '\t':
                advance();
                return TAB;
            case '#':
                return scanComment();
            case '"':
            case '\'':
                return scanString(c);
            case ':':
                advance();
                return COLON;
            case ',':
                advance();
                return COMMA;
            case '|':
                advance();
                return PIPE;
            case '[':
                advance();
                return L_BRACKET;
            case ']':
                advance();
                return R_BRACKET;
            case '{':
                advance();
                return L_CURLY;
            case '}':
                advance();
                return R_CURLY;
        }
        if (c == '/' && peek(1) == '/') {
            return scanComment();
        }
        if (isInvalid(c)) {
            advance();
            error(ErrorCode.INVALID_CHARACTER, ErrorMessages.invalidCharacter(c), tokenStart, 1, tokenLine, tokenCol);
            return INVALID;
        }
        if (c == '-' || isDigit(c)) {
            return scanNumber();
        }
        return scanWord();
    }

    private boolean hasContent() {
        if (isAtEnd()) {
            return false;
        }
        char c = peek();
        return !isLineEnd(c) && c != '#' && !(c == '/' && peek(1) == '/');
    }

    // ========== Comments ==========

    private TokenType scanComment() {
        while (!isAtEnd() && !isLineEnd(peek())) {
            advance();
        }
        return COMMENT;
    }

    // ========== Strings ==========

    private TokenType scanString(char quote) {
        advance();
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (isAtEnd() || isLineEnd(peek())) {
                error(ErrorCode.UNTERMINATED_STRING, ErrorMessages.unterminatedString(quote),
                        tokenStart, pos - tokenStart, tokenLine, tokenCol);
                break;
            }
            char c = advance();
            if (c == quote) {
                break;
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (isAtEnd() || isLineEnd(peek())) {
                sb.append('\\');
                continue;
            }
            int escapeStart = pos - 1;
            int escapeCol = col - 1;
            char e = advance();
            switch (e) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case '\\', '"', '\'' -> sb.append(e);
                default -> {
                    // kept verbatim so the value still shows what was written
                    sb.append('\\').append(e);
                    error(ErrorCode.INVALID_ESCAPE_SEQUENCE, ErrorMessages.invalidEscape(e), escapeStart, 2, line, escapeCol);
                }
            }
        }
        value = sb.toString();
        return STRING;
    }

    // ========== Numbers and Words ==========

    private TokenType scanNumber() {
        match('-');
        if (!isDigit(peek())) {
            return scanWord();
        }
        int intStart = pos;
        while (isDigit(peek())) {
            advance();
        }
        int intDigits = pos - intStart;
        if (peek() == '.' && isDigit(peek(1))) {
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        if (peek() == 'e' || peek() == 'E') {
            int signed = (peek(1) == '+' || peek(1) == '-') ? 1 : 0;
            if (isDigit(peek(1 + signed))) {
                advance();
                if (signed == 1) {
                    advance();
                }
                while (isDigit(peek())) {
                    advance();
                }
            }
        }
        if (isWordChar()) {
            // e.g. 1.2.3 or 2024-01-01
            return scanWord();
        }
        if (intDigits > 1 && text.charAt(intStart) == '0') {
            return STRING;
        }
        return NUMBER;
    }

    private TokenType scanWord() {
        while (isWordChar()) {
            advance();
        }
        if (pos == tokenStart) {
            // never expected, but guarantees progress
            advance();
        }
        String word = text.substring(tokenStart, pos);
        return switch (word) {
            case "true" -> TRUE;
            case "false" -> FALSE;
            case "null" -> NULL;
            default -> IDENT;
        };
    }

    private boolean isWordChar() {
        if (isAtEnd()) {
            return false;
        }
        char c = peek();
        return switch (c) {
            case ' ', '\t', '\n', '\r', ':', ',', '|', '[', ']', '{', '}', '#' -> false;
            case '/' -> peek(1) != '/';
            default -> !isInvalid(c);
        };
    }

}
