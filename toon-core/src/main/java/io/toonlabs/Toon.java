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
package io.toonlabs;

import io.toonlabs.ast.DocumentNode;
import io.toonlabs.common.Source;
import io.toonlabs.parser.SourceGuard;
import io.toonlabs.parser.Token;
import io.toonlabs.parser.ToonError;
import io.toonlabs.parser.ToonException;
import io.toonlabs.parser.ToonLexer;
import io.toonlabs.parser.ToonParseResult;
import io.toonlabs.parser.ToonParser;
import io.toonlabs.parser.ToonParserOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for parsing TOON text. Every call creates its own lexer and
 * parser, so the methods are safe to use from multiple threads.
 */
public class Toon {

    static final Logger logger = LoggerFactory.getLogger(Toon.class);

    private Toon() {
        // only static methods
    }

    /**
     * Result of {@link #tryParse(String)}. Only input rejected before parsing
     * gives {@code succeeded == false}, a parse that recorded errors still
     * succeeded.
     */
    public record ParseAttempt(boolean succeeded, ToonParseResult result) {

    }

    public static ToonParseResult parse(String text) {
        return parse(text, ToonParserOptions.DEFAULT);
    }

    /**
     * @throws ToonException if the text is null or larger than the configured maximum
     */
    public static ToonParseResult parse(String text, ToonParserOptions options) {
        SourceGuard.check(text, options);
        return doParse(Source.of(text), options);
    }

    public static ToonParseResult parse(Source source, ToonParserOptions options) {
        SourceGuard.check(source == null ? null : source.getText(), options);
        return doParse(source, options);
    }

    private static ToonParseResult doParse(Source source, ToonParserOptions options) {
        long startTime = System.currentTimeMillis();
        ToonLexer lexer = new ToonLexer(source, options);
        List<Token> tokens = lexer.tokenize();
        ToonParser parser = new ToonParser(source, tokens, options);
        DocumentNode document = parser.parse();
        List<ToonError> errors = new ArrayList<>(lexer.getErrors().size() + parser.getErrors().size());
        errors.addAll(lexer.getErrors());
        errors.addAll(parser.getErrors());
        ToonParseResult result = new ToonParseResult(document, errors, tokens);
        if (logger.isDebugEnabled()) {
            logger.debug("parsed {} in {} ms: {} properties, {} tokens, {} errors", source.getPathForLog(),
                    System.currentTimeMillis() - startTime, document.properties().size(), tokens.size(), errors.size());
        }
        return result;
    }

    public static ParseAttempt tryParse(String text) {
        return tryParse(text, ToonParserOptions.DEFAULT);
    }

    public static ParseAttempt tryParse(String text, ToonParserOptions options) {
        try {
            return new ParseAttempt(true, parse(text, options));
        } catch (ToonException e) {
            logger.debug("input rejected: {}", e.getMessage());
            return new ParseAttempt(false, ToonParseResult.rejected(e.getMessage()));
        }
    }

    /**
     * Runs the lexer alone. The list includes layout and comment tokens and
     * always ends with EOF.
     */
    public static List<Token> tokenize(String text) {
        return tokenize(text, ToonParserOptions.DEFAULT);
    }

    public static List<Token> tokenize(String text, ToonParserOptions options) {
        SourceGuard.check(text, options);
        return List.copyOf(new ToonLexer(Source.of(text), options).tokenize());
    }

}
