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
 * Message text for every diagnostic, including the hints that suggest a fix.
 */
public class ErrorMessages {

    private ErrorMessages() {
        // only static methods
    }

    // ========== Lexical ==========

    public static String unterminatedString(char quote) {
        return "Unterminated string. Add closing " + quote + " character before the end of the line.";
    }

    public static String invalidEscape(char c) {
        return "Invalid escape sequence '\\" + c + "'. Valid escapes are \\n \\r \\t \\\\ \\\" and \\'.";
    }

    public static String invalidCharacter(char c) {
        return "Invalid character " + String.format("U+%04X", (int) c) + " in input";
    }

    // ========== Syntax ==========

    public static String expectedPropertyKey(Token found) {
        return "Expected property key but found " + describe(found) + ". " + unexpectedTokenHint(found.type);
    }

    public static String expectedColon(String key, Token found) {
        return "Expected ':' after property key '" + key + "' but found " + describe(found) + ". "
                + missingColonHint(key, found);
    }

    public static String expectedColonAfterHeader(Token found) {
        return "Expected ':' after array header but found " + describe(found);
    }

    public static String expectedRightBracket(Token found) {
        return "Expected ']' to close array size but found " + describe(found);
    }

    public static String expectedRightBrace(Token found) {
        return "Expected '}' to close field list but found " + describe(found);
    }

    public static String expectedFieldName(Token found) {
        return "Expected field name in schema but found " + describe(found);
    }

    public static String expectedDelimiter(Delimiter delimiter, Token found) {
        return "Expected " + delimiter.displayName + " delimiter before " + describe(found)
                + ". This array uses " + delimiter.displayName + " as delimiter.";
    }

    public static String unexpectedListItem(Token found) {
        return "Expected '-' list item but found " + describe(found);
    }

    public static String unexpectedContentAfterTableHeader(Token found) {
        return "Unexpected " + describe(found) + " after table header. Table rows must start on the next line.";
    }

    public static String unexpectedEndOfInput(String context) {
        return "Unexpected end of input while parsing " + context;
    }

    public static String invalidArraySize(Token found) {
        return "Invalid array size " + describe(found) + ". Array size must be a non-negative integer, e.g. [3].";
    }

    public static String emptyDocument() {
        return "Document is empty";
    }

    // ========== Structure ==========

    public static String arraySizeMismatch(int declared, int actual) {
        return "Array size mismatch: declared " + declared + ", found " + actual + " ("
                + difference(declared, actual) + "). " + sizeHint(declared, actual, "element");
    }

    public static String tableSizeMismatch(int declared, int actual) {
        return "Table size mismatch: declared " + declared + ", found " + actual + " ("
                + difference(declared, actual) + "). " + sizeHint(declared, actual, "row");
    }

    public static String tableRowFieldMismatch(int expected, int actual) {
        return "Table row has " + actual + " value" + plural(actual) + " but the schema declares "
                + expected + " field" + plural(expected);
    }

    // ========== Delimiters ==========

    public static String mixedDelimiters(Delimiter active, Delimiter found) {
        return "Mixed delimiters: found " + found.displayName + " where " + active.displayName
                + " is the active delimiter. Ensure all values are separated by " + active.displayName + ".";
    }

    public static String markerBeforeSize(Delimiter marker) {
        return "Delimiter marker " + marker.displayName + " must come after the array size, e.g. [3" + marker.symbol + "]";
    }

    public static String schemaMarkerMismatch(Delimiter active, Delimiter marker) {
        return "Schema marker " + marker.displayName + " does not match the array delimiter " + active.displayName;
    }

    // ========== Indentation ==========

    public static String unexpectedIndentation(int expected, int actual) {
        String hint;
        if (actual > expected) {
            hint = "Over-indented by " + (actual - expected) + ". Child lines must follow a property that opens a block.";
        } else {
            hint = "Under-indented by " + (expected - actual) + ". Check if this line belongs to the correct parent.";
        }
        return "Unexpected indentation: expected " + expected + ", found " + actual + ". " + hint;
    }

    public static String inconsistentIndentation() {
        return "Inconsistent indentation: tabs and spaces are mixed in the same line";
    }

    // ========== Limits ==========

    public static String infiniteLoop(String where) {
        return "Parser made no progress in " + where + ", skipping one token";
    }

    public static String tokenLimit(int max) {
        return "Token count exceeds maximum of " + max
                + ". Increase ToonParserOptions.maxTokenCount to parse larger documents.";
    }

    public static String stringLength(int length, int max) {
        return "String length " + length + " exceeds maximum of " + max
                + ". Increase ToonParserOptions.maxStringLength to allow longer strings.";
    }

    public static String nestingDepth(int max) {
        return "Nesting depth exceeds maximum of " + max
                + ". Increase ToonParserOptions.maxNestingDepth to allow deeper structures.";
    }

    /**
     * @param declared the size as written, which may not fit in a long
     */
    public static String arraySize(String declared, int max) {
        return "Array size " + declared + " exceeds maximum of " + max
                + ". Increase ToonParserOptions.maxArraySize to allow larger arrays.";
    }

    public static String inputTooLarge(long size, int max) {
        return "Input size " + StringUtils.formatFileSize(size) + " exceeds maximum allowed size of "
                + StringUtils.formatFileSize(max) + ". Increase ToonParserOptions.maxInputSize to parse larger inputs.";
    }

    public static String nullSource() {
        return "Source text cannot be null";
    }

    // ========== Hints ==========

    static String missingColonHint(String key, Token found) {
        if (key.endsWith(";") || found.text.startsWith(";")) {
            return "In TOON, use colon ':' not semicolon ';' as separator.";
        }
        if (key.contains("=") || found.text.startsWith("=")) {
            return "In TOON, use colon ':' not equals '=' as separator.";
        }
        if (found.type.isValue()) {
            return "If '" + key + " " + found.text + "' is a multi-word key, quote it. Then add ':' separator.";
        }
        return "Correct format: " + key + ": value";
    }

    static String unexpectedTokenHint(TokenType type) {
        return switch (type) {
            case L_BRACKET -> "Array size notation [n] must come immediately after the property key.";
            case L_CURLY -> "Schema notation {fields} must come after array size [n].";
            case COLON -> "Each property should have exactly one colon separator.";
            case COMMA -> "Commas are only used as array delimiters.";
            case PIPE -> "Pipes are only used as array delimiters when declared with [n|].";
            case R_BRACKET -> "Check for extra or misplaced brackets.";
            case R_CURLY -> "Check for extra or misplaced braces.";
            default -> "Check TOON syntax rules for this context.";
        };
    }

    private static String sizeHint(int declared, int actual, String noun) {
        if (actual == 0) {
            return "No " + noun + "s found. Check that the content is on the correct line and properly indented.";
        }
        if (actual < declared) {
            int missing = declared - actual;
            return "Missing " + missing + " " + noun + plural(missing) + ". Check for incomplete data or a missing delimiter.";
        }
        int extra = actual - declared;
        return "Found " + extra + " extra " + noun + plural(extra) + ". Either change the declared size to ["
                + actual + "] or remove the extra " + noun + plural(extra) + ".";
    }

    private static String difference(int declared, int actual) {
        return actual < declared ? "missing " + (declared - actual) : (actual - declared) + " extra";
    }

    private static String plural(int count) {
        return count == 1 ? "" : "s";
    }

    static String describe(Token token) {
        return switch (token.type) {
            case EOF -> "end of input";
            case WS_LF -> "end of line";
            case TAB -> "tab";
            default -> "'" + StringUtils.truncate(StringUtils.escapeForDisplay(token.text), 40, true) + "'";
        };
    }

}
