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
 * Stable diagnostic codes. The leading digit groups codes by category:
 * 1 lexical, 2 syntax, 3 structural size, 4 delimiter, 5 indentation and
 * 9 parser limits and safeguards.
 */
public enum ErrorCode {

    UNTERMINATED_STRING("TOON1001"),
    INVALID_ESCAPE_SEQUENCE("TOON1002"),
    INVALID_CHARACTER("TOON1003"),
    EXPECTED_PROPERTY_KEY("TOON2001"),
    EXPECTED_COLON("TOON2002"),
    EXPECTED_RIGHT_BRACKET("TOON2003"),
    EXPECTED_RIGHT_BRACE("TOON2004"),
    EXPECTED_FIELD_NAME("TOON2005"),
    EXPECTED_DELIMITER("TOON2006"),
    UNEXPECTED_TOKEN("TOON2007"),
    UNEXPECTED_END_OF_INPUT("TOON2008"),
    INVALID_ARRAY_SIZE("TOON2009"),
    EMPTY_DOCUMENT("TOON2010"),
    ARRAY_SIZE_MISMATCH("TOON3001"),
    TABLE_SIZE_MISMATCH("TOON3002"),
    TABLE_ROW_FIELD_MISMATCH("TOON3003"),
    MIXED_DELIMITERS("TOON4001"),
    DELIMITER_MARKER_MISPLACED("TOON4002"),
    UNEXPECTED_INDENTATION("TOON5001"),
    INCONSISTENT_INDENTATION("TOON5002"),
    INFINITE_LOOP_DETECTED("TOON9001"),
    TOKEN_LIMIT_EXCEEDED("TOON9002"),
    STRING_LENGTH_EXCEEDED("TOON9003"),
    NESTING_DEPTH_EXCEEDED("TOON9004"),
    ARRAY_SIZE_LIMIT_EXCEEDED("TOON9005"),
    INPUT_REJECTED("TOON9006");

    public enum Category {
        LEXICAL, SYNTAX, STRUCTURE, DELIMITER, INDENTATION, LIMIT
    }

    public final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public Category category() {
        return switch (code.charAt(4)) {
            case '1' -> Category.LEXICAL;
            case '2' -> Category.SYNTAX;
            case '3' -> Category.STRUCTURE;
            case '4' -> Category.DELIMITER;
            case '5' -> Category.INDENTATION;
            default -> Category.LIMIT;
        };
    }

    public static ErrorCode fromCode(String code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code.equals(code)) {
                return errorCode;
            }
        }
        throw new IllegalArgumentException("unknown error code: " + code);
    }

    @Override
    public String toString() {
        return code;
    }

}
