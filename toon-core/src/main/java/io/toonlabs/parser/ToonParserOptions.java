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

import java.math.BigDecimal;
import java.util.Map;

/**
 * Limits that protect the lexer and parser against hostile or runaway input.
 * Instances are immutable and can be shared across threads.
 * Supports both the Builder pattern and a Map constructor for configuration
 * loaded from JSON or similar sources.
 */
public class ToonParserOptions {

    public static final int DEFAULT_MAX_INPUT_SIZE = 10 * 1024 * 1024;
    public static final int DEFAULT_MAX_TOKEN_COUNT = 1_000_000;
    public static final int DEFAULT_MAX_STRING_LENGTH = 65_536;
    public static final int DEFAULT_MAX_NESTING_DEPTH = 100;
    public static final int DEFAULT_MAX_ARRAY_SIZE = 1_000_000;

    public static final ToonParserOptions DEFAULT = builder().build();

    public static final ToonParserOptions UNLIMITED = builder()
            .maxInputSize(Integer.MAX_VALUE)
            .maxTokenCount(Integer.MAX_VALUE)
            .maxStringLength(Integer.MAX_VALUE)
            .maxNestingDepth(Integer.MAX_VALUE)
            .maxArraySize(Integer.MAX_VALUE)
            .build();

    private final int maxInputSize;
    private final int maxTokenCount;
    private final int maxStringLength;
    private final int maxNestingDepth;
    private final int maxArraySize;

    private ToonParserOptions(Builder builder) {
        this.maxInputSize = builder.maxInputSize;
        this.maxTokenCount = builder.maxTokenCount;
        this.maxStringLength = builder.maxStringLength;
        this.maxNestingDepth = builder.maxNestingDepth;
        this.maxArraySize = builder.maxArraySize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
                .maxInputSize(maxInputSize)
                .maxTokenCount(maxTokenCount)
                .maxStringLength(maxStringLength)
                .maxNestingDepth(maxNestingDepth)
                .maxArraySize(maxArraySize);
    }

    public static ToonParserOptions fromMap(Map<String, Object> map) {
        Builder builder = builder();
        if (map == null) {
            return builder.build();
        }
        if (map.containsKey("maxInputSize")) {
            builder.maxInputSize(toInt("maxInputSize", map.get("maxInputSize")));
        }
        if (map.containsKey("maxTokenCount")) {
            builder.maxTokenCount(toInt("maxTokenCount", map.get("maxTokenCount")));
        }
        if (map.containsKey("maxStringLength")) {
            builder.maxStringLength(toInt("maxStringLength", map.get("maxStringLength")));
        }
        if (map.containsKey("maxNestingDepth")) {
            builder.maxNestingDepth(toInt("maxNestingDepth", map.get("maxNestingDepth")));
        }
        if (map.containsKey("maxArraySize")) {
            builder.maxArraySize(toInt("maxArraySize", map.get("maxArraySize")));
        }
        return builder.build();
    }

    private static int toInt(String name, Object value) {
        try {
            // fractions and values beyond int range are rejected, never truncated
            return new BigDecimal(String.valueOf(value).trim()).intValueExact();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, was: " + value, e);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(name + " must be a whole number within int range, was: " + value, e);
        }
    }

    // Getters

    public int getMaxInputSize() {
        return maxInputSize;
    }

    public int getMaxTokenCount() {
        return maxTokenCount;
    }

    public int getMaxStringLength() {
        return maxStringLength;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public int getMaxArraySize() {
        return maxArraySize;
    }

    @Override
    public String toString() {
        return "ToonParserOptions{maxInputSize=" + StringUtils.formatFileSize(maxInputSize)
                + ", maxTokenCount=" + maxTokenCount
                + ", maxStringLength=" + maxStringLength
                + ", maxNestingDepth=" + maxNestingDepth
                + ", maxArraySize=" + maxArraySize + "}";
    }

    public static class Builder {

        private int maxInputSize = DEFAULT_MAX_INPUT_SIZE;
        private int maxTokenCount = DEFAULT_MAX_TOKEN_COUNT;
        private int maxStringLength = DEFAULT_MAX_STRING_LENGTH;
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
        private int maxArraySize = DEFAULT_MAX_ARRAY_SIZE;

        private Builder() {
        }

        public Builder maxInputSize(int maxInputSize) {
            this.maxInputSize = positive("maxInputSize", maxInputSize);
            return this;
        }

        public Builder maxTokenCount(int maxTokenCount) {
            this.maxTokenCount = positive("maxTokenCount", maxTokenCount);
            return this;
        }

        public Builder maxStringLength(int maxStringLength) {
            this.maxStringLength = positive("maxStringLength", maxStringLength);
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = positive("maxNestingDepth", maxNestingDepth);
            return this;
        }

        public Builder maxArraySize(int maxArraySize) {
            this.maxArraySize = positive("maxArraySize", maxArraySize);
            return this;
        }

        private static int positive(String name, int value) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be at least 1, was: " + value);
            }
            return value;
        }

        public ToonParserOptions build() {
            return new ToonParserOptions(this);
        }

    }

}
