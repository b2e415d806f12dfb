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
package io.toonlabs.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tabular array: a field schema followed by one row of values per line.
 * Rows whose width differs from the schema are kept as written.
 *
 * @param declaredSize the size written in the header, -1 when it could not be read
 */
public record TableArrayNode(int declaredSize, List<String> fields, List<List<ValueNode>> rows, Span span) implements Node {

    public TableArrayNode {
        fields = List.copyOf(fields);
        List<List<ValueNode>> copy = new ArrayList<>(rows.size());
        for (List<ValueNode> row : rows) {
            copy.add(List.copyOf(row));
        }
        rows = List.copyOf(copy);
    }

    @Override
    public NodeType type() {
        return NodeType.TABLE_ARRAY;
    }

    public boolean hasDeclaredSize() {
        return declaredSize >= 0;
    }

    public int size() {
        return rows.size();
    }

    /**
     * Pairs the cells of a row with the schema. Missing cells are left out,
     * cells beyond the schema are dropped.
     */
    public Map<String, ValueNode> getRow(int index) {
        List<ValueNode> row = rows.get(index);
        Map<String, ValueNode> map = new LinkedHashMap<>();
        int count = Math.min(fields.size(), row.size());
        for (int i = 0; i < count; i++) {
            map.put(fields.get(i), row.get(i));
        }
        return map;
    }

}
