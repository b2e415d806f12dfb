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
import java.util.List;
import java.util.Optional;

public record ObjectNode(List<PropertyNode> properties, Span span) implements Node {

    public ObjectNode {
        properties = List.copyOf(properties);
    }

    @Override
    public NodeType type() {
        return NodeType.OBJECT;
    }

    /**
     * Duplicate keys are kept in the tree, the last one wins for lookups.
     */
    public Optional<Node> get(String key) {
        return Properties.last(properties, key).map(PropertyNode::value);
    }

    public Optional<PropertyNode> getProperty(String key) {
        return Properties.last(properties, key);
    }

    public List<String> keys() {
        List<String> keys = new ArrayList<>(properties.size());
        for (PropertyNode property : properties) {
            keys.add(property.key());
        }
        return keys;
    }

    public int size() {
        return properties.size();
    }

    public boolean isEmpty() {
        return properties.isEmpty();
    }

}
