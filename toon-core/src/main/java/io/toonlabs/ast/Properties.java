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

import java.util.List;
import java.util.Optional;

class Properties {

    private Properties() {
        // only static methods
    }

    static Optional<PropertyNode> last(List<PropertyNode> properties, String key) {
        for (int i = properties.size() - 1; i >= 0; i--) {
            PropertyNode property = properties.get(i);
            if (property.key().equals(key)) {
                return Optional.of(property);
            }
        }
        return Optional.empty();
    }

    /**
     * Walks a dotted path through nested objects, for example "server.tls.port".
     * Documents and objects are descended into, any other node ends the walk.
     */
    static Optional<Node> find(List<PropertyNode> properties, String path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        String[] keys = path.split("\\.", -1);
        List<PropertyNode> current = properties;
        Node found = null;
        for (int i = 0; i < keys.length; i++) {
            if (current == null) {
                return Optional.empty();
            }
            Optional<PropertyNode> property = last(current, keys[i]);
            if (property.isEmpty()) {
                return Optional.empty();
            }
            found = property.get().value();
            current = found instanceof ObjectNode object ? object.properties() : null;
        }
        return Optional.ofNullable(found);
    }

}
