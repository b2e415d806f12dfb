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

import io.toonlabs.common.StringUtils;
import net.minidev.json.JSONValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions of a syntax tree into plain Java collections, JSON text and an
 * indented debug dump.
 */
public class Nodes {

    private Nodes() {
        // only static methods
    }

    /**
     * Converts a node to Map, List, String, Long, Double, Boolean or null.
     * Duplicate keys resolve to the last value. Table rows become maps keyed
     * by the schema fields.
     */
    public static Object toJava(Node node) {
        return switch (node.type()) {
            case DOCUMENT -> toMap(((DocumentNode) node).properties());
            case OBJECT -> toMap(((ObjectNode) node).properties());
            case PROPERTY -> {
                PropertyNode property = (PropertyNode) node;
                Map<String, Object> map = new LinkedHashMap<>(1);
                map.put(property.key(), toJava(property.value()));
                yield map;
            }
            case ARRAY -> {
                List<Node> elements = ((ArrayNode) node).elements();
                List<Object> list = new ArrayList<>(elements.size());
                for (Node element : elements) {
                    list.add(toJava(element));
                }
                yield list;
            }
            case TABLE_ARRAY -> {
                TableArrayNode table = (TableArrayNode) node;
                List<Object> list = new ArrayList<>(table.size());
                for (int i = 0; i < table.size(); i++) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    table.getRow(i).forEach((k, v) -> row.put(k, v.toJava()));
                    list.add(row);
                }
                yield list;
            }
            case STRING, NUMBER, BOOLEAN, NULL -> ((ValueNode) node).toJava();
        };
    }

    private static Map<String, Object> toMap(List<PropertyNode> properties) {
        Map<String, Object> map = new LinkedHashMap<>(properties.size());
        for (PropertyNode property : properties) {
            map.put(property.key(), toJava(property.value()));
        }
        return map;
    }

    public static String toJson(Node node) {
        return JSONValue.toJSONString(toJava(node));
    }

    /**
     * @return every property in the tree, depth first in source order
     */
    public static List<PropertyNode> allProperties(Node node) {
        List<PropertyNode> list = new ArrayList<>();
        collect(node, list);
        return list;
    }

    private static void collect(Node node, List<PropertyNode> list) {
        switch (node.type()) {
            case DOCUMENT -> ((DocumentNode) node).properties().forEach(p -> collect(p, list));
            case OBJECT -> ((ObjectNode) node).properties().forEach(p -> collect(p, list));
            case PROPERTY -> {
                PropertyNode property = (PropertyNode) node;
                list.add(property);
                collect(property.value(), list);
            }
            case ARRAY -> ((ArrayNode) node).elements().forEach(e -> collect(e, list));
            case TABLE_ARRAY, STRING, NUMBER, BOOLEAN, NULL -> {
                // no properties below
            }
        }
    }

    public static String toDebugString(Node node) {
        StringBuilder sb = new StringBuilder();
        recurse(sb, 0, node);
        return sb.toString();
    }

    private static void spaces(StringBuilder sb, int level) {
        sb.append(StringUtils.repeat(' ', level * 2));
    }

    private static void recurse(StringBuilder sb, int level, Node node) {
        spaces(sb, level);
        sb.append(node.type());
        switch (node.type()) {
            case DOCUMENT -> {
                sb.append('\n');
                ((DocumentNode) node).properties().forEach(p -> recurse(sb, level + 1, p));
            }
            case OBJECT -> {
                sb.append('\n');
                ((ObjectNode) node).properties().forEach(p -> recurse(sb, level + 1, p));
            }
            case PROPERTY -> {
                PropertyNode property = (PropertyNode) node;
                sb.append(' ').append(property.key()).append(" @").append(property.span()).append('\n');
                recurse(sb, level + 1, property.value());
            }
            case ARRAY -> {
                ArrayNode array = (ArrayNode) node;
                sb.append(" [").append(array.declaredSize()).append("]\n");
                array.elements().forEach(e -> recurse(sb, level + 1, e));
            }
            case TABLE_ARRAY -> {
                TableArrayNode table = (TableArrayNode) node;
                sb.append(" [").append(table.declaredSize()).append("]").append(table.fields()).append('\n');
                for (List<ValueNode> row : table.rows()) {
                    spaces(sb, level + 1);
                    List<Object> values = new ArrayList<>(row.size());
                    for (ValueNode value : row) {
                        values.add(value.toJava());
                    }
                    sb.append(values).append('\n');
                }
            }
            case STRING, NUMBER, BOOLEAN, NULL -> sb.append(' ').append(((ValueNode) node).raw()).append('\n');
        }
    }

}
