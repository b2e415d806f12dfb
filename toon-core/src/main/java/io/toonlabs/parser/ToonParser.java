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

import io.toonlabs.ast.ArrayNode;
import io.toonlabs.ast.BooleanNode;
import io.toonlabs.ast.DocumentNode;
import io.toonlabs.ast.Node;
import io.toonlabs.ast.NullNode;
import io.toonlabs.ast.NumberNode;
import io.toonlabs.ast.ObjectNode;
import io.toonlabs.ast.PropertyNode;
import io.toonlabs.ast.Span;
import io.toonlabs.ast.StringNode;
import io.toonlabs.ast.TableArrayNode;
import io.toonlabs.ast.ValueNode;
import io.toonlabs.common.Source;
import io.toonlabs.common.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.toonlabs.parser.TokenType.*;

/**
 * Resilient recursive-descent parser for TOON. Structure is driven by line
 * indentation, measured from the source, and by the delimiter scope of the
 * enclosing array. Every problem is recorded as a {@link ToonError} and
 * parsing resumes at the next line that belongs to the enclosing block, so a
 * document is always produced.
 */
public class ToonParser extends BaseParser {

    private final ToonParserOptions options;
    private final ScopeTracker scopes;
    private final Set<Integer> mixedIndentLines = new HashSet<>();

    private int depth;

    public ToonParser(Source source, List<Token> tokens) {
        this(source, tokens, ToonParserOptions.DEFAULT);
    }

    public ToonParser(Source source, List<Token> tokens, ToonParserOptions options) {
        super(source, tokens);
        this.options = options;
        this.scopes = new ScopeTracker(source);
    }

    @Override
    protected int indentOf(Token token) {
        return scopes.indentOf(token.line);
    }

    @Override
    protected boolean isSkipped(Token token) {
        // a tab is layout unless it separates values in the current scope
        return token.type == TAB && scopes.current() != Delimiter.TAB;
    }

    /**
     * Same as {@link #indentOf(Token)} but also reports tabs and spaces mixed
     * in the leading whitespace, once per line.
     */
    private int lineIndent(Token token) {
        int indent = scopes.indentOf(token.line);
        if (scopes.hasMixedIndent(token.line) && mixedIndentLines.add(token.line)) {
            int start = source.getLineStart(token.line);
            error(new ToonError(ErrorCode.INCONSISTENT_INDENTATION, ErrorMessages.inconsistentIndentation(),
                    start, indent, token.line, 1));
        }
        return indent;
    }

    // ========== Document ==========

    public DocumentNode parse() {
        if (StringUtils.isBlank(source.getText())) {
            error(ErrorCode.EMPTY_DOCUMENT, ErrorMessages.emptyDocument());
            return DocumentNode.EMPTY;
        }
        skipNewlines();
        Token first = peekToken();
        if (first.type == EOF) {
            // only comments
            return DocumentNode.EMPTY;
        }
        int blockIndent = lineIndent(first);
        if (blockIndent > 0) {
            error(first, ErrorCode.UNEXPECTED_INDENTATION, ErrorMessages.unexpectedIndentation(0, blockIndent));
        }
        List<PropertyNode> properties = new ArrayList<>();
        while (true) {
            int start = getPosition();
            properties.addAll(parseProperties(blockIndent));
            skipNewlines();
            Token next = peekToken();
            if (next.type == EOF) {
                break;
            }
            blockIndent = lineIndent(next);
            checkProgress(start, "document");
        }
        return new DocumentNode(properties, Span.between(first, lastSignificant()));
    }

    // ========== Properties ==========

    private List<PropertyNode> parseProperties(int blockIndent) {
        List<PropertyNode> properties = new ArrayList<>();
        while (true) {
            skipNewlines();
            Token token = peekToken();
            if (token.type == EOF) {
                break;
            }
            int indent = lineIndent(token);
            if (indent < blockIndent) {
                break;
            }
            int start = getPosition();
            if (indent > blockIndent) {
                error(token, ErrorCode.UNEXPECTED_INDENTATION, ErrorMessages.unexpectedIndentation(blockIndent, indent));
                recoverToIndent(blockIndent);
            } else {
                PropertyNode property = parseProperty(indent);
                if (property != null) {
                    properties.add(property);
                }
            }
            checkProgress(start, "properties");
        }
        return properties;
    }

    private PropertyNode parseProperty(int indent) {
        Token keyToken = peekToken();
        if (!keyToken.type.isValue()) {
            error(keyToken, ErrorCode.EXPECTED_PROPERTY_KEY, ErrorMessages.expectedPropertyKey(keyToken));
            recoverToIndent(indent);
            return null;
        }
        next();
        String key = keyToken.value;
        Header header = peek() == L_BRACKET ? parseHeader() : null;
        try {
            Token found = peekToken();
            if (found.type != COLON) {
                Token at = (found.type == WS_LF || found.type == EOF) ? keyToken : found;
                String message = header == null
                        ? ErrorMessages.expectedColon(key, found)
                        : ErrorMessages.expectedColonAfterHeader(found);
                error(at, ErrorCode.EXPECTED_COLON, message);
                recoverToIndent(indent);
                return null;
            }
            next();
            Node value = header == null ? parseValue(indent, keyToken) : parseArray(header, indent);
            return new PropertyNode(key, value, indent, Span.between(keyToken, lastSignificant()));
        } finally {
            if (header != null) {
                scopes.pop();
            }
        }
    }

    private Node parseValue(int indent, Token keyToken) {
        if (!atLineEnd()) {
            return parseSimpleValue();
        }
        Token next = peekPastNewlines();
        if (next.type == EOF || indentOf(next) <= indent) {
            return new ObjectNode(List.of(), Span.of(lastSignificant()));
        }
        return parseObject(indent, keyToken);
    }

    private Node parseObject(int indent, Token anchor) {
        if (!enterDepth(anchor)) {
            recoverToIndent(indent);
            return new NullNode(StringUtils.EMPTY, Span.of(anchor));
        }
        try {
            skipNewlines();
            Token first = peekToken();
            List<PropertyNode> properties = parseProperties(lineIndent(first));
            return new ObjectNode(properties, Span.between(first, lastSignificant()));
        } finally {
            depth--;
        }
    }

    private boolean enterDepth(Token at) {
        if (depth >= options.getMaxNestingDepth()) {
            error(at, ErrorCode.NESTING_DEPTH_EXCEEDED, ErrorMessages.nestingDepth(options.getMaxNestingDepth()));
            return false;
        }
        depth++;
        return true;
    }

    // ========== Values ==========

    /**
     * Everything up to the end of the line is one value. A single token keeps
     * its literal kind, several tokens become the string covering them.
     */
    private ValueNode parseSimpleValue() {
        Token first = next();
        Token last = first;
        while (!atLineEnd()) {
            last = next();
        }
        if (first == last) {
            return literal(first);
        }
        return joined(first, last);
    }

    private ValueNode literal(Token token) {
        Span span = Span.of(token);
        return switch (token.type) {
            case STRING -> new StringNode(token.value, token.text, span);
            case NUMBER -> new NumberNode(Double.parseDouble(token.text), isInteger(token.text), token.text, span);
            case TRUE -> new BooleanNode(true, token.text, span);
            case FALSE -> new BooleanNode(false, token.text, span);
            case NULL -> new NullNode(token.text, span);
            default -> new StringNode(token.text, token.text, span);
        };
    }

    private StringNode joined(Token first, Token last) {
        String raw = source.getText().substring(first.pos, last.getEndPos());
        return new StringNode(raw, raw, Span.between(first, last));
    }

    private static boolean isInteger(String number) {
        return number.indexOf('.') == -1 && number.indexOf('e') == -1 && number.indexOf('E') == -1;
    }

    private static boolean isDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) < '0' || text.charAt(i) > '9') {
                return false;
            }
        }
        return true;
    }

    private static boolean isDash(Token token) {
        return token.type == IDENT && "-".equals(token.text);
    }

    // ========== Array Headers ==========

    private record Header(Token open, Token sizeToken, long declared, List<Token> fields) {

        boolean isTable() {
            return fields != null;
        }

        int declaredSize() {
            return declared < 0 ? -1 : (int) Math.min(declared, Integer.MAX_VALUE);
        }

    }

    private record Schema(List<Token> fields, Delimiter marker) {

    }

    /**
     * Parses {@code [N marker?]} and an optional {@code {fields}} schema, and
     * always opens a delimiter scope that the caller must close.
     */
    private Header parseHeader() {
        Token open = nextRaw();
        Delimiter marker = null;
        Token token = peekRaw();
        Delimiter early = Delimiter.of(token.type);
        if (early != null) {
            nextRaw();
            error(token, ErrorCode.DELIMITER_MARKER_MISPLACED, ErrorMessages.markerBeforeSize(early));
            marker = early;
            token = peekRaw();
        }
        Token sizeToken = open;
        long declared = -1;
        if (token.type == EOF) {
            error(token, ErrorCode.UNEXPECTED_END_OF_INPUT, ErrorMessages.unexpectedEndOfInput("array header"));
            scopes.push(marker);
            return new Header(open, sizeToken, declared, null);
        }
        if ((token.type == NUMBER || token.type == STRING) && isDigits(token.text)) {
            nextRaw();
            sizeToken = token;
            declared = token.text.length() > 18 ? Long.MAX_VALUE : Long.parseLong(token.text);
        } else {
            error(token, ErrorCode.INVALID_ARRAY_SIZE, ErrorMessages.invalidArraySize(token));
            if (token.type.isValue()) {
                nextRaw();
                sizeToken = token;
            }
        }
        token = peekRaw();
        Delimiter trailing = Delimiter.of(token.type);
        if (trailing != null) {
            nextRaw();
            marker = trailing;
            token = peekRaw();
        }
        if (token.type == R_BRACKET) {
            nextRaw();
        } else {
            error(token, ErrorCode.EXPECTED_RIGHT_BRACKET, ErrorMessages.expectedRightBracket(token));
        }
        Delimiter delimiter = scopes.push(marker);
        if (peek() != L_CURLY) {
            return new Header(open, sizeToken, declared, null);
        }
        Schema schema = parseSchema(delimiter);
        if (schema.marker() != null) {
            scopes.pop();
            scopes.push(schema.marker());
        }
        return new Header(open, sizeToken, declared, schema.fields());
    }

    private Schema parseSchema(Delimiter delimiter) {
        nextRaw();
        List<Token> fields = new ArrayList<>();
        Delimiter marker = null;
        boolean expectField = true;
        while (true) {
            Token token = peekRaw();
            if (token.type == R_CURLY) {
                nextRaw();
                if (fields.isEmpty()) {
                    error(token, ErrorCode.EXPECTED_FIELD_NAME, ErrorMessages.expectedFieldName(token));
                }
                break;
            }
            if (token.type == EOF) {
                error(token, ErrorCode.UNEXPECTED_END_OF_INPUT, ErrorMessages.unexpectedEndOfInput("table schema"));
                break;
            }
            if (token.type == WS_LF || token.type == COLON) {
                error(token, ErrorCode.EXPECTED_RIGHT_BRACE, ErrorMessages.expectedRightBrace(token));
                break;
            }
            nextRaw();
            Delimiter found = Delimiter.of(token.type);
            if (found != null) {
                if (found != delimiter) {
                    if (peekRaw().type == R_CURLY) {
                        error(token, ErrorCode.DELIMITER_MARKER_MISPLACED, ErrorMessages.schemaMarkerMismatch(delimiter, found));
                        marker = found;
                    } else {
                        error(token, ErrorCode.MIXED_DELIMITERS, ErrorMessages.mixedDelimiters(delimiter, found));
                    }
                }
                if (expectField) {
                    error(token, ErrorCode.EXPECTED_FIELD_NAME, ErrorMessages.expectedFieldName(token));
                }
                expectField = true;
            } else if (token.type.isValue()) {
                if (!expectField) {
                    error(token, ErrorCode.EXPECTED_DELIMITER, ErrorMessages.expectedDelimiter(delimiter, token));
                }
                fields.add(token);
                expectField = false;
            } else {
                error(token, ErrorCode.EXPECTED_FIELD_NAME, ErrorMessages.expectedFieldName(token));
            }
        }
        return new Schema(fields, marker);
    }

    // ========== Arrays ==========

    private Node parseArray(Header header, int indent) {
        boolean overLimit = header.declared() > options.getMaxArraySize();
        if (overLimit) {
            error(header.sizeToken(), ErrorCode.ARRAY_SIZE_LIMIT_EXCEEDED,
                    ErrorMessages.arraySize(header.sizeToken().text, options.getMaxArraySize()));
        }
        if (header.isTable()) {
            return parseTable(header, indent, overLimit);
        }
        if (atLineEnd()) {
            Token next = peekPastNewlines();
            if (next.type == EOF || indentOf(next) <= indent) {
                checkSize(header, 0, overLimit, false);
                return new ArrayNode(header.declaredSize(), List.of(), Span.between(header.open(), lastSignificant()));
            }
            if (isDash(next)) {
                return parseExpandedArray(header, indent, overLimit);
            }
        }
        return parseInlineArray(header, indent, overLimit);
    }

    private void checkSize(Header header, int actual, boolean overLimit, boolean table) {
        if (header.declared() < 0 || overLimit || actual == header.declared()) {
            return;
        }
        int declared = header.declaredSize();
        if (table) {
            error(header.sizeToken(), ErrorCode.TABLE_SIZE_MISMATCH, ErrorMessages.tableSizeMismatch(declared, actual));
        } else {
            error(header.sizeToken(), ErrorCode.ARRAY_SIZE_MISMATCH, ErrorMessages.arraySizeMismatch(declared, actual));
        }
    }

    /**
     * Values split by the active delimiter on the header line and on any
     * deeper indented continuation lines.
     */
    private ArrayNode parseInlineArray(Header header, int indent, boolean overLimit) {
        Cells cells = new Cells(scopes.current(), options.getMaxArraySize());
        while (true) {
            Token trailing = collectCells(cells);
            Token next = peekPastNewlines();
            boolean continued = next.type != EOF && indentOf(next) > indent;
            if (trailing != null && !continued) {
                addCell(cells, List.of(), trailing);
            }
            if (!continued) {
                break;
            }
            skipNewlines();
        }
        if (cells.count == 1 && header.declared() > 1 && cells.foreignToken != null) {
            error(cells.foreignToken, ErrorCode.MIXED_DELIMITERS, ErrorMessages.mixedDelimiters(cells.delimiter, cells.foreign));
        }
        checkSize(header, cells.count, overLimit, false);
        return new ArrayNode(header.declaredSize(), new ArrayList<>(cells.values), Span.between(header.open(), lastSignificant()));
    }

    private ArrayNode parseExpandedArray(Header header, int indent, boolean overLimit) {
        skipNewlines();
        int itemIndent = lineIndent(peekToken());
        List<Node> items = new ArrayList<>();
        int count = 0;
        while (true) {
            skipNewlines();
            Token token = peekToken();
            if (token.type == EOF) {
                break;
            }
            int lineIndent = lineIndent(token);
            if (lineIndent <= indent) {
                break;
            }
            int start = getPosition();
            if (lineIndent != itemIndent) {
                error(token, ErrorCode.UNEXPECTED_INDENTATION, ErrorMessages.unexpectedIndentation(itemIndent, lineIndent));
                if (lineIndent > itemIndent) {
                    recoverToIndent(itemIndent);
                } else {
                    skipToLineEnd();
                }
            } else if (!isDash(token)) {
                error(token, ErrorCode.UNEXPECTED_TOKEN, ErrorMessages.unexpectedListItem(token));
                recoverToIndent(itemIndent);
            } else {
                Node item = parseListItem(itemIndent);
                count++;
                if (items.size() < options.getMaxArraySize()) {
                    items.add(item);
                }
            }
            checkProgress(start, "expanded array");
        }
        checkSize(header, count, overLimit, false);
        return new ArrayNode(header.declaredSize(), items, Span.between(header.open(), lastSignificant()));
    }

    private Node parseListItem(int itemIndent) {
        Token dash = next();
        if (!enterDepth(dash)) {
            recoverToIndent(itemIndent);
            return new NullNode(StringUtils.EMPTY, Span.of(dash));
        }
        try {
            if (atLineEnd()) {
                Token next = peekPastNewlines();
                if (next.type != EOF && indentOf(next) > itemIndent) {
                    skipNewlines();
                    List<PropertyNode> properties = parseProperties(lineIndent(peekToken()));
                    return new ObjectNode(properties, Span.between(dash, lastSignificant()));
                }
                return new ObjectNode(List.of(), Span.of(dash));
            }
            Token token = peekToken();
            if (token.type == L_BRACKET) {
                return parseListItemArray(itemIndent, dash);
            }
            if (token.type.isValue() && peekToken(1).type.oneOf(COLON, L_BRACKET)) {
                // fields of the object line up with the first key
                int fieldIndent = token.col - 1;
                List<PropertyNode> properties = new ArrayList<>();
                PropertyNode first = parseProperty(fieldIndent);
                if (first != null) {
                    properties.add(first);
                }
                properties.addAll(parseProperties(fieldIndent));
                return new ObjectNode(properties, Span.between(token, lastSignificant()));
            }
            return parseSimpleValue();
        } finally {
            depth--;
        }
    }

    private Node parseListItemArray(int itemIndent, Token dash) {
        Header header = parseHeader();
        try {
            Token found = peekToken();
            if (found.type != COLON) {
                error(found, ErrorCode.EXPECTED_COLON, ErrorMessages.expectedColonAfterHeader(found));
                recoverToIndent(itemIndent);
                return new ArrayNode(header.declaredSize(), List.of(), Span.between(dash, lastSignificant()));
            }
            next();
            return parseArray(header, itemIndent);
        } finally {
            scopes.pop();
        }
    }

    // ========== Tables ==========

    private TableArrayNode parseTable(Header header, int indent, boolean overLimit) {
        if (!atLineEnd()) {
            Token token = peekToken();
            error(token, ErrorCode.UNEXPECTED_TOKEN, ErrorMessages.unexpectedContentAfterTableHeader(token));
            skipToLineEnd();
        }
        Delimiter delimiter = scopes.current();
        List<String> fields = new ArrayList<>(header.fields().size());
        for (Token field : header.fields()) {
            fields.add(field.value);
        }
        int width = fields.size();
        List<List<ValueNode>> rows = new ArrayList<>();
        int count = 0;
        while (true) {
            skipNewlines();
            Token first = peekToken();
            if (first.type == EOF || lineIndent(first) <= indent) {
                break;
            }
            int start = getPosition();
            if (!enterDepth(first)) {
                recoverToIndent(indent);
                break;
            }
            try {
                Cells cells = new Cells(delimiter, Integer.MAX_VALUE);
                Token trailing = collectCells(cells);
                if (trailing != null) {
                    addCell(cells, List.of(), trailing);
                }
                if (cells.count != width) {
                    if (cells.count == 1 && cells.foreignToken != null) {
                        error(cells.foreignToken, ErrorCode.MIXED_DELIMITERS, ErrorMessages.mixedDelimiters(delimiter, cells.foreign));
                    }
                    error(first, ErrorCode.TABLE_ROW_FIELD_MISMATCH, ErrorMessages.tableRowFieldMismatch(width, cells.count));
                }
                count++;
                if (rows.size() < options.getMaxArraySize()) {
                    rows.add(cells.values);
                }
            } finally {
                depth--;
            }
            checkProgress(start, "table rows");
        }
        checkSize(header, count, overLimit, true);
        return new TableArrayNode(header.declaredSize(), fields, rows, Span.between(header.open(), lastSignificant()));
    }

    // ========== Cells ==========

    private static class Cells {

        final Delimiter delimiter;
        final int limit;
        final List<ValueNode> values = new ArrayList<>();
        int count;
        Delimiter foreign;
        Token foreignToken;

        Cells(Delimiter delimiter, int limit) {
            this.delimiter = delimiter;
            this.limit = limit;
        }

        void foreign(Delimiter found, Token token) {
            if (foreign == null && found != delimiter) {
                foreign = found;
                foreignToken = token;
            }
        }

    }

    /**
     * Splits the rest of the current line into cells.
     *
     * @return the delimiter token if the line ended with one, else null
     */
    private Token collectCells(Cells cells) {
        List<Token> cell = new ArrayList<>();
        Token trailing = null;
        while (!atLineEnd()) {
            Token token = next();
            Delimiter found = Delimiter.of(token.type);
            if (found == cells.delimiter) {
                addCell(cells, cell, token);
                cell.clear();
                trailing = token;
            } else {
                if (found != null) {
                    cells.foreign(found, token);
                }
                cell.add(token);
                trailing = null;
            }
        }
        if (!cell.isEmpty()) {
            addCell(cells, cell, null);
        }
        return trailing;
    }

    private void addCell(Cells cells, List<Token> cell, Token delimiterToken) {
        cells.count++;
        if (cell.size() > 1 && cells.delimiter != Delimiter.TAB) {
            // tabs between words are skipped as layout, but still count as a foreign delimiter
            String text = source.getText();
            for (int i = 1; i < cell.size(); i++) {
                Token prev = cell.get(i - 1);
                Token token = cell.get(i);
                if (text.substring(prev.getEndPos(), token.pos).indexOf('\t') != -1) {
                    cells.foreign(Delimiter.TAB, token);
                    break;
                }
            }
        }
        if (cells.values.size() >= cells.limit) {
            return;
        }
        if (cell.isEmpty()) {
            Span span = new Span(delimiterToken.line, delimiterToken.col, delimiterToken.pos,
                    delimiterToken.line, delimiterToken.col, delimiterToken.pos);
            cells.values.add(new StringNode(StringUtils.EMPTY, StringUtils.EMPTY, span));
        } else if (cell.size() == 1) {
            cells.values.add(literal(cell.get(0)));
        } else {
            cells.values.add(joined(cell.get(0), cell.get(cell.size() - 1)));
        }
    }

}
