/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.grammar;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Range;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstValue;
import software.amazon.smithy.diagram.ast.CstNode;
import software.amazon.smithy.diagram.document.Document;
import software.amazon.smithy.utils.SimpleParser;

/**
 * Single-use reader for one parse of an entities document. See
 * {@link EntityDslParser} for the syntax.
 *
 * <p>The reader never gives up: syntax errors are recorded as diagnostics and
 * parsing resumes at the next token, so the returned tree covers everything
 * that could be understood.
 */
final class EntityDslReader extends SimpleParser {
    static final String ROOT_TYPE = "Model";
    static final String RECORD_TYPE = "Record";
    static final String ELEMENTS_FIELD = "elements";
    static final String MEMBERS_FIELD = "members";
    static final String NAME_FIELD = "name";
    static final String DIAGNOSTIC_SOURCE = "parser";

    private final Document document;
    private final Manifest manifest;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    EntityDslReader(Document document, Manifest manifest) {
        super(document.borrowText());
        this.document = document;
        this.manifest = manifest;
    }

    ParseResult parseModel() {
        List<AstValue> elements = new ArrayList<>();
        List<CstNode> cstChildren = new ArrayList<>();
        ws();
        while (!eof()) {
            if (isIdentStart()) {
                int start = position();
                String keyword = identText();
                Parsed declaration = declaration(start, keyword);
                if (declaration != null) {
                    elements.add(declaration.value);
                    cstChildren.add(declaration.cst);
                }
            } else {
                unexpectedToken();
            }
            ws();
        }

        CstNode rootCst = CstNode.composite(0, document.length(), null, cstChildren);
        AstNode root = AstNode.builder(ROOT_TYPE)
                .field(ELEMENTS_FIELD, new AstValue.Many(elements))
                .cstNode(rootCst)
                .build();
        return new ParseResult(root, diagnostics);
    }

    private record Parsed(AstValue value, CstNode cst) {
    }

    // Called with the keyword already consumed.
    private Parsed declaration(int start, String keyword) {
        CstNode keywordCst = CstNode.leaf(start, position(), null);
        ws();
        if (!isIdentStart()) {
            addError(start, position(), "expected a name after '" + keyword + "'");
            return null;
        }

        int nameStart = position();
        String name = identText();
        CstNode nameCst = CstNode.leaf(nameStart, position(), NAME_FIELD);
        ws();
        if (!is('{')) {
            addError(start, position(), "expected '{' after " + keyword + " " + name);
            return null;
        }

        String type = capitalize(keyword);
        AstNode.Builder builder = AstNode.builder(type).field(NAME_FIELD, new AstValue.Ident(name));
        List<CstNode> children = new ArrayList<>();
        children.add(keywordCst);
        children.add(nameCst);
        return body(start, type, builder, children);
    }

    private Parsed record(int start, String type) {
        return body(start, type, AstNode.builder(type), new ArrayList<>());
    }

    // Called at '{'. Consumes through the matching '}'.
    private Parsed body(int start, String type, AstNode.Builder builder, List<CstNode> children) {
        skip(); // '{'
        ws();

        List<AstValue> members = new ArrayList<>();
        Set<String> seenFields = new HashSet<>();
        boolean closed = false;
        while (!eof()) {
            if (is('}')) {
                skip();
                closed = true;
                break;
            }

            if (!isIdentStart()) {
                unexpectedToken();
                ws();
                continue;
            }

            int keyStart = position();
            String key = identText();
            int keyEnd = position();
            ws();
            if (is(':')) {
                int colon = position();
                skip();
                ws();
                Parsed value = value();
                if (value != null) {
                    if (!seenFields.add(key)) {
                        addWarning(keyStart, keyEnd, "duplicate field " + key);
                    }
                    builder.field(key, value.value);
                    children.add(CstNode.composite(keyStart, value.cst.end(), key, List.of(
                            CstNode.leaf(keyStart, keyEnd, null),
                            CstNode.leaf(colon, colon + 1, null),
                            value.cst)));
                }
            } else if (isIdentStart()) {
                Parsed declaration = declaration(keyStart, key);
                if (declaration != null) {
                    members.add(declaration.value);
                    children.add(declaration.cst);
                }
            } else {
                addError(keyStart, keyEnd, "expected ':' after " + key);
            }
            ws();
        }

        if (!closed) {
            addError(start, position(), "missing }");
        }

        if (!members.isEmpty()) {
            builder.field(MEMBERS_FIELD, new AstValue.Many(members));
        }
        manifest.defaultsOf(type).forEach(builder::fieldDefault);

        CstNode cst = CstNode.composite(start, position(), null, children);
        AstNode node = builder.cstNode(cst).build();
        return new Parsed(new AstValue.Child(node), cst);
    }

    private Parsed value() {
        int start = position();
        if (is('"')) {
            return string();
        } else if (is('[')) {
            return array();
        } else if (is('{')) {
            return record(start, RECORD_TYPE);
        } else if (is('-') || isDigit()) {
            return number();
        } else if (isIdentStart()) {
            String text = identText();
            int end = position();
            switch (text) {
                case "true":
                    return new Parsed(new AstValue.Bool(true), CstNode.leaf(start, end, null));
                case "false":
                    return new Parsed(new AstValue.Bool(false), CstNode.leaf(start, end, null));
                case "null":
                    return new Parsed(AstValue.Null.INSTANCE, CstNode.leaf(start, end, null));
                default:
                    break;
            }

            if (Character.isUpperCase(text.charAt(0))) {
                ws();
                if (is('{')) {
                    return record(start, text);
                }
                return new Parsed(new AstValue.Ref(text), CstNode.leaf(start, end, null));
            }
            return new Parsed(new AstValue.Ident(text), CstNode.leaf(start, end, null));
        }

        addError(start, start, "expected a value");
        if (!is('}') && !is(']') && !eof()) {
            unexpectedToken();
        }
        return null;
    }

    private Parsed array() {
        int start = position();
        skip(); // '['
        ws();

        List<AstValue> elements = new ArrayList<>();
        List<CstNode> children = new ArrayList<>();
        boolean closed = false;
        while (!eof()) {
            if (is(']')) {
                skip();
                closed = true;
                break;
            }
            if (is('}')) {
                break;
            }

            Parsed element = value();
            if (element != null) {
                elements.add(element.value);
                children.add(element.cst);
            }
            ws();
        }

        if (!closed) {
            addError(start, position(), "missing ]");
        }
        return new Parsed(new AstValue.Many(elements), CstNode.composite(start, position(), null, children));
    }

    private Parsed string() {
        int start = position();
        skip(); // '"'
        StringBuilder builder = new StringBuilder();
        while (!isNl() && !eof()) {
            char c = peek();
            if (c == '"') {
                skip();
                return new Parsed(new AstValue.Str(builder.toString()), CstNode.leaf(start, position(), null));
            }

            skip();
            if (c == '\\' && !eof()) {
                char escaped = peek();
                skip();
                switch (escaped) {
                    case 'n' -> builder.append('\n');
                    case 't' -> builder.append('\t');
                    case 'r' -> builder.append('\r');
                    default -> builder.append(escaped);
                }
            } else {
                builder.append(c);
            }
        }

        addError(start, position(), "unclosed string literal");
        return new Parsed(new AstValue.Str(builder.toString()), CstNode.leaf(start, position(), null));
    }

    private Parsed number() {
        int start = position();
        if (is('-')) {
            skip();
        }
        while (isDigit() || is('.')) {
            skip();
        }

        String token = document.copySpan(start, position());
        try {
            BigDecimal value = new BigDecimal(token);
            return new Parsed(new AstValue.Num(value), CstNode.leaf(start, position(), null));
        } catch (NumberFormatException e) {
            addError(start, position(), token + " is not a valid number");
            return null;
        }
    }

    private String identText() {
        int start = position();
        do {
            skip();
        } while (isIdentChar());
        return document.copySpan(start, position());
    }

    private void unexpectedToken() {
        int start = position();
        do {
            skip();
        } while (!isWs() && !isStructuralBreakpoint() && !eof());
        addError(start, position(), "unexpected token " + document.copySpan(start, position()));
    }

    private static String capitalize(String keyword) {
        return Character.toUpperCase(keyword.charAt(0)) + keyword.substring(1);
    }

    private void addError(int start, int end, String message) {
        addDiagnostic(start, end, message, DiagnosticSeverity.Error);
    }

    private void addWarning(int start, int end, String message) {
        addDiagnostic(start, end, message, DiagnosticSeverity.Warning);
    }

    private void addDiagnostic(int start, int end, String message, DiagnosticSeverity severity) {
        Range range = new Range(document.positionAtIndex(start), document.positionAtIndex(end));
        diagnostics.add(new Diagnostic(range, message, severity, DIAGNOSTIC_SOURCE));
    }

    private boolean isStructuralBreakpoint() {
        return switch (peek()) {
            case '{', '[', '}', ']', ':', '"' -> true;
            default -> false;
        };
    }

    private boolean isIdentStart() {
        char peeked = peek();
        return Character.isLetter(peeked) || peeked == '_';
    }

    private boolean isIdentChar() {
        char peeked = peek();
        return Character.isLetterOrDigit(peeked) || peeked == '_';
    }

    private boolean isDigit() {
        return Character.isDigit(peek());
    }

    private boolean isNl() {
        return switch (peek()) {
            case '\n', '\r' -> true;
            default -> false;
        };
    }

    private boolean isWs() {
        return switch (peek()) {
            case '\n', '\r', ' ', '\t', ',' -> true;
            default -> false;
        };
    }

    private boolean is(char c) {
        return peek() == c;
    }

    @Override
    public void ws() {
        while (this.isWs() || is('/')) {
            if (is('/')) {
                while (!isNl() && !eof()) {
                    this.skip();
                }
            } else {
                this.skip();
            }
        }
    }
}
