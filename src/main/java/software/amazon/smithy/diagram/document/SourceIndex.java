/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.document;

import java.util.function.Predicate;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstWalker;
import software.amazon.smithy.diagram.ast.CstNode;

/**
 * Resolves text offsets to and from positions for one parse generation of a
 * document, and finds the concrete syntax spanning AST nodes and their
 * fields.
 *
 * <p>An index is only meaningful against the exact text it was built from. It
 * is rebuilt on every reparse together with the AST it indexes.
 */
public final class SourceIndex {
    private static final String CLOSING_DELIMITERS = "}])";

    private final Document document;

    private SourceIndex(Document document) {
        this.document = document;
    }

    /**
     * @param document A snapshot of the text the AST was parsed from
     * @return The index
     */
    public static SourceIndex of(Document document) {
        return new SourceIndex(document);
    }

    /**
     * @return The indexed text
     */
    public Document document() {
        return document;
    }

    /**
     * @param offset A character offset, up to and including the length of
     *               the document
     * @return The position of the offset
     * @throws IndexOutOfBoundsException If the offset is outside the document
     */
    public Position positionAt(int offset) {
        Position position = document.positionAtIndex(offset);
        if (position == null) {
            throw new IndexOutOfBoundsException("Offset " + offset + " is outside of the document, which has length "
                                                + document.length());
        }
        return position;
    }

    /**
     * @param position A position in the document
     * @return The offset of the position, or {@code -1} if it is out of bounds
     */
    public int offsetAt(Position position) {
        return document.indexOfPosition(position);
    }

    /**
     * @param offset Start offset
     * @param length Span length
     * @return The range covering the span
     */
    public Range rangeOf(int offset, int length) {
        return new Range(positionAt(offset), positionAt(offset + length));
    }

    /**
     * @param cstNode The span to get the range of
     * @return The range covering the span
     */
    public Range rangeOf(CstNode cstNode) {
        return rangeOf(cstNode.offset(), cstNode.length());
    }

    /**
     * @return The range of an empty span at the very end of the document
     */
    public Range endOfDocument() {
        Position end = positionAt(document.length());
        return new Range(end, end);
    }

    /**
     * @param node The node to get the source text of
     * @return The text the node was parsed from, or {@code null} if the node
     *  has no source
     */
    public String textOf(AstNode node) {
        CstNode cst = node.cstNode();
        if (cst == null) {
            return null;
        }
        return document.copySpan(cst.offset(), cst.end());
    }

    /**
     * Finds where a field of a node is written in source. Only the direct
     * children of the node's span are searched, and for a compound assignment
     * only the value is returned, so that a replacement never touches the
     * field's keyword.
     *
     * @param node The node owning the field
     * @param fieldName The field to find
     * @return The span of the field's value, or {@code null} if the field is
     *  not written in source (it only exists as a default)
     */
    public CstNode findFieldSpan(AstNode node, String fieldName) {
        CstNode cst = node.cstNode();
        if (cst == null) {
            return null;
        }

        for (CstNode child : cst.children()) {
            if (fieldName.equals(child.grammarSource())) {
                return child.valueNode();
            }
        }
        return null;
    }

    /**
     * @param node The node to search
     * @return The offset of the last closing delimiter within the node's span,
     *  or {@code -1} if the node has no source or no closing delimiter
     */
    public int closingDelimiterOffset(AstNode node) {
        CstNode cst = node.cstNode();
        if (cst == null) {
            return -1;
        }

        for (int i = cst.end() - 1; i > cst.offset(); i--) {
            if (CLOSING_DELIMITERS.indexOf(document.charAt(i)) >= 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @param root The root of the tree to search
     * @param offset The offset to find a node at
     * @return The deepest node whose span contains {@code offset}, or
     *  {@code null} if no node does
     */
    public AstNode innermostNodeAt(AstNode root, int offset) {
        return innermostNodeAt(root, offset, node -> true);
    }

    /**
     * @param root The root of the tree to search
     * @param offset The offset to find a node at
     * @param filter Which nodes to consider
     * @return The deepest node accepted by {@code filter} whose span contains
     *  {@code offset}, or {@code null} if no node does
     */
    public AstNode innermostNodeAt(AstNode root, int offset, Predicate<AstNode> filter) {
        AstNode best = null;
        for (AstNode node : AstWalker.streamAst(root).toList()) {
            CstNode cst = node.cstNode();
            if (cst == null || !cst.isIn(offset) || !filter.test(node)) {
                continue;
            }
            if (best == null || best.cstNode().contains(cst)) {
                best = node;
            }
        }
        return best;
    }
}
