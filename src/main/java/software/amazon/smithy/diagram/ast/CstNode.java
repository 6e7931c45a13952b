/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.ast;

import java.util.List;
import software.amazon.smithy.utils.ListUtils;

/**
 * A span of concrete syntax in the original text.
 *
 * <p>Each node carries a {@link #grammarSource()} tag naming the AST field
 * assignment it was produced for, or {@code null} for punctuation, keywords
 * and whole declarations. Spans of siblings never overlap, and a parent's
 * span contains all of its children's spans.
 */
public final class CstNode {
    private final int start;
    private final int end;
    private final String grammarSource;
    private final List<CstNode> children;

    private CstNode(int start, int end, String grammarSource, List<CstNode> children) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.grammarSource = grammarSource;
        this.children = ListUtils.copyOf(children);
    }

    /**
     * @param start Start offset, inclusive
     * @param end End offset, exclusive
     * @param grammarSource The field this token was assigned to, or null
     * @return A token with no children
     */
    public static CstNode leaf(int start, int end, String grammarSource) {
        return new CstNode(start, end, grammarSource, List.of());
    }

    /**
     * @param start Start offset, inclusive
     * @param end End offset, exclusive
     * @param grammarSource The field this node was assigned to, or null
     * @param children Child spans, in source order
     * @return A node spanning its children
     */
    public static CstNode composite(int start, int end, String grammarSource, List<CstNode> children) {
        return new CstNode(start, end, grammarSource, children);
    }

    /**
     * @return The offset of the first character in this span
     */
    public int offset() {
        return start;
    }

    /**
     * @return The offset just past the last character in this span
     */
    public int end() {
        return end;
    }

    public int length() {
        return end - start;
    }

    public String grammarSource() {
        return grammarSource;
    }

    public List<CstNode> children() {
        return children;
    }

    /**
     * For a compound assignment (keyword, separator, value) this is the final
     * child, so a replacement never touches the keyword. A plain token is its
     * own value.
     *
     * @return The span holding the assigned value
     */
    public CstNode valueNode() {
        if (children.isEmpty()) {
            return this;
        }
        return children.get(children.size() - 1);
    }

    /**
     * @param pos The character offset in a file to check
     * @return Whether {@code pos} is within this span
     */
    public boolean isIn(int pos) {
        return start <= pos && end > pos;
    }

    /**
     * @param other The span to check
     * @return Whether {@code other} lies entirely within this span
     */
    public boolean contains(CstNode other) {
        return start <= other.start && other.end <= end;
    }

    @Override
    public String toString() {
        return "CstNode[" + start + ", " + end + ")" + (grammarSource == null ? "" : " " + grammarSource);
    }
}
