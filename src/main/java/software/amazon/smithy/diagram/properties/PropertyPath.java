/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.properties;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstValue;
import software.amazon.smithy.diagram.util.Result;
import software.amazon.smithy.utils.ListUtils;

/**
 * A dot-path naming a field of a node or of one of its nested nodes, such as
 * {@code description} or {@code scores[1].notes}.
 */
public final class PropertyPath {
    private static final Pattern INDEXED_SEGMENT = Pattern.compile("^(\\w+)\\[(\\d+)]$");

    private final String text;
    private final List<Segment> segments;

    private PropertyPath(String text, List<Segment> segments) {
        this.text = text;
        this.segments = ListUtils.copyOf(segments);
    }

    /**
     * One step of a path.
     *
     * @param name Field name
     * @param index Index into the field's list, or {@code -1} when the
     *              segment isn't indexed
     */
    public record Segment(String name, int index) {
        public boolean hasIndex() {
            return index >= 0;
        }
    }

    /**
     * Where a path ends up.
     *
     * @param node The node owning the addressed field
     * @param field The addressed field's name
     */
    public record Target(AstNode node, String field) {
    }

    /**
     * @param path The dot-path text
     * @return The parsed path
     */
    public static PropertyPath parse(String path) {
        List<Segment> segments = new ArrayList<>();
        for (String part : path.split("\\.", -1)) {
            Matcher matcher = INDEXED_SEGMENT.matcher(part);
            if (matcher.matches()) {
                segments.add(new Segment(matcher.group(1), parseIndex(matcher.group(2))));
            } else {
                segments.add(new Segment(part, -1));
            }
        }
        return new PropertyPath(path, segments);
    }

    // Indices past int range are clamped so that they fail the bounds check.
    private static int parseIndex(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    public List<Segment> segments() {
        return segments;
    }

    /**
     * @return Whether the path goes through a nested node
     */
    public boolean isNested() {
        return segments.size() > 1;
    }

    /**
     * Walks every segment but the last through the live AST. Indexed
     * segments are bounds-checked against the list's current length.
     *
     * @param root The node the path starts at
     * @return The node and field the last segment addresses, or an error
     *  message if the path can't be followed
     */
    public Result<Target, String> navigate(AstNode root) {
        AstNode current = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            Segment segment = segments.get(i);
            AstValue value = current.get(segment.name());
            if (segment.hasIndex()) {
                if (!(value instanceof AstValue.Many many) || segment.index() >= many.elements().size()) {
                    return failure();
                }
                value = many.elements().get(segment.index());
            }
            if (!(value instanceof AstValue.Child child)) {
                return failure();
            }
            current = child.node();
        }

        Segment last = segments.get(segments.size() - 1);
        if (last.name().isEmpty() || last.hasIndex()) {
            return failure();
        }
        return Result.ok(new Target(current, last.name()));
    }

    private Result<Target, String> failure() {
        return Result.err("Cannot navigate to property path: " + text);
    }

    @Override
    public String toString() {
        return text;
    }
}
