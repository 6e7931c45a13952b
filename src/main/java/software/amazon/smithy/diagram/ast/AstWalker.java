/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Traversal over the containment edges of an AST. References are never
 * followed, so traversal always terminates.
 */
public final class AstWalker {
    private AstWalker() {
    }

    /**
     * @param root The node to start from
     * @return {@code root} and all of its descendants, in depth-first
     *  pre-order (source order for parsed trees)
     */
    public static Stream<AstNode> streamAst(AstNode root) {
        return collect(root).stream();
    }

    /**
     * @param root The node to start from
     * @return All descendants of {@code root}, excluding {@code root} itself
     */
    public static Stream<AstNode> streamAllContents(AstNode root) {
        return collect(root).stream().skip(1);
    }

    /**
     * @param node The node whose direct children to get
     * @return The nodes directly owned by {@code node}'s fields, in field order
     */
    public static List<AstNode> children(AstNode node) {
        List<AstNode> children = new ArrayList<>();
        for (var entry : node.fields().entrySet()) {
            if (AstNode.isInternalField(entry.getKey())) {
                continue;
            }
            AstValue value = entry.getValue();
            if (value instanceof AstValue.Child child) {
                children.add(child.node());
            } else if (value instanceof AstValue.Many many) {
                for (AstValue element : many.elements()) {
                    if (element instanceof AstValue.Child child) {
                        children.add(child.node());
                    }
                }
            }
        }
        return children;
    }

    /**
     * @param root The node to search from
     * @param name The name to look for
     * @return The first node in pre-order named {@code name}
     */
    public static Optional<AstNode> findByName(AstNode root, String name) {
        return streamAst(root).filter(node -> name.equals(node.name())).findFirst();
    }

    private static List<AstNode> collect(AstNode root) {
        List<AstNode> result = new ArrayList<>();
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode current = stack.pop();
            result.add(current);
            List<AstNode> children = children(current);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }
}
