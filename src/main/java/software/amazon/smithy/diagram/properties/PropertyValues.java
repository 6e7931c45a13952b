/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.properties;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstValue;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;

/**
 * Converts AST values to the plain values put on the wire. References are
 * flattened to their display text, and internal fields are stripped from
 * nested nodes.
 */
public final class PropertyValues {
    private static final AstValue.Visitor<Node> TO_NODE = new AstValue.Visitor<>() {
        @Override
        public Node str(AstValue.Str str) {
            return Node.from(str.value());
        }

        @Override
        public Node num(AstValue.Num num) {
            return Node.from(num.value());
        }

        @Override
        public Node bool(AstValue.Bool bool) {
            return Node.from(bool.value());
        }

        @Override
        public Node ident(AstValue.Ident ident) {
            return Node.from(ident.text());
        }

        @Override
        public Node nullValue(AstValue.Null nullValue) {
            return Node.nullNode();
        }

        @Override
        public Node ref(AstValue.Ref ref) {
            return Node.from(ref.text());
        }

        @Override
        public Node child(AstValue.Child child) {
            return toNode(child.node());
        }

        @Override
        public Node many(AstValue.Many many) {
            List<Node> elements = new ArrayList<>(many.elements().size());
            for (AstValue element : many.elements()) {
                elements.add(element.accept(this));
            }
            return Node.fromNodes(elements);
        }
    };

    private PropertyValues() {
    }

    /**
     * @param value The value to convert
     * @return The plain form of the value
     */
    public static Node toNode(AstValue value) {
        return value.accept(TO_NODE);
    }

    /**
     * @param node The node to convert
     * @return An object with every non-internal field of the node
     */
    public static ObjectNode toNode(AstNode node) {
        ObjectNode.Builder builder = Node.objectNodeBuilder();
        for (Map.Entry<String, AstValue> entry : node.fields().entrySet()) {
            if (!AstNode.isInternalField(entry.getKey())) {
                builder.withMember(entry.getKey(), toNode(entry.getValue()));
            }
        }
        return builder.build();
    }

    /**
     * @param value A scalar or reference
     * @return The text the value is displayed as in a joined list
     */
    public static String displayText(AstValue value) {
        Node node = toNode(value);
        if (node.isStringNode()) {
            return node.expectStringNode().getValue();
        } else if (node.isNumberNode()) {
            return node.expectNumberNode().getValue().toString();
        } else if (node.isBooleanNode()) {
            return String.valueOf(node.expectBooleanNode().getValue());
        } else if (node.isNullNode()) {
            return "null";
        }
        return Node.printJson(node);
    }
}
