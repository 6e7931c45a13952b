/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.identity;

import java.util.Objects;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstValue;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;
import software.amazon.smithy.model.node.ToNode;

/**
 * Where a node sits in its tree, used to find the same logical node again
 * after a reparse.
 *
 * @param type The node's type tag
 * @param containment The field of the container holding the node
 * @param ordinal Index of the node among nodes of the same type in that field
 * @param parentId Element id of the container
 * @param ancestorName Name of the nearest named ancestor, or {@code null}
 * @param name The node's own name, or {@code null}
 * @param offset Where the node started in source, or {@code -1}
 */
public record Fingerprint(
        String type,
        String containment,
        int ordinal,
        String parentId,
        String ancestorName,
        String name,
        int offset
) implements ToNode {
    static final String ROOT_PARENT = "root";
    static final String UNKNOWN_PARENT = "unknown";

    static final int THRESHOLD = 55;
    private static final int TYPE_SCORE = 40;
    private static final int PARENT_SCORE = 25;
    private static final int CONTAINMENT_SCORE = 15;
    private static final int ANCESTOR_NAME_SCORE = 10;
    private static final int NAME_SCORE = 10;
    private static final int ORDINAL_SCORE = 10;

    public Fingerprint {
        Objects.requireNonNull(type);
        Objects.requireNonNull(containment);
        Objects.requireNonNull(parentId);
    }

    /**
     * @param node The node to fingerprint
     * @param parentId The element id its container has in this generation
     * @return The node's fingerprint
     */
    public static Fingerprint of(AstNode node, String parentId) {
        AstNode ancestor = node.namedAncestor();
        return new Fingerprint(
                node.type(),
                node.containerField(),
                ordinal(node),
                parentId,
                ancestor == null ? null : ancestor.name(),
                node.name(),
                node.hasSource() ? node.cstNode().offset() : -1);
    }

    /**
     * @return The key two fingerprints of the same logical node share when
     *  nothing structural changed around it
     */
    public String exactKey() {
        return parentId + "/" + containment + "/" + ordinal + "/" + type;
    }

    /**
     * Scores how likely {@code stored} describes the same node as this
     * fingerprint. Different types never match.
     *
     * @param stored A fingerprint from an earlier generation
     * @return The score, at least {@link #THRESHOLD} for a plausible match
     */
    public int score(Fingerprint stored) {
        if (!type.equals(stored.type)) {
            return 0;
        }

        int score = TYPE_SCORE;
        if (parentId.equals(stored.parentId)) {
            score += PARENT_SCORE;
        }
        if (containment.equals(stored.containment)) {
            score += CONTAINMENT_SCORE;
        }
        if (ancestorName != null && ancestorName.equals(stored.ancestorName)) {
            score += ANCESTOR_NAME_SCORE;
        }
        if (name != null && name.equals(stored.name)) {
            score += NAME_SCORE;
        }
        if (ordinal == stored.ordinal) {
            score += ORDINAL_SCORE;
        }
        return score;
    }

    @Override
    public Node toNode() {
        ObjectNode.Builder builder = Node.objectNodeBuilder()
                .withMember("type", type)
                .withMember("containment", containment)
                .withMember("ordinal", ordinal)
                .withMember("parentId", parentId)
                .withMember("offset", offset);
        if (ancestorName != null) {
            builder.withMember("ancestorName", ancestorName);
        }
        if (name != null) {
            builder.withMember("name", name);
        }
        return builder.build();
    }

    /**
     * @param node A fingerprint in the form produced by {@link #toNode()}
     * @return The fingerprint
     */
    public static Fingerprint fromNode(Node node) {
        ObjectNode object = node.expectObjectNode();
        return new Fingerprint(
                object.expectStringMember("type").getValue(),
                object.getStringMember("containment").map(StringNode::getValue).orElse(""),
                object.getNumberMember("ordinal").map(n -> n.getValue().intValue()).orElse(0),
                object.getStringMember("parentId").map(StringNode::getValue).orElse(UNKNOWN_PARENT),
                object.getStringMember("ancestorName").map(StringNode::getValue).orElse(null),
                object.getStringMember("name").map(StringNode::getValue).orElse(null),
                object.getNumberMember("offset").map(n -> n.getValue().intValue()).orElse(-1));
    }

    private static int ordinal(AstNode node) {
        AstNode container = node.container();
        if (container == null) {
            return 0;
        }

        AstValue value = container.get(node.containerField());
        if (!(value instanceof AstValue.Many many)) {
            return 0;
        }

        int ordinal = 0;
        for (int i = 0; i < node.containerIndex(); i++) {
            if (many.elements().get(i) instanceof AstValue.Child sibling
                    && sibling.node().type().equals(node.type())) {
                ordinal++;
            }
        }
        return ordinal;
    }
}
