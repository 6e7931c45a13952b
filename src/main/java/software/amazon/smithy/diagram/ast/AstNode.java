/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import software.amazon.smithy.utils.SmithyBuilder;

/**
 * A node of a parsed document's abstract syntax tree.
 *
 * <p>Nodes are produced by a parser for one parse generation and are never
 * modified afterwards; the next reparse produces a whole new tree. Fields
 * keep their declaration order. A node that was synthesized rather than
 * parsed has no {@link #cstNode()}.
 *
 * <p>Field names starting with {@code $} or {@code _} are node metadata and
 * are never surfaced as properties.
 */
public final class AstNode {
    private final String type;
    private final Map<String, AstValue> fields;
    private final CstNode cstNode;
    private AstNode container;
    private String containerField;
    private int containerIndex;

    private AstNode(Builder builder) {
        this.type = SmithyBuilder.requiredState("type", builder.type);
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.cstNode = builder.cstNode;
        for (Map.Entry<String, AstValue> entry : fields.entrySet()) {
            adopt(entry.getKey(), entry.getValue());
        }
    }

    public static Builder builder(String type) {
        return new Builder().type(type);
    }

    /**
     * @param fieldName Field name to check
     * @return Whether the field holds node metadata rather than user data
     */
    public static boolean isInternalField(String fieldName) {
        return fieldName.startsWith("$") || fieldName.startsWith("_");
    }

    /**
     * @return The type tag of this node
     */
    public String type() {
        return type;
    }

    /**
     * @return All fields of this node in declaration order
     */
    public Map<String, AstValue> fields() {
        return fields;
    }

    /**
     * @param fieldName The field to get
     * @return The field's value, or {@code null} if the node has no such field
     */
    public AstValue get(String fieldName) {
        return fields.get(fieldName);
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    /**
     * @return The node's name, if its {@code name} field is a string or bare
     *  token, otherwise {@code null}
     */
    public String name() {
        AstValue value = fields.get("name");
        if (value instanceof AstValue.Ident ident) {
            return ident.text();
        } else if (value instanceof AstValue.Str str) {
            return str.value();
        }
        return null;
    }

    /**
     * @return The concrete syntax this node was parsed from, or {@code null}
     *  if it was synthesized
     */
    public CstNode cstNode() {
        return cstNode;
    }

    public boolean hasSource() {
        return cstNode != null;
    }

    /**
     * @return The node owning this one, or {@code null} for a root
     */
    public AstNode container() {
        return container;
    }

    /**
     * @return The field of {@link #container()} holding this node, or an empty
     *  string for a root
     */
    public String containerField() {
        return containerField == null ? "" : containerField;
    }

    /**
     * @return The index of this node within a list-valued containing field,
     *  otherwise 0
     */
    public int containerIndex() {
        return containerIndex;
    }

    /**
     * @return The nearest named ancestor of this node, or {@code null}
     */
    public AstNode namedAncestor() {
        AstNode current = container;
        while (current != null) {
            if (current.name() != null) {
                return current;
            }
            current = current.container;
        }
        return null;
    }

    private void adopt(String fieldName, AstValue value) {
        if (value instanceof AstValue.Child child) {
            child.node().attach(this, fieldName, 0);
        } else if (value instanceof AstValue.Many many) {
            for (int i = 0; i < many.elements().size(); i++) {
                if (many.elements().get(i) instanceof AstValue.Child child) {
                    child.node().attach(this, fieldName, i);
                }
            }
        }
    }

    private void attach(AstNode parent, String fieldName, int index) {
        if (this.container != null && this.container != parent) {
            throw new IllegalStateException("Node of type " + type + " is already contained by "
                                            + container.type());
        }
        this.container = parent;
        this.containerField = fieldName;
        this.containerIndex = index;
    }

    @Override
    public String toString() {
        String name = name();
        return name == null ? type : type + " " + name;
    }

    /**
     * Builds a node. The node becomes the container of every nested node
     * assigned to its fields.
     */
    public static final class Builder implements SmithyBuilder<AstNode> {
        private String type;
        private final Map<String, AstValue> fields = new LinkedHashMap<>();
        private CstNode cstNode;

        private Builder() {
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        /**
         * Assigns a field. Assigning the same field twice keeps the last
         * value but the original position in the field order.
         *
         * @param name Field name
         * @param value Field value
         * @return The builder
         */
        public Builder field(String name, AstValue value) {
            fields.put(name, value);
            return this;
        }

        /**
         * Assigns a field only if it hasn't been assigned yet.
         *
         * @param name Field name
         * @param value Default value
         * @return The builder
         */
        public Builder fieldDefault(String name, AstValue value) {
            fields.putIfAbsent(name, value);
            return this;
        }

        public Builder cstNode(CstNode cstNode) {
            this.cstNode = cstNode;
            return this;
        }

        @Override
        public AstNode build() {
            return new AstNode(this);
        }
    }
}
