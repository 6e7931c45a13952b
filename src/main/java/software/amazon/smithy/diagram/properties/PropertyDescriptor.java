/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.properties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.ToNode;
import software.amazon.smithy.utils.ListUtils;
import software.amazon.smithy.utils.SmithyBuilder;
import software.amazon.smithy.utils.ToSmithyBuilder;

/**
 * One entry on the property-editing surface, produced fresh by each
 * extraction.
 */
public final class PropertyDescriptor implements ToNode, ToSmithyBuilder<PropertyDescriptor> {
    private final String name;
    private final String label;
    private final PropertyType type;
    private final Node value;
    private final List<PropertyDescriptor> children;
    private final boolean readOnly;
    private final String description;
    private final String elementType;

    private PropertyDescriptor(Builder builder) {
        this.name = SmithyBuilder.requiredState("name", builder.name);
        this.label = builder.label == null ? PropertyLabels.fromFieldName(lastSegment(name)) : builder.label;
        this.type = SmithyBuilder.requiredState("type", builder.type);
        this.value = builder.value;
        this.children = ListUtils.copyOf(builder.children);
        this.readOnly = builder.readOnly;
        this.description = builder.description;
        this.elementType = builder.elementType;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The property's name, a dot-path for fields of nested objects
     */
    public String name() {
        return name;
    }

    public String label() {
        return label;
    }

    public PropertyType type() {
        return type;
    }

    /**
     * @return The current value, or empty when the value is unknown (a
     *  multi-selection whose values differ)
     */
    public Optional<Node> value() {
        return Optional.ofNullable(value);
    }

    /**
     * @return Descriptors of nested fields, for arrays and objects
     */
    public List<PropertyDescriptor> children() {
        return children;
    }

    public boolean readOnly() {
        return readOnly;
    }

    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    /**
     * @return The shared type tag of the elements of an array of nodes
     */
    public Optional<String> elementType() {
        return Optional.ofNullable(elementType);
    }

    /**
     * @param name Name of a child to get
     * @return The direct child with the given name
     */
    public Optional<PropertyDescriptor> child(String name) {
        for (PropertyDescriptor child : children) {
            if (child.name.equals(name)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    @Override
    public Node toNode() {
        ObjectNode.Builder builder = Node.objectNodeBuilder()
                .withMember("name", name)
                .withMember("label", label)
                .withMember("type", type.wireName())
                .withMember("readOnly", readOnly);
        if (value != null) {
            builder.withMember("value", value);
        }
        if (type == PropertyType.ARRAY || type == PropertyType.OBJECT) {
            List<Node> childNodes = new ArrayList<>(children.size());
            for (PropertyDescriptor child : children) {
                childNodes.add(child.toNode());
            }
            builder.withMember("children", Node.fromNodes(childNodes));
        }
        if (description != null) {
            builder.withMember("description", description);
        }
        if (elementType != null) {
            builder.withMember("elementType", elementType);
        }
        return builder.build();
    }

    @Override
    public Builder toBuilder() {
        return builder()
                .name(name)
                .label(label)
                .type(type)
                .value(value)
                .children(children)
                .readOnly(readOnly)
                .description(description)
                .elementType(elementType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PropertyDescriptor that)) {
            return false;
        }
        return readOnly == that.readOnly
               && name.equals(that.name)
               && label.equals(that.label)
               && type == that.type
               && Objects.equals(value, that.value)
               && children.equals(that.children)
               && Objects.equals(description, that.description)
               && Objects.equals(elementType, that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, value, children);
    }

    @Override
    public String toString() {
        return Node.printJson(toNode());
    }

    private static String lastSegment(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }

    public static final class Builder implements SmithyBuilder<PropertyDescriptor> {
        private String name;
        private String label;
        private PropertyType type;
        private Node value;
        private final List<PropertyDescriptor> children = new ArrayList<>();
        private boolean readOnly;
        private String description;
        private String elementType;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * @param label The display label. Derived from the last segment of
         *              the name when not set.
         * @return The builder
         */
        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder type(PropertyType type) {
            this.type = type;
            return this;
        }

        public Builder value(Node value) {
            this.value = value;
            return this;
        }

        public Builder children(List<PropertyDescriptor> children) {
            this.children.clear();
            this.children.addAll(children);
            return this;
        }

        public Builder readOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder elementType(String elementType) {
            this.elementType = elementType;
            return this;
        }

        @Override
        public PropertyDescriptor build() {
            return new PropertyDescriptor(this);
        }
    }
}
