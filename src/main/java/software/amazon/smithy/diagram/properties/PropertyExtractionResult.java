/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.properties;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.ToNode;
import software.amazon.smithy.utils.ListUtils;

/**
 * The properties of a selection of diagram elements.
 *
 * @param elementIds The selected element ids
 * @param properties Descriptors common to the whole selection
 * @param typeLabel Human-readable description of what is selected
 * @param isMultiSelect Whether more than one element was found
 * @param error Why extraction failed, or {@code null}
 */
public record PropertyExtractionResult(
        List<String> elementIds,
        List<PropertyDescriptor> properties,
        String typeLabel,
        boolean isMultiSelect,
        String error
) implements ToNode {
    public PropertyExtractionResult {
        elementIds = ListUtils.copyOf(elementIds);
        properties = ListUtils.copyOf(properties);
    }

    public static PropertyExtractionResult failure(List<String> elementIds, String typeLabel, String error) {
        return new PropertyExtractionResult(elementIds, List.of(), typeLabel, false, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * @param name Property name
     * @return The top-level property with the given name
     */
    public Optional<PropertyDescriptor> property(String name) {
        return properties.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    @Override
    public Node toNode() {
        List<Node> propertyNodes = new ArrayList<>(properties.size());
        for (PropertyDescriptor property : properties) {
            propertyNodes.add(property.toNode());
        }
        ObjectNode.Builder builder = Node.objectNodeBuilder()
                .withMember("elementIds", Node.fromStrings(elementIds))
                .withMember("properties", Node.fromNodes(propertyNodes))
                .withMember("typeLabel", typeLabel)
                .withMember("isMultiSelect", isMultiSelect);
        if (error != null) {
            builder.withMember("error", error);
        }
        return builder.build();
    }
}
