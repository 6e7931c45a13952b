/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.edits;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import software.amazon.smithy.diagram.gmodel.Dimension;
import software.amazon.smithy.diagram.gmodel.Point;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;

/**
 * Diagram positions and sizes kept beside the document, keyed by element id.
 *
 * <p>Nodes created from the diagram don't have an id until the document is
 * reparsed, so their drop location is held as pending under the generated
 * name and claimed when the new id is minted.
 */
public final class LayoutMetadata {
    private final Map<String, Point> positions = new ConcurrentHashMap<>();
    private final Map<String, Dimension> sizes = new ConcurrentHashMap<>();
    private final Map<String, Point> pendingPositions = new ConcurrentHashMap<>();

    public Optional<Point> position(String elementId) {
        return Optional.ofNullable(positions.get(elementId));
    }

    public Optional<Dimension> size(String elementId) {
        return Optional.ofNullable(sizes.get(elementId));
    }

    public void setPosition(String elementId, Point position) {
        positions.put(elementId, position);
    }

    public void setSize(String elementId, Dimension size) {
        sizes.put(elementId, size);
    }

    /**
     * @param name The name a node is being created with
     * @param position Where the node was dropped on the diagram
     */
    public void rememberPending(String name, Point position) {
        pendingPositions.put(name, position);
    }

    /**
     * Moves the pending position for {@code name}, if there is one, to
     * {@code elementId}.
     *
     * @param name The name of a newly parsed node
     * @param elementId The id minted for it
     * @return Whether a pending position was claimed
     */
    public boolean claimPending(String name, String elementId) {
        Point position = pendingPositions.remove(name);
        if (position == null) {
            return false;
        }
        positions.put(elementId, position);
        return true;
    }

    /**
     * Drops the layout of every element not in {@code elementIds}.
     *
     * @param elementIds The ids that still exist
     */
    public void retainAll(Set<String> elementIds) {
        positions.keySet().retainAll(elementIds);
        sizes.keySet().retainAll(elementIds);
    }

    /**
     * @return Positions and sizes as {@code {id: {x, y, width, height}}},
     *  with only the members that are set
     */
    public ObjectNode toNode() {
        ObjectNode.Builder builder = Node.objectNodeBuilder();
        Set<String> ids = new TreeSet<>(positions.keySet());
        ids.addAll(sizes.keySet());
        for (String id : ids) {
            ObjectNode.Builder entry = Node.objectNodeBuilder();
            Point position = positions.get(id);
            if (position != null) {
                entry.withMember("x", position.x()).withMember("y", position.y());
            }
            Dimension size = sizes.get(id);
            if (size != null) {
                entry.withMember("width", size.width()).withMember("height", size.height());
            }
            builder.withMember(id, entry.build());
        }
        return builder.build();
    }

    /**
     * Replaces the stored layout with the layout in {@code node}, the form
     * produced by {@link #toNode()}.
     *
     * @param node Stored layout
     */
    public void load(ObjectNode node) {
        positions.clear();
        sizes.clear();
        node.getStringMap().forEach((id, value) -> value.asObjectNode().ifPresent(entry -> {
            Optional<Double> x = entry.getNumberMember("x").map(n -> n.getValue().doubleValue());
            Optional<Double> y = entry.getNumberMember("y").map(n -> n.getValue().doubleValue());
            if (x.isPresent() && y.isPresent()) {
                positions.put(id, new Point(x.get(), y.get()));
            }
            Optional<Double> width = entry.getNumberMember("width").map(n -> n.getValue().doubleValue());
            Optional<Double> height = entry.getNumberMember("height").map(n -> n.getValue().doubleValue());
            if (width.isPresent() && height.isPresent()) {
                sizes.put(id, new Dimension(width.get(), height.get()));
            }
        }));
    }
}
