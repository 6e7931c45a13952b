/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.gmodel;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import software.amazon.smithy.utils.ListUtils;

/**
 * A box on the diagram.
 *
 * @param id The node's id
 * @param type The node's diagram type
 * @param position Top left corner
 * @param size Width and height
 * @param children Owned elements, usually a single label
 */
public record GNode(String id, String type, Point position, Dimension size, List<GModelElement> children)
        implements GModelElement {
    public GNode {
        Objects.requireNonNull(position);
        Objects.requireNonNull(size);
        children = ListUtils.copyOf(children);
    }

    /**
     * @return The first label child, if any
     */
    public Optional<GLabel> label() {
        for (GModelElement child : children) {
            if (child instanceof GLabel label) {
                return Optional.of(label);
            }
        }
        return Optional.empty();
    }

    /**
     * @param other Node to check against
     * @return Whether the bounding boxes of the two nodes intersect with a
     *  non-empty area
     */
    public boolean overlaps(GNode other) {
        return position.x() < other.position.x() + other.size.width()
               && other.position.x() < position.x() + size.width()
               && position.y() < other.position.y() + other.size.height()
               && other.position.y() < position.y() + size.height();
    }
}
