/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.gmodel;

import java.util.List;
import software.amazon.smithy.utils.ListUtils;

/**
 * The root of a graphical model. Each conversion of a document produces a
 * new root with a higher revision.
 *
 * @param id The document-derived root id
 * @param revision Increasing revision number
 * @param children All nodes and edges, nodes first
 */
public record GModelRoot(String id, long revision, List<GModelElement> children) {
    public static final String TYPE = "graph";

    public GModelRoot {
        children = ListUtils.copyOf(children);
    }

    public List<GNode> nodes() {
        return children.stream()
                .filter(GNode.class::isInstance)
                .map(GNode.class::cast)
                .toList();
    }

    public List<GEdge> edges() {
        return children.stream()
                .filter(GEdge.class::isInstance)
                .map(GEdge.class::cast)
                .toList();
    }
}
