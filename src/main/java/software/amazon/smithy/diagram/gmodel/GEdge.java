/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.gmodel;

/**
 * A connection between two nodes.
 *
 * @param id The edge's id
 * @param type The edge's diagram type
 * @param sourceId Id of the node the edge starts at
 * @param targetId Id of the node the edge ends at
 */
public record GEdge(String id, String type, String sourceId, String targetId) implements GModelElement {
}
