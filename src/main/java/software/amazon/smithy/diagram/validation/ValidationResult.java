/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.validation;

import java.util.ArrayList;
import java.util.List;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ToNode;
import software.amazon.smithy.utils.ListUtils;

/**
 * The markers of one validation pass.
 *
 * @param markers All markers found
 * @param cancelled Whether the pass was cancelled before it finished, in
 *                  which case {@code markers} is empty
 */
public record ValidationResult(List<DiagramMarker> markers, boolean cancelled) implements ToNode {
    public ValidationResult {
        markers = ListUtils.copyOf(markers);
    }

    public static ValidationResult of(List<DiagramMarker> markers) {
        return new ValidationResult(markers, false);
    }

    public static ValidationResult cancelledResult() {
        return new ValidationResult(List.of(), true);
    }

    public int errorCount() {
        return count(MarkerSeverity.ERROR);
    }

    public int warningCount() {
        return count(MarkerSeverity.WARNING);
    }

    /**
     * @return Whether the pass finished without finding errors
     */
    public boolean isValid() {
        return !cancelled && errorCount() == 0;
    }

    /**
     * @param code A marker code
     * @return The markers with that code
     */
    public List<DiagramMarker> markersWithCode(String code) {
        return markers.stream().filter(marker -> marker.code().equals(code)).toList();
    }

    private int count(MarkerSeverity severity) {
        int count = 0;
        for (DiagramMarker marker : markers) {
            if (marker.severity() == severity) {
                count++;
            }
        }
        return count;
    }

    @Override
    public Node toNode() {
        List<Node> markerNodes = new ArrayList<>(markers.size());
        for (DiagramMarker marker : markers) {
            markerNodes.add(marker.toNode());
        }
        return Node.objectNodeBuilder()
                .withMember("markers", Node.fromNodes(markerNodes))
                .withMember("isValid", isValid())
                .withMember("errorCount", errorCount())
                .withMember("warningCount", warningCount())
                .build();
    }
}
