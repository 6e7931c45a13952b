/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.validation;

import java.util.Objects;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ToNode;

/**
 * A problem found on one diagram element.
 *
 * @param elementId The element the problem is on
 * @param severity How bad it is
 * @param message Human-readable description
 * @param code Machine-readable kind, such as {@code SELF_LOOP}
 * @param source What reported it
 */
public record DiagramMarker(
        String elementId,
        MarkerSeverity severity,
        String message,
        String code,
        String source
) implements ToNode {
    public DiagramMarker {
        Objects.requireNonNull(elementId);
        Objects.requireNonNull(severity);
        Objects.requireNonNull(message);
        Objects.requireNonNull(code);
        Objects.requireNonNull(source);
    }

    @Override
    public Node toNode() {
        return Node.objectNodeBuilder()
                .withMember("elementId", elementId)
                .withMember("severity", severity.wireName())
                .withMember("message", message)
                .withMember("code", code)
                .withMember("source", source)
                .build();
    }
}
