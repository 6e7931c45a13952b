/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.gmodel;

/**
 * An element of the graphical model.
 */
public sealed interface GModelElement permits GNode, GEdge, GLabel {
    /**
     * @return The element's diagram id
     */
    String id();

    /**
     * @return The diagram type, such as {@code node:entity} or {@code edge:reference}
     */
    String type();
}
