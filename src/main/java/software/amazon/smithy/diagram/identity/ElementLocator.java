/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.identity;

import java.util.Optional;
import software.amazon.smithy.diagram.ast.AstNode;

/**
 * Finds the AST node a diagram element id stands for in the current parse
 * generation.
 */
@FunctionalInterface
public interface ElementLocator {
    /**
     * @param elementId The diagram element id
     * @return The node, or empty if the id doesn't resolve
     */
    Optional<AstNode> locate(String elementId);
}
