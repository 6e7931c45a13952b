/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.grammar;

import software.amazon.smithy.diagram.document.Document;

/**
 * Turns document text into an AST. Implementations must produce a complete
 * tree even for text with syntax errors, reporting the errors as diagnostics,
 * and must give every parsed node a {@link software.amazon.smithy.diagram.ast.CstNode}.
 */
@FunctionalInterface
public interface DocumentParser {
    /**
     * @param document The text to parse. It is not retained.
     * @return The parse result
     */
    ParseResult parse(Document document);
}
