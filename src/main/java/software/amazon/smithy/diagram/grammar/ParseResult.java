/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.grammar;

import java.util.List;
import java.util.Objects;
import org.eclipse.lsp4j.Diagnostic;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.utils.ListUtils;

/**
 * @param root The root of the parsed tree
 * @param diagnostics Syntax problems found while parsing
 */
public record ParseResult(AstNode root, List<Diagnostic> diagnostics) {
    public ParseResult {
        Objects.requireNonNull(root);
        diagnostics = ListUtils.copyOf(diagnostics);
    }
}
