/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.edits;

import java.util.List;
import java.util.Optional;
import org.eclipse.lsp4j.TextEdit;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.utils.ListUtils;

/**
 * The outcome of a diagram or property change. A failed result never
 * carries edits.
 *
 * @param success Whether the change can be made
 * @param edits The text edits making the change, to be applied together
 * @param error Why the change can't be made, or {@code null}
 * @param astNode The node the change produced or affected, if any
 * @param version The document version the edits were computed against, or
 *                {@link #UNVERSIONED}
 */
public record EditResult(boolean success, List<TextEdit> edits, String error, AstNode astNode, int version) {
    public static final int UNVERSIONED = -1;

    public EditResult {
        edits = ListUtils.copyOf(edits);
        if (!success && !edits.isEmpty()) {
            throw new IllegalArgumentException("A failed edit result can't carry edits");
        }
    }

    public static EditResult ok(List<TextEdit> edits) {
        return new EditResult(true, edits, null, null, UNVERSIONED);
    }

    public static EditResult ok(List<TextEdit> edits, AstNode astNode) {
        return new EditResult(true, edits, null, astNode, UNVERSIONED);
    }

    public static EditResult failure(String error) {
        return new EditResult(false, List.of(), error, null, UNVERSIONED);
    }

    /**
     * @param version The document version the edits were computed against
     * @return This result, stamped with {@code version}
     */
    public EditResult withVersion(int version) {
        return new EditResult(success, edits, error, astNode, version);
    }

    public boolean isVersioned() {
        return version != UNVERSIONED;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<AstNode> getAstNode() {
        return Optional.ofNullable(astNode);
    }
}
