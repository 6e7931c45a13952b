/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.ast;

import java.util.Optional;

/**
 * Looks up the target of a {@link AstValue.Ref} within a parse generation.
 */
@FunctionalInterface
public interface ReferenceResolver {

    /**
     * @param ref The reference to resolve
     * @param root The root of the tree the reference appears in
     * @return The referenced node, if it can be found
     */
    Optional<AstNode> resolve(AstValue.Ref ref, AstNode root);

    /**
     * @return A resolver that matches the reference text against node names
     */
    static ReferenceResolver byName() {
        return (ref, root) -> AstWalker.findByName(root, ref.text());
    }
}
