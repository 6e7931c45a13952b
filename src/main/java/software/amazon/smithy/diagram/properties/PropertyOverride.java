/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.properties;

import java.util.Objects;

/**
 * A manifest-declared classification for a field, taking priority over the
 * shape-based heuristics.
 *
 * @param property The AST field name the override applies to
 * @param classification The classification to use
 */
public record PropertyOverride(String property, FieldClassification classification) {
    public PropertyOverride {
        Objects.requireNonNull(property);
        Objects.requireNonNull(classification);
    }
}
