/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.properties;

import java.util.Locale;
import java.util.Optional;

/**
 * Whether an AST field is surfaced on the property-editing surface or treated
 * as structure.
 */
public enum FieldClassification {
    PROPERTY,
    CHILD;

    /**
     * @param value Lowercase name, as written in a manifest
     * @return The classification, if {@code value} names one
     */
    public static Optional<FieldClassification> fromString(String value) {
        for (FieldClassification classification : values()) {
            if (classification.name().equals(value.toUpperCase(Locale.ROOT))) {
                return Optional.of(classification);
            }
        }
        return Optional.empty();
    }
}
