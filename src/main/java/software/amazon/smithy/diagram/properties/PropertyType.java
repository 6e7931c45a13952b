/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.properties;

import java.util.Locale;

/**
 * The kind of editor a property is shown with.
 */
public enum PropertyType {
    STRING,
    NUMBER,
    BOOLEAN,
    REFERENCE,
    ARRAY,
    OBJECT;

    /**
     * @return The lowercase name used on the wire
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return wireName();
    }
}
