/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.properties;

import java.util.Locale;
import java.util.Set;
import software.amazon.smithy.utils.SetUtils;

/**
 * Derives display labels from field names.
 */
public final class PropertyLabels {
    private static final Set<String> ABBREVIATIONS = SetUtils.of("id", "url", "uri", "api", "http", "html", "css", "js");

    private PropertyLabels() {
    }

    /**
     * Converts a camelCase field name to Title Case words, upper-casing
     * common abbreviations, so {@code parentId} becomes {@code Parent ID}.
     *
     * @param fieldName The field name
     * @return The label
     */
    public static String fromFieldName(String fieldName) {
        StringBuilder spaced = new StringBuilder();
        for (int i = 0; i < fieldName.length(); i++) {
            char c = fieldName.charAt(i);
            if (Character.isUpperCase(c) && i > 0) {
                spaced.append(' ');
            }
            spaced.append(c);
        }

        StringBuilder label = new StringBuilder();
        for (String word : spaced.toString().trim().split(" ")) {
            if (word.isEmpty()) {
                continue;
            }
            if (label.length() > 0) {
                label.append(' ');
            }
            if (ABBREVIATIONS.contains(word.toLowerCase(Locale.ROOT))) {
                label.append(word.toUpperCase(Locale.ROOT));
            } else {
                label.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        return label.toString();
    }
}
