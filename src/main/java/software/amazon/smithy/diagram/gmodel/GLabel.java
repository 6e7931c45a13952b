/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.gmodel;

/**
 * A text label owned by a node.
 *
 * @param id The label's id
 * @param type The label's diagram type
 * @param text The displayed text
 */
public record GLabel(String id, String type, String text) implements GModelElement {
    public static final String DEFAULT_TYPE = "label";
}
