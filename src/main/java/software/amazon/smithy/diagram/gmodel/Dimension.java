/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.gmodel;

/**
 * The size of a diagram node.
 *
 * @param width Width
 * @param height Height
 */
public record Dimension(double width, double height) {
    /**
     * @return Whether both sides are strictly positive
     */
    public boolean isPositive() {
        return width > 0 && height > 0;
    }
}
