/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.gmodel;

/**
 * A location on the diagram canvas.
 *
 * @param x Horizontal coordinate
 * @param y Vertical coordinate
 */
public record Point(double x, double y) {
    public static final Point ORIGIN = new Point(0, 0);
}
