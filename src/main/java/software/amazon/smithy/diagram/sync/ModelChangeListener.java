/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.sync;

@FunctionalInterface
public interface ModelChangeListener {
    void onModelChanged(ModelChangeEvent event);
}
