/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.sync;

/**
 * Why a model change event was published.
 */
public enum ChangeType {
    /**
     * The document was reparsed.
     */
    UPDATE,

    /**
     * The document was closed. No further events follow.
     */
    CLOSE
}
