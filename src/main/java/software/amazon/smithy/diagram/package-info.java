/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * Keeps a text document and its diagram in sync.
 *
 * <p>{@link software.amazon.smithy.diagram.DiagramWorkspace} owns the open
 * documents, and {@link software.amazon.smithy.diagram.DiagramService} is
 * the entry point for the editors that read and change them.
 */
package software.amazon.smithy.diagram;
