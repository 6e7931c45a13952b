/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.sync;

import java.util.Optional;
import software.amazon.smithy.diagram.gmodel.GModelRoot;
import software.amazon.smithy.diagram.validation.ValidationResult;

/**
 * A new state of a document's diagram.
 *
 * @param uri The document
 * @param type Why the event was published
 * @param version The document version the model was built from
 * @param model The new model, or {@code null} for a closed document
 * @param validation Markers for the new model, or {@code null} for a closed
 *                   document
 */
public record ModelChangeEvent(
        String uri,
        ChangeType type,
        int version,
        GModelRoot model,
        ValidationResult validation
) {
    public static ModelChangeEvent closed(String uri, int version) {
        return new ModelChangeEvent(uri, ChangeType.CLOSE, version, null, null);
    }

    public Optional<GModelRoot> getModel() {
        return Optional.ofNullable(model);
    }

    public Optional<ValidationResult> getValidation() {
        return Optional.ofNullable(validation);
    }
}
