/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import software.amazon.smithy.diagram.edits.EditResult;
import software.amazon.smithy.diagram.edits.TextEditGenerator;
import software.amazon.smithy.diagram.gmodel.Dimension;
import software.amazon.smithy.diagram.gmodel.Point;
import software.amazon.smithy.diagram.properties.PropertyExtractionResult;
import software.amazon.smithy.diagram.sync.ModelChangeListener;
import software.amazon.smithy.diagram.sync.SubscriptionHandle;
import software.amazon.smithy.diagram.validation.DiagramMarker;
import software.amazon.smithy.diagram.validation.DiagramValidator;
import software.amazon.smithy.diagram.validation.MarkerSeverity;
import software.amazon.smithy.diagram.validation.ValidationResult;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;

/**
 * Operations the property panel, the diagram editor and the text editor call
 * on open documents.
 *
 * <p>No operation throws. Each returns a result saying whether it succeeded,
 * and a failed operation never returns edits. Edits are computed against the
 * document's latest parse and stamped with its version; callers apply them
 * through {@link DiagramWorkspace#apply}, which refuses stale edits.
 */
public final class DiagramService {
    public static final String DOCUMENT_NOT_OPEN = DiagramWorkspace.DOCUMENT_NOT_OPEN;
    public static final String CANCELLED = "Request was cancelled";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private static final Logger LOGGER = Logger.getLogger(DiagramService.class.getName());
    private static final CancelChecker NEVER_CANCELLED = () -> { };

    private final DiagramWorkspace workspace;

    public DiagramService(DiagramWorkspace workspace) {
        this.workspace = workspace;
    }

    public DiagramWorkspace workspace() {
        return workspace;
    }

    public PropertyExtractionResult extractProperties(String uri, List<String> elementIds) {
        return extractProperties(uri, elementIds, NEVER_CANCELLED);
    }

    /**
     * @param uri The document
     * @param elementIds The selection
     * @param cancelChecker Checked between nodes
     * @return The properties the selection has in common
     */
    public PropertyExtractionResult extractProperties(
            String uri,
            List<String> elementIds,
            CancelChecker cancelChecker
    ) {
        Optional<DocumentContext> context = workspace.context(uri);
        if (context.isEmpty()) {
            return PropertyExtractionResult.failure(elementIds, "Error", DOCUMENT_NOT_OPEN);
        }

        try {
            return context.get().extractProperties(elementIds, cancelChecker);
        } catch (CancellationException e) {
            return PropertyExtractionResult.failure(elementIds, "Cancelled", CANCELLED);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, e, () -> "Failed to extract properties of " + elementIds + " in " + uri);
            return PropertyExtractionResult.failure(elementIds, "Error", String.valueOf(e.getMessage()));
        }
    }

    public EditResult updateProperty(String uri, List<String> elementIds, String path, Node value) {
        return edit(uri, "updateProperty", edits -> edits.updateProperty(elementIds, path, value));
    }

    public EditResult createNode(String uri, String nodeType, Point location, ObjectNode args) {
        return edit(uri, "createNode", edits -> edits.createNode(nodeType, location, args));
    }

    public EditResult createEdge(String uri, String edgeType, String sourceId, String targetId, ObjectNode args) {
        return edit(uri, "createEdge", edits -> edits.createEdge(edgeType, sourceId, targetId, args));
    }

    public EditResult deleteElement(String uri, String elementId) {
        return edit(uri, "deleteElement", edits -> edits.deleteElement(elementId));
    }

    public EditResult renameElement(String uri, String elementId, String newName) {
        return edit(uri, "renameElement", edits -> edits.renameElement(elementId, newName));
    }

    public EditResult applyPosition(String uri, String elementId, Point position) {
        return edit(uri, "applyPosition", edits -> edits.applyPosition(elementId, position));
    }

    public EditResult applySize(String uri, String elementId, Dimension size) {
        return edit(uri, "applySize", edits -> edits.applySize(elementId, size));
    }

    public ValidationResult validate(String uri) {
        return validate(uri, NEVER_CANCELLED);
    }

    /**
     * @param uri The document
     * @param cancelChecker Checked between units of work
     * @return Markers for the document's diagram. A document that isn't open,
     *  or a pass that fails, gives a single error marker.
     */
    public ValidationResult validate(String uri, CancelChecker cancelChecker) {
        Optional<DocumentContext> context = workspace.context(uri);
        if (context.isEmpty()) {
            return ValidationResult.of(List.of(internalError(DOCUMENT_NOT_OPEN)));
        }

        try {
            return context.get().validate(cancelChecker);
        } catch (CancellationException e) {
            return ValidationResult.cancelledResult();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, e, () -> "Failed to validate " + uri);
            return ValidationResult.of(List.of(internalError(String.valueOf(e.getMessage()))));
        }
    }

    /**
     * @param uri The document to watch
     * @param debounceMs Quiet period before delivering, or {@code null} for
     *                   the configured default
     * @param listener Receives the events
     * @return A handle to unsubscribe with
     * @throws IllegalArgumentException If {@code uri} isn't a document URI
     */
    public SubscriptionHandle subscribe(String uri, Long debounceMs, ModelChangeListener listener) {
        return workspace.pipeline().subscribe(uri, debounceMs, listener);
    }

    public void unsubscribe(SubscriptionHandle handle) {
        workspace.pipeline().unsubscribe(handle);
    }

    private EditResult edit(String uri, String operation, Function<TextEditGenerator, EditResult> change) {
        Optional<DocumentContext> context = workspace.context(uri);
        if (context.isEmpty()) {
            return EditResult.failure(DOCUMENT_NOT_OPEN);
        }

        try {
            TextEditGenerator generator = context.get().edits();
            return change.apply(generator).withVersion(generator.version());
        } catch (CancellationException e) {
            return EditResult.failure(CANCELLED);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, e, () -> operation + " failed on " + uri);
            return EditResult.failure(String.valueOf(e.getMessage()));
        }
    }

    private static DiagramMarker internalError(String message) {
        return new DiagramMarker("", MarkerSeverity.ERROR, message, INTERNAL_ERROR, DiagramValidator.SOURCE);
    }
}
