/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import org.eclipse.lsp4j.TextEdit;
import software.amazon.smithy.diagram.ast.ReferenceResolver;
import software.amazon.smithy.diagram.document.Document;
import software.amazon.smithy.diagram.edits.EditResult;
import software.amazon.smithy.diagram.grammar.DocumentParser;
import software.amazon.smithy.diagram.grammar.EntityDslParser;
import software.amazon.smithy.diagram.grammar.Manifest;
import software.amazon.smithy.diagram.identity.ElementIdRegistry;
import software.amazon.smithy.diagram.protocol.LspAdapter;
import software.amazon.smithy.diagram.sync.ChangePropagationPipeline;
import software.amazon.smithy.diagram.util.Result;

/**
 * The open documents of one grammar, and the pipeline that tells
 * subscribers about their changes.
 */
public final class DiagramWorkspace implements AutoCloseable {
    public static final String DOCUMENT_NOT_OPEN = "Document not open";
    public static final String INVALID_EDIT_RANGE = "Invalid edit range";

    private static final Logger LOGGER = Logger.getLogger(DiagramWorkspace.class.getName());

    private final DocumentParser parser;
    private final Manifest manifest;
    private final ReferenceResolver resolver;
    private final SyncOptions options;
    private final ChangePropagationPipeline pipeline;
    private final Map<String, OpenDocument> documents = new ConcurrentHashMap<>();

    public DiagramWorkspace(DocumentParser parser, Manifest manifest, ReferenceResolver resolver, SyncOptions options) {
        this.parser = parser;
        this.manifest = manifest;
        this.resolver = resolver;
        this.options = options;
        this.pipeline = new ChangePropagationPipeline(options.getDefaultDebounceMs(), options.getMaxDebounceMs());
    }

    /**
     * @param options The options to use
     * @return A workspace of entities documents
     */
    public static DiagramWorkspace forEntities(SyncOptions options) {
        EntityDslParser parser = EntityDslParser.withBundledManifest();
        return new DiagramWorkspace(parser, parser.manifest(), ReferenceResolver.byName(), options);
    }

    private record OpenDocument(Document document, DocumentContext context) {
    }

    public ChangePropagationPipeline pipeline() {
        return pipeline;
    }

    public SyncOptions options() {
        return options;
    }

    /**
     * Opens a document at version 0, replacing it if it was already open.
     *
     * @param uri The document's URI
     * @param text The document's text
     * @return The new document's context
     * @throws IllegalArgumentException If {@code uri} isn't a document URI
     */
    public DocumentContext open(String uri, String text) {
        if (!LspAdapter.isDocumentUri(uri)) {
            throw new IllegalArgumentException("Invalid URI format: " + uri);
        }

        Document document = Document.of(text);
        DocumentContext context = new DocumentContext(uri, parser, manifest, resolver, new ElementIdRegistry(),
                options);
        context.reparse(0, document);
        OpenDocument previous = documents.put(uri, new OpenDocument(document, context));
        if (previous != null) {
            LOGGER.fine(() -> "Reopened " + uri);
        }
        pipeline.onParsed(uri, context::changeEvent);
        return context;
    }

    /**
     * Applies edits to an open document the way an editor would, then
     * reparses it and notifies its subscribers.
     *
     * @param uri The document's URI
     * @param edits Edits to apply, with ranges in the current text
     * @return The document's context, or empty if the document isn't open
     */
    public Optional<DocumentContext> change(String uri, List<TextEdit> edits) {
        OpenDocument open = documents.get(uri);
        if (open == null) {
            LOGGER.warning(() -> "Tried to change a document that isn't open: " + uri);
            return Optional.empty();
        }

        DocumentContext context = open.context();
        synchronized (open) {
            open.document().applyEdits(edits);
            context.reparse(context.version() + 1, open.document());
        }
        pipeline.onParsed(uri, context::changeEvent);
        return Optional.of(context);
    }

    /**
     * Applies edits that were computed against a known version of a document.
     * Nothing is applied when the document has moved on since, or when any
     * edit's range is outside of the current text.
     *
     * @param uri The document's URI
     * @param expectedVersion The version the edits were computed against
     * @param edits Edits to apply
     * @return The document's context, or why the edits were refused
     */
    public Result<DocumentContext, String> change(String uri, int expectedVersion, List<TextEdit> edits) {
        OpenDocument open = documents.get(uri);
        if (open == null) {
            return Result.err(DOCUMENT_NOT_OPEN);
        }

        DocumentContext context = open.context();
        synchronized (open) {
            int actualVersion = context.version();
            if (actualVersion != expectedVersion) {
                LOGGER.warning(() -> "Refusing edits to " + uri + " computed against version " + expectedVersion
                                     + ", the document is at version " + actualVersion);
                return Result.err(versionConflict(expectedVersion, actualVersion));
            }
            for (TextEdit edit : edits) {
                if (!open.document().isValidRange(edit.getRange())) {
                    LOGGER.warning(() -> "Refusing edits to " + uri + " with range " + edit.getRange());
                    return Result.err(INVALID_EDIT_RANGE + ": " + edit.getRange());
                }
            }
            open.document().applyEdits(edits);
            context.reparse(actualVersion + 1, open.document());
        }
        pipeline.onParsed(uri, context::changeEvent);
        return Result.ok(context);
    }

    /**
     * Applies the edits of a successful edit result, checking they aren't
     * stale. Results without a version are checked against the current one.
     *
     * @param uri The document's URI
     * @param result The edits to apply
     * @return The document's context, or why the edits were refused
     */
    public Result<DocumentContext, String> apply(String uri, EditResult result) {
        if (!result.success()) {
            return Result.err(result.getError().orElse("Edit failed"));
        }
        if (result.isVersioned()) {
            return change(uri, result.version(), result.edits());
        }
        return context(uri)
                .map(context -> change(uri, context.version(), result.edits()))
                .orElseGet(() -> Result.err(DOCUMENT_NOT_OPEN));
    }

    private static String versionConflict(int expectedVersion, int actualVersion) {
        return "Version conflict: edits were computed against version " + expectedVersion
               + " but the document is at version " + actualVersion;
    }

    /**
     * Closes a document. Its subscribers get a final event and are dropped.
     *
     * @param uri The document's URI
     */
    public void close(String uri) {
        OpenDocument open = documents.remove(uri);
        if (open == null) {
            return;
        }
        pipeline.onClosed(uri, open.context().version());
        open.context().registry().clear();
    }

    /**
     * @param uri The document's URI
     * @return The document's context, if it's open
     */
    public Optional<DocumentContext> context(String uri) {
        OpenDocument open = documents.get(uri);
        return open == null ? Optional.empty() : Optional.of(open.context());
    }

    /**
     * @param uri The document's URI
     * @return The current text of the document, if it's open
     */
    public Optional<String> text(String uri) {
        OpenDocument open = documents.get(uri);
        return open == null ? Optional.empty() : Optional.of(open.document().copyText());
    }

    @Override
    public void close() {
        documents.clear();
        pipeline.close();
    }
}
