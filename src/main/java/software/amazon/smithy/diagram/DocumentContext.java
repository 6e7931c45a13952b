/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstWalker;
import software.amazon.smithy.diagram.ast.ReferenceResolver;
import software.amazon.smithy.diagram.document.Document;
import software.amazon.smithy.diagram.document.SourceIndex;
import software.amazon.smithy.diagram.edits.LayoutMetadata;
import software.amazon.smithy.diagram.edits.TextEditGenerator;
import software.amazon.smithy.diagram.gmodel.GModelConverter;
import software.amazon.smithy.diagram.gmodel.GModelRoot;
import software.amazon.smithy.diagram.grammar.DocumentParser;
import software.amazon.smithy.diagram.grammar.Manifest;
import software.amazon.smithy.diagram.grammar.ParseResult;
import software.amazon.smithy.diagram.identity.ElementIdRegistry;
import software.amazon.smithy.diagram.properties.PropertyExtractionResult;
import software.amazon.smithy.diagram.properties.PropertyExtractor;
import software.amazon.smithy.diagram.sync.ChangeType;
import software.amazon.smithy.diagram.sync.ModelChangeEvent;
import software.amazon.smithy.diagram.validation.DiagramValidator;
import software.amazon.smithy.diagram.validation.ValidationResult;

/**
 * Everything known about one open document: its latest parse, the element
 * ids of that parse's nodes, and the diagram layout. Created when the
 * document is opened and discarded when it's closed.
 *
 * <p>Each reparse publishes a new immutable {@link Generation}. Operations
 * read the generation once, so they see a consistent text, tree and index
 * even if the document is reparsed while they run.
 */
public final class DocumentContext {
    private static final Logger LOGGER = Logger.getLogger(DocumentContext.class.getName());

    private final String uri;
    private final DocumentParser parser;
    private final Manifest manifest;
    private final ElementIdRegistry registry;
    private final LayoutMetadata layout = new LayoutMetadata();
    private final GModelConverter converter;
    private final PropertyExtractor extractor;
    private final DiagramValidator validator;
    private volatile Generation generation;

    DocumentContext(
            String uri,
            DocumentParser parser,
            Manifest manifest,
            ReferenceResolver resolver,
            ElementIdRegistry registry,
            SyncOptions options
    ) {
        this.uri = uri;
        this.parser = parser;
        this.manifest = manifest;
        this.registry = registry;
        this.converter = new GModelConverter(manifest, resolver, options.getDefaultNodeSize());
        this.extractor = new PropertyExtractor(manifest.propertyOverrides(), options.getMaxDepth());
        this.validator = new DiagramValidator(options.getBounds().orElse(null));
    }

    /**
     * One parse of the document.
     *
     * @param version The document version that was parsed
     * @param sourceIndex Index of the parsed text
     * @param parse The parse result
     */
    public record Generation(int version, SourceIndex sourceIndex, ParseResult parse) {
        public AstNode root() {
            return parse.root();
        }

        public List<Diagnostic> diagnostics() {
            return parse.diagnostics();
        }
    }

    public String uri() {
        return uri;
    }

    public Manifest manifest() {
        return manifest;
    }

    public ElementIdRegistry registry() {
        return registry;
    }

    public LayoutMetadata layout() {
        return layout;
    }

    /**
     * @return The latest parse
     */
    public Generation generation() {
        return generation;
    }

    public int version() {
        return generation.version();
    }

    /**
     * Parses a new version of the document and re-identifies its nodes.
     * Layout stored for nodes that no longer exist is dropped, and nodes
     * created from the diagram pick up the position they were created at.
     *
     * @param version The new version
     * @param document The new text. It is copied, not retained.
     * @return The new generation
     */
    synchronized Generation reparse(int version, Document document) {
        Document snapshot = document.copy();
        ParseResult parse = parser.parse(snapshot);
        ElementIdRegistry.ReindexResult reindexed = registry.reindex(parse.root());

        for (String minted : reindexed.minted()) {
            registry.resolve(minted)
                    .map(AstNode::name)
                    .ifPresent(name -> layout.claimPending(name, minted));
        }
        layout.retainAll(registry.ids());

        Generation next = new Generation(version, SourceIndex.of(snapshot), parse);
        this.generation = next;
        LOGGER.finest(() -> "Parsed " + uri + " version " + version + ": " + reindexed);
        return next;
    }

    /**
     * Finds the node an element id stands for. Ids of the registry are tried
     * first, then node names, so callers may address named nodes by name.
     *
     * @param elementId An element id or node name
     * @return The node
     */
    public Optional<AstNode> locate(String elementId) {
        Optional<AstNode> byId = registry.resolve(elementId);
        if (byId.isPresent()) {
            return byId;
        }
        return AstWalker.findByName(generation.root(), elementId);
    }

    /**
     * @return An edit generator over the latest parse
     */
    public TextEditGenerator edits() {
        Generation current = generation;
        return new TextEditGenerator(current.sourceIndex(), current.root(), this::locate, manifest, layout,
                current.version());
    }

    /**
     * @param elementIds The selection
     * @param cancelChecker Checked between nodes
     * @return The properties the selected nodes have in common
     * @throws java.util.concurrent.CancellationException If cancelled
     */
    public PropertyExtractionResult extractProperties(List<String> elementIds, CancelChecker cancelChecker) {
        List<AstNode> nodes = new ArrayList<>();
        for (String elementId : elementIds) {
            locate(elementId).ifPresent(nodes::add);
        }
        return extractor.extractSelection(elementIds, nodes, cancelChecker);
    }

    /**
     * @return The diagram of the latest parse
     */
    public GModelRoot model() {
        return converter.convert(uri, generation.root(), registry, layout);
    }

    /**
     * @param cancelChecker Checked between units of work
     * @return Markers for the diagram of the latest parse
     * @throws java.util.concurrent.CancellationException If cancelled
     */
    public ValidationResult validate(CancelChecker cancelChecker) {
        Generation current = generation;
        GModelRoot model = converter.convert(uri, current.root(), registry, layout);
        return validator.validate(model, current.root(), current.diagnostics(), current.sourceIndex(), registry,
                cancelChecker);
    }

    /**
     * @return The state of the latest parse, for subscribers
     */
    public ModelChangeEvent changeEvent() {
        Generation current = generation;
        GModelRoot model = converter.convert(uri, current.root(), registry, layout);
        ValidationResult validation = validator.validate(model, current.root(), current.diagnostics(),
                current.sourceIndex(), registry, () -> { });
        return new ModelChangeEvent(uri, ChangeType.UPDATE, current.version(), model, validation);
    }
}
