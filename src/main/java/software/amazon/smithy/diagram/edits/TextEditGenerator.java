/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.edits;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.TextEdit;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstValue;
import software.amazon.smithy.diagram.ast.AstWalker;
import software.amazon.smithy.diagram.ast.CstNode;
import software.amazon.smithy.diagram.document.SourceIndex;
import software.amazon.smithy.diagram.gmodel.Dimension;
import software.amazon.smithy.diagram.gmodel.Point;
import software.amazon.smithy.diagram.grammar.Manifest;
import software.amazon.smithy.diagram.identity.ElementLocator;
import software.amazon.smithy.diagram.properties.PropertyPath;
import software.amazon.smithy.diagram.protocol.LspAdapter;
import software.amazon.smithy.diagram.util.Result;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;

/**
 * Turns diagram and property changes into text edits against one parse
 * generation of a document.
 *
 * <p>Edits are computed, never applied: the caller applies them and reparses
 * before asking for more. Every operation either succeeds with all of its
 * edits or fails with none. Edits replace only the text that has to change,
 * so formatting and comments elsewhere are kept.
 */
public final class TextEditGenerator {
    public static final String NAME_ARG = "name";
    public static final String NAME_FIELD = "name";
    public static final String INSERT_AT_ARG = "insertAt";
    public static final String PROPERTY_NAME_ARG = "propertyName";
    public static final String POSITION_FIELD = "position";
    public static final String SIZE_FIELD = "size";

    private static final Logger LOGGER = Logger.getLogger(TextEditGenerator.class.getName());

    private final SourceIndex sourceIndex;
    private final AstNode root;
    private final ElementLocator locator;
    private final Manifest manifest;
    private final LayoutMetadata layout;
    private final int version;

    public TextEditGenerator(
            SourceIndex sourceIndex,
            AstNode root,
            ElementLocator locator,
            Manifest manifest,
            LayoutMetadata layout
    ) {
        this(sourceIndex, root, locator, manifest, layout, EditResult.UNVERSIONED);
    }

    /**
     * @param version The document version {@code root} was parsed from
     */
    public TextEditGenerator(
            SourceIndex sourceIndex,
            AstNode root,
            ElementLocator locator,
            Manifest manifest,
            LayoutMetadata layout,
            int version
    ) {
        this.sourceIndex = sourceIndex;
        this.root = root;
        this.locator = locator;
        this.manifest = manifest;
        this.layout = layout;
        this.version = version;
    }

    /**
     * @return The document version edits are computed against
     */
    public int version() {
        return version;
    }

    /**
     * Sets a field on each of the given elements. When the field is written
     * in source its value is replaced; otherwise a new assignment is inserted
     * before the owning node's closing delimiter.
     *
     * @param elementIds Elements to update
     * @param path Dot-path of the field, such as {@code scores[1].notes}
     * @param value The new value
     * @return The edits, or why the update can't be made
     */
    public EditResult updateProperty(List<String> elementIds, String path, Node value) {
        if (elementIds.isEmpty()) {
            return EditResult.failure("No elements to update");
        }

        PropertyPath propertyPath = PropertyPath.parse(path);
        List<TextEdit> edits = new ArrayList<>();
        for (String elementId : elementIds) {
            Optional<AstNode> node = locator.locate(elementId);
            if (node.isEmpty()) {
                LOGGER.warning(() -> "Can't update " + path + " of unknown element " + elementId);
                return EditResult.failure("Element not found: " + elementId);
            }

            Result<TextEdit, String> edit = propertyPath.navigate(node.get())
                    .flatMap(target -> fieldEdit(target, value));
            if (edit.isErr()) {
                return EditResult.failure(edit.unwrapErr());
            }
            if (!containsEdit(edits, edit.unwrap())) {
                edits.add(edit.unwrap());
            }
        }
        return EditResult.ok(edits);
    }

    /**
     * Inserts a new node declaration.
     *
     * @param nodeType The diagram node type to create
     * @param location Where the node was dropped on the diagram
     * @param args Optional {@code name} for the node and {@code insertAt}
     *             ({@code {line, character}}) for the text position, which
     *             defaults to the end of the document
     * @return The insertion edit with the node that will be parsed from it,
     *  or why the node can't be created
     */
    public EditResult createNode(String nodeType, Point location, ObjectNode args) {
        Optional<String> astType = resolveAstType(nodeType);
        if (astType.isEmpty()) {
            LOGGER.warning(() -> "Can't create node of unknown type " + nodeType);
            return EditResult.failure("Unknown node type: " + nodeType);
        }

        String name = args.getStringMember(NAME_ARG)
                .map(StringNode::getValue)
                .orElseGet(() -> generateName(astType.get()));
        String text = manifest.templateOf(astType.get())
                .orElseGet(() -> fallbackTemplate(astType.get()))
                .replace(Manifest.NAME_PLACEHOLDER, name);

        Position insertAt = args.getObjectMember(INSERT_AT_ARG)
                .map(TextEditGenerator::toPosition)
                .orElseGet(() -> sourceIndex.endOfDocument().getEnd());

        if (location != null) {
            layout.rememberPending(name, location);
        }

        AstNode created = AstNode.builder(astType.get())
                .field(NAME_FIELD, new AstValue.Ident(name))
                .build();
        return EditResult.ok(List.of(LspAdapter.insert(insertAt, text)), created);
    }

    /**
     * Adds a reference from one node to another.
     *
     * @param edgeType The diagram edge type to create
     * @param sourceId Element the reference is written in
     * @param targetId Element the reference points to
     * @param args Optional {@code propertyName} naming the reference field
     * @return The insertion edit, or why the edge can't be created
     */
    public EditResult createEdge(String edgeType, String sourceId, String targetId, ObjectNode args) {
        Optional<AstNode> source = locator.locate(sourceId);
        Optional<AstNode> target = locator.locate(targetId);
        if (source.isEmpty() || target.isEmpty()) {
            LOGGER.warning(() -> "Can't create " + edgeType + " edge between " + sourceId + " and " + targetId);
            return EditResult.failure("Source or target node not found");
        }

        String targetName = target.get().name();
        if (targetName == null) {
            return EditResult.failure("Target node has no name to reference");
        }
        if (!source.get().hasSource()) {
            return EditResult.failure("Source node has no source text");
        }

        String field = args.getStringMember(PROPERTY_NAME_ARG)
                .map(StringNode::getValue)
                .or(() -> manifest.referenceFieldOf(edgeType))
                .orElseGet(() -> defaultReferenceField(edgeType));

        Position insertAt = propertyInsertPosition(source.get());
        return EditResult.ok(List.of(LspAdapter.insert(insertAt, assignment(field, targetName))), source.get());
    }

    /**
     * Deletes the source text of an element. An element that can't be found,
     * or that has no source text, is already gone.
     *
     * @param elementId Element to delete
     * @return The deletion edit, if any
     */
    public EditResult deleteElement(String elementId) {
        Optional<AstNode> node = locator.locate(elementId);
        if (node.isEmpty() || !node.get().hasSource()) {
            return EditResult.ok(List.of());
        }

        CstNode cst = node.get().cstNode();
        return EditResult.ok(List.of(LspAdapter.delete(sourceIndex.rangeOf(cst))), node.get());
    }

    /**
     * Replaces an element's name where its {@code name} field is written.
     * When the parser recorded no span for the name, the first occurrence of
     * the name within the element's source text is replaced instead.
     *
     * @param elementId Element to rename
     * @param newName The new name
     * @return The replacement edit, or why the element can't be renamed
     */
    public EditResult renameElement(String elementId, String newName) {
        Optional<AstNode> node = locator.locate(elementId);
        if (node.isEmpty() || node.get().name() == null) {
            return EditResult.failure("Element not found or not nameable");
        }

        String oldName = node.get().name();
        CstNode nameSpan = sourceIndex.findFieldSpan(node.get(), NAME_FIELD);
        if (nameSpan != null && oldName.equals(sourceIndex.document().copySpan(nameSpan.offset(), nameSpan.end()))) {
            TextEdit edit = new TextEdit(sourceIndex.rangeOf(nameSpan), newName);
            return EditResult.ok(List.of(edit), node.get());
        }

        String text = sourceIndex.textOf(node.get());
        int nameIndex = text == null ? -1 : text.indexOf(oldName);
        if (nameIndex < 0) {
            return EditResult.failure("Cannot find name in source");
        }

        int start = node.get().cstNode().offset() + nameIndex;
        TextEdit edit = new TextEdit(sourceIndex.rangeOf(start, oldName.length()), newName);
        return EditResult.ok(List.of(edit), node.get());
    }

    /**
     * Records a new diagram position for an element. Text is only edited
     * when the element's node writes a {@code position} field in source.
     *
     * @param elementId The moved element
     * @param position The new position
     * @return The edits, usually none
     */
    public EditResult applyPosition(String elementId, Point position) {
        layout.setPosition(elementId, position);
        return layoutFieldEdit(elementId, POSITION_FIELD,
                "{ x: " + ValueFormatter.number(position.x()) + ", y: " + ValueFormatter.number(position.y()) + " }");
    }

    /**
     * Records a new diagram size for an element. Text is only edited when
     * the element's node writes a {@code size} field in source.
     *
     * @param elementId The resized element
     * @param size The new size
     * @return The edits, usually none
     */
    public EditResult applySize(String elementId, Dimension size) {
        layout.setSize(elementId, size);
        return layoutFieldEdit(elementId, SIZE_FIELD,
                "{ width: " + ValueFormatter.number(size.width())
                + ", height: " + ValueFormatter.number(size.height()) + " }");
    }

    /**
     * @param astType An AST type tag
     * @return A name of the form {@code <astType><n>} that no node in the
     *  document has
     */
    public String generateName(String astType) {
        Set<String> existing = new HashSet<>();
        AstWalker.streamAst(root).map(AstNode::name).filter(Objects::nonNull).forEach(existing::add);

        int counter = 1;
        while (existing.contains(astType + counter)) {
            counter++;
        }
        return astType + counter;
    }

    /**
     * @param nodeType A diagram node type
     * @return The AST type declared for it, or else the type suggested by its
     *  name
     */
    public Optional<String> resolveAstType(String nodeType) {
        Optional<String> declared = manifest.astTypeOf(nodeType);
        if (declared.isPresent()) {
            return declared;
        }

        String lower = nodeType.toLowerCase(Locale.ROOT);
        if (lower.contains("entity")) {
            return Optional.of("Entity");
        } else if (lower.contains("property")) {
            return Optional.of("Property");
        } else if (lower.contains("package")) {
            return Optional.of("Package");
        }
        return Optional.empty();
    }

    static String defaultReferenceField(String edgeType) {
        if (edgeType.contains("inheritance")) {
            return "extends";
        } else if (edgeType.contains("composition")) {
            return "contains";
        }
        return "ref";
    }

    private static String fallbackTemplate(String astType) {
        String keyword = astType.toLowerCase(Locale.ROOT);
        if (keyword.equals("class")) {
            keyword = "entity";
        }
        return "\n\n" + keyword + " " + Manifest.NAME_PLACEHOLDER + " {\n}\n";
    }

    private Result<TextEdit, String> fieldEdit(PropertyPath.Target target, Node value) {
        AstNode node = target.node();
        if (!node.hasSource()) {
            return Result.err("Cannot edit " + target.field() + " of " + node + ": it has no source text");
        }

        String formatted = ValueFormatter.format(value, node.get(target.field()));
        CstNode span = sourceIndex.findFieldSpan(node, target.field());
        if (span != null) {
            return Result.ok(new TextEdit(sourceIndex.rangeOf(span), formatted));
        }
        return Result.ok(LspAdapter.insert(propertyInsertPosition(node), assignment(target.field(), formatted)));
    }

    private EditResult layoutFieldEdit(String elementId, String field, String text) {
        Optional<AstNode> node = locator.locate(elementId);
        if (node.isEmpty()) {
            return EditResult.ok(List.of());
        }

        CstNode span = sourceIndex.findFieldSpan(node.get(), field);
        if (span == null) {
            return EditResult.ok(List.of(), node.get());
        }
        return EditResult.ok(List.of(new TextEdit(sourceIndex.rangeOf(span), text)), node.get());
    }

    private Position propertyInsertPosition(AstNode node) {
        int closing = sourceIndex.closingDelimiterOffset(node);
        if (closing >= 0) {
            return sourceIndex.positionAt(closing);
        }
        return sourceIndex.positionAt(node.cstNode().end());
    }

    private static String assignment(String field, String value) {
        return "  " + field + ": " + value + "\n";
    }

    private static boolean containsEdit(List<TextEdit> edits, TextEdit edit) {
        for (TextEdit existing : edits) {
            if (existing.getRange().equals(edit.getRange()) && existing.getNewText().equals(edit.getNewText())) {
                return true;
            }
        }
        return false;
    }

    private static Position toPosition(ObjectNode node) {
        int line = node.getNumberMember("line").map(n -> n.getValue().intValue()).orElse(0);
        int character = node.getNumberMember("character").map(n -> n.getValue().intValue()).orElse(0);
        return new Position(line, character);
    }
}
