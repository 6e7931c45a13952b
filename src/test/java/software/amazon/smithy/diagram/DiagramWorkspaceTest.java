/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static software.amazon.smithy.diagram.UtilMatchers.anOptionalOf;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.edits.EditResult;
import software.amazon.smithy.diagram.gmodel.GLabel;
import software.amazon.smithy.diagram.gmodel.GNode;
import software.amazon.smithy.diagram.gmodel.Point;
import software.amazon.smithy.diagram.protocol.LspAdapter;
import software.amazon.smithy.diagram.sync.ChangeType;
import software.amazon.smithy.diagram.sync.ModelChangeEvent;
import software.amazon.smithy.diagram.util.Result;
import software.amazon.smithy.model.node.Node;

public class DiagramWorkspaceTest {
    private static final String URI = TestDocuments.URI;

    private DiagramWorkspace workspace;

    @BeforeEach
    public void setup() {
        workspace = DiagramWorkspace.forEntities(SyncOptions.defaults());
    }

    @AfterEach
    public void teardown() {
        workspace.close();
    }

    @Test
    public void opensDocumentAtVersionZero() {
        DocumentContext context = workspace.open(URI, "entity A { }");

        assertThat(context.version(), is(0));
        assertThat(context.generation().diagnostics(), empty());
        assertThat(workspace.context(URI).isPresent(), is(true));
        assertThat(workspace.text(URI), anOptionalOf(equalTo("entity A { }")));
        assertThat(context.model().nodes(), hasSize(1));
    }

    @Test
    public void rejectsInvalidUri() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> workspace.open("C:model.entities", "entity A { }"));

        assertThat(e.getMessage(), equalTo("Invalid URI format: C:model.entities"));
    }

    @Test
    public void reparsesOnChangeKeepingIds() {
        DocumentContext context = workspace.open(URI, "entity A { }");
        String id = context.registry().idOf(find(context, "A")).get();

        workspace.change(URI, List.of(LspAdapter.insert(new Position(0, 12), "\nentity B { }")));

        assertThat(context.version(), is(1));
        assertThat(workspace.text(URI), anOptionalOf(equalTo("entity A { }\nentity B { }")));
        assertThat(context.registry().idOf(find(context, "A")), anOptionalOf(equalTo(id)));
        assertThat(context.model().nodes(), hasSize(2));
    }

    @Test
    public void ignoresChangesToDocumentsThatAreNotOpen() {
        assertThat(workspace.change(URI, List.of()).isPresent(), is(false));
    }

    @Test
    public void locatesByIdThenByName() {
        DocumentContext context = workspace.open(URI, "entity A { }");
        String id = context.registry().idOf(find(context, "A")).get();

        assertThat(context.locate(id).map(AstNode::name), anOptionalOf(equalTo("A")));
        assertThat(context.locate("A").map(AstNode::name), anOptionalOf(equalTo("A")));
        assertThat(context.locate("B").isPresent(), is(false));
    }

    @Test
    public void placesCreatedNodeWhereItWasDropped() {
        DocumentContext context = workspace.open(URI, "entity Entity1 { }");
        List<TextEdit> edits = context.edits()
                .createNode("node:entity", new Point(120, 80), Node.objectNode())
                .edits();

        workspace.change(URI, edits);

        GNode created = context.model().nodes().stream()
                .filter(node -> node.label().map(GLabel::text).orElse("").equals("Entity2"))
                .findFirst()
                .get();
        assertThat(created.position(), equalTo(new Point(120, 80)));
    }

    @Test
    public void dropsLayoutOfDeletedNodes() {
        DocumentContext context = workspace.open(URI, "entity A { }\nentity B { }");
        String b = context.registry().idOf(find(context, "B")).get();
        context.layout().setPosition(b, new Point(5, 5));

        workspace.change(URI, context.edits().deleteElement(b).edits());

        assertThat(context.layout().position(b).isPresent(), is(false));
    }

    @Test
    public void appliesEditsComputedAgainstCurrentVersion() {
        workspace.open(URI, "entity A { }");
        EditResult rename = new DiagramService(workspace).renameElement(URI, "A", "B");

        Result<DocumentContext, String> applied = workspace.apply(URI, rename);

        assertThat(rename.version(), is(0));
        assertThat(applied.isOk(), is(true));
        assertThat(applied.unwrap().version(), is(1));
        assertThat(workspace.text(URI), anOptionalOf(equalTo("entity B { }")));
    }

    @Test
    public void refusesEditsComputedAgainstOlderVersion() {
        workspace.open(URI, "entity A { }");
        EditResult rename = new DiagramService(workspace).renameElement(URI, "A", "B");
        workspace.change(URI, List.of(LspAdapter.insert(new Position(0, 0), "entity C { }\n")));

        Result<DocumentContext, String> applied = workspace.apply(URI, rename);

        assertThat(applied.isErr(), is(true));
        assertThat(applied.unwrapErr(),
                equalTo("Version conflict: edits were computed against version 0 but the document is at version 1"));
        assertThat(workspace.text(URI), anOptionalOf(equalTo("entity C { }\nentity A { }")));
        assertThat(workspace.context(URI).get().version(), is(1));
    }

    @Test
    public void refusesEditsOutsideDocument() {
        workspace.open(URI, "entity A { }");
        List<TextEdit> edits = List.of(
                LspAdapter.insert(new Position(0, 12), "\nentity B { }"),
                new TextEdit(new Range(new Position(3, 0), new Position(3, 1)), "x"));

        Result<DocumentContext, String> applied = workspace.change(URI, 0, edits);

        assertThat(applied.isErr(), is(true));
        assertThat(applied.unwrapErr(), startsWith(DiagramWorkspace.INVALID_EDIT_RANGE));
        assertThat(workspace.text(URI), anOptionalOf(equalTo("entity A { }")));
        assertThat(workspace.context(URI).get().version(), is(0));
    }

    @Test
    public void refusesBackwardsRange() {
        workspace.open(URI, "entity A { }");
        TextEdit backwards = new TextEdit(new Range(new Position(0, 8), new Position(0, 7)), "B");

        assertThat(workspace.change(URI, 0, List.of(backwards)).isErr(), is(true));
        assertThat(workspace.text(URI), anOptionalOf(equalTo("entity A { }")));
    }

    @Test
    public void refusesVersionedChangeToClosedDocument() {
        Result<DocumentContext, String> applied = workspace.change(URI, 0, List.of());

        assertThat(applied.unwrapErr(), equalTo(DiagramWorkspace.DOCUMENT_NOT_OPEN));
    }

    @Test
    public void refusesFailedEditResult() {
        workspace.open(URI, "entity A { }");

        Result<DocumentContext, String> applied = workspace.apply(URI, EditResult.failure("Unknown node type: x"));

        assertThat(applied.unwrapErr(), equalTo("Unknown node type: x"));
        assertThat(workspace.context(URI).get().version(), is(0));
    }

    @Test
    public void notifiesSubscribersOfChangesAndClose() {
        List<ModelChangeEvent> events = new CopyOnWriteArrayList<>();
        workspace.open(URI, "entity A { }");
        workspace.pipeline().subscribe(URI, 0L, events::add);

        workspace.change(URI, List.of(LspAdapter.insert(new Position(0, 12), "\nentity B { }")));
        workspace.close(URI);

        assertThat(events.stream().map(ModelChangeEvent::type).toList(),
                contains(ChangeType.UPDATE, ChangeType.CLOSE));
        assertThat(events.get(0).version(), is(1));
        assertThat(events.get(0).getModel().get().nodes(), hasSize(2));
        assertThat(events.get(0).getValidation().get().isValid(), is(true));
        assertThat(events.get(1).version(), is(1));
        assertThat(workspace.context(URI).isPresent(), is(false));
    }

    private static AstNode find(DocumentContext context, String name) {
        return context.locate(name).orElseThrow(() -> new AssertionError("No node named " + name));
    }
}
