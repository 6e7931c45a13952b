/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.edits;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static software.amazon.smithy.diagram.LspMatchers.hasText;
import static software.amazon.smithy.diagram.LspMatchers.makesEditedDocument;
import static software.amazon.smithy.diagram.LspMatchers.togetherMakeEditedDocument;
import static software.amazon.smithy.diagram.UtilMatchers.anOptionalOf;

import java.util.List;
import java.util.Objects;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.diagram.TestDocuments;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstWalker;
import software.amazon.smithy.diagram.gmodel.Dimension;
import software.amazon.smithy.diagram.gmodel.Point;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;

public class TextEditGeneratorTest {
    @Test
    public void replacesOnlyTheValueSpan() {
        String text = """
                entity User {
                    age: 30
                    firstName: "Ada"
                }
                """;
        TestDocuments.Parsed parsed = TestDocuments.parse(text);

        EditResult result = generator(parsed).updateProperty(List.of("User"), "age", Node.from(31));

        assertThat(result.success(), is(true));
        assertThat(result.edits(), hasSize(1));
        TextEdit edit = result.edits().get(0);
        assertThat(edit.getRange(), hasText(parsed.document(), equalTo("30")));
        assertThat(edit, makesEditedDocument(parsed.document(), text.replace("age: 30", "age: 31")));
    }

    @Test
    public void quotesStringsAndKeepsReferencesBare() {
        TestDocuments.Parsed parsed = TestDocuments.parse("""
                entity User {
                    firstName: "Ada"
                    extends: Base
                    role: admin
                }
                """);
        TextEditGenerator generator = generator(parsed);

        assertThat(generator.updateProperty(List.of("User"), "firstName", Node.from("Grace")).edits().get(0)
                .getNewText(), equalTo("\"Grace\""));
        assertThat(generator.updateProperty(List.of("User"), "extends", Node.from("Other")).edits().get(0)
                .getNewText(), equalTo("Other"));
        assertThat(generator.updateProperty(List.of("User"), "role", Node.from("two words")).edits().get(0)
                .getNewText(), equalTo("\"two words\""));
    }

    @Test
    public void insertsFieldThatIsNotWritten() {
        TestDocuments.Parsed parsed = TestDocuments.parse("""
                entity User {
                    age: 30
                }
                """);

        EditResult result = generator(parsed).updateProperty(List.of("User"), "email", Node.from("a@b"));

        assertThat(result.success(), is(true));
        assertThat(result.edits(), togetherMakeEditedDocument(parsed.document(), """
                entity User {
                    age: 30
                  email: "a@b"
                }
                """));
    }

    @Test
    public void insertsDefaultedField() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity User {\n}\n");

        EditResult result = generator(parsed).updateProperty(List.of("User"), "description", Node.from("x"));

        assertThat(result.edits(), togetherMakeEditedDocument(parsed.document(),
                "entity User {\n  description: \"x\"\n}\n"));
    }

    @Test
    public void updatesNestedField() {
        String text = """
                entity User {
                    score: Score { value: 3 }
                }
                """;
        TestDocuments.Parsed parsed = TestDocuments.parse(text);

        EditResult result = generator(parsed).updateProperty(List.of("User"), "score.value", Node.from(4));

        assertThat(result.edits(), togetherMakeEditedDocument(parsed.document(), text.replace("3", "4")));
    }

    @Test
    public void updatesEverySelectedElement() {
        TestDocuments.Parsed parsed = TestDocuments.parse("""
                entity A { x: 1 }
                entity B { x: 2 }
                """);

        EditResult result = generator(parsed).updateProperty(List.of("A", "B", "A"), "x", Node.from(5));

        assertThat(result.edits(), hasSize(2));
        assertThat(result.edits(), togetherMakeEditedDocument(parsed.document(), """
                entity A { x: 5 }
                entity B { x: 5 }
                """));
    }

    @Test
    public void failsWithoutEditsOnUnknownElement() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity A { x: 1 }");

        EditResult result = generator(parsed).updateProperty(List.of("A", "Nope"), "x", Node.from(5));

        assertThat(result.success(), is(false));
        assertThat(result.edits(), empty());
        assertThat(result.getError(), anOptionalOf(equalTo("Element not found: Nope")));
    }

    @Test
    public void failsWithoutEditsOnEmptySelection() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity A { x: 1 }");

        EditResult result = generator(parsed).updateProperty(List.of(), "x", Node.from(5));

        assertThat(result.success(), is(false));
        assertThat(result.getError(), anOptionalOf(equalTo("No elements to update")));
    }

    @Test
    public void failsWithoutEditsOnPathPastEndOfList() {
        TestDocuments.Parsed parsed = TestDocuments.parse("""
                entity n1 {
                    scores: [{ notes: "x" }]
                }
                """);

        EditResult result = generator(parsed).updateProperty(List.of("n1"), "scores[1].notes", Node.from("ok"));

        assertThat(result.success(), is(false));
        assertThat(result.edits(), empty());
        assertThat(result.getError(), anOptionalOf(containsString("Cannot navigate to property path")));
    }

    @Test
    public void createdNodeParsesBackWithUniqueName() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity Entity1 { }");
        LayoutMetadata layout = new LayoutMetadata();

        EditResult result = generator(parsed, layout).createNode("node:entity", new Point(10, 20), Node.objectNode());

        assertThat(result.success(), is(true));
        assertThat(result.getAstNode().map(AstNode::name), anOptionalOf(equalTo("Entity2")));
        assertThat(result.edits(), togetherMakeEditedDocument(parsed.document(),
                "entity Entity1 { }\n\nentity Entity2 {\n}\n"));

        TestDocuments.Parsed reparsed = TestDocuments.parse(apply(parsed, result));
        List<AstNode> entities = AstWalker.streamAllContents(reparsed.root())
                .filter(node -> node.type().equals("Entity"))
                .toList();
        assertThat(entities, hasSize(2));
        assertThat(entities.stream().filter(node -> Objects.equals(node.name(), "Entity2")).count(), is(1L));
        assertThat(reparsed.diagnostics(), empty());
        assertThat(layout.claimPending("Entity2", "e2"), is(true));
        assertThat(layout.position("e2"), anOptionalOf(equalTo(new Point(10, 20))));
    }

    @Test
    public void createsNodeWithGivenNameAtGivenPosition() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity A { }\nentity B { }\n");
        ObjectNode args = Node.objectNodeBuilder()
                .withMember("name", "Middle")
                .withMember("insertAt", Node.objectNodeBuilder()
                        .withMember("line", 1)
                        .withMember("character", 0)
                        .build())
                .build();

        EditResult result = generator(parsed).createNode("node:package", null, args);

        assertThat(result.edits(), togetherMakeEditedDocument(parsed.document(),
                "entity A { }\n\n\npackage Middle {\n}\nentity B { }\n"));
    }

    @Test
    public void fallsBackToTypeNameHeuristics() {
        TestDocuments.Parsed parsed = TestDocuments.parse("");

        EditResult result = generator(parsed).createNode("custom-property", null, Node.objectNode());

        assertThat(result.success(), is(true));
        assertThat(result.edits().get(0).getNewText(), equalTo("\n\nproperty Property1 {\n}\n"));
    }

    @Test
    public void failsToCreateUnknownNodeType() {
        TestDocuments.Parsed parsed = TestDocuments.parse("");

        EditResult result = generator(parsed).createNode("node:widget", null, Node.objectNode());

        assertThat(result.success(), is(false));
        assertThat(result.getError(), anOptionalOf(equalTo("Unknown node type: node:widget")));
    }

    @Test
    public void createsEdgeAsReferenceField() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity A {\n}\nentity B {\n}\n");
        TextEditGenerator generator = generator(parsed);

        EditResult inheritance = generator.createEdge("edge:inheritance", "A", "B", Node.objectNode());
        EditResult custom = generator.createEdge("edge:custom", "A", "B", Node.objectNode());
        EditResult named = generator.createEdge("edge:custom", "A", "B",
                Node.objectNode().withMember("propertyName", "owner"));

        assertThat(inheritance.edits(), togetherMakeEditedDocument(parsed.document(),
                "entity A {\n  extends: B\n}\nentity B {\n}\n"));
        assertThat(custom.edits().get(0).getNewText(), equalTo("  ref: B\n"));
        assertThat(named.edits().get(0).getNewText(), equalTo("  owner: B\n"));
    }

    @Test
    public void failsToCreateEdgeToUnknownNode() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity A { }");

        EditResult result = generator(parsed).createEdge("edge:reference", "A", "Nope", Node.objectNode());

        assertThat(result.success(), is(false));
        assertThat(result.getError(), anOptionalOf(equalTo("Source or target node not found")));
    }

    @Test
    public void deletesNodeSource() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity A { }\nentity B { }\n");

        EditResult result = generator(parsed).deleteElement("B");

        assertThat(result.edits(), togetherMakeEditedDocument(parsed.document(), "entity A { }\n\n"));
    }

    @Test
    public void deletingUnknownElementSucceedsWithoutEdits() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity A { }");

        EditResult result = generator(parsed).deleteElement("Nope");

        assertThat(result.success(), is(true));
        assertThat(result.edits(), empty());
    }

    @Test
    public void renamesOnlyTheName() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity Admin { }");

        EditResult result = generator(parsed).renameElement("Admin", "Root");

        assertThat(result.success(), is(true));
        TextEdit edit = result.edits().get(0);
        assertThat(edit.getRange(), equalTo(new Range(new Position(0, 7), new Position(0, 12))));
        assertThat(edit.getNewText(), equalTo("Root"));
        assertThat(TestDocuments.parse(apply(parsed, result)).find("Root").isPresent(), is(true));
    }

    @Test
    public void renamesNameThatIsPartOfKeyword() {
        TestDocuments.Parsed parsed = TestDocuments.parse("package pack {\n}\n");

        EditResult result = generator(parsed).renameElement("pack", "x");

        assertThat(result.success(), is(true));
        assertThat(result.edits().get(0).getRange(), equalTo(new Range(new Position(0, 8), new Position(0, 12))));
        String renamed = apply(parsed, result);
        assertThat(renamed, equalTo("package x {\n}\n"));
        assertThat(TestDocuments.parse(renamed).find("x").map(AstNode::type), anOptionalOf(equalTo("Package")));
    }

    @Test
    public void renamesEntityNamedLikeItsKeyword() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity t { }\nentity ent { }\n");

        String renamed = apply(parsed, generator(parsed).renameElement("t", "T"));
        renamed = apply(TestDocuments.parse(renamed), generator(TestDocuments.parse(renamed)).renameElement("ent", "E"));

        assertThat(renamed, equalTo("entity T { }\nentity E { }\n"));
    }

    @Test
    public void failsToRenameUnknownElement() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity Admin { }");

        EditResult result = generator(parsed).renameElement("Nope", "Root");

        assertThat(result.success(), is(false));
        assertThat(result.getError(), anOptionalOf(equalTo("Element not found or not nameable")));
    }

    @Test
    public void rewritesWrittenPosition() {
        TestDocuments.Parsed parsed = TestDocuments.parse("""
                entity A {
                    position: { x: 1, y: 2 }
                }
                entity B { }
                """);
        LayoutMetadata layout = new LayoutMetadata();
        TextEditGenerator generator = generator(parsed, layout);

        EditResult written = generator.applyPosition("A", new Point(10, 20.5));
        EditResult unwritten = generator.applyPosition("B", new Point(3, 4));

        assertThat(written.edits(), hasSize(1));
        assertThat(written.edits().get(0).getNewText(), equalTo("{ x: 10, y: 20.5 }"));
        assertThat(unwritten.success(), is(true));
        assertThat(unwritten.edits(), empty());
        assertThat(layout.position("B"), anOptionalOf(equalTo(new Point(3, 4))));
    }

    @Test
    public void recordsSize() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity A { size: { width: 1, height: 1 } }");
        LayoutMetadata layout = new LayoutMetadata();

        EditResult result = generator(parsed, layout).applySize("A", new Dimension(200, 100));

        assertThat(result.edits().get(0).getNewText(), equalTo("{ width: 200, height: 100 }"));
        assertThat(layout.size("A"), anOptionalOf(equalTo(new Dimension(200, 100))));
    }

    @Test
    public void generatesNamesThatAreNotTaken() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity Entity1 { }\nentity Entity3 { }\n");

        assertThat(generator(parsed).generateName("Entity"), equalTo("Entity2"));
        assertThat(generator(parsed).generateName("Package"), equalTo("Package1"));
    }

    private static TextEditGenerator generator(TestDocuments.Parsed parsed) {
        return generator(parsed, new LayoutMetadata());
    }

    private static TextEditGenerator generator(TestDocuments.Parsed parsed, LayoutMetadata layout) {
        return new TextEditGenerator(
                parsed.sourceIndex(),
                parsed.root(),
                id -> AstWalker.findByName(parsed.root(), id),
                TestDocuments.manifest(),
                layout);
    }

    private static String apply(TestDocuments.Parsed parsed, EditResult result) {
        var copy = parsed.document().copy();
        copy.applyEdits(result.edits());
        return copy.copyText();
    }
}
