/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.grammar;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

import java.math.BigDecimal;
import java.util.List;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.diagram.TestDocuments;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstValue;
import software.amazon.smithy.diagram.ast.AstWalker;

public class EntityDslParserTest {
    @Test
    public void parsesDeclarationsIntoElements() {
        TestDocuments.Parsed parsed = TestDocuments.parse("""
                entity User { }
                package Billing { }
                """);

        assertThat(parsed.diagnostics(), empty());
        assertThat(parsed.root().type(), equalTo("Model"));
        AstValue.Many elements = (AstValue.Many) parsed.root().get("elements");
        assertThat(elements.elements(), hasSize(2));
        assertThat(parsed.node("User").type(), equalTo("Entity"));
        assertThat(parsed.node("Billing").type(), equalTo("Package"));
        assertThat(parsed.node("Billing").container(), sameInstance(parsed.root()));
        assertThat(parsed.node("Billing").containerField(), equalTo("elements"));
        assertThat(parsed.node("Billing").containerIndex(), is(1));
    }

    @Test
    public void parsesScalarValues() {
        TestDocuments.Parsed parsed = TestDocuments.parse("""
                entity User {
                    description: "A \\"quoted\\" person"
                    age: 42
                    ratio: -1.5
                    active: true
                    nickname: null
                    role: admin
                    extends: Base
                }
                """);
        AstNode user = parsed.node("User");

        assertThat(parsed.diagnostics(), empty());
        assertThat(user.get("description"), equalTo(new AstValue.Str("A \"quoted\" person")));
        assertThat(user.get("age"), equalTo(new AstValue.Num(new BigDecimal("42"))));
        assertThat(user.get("ratio"), equalTo(new AstValue.Num(new BigDecimal("-1.5"))));
        assertThat(user.get("active"), equalTo(new AstValue.Bool(true)));
        assertThat(user.get("nickname"), sameInstance(AstValue.Null.INSTANCE));
        assertThat(user.get("role"), equalTo(new AstValue.Ident("admin")));
        assertThat(user.get("extends"), equalTo(new AstValue.Ref("Base")));
    }

    @Test
    public void parsesNestedNodesAndLists() {
        TestDocuments.Parsed parsed = TestDocuments.parse("""
                entity User {
                    score: Score { value: 3 }
                    roles: [{ name: "a" }, { name: "b" }]
                    tags: [one two]
                }
                """);
        AstNode user = parsed.node("User");

        assertThat(parsed.diagnostics(), empty());
        AstNode score = ((AstValue.Child) user.get("score")).node();
        assertThat(score.type(), equalTo("Score"));
        assertThat(score.container(), sameInstance(user));

        AstValue.Many roles = (AstValue.Many) user.get("roles");
        assertThat(roles.elements(), hasSize(2));
        AstNode second = ((AstValue.Child) roles.elements().get(1)).node();
        assertThat(second.type(), equalTo("Record"));
        assertThat(second.name(), equalTo("b"));
        assertThat(second.containerIndex(), is(1));

        assertThat(user.get("tags"), equalTo(new AstValue.Many(List.of(
                new AstValue.Ident("one"),
                new AstValue.Ident("two")))));
    }

    @Test
    public void nestedDeclarationsBecomeMembers() {
        TestDocuments.Parsed parsed = TestDocuments.parse("""
                package Billing {
                    entity Invoice {
                        property total { type: Number }
                    }
                }
                """);

        AstNode invoice = parsed.node("Invoice");
        AstNode total = parsed.node("total");
        assertThat(parsed.diagnostics(), empty());
        assertThat(invoice.container(), sameInstance(parsed.node("Billing")));
        assertThat(invoice.containerField(), equalTo("members"));
        assertThat(total.type(), equalTo("Property"));
        assertThat(total.namedAncestor(), sameInstance(invoice));
        assertThat(parsed.node("Billing").hasField("members"), is(true));
        assertThat(total.hasField("members"), is(false));
    }

    @Test
    public void appliesManifestDefaults() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity A { abstract: true }");
        AstNode a = parsed.node("A");

        assertThat(a.get("abstract"), equalTo(new AstValue.Bool(true)));
        assertThat(a.get("description"), sameInstance(AstValue.Null.INSTANCE));
        assertThat(parsed.sourceIndex().findFieldSpan(a, "abstract").length(), is(4));
    }

    @Test
    public void ignoresCommentsAndCommas() {
        TestDocuments.Parsed parsed = TestDocuments.parse("""
                // a comment
                entity A { x: 1, y: 2, } // trailing
                """);

        assertThat(parsed.diagnostics(), empty());
        assertThat(parsed.node("A").get("y"), equalTo(new AstValue.Num(new BigDecimal("2"))));
    }

    @Test
    public void recoversFromMissingClosingBrace() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity A {\n    x: 1\n");

        assertThat(parsed.diagnostics(), hasSize(1));
        Diagnostic diagnostic = parsed.diagnostics().get(0);
        assertThat(diagnostic.getMessage(), equalTo("missing }"));
        assertThat(diagnostic.getSeverity(), equalTo(DiagnosticSeverity.Error));
        assertThat(diagnostic.getSource(), equalTo("parser"));
        assertThat(parsed.node("A").get("x"), instanceOf(AstValue.Num.class));
    }

    @Test
    public void recoversFromUnexpectedTokens() {
        TestDocuments.Parsed parsed = TestDocuments.parse("""
                entity A { x: 1 }
                ??? entity B { }
                """);

        assertThat(parsed.diagnostics(), hasSize(1));
        assertThat(parsed.diagnostics().get(0).getMessage(), containsString("unexpected token ???"));
        assertThat(parsed.find("B").isPresent(), is(true));
    }

    @Test
    public void reportsMissingValue() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity A { x: }");

        assertThat(parsed.diagnostics(), hasSize(1));
        assertThat(parsed.diagnostics().get(0).getMessage(), equalTo("expected a value"));
        assertThat(parsed.node("A").hasField("x"), is(false));
    }

    @Test
    public void reportsUnclosedString() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity A {\n    d: \"open\n}");

        assertThat(parsed.diagnostics(), hasSize(1));
        assertThat(parsed.diagnostics().get(0).getMessage(), equalTo("unclosed string literal"));
        assertThat(parsed.node("A").get("d"), equalTo(new AstValue.Str("open")));
    }

    @Test
    public void warnsOnDuplicateField() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity A { x: 1 x: 2 }");

        assertThat(parsed.diagnostics(), hasSize(1));
        assertThat(parsed.diagnostics().get(0).getSeverity(), equalTo(DiagnosticSeverity.Warning));
        assertThat(parsed.node("A").get("x"), equalTo(new AstValue.Num(new BigDecimal("2"))));
    }

    @Test
    public void reportsMissingName() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity { }");

        assertThat(parsed.diagnostics().get(0).getMessage(), equalTo("expected a name after 'entity'"));
        assertThat(AstWalker.streamAllContents(parsed.root()).count(), is(0L));
    }

    @Test
    public void emptyDocumentParsesToEmptyModel() {
        TestDocuments.Parsed parsed = TestDocuments.parse("");

        assertThat(parsed.diagnostics(), empty());
        assertThat(((AstValue.Many) parsed.root().get("elements")).elements(), empty());
        assertThat(parsed.root().cstNode().length(), is(0));
    }

    @Test
    public void everyParsedNodeHasSource() {
        TestDocuments.Parsed parsed = TestDocuments.parse("""
                entity User {
                    score: Score { value: 3 }
                    roles: [{ name: "a" }]
                    property id { }
                }
                """);

        assertThat(AstWalker.streamAst(parsed.root()).allMatch(AstNode::hasSource), is(true));
        assertThat(AstWalker.streamAst(parsed.root()).map(AstNode::type).toList(),
                contains("Model", "Entity", "Score", "Record", "Property"));
    }
}
