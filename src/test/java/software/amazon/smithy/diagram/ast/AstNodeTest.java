/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.ast;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.diagram.TestDocuments;

public class AstNodeTest {
    @Test
    public void adoptsNestedNodes() {
        AstNode first = AstNode.builder("Entity").field("name", new AstValue.Ident("A")).build();
        AstNode second = AstNode.builder("Entity").field("name", new AstValue.Ident("B")).build();
        AstNode root = AstNode.builder("Model")
                .field("elements", new AstValue.Many(List.of(new AstValue.Child(first), new AstValue.Child(second))))
                .build();

        assertThat(second.container(), sameInstance(root));
        assertThat(second.containerField(), equalTo("elements"));
        assertThat(second.containerIndex(), is(1));
        assertThat(root.containerField(), equalTo(""));
        assertThat(root.namedAncestor(), nullValue());
    }

    @Test
    public void refusesSecondContainer() {
        AstNode shared = AstNode.builder("Entity").build();
        AstNode.builder("Model").field("a", new AstValue.Child(shared)).build();

        assertThrows(IllegalStateException.class,
                () -> AstNode.builder("Model").field("b", new AstValue.Child(shared)).build());
    }

    @Test
    public void walksInPreOrder() {
        TestDocuments.Parsed parsed = TestDocuments.parse("""
                package P {
                    entity A { }
                    entity B { }
                }
                entity C { }
                """);

        List<String> names = AstWalker.streamAllContents(parsed.root()).map(AstNode::name).toList();

        assertThat(names, contains("P", "A", "B", "C"));
        assertThat(parsed.node("B").namedAncestor().name(), equalTo("P"));
        assertThat(AstWalker.findByName(parsed.root(), "C").map(AstNode::type).get(), equalTo("Entity"));
    }

    @Test
    public void skipsInternalFields() {
        AstNode hidden = AstNode.builder("Entity").build();
        AstNode root = AstNode.builder("Model").field("$meta", new AstValue.Child(hidden)).build();

        assertThat(AstWalker.children(root).isEmpty(), is(true));
        assertThat(AstNode.isInternalField("_x"), is(true));
    }

    @Test
    public void resolvesReferencesByName() {
        TestDocuments.Parsed parsed = TestDocuments.parse("entity A { extends: B }\nentity B { }");

        AstValue.Ref ref = (AstValue.Ref) parsed.node("A").get("extends");

        assertThat(ReferenceResolver.byName().resolve(ref, parsed.root()).map(AstNode::name).get(), equalTo("B"));
        assertThat(ReferenceResolver.byName().resolve(new AstValue.Ref("Z"), parsed.root()).isPresent(), is(false));
    }
}
