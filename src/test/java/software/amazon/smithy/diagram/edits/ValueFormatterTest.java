/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.edits;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.diagram.ast.AstValue;
import software.amazon.smithy.model.node.Node;

public class ValueFormatterTest {
    @Test
    public void formatsScalars() {
        assertThat(ValueFormatter.format(Node.from(true)), equalTo("true"));
        assertThat(ValueFormatter.format(Node.nullNode()), equalTo("null"));
        assertThat(ValueFormatter.format(Node.from(42)), equalTo("42"));
        assertThat(ValueFormatter.format(Node.from(new BigDecimal("1.50"))), equalTo("1.5"));
        assertThat(ValueFormatter.format(Node.from(new BigDecimal("0.000"))), equalTo("0"));
        assertThat(ValueFormatter.format(Node.from(new BigDecimal("1E+3"))), equalTo("1000"));
    }

    @Test
    public void escapesStrings() {
        assertThat(ValueFormatter.format(Node.from("say \"hi\"\\\n")), equalTo("\"say \\\"hi\\\"\\\\\\n\""));
    }

    @Test
    public void formatsCollections() {
        Node array = Node.arrayNode(Node.from(1), Node.from("a"));
        Node object = Node.objectNodeBuilder()
                .withMember("x", 1)
                .withMember("label", "b")
                .build();

        assertThat(ValueFormatter.format(array), equalTo("[1, \"a\"]"));
        assertThat(ValueFormatter.format(object), equalTo("{ x: 1, label: \"b\" }"));
        assertThat(ValueFormatter.format(Node.objectNode()), equalTo("{}"));
    }

    @Test
    public void keepsBareValuesBare() {
        assertThat(ValueFormatter.format(Node.from("Other"), new AstValue.Ref("Base")), equalTo("Other"));
        assertThat(ValueFormatter.format(Node.from("user"), new AstValue.Ident("admin")), equalTo("user"));
        assertThat(ValueFormatter.format(Node.from("not bare"), new AstValue.Ident("admin")),
                equalTo("\"not bare\""));
        assertThat(ValueFormatter.format(Node.from("Other"), new AstValue.Str("Base")), equalTo("\"Other\""));
        assertThat(ValueFormatter.format(Node.from("Other"), null), equalTo("\"Other\""));
    }

    @Test
    public void recognizesBareTokens() {
        assertThat(ValueFormatter.isBareToken("_a1"), is(true));
        assertThat(ValueFormatter.isBareToken("1a"), is(false));
        assertThat(ValueFormatter.isBareToken("a-b"), is(false));
        assertThat(ValueFormatter.isBareToken(""), is(false));
    }
}
