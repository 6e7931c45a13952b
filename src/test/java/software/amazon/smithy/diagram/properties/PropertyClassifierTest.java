/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.properties;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstValue;

public class PropertyClassifierTest {
    private static final AstValue CHILD = new AstValue.Child(AstNode.builder("Score").build());
    private static final AstValue MANY = new AstValue.Many(List.of(new AstValue.Str("a")));

    @Test
    public void userFieldsAreProperties() {
        assertThat(PropertyClassifier.classify("name", new AstValue.Str("x"), List.of()),
                equalTo(FieldClassification.PROPERTY));
        assertThat(PropertyClassifier.classify("score", CHILD, List.of()), equalTo(FieldClassification.PROPERTY));
        assertThat(PropertyClassifier.classify("tags", MANY, List.of()), equalTo(FieldClassification.PROPERTY));
    }

    @Test
    public void internalFieldsAreChildren() {
        assertThat(PropertyClassifier.classify("$container", CHILD, List.of()), equalTo(FieldClassification.CHILD));
        assertThat(PropertyClassifier.classify("_cache", new AstValue.Str("x"), List.of()),
                equalTo(FieldClassification.CHILD));
    }

    @Test
    public void overridesWin() {
        List<PropertyOverride> overrides = List.of(
                new PropertyOverride("members", FieldClassification.CHILD),
                new PropertyOverride("$meta", FieldClassification.PROPERTY));

        assertThat(PropertyClassifier.classify("members", MANY, overrides), equalTo(FieldClassification.CHILD));
        assertThat(PropertyClassifier.classify("$meta", new AstValue.Str("x"), overrides),
                equalTo(FieldClassification.PROPERTY));
        assertThat(PropertyClassifier.classify("other", MANY, overrides), equalTo(FieldClassification.PROPERTY));
    }

    @Test
    public void mapsValuesToEditorTypes() {
        assertThat(PropertyClassifier.typeOf(new AstValue.Str("x")), equalTo(PropertyType.STRING));
        assertThat(PropertyClassifier.typeOf(new AstValue.Ident("x")), equalTo(PropertyType.STRING));
        assertThat(PropertyClassifier.typeOf(AstValue.Null.INSTANCE), equalTo(PropertyType.STRING));
        assertThat(PropertyClassifier.typeOf(new AstValue.Num(BigDecimal.ONE)), equalTo(PropertyType.NUMBER));
        assertThat(PropertyClassifier.typeOf(new AstValue.Bool(true)), equalTo(PropertyType.BOOLEAN));
        assertThat(PropertyClassifier.typeOf(new AstValue.Ref("User")), equalTo(PropertyType.REFERENCE));
        assertThat(PropertyClassifier.typeOf(CHILD), equalTo(PropertyType.OBJECT));
        assertThat(PropertyClassifier.typeOf(MANY), equalTo(PropertyType.ARRAY));
    }
}
