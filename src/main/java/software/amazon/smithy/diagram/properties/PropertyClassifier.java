/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.properties;

import java.util.List;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstValue;

/**
 * Decides which AST fields show up on the property-editing surface.
 */
public final class PropertyClassifier {
    private static final AstValue.Visitor<PropertyType> TYPE_OF = new AstValue.Visitor<>() {
        @Override
        public PropertyType str(AstValue.Str str) {
            return PropertyType.STRING;
        }

        @Override
        public PropertyType num(AstValue.Num num) {
            return PropertyType.NUMBER;
        }

        @Override
        public PropertyType bool(AstValue.Bool bool) {
            return PropertyType.BOOLEAN;
        }

        @Override
        public PropertyType ident(AstValue.Ident ident) {
            return PropertyType.STRING;
        }

        @Override
        public PropertyType nullValue(AstValue.Null nullValue) {
            return PropertyType.STRING;
        }

        @Override
        public PropertyType ref(AstValue.Ref ref) {
            return PropertyType.REFERENCE;
        }

        @Override
        public PropertyType child(AstValue.Child child) {
            return PropertyType.OBJECT;
        }

        @Override
        public PropertyType many(AstValue.Many many) {
            return PropertyType.ARRAY;
        }
    };

    private PropertyClassifier() {
    }

    /**
     * Classifies a field. An override naming the field always wins, then
     * internal fields are structural, then every other field is a property:
     * scalars and references as leaves, lists and nested nodes expanded by
     * {@link PropertyExtractor}.
     *
     * @param fieldName The field's name
     * @param value The field's value
     * @param overrides Manifest-declared classifications
     * @return The classification
     */
    public static FieldClassification classify(String fieldName, AstValue value, List<PropertyOverride> overrides) {
        for (PropertyOverride override : overrides) {
            if (override.property().equals(fieldName)) {
                return override.classification();
            }
        }

        if (AstNode.isInternalField(fieldName)) {
            return FieldClassification.CHILD;
        }

        return FieldClassification.PROPERTY;
    }

    /**
     * @param value A field value
     * @return The editor type the value is shown with, before any array
     *  flattening
     */
    public static PropertyType typeOf(AstValue value) {
        return value.accept(TYPE_OF);
    }
}
