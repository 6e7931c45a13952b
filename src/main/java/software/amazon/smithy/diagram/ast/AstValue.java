/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.ast;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import software.amazon.smithy.utils.ListUtils;

/**
 * The closed set of values an {@link AstNode} field can hold.
 *
 * <p>Consumers dispatch over the variants with a {@link Visitor}, which the
 * compiler keeps exhaustive as variants are added.
 */
public sealed interface AstValue {

    /**
     * @param visitor The visitor to dispatch to
     * @param <R> The visitor's result type
     * @return The result of the variant-specific visit method
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * @return Whether this value is an owned nested node
     */
    default boolean isNode() {
        return false;
    }

    /**
     * One method per variant of {@link AstValue}.
     *
     * @param <R> The result type
     */
    interface Visitor<R> {
        R str(Str str);

        R num(Num num);

        R bool(Bool bool);

        R ident(Ident ident);

        R nullValue(Null nullValue);

        R ref(Ref ref);

        R child(Child child);

        R many(Many many);
    }

    /**
     * A quoted string literal.
     *
     * @param value The unescaped string content
     */
    record Str(String value) implements AstValue {
        public Str {
            Objects.requireNonNull(value);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.str(this);
        }
    }

    /**
     * A numeric literal.
     *
     * @param value The number
     */
    record Num(BigDecimal value) implements AstValue {
        public Num {
            Objects.requireNonNull(value);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.num(this);
        }
    }

    /**
     * A boolean literal.
     *
     * @param value The boolean
     */
    record Bool(boolean value) implements AstValue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.bool(this);
        }
    }

    /**
     * A bare token that is not a cross-reference, such as a declared name or
     * an enum-like keyword.
     *
     * @param text The token text
     */
    record Ident(String text) implements AstValue {
        public Ident {
            Objects.requireNonNull(text);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.ident(this);
        }
    }

    /**
     * An explicit or defaulted absence of a value.
     */
    record Null() implements AstValue {
        public static final Null INSTANCE = new Null();

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.nullValue(this);
        }
    }

    /**
     * A symbolic link to another node. Only the display text is held: the
     * target is looked up on demand through a {@link ReferenceResolver}, so a
     * reference never owns its target and reference cycles are harmless.
     *
     * @param text The reference text as written in source
     */
    record Ref(String text) implements AstValue {
        public Ref {
            Objects.requireNonNull(text);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.ref(this);
        }
    }

    /**
     * A nested node owned by the field.
     *
     * @param node The nested node
     */
    record Child(AstNode node) implements AstValue {
        public Child {
            Objects.requireNonNull(node);
        }

        @Override
        public boolean isNode() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.child(this);
        }
    }

    /**
     * An ordered list of values.
     *
     * @param elements The elements, in source order
     */
    record Many(List<AstValue> elements) implements AstValue {
        public Many {
            elements = ListUtils.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.many(this);
        }
    }
}
