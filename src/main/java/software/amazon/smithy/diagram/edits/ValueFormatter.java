/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.edits;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import software.amazon.smithy.diagram.ast.AstValue;
import software.amazon.smithy.model.node.Node;

/**
 * Writes property values as source text.
 */
public final class ValueFormatter {
    private ValueFormatter() {
    }

    /**
     * Formats a value for the field it replaces. A string replacing a
     * reference or a bare token is written bare, so that editing a reference
     * keeps it a reference; other strings are quoted.
     *
     * @param value The new value
     * @param current The field's current value, or {@code null} if the field
     *                isn't set
     * @return The source text of the value
     */
    public static String format(Node value, AstValue current) {
        if (value.isStringNode()) {
            String text = value.expectStringNode().getValue();
            boolean bareCurrent = current instanceof AstValue.Ref || current instanceof AstValue.Ident;
            if (bareCurrent && isBareToken(text)) {
                return text;
            }
            return quote(text);
        }
        return format(value);
    }

    /**
     * @param value The value
     * @return The source text of the value, with strings quoted
     */
    public static String format(Node value) {
        if (value.isBooleanNode()) {
            return String.valueOf(value.expectBooleanNode().getValue());
        } else if (value.isNumberNode()) {
            return number(value.expectNumberNode().getValue());
        } else if (value.isStringNode()) {
            return quote(value.expectStringNode().getValue());
        } else if (value.isNullNode()) {
            return "null";
        } else if (value.isArrayNode()) {
            List<String> elements = new ArrayList<>();
            for (Node element : value.expectArrayNode().getElements()) {
                elements.add(format(element));
            }
            return "[" + String.join(", ", elements) + "]";
        }

        List<String> members = new ArrayList<>();
        for (Map.Entry<String, Node> member : value.expectObjectNode().getStringMap().entrySet()) {
            members.add(member.getKey() + ": " + format(member.getValue()));
        }
        return members.isEmpty() ? "{}" : "{ " + String.join(", ", members) + " }";
    }

    /**
     * @param number A number
     * @return The number in plain decimal notation, without a fractional
     *  part when it is integral
     */
    public static String number(Number number) {
        BigDecimal decimal = new BigDecimal(number.toString());
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.stripTrailingZeros().toPlainString();
    }

    /**
     * @param text Text to quote
     * @return The text as a string literal, with backslashes and quotes
     *  escaped
     */
    public static String quote(String text) {
        StringBuilder builder = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> builder.append("\\\\");
                case '"' -> builder.append("\\\"");
                case '\n' -> builder.append("\\n");
                default -> builder.append(c);
            }
        }
        return builder.append('"').toString();
    }

    static boolean isBareToken(String text) {
        if (text.isEmpty() || !(Character.isLetter(text.charAt(0)) || text.charAt(0) == '_')) {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }
}
