/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.properties;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstValue;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.utils.ListUtils;

/**
 * Builds property descriptor trees from AST nodes.
 *
 * <p>Nested nodes are expanded into {@link PropertyType#OBJECT} descriptors
 * whose children are named with dot-paths ({@code score.value}). Lists of
 * nodes that all share one type are expanded into
 * {@link PropertyType#ARRAY} descriptors whose children describe the shape
 * of the first element, with names that are not prefixed because each
 * element is edited as an independent record. Lists of nodes of different
 * types have no single shape and are left out.
 *
 * <p>Expansion stops at {@code maxDepth}: past it, nested nodes and lists of
 * nodes are left out, so the descriptor tree is bounded regardless of how
 * deeply the AST nests.
 */
public final class PropertyExtractor {
    public static final int DEFAULT_MAX_DEPTH = 3;
    public static final String MIXED_VALUES = "(Mixed values)";
    public static final String EMPTY_ARRAY = "Empty array";

    private static final Logger LOGGER = Logger.getLogger(PropertyExtractor.class.getName());
    private static final CancelChecker NEVER_CANCELLED = () -> { };

    private final List<PropertyOverride> overrides;
    private final int maxDepth;

    public PropertyExtractor(List<PropertyOverride> overrides, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative, was " + maxDepth);
        }
        this.overrides = ListUtils.copyOf(overrides);
        this.maxDepth = maxDepth;
    }

    public PropertyExtractor(List<PropertyOverride> overrides) {
        this(overrides, DEFAULT_MAX_DEPTH);
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * @param node The node to describe
     * @return Descriptors for every property field of the node
     */
    public List<PropertyDescriptor> extract(AstNode node) {
        return extract(node, NEVER_CANCELLED);
    }

    /**
     * @param node The node to describe
     * @param cancelChecker Checked before each node is visited
     * @return Descriptors for every property field of the node
     * @throws java.util.concurrent.CancellationException If cancelled
     */
    public List<PropertyDescriptor> extract(AstNode node, CancelChecker cancelChecker) {
        return extract(node, 0, "", cancelChecker);
    }

    /**
     * Extracts the properties shared by several nodes. A property survives
     * when every node has a property of the same name and type. When the
     * nodes' values for it differ, the value is left unknown and the
     * description marks it as mixed.
     *
     * @param nodes The selected nodes
     * @param cancelChecker Checked before each node is visited
     * @return The common descriptors, in the first node's order
     * @throws java.util.concurrent.CancellationException If cancelled
     */
    public List<PropertyDescriptor> extractCommon(List<AstNode> nodes, CancelChecker cancelChecker) {
        if (nodes.isEmpty()) {
            return List.of();
        }
        if (nodes.size() == 1) {
            return extract(nodes.get(0), cancelChecker);
        }

        List<List<PropertyDescriptor>> perNode = new ArrayList<>(nodes.size());
        for (AstNode node : nodes) {
            perNode.add(extract(node, cancelChecker));
        }

        List<PropertyDescriptor> common = new ArrayList<>();
        for (PropertyDescriptor first : perNode.get(0)) {
            boolean shared = true;
            boolean sameValue = true;
            for (int i = 1; i < perNode.size() && shared; i++) {
                Optional<PropertyDescriptor> other = find(perNode.get(i), first);
                if (other.isEmpty()) {
                    shared = false;
                } else if (!sameValue(first, other.get())) {
                    sameValue = false;
                }
            }

            if (!shared) {
                continue;
            }
            if (sameValue) {
                common.add(first);
            } else {
                common.add(first.toBuilder().value(null).description(MIXED_VALUES).build());
            }
        }
        return common;
    }

    /**
     * Extracts a selection, describing what was selected.
     *
     * @param elementIds The requested ids
     * @param nodes The nodes the ids resolved to
     * @param cancelChecker Checked before each node is visited
     * @return The extraction result
     * @throws java.util.concurrent.CancellationException If cancelled
     */
    public PropertyExtractionResult extractSelection(
            List<String> elementIds,
            List<AstNode> nodes,
            CancelChecker cancelChecker
    ) {
        if (elementIds.isEmpty()) {
            return new PropertyExtractionResult(List.of(), List.of(), "No selection", false, null);
        }
        if (nodes.isEmpty()) {
            return PropertyExtractionResult.failure(elementIds, "Elements not found",
                    "Could not find AST nodes for selected elements");
        }

        boolean isMultiSelect = nodes.size() > 1;
        return new PropertyExtractionResult(
                elementIds,
                extractCommon(nodes, cancelChecker),
                typeLabel(nodes),
                isMultiSelect,
                null);
    }

    static String typeLabel(List<AstNode> nodes) {
        Set<String> types = new LinkedHashSet<>();
        for (AstNode node : nodes) {
            types.add(node.type());
        }
        String firstType = types.iterator().next();
        if (nodes.size() == 1) {
            return firstType;
        }
        if (types.size() == 1) {
            return nodes.size() + " " + firstType + "s";
        }
        return nodes.size() + " elements";
    }

    private static Optional<PropertyDescriptor> find(List<PropertyDescriptor> descriptors, PropertyDescriptor like) {
        for (PropertyDescriptor descriptor : descriptors) {
            if (descriptor.name().equals(like.name()) && descriptor.type() == like.type()) {
                return Optional.of(descriptor);
            }
        }
        return Optional.empty();
    }

    // Values are plain trees with references already flattened to text, so
    // the comparison always terminates.
    private static boolean sameValue(PropertyDescriptor a, PropertyDescriptor b) {
        return Objects.equals(a.value().orElse(null), b.value().orElse(null));
    }

    private List<PropertyDescriptor> extract(AstNode node, int depth, String prefix, CancelChecker cancelChecker) {
        cancelChecker.checkCanceled();

        List<PropertyDescriptor> descriptors = new ArrayList<>();
        for (Map.Entry<String, AstValue> entry : node.fields().entrySet()) {
            String fieldName = entry.getKey();
            AstValue value = entry.getValue();
            if (PropertyClassifier.classify(fieldName, value, overrides) != FieldClassification.PROPERTY) {
                continue;
            }

            String name = prefix.isEmpty() ? fieldName : prefix + "." + fieldName;
            FieldExtraction extraction = new FieldExtraction(node, fieldName, name, depth, cancelChecker);
            value.accept(extraction).ifPresent(descriptors::add);
        }
        return descriptors;
    }

    private final class FieldExtraction implements AstValue.Visitor<Optional<PropertyDescriptor>> {
        private final AstNode owner;
        private final String fieldName;
        private final String name;
        private final int depth;
        private final CancelChecker cancelChecker;

        private FieldExtraction(AstNode owner, String fieldName, String name, int depth, CancelChecker cancelChecker) {
            this.owner = owner;
            this.fieldName = fieldName;
            this.name = name;
            this.depth = depth;
            this.cancelChecker = cancelChecker;
        }

        @Override
        public Optional<PropertyDescriptor> str(AstValue.Str str) {
            return leaf(str);
        }

        @Override
        public Optional<PropertyDescriptor> num(AstValue.Num num) {
            return leaf(num);
        }

        @Override
        public Optional<PropertyDescriptor> bool(AstValue.Bool bool) {
            return leaf(bool);
        }

        @Override
        public Optional<PropertyDescriptor> ident(AstValue.Ident ident) {
            return leaf(ident);
        }

        @Override
        public Optional<PropertyDescriptor> nullValue(AstValue.Null nullValue) {
            return leaf(nullValue);
        }

        @Override
        public Optional<PropertyDescriptor> ref(AstValue.Ref ref) {
            return leaf(ref);
        }

        @Override
        public Optional<PropertyDescriptor> child(AstValue.Child child) {
            if (depth >= maxDepth) {
                return Optional.empty();
            }

            AstNode nested = child.node();
            return Optional.of(descriptor(PropertyType.OBJECT)
                    .value(PropertyValues.toNode(nested))
                    .children(extract(nested, depth + 1, name, cancelChecker))
                    .build());
        }

        @Override
        public Optional<PropertyDescriptor> many(AstValue.Many many) {
            List<AstValue> elements = many.elements();
            if (elements.isEmpty()) {
                return Optional.of(descriptor(PropertyType.ARRAY)
                        .value(Node.arrayNode())
                        .readOnly(true)
                        .description(EMPTY_ARRAY)
                        .build());
            }

            int refs = 0;
            int nodes = 0;
            for (AstValue element : elements) {
                if (element instanceof AstValue.Ref) {
                    refs++;
                } else if (element.isNode()) {
                    nodes++;
                }
            }

            if (refs == elements.size()) {
                return Optional.of(descriptor(PropertyType.STRING)
                        .value(Node.from(joined(elements)))
                        .readOnly(true)
                        .description(refs + " reference(s)")
                        .build());
            } else if (nodes == 0) {
                return Optional.of(descriptor(PropertyType.STRING)
                        .value(Node.from(joined(elements)))
                        .readOnly(true)
                        .build());
            } else if (depth >= maxDepth) {
                return Optional.empty();
            }

            String elementType = uniformType(elements);
            if (elementType == null) {
                LOGGER.fine(() -> "Leaving out " + owner.type() + "." + fieldName
                                  + " because its elements don't share a single type");
                return Optional.empty();
            }

            AstNode template = ((AstValue.Child) elements.get(0)).node();
            return Optional.of(descriptor(PropertyType.ARRAY)
                    .value(PropertyValues.toNode(many))
                    .children(extract(template, depth + 1, "", cancelChecker))
                    .elementType(elementType)
                    .build());
        }

        private Optional<PropertyDescriptor> leaf(AstValue value) {
            return Optional.of(descriptor(PropertyClassifier.typeOf(value))
                    .value(PropertyValues.toNode(value))
                    .build());
        }

        private PropertyDescriptor.Builder descriptor(PropertyType type) {
            return PropertyDescriptor.builder()
                    .name(name)
                    .label(PropertyLabels.fromFieldName(fieldName))
                    .type(type);
        }
    }

    private static String joined(List<AstValue> elements) {
        List<String> texts = new ArrayList<>(elements.size());
        for (AstValue element : elements) {
            texts.add(PropertyValues.displayText(element));
        }
        return String.join(", ", texts);
    }

    // The shared type of a list made only of nodes, or null.
    private static String uniformType(List<AstValue> elements) {
        String type = null;
        for (AstValue element : elements) {
            if (!(element instanceof AstValue.Child child)) {
                return null;
            }
            if (type == null) {
                type = child.node().type();
            } else if (!type.equals(child.node().type())) {
                return null;
            }
        }
        return type;
    }
}
