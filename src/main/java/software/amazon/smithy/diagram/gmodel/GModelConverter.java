/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.gmodel;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstValue;
import software.amazon.smithy.diagram.ast.AstWalker;
import software.amazon.smithy.diagram.ast.ReferenceResolver;
import software.amazon.smithy.diagram.edits.LayoutMetadata;
import software.amazon.smithy.diagram.grammar.Manifest;
import software.amazon.smithy.diagram.identity.ElementIdRegistry;

/**
 * Builds the graphical model of a document from its AST.
 *
 * <p>Every named node below the root becomes a {@link GNode} labelled with
 * its name. Nodes nested in other diagram nodes are connected to them by
 * containment edges, and each reference that resolves to a diagram node
 * becomes an edge named after the reference's field.
 */
public final class GModelConverter {
    public static final String CONTAINMENT_EDGE = "edge:containment";
    public static final String REFERENCE_EDGE = "edge:reference";
    public static final String GENERIC_NODE = "node:generic";

    private final Manifest manifest;
    private final ReferenceResolver resolver;
    private final Dimension defaultSize;
    private final AtomicLong revision = new AtomicLong();

    public GModelConverter(Manifest manifest, ReferenceResolver resolver, Dimension defaultSize) {
        this.manifest = manifest;
        this.resolver = resolver;
        this.defaultSize = defaultSize;
    }

    /**
     * @param modelId Id of the model root
     * @param root The AST to convert
     * @param ids Element ids of the AST's nodes
     * @param layout Stored positions and sizes
     * @return A new model root with the next revision
     */
    public GModelRoot convert(String modelId, AstNode root, ElementIdRegistry ids, LayoutMetadata layout) {
        Map<AstNode, String> diagramNodes = new IdentityHashMap<>();
        List<AstNode> diagramOrder = new ArrayList<>();
        List<GModelElement> nodes = new ArrayList<>();
        for (AstNode node : AstWalker.streamAllContents(root).toList()) {
            if (node.name() == null) {
                continue;
            }
            Optional<String> id = ids.idOf(node);
            if (id.isEmpty()) {
                continue;
            }
            diagramNodes.put(node, id.get());
            diagramOrder.add(node);
            nodes.add(toGNode(node, id.get(), layout));
        }

        List<GModelElement> edges = new ArrayList<>();
        Set<String> edgeIds = new HashSet<>();
        for (AstNode node : diagramOrder) {
            String id = diagramNodes.get(node);

            AstNode parent = node.namedAncestor();
            if (parent != null && diagramNodes.containsKey(parent)) {
                String parentId = diagramNodes.get(parent);
                addEdge(edges, edgeIds, new GEdge(parentId + "_containment_" + id, CONTAINMENT_EDGE, parentId, id));
            }

            for (Map.Entry<String, AstValue> field : node.fields().entrySet()) {
                if (AstNode.isInternalField(field.getKey())) {
                    continue;
                }
                for (AstValue.Ref ref : references(field.getValue())) {
                    resolver.resolve(ref, root)
                            .map(diagramNodes::get)
                            .ifPresent(targetId -> addEdge(edges, edgeIds, new GEdge(
                                    id + "_" + field.getKey() + "_" + targetId,
                                    manifest.edgeTypeOf(field.getKey()).orElse(REFERENCE_EDGE),
                                    id,
                                    targetId)));
                }
            }
        }

        List<GModelElement> children = new ArrayList<>(nodes);
        children.addAll(edges);
        return new GModelRoot(modelId, revision.incrementAndGet(), children);
    }

    /**
     * @param astType An AST type tag
     * @return The diagram node type declared for it, or one suggested by its
     *  name
     */
    public String nodeTypeOf(String astType) {
        Optional<String> declared = manifest.nodeTypeOf(astType);
        if (declared.isPresent()) {
            return declared.get();
        }

        String lower = astType.toLowerCase(Locale.ROOT);
        for (String family : List.of("entity", "property", "package")) {
            if (lower.contains(family)) {
                return "node:" + family;
            }
        }
        return GENERIC_NODE;
    }

    private GNode toGNode(AstNode node, String id, LayoutMetadata layout) {
        Point position = layout.position(id).orElse(Point.ORIGIN);
        Dimension size = layout.size(id)
                .or(() -> manifest.defaultSizeOf(node.type()))
                .orElse(defaultSize);
        GLabel label = new GLabel(id + "_label", GLabel.DEFAULT_TYPE, node.name());
        return new GNode(id, nodeTypeOf(node.type()), position, size, List.of(label));
    }

    private static List<AstValue.Ref> references(AstValue value) {
        List<AstValue.Ref> refs = new ArrayList<>();
        if (value instanceof AstValue.Ref ref) {
            refs.add(ref);
        } else if (value instanceof AstValue.Many many) {
            for (AstValue element : many.elements()) {
                if (element instanceof AstValue.Ref ref) {
                    refs.add(ref);
                }
            }
        }
        return refs;
    }

    private static void addEdge(List<GModelElement> edges, Set<String> edgeIds, GEdge edge) {
        if (edgeIds.add(edge.id())) {
            edges.add(edge);
        }
    }
}
