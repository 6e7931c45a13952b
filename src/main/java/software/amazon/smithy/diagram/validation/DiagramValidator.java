/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.validation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstWalker;
import software.amazon.smithy.diagram.document.SourceIndex;
import software.amazon.smithy.diagram.gmodel.Dimension;
import software.amazon.smithy.diagram.gmodel.GEdge;
import software.amazon.smithy.diagram.gmodel.GModelRoot;
import software.amazon.smithy.diagram.gmodel.GNode;
import software.amazon.smithy.diagram.identity.ElementIdRegistry;

/**
 * Checks a graphical model and the AST it was built from for structural and
 * layout problems.
 *
 * <p>Every check runs regardless of what earlier checks found. Markers are
 * advisory: they never block an edit.
 */
public final class DiagramValidator {
    public static final String SOURCE = "diagram-validation";
    public static final String DEFAULT_EXTERNAL_SOURCE = "parser";

    public static final String NEGATIVE_POSITION = "NEGATIVE_POSITION";
    public static final String INVALID_SIZE = "INVALID_SIZE";
    public static final String MISSING_LABEL = "MISSING_LABEL";
    public static final String MISSING_SOURCE = "MISSING_SOURCE";
    public static final String MISSING_TARGET = "MISSING_TARGET";
    public static final String SELF_LOOP = "SELF_LOOP";
    public static final String DUPLICATE_NAME = "DUPLICATE_NAME";
    public static final String OVERLAPPING_NODES = "OVERLAPPING_NODES";
    public static final String OUTSIDE_BOUNDS = "OUTSIDE_BOUNDS";
    public static final String EXTERNAL_DIAGNOSTIC = "EXTERNAL_DIAGNOSTIC";

    private final Dimension bounds;

    /**
     * @param bounds The visible diagram area, or {@code null} to skip the
     *               bounds check
     */
    public DiagramValidator(Dimension bounds) {
        this.bounds = bounds;
    }

    /**
     * @param model The graphical model
     * @param root The AST the model was built from
     * @param diagnostics Diagnostics reported on the document by others
     * @param sourceIndex Index of the text {@code root} was parsed from
     * @param ids Element ids of {@code root}'s nodes
     * @param cancelChecker Checked between units of work
     * @return Every marker found
     * @throws java.util.concurrent.CancellationException If cancelled
     */
    public ValidationResult validate(
            GModelRoot model,
            AstNode root,
            List<Diagnostic> diagnostics,
            SourceIndex sourceIndex,
            ElementIdRegistry ids,
            CancelChecker cancelChecker
    ) {
        List<DiagramMarker> markers = new ArrayList<>();
        List<GNode> nodes = model.nodes();

        for (GNode node : nodes) {
            cancelChecker.checkCanceled();
            checkGeometry(node, markers);
        }

        cancelChecker.checkCanceled();
        checkEdges(nodes, model.edges(), markers);

        cancelChecker.checkCanceled();
        checkNames(root, ids, markers);

        cancelChecker.checkCanceled();
        mapDiagnostics(root, diagnostics, sourceIndex, ids, markers);

        for (int i = 0; i < nodes.size(); i++) {
            cancelChecker.checkCanceled();
            GNode a = nodes.get(i);
            for (int j = i + 1; j < nodes.size(); j++) {
                GNode b = nodes.get(j);
                if (a.overlaps(b)) {
                    markers.add(marker(a.id(), MarkerSeverity.WARNING,
                            "Node " + a.id() + " overlaps node " + b.id(), OVERLAPPING_NODES));
                }
            }
            if (bounds != null && isOutsideBounds(a)) {
                markers.add(marker(a.id(), MarkerSeverity.INFO,
                        "Node extends outside the visible diagram area", OUTSIDE_BOUNDS));
            }
        }

        return ValidationResult.of(markers);
    }

    private static void checkGeometry(GNode node, List<DiagramMarker> markers) {
        if (node.position().x() < 0 || node.position().y() < 0) {
            markers.add(marker(node.id(), MarkerSeverity.WARNING,
                    "Node has a negative position (" + node.position().x() + ", " + node.position().y() + ")",
                    NEGATIVE_POSITION));
        }
        if (!node.size().isPositive()) {
            markers.add(marker(node.id(), MarkerSeverity.ERROR,
                    "Node must have a positive width and height, but is "
                    + node.size().width() + "x" + node.size().height(),
                    INVALID_SIZE));
        }
        if (node.label().isEmpty()) {
            markers.add(marker(node.id(), MarkerSeverity.HINT, "Node has no label", MISSING_LABEL));
        }
    }

    private static void checkEdges(List<GNode> nodes, List<GEdge> edges, List<DiagramMarker> markers) {
        Set<String> nodeIds = new HashSet<>();
        for (GNode node : nodes) {
            nodeIds.add(node.id());
        }

        for (GEdge edge : edges) {
            if (!nodeIds.contains(edge.sourceId())) {
                markers.add(marker(edge.id(), MarkerSeverity.ERROR,
                        "Edge source " + edge.sourceId() + " does not exist", MISSING_SOURCE));
            }
            if (!nodeIds.contains(edge.targetId())) {
                markers.add(marker(edge.id(), MarkerSeverity.ERROR,
                        "Edge target " + edge.targetId() + " does not exist", MISSING_TARGET));
            }
            if (edge.sourceId().equals(edge.targetId())) {
                markers.add(marker(edge.id(), MarkerSeverity.INFO,
                        "Edge connects node " + edge.sourceId() + " to itself", SELF_LOOP));
            }
        }
    }

    private static void checkNames(AstNode root, ElementIdRegistry ids, List<DiagramMarker> markers) {
        Map<String, List<AstNode>> byName = new LinkedHashMap<>();
        AstWalker.streamAllContents(root)
                .filter(node -> node.name() != null)
                .forEach(node -> byName.computeIfAbsent(node.name(), k -> new ArrayList<>()).add(node));

        for (Map.Entry<String, List<AstNode>> entry : byName.entrySet()) {
            List<AstNode> named = entry.getValue();
            if (named.size() < 2) {
                continue;
            }
            for (AstNode node : named) {
                String elementId = ids.idOf(node).orElse(entry.getKey());
                markers.add(marker(elementId, MarkerSeverity.ERROR,
                        "Duplicate name '" + entry.getKey() + "' is used by " + named.size() + " elements",
                        DUPLICATE_NAME));
            }
        }
    }

    private static void mapDiagnostics(
            AstNode root,
            List<Diagnostic> diagnostics,
            SourceIndex sourceIndex,
            ElementIdRegistry ids,
            List<DiagramMarker> markers
    ) {
        String rootId = ids.idOf(root).orElse("");
        for (Diagnostic diagnostic : diagnostics) {
            int offset = sourceIndex.offsetAt(diagnostic.getRange().getStart());
            AstNode node = offset < 0
                    ? null
                    : sourceIndex.innermostNodeAt(root, offset, candidate -> ids.idOf(candidate).isPresent());
            String elementId = node == null ? rootId : ids.idOf(node).orElse(rootId);

            String code = EXTERNAL_DIAGNOSTIC;
            if (diagnostic.getCode() != null) {
                code = diagnostic.getCode().isLeft()
                        ? diagnostic.getCode().getLeft()
                        : String.valueOf(diagnostic.getCode().getRight());
            }
            String source = diagnostic.getSource() == null ? DEFAULT_EXTERNAL_SOURCE : diagnostic.getSource();
            markers.add(new DiagramMarker(elementId, MarkerSeverity.fromLsp(diagnostic.getSeverity()),
                    diagnostic.getMessage(), code, source));
        }
    }

    private boolean isOutsideBounds(GNode node) {
        return node.position().x() + node.size().width() > bounds.width()
               || node.position().y() + node.size().height() > bounds.height();
    }

    private static DiagramMarker marker(String elementId, MarkerSeverity severity, String message, String code) {
        return new DiagramMarker(elementId, severity, message, code, SOURCE);
    }
}
