/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.identity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Logger;
import software.amazon.smithy.diagram.ast.AstNode;
import software.amazon.smithy.diagram.ast.AstWalker;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;

/**
 * Keeps diagram element ids attached to the same logical AST nodes across
 * reparses of one document.
 *
 * <p>Names can't identify nodes because a rename keeps the diagram element,
 * so each node is matched by its {@link Fingerprint} in three passes:
 * <ol>
 *     <li>Exact: the node sits under the same parent, in the same field, at
 *     the same ordinal among nodes of its type.</li>
 *     <li>Fuzzy: the best-scoring remaining id of the same type, if the score
 *     reaches {@link Fingerprint#THRESHOLD}.</li>
 *     <li>New: a fresh id is minted.</li>
 * </ol>
 * Ids that nothing matched are dropped, and resolve to nothing from then on.
 *
 * <p>Lookups may happen from any thread; reindexing publishes a complete new
 * mapping at once.
 */
public final class ElementIdRegistry implements ElementLocator {
    private static final Logger LOGGER = Logger.getLogger(ElementIdRegistry.class.getName());

    private final Supplier<String> idSupplier;
    private volatile Generation generation = Generation.EMPTY;
    private Map<String, Fingerprint> stored = new LinkedHashMap<>();

    public ElementIdRegistry() {
        this(() -> UUID.randomUUID().toString());
    }

    /**
     * @param idSupplier Mints ids for nodes that match no known id
     */
    public ElementIdRegistry(Supplier<String> idSupplier) {
        this.idSupplier = idSupplier;
    }

    private record Generation(Map<String, AstNode> nodesById, Map<AstNode, String> idsByNode) {
        static final Generation EMPTY = new Generation(Map.of(), new IdentityHashMap<>());
    }

    /**
     * Counts of how the nodes of a reparse were identified.
     *
     * @param total Nodes in the new tree, including the root
     * @param exact Nodes that kept their id by exact match
     * @param fuzzy Nodes that kept their id by fuzzy match
     * @param minted Ids minted for new nodes
     * @param orphaned Ids that matched nothing and were dropped
     */
    public record ReindexResult(int total, int exact, int fuzzy, List<String> minted, int orphaned) {
    }

    @Override
    public Optional<AstNode> locate(String elementId) {
        return resolve(elementId);
    }

    /**
     * @param elementId A diagram element id
     * @return The node the id stands for in the current generation
     */
    public Optional<AstNode> resolve(String elementId) {
        return Optional.ofNullable(generation.nodesById.get(elementId));
    }

    /**
     * @param node A node of the current generation
     * @return The node's element id
     */
    public Optional<String> idOf(AstNode node) {
        return Optional.ofNullable(generation.idsByNode.get(node));
    }

    /**
     * @return Every id of the current generation
     */
    public Set<String> ids() {
        return Collections.unmodifiableSet(generation.nodesById.keySet());
    }

    /**
     * @param elementId A diagram element id
     * @return The fingerprint recorded for it at the last reindex
     */
    public Optional<Fingerprint> fingerprint(String elementId) {
        return Optional.ofNullable(stored.get(elementId));
    }

    /**
     * Re-identifies every node of a freshly parsed tree.
     *
     * @param root The root of the new tree
     * @return How the nodes were identified
     */
    public synchronized ReindexResult reindex(AstNode root) {
        Map<String, AstNode> nodesById = new LinkedHashMap<>();
        Map<AstNode, String> idsByNode = new IdentityHashMap<>();
        Set<String> claimed = new HashSet<>();

        String rootId = storedRootId().orElseGet(idSupplier);
        nodesById.put(rootId, root);
        idsByNode.put(root, rootId);
        claimed.add(rootId);

        List<AstNode> nodes = AstWalker.streamAllContents(root).toList();

        Map<String, String> exactIndex = new HashMap<>();
        stored.forEach((id, fingerprint) -> exactIndex.put(fingerprint.exactKey(), id));

        List<AstNode> unmatched = new ArrayList<>();
        for (AstNode node : nodes) {
            String id = exactIndex.get(fingerprintOf(node, idsByNode).exactKey());
            if (id != null && claimed.add(id)) {
                nodesById.put(id, node);
                idsByNode.put(node, id);
            } else {
                unmatched.add(node);
            }
        }
        int exact = nodes.size() - unmatched.size();

        Map<String, Fingerprint> unclaimed = new LinkedHashMap<>(stored);
        unclaimed.keySet().removeAll(claimed);

        List<AstNode> stillUnmatched = new ArrayList<>();
        for (AstNode node : unmatched) {
            Fingerprint fingerprint = fingerprintOf(node, idsByNode);
            String bestId = null;
            int bestScore = 0;
            for (Map.Entry<String, Fingerprint> candidate : unclaimed.entrySet()) {
                int score = fingerprint.score(candidate.getValue());
                if (score >= Fingerprint.THRESHOLD && score > bestScore) {
                    bestScore = score;
                    bestId = candidate.getKey();
                }
            }

            if (bestId != null) {
                nodesById.put(bestId, node);
                idsByNode.put(node, bestId);
                claimed.add(bestId);
                unclaimed.remove(bestId);
            } else {
                stillUnmatched.add(node);
            }
        }
        int fuzzy = unmatched.size() - stillUnmatched.size();

        List<String> minted = new ArrayList<>();
        for (AstNode node : stillUnmatched) {
            String id = idSupplier.get();
            nodesById.put(id, node);
            idsByNode.put(node, id);
            minted.add(id);
        }

        Map<String, Fingerprint> nextStored = new LinkedHashMap<>();
        nextStored.put(rootId, Fingerprint.of(root, Fingerprint.ROOT_PARENT));
        for (AstNode node : nodes) {
            nextStored.put(idsByNode.get(node), fingerprintOf(node, idsByNode));
        }
        this.stored = nextStored;
        this.generation = new Generation(Collections.unmodifiableMap(nodesById), idsByNode);

        ReindexResult result = new ReindexResult(nodes.size() + 1, exact, fuzzy, minted, unclaimed.size());
        LOGGER.finest(() -> "Reindexed " + result);
        return result;
    }

    /**
     * @return The fingerprints of the current generation, to persist beside
     *  the diagram's layout
     */
    public synchronized ObjectNode snapshot() {
        ObjectNode.Builder fingerprints = Node.objectNodeBuilder();
        stored.forEach((id, fingerprint) -> fingerprints.withMember(id, fingerprint.toNode()));
        return Node.objectNodeBuilder()
                .withMember("fingerprints", fingerprints.build())
                .build();
    }

    /**
     * Replaces the known fingerprints with persisted ones, so the next
     * reindex reattaches the persisted ids. Current lookups are cleared.
     *
     * @param snapshot Fingerprints in the form produced by {@link #snapshot()}
     */
    public synchronized void restore(ObjectNode snapshot) {
        Map<String, Fingerprint> restored = new LinkedHashMap<>();
        snapshot.getObjectMember("fingerprints").ifPresent(fingerprints ->
                fingerprints.getStringMap().forEach((id, value) -> restored.put(id, Fingerprint.fromNode(value))));
        this.stored = restored;
        this.generation = Generation.EMPTY;
        LOGGER.finest(() -> "Restored " + restored.size() + " element ids");
    }

    /**
     * Forgets every id.
     */
    public synchronized void clear() {
        this.stored = new LinkedHashMap<>();
        this.generation = Generation.EMPTY;
    }

    private Optional<String> storedRootId() {
        for (Map.Entry<String, Fingerprint> entry : stored.entrySet()) {
            Fingerprint fingerprint = entry.getValue();
            if (fingerprint.parentId().equals(Fingerprint.ROOT_PARENT) && fingerprint.containment().isEmpty()) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    private static Fingerprint fingerprintOf(AstNode node, Map<AstNode, String> idsByNode) {
        String parentId = idsByNode.getOrDefault(node.container(), Fingerprint.UNKNOWN_PARENT);
        return Fingerprint.of(node, parentId);
    }
}
