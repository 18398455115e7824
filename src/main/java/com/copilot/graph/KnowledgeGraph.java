package com.copilot.graph;

import com.copilot.exception.DanglingEdgeException;
import com.copilot.exception.DuplicateEdgeException;
import com.copilot.exception.DuplicateNodeException;
import com.copilot.exception.GraphFrozenException;
import com.copilot.exception.SelfLoopException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Queue;

/**
 * In-memory knowledge graph of typed nodes and directed, typed, weighted edges.
 * <p>
 * Nodes and edges live in arrays; an id to index map resolves node ids and each node
 * keeps adjacency lists of edge indices (outgoing and incoming) in insertion order.
 * <p>
 * The graph is mutable until {@link #freeze()} is called. After that every mutation
 * fails with {@link GraphFrozenException} and the graph may be shared across threads
 * without locking.
 */
public class KnowledgeGraph {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraph.class);

    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Map<String, Integer> nodeIndex = new HashMap<>();
    private final List<List<Integer>> outgoing = new ArrayList<>();
    private final List<List<Integer>> incoming = new ArrayList<>();
    private volatile boolean frozen;

    /**
     * Add a node.
     *
     * @throws DuplicateNodeException if a node with the same id exists
     * @throws GraphFrozenException   if the graph is frozen
     */
    public void addNode(Node node) {
        Objects.requireNonNull(node, "Node cannot be null");
        checkNotFrozen(node.id());
        if (nodeIndex.containsKey(node.id())) {
            throw new DuplicateNodeException(node.id(), "Node '" + node.id() + "' already exists");
        }
        nodeIndex.put(node.id(), nodes.size());
        nodes.add(node);
        outgoing.add(new ArrayList<>());
        incoming.add(new ArrayList<>());
        log.trace("Added node {}", node);
    }

    /**
     * Add an edge. Both endpoints must already be present.
     *
     * @throws SelfLoopException      if source and target are the same node
     * @throws DanglingEdgeException  if either endpoint is missing
     * @throws DuplicateEdgeException if the same source, target and relation already exist
     * @throws GraphFrozenException   if the graph is frozen
     */
    public void addEdge(Edge edge) {
        Objects.requireNonNull(edge, "Edge cannot be null");
        checkNotFrozen(edge.sourceId());
        if (edge.sourceId().equals(edge.targetId())) {
            throw new SelfLoopException(edge.sourceId(), "Self-loop not allowed: " + edge);
        }
        Integer source = nodeIndex.get(edge.sourceId());
        if (source == null) {
            throw new DanglingEdgeException(edge.sourceId(),
                    "Edge " + edge + " references unknown source node '" + edge.sourceId() + "'");
        }
        Integer target = nodeIndex.get(edge.targetId());
        if (target == null) {
            throw new DanglingEdgeException(edge.targetId(),
                    "Edge " + edge + " references unknown target node '" + edge.targetId() + "'");
        }
        for (int edgeIdx : outgoing.get(source)) {
            Edge existing = edges.get(edgeIdx);
            if (existing.targetId().equals(edge.targetId()) && existing.relation() == edge.relation()) {
                throw new DuplicateEdgeException(edge.sourceId(), "Edge " + edge + " already exists");
            }
        }
        int index = edges.size();
        edges.add(edge);
        outgoing.get(source).add(index);
        incoming.get(target).add(index);
        log.trace("Added edge {}", edge);
    }

    /**
     * Make the graph read-only. Idempotent.
     */
    public void freeze() {
        if (!frozen) {
            frozen = true;
            log.info("Knowledge graph frozen with {} nodes and {} edges", nodes.size(), edges.size());
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Optional<Node> node(String id) {
        Integer index = nodeIndex.get(id);
        return index == null ? Optional.empty() : Optional.of(nodes.get(index));
    }

    public boolean containsNode(String id) {
        return nodeIndex.containsKey(id);
    }

    /**
     * All nodes of a type, in insertion order.
     */
    public List<Node> nodesOfType(NodeType type) {
        List<Node> result = new ArrayList<>();
        for (Node node : nodes) {
            if (node.type() == type) {
                result.add(node);
            }
        }
        return result;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Nodes one hop away from {@code nodeId}.
     *
     * @param nodeId    Node to start from; an unknown id yields an empty list
     * @param relation  Relation filter, or null for any relation
     * @param direction Which edges to follow
     * @return Neighbors in edge insertion order (a node reached by two edges appears twice)
     */
    public List<Node> neighbors(String nodeId, Relation relation, Direction direction) {
        Integer index = nodeIndex.get(nodeId);
        if (index == null) {
            return List.of();
        }
        List<Integer> edgeIndices = switch (direction) {
            case OUT -> outgoing.get(index);
            case IN -> incoming.get(index);
            case BOTH -> mergeInInsertionOrder(outgoing.get(index), incoming.get(index));
        };

        List<Node> result = new ArrayList<>();
        for (int edgeIdx : edgeIndices) {
            Edge edge = edges.get(edgeIdx);
            if (relation != null && edge.relation() != relation) {
                continue;
            }
            String other = edge.sourceId().equals(nodeId) ? edge.targetId() : edge.sourceId();
            result.add(nodes.get(nodeIndex.get(other)));
        }
        return Collections.unmodifiableList(result);
    }

    public List<Node> neighbors(String nodeId, Relation relation) {
        return neighbors(nodeId, relation, Direction.OUT);
    }

    /**
     * Outgoing edges of a node in insertion order.
     */
    public List<Edge> outgoingEdges(String nodeId) {
        Integer index = nodeIndex.get(nodeId);
        if (index == null) {
            return List.of();
        }
        List<Edge> result = new ArrayList<>();
        for (int edgeIdx : outgoing.get(index)) {
            result.add(edges.get(edgeIdx));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Check whether {@code targetId} is reachable from {@code sourceId} following outgoing
     * edges in at most {@code maxHops} hops.
     */
    public boolean hasPath(String sourceId, String targetId, int maxHops) {
        return hopDistance(sourceId, targetId, maxHops).isPresent();
    }

    /**
     * Length of the shortest outgoing path from {@code sourceId} to {@code targetId},
     * if one exists within {@code maxHops}. Bounded breadth-first search; each node is
     * visited once, so cycles terminate.
     */
    public OptionalInt hopDistance(String sourceId, String targetId, int maxHops) {
        Integer source = nodeIndex.get(sourceId);
        Integer target = nodeIndex.get(targetId);
        if (source == null || target == null || maxHops < 0) {
            return OptionalInt.empty();
        }
        if (source.equals(target)) {
            return OptionalInt.of(0);
        }

        boolean[] visited = new boolean[nodes.size()];
        visited[source] = true;
        Queue<Integer> frontier = new ArrayDeque<>();
        frontier.add(source);

        for (int depth = 1; depth <= maxHops && !frontier.isEmpty(); depth++) {
            int levelSize = frontier.size();
            for (int i = 0; i < levelSize; i++) {
                int current = frontier.poll();
                for (int edgeIdx : outgoing.get(current)) {
                    int next = nodeIndex.get(edges.get(edgeIdx).targetId());
                    if (next == target) {
                        return OptionalInt.of(depth);
                    }
                    if (!visited[next]) {
                        visited[next] = true;
                        frontier.add(next);
                    }
                }
            }
        }
        return OptionalInt.empty();
    }

    private List<Integer> mergeInInsertionOrder(List<Integer> out, List<Integer> in) {
        List<Integer> merged = new ArrayList<>(out.size() + in.size());
        int i = 0;
        int j = 0;
        while (i < out.size() || j < in.size()) {
            if (j >= in.size() || (i < out.size() && out.get(i) < in.get(j))) {
                merged.add(out.get(i++));
            } else {
                merged.add(in.get(j++));
            }
        }
        return merged;
    }

    private void checkNotFrozen(String nodeId) {
        if (frozen) {
            throw new GraphFrozenException(nodeId, "Knowledge graph is frozen; mutation rejected for '" + nodeId + "'");
        }
    }

    @Override
    public String toString() {
        return "KnowledgeGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + ", frozen=" + frozen + '}';
    }
}
