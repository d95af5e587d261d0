package com.boardsketch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed diagram: nodes and edges in declaration order.
 *
 * <p>The topology is fixed when the diagram is built. Layout engines may only write node
 * placements, message positions and {@link #bounds()}.
 */
public final class Diagram {

    private final DiagramKind kind;
    private final Direction direction;
    private final Map<String, Node> nodes;
    private final List<Edge> edges;

    private Bounds bounds = Bounds.EMPTY;

    /**
     * Creates a diagram.
     *
     * @param kind diagram dialect
     * @param direction layout direction
     * @param nodes nodes in declaration order, ids must be unique
     * @param edges edges in declaration order, endpoints must be among {@code nodes}
     * @throws IllegalArgumentException if an id is duplicated or an edge endpoint is unknown
     */
    public Diagram(DiagramKind kind, Direction direction, List<Node> nodes, List<Edge> edges) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.direction = direction != null ? direction : Direction.TOP_TO_BOTTOM;
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");

        Map<String, Node> byId = new LinkedHashMap<>();
        for (Node node : nodes) {
            if (byId.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
        }
        for (Edge edge : edges) {
            if (!byId.containsKey(edge.from()) || !byId.containsKey(edge.to())) {
                throw new IllegalArgumentException("Edge references unknown node: " + edge);
            }
        }
        this.nodes = Collections.unmodifiableMap(byId);
        this.edges = List.copyOf(edges);
    }

    public DiagramKind kind() {
        return kind;
    }

    public Direction direction() {
        return direction;
    }

    /**
     * @return nodes in declaration order
     */
    public List<Node> nodes() {
        return List.copyOf(nodes.values());
    }

    /**
     * @return edges in declaration order
     */
    public List<Edge> edges() {
        return edges;
    }

    public Optional<Node> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public int nodeCount() {
        return nodes.size();
    }

    public Bounds bounds() {
        return bounds;
    }

    public void setBounds(Bounds bounds) {
        this.bounds = Objects.requireNonNull(bounds, "bounds must not be null");
    }

    @Override
    public String toString() {
        return "Diagram[" + kind + " " + direction.code() + ", " + nodes.size() + " nodes, "
            + edges.size() + " edges]";
    }
}
