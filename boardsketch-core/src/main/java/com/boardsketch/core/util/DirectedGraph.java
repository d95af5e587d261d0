package com.boardsketch.core.util;

import com.boardsketch.core.model.Diagram;
import com.boardsketch.core.model.Edge;
import com.boardsketch.core.model.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.stream.Collectors;

/**
 * Index-based adjacency structure over the nodes of a diagram.
 *
 * <p>Vertices are numbered in node declaration order and adjacency lists keep edge
 * declaration order, so every traversal here is deterministic. Parallel edges appear as
 * repeated entries. Instances are working copies: mutating one never touches the
 * {@link Diagram} it was built from.
 */
public final class DirectedGraph {

    private static final int UNVISITED = 0;
    private static final int ACTIVE = 1;
    private static final int FINISHED = 2;

    private final List<String> ids;
    private final Map<String, Integer> indexById;
    private final List<List<Integer>> successors;
    private final List<List<Integer>> predecessors;

    private DirectedGraph(List<String> ids) {
        this.ids = List.copyOf(ids);
        this.indexById = new HashMap<>();
        this.successors = new ArrayList<>(ids.size());
        this.predecessors = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            indexById.put(ids.get(i), i);
            successors.add(new ArrayList<>());
            predecessors.add(new ArrayList<>());
        }
    }

    /**
     * Builds the graph of a diagram's nodes and edges.
     *
     * @param diagram source diagram
     * @return new graph
     */
    public static DirectedGraph of(Diagram diagram) {
        List<String> ids = diagram.nodes().stream().map(Node::id).toList();
        DirectedGraph graph = new DirectedGraph(ids);
        for (Edge edge : diagram.edges()) {
            graph.addEdge(graph.indexOf(edge.from()), graph.indexOf(edge.to()));
        }
        return graph;
    }

    /**
     * Returns an independent copy of this graph.
     *
     * @return copy
     */
    public DirectedGraph copy() {
        DirectedGraph copy = new DirectedGraph(ids);
        for (int v = 0; v < size(); v++) {
            copy.successors.get(v).addAll(successors.get(v));
            copy.predecessors.get(v).addAll(predecessors.get(v));
        }
        return copy;
    }

    public int size() {
        return ids.size();
    }

    public String id(int vertex) {
        return ids.get(vertex);
    }

    public int indexOf(String id) {
        Integer index = indexById.get(id);
        if (index == null) {
            throw new IllegalArgumentException("Unknown vertex: " + id);
        }
        return index;
    }

    public List<Integer> successors(int vertex) {
        return Collections.unmodifiableList(successors.get(vertex));
    }

    public List<Integer> predecessors(int vertex) {
        return Collections.unmodifiableList(predecessors.get(vertex));
    }

    public void addEdge(int from, int to) {
        successors.get(from).add(to);
        predecessors.get(to).add(from);
    }

    /**
     * Removes every edge from {@code from} to {@code to}.
     *
     * @param from source vertex
     * @param to target vertex
     */
    public void removeEdges(int from, int to) {
        successors.get(from).removeIf(v -> v == to);
        predecessors.get(to).removeIf(v -> v == from);
    }

    /**
     * Finds the edges that close a cycle during a depth-first search started from each
     * unvisited vertex in index order. Self-loops are always included.
     *
     * @return back edges as {@code {from, to}} pairs, in discovery order
     */
    public List<int[]> backEdges() {
        List<int[]> back = new ArrayList<>();
        depthFirst((from, to, stack, top) -> {
            back.add(new int[] {from, to});
            return false;
        });
        return back;
    }

    /**
     * Returns a copy of this graph with all back edges removed.
     *
     * @return acyclic copy
     */
    public DirectedGraph withoutBackEdges() {
        DirectedGraph copy = copy();
        for (int[] edge : backEdges()) {
            copy.removeEdges(edge[0], edge[1]);
        }
        return copy;
    }

    /**
     * Finds one directed cycle, if any.
     *
     * @return vertex ids along the cycle, first id repeated at the end
     */
    public Optional<List<String>> findCycle() {
        List<String> cycle = new ArrayList<>();
        depthFirst((from, to, stack, top) -> {
            int start = top;
            while (stack[start] != to) {
                start--;
            }
            for (int i = start; i <= top; i++) {
                cycle.add(ids.get(stack[i]));
            }
            cycle.add(ids.get(to));
            return true;
        });
        return cycle.isEmpty() ? Optional.empty() : Optional.of(cycle);
    }

    /**
     * Orders vertices so every edge points forward. Among available vertices the lowest
     * index goes first.
     *
     * @return topological order
     * @throws IllegalStateException if the graph has a cycle
     */
    public int[] topologicalOrder() {
        int[] inDegree = new int[size()];
        for (int v = 0; v < size(); v++) {
            inDegree[v] = predecessors.get(v).size();
        }
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int v = 0; v < size(); v++) {
            if (inDegree[v] == 0) {
                ready.add(v);
            }
        }
        int[] order = new int[size()];
        int count = 0;
        while (!ready.isEmpty()) {
            int v = ready.poll();
            order[count++] = v;
            for (int w : successors.get(v)) {
                if (--inDegree[w] == 0) {
                    ready.add(w);
                }
            }
        }
        if (count != size()) {
            throw new IllegalStateException("Graph contains a cycle");
        }
        return order;
    }

    /**
     * Groups vertices into weakly connected components.
     *
     * @return components ordered by their lowest vertex, each sorted ascending
     */
    public List<List<Integer>> connectedComponents() {
        int[] parent = new int[size()];
        for (int v = 0; v < size(); v++) {
            parent[v] = v;
        }
        for (int v = 0; v < size(); v++) {
            for (int w : successors.get(v)) {
                int rootV = find(parent, v);
                int rootW = find(parent, w);
                if (rootV != rootW) {
                    parent[Math.max(rootV, rootW)] = Math.min(rootV, rootW);
                }
            }
        }
        Map<Integer, List<Integer>> byRoot = new HashMap<>();
        List<List<Integer>> components = new ArrayList<>();
        for (int v = 0; v < size(); v++) {
            List<Integer> component = byRoot.computeIfAbsent(find(parent, v), r -> {
                List<Integer> created = new ArrayList<>();
                components.add(created);
                return created;
            });
            component.add(v);
        }
        return components;
    }

    private static int find(int[] parent, int v) {
        while (parent[v] != v) {
            parent[v] = parent[parent[v]];
            v = parent[v];
        }
        return v;
    }

    /**
     * Iterative depth-first search reporting each edge that reaches an active vertex.
     */
    private void depthFirst(BackEdgeVisitor visitor) {
        int n = size();
        int[] state = new int[n];
        int[] stack = new int[n];
        int[] cursor = new int[n];
        for (int root = 0; root < n; root++) {
            if (state[root] != UNVISITED) {
                continue;
            }
            int top = 0;
            stack[0] = root;
            cursor[0] = 0;
            state[root] = ACTIVE;
            while (top >= 0) {
                int v = stack[top];
                List<Integer> next = successors.get(v);
                if (cursor[top] < next.size()) {
                    int w = next.get(cursor[top]++);
                    if (state[w] == ACTIVE) {
                        if (visitor.onBackEdge(v, w, stack, top)) {
                            return;
                        }
                    } else if (state[w] == UNVISITED) {
                        state[w] = ACTIVE;
                        top++;
                        stack[top] = w;
                        cursor[top] = 0;
                    }
                } else {
                    state[v] = FINISHED;
                    top--;
                }
            }
        }
    }

    @FunctionalInterface
    private interface BackEdgeVisitor {
        /**
         * @return true to stop the search
         */
        boolean onBackEdge(int from, int to, int[] stack, int top);
    }

    @Override
    public String toString() {
        return ids.stream()
            .map(id -> id + "->" + successors.get(indexOf(id)).stream().map(ids::get).toList())
            .collect(Collectors.joining(", ", "DirectedGraph[", "]"));
    }
}
