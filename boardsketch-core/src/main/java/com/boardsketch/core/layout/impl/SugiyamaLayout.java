package com.boardsketch.core.layout.impl;

import com.boardsketch.core.config.DiagramOptions;
import com.boardsketch.core.layout.LayoutEngine;
import com.boardsketch.core.model.Bounds;
import com.boardsketch.core.model.Diagram;
import com.boardsketch.core.model.DiagramKind;
import com.boardsketch.core.model.Direction;
import com.boardsketch.core.model.Node;
import com.boardsketch.core.util.DirectedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Layered layout for flowcharts.
 *
 * <p><b>Phases:</b>
 * <ol>
 *   <li><b>Cycle breaking:</b> back edges found by a depth-first search in declaration order,
 *       self-loops included, are ignored on a working copy of the graph</li>
 *   <li><b>Layering:</b> longest path from the sources, so every edge of the acyclic copy
 *       points to a higher layer</li>
 *   <li><b>Components:</b> weakly connected components are laid out independently and packed
 *       side by side along the order axis in the order of their first declared node</li>
 *   <li><b>Ordering:</b> alternating down/up barycenter sweeps; the ordering with the fewest
 *       crossings between adjacent layers wins</li>
 *   <li><b>Coordinates:</b> layers map to Y and orders to X for TB/BT, swapped for LR/RL;
 *       BT and RL reverse the layer axis</li>
 * </ol>
 *
 * <p>Horizontal spacing separates neighbors within a layer and vertical spacing separates
 * layers, whatever the direction. Layer and order indices are unique across the whole
 * diagram because component order ranges never overlap.
 */
public class SugiyamaLayout implements LayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(SugiyamaLayout.class);

    @Override
    public String getId() {
        return "sugiyama";
    }

    @Override
    public DiagramKind getKind() {
        return DiagramKind.FLOWCHART;
    }

    @Override
    public void apply(Diagram diagram, DiagramOptions options) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (diagram.kind() != DiagramKind.FLOWCHART) {
            throw new IllegalArgumentException("Sugiyama layout does not support " + diagram.kind() + " diagrams");
        }

        List<Node> nodes = diagram.nodes();
        if (nodes.isEmpty()) {
            diagram.setBounds(Bounds.EMPTY);
            return;
        }

        DirectedGraph graph = DirectedGraph.of(diagram).withoutBackEdges();
        int[] layer = assignLayers(graph);
        int maxLayer = 0;
        for (int value : layer) {
            maxLayer = Math.max(maxLayer, value);
        }

        List<List<Integer>> components = graph.connectedComponents();
        double[] slot = new double[graph.size()];
        int[] order = new int[graph.size()];
        int offset = 0;
        for (List<Integer> component : components) {
            List<List<Integer>> layers = orderComponent(graph, component, layer, options.crossingPasses());
            int width = layers.stream().mapToInt(List::size).max().orElse(0);
            for (List<Integer> members : layers) {
                double centering = (width - members.size()) / 2.0;
                for (int position = 0; position < members.size(); position++) {
                    int v = members.get(position);
                    order[v] = offset + position;
                    slot[v] = offset + centering + position;
                }
            }
            offset += width;
        }

        place(diagram, nodes, layer, order, slot, maxLayer, options);

        log.debug("Laid out flowchart: {} nodes in {} layers, {} components", nodes.size(), maxLayer + 1,
            components.size());
    }

    /**
     * Longest-path layering over an acyclic graph.
     */
    private int[] assignLayers(DirectedGraph dag) {
        int[] layer = new int[dag.size()];
        for (int v : dag.topologicalOrder()) {
            for (int p : dag.predecessors(v)) {
                layer[v] = Math.max(layer[v], layer[p] + 1);
            }
        }
        return layer;
    }

    /**
     * Orders the vertices of one component within their layers.
     *
     * @return vertices per layer, index 0 being the lowest layer used by the component
     */
    private List<List<Integer>> orderComponent(DirectedGraph dag, List<Integer> component, int[] layer, int passes) {
        int minLayer = Integer.MAX_VALUE;
        int maxLayer = 0;
        for (int v : component) {
            minLayer = Math.min(minLayer, layer[v]);
            maxLayer = Math.max(maxLayer, layer[v]);
        }
        List<List<Integer>> layers = new ArrayList<>();
        for (int l = minLayer; l <= maxLayer; l++) {
            layers.add(new ArrayList<>());
        }
        // component lists are ascending, so each layer starts in declaration order
        for (int v : component) {
            layers.get(layer[v] - minLayer).add(v);
        }
        layers.removeIf(List::isEmpty);
        if (layers.size() < 2) {
            return layers;
        }

        int[] layerOf = new int[dag.size()];
        for (int l = 0; l < layers.size(); l++) {
            for (int v : layers.get(l)) {
                layerOf[v] = l;
            }
        }

        List<List<Integer>> best = copy(layers);
        int bestCrossings = countCrossings(dag, layers, layerOf);
        int initialCrossings = bestCrossings;

        for (int pass = 0; pass < passes && bestCrossings > 0; pass++) {
            List<List<Integer>> before = copy(layers);
            for (int l = 1; l < layers.size(); l++) {
                sortByBarycenter(layers, l, dag, true);
            }
            bestCrossings = keepBest(dag, layers, layerOf, best, bestCrossings);
            for (int l = layers.size() - 2; l >= 0; l--) {
                sortByBarycenter(layers, l, dag, false);
            }
            bestCrossings = keepBest(dag, layers, layerOf, best, bestCrossings);
            if (layers.equals(before)) {
                break;
            }
        }

        log.trace("Crossings in component starting at {}: {} -> {}", component.get(0), initialCrossings, bestCrossings);
        return best;
    }

    private static int keepBest(DirectedGraph dag, List<List<Integer>> layers, int[] layerOf,
                         List<List<Integer>> best, int bestCrossings) {
        int crossings = countCrossings(dag, layers, layerOf);
        if (crossings < bestCrossings) {
            for (int l = 0; l < layers.size(); l++) {
                best.set(l, new ArrayList<>(layers.get(l)));
            }
            return crossings;
        }
        return bestCrossings;
    }

    /**
     * Reorders one layer by the mean position of each vertex's predecessors (downward sweep)
     * or successors (upward sweep). Vertices without such neighbors keep their position.
     */
    private void sortByBarycenter(List<List<Integer>> layers, int l, DirectedGraph dag, boolean downward) {
        List<Integer> members = layers.get(l);
        int[] position = positions(layers, dag.size());
        double[] key = new double[dag.size()];
        for (int i = 0; i < members.size(); i++) {
            int v = members.get(i);
            List<Integer> neighbors = downward ? dag.predecessors(v) : dag.successors(v);
            if (neighbors.isEmpty()) {
                key[v] = i;
                continue;
            }
            double sum = 0;
            for (int w : neighbors) {
                sum += position[w];
            }
            key[v] = sum / neighbors.size();
        }
        members.sort(Comparator.<Integer>comparingDouble(v -> key[v]).thenComparingInt(v -> v));
    }

    private static int[] positions(List<List<Integer>> layers, int size) {
        int[] position = new int[size];
        for (List<Integer> members : layers) {
            for (int i = 0; i < members.size(); i++) {
                position[members.get(i)] = i;
            }
        }
        return position;
    }

    /**
     * Counts pairwise crossings of edges joining adjacent layers.
     */
    private static int countCrossings(DirectedGraph dag, List<List<Integer>> layers, int[] layerOf) {
        int[] position = positions(layers, dag.size());
        int crossings = 0;
        for (int l = 0; l + 1 < layers.size(); l++) {
            List<int[]> segments = new ArrayList<>();
            for (int u : layers.get(l)) {
                for (int w : dag.successors(u)) {
                    if (layerOf[w] == l + 1) {
                        segments.add(new int[] {position[u], position[w]});
                    }
                }
            }
            for (int i = 0; i < segments.size(); i++) {
                for (int j = i + 1; j < segments.size(); j++) {
                    int[] a = segments.get(i);
                    int[] b = segments.get(j);
                    if ((a[0] - b[0]) * (a[1] - b[1]) < 0) {
                        crossings++;
                    }
                }
            }
        }
        return crossings;
    }

    private void place(Diagram diagram, List<Node> nodes, int[] layer, int[] order, double[] slot,
                       int maxLayer, DiagramOptions options) {
        Direction direction = diagram.direction();
        boolean horizontal = direction.isHorizontal();
        double layerStep = (horizontal ? options.nodeWidth() : options.nodeHeight()) + options.verticalSpacing();
        double orderStep = (horizontal ? options.nodeHeight() : options.nodeWidth()) + options.horizontalSpacing();

        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        for (int v = 0; v < nodes.size(); v++) {
            Node node = nodes.get(v);
            int layerIndex = direction.isReversed() ? maxLayer - layer[v] : layer[v];
            double layerPos = layerIndex * layerStep;
            double orderPos = slot[v] * orderStep;
            double x = options.startX() + (horizontal ? layerPos : orderPos);
            double y = options.startY() + (horizontal ? orderPos : layerPos);

            node.assignRank(layer[v], order[v]);
            node.place(x, y, options.nodeWidth(), options.nodeHeight());

            minX = Math.min(minX, x);
            minY = Math.min(minY, y);
            maxX = Math.max(maxX, x + options.nodeWidth());
            maxY = Math.max(maxY, y + options.nodeHeight());
        }

        double margin = options.margin();
        diagram.setBounds(new Bounds(minX - margin, minY - margin,
            maxX - minX + 2 * margin, maxY - minY + 2 * margin));
    }

    private static List<List<Integer>> copy(List<List<Integer>> layers) {
        List<List<Integer>> copy = new ArrayList<>(layers.size());
        for (List<Integer> members : layers) {
            copy.add(new ArrayList<>(members));
        }
        return copy;
    }
}
