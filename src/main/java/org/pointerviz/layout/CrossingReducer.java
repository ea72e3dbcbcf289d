package org.pointerviz.layout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the nodes inside each layer to reduce edge crossings.
 * <p>
 * Starts from a by-name ordering and then runs alternating median sweeps: downward sweeps sort a layer by
 * the median position of its incoming-edge sources, upward sweeps by the median position of its
 * outgoing-edge targets. Nodes without neighbors in the sweep direction sort last; ties keep their
 * current relative order.
 */
final class CrossingReducer {

    private CrossingReducer() {
    }

    /**
     * @param graph  The graph.
     * @param layers Layer index per node.
     * @param sweeps Number of sweeps; the first one goes downward.
     * @return node indices per layer, top to bottom.
     */
    static List<List<Integer>> order(LayoutGraph graph, int[] layers, int sweeps) {
        int layerCount = Arrays.stream(layers).max().orElse(-1) + 1;
        List<List<Integer>> byLayer = new ArrayList<>(layerCount);
        for (int i = 0; i < layerCount; i++) {
            byLayer.add(new ArrayList<>());
        }
        for (int node = 0; node < graph.size(); node++) {
            byLayer.get(layers[node]).add(node);
        }

        Comparator<Integer> byName = Comparator.comparing(node -> graph.node(node).name());
        int[] position = new int[graph.size()];
        for (List<Integer> layer : byLayer) {
            layer.sort(byName.thenComparingInt(Integer::intValue));
            updatePositions(layer, position);
        }

        double[] key = new double[graph.size()];
        for (int sweep = 0; sweep < sweeps; sweep++) {
            boolean downward = sweep % 2 == 0;
            if (downward) {
                for (int l = 0; l < layerCount; l++) {
                    reorder(byLayer.get(l), position, key, graph, true);
                }
            } else {
                for (int l = layerCount - 1; l >= 0; l--) {
                    reorder(byLayer.get(l), position, key, graph, false);
                }
            }
        }
        return byLayer;
    }

    private static void reorder(List<Integer> layer, int[] position, double[] key, LayoutGraph graph,
                                boolean downward) {
        for (int node : layer) {
            int[] neighbors = downward ? graph.predecessors(node) : graph.successors(node);
            key[node] = median(neighbors, position);
        }
        // stable: equal medians keep their order
        layer.sort(Comparator.comparingDouble(node -> key[node]));
        updatePositions(layer, position);
    }

    /**
     * Median of the neighbors' positions; the mean of the two middle values for an even count.
     *
     * @return the median, or {@link Double#POSITIVE_INFINITY} if there are no neighbors.
     */
    static double median(int[] neighbors, int[] position) {
        if (neighbors.length == 0) {
            return Double.POSITIVE_INFINITY;
        }
        int[] sorted = new int[neighbors.length];
        for (int i = 0; i < neighbors.length; i++) {
            sorted[i] = position[neighbors[i]];
        }
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    private static void updatePositions(List<Integer> layer, int[] position) {
        for (int i = 0; i < layer.size(); i++) {
            position[layer.get(i)] = i;
        }
    }
}
