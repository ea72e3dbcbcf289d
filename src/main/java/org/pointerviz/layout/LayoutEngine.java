package org.pointerviz.layout;

import org.pointerviz.model.MemoryGraph;
import org.pointerviz.model.MemoryObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes 2D coordinates for a {@link MemoryGraph} with a simplified hierarchical layout.
 * <p>
 * The pipeline runs in this order:
 * <ol>
 *   <li>Layering: a node sits one layer deeper than the deepest node pointing to it.</li>
 *   <li>Ordering: nodes in a layer start sorted by name, then median sweeps reduce crossings.</li>
 *   <li>Spacing: column and row distances adapt to node width and graph density.</li>
 *   <li>Placement: layers become columns; each column is centered against the tallest one.</li>
 *   <li>Alignment: pass-through nodes are nudged towards their neighbors' midpoint.</li>
 *   <li>Normalization: the diagram is shifted so its top-left node sits at the margin.</li>
 * </ol>
 * The engine never mutates the graph and is deterministic: the same graph always yields the same result.
 * <p>
 * Thread Safety: instances are immutable and may be shared.
 */
public class LayoutEngine {

    private static final Logger LOG = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutOptions options;

    /**
     * Creates an engine with the options configured under {@code pointerviz.layout}.
     */
    public LayoutEngine() {
        this(LayoutOptions.defaults());
    }

    public LayoutEngine(LayoutOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Lays out the graph using estimated node widths.
     *
     * @param graph The graph to lay out.
     * @return positions keyed by object address.
     */
    public LayoutResult layout(MemoryGraph graph) {
        return layout(graph, Map.of());
    }

    /**
     * Lays out the graph.
     *
     * @param graph          The graph to lay out.
     * @param measuredWidths Rendered node widths keyed by address. Nodes without an entry use an estimate
     *                       from their longest display line.
     * @return positions keyed by object address.
     */
    public LayoutResult layout(MemoryGraph graph, Map<String, Double> measuredWidths) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(measuredWidths, "measuredWidths");
        if (graph.isEmpty()) {
            LOG.debug("Empty graph, nothing to lay out");
            return LayoutResult.empty(options.smallMargin());
        }

        LayoutGraph layoutGraph = LayoutGraph.of(graph);
        int[] layers = LayerAssigner.assign(layoutGraph);
        List<List<Integer>> order = CrossingReducer.order(layoutGraph, layers, options.sweeps());

        int maxLayerSize = order.stream().mapToInt(List::size).max().orElse(0);
        AdaptiveSpacing spacing = AdaptiveSpacing.compute(options, layoutGraph.size(), layoutGraph.edgeCount(),
                order.size(), maxLayerSize, nodeWidth(graph, measuredWidths));
        LOG.debug("{} node(s) in {} layer(s), {} edge(s); xSpacing={}, ySpacing={}, margin={}",
                layoutGraph.size(), order.size(), layoutGraph.edgeCount(),
                spacing.xSpacing(), spacing.ySpacing(), spacing.margin());

        double[] x = new double[layoutGraph.size()];
        double[] y = new double[layoutGraph.size()];
        place(order, spacing, maxLayerSize, x, y);
        align(layoutGraph, layers, order, y);
        return normalize(graph, layers, spacing, x, y);
    }

    /**
     * Width of the widest node, never below the configured minimum.
     */
    double nodeWidth(MemoryGraph graph, Map<String, Double> measuredWidths) {
        double width = options.minNodeWidth();
        for (MemoryObject object : graph.objects()) {
            Double measured = measuredWidths.get(object.address());
            double candidate = measured != null ? measured : estimateWidth(object);
            width = Math.max(width, candidate);
        }
        return width;
    }

    private double estimateWidth(MemoryObject object) {
        int longest = object.displayLines().stream().mapToInt(String::length).max().orElse(0);
        return longest * options.charWidth() + options.nodePadding();
    }

    private void place(List<List<Integer>> order, AdaptiveSpacing spacing, int maxLayerSize, double[] x, double[] y) {
        double tallest = (maxLayerSize - 1) * spacing.ySpacing();
        for (int layer = 0; layer < order.size(); layer++) {
            List<Integer> nodes = order.get(layer);
            double offset = (tallest - (nodes.size() - 1) * spacing.ySpacing()) / 2;
            for (int slot = 0; slot < nodes.size(); slot++) {
                int node = nodes.get(slot);
                x[node] = spacing.margin() + layer * spacing.xSpacing();
                y[node] = spacing.margin() + offset + slot * spacing.ySpacing();
            }
        }
    }

    private void align(LayoutGraph graph, int[] layers, List<List<Integer>> order, double[] y) {
        int nudged = 0;
        for (int node = 0; node < graph.size(); node++) {
            int[] predecessors = graph.predecessors(node);
            int[] successors = graph.successors(node);
            if (predecessors.length != 1 || successors.length != 1) continue;

            double target = (y[predecessors[0]] + y[successors[0]]) / 2;
            double distance = target - y[node];
            if (distance == 0 || Math.abs(distance) >= options.alignmentThreshold()) continue;
            if (overlapsLayer(node, target, order.get(layers[node]), y)) continue;
            y[node] = target;
            nudged++;
        }
        LOG.debug("Alignment nudged {} node(s)", nudged);
    }

    private boolean overlapsLayer(int node, double targetY, List<Integer> layer, double[] y) {
        for (int other : layer) {
            if (other != node && Math.abs(y[other] - targetY) < options.nodeHeight()) {
                return true;
            }
        }
        return false;
    }

    private LayoutResult normalize(MemoryGraph graph, int[] layers, AdaptiveSpacing spacing, double[] x, double[] y) {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        for (int i = 0; i < x.length; i++) {
            minX = Math.min(minX, x[i]);
            minY = Math.min(minY, y[i]);
        }
        double dx = spacing.margin() - minX;
        double dy = spacing.margin() - minY;

        Map<String, Position> positions = new LinkedHashMap<>();
        Map<String, Integer> layerByAddress = new LinkedHashMap<>();
        double maxX = 0;
        double maxY = 0;
        List<MemoryObject> objects = graph.objects();
        for (int i = 0; i < objects.size(); i++) {
            Position position = new Position(x[i], y[i]).translate(dx, dy);
            String address = objects.get(i).address();
            positions.put(address, position);
            layerByAddress.put(address, layers[i]);
            maxX = Math.max(maxX, position.x());
            maxY = Math.max(maxY, position.y());
        }
        return new LayoutResult(positions, layerByAddress, spacing.xSpacing(), spacing.ySpacing(), spacing.margin(),
                spacing.nodeWidth(), maxX + spacing.nodeWidth() + spacing.margin(),
                maxY + options.nodeHeight() + spacing.margin());
    }
}
