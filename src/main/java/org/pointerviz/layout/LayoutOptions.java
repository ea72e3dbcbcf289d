package org.pointerviz.layout;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Fixed constants of the layout heuristics. Defaults live in {@code reference.conf} under
 * {@code pointerviz.layout}; any key missing there falls back to {@link #DEFAULT}.
 *
 * @param charWidth            Estimated width of one character of node text.
 * @param nodePadding          Horizontal padding added to the estimated text width.
 * @param minNodeWidth         Lower bound for a node width.
 * @param nodeHeight           Estimated node height.
 * @param horizontalGap        Base gap between two layer columns.
 * @param minHorizontalGap     Smallest gap allowed between two layer columns.
 * @param baseVerticalSpacing  Base distance between the tops of two nodes in one layer.
 * @param minVerticalGap       Smallest gap allowed between two nodes in one layer.
 * @param layerFactorMin       Lower band edge of the layer-count factor.
 * @param layerFactorMax       Upper band edge of the layer-count factor.
 * @param densityFactorMin     Lower band edge of the edge-density factor.
 * @param densityFactorMax     Upper band edge of the edge-density factor.
 * @param occupancyFactorMin   Lower band edge of the layer-occupancy factor.
 * @param occupancyFactorMax   Upper band edge of the layer-occupancy factor.
 * @param nodeCountFactorMin   Lower band edge of the node-count factor.
 * @param nodeCountFactorMax   Upper band edge of the node-count factor.
 * @param smallGraphNodes      Graphs with at most this many nodes use {@code smallMargin}.
 * @param largeGraphNodes      Graphs with at least this many nodes use {@code largeMargin}.
 * @param smallMargin          Margin of small graphs.
 * @param margin               Margin of medium graphs.
 * @param largeMargin          Margin of large graphs.
 * @param alignmentThreshold   Largest vertical nudge the alignment pass may apply.
 * @param sweeps               Number of alternating crossing-reduction sweeps.
 */
public record LayoutOptions(
        double charWidth,
        double nodePadding,
        double minNodeWidth,
        double nodeHeight,
        double horizontalGap,
        double minHorizontalGap,
        double baseVerticalSpacing,
        double minVerticalGap,
        double layerFactorMin,
        double layerFactorMax,
        double densityFactorMin,
        double densityFactorMax,
        double occupancyFactorMin,
        double occupancyFactorMax,
        double nodeCountFactorMin,
        double nodeCountFactorMax,
        int smallGraphNodes,
        int largeGraphNodes,
        double smallMargin,
        double margin,
        double largeMargin,
        double alignmentThreshold,
        int sweeps
) {

    public static final String CONFIG_PATH = "pointerviz.layout";

    public static final LayoutOptions DEFAULT = new LayoutOptions(
            7.5, 40, 160, 120,
            100, 40, 160, 20,
            0.8, 1.3,
            1.0, 1.4,
            0.75, 1.2,
            0.85, 1.1,
            5, 20,
            30, 40, 60,
            80, 3);

    public LayoutOptions {
        if (sweeps < 0) {
            throw new IllegalArgumentException("sweeps must not be negative: " + sweeps);
        }
        requireBand("layer-factor", layerFactorMin, layerFactorMax);
        requireBand("density-factor", densityFactorMin, densityFactorMax);
        requireBand("occupancy-factor", occupancyFactorMin, occupancyFactorMax);
        requireBand("node-count-factor", nodeCountFactorMin, nodeCountFactorMax);
    }

    /**
     * Loads options from the {@code pointerviz.layout} section of the classpath configuration.
     */
    public static LayoutOptions defaults() {
        Config config = ConfigFactory.load();
        return config.hasPath(CONFIG_PATH) ? fromConfig(config.getConfig(CONFIG_PATH)) : DEFAULT;
    }

    /**
     * Reads options from a layout config section. Missing keys keep their {@link #DEFAULT} value.
     *
     * @param options The {@code pointerviz.layout} section.
     */
    public static LayoutOptions fromConfig(Config options) {
        LayoutOptions d = DEFAULT;
        return new LayoutOptions(
                getDouble(options, "char-width", d.charWidth),
                getDouble(options, "node-padding", d.nodePadding),
                getDouble(options, "min-node-width", d.minNodeWidth),
                getDouble(options, "node-height", d.nodeHeight),
                getDouble(options, "horizontal-gap", d.horizontalGap),
                getDouble(options, "min-horizontal-gap", d.minHorizontalGap),
                getDouble(options, "base-vertical-spacing", d.baseVerticalSpacing),
                getDouble(options, "min-vertical-gap", d.minVerticalGap),
                getDouble(options, "layer-factor.min", d.layerFactorMin),
                getDouble(options, "layer-factor.max", d.layerFactorMax),
                getDouble(options, "density-factor.min", d.densityFactorMin),
                getDouble(options, "density-factor.max", d.densityFactorMax),
                getDouble(options, "occupancy-factor.min", d.occupancyFactorMin),
                getDouble(options, "occupancy-factor.max", d.occupancyFactorMax),
                getDouble(options, "node-count-factor.min", d.nodeCountFactorMin),
                getDouble(options, "node-count-factor.max", d.nodeCountFactorMax),
                options.hasPath("margin.small-graph-nodes") ? options.getInt("margin.small-graph-nodes") : d.smallGraphNodes,
                options.hasPath("margin.large-graph-nodes") ? options.getInt("margin.large-graph-nodes") : d.largeGraphNodes,
                getDouble(options, "margin.small", d.smallMargin),
                getDouble(options, "margin.medium", d.margin),
                getDouble(options, "margin.large", d.largeMargin),
                getDouble(options, "alignment-threshold", d.alignmentThreshold),
                options.hasPath("sweeps") ? options.getInt("sweeps") : d.sweeps);
    }

    private static double getDouble(Config options, String path, double fallback) {
        return options.hasPath(path) ? options.getDouble(path) : fallback;
    }

    private static void requireBand(String name, double min, double max) {
        if (min > max) {
            throw new IllegalArgumentException(name + " band is empty: [" + min + ", " + max + "]");
        }
    }
}
