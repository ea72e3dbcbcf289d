package org.pointerviz.layout;

/**
 * Derives spacing and margin from node size and structural density.
 * <p>
 * Horizontal spacing grows with the widest node and with edge density, and shrinks as the number of
 * layers grows. Vertical spacing shrinks as layers fill up and as the graph grows. Every factor is clamped
 * to its band in {@link LayoutOptions}.
 *
 * @param xSpacing  Distance between two layer columns.
 * @param ySpacing  Distance between two nodes in one layer.
 * @param margin    Margin around the diagram.
 * @param nodeWidth The widest node width.
 */
record AdaptiveSpacing(double xSpacing, double ySpacing, double margin, double nodeWidth) {

    /**
     * @param options      The layout constants.
     * @param nodeCount    Number of nodes, at least 1.
     * @param edgeCount    Number of edges.
     * @param layerCount   Number of layers, at least 1.
     * @param maxLayerSize Number of nodes in the fullest layer.
     * @param nodeWidth    Width of the widest node.
     */
    static AdaptiveSpacing compute(LayoutOptions options, int nodeCount, int edgeCount, int layerCount,
                                   int maxLayerSize, double nodeWidth) {
        double layerFactor = clamp(1.4 - 0.1 * layerCount, options.layerFactorMin(), options.layerFactorMax());
        double edgesPerNode = (double) edgeCount / nodeCount;
        double densityFactor = clamp(1.0 + 0.5 * edgesPerNode, options.densityFactorMin(), options.densityFactorMax());
        double xSpacing = Math.max(nodeWidth + options.minHorizontalGap(),
                (nodeWidth + options.horizontalGap()) * layerFactor * densityFactor);

        double occupancyFactor = clamp(1.2 - 0.05 * maxLayerSize,
                options.occupancyFactorMin(), options.occupancyFactorMax());
        double countFactor = clamp(1.1 - 0.01 * nodeCount, options.nodeCountFactorMin(), options.nodeCountFactorMax());
        double ySpacing = Math.max(options.nodeHeight() + options.minVerticalGap(),
                options.baseVerticalSpacing() * occupancyFactor * countFactor);

        double margin;
        if (nodeCount <= options.smallGraphNodes()) {
            margin = options.smallMargin();
        } else if (nodeCount >= options.largeGraphNodes()) {
            margin = options.largeMargin();
        } else {
            margin = options.margin();
        }
        return new AdaptiveSpacing(xSpacing, ySpacing, margin, nodeWidth);
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
