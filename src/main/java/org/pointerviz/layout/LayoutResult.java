package org.pointerviz.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Computed coordinates of one layout run, keyed by object address in declaration order.
 *
 * @param positions Final top-left position of every node.
 * @param layers    Layer index of every node.
 * @param xSpacing  Distance between two layer columns.
 * @param ySpacing  Distance between two nodes of one layer.
 * @param margin    Margin applied around the diagram.
 * @param nodeWidth Width used for every node box.
 * @param width     Total diagram width including margins.
 * @param height    Total diagram height including margins.
 */
public record LayoutResult(
        Map<String, Position> positions,
        Map<String, Integer> layers,
        double xSpacing,
        double ySpacing,
        double margin,
        double nodeWidth,
        double width,
        double height
) {

    public LayoutResult {
        positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        layers = Collections.unmodifiableMap(new LinkedHashMap<>(layers));
    }

    static LayoutResult empty(double margin) {
        return new LayoutResult(Map.of(), Map.of(), 0, 0, margin, 0, 2 * margin, 2 * margin);
    }

    public Optional<Position> positionOf(String address) {
        return Optional.ofNullable(positions.get(address));
    }

    /**
     * @return the layer of the node, or -1 if the address was not laid out.
     */
    public int layerOf(String address) {
        return layers.getOrDefault(address, -1);
    }

    public int layerCount() {
        return layers.values().stream().mapToInt(Integer::intValue).max().orElse(-1) + 1;
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }
}
