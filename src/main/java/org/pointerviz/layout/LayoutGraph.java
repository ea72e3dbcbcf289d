package org.pointerviz.layout;

import org.pointerviz.model.MemoryGraph;
import org.pointerviz.model.MemoryObject;
import org.pointerviz.model.PointerEdge;

import java.util.ArrayList;
import java.util.List;

/**
 * Index-based adjacency view of a {@link MemoryGraph}. Node {@code i} is the {@code i}-th declared object;
 * an edge runs from a pointer or reference to its resolved target.
 */
final class LayoutGraph {

    private final List<MemoryObject> nodes;
    private final int[][] successors;
    private final int[][] predecessors;
    private final int edgeCount;

    private LayoutGraph(List<MemoryObject> nodes, int[][] successors, int[][] predecessors, int edgeCount) {
        this.nodes = nodes;
        this.successors = successors;
        this.predecessors = predecessors;
        this.edgeCount = edgeCount;
    }

    static LayoutGraph of(MemoryGraph graph) {
        int n = graph.size();
        List<List<Integer>> out = new ArrayList<>(n);
        List<List<Integer>> in = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new ArrayList<>());
            in.add(new ArrayList<>());
        }
        List<PointerEdge> edges = graph.edges();
        for (PointerEdge edge : edges) {
            int from = graph.indexOf(edge.fromAddress());
            int to = graph.indexOf(edge.toAddress());
            out.get(from).add(to);
            in.get(to).add(from);
        }
        return new LayoutGraph(graph.objects(), toArrays(out), toArrays(in), edges.size());
    }

    private static int[][] toArrays(List<List<Integer>> lists) {
        int[][] result = new int[lists.size()][];
        for (int i = 0; i < lists.size(); i++) {
            result[i] = lists.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return result;
    }

    int size() {
        return nodes.size();
    }

    MemoryObject node(int index) {
        return nodes.get(index);
    }

    int[] successors(int index) {
        return successors[index];
    }

    int[] predecessors(int index) {
        return predecessors[index];
    }

    int edgeCount() {
        return edgeCount;
    }
}
