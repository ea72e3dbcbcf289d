package org.pointerviz.layout;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Assigns each node a layer one deeper than the deepest node pointing to it; nodes nobody points to
 * sit at layer 0. The referent at the end of an indirection chain therefore lands in the deepest layer.
 * <p>
 * The traversal is iterative with a three-state marker per node, so long chains cannot overflow the call
 * stack. A predecessor met while it is still in progress closes a cycle and contributes 0 instead of
 * being followed. Each node is computed once.
 */
final class LayerAssigner {

    private static final byte UNVISITED = 0;
    private static final byte IN_PROGRESS = 1;
    private static final byte DONE = 2;

    private LayerAssigner() {
    }

    private static final class Frame {
        final int node;
        int nextPredecessor;
        int layer;

        Frame(int node) {
            this.node = node;
        }
    }

    static int[] assign(LayoutGraph graph) {
        int n = graph.size();
        int[] layers = new int[n];
        byte[] state = new byte[n];
        Deque<Frame> stack = new ArrayDeque<>();

        for (int root = 0; root < n; root++) {
            if (state[root] != UNVISITED) continue;
            state[root] = IN_PROGRESS;
            stack.push(new Frame(root));

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                int[] predecessors = graph.predecessors(frame.node);
                if (frame.nextPredecessor < predecessors.length) {
                    int predecessor = predecessors[frame.nextPredecessor++];
                    if (state[predecessor] == DONE) {
                        frame.layer = Math.max(frame.layer, layers[predecessor] + 1);
                    } else if (state[predecessor] == UNVISITED) {
                        state[predecessor] = IN_PROGRESS;
                        stack.push(new Frame(predecessor));
                    }
                    // IN_PROGRESS: back edge of a cycle, contributes 0
                    continue;
                }
                layers[frame.node] = frame.layer;
                state[frame.node] = DONE;
                stack.pop();
                Frame parent = stack.peek();
                if (parent != null) {
                    parent.layer = Math.max(parent.layer, frame.layer + 1);
                }
            }
        }
        return layers;
    }
}
