package com.workflow.pga.layout;

import com.workflow.pga.model.NodeKind;
import com.workflow.pga.model.ProcessGraph;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Deterministic layered layout: breadth-first distance from the layering
 * roots gives the layer (y), a stable sort within each layer gives the
 * position (x).
 *
 * Algorithm:
 * 1. Roots: every Start node; failing that every node without incoming flow;
 * failing that (every node sits on a cycle) the lexicographically smallest id,
 * with a {@link LayoutWarning.Type#DEGENERATE_GRAPH} warning.
 * 2. Multi-source BFS from all roots at once. First visit wins, so a back edge
 * into an already layered node changes nothing and cycles never push a layer
 * further down.
 * 3. Unreached nodes go to layer 0 and are reported as isolated.
 * 4. Each layer is sorted by the smallest position of a predecessor in an
 * earlier layer, then by id. Nodes with no such predecessor sort last.
 *
 * The result depends only on graph structure and {@link LayoutConfig}: no
 * randomness, no hash iteration order.
 */
@Log4j2
public final class LayeredLayoutEngine {
    private static final int NO_PREDECESSOR = Integer.MAX_VALUE;

    private final LayoutConfig config;

    public LayeredLayoutEngine() {
        this(LayoutConfig.DEFAULT);
    }

    public LayeredLayoutEngine(LayoutConfig config) {
        this.config = config;
    }

    public LayoutConfig config() {
        return config;
    }

    public LayoutResult layout(ProcessGraph graph) {
        int n = graph.nodeCount();
        List<LayoutWarning> warnings = new ArrayList<>();
        if (n == 0)
            return new LayoutResult(new LinkedHashMap<>(), List.of(), List.of(), warnings);

        // 1. Roots
        int[] roots = pickRoots(graph, warnings);

        // 2. Multi-source BFS
        int[] layer = new int[n];
        Arrays.fill(layer, -1);
        int[] queue = new int[n];
        int head = 0, tail = 0;
        for (int r : roots) {
            if (layer[r] < 0) {
                layer[r] = 0;
                queue[tail++] = r;
            }
        }
        while (head < tail) {
            int curr = queue[head++];
            for (int child : graph.successorIndices(curr)) {
                if (layer[child] < 0) {
                    layer[child] = layer[curr] + 1;
                    queue[tail++] = child;
                }
            }
        }

        // 3. Isolated nodes
        boolean[] isolated = new boolean[n];
        List<String> isolatedIds = new ArrayList<>();
        int maxLayer = 0;
        for (int i = 0; i < n; i++) {
            if (layer[i] < 0) {
                layer[i] = 0;
                isolated[i] = true;
                isolatedIds.add(graph.node(i).id());
            }
            maxLayer = Math.max(maxLayer, layer[i]);
        }
        if (!isolatedIds.isEmpty())
            log.debug("Process {}: {} node(s) unreachable from layering roots: {}", graph.processId(),
                    isolatedIds.size(), isolatedIds);

        // 4. Order within layers, top to bottom so predecessors are placed first
        List<List<Integer>> buckets = new ArrayList<>(maxLayer + 1);
        for (int l = 0; l <= maxLayer; l++)
            buckets.add(new ArrayList<>());
        for (int i = 0; i < n; i++)
            buckets.get(layer[i]).add(i);

        int[] order = new int[n];
        Arrays.fill(order, -1);
        List<List<String>> layers = new ArrayList<>(maxLayer + 1);
        Map<String, NodePosition> positions = new LinkedHashMap<>(n * 2);

        for (int l = 0; l <= maxLayer; l++) {
            List<Integer> bucket = buckets.get(l);
            int[] key = new int[n];
            for (int i : bucket)
                key[i] = placedPredecessorKey(graph, i, l, layer, order);

            bucket.sort(Comparator.<Integer>comparingInt(i -> key[i])
                    .thenComparing(i -> graph.node(i).id()));

            List<String> ids = new ArrayList<>(bucket.size());
            for (int pos = 0; pos < bucket.size(); pos++) {
                int i = bucket.get(pos);
                order[i] = pos;
                String id = graph.node(i).id();
                ids.add(id);
                positions.put(id, new NodePosition(id,
                        config.marginX() + pos * config.nodeSpacingX(),
                        config.marginY() + l * config.layerSpacingY(),
                        l, pos, isolated[i]));
            }
            layers.add(ids);
        }

        return new LayoutResult(positions, layers, isolatedIds, warnings);
    }

    private static int placedPredecessorKey(ProcessGraph graph, int node, int nodeLayer, int[] layer, int[] order) {
        int best = NO_PREDECESSOR;
        for (int p : graph.predecessorIndices(node))
            if (layer[p] < nodeLayer && order[p] >= 0)
                best = Math.min(best, order[p]);
        return best;
    }

    private static int[] pickRoots(ProcessGraph graph, List<LayoutWarning> warnings) {
        List<String> starts = graph.nodesOfKind(NodeKind.START);
        if (!starts.isEmpty())
            return starts.stream().mapToInt(graph::indexOf).toArray();

        List<Integer> sources = new ArrayList<>();
        for (int i = 0; i < graph.nodeCount(); i++)
            if (graph.predecessorIndices(i).length == 0)
                sources.add(i);
        if (!sources.isEmpty())
            return sources.stream().mapToInt(Integer::intValue).toArray();

        String smallest = null;
        for (int i = 0; i < graph.nodeCount(); i++) {
            String id = graph.node(i).id();
            if (smallest == null || id.compareTo(smallest) < 0)
                smallest = id;
        }
        String msg = "Process " + graph.processId() + " has no Start node and no source node; using '" + smallest
                + "' as layering root";
        log.warn(msg);
        warnings.add(new LayoutWarning(LayoutWarning.Type.DEGENERATE_GRAPH, msg));
        return new int[] { graph.indexOf(smallest) };
    }
}
