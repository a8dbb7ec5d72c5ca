package com.workflow.pga.analysis;

import com.workflow.pga.model.NodeKind;
import com.workflow.pga.model.ProcessGraph;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Enumerates every simple path between start and end nodes.
 *
 * Depth-first search from each start node towards each end node. The visited
 * set belongs to the current path only and is unwound on backtrack, which
 * keeps paths simple and guarantees termination on cyclic graphs. Parallel
 * edges are followed once.
 *
 * Bounds:
 * - maxPathLength: maximum number of nodes in a path. 0 means twice the node
 * count of the graph being searched.
 * - maxPaths: maximum number of paths per start/end pair. 0 means unbounded.
 * Hitting either bound stops the current pair, keeps what was found, and adds a
 * {@link PathLimitExceeded} signal to the result.
 */
@Log4j2
public final class PathEnumerator {
    private final int maxPathLength;
    private final int maxPaths;

    public PathEnumerator() {
        this(0, 0);
    }

    public PathEnumerator(int maxPathLength, int maxPaths) {
        if (maxPathLength < 0 || maxPaths < 0)
            throw new IllegalArgumentException(
                    "Path limits must not be negative: maxPathLength=" + maxPathLength + ", maxPaths=" + maxPaths);
        this.maxPathLength = maxPathLength;
        this.maxPaths = maxPaths;
    }

    /** Effective length bound for {@code graph}. */
    public int maxPathLength(ProcessGraph graph) {
        return maxPathLength > 0 ? maxPathLength : Math.max(1, 2 * graph.nodeCount());
    }

    public int maxPaths() {
        return maxPaths;
    }

    /** All simple paths from Start nodes to End nodes. */
    public PathSet enumerate(ProcessGraph graph) {
        return enumerate(graph, NodeKind.START, NodeKind.END);
    }

    /** All simple paths from nodes of {@code startKind} to nodes of {@code endKind}. */
    public PathSet enumerate(ProcessGraph graph, NodeKind startKind, NodeKind endKind) {
        List<String> starts = graph.nodesOfKind(startKind);
        List<String> ends = graph.nodesOfKind(endKind);
        if (starts.isEmpty() || ends.isEmpty())
            return PathSet.empty();

        int[][] succ = distinctSuccessors(graph);
        List<List<String>> paths = new ArrayList<>();
        List<PathLimitExceeded> signals = new ArrayList<>();
        for (String s : starts)
            for (String e : ends)
                new PairSearch(graph, succ, graph.indexOf(s), graph.indexOf(e)).run(paths, signals);
        return new PathSet(paths, signals);
    }

    /** All simple paths from {@code startId} to {@code endId}. */
    public PathSet enumerate(ProcessGraph graph, String startId, String endId) {
        int s = graph.indexOf(startId), e = graph.indexOf(endId);
        List<List<String>> paths = new ArrayList<>();
        List<PathLimitExceeded> signals = new ArrayList<>();
        new PairSearch(graph, distinctSuccessors(graph), s, e).run(paths, signals);
        return new PathSet(paths, signals);
    }

    private static int[][] distinctSuccessors(ProcessGraph graph) {
        int n = graph.nodeCount();
        int[][] out = new int[n][];
        for (int i = 0; i < n; i++)
            out[i] = Arrays.stream(graph.successorIndices(i)).distinct().toArray();
        return out;
    }

    /** DFS state for one start/end pair. */
    private final class PairSearch {
        private final ProcessGraph graph;
        private final int[][] succ;
        private final int start, end;
        private final int lengthLimit;
        private final boolean[] onPath;
        private final int[] path;
        private int depth;
        private final List<List<String>> found = new ArrayList<>();
        private PathLimitExceeded signal;

        PairSearch(ProcessGraph graph, int[][] succ, int start, int end) {
            this.graph = graph;
            this.succ = succ;
            this.start = start;
            this.end = end;
            this.lengthLimit = maxPathLength(graph);
            this.onPath = new boolean[graph.nodeCount()];
            this.path = new int[graph.nodeCount()];
        }

        void run(List<List<String>> paths, List<PathLimitExceeded> signals) {
            dfs(start);
            paths.addAll(found);
            if (signal != null) {
                log.warn("Process {}: path enumeration stopped early, {} path(s) kept: {}", graph.processId(),
                        found.size(), signal);
                signals.add(signal);
            }
        }

        private void dfs(int node) {
            path[depth++] = node;
            onPath[node] = true;
            try {
                if (node == end) {
                    record();
                    return;
                }
                for (int child : succ[node]) {
                    if (signal != null)
                        return;
                    if (onPath[child])
                        continue;
                    if (depth >= lengthLimit) {
                        stop(PathLimitExceeded.Reason.PATH_LENGTH, lengthLimit);
                        return;
                    }
                    dfs(child);
                }
            } finally {
                onPath[node] = false;
                depth--;
            }
        }

        private void record() {
            if (maxPaths > 0 && found.size() >= maxPaths) {
                stop(PathLimitExceeded.Reason.PATH_COUNT, maxPaths);
                return;
            }
            List<String> ids = new ArrayList<>(depth);
            for (int k = 0; k < depth; k++)
                ids.add(graph.node(path[k]).id());
            found.add(ids);
        }

        private void stop(PathLimitExceeded.Reason reason, int limit) {
            signal = new PathLimitExceeded(graph.node(start).id(), graph.node(end).id(), reason, limit);
        }
    }
}
