package com.workflow.pga.model;

import com.workflow.pga.api.GraphValidationException;
import com.workflow.pga.api.UnknownNodeException;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Immutable, validated index over the steps and sequence flows of one process.
 *
 * Cycles are legal: rework loops are ordinary workflow data. Parallel edges
 * between the same ordered pair are kept as separate flows.
 *
 * Data layout:
 * Adjacency is stored in compressed form, one pair of arrays per direction.
 * For node i, its outgoing targets are
 * {@code succList[succOffset[i]] .. succList[succOffset[i+1] - 1]} in edge
 * insertion order; incoming sources use {@code predOffset}/{@code predList} the
 * same way. Everything is computed once in {@link Builder#build()}, O(V+E).
 */
@Log4j2
public final class ProcessGraph {
    private final String processId;
    private final String name;

    // Nodes in insertion order; the position is the node's index.
    private final ProcessNode[] nodes;
    private final Map<String, Integer> idToIndex;
    private final List<SequenceEdge> edges;

    private final int[] succOffset;
    private final int[] succList;
    private final int[] predOffset;
    private final int[] predList;

    private ProcessGraph(String processId, String name, ProcessNode[] nodes, Map<String, Integer> idToIndex,
            List<SequenceEdge> edges, int[] succOffset, int[] succList, int[] predOffset, int[] predList) {
        this.processId = processId;
        this.name = name;
        this.nodes = nodes;
        this.idToIndex = idToIndex;
        this.edges = edges;
        this.succOffset = succOffset;
        this.succList = succList;
        this.predOffset = predOffset;
        this.predList = predList;
    }

    public String processId() {
        return processId;
    }

    public String name() {
        return name;
    }

    public int nodeCount() {
        return nodes.length;
    }

    public int edgeCount() {
        return edges.size();
    }

    /** All nodes in insertion order. */
    public List<ProcessNode> nodes() {
        return List.of(nodes);
    }

    /** All edges in insertion order, parallel edges included. */
    public List<SequenceEdge> edges() {
        return edges;
    }

    public boolean contains(String id) {
        return idToIndex.containsKey(id);
    }

    /** Resolves a node id to its insertion index. O(1) hash lookup. */
    public int indexOf(String id) {
        Integer idx = idToIndex.get(id);
        if (idx == null)
            throw new UnknownNodeException(id);
        return idx;
    }

    public ProcessNode node(String id) {
        return nodes[indexOf(id)];
    }

    public ProcessNode node(int index) {
        return nodes[index];
    }

    /** Edge targets of {@code id} in edge insertion order, one entry per edge. */
    public List<String> successors(String id) {
        int i = indexOf(id);
        return ids(succList, succOffset[i], succOffset[i + 1]);
    }

    /** Edge sources into {@code id} in edge insertion order, one entry per edge. */
    public List<String> predecessors(String id) {
        int i = indexOf(id);
        return ids(predList, predOffset[i], predOffset[i + 1]);
    }

    /** Successors with parallel edges collapsed, first occurrence order. */
    public List<String> distinctSuccessors(String id) {
        return List.copyOf(new LinkedHashSet<>(successors(id)));
    }

    /** Predecessors with parallel edges collapsed, first occurrence order. */
    public List<String> distinctPredecessors(String id) {
        return List.copyOf(new LinkedHashSet<>(predecessors(id)));
    }

    public int outDegree(String id) {
        int i = indexOf(id);
        return succOffset[i + 1] - succOffset[i];
    }

    public int inDegree(String id) {
        int i = indexOf(id);
        return predOffset[i + 1] - predOffset[i];
    }

    // Index-based accessors for the traversal code.

    int successorCount(int index) {
        return succOffset[index + 1] - succOffset[index];
    }

    public int[] successorIndices(int index) {
        return Arrays.copyOfRange(succList, succOffset[index], succOffset[index + 1]);
    }

    public int[] predecessorIndices(int index) {
        return Arrays.copyOfRange(predList, predOffset[index], predOffset[index + 1]);
    }

    /** Ids of the nodes of the given kind, in insertion order. */
    public List<String> nodesOfKind(NodeKind kind) {
        List<String> out = new ArrayList<>();
        for (ProcessNode n : nodes)
            if (n.kind() == kind)
                out.add(n.id());
        return out;
    }

    /** Nodes other than {@code End} that have no outgoing edge. */
    public List<String> deadEnds() {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < nodes.length; i++)
            if (nodes[i].kind() != NodeKind.END && successorCount(i) == 0)
                out.add(nodes[i].id());
        return out;
    }

    /** Case-insensitive substring match on labels, in insertion order. */
    public List<ProcessNode> findByLabel(String fragment) {
        String needle = fragment.toLowerCase(Locale.ROOT);
        List<ProcessNode> out = new ArrayList<>();
        for (ProcessNode n : nodes)
            if (n.label().toLowerCase(Locale.ROOT).contains(needle))
                out.add(n);
        return out;
    }

    private List<String> ids(int[] flat, int from, int to) {
        List<String> out = new ArrayList<>(to - from);
        for (int k = from; k < to; k++)
            out.add(nodes[flat[k]].id());
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        return "ProcessGraph[" + processId + ", " + nodes.length + " nodes, " + edges.size() + " edges]";
    }

    public static Builder builder(String processId, String name) {
        return new Builder(processId, name);
    }

    public static ProcessGraph of(String processId, String name, Collection<ProcessNode> nodes,
            Collection<SequenceEdge> edges) {
        Builder b = builder(processId, name);
        nodes.forEach(b::addNode);
        edges.forEach(b::addEdge);
        return b.build();
    }

    /**
     * Collects nodes and edges. Nothing is checked until {@link #build()}, which
     * reports every problem at once and never yields a partial graph.
     */
    public static final class Builder {
        private final String processId;
        private final String name;
        private final List<ProcessNode> nodes = new ArrayList<>();
        private final List<SequenceEdge> edges = new ArrayList<>();

        private Builder(String processId, String name) {
            this.processId = processId;
            this.name = name;
        }

        public Builder addNode(ProcessNode node) {
            nodes.add(node);
            return this;
        }

        public Builder addEdge(String from, String to) {
            return addEdge(new SequenceEdge(from, to));
        }

        public Builder addEdge(SequenceEdge edge) {
            edges.add(edge);
            return this;
        }

        public ProcessGraph build() {
            List<String> problems = new ArrayList<>();
            int n = nodes.size();

            // 1. Index nodes
            Map<String, Integer> idToIdx = new HashMap<>(n * 2);
            for (int i = 0; i < n; i++) {
                ProcessNode node = nodes.get(i);
                if (node == null) {
                    problems.add("null node at position " + i);
                    continue;
                }
                if (node.id() == null || node.id().isBlank()) {
                    problems.add("node at position " + i + " has no id");
                    continue;
                }
                if (node.kind() == null)
                    problems.add("node " + node.id() + " has no kind");
                if (idToIdx.putIfAbsent(node.id(), i) != null)
                    problems.add("duplicate node id: " + node.id());
            }

            // 2. Resolve edges
            for (SequenceEdge e : edges) {
                if (e == null) {
                    problems.add("null edge");
                    continue;
                }
                if (!idToIdx.containsKey(e.from()))
                    problems.add("edge " + e + " references unknown node " + e.from());
                if (!idToIdx.containsKey(e.to()))
                    problems.add("edge " + e + " references unknown node " + e.to());
            }

            if (!problems.isEmpty())
                throw new GraphValidationException(problems);

            // 3. Degrees
            int[] outDeg = new int[n], inDeg = new int[n];
            for (SequenceEdge e : edges) {
                outDeg[idToIdx.get(e.from())]++;
                inDeg[idToIdx.get(e.to())]++;
            }

            // 4. Offsets
            int[] succOff = new int[n + 1], predOff = new int[n + 1];
            for (int i = 0; i < n; i++) {
                succOff[i + 1] = succOff[i] + outDeg[i];
                predOff[i + 1] = predOff[i] + inDeg[i];
            }

            // 5. Fill flat lists in edge insertion order
            int[] succ = new int[edges.size()], pred = new int[edges.size()];
            int[] succFill = Arrays.copyOf(succOff, n), predFill = Arrays.copyOf(predOff, n);
            for (SequenceEdge e : edges) {
                int from = idToIdx.get(e.from()), to = idToIdx.get(e.to());
                succ[succFill[from]++] = to;
                pred[predFill[to]++] = from;
            }

            ProcessGraph graph = new ProcessGraph(processId, name, nodes.toArray(new ProcessNode[0]),
                    Collections.unmodifiableMap(idToIdx), List.copyOf(edges), succOff, succ, predOff, pred);

            log.debug("Built {}", graph);
            List<String> deadEnds = graph.deadEnds();
            if (!deadEnds.isEmpty())
                log.warn("Process {} has dead ends (non-End nodes without outgoing flow): {}", processId, deadEnds);
            return graph;
        }
    }
}
