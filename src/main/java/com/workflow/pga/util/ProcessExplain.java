package com.workflow.pga.util;

import com.workflow.pga.analysis.CriticalPathResult;
import com.workflow.pga.model.NodeKind;
import com.workflow.pga.model.ProcessGraph;
import com.workflow.pga.model.ProcessNode;
import com.workflow.pga.model.SequenceEdge;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Diagnostic utility for inspecting process structure.
 *
 * <p>
 * Generates human-readable text dumps and Mermaid diagrams. Intended for
 * debugging sessions, log output and Markdown reports.
 */
public final class ProcessExplain {
    private final ProcessGraph graph;

    public ProcessExplain(ProcessGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps details of a single node.
     */
    public String explainNode(String nodeId) {
        ProcessNode node = graph.node(nodeId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeId).append('\n')
                .append("  Label: ").append(node.label()).append('\n')
                .append("  Kind: ").append(node.kind().label()).append('\n')
                .append("  Index: ").append(graph.indexOf(nodeId)).append('\n');
        if (node.duration() != null)
            sb.append("  Duration: ").append(node.duration()).append('\n');
        if (node.cost() != null)
            sb.append("  Cost: ").append(node.cost()).append('\n');
        if (node.role() != null)
            sb.append("  Role: ").append(node.role()).append('\n');
        sb.append("  Predecessors: ").append(String.join(", ", graph.predecessors(nodeId))).append('\n');
        sb.append("  Successors: ").append(String.join(", ", graph.successors(nodeId)));
        return sb.append('\n').toString();
    }

    /**
     * Dumps the whole process, one node per line with its outgoing flows.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Process ").append(graph.processId()).append(" (").append(graph.nodeCount())
                .append(" nodes, ").append(graph.edgeCount()).append(" edges):\n");
        for (int i = 0; i < graph.nodeCount(); i++) {
            ProcessNode node = graph.node(i);
            sb.append("  [").append(i).append("] ").append(node.id())
                    .append(" (").append(node.kind().label()).append(')');
            List<String> succ = graph.successors(node.id());
            if (!succ.isEmpty())
                sb.append(" -> ").append(String.join(", ", succ));
            sb.append('\n');
        }
        return sb.toString();
    }

    public String toMermaid() {
        return toMermaid(null);
    }

    /**
     * Generates a Mermaid flowchart.
     * <p>
     * Node shapes follow the step kind. Edges lying on {@code criticalPath}, if
     * given, are drawn thick and red.
     * </p>
     */
    public String toMermaid(CriticalPathResult criticalPath) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Nodes in insertion order
        for (ProcessNode node : graph.nodes()) {
            sb.append("  ").append(sanitize(node.id())).append(shape(node.kind(), escape(node.label())))
                    .append(":::kind_").append(node.kind().name().toLowerCase(Locale.ROOT)).append(";\n");
        }

        // 2. Edges in insertion order; Mermaid numbers links in declaration order
        Set<String> critical = new HashSet<>();
        if (criticalPath != null) {
            List<String> nodes = criticalPath.nodes();
            for (int i = 0; i + 1 < nodes.size(); i++)
                critical.add(nodes.get(i) + '\u0000' + nodes.get(i + 1));
        }
        StringBuilder styles = new StringBuilder();
        int linkIndex = 0;
        for (SequenceEdge e : graph.edges()) {
            sb.append("  ").append(sanitize(e.from())).append(" --> ").append(sanitize(e.to())).append(";\n");
            if (critical.contains(e.from() + '\u0000' + e.to()))
                styles.append("  linkStyle ").append(linkIndex).append(" stroke:#e74c3c,stroke-width:3px;\n");
            linkIndex++;
        }
        sb.append(styles);

        // 3. Kind colours ('end' is a Mermaid keyword, hence the prefix)
        sb.append("  classDef kind_start fill:#2ecc71;\n")
                .append("  classDef kind_end fill:#e74c3c;\n")
                .append("  classDef kind_task fill:#3498db;\n")
                .append("  classDef kind_gateway fill:#f39c12;\n")
                .append("  classDef kind_event fill:#1abc9c;\n");
        return sb.toString();
    }

    private static String shape(NodeKind kind, String text) {
        return switch (kind) {
            case START, END -> "((\"" + text + "\"))";
            case GATEWAY -> "{\"" + text + "\"}";
            case EVENT -> "([\"" + text + "\"])";
            case TASK -> "[\"" + text + "\"]";
        };
    }

    private static String escape(String label) {
        return label.replace("\"", "#quot;");
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
