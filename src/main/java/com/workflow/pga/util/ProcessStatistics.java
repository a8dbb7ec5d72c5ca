package com.workflow.pga.util;

import com.workflow.pga.model.NodeKind;
import com.workflow.pga.model.ProcessGraph;
import com.workflow.pga.model.ProcessNode;
import com.workflow.pga.model.WeightMetric;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Summary figures for one process: size, kind breakdown, total time and cost
 * over all steps, and the roles the process needs.
 *
 * @param processId   Process id.
 * @param nodeCount   Number of steps.
 * @param edgeCount   Number of sequence flows, parallel flows included.
 * @param kindCounts  Steps per kind; every kind is present, possibly 0.
 * @param totalDuration Sum of durations over all steps.
 * @param totalCost   Sum of costs over all steps.
 * @param roles       Distinct roles, sorted.
 * @param deadEnds    Non-End steps without outgoing flow.
 */
public record ProcessStatistics(String processId, int nodeCount, int edgeCount, Map<NodeKind, Integer> kindCounts,
        double totalDuration, double totalCost, List<String> roles, List<String> deadEnds) {

    public static ProcessStatistics of(ProcessGraph graph) {
        Map<NodeKind, Integer> counts = new EnumMap<>(NodeKind.class);
        for (NodeKind k : NodeKind.values())
            counts.put(k, 0);
        TreeSet<String> roles = new TreeSet<>();
        double duration = 0, cost = 0;
        for (ProcessNode n : graph.nodes()) {
            counts.merge(n.kind(), 1, Integer::sum);
            duration += n.weight(WeightMetric.DURATION);
            cost += n.weight(WeightMetric.COST);
            if (n.role() != null && !n.role().isBlank())
                roles.add(n.role().trim());
        }
        return new ProcessStatistics(graph.processId(), graph.nodeCount(), graph.edgeCount(),
                Collections.unmodifiableMap(counts), duration, cost, List.copyOf(roles), graph.deadEnds());
    }

    public int count(NodeKind kind) {
        return kindCounts.getOrDefault(kind, 0);
    }
}
