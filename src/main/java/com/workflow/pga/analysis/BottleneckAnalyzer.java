package com.workflow.pga.analysis;

import com.workflow.pga.model.ProcessGraph;
import com.workflow.pga.model.ProcessNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks convergence points by the number of distinct predecessors. Parallel
 * edges from the same source count once; nodes with one predecessor or none
 * are not convergence points.
 */
public final class BottleneckAnalyzer {

    private static final Comparator<BottleneckRecord> RANKING = Comparator
            .comparingInt(BottleneckRecord::distinctPredecessorCount).reversed()
            .thenComparing(BottleneckRecord::nodeId);

    public List<BottleneckRecord> analyze(ProcessGraph graph) {
        List<BottleneckRecord> out = new ArrayList<>();
        for (ProcessNode node : graph.nodes()) {
            int count = graph.distinctPredecessors(node.id()).size();
            if (count > 1)
                out.add(new BottleneckRecord(node.id(), count));
        }
        out.sort(RANKING);
        return List.copyOf(out);
    }
}
