package com.workflow.pga.analysis;

import com.workflow.pga.model.ProcessGraph;
import com.workflow.pga.model.ProcessNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Lists the split points of a process, the mirror image of
 * {@link BottleneckAnalyzer}: every node with more than one distinct
 * successor, widest first, ties by id.
 */
public final class BranchAnalyzer {

    private static final Comparator<BranchPoint> RANKING = Comparator
            .comparingInt(BranchPoint::branchCount).reversed()
            .thenComparing(BranchPoint::nodeId);

    public List<BranchPoint> analyze(ProcessGraph graph) {
        List<BranchPoint> out = new ArrayList<>();
        for (ProcessNode node : graph.nodes()) {
            List<String> targets = graph.distinctSuccessors(node.id());
            if (targets.size() > 1)
                out.add(new BranchPoint(node.id(), node.kind(), targets));
        }
        out.sort(RANKING);
        return List.copyOf(out);
    }
}
