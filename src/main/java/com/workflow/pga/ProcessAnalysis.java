package com.workflow.pga;

import com.workflow.pga.analysis.BottleneckRecord;
import com.workflow.pga.analysis.BranchPoint;
import com.workflow.pga.analysis.CriticalPathResult;
import com.workflow.pga.analysis.PathSet;
import com.workflow.pga.layout.LayoutResult;
import com.workflow.pga.model.ProcessGraph;
import com.workflow.pga.util.ProcessStatistics;

import java.util.List;
import java.util.Optional;

/**
 * Every analysis of one graph, computed in one {@link ProcessAnalysisEngine#analyze} call.
 *
 * @param criticalPath {@code null} when the graph has no start-to-end path.
 */
public record ProcessAnalysis(ProcessGraph graph, LayoutResult layout, PathSet paths,
        List<BottleneckRecord> bottlenecks, List<BranchPoint> branches, CriticalPathResult criticalPath,
        ProcessStatistics statistics) {

    public ProcessAnalysis {
        bottlenecks = List.copyOf(bottlenecks);
        branches = List.copyOf(branches);
    }

    public Optional<CriticalPathResult> findCriticalPath() {
        return Optional.ofNullable(criticalPath);
    }
}
