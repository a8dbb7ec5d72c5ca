package com.workflow.pga.analysis;

import com.workflow.pga.model.WeightMetric;

import java.util.List;

/**
 * The heaviest start-to-end path.
 *
 * @param nodes     Node ids from start to end.
 * @param weight    Sum of the metric over the path's nodes.
 * @param metric    Metric that was summed.
 * @param truncated true if path enumeration hit a limit, so a heavier path may
 *                  exist beyond it.
 */
public record CriticalPathResult(List<String> nodes, double weight, WeightMetric metric, boolean truncated) {

    public CriticalPathResult {
        nodes = List.copyOf(nodes);
    }

    public int hopCount() {
        return nodes.size() - 1;
    }
}
