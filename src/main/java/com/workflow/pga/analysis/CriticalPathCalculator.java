package com.workflow.pga.analysis;

import com.workflow.pga.api.NoPathException;
import com.workflow.pga.model.ProcessGraph;
import com.workflow.pga.model.WeightMetric;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds the start-to-end path with the greatest accumulated weight.
 *
 * Every simple path from the {@link PathEnumerator} is scored by summing the
 * chosen metric over its nodes, absent attributes counting as 0. The winner is
 * the heaviest path; ties go to the path with fewer nodes, then to the
 * lexicographically smallest id sequence, so the result does not depend on
 * discovery order. With no weights at all the shortest path wins at weight 0.
 */
public final class CriticalPathCalculator {
    private static final Logger log = LogManager.getLogger(CriticalPathCalculator.class);

    private final PathEnumerator enumerator;

    public CriticalPathCalculator() {
        this(new PathEnumerator());
    }

    public CriticalPathCalculator(PathEnumerator enumerator) {
        this.enumerator = enumerator;
    }

    public CriticalPathResult calculate(ProcessGraph graph, WeightMetric metric) {
        return select(graph, enumerator.enumerate(graph), metric);
    }

    /**
     * Picks the critical path among already enumerated paths.
     *
     * @throws NoPathException if {@code paths} is empty.
     */
    public CriticalPathResult select(ProcessGraph graph, PathSet paths, WeightMetric metric) {
        if (paths.isEmpty())
            throw new NoPathException(graph.processId(),
                    "No start-to-end path in process " + graph.processId());

        List<String> best = null;
        double bestWeight = 0;
        for (List<String> candidate : paths.paths()) {
            double w = weight(graph, candidate, metric);
            if (best == null || isBetter(candidate, w, best, bestWeight)) {
                best = candidate;
                bestWeight = w;
            }
        }

        log.debug("Process {}: critical path by {} = {} (weight {})", graph.processId(), metric, best, bestWeight);
        return new CriticalPathResult(best, bestWeight, metric, paths.isTruncated());
    }

    public static double weight(ProcessGraph graph, List<String> path, WeightMetric metric) {
        double sum = 0;
        for (String id : path)
            sum += graph.node(id).weight(metric);
        return sum;
    }

    private static boolean isBetter(List<String> candidate, double weight, List<String> best, double bestWeight) {
        int c = Double.compare(weight, bestWeight);
        if (c != 0)
            return c > 0;
        if (candidate.size() != best.size())
            return candidate.size() < best.size();
        return compareIds(candidate, best) < 0;
    }

    private static int compareIds(List<String> a, List<String> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0)
                return c;
        }
        return Integer.compare(a.size(), b.size());
    }
}
