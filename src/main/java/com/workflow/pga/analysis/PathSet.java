package com.workflow.pga.analysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Simple paths found by the {@link PathEnumerator}, in discovery order, plus
 * any limit signals raised while searching.
 */
public final class PathSet {
    private static final PathSet EMPTY = new PathSet(List.of(), List.of());

    private final List<List<String>> paths;
    private final List<PathLimitExceeded> limitSignals;

    PathSet(List<List<String>> paths, List<PathLimitExceeded> limitSignals) {
        List<List<String>> frozen = new ArrayList<>(paths.size());
        for (List<String> p : paths)
            frozen.add(List.copyOf(p));
        this.paths = List.copyOf(frozen);
        this.limitSignals = List.copyOf(limitSignals);
    }

    public static PathSet empty() {
        return EMPTY;
    }

    public List<List<String>> paths() {
        return paths;
    }

    public List<PathLimitExceeded> limitSignals() {
        return limitSignals;
    }

    /** true if at least one start/end pair stopped early. */
    public boolean isTruncated() {
        return !limitSignals.isEmpty();
    }

    public int size() {
        return paths.size();
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }

    /** Paths passing through {@code nodeId}, in discovery order. */
    public List<List<String>> containing(String nodeId) {
        return paths.stream().filter(p -> p.contains(nodeId)).toList();
    }

    /** First discovered path with the most nodes. */
    public Optional<List<String>> longest() {
        return paths.stream().max(Comparator.comparingInt(List::size));
    }

    /** First discovered path with the fewest nodes. */
    public Optional<List<String>> shortest() {
        return paths.stream().min(Comparator.comparingInt(List::size));
    }
}
