package com.workflow.pga.model;

/**
 * One workflow step.
 *
 * @param id       Unique within the containing graph.
 * @param label    Human-readable name; defaults to the id.
 * @param kind     Step kind.
 * @param duration Optional duration, {@code null} when absent.
 * @param cost     Optional cost, {@code null} when absent.
 * @param role     Optional free-text role, {@code null} when absent.
 */
public record ProcessNode(String id, String label, NodeKind kind, Double duration, Double cost, String role) {

    public ProcessNode {
        if (label == null)
            label = id;
    }

    public static ProcessNode of(String id, NodeKind kind) {
        return new ProcessNode(id, id, kind, null, null, null);
    }

    public static ProcessNode start(String id) {
        return of(id, NodeKind.START);
    }

    public static ProcessNode end(String id) {
        return of(id, NodeKind.END);
    }

    public static ProcessNode task(String id) {
        return of(id, NodeKind.TASK);
    }

    public ProcessNode withDuration(Double duration) {
        return new ProcessNode(id, label, kind, duration, cost, role);
    }

    public ProcessNode withCost(Double cost) {
        return new ProcessNode(id, label, kind, duration, cost, role);
    }

    public ProcessNode withRole(String role) {
        return new ProcessNode(id, label, kind, duration, cost, role);
    }

    public ProcessNode withLabel(String label) {
        return new ProcessNode(id, label, kind, duration, cost, role);
    }

    /** Value of the chosen metric; an absent attribute counts as 0. */
    public double weight(WeightMetric metric) {
        Double v = switch (metric) {
            case DURATION -> duration;
            case COST -> cost;
        };
        return v != null ? v : 0.0;
    }
}
