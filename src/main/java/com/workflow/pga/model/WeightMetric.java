package com.workflow.pga.model;

/**
 * Node attribute accumulated along a path by the critical path calculation.
 * Duration and cost are independent metrics; they are never blended.
 */
public enum WeightMetric {
    DURATION,
    COST;

    public static WeightMetric fromString(String text) {
        for (WeightMetric m : WeightMetric.values()) {
            if (m.name().equalsIgnoreCase(text))
                return m;
        }
        throw new IllegalArgumentException("Unknown weight metric: " + text);
    }
}
