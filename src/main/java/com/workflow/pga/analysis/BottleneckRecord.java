package com.workflow.pga.analysis;

/**
 * A convergence point: a node that more than one distinct branch flows into.
 */
public record BottleneckRecord(String nodeId, int distinctPredecessorCount) {
}
