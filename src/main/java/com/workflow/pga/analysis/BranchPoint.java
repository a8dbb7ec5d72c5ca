package com.workflow.pga.analysis;

import com.workflow.pga.model.NodeKind;

import java.util.List;

/**
 * A node whose outgoing flow splits into more than one distinct branch.
 *
 * @param nodeId     The splitting node.
 * @param kind       Its kind; usually {@link NodeKind#GATEWAY}.
 * @param successors Distinct branch targets in edge insertion order.
 */
public record BranchPoint(String nodeId, NodeKind kind, List<String> successors) {

    public BranchPoint {
        successors = List.copyOf(successors);
    }

    public int branchCount() {
        return successors.size();
    }
}
