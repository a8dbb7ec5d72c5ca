package com.workflow.pga.report;

import com.workflow.pga.model.NodeKind;

/**
 * A Gateway or Event step with outgoing flow.
 *
 * @param branchCount Number of distinct successors, at least 1.
 */
public record GatewayRecord(String processId, String processName, String gatewayId, String gatewayLabel,
        NodeKind kind, int branchCount) {
}
