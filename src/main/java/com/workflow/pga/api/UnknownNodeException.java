package com.workflow.pga.api;

/** Lookup of a node id that the graph does not contain. */
public class UnknownNodeException extends ProcessAnalysisException {
    private final String nodeId;

    public UnknownNodeException(String nodeId) {
        super("Unknown node: " + nodeId);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
