package com.workflow.pga.api;

/**
 * Raised by the critical path calculation when no start-to-end path exists in
 * the graph.
 */
public class NoPathException extends ProcessAnalysisException {
    private final String processId;

    public NoPathException(String processId, String message) {
        super(message);
        this.processId = processId;
    }

    public String processId() {
        return processId;
    }
}
