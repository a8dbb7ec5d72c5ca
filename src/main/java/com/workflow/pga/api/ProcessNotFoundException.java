package com.workflow.pga.api;

/**
 * Raised by a {@link GraphProvider} when it holds no process with the requested
 * id. The engine passes it to its caller unchanged.
 */
public class ProcessNotFoundException extends ProcessAnalysisException {
    private final String processId;

    public ProcessNotFoundException(String processId) {
        super("Process not found: " + processId);
        this.processId = processId;
    }

    public String processId() {
        return processId;
    }
}
