package com.workflow.pga.api;

/**
 * Base type of every error raised by the analysis engine.
 *
 * All engine errors are unchecked. Construction errors abort the build call
 * that raised them; analysis errors are scoped to the single query and leave
 * the underlying graph untouched, so a caller may retry a different analysis
 * against the same instance.
 */
public class ProcessAnalysisException extends RuntimeException {

    public ProcessAnalysisException(String message) {
        super(message);
    }

    public ProcessAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
