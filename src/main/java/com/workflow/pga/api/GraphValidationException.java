package com.workflow.pga.api;

import java.util.List;

/**
 * Malformed graph construction input.
 * <p>
 * Carries every problem found during one build attempt, not only the first.
 */
public class GraphValidationException extends ProcessAnalysisException {
    private final List<String> problems;

    public GraphValidationException(String problem) {
        this(List.of(problem));
    }

    public GraphValidationException(List<String> problems) {
        super(summarize(problems));
        this.problems = List.copyOf(problems);
    }

    public GraphValidationException(String problem, Throwable cause) {
        super(problem, cause);
        this.problems = List.of(problem);
    }

    public List<String> problems() {
        return problems;
    }

    private static String summarize(List<String> problems) {
        if (problems.size() == 1)
            return "Invalid process graph: " + problems.get(0);
        return "Invalid process graph (" + problems.size() + " problems): " + String.join("; ", problems);
    }
}
