package com.workflow.pga.model;

import com.workflow.pga.api.GraphValidationException;

/**
 * Closed set of workflow step kinds.
 */
public enum NodeKind {
    START("Start"),
    END("End"),
    TASK("Task"),
    GATEWAY("Gateway"),
    EVENT("Event");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    /** Display form used in export documents, e.g. {@code Gateway}. */
    public String label() {
        return label;
    }

    public static NodeKind fromString(String text) {
        if (text != null) {
            for (NodeKind k : NodeKind.values()) {
                if (k.name().equalsIgnoreCase(text.trim()))
                    return k;
            }
        }
        throw new GraphValidationException("Unknown node kind: " + text);
    }
}
