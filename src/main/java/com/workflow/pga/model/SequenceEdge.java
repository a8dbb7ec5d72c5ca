package com.workflow.pga.model;

/**
 * Directed sequence flow between two steps of the same process.
 */
public record SequenceEdge(String from, String to) {

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
