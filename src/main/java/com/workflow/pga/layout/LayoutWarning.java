package com.workflow.pga.layout;

/**
 * Non-fatal condition met while laying out a graph. The layout is still
 * complete when a warning is present.
 */
public record LayoutWarning(Type type, String message) {

    public enum Type {
        /** No Start node and no source node: an arbitrary root was picked. */
        DEGENERATE_GRAPH
    }
}
