package com.workflow.pga.analysis;

/**
 * Non-fatal signal: enumeration for one start/end pair stopped early. The
 * paths found before the limit was hit are still part of the {@link PathSet}.
 *
 * @param startId Start node of the pair.
 * @param endId   End node of the pair.
 * @param reason  Which bound was hit.
 * @param limit   Value of that bound.
 */
public record PathLimitExceeded(String startId, String endId, Reason reason, int limit) {

    public enum Reason {
        /** A partial path would have grown past the maximum path length. */
        PATH_LENGTH,
        /** The pair produced more paths than the maximum path count. */
        PATH_COUNT
    }

    @Override
    public String toString() {
        return "PathLimitExceeded[" + startId + " -> " + endId + ", " + reason + " limit " + limit + "]";
    }
}
