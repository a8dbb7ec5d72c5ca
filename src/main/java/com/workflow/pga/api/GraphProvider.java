package com.workflow.pga.api;

import com.workflow.pga.model.ProcessGraph;

import java.util.List;

/**
 * Source of process graph snapshots.
 *
 * The engine depends on nothing else of the backing store: not its query
 * language, not its connection protocol. Retry and backoff policy belong to
 * the implementation.
 */
public interface GraphProvider {

    /**
     * Returns an immutable snapshot of the process graph.
     *
     * @param processId The process identifier.
     * @return The graph.
     * @throws ProcessNotFoundException if the store holds no such process.
     */
    ProcessGraph fetchGraph(String processId);

    /** Ids of all processes the provider can currently serve. */
    List<String> processIds();
}
