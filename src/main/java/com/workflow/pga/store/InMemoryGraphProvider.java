package com.workflow.pga.store;

import com.workflow.pga.api.GraphProvider;
import com.workflow.pga.api.ProcessNotFoundException;
import com.workflow.pga.model.ProcessGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.log4j.Log4j2;

/**
 * {@link GraphProvider} backed by a concurrent map. Graphs are immutable, so
 * handing out the stored instance is safe.
 */
@Log4j2
public class InMemoryGraphProvider implements GraphProvider {
    private final Map<String, ProcessGraph> graphs = new ConcurrentHashMap<>();

    /** Stores {@code graph} under its process id, replacing any previous version. */
    public InMemoryGraphProvider register(ProcessGraph graph) {
        if (graphs.put(graph.processId(), graph) != null)
            log.info("Replaced process {}", graph.processId());
        return this;
    }

    public boolean remove(String processId) {
        return graphs.remove(processId) != null;
    }

    @Override
    public ProcessGraph fetchGraph(String processId) {
        ProcessGraph g = graphs.get(processId);
        if (g == null)
            throw new ProcessNotFoundException(processId);
        return g;
    }

    @Override
    public List<String> processIds() {
        List<String> ids = new ArrayList<>(graphs.keySet());
        Collections.sort(ids);
        return ids;
    }
}
