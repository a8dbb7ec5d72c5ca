package com.workflow.pga.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.workflow.pga.ProcessAnalysis;
import com.workflow.pga.analysis.BottleneckRecord;
import com.workflow.pga.analysis.CriticalPathResult;
import com.workflow.pga.analysis.PathSet;
import com.workflow.pga.api.GraphValidationException;
import com.workflow.pga.layout.LayoutResult;
import com.workflow.pga.layout.NodePosition;
import com.workflow.pga.model.NodeKind;
import com.workflow.pga.model.ProcessGraph;
import com.workflow.pga.model.ProcessNode;
import com.workflow.pga.model.SequenceEdge;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Converts between {@link ProcessGraph} (plus analysis results) and the
 * {@link ProcessDocument} interchange format.
 * <p>
 * Importing a document rebuilds only the graph. Layout and analysis sections
 * are derived data and are recomputed rather than trusted.
 */
@Log4j2
public final class ProcessDocumentCodec {
    private final ObjectMapper mapper;

    public ProcessDocumentCodec() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ProcessDocumentCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Plain graph export, no analysis sections. */
    public ProcessDocument export(ProcessGraph graph) {
        return export(graph, null, null, null, null);
    }

    /** Graph plus every section of {@code analysis}. */
    public ProcessDocument export(ProcessGraph graph, ProcessAnalysis analysis) {
        return export(graph, analysis.layout(), analysis.paths(), analysis.bottlenecks(), analysis.criticalPath());
    }

    /**
     * Graph plus the given analysis sections; any of them may be {@code null} and
     * is then omitted.
     */
    public ProcessDocument export(ProcessGraph graph, LayoutResult layout, PathSet paths,
            List<BottleneckRecord> bottlenecks, CriticalPathResult criticalPath) {
        ProcessDocument doc = new ProcessDocument();
        doc.setProcess(new ProcessDocument.ProcessInfo(graph.processId(), graph.name()));

        List<ProcessDocument.NodeDef> nodes = new ArrayList<>(graph.nodeCount());
        for (ProcessNode n : graph.nodes())
            nodes.add(new ProcessDocument.NodeDef(n.id(), n.label(), n.kind().label(), n.duration(), n.cost(),
                    n.role()));
        doc.setNodes(nodes);

        List<ProcessDocument.EdgeDef> edges = new ArrayList<>(graph.edgeCount());
        for (SequenceEdge e : graph.edges())
            edges.add(new ProcessDocument.EdgeDef(e.from(), e.to()));
        doc.setEdges(edges);

        if (layout != null) {
            List<ProcessDocument.LayoutDef> defs = new ArrayList<>(layout.size());
            for (NodePosition p : layout.positions())
                defs.add(new ProcessDocument.LayoutDef(p.id(), p.x(), p.y(), p.layer()));
            doc.setLayout(defs);
        }
        if (paths != null)
            doc.setPaths(new ArrayList<>(paths.paths()));
        if (bottlenecks != null) {
            List<ProcessDocument.BottleneckDef> defs = new ArrayList<>(bottlenecks.size());
            for (BottleneckRecord b : bottlenecks)
                defs.add(new ProcessDocument.BottleneckDef(b.nodeId(), b.distinctPredecessorCount()));
            doc.setBottlenecks(defs);
        }
        if (criticalPath != null)
            doc.setCriticalPath(new ProcessDocument.CriticalPathDef(criticalPath.nodes(), criticalPath.weight()));
        return doc;
    }

    public String toJson(ProcessDocument doc) {
        try {
            return mapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize process document", e);
        }
    }

    /**
     * Parses a JSON document.
     *
     * @throws GraphValidationException if the text is not a valid document.
     */
    public ProcessDocument fromJson(String json) {
        try {
            return mapper.readValue(json, ProcessDocument.class);
        } catch (JsonProcessingException e) {
            throw new GraphValidationException("Malformed process document: " + e.getOriginalMessage(), e);
        }
    }

    public ProcessGraph importGraph(String json) {
        return importGraph(fromJson(json));
    }

    /**
     * Rebuilds the graph described by {@code doc}.
     *
     * @throws GraphValidationException listing every problem found.
     */
    public ProcessGraph importGraph(ProcessDocument doc) {
        if (doc == null)
            throw new GraphValidationException("document is empty");
        List<String> problems = new ArrayList<>();
        ProcessDocument.ProcessInfo info = doc.getProcess();
        if (info == null || info.getId() == null || info.getId().isBlank())
            problems.add("document has no process id");
        if (doc.getNodes() == null)
            problems.add("document has no nodes section");
        if (!problems.isEmpty())
            throw new GraphValidationException(problems);

        ProcessGraph.Builder builder = ProcessGraph.builder(info.getId(), info.getName());
        List<ProcessDocument.NodeDef> nodeDefs = doc.getNodes();
        for (int i = 0; i < nodeDefs.size(); i++) {
            ProcessDocument.NodeDef nd = nodeDefs.get(i);
            if (nd == null) {
                problems.add("null node at position " + i);
                continue;
            }
            NodeKind kind;
            try {
                kind = NodeKind.fromString(nd.getKind());
            } catch (GraphValidationException e) {
                problems.add("node " + nd.getId() + ": " + e.problems().get(0));
                continue;
            }
            builder.addNode(new ProcessNode(nd.getId(), nd.getLabel(), kind, nd.getDuration(), nd.getCost(),
                    nd.getRole()));
        }

        List<ProcessDocument.EdgeDef> edgeDefs = doc.getEdges() != null ? doc.getEdges() : List.of();
        for (int i = 0; i < edgeDefs.size(); i++) {
            ProcessDocument.EdgeDef ed = edgeDefs.get(i);
            if (ed == null)
                problems.add("null edge at position " + i);
            else
                builder.addEdge(ed.getFrom(), ed.getTo());
        }
        if (!problems.isEmpty())
            throw new GraphValidationException(problems);

        ProcessGraph graph = builder.build();
        log.debug("Imported {}", graph);
        return graph;
    }
}
