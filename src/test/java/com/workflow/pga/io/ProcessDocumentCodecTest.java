package com.workflow.pga.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflow.pga.ProcessAnalysis;
import com.workflow.pga.ProcessAnalysisEngine;
import com.workflow.pga.api.GraphValidationException;
import com.workflow.pga.model.NodeKind;
import com.workflow.pga.model.ProcessGraph;
import com.workflow.pga.model.ProcessNode;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ProcessDocumentCodecTest {

    private final ProcessDocumentCodec codec = new ProcessDocumentCodec();

    private static final String DOC = """
            {
              "process": { "id": "claims", "name": "Claims handling" },
              "nodes": [
                { "id": "s", "label": "Claim filed", "kind": "Start" },
                { "id": "t", "label": "Assess", "kind": "Task", "duration": 45.0, "cost": 80.0, "role": "Assessor" },
                { "id": "g", "label": "Approved?", "kind": "Gateway" },
                { "id": "e", "label": "Done", "kind": "End" }
              ],
              "edges": [
                { "from": "s", "to": "t" },
                { "from": "t", "to": "g" },
                { "from": "g", "to": "t" },
                { "from": "g", "to": "e" },
                { "from": "g", "to": "e" }
              ]
            }
            """;

    private static ProcessGraph sample() {
        return ProcessGraph.builder("loan", "Loan")
                .addNode(ProcessNode.start("start").withLabel("Received"))
                .addNode(ProcessNode.task("review").withDuration(20.0).withCost(12.5).withRole("Clerk"))
                .addNode(new ProcessNode("split", "Split", NodeKind.GATEWAY, null, null, null))
                .addNode(ProcessNode.task("a").withDuration(5.0))
                .addNode(ProcessNode.task("b").withDuration(7.0))
                .addNode(ProcessNode.of("join", NodeKind.EVENT))
                .addNode(ProcessNode.end("end"))
                .addEdge("start", "review").addEdge("review", "split")
                .addEdge("split", "a").addEdge("split", "b")
                .addEdge("a", "join").addEdge("b", "join").addEdge("b", "join")
                .addEdge("join", "end")
                .build();
    }

    @Test
    public void testGraphRoundTrip() {
        ProcessGraph original = sample();

        ProcessGraph restored = codec.importGraph(codec.toJson(codec.export(original)));

        assertEquals(original.processId(), restored.processId());
        assertEquals(original.name(), restored.name());
        assertEquals(original.nodes(), restored.nodes());
        assertEquals(original.edges(), restored.edges());
    }

    @Test
    public void testDocumentRoundTrip() {
        ProcessDocument doc = codec.fromJson(DOC);

        ProcessDocument again = codec.export(codec.importGraph(doc));

        assertEquals(doc, again);
    }

    @Test
    public void testImportedAttributes() {
        ProcessGraph g = codec.importGraph(DOC);

        ProcessNode t = g.node("t");
        assertEquals(NodeKind.TASK, t.kind());
        assertEquals(Double.valueOf(45.0), t.duration());
        assertEquals(Double.valueOf(80.0), t.cost());
        assertEquals("Assessor", t.role());
        assertNull(g.node("s").duration());
        assertEquals(List.of("t", "e", "e"), g.successors("g"));
    }

    @Test
    public void testPlainExportOmitsOptionalSections() throws Exception {
        JsonNode json = new ObjectMapper().readTree(codec.toJson(codec.export(sample())));

        assertTrue(json.has("process"));
        assertTrue(json.has("nodes"));
        assertTrue(json.has("edges"));
        assertFalse(json.has("layout"));
        assertFalse(json.has("paths"));
        assertFalse(json.has("bottlenecks"));
        assertFalse(json.has("criticalPath"));
        assertFalse(json.get("nodes").get(0).has("duration"));
        assertEquals("Start", json.get("nodes").get(0).get("kind").asText());
    }

    @Test
    public void testFullExportCarriesAnalysis() throws Exception {
        ProcessGraph g = sample();
        ProcessAnalysis analysis = new ProcessAnalysisEngine().analyze(g);

        JsonNode json = new ObjectMapper().readTree(codec.toJson(codec.export(g, analysis)));

        assertEquals(g.nodeCount(), json.get("layout").size());
        assertEquals(2, json.get("paths").size());
        assertEquals("join", json.get("bottlenecks").get(0).get("id").asText());
        assertEquals(2, json.get("bottlenecks").get(0).get("distinctPredecessorCount").asInt());
        assertEquals(27.0, json.get("criticalPath").get("weight").asDouble(), 1e-9);
        assertEquals("b", json.get("criticalPath").get("nodes").get(3).asText());

        // Importing ignores derived sections
        ProcessGraph restored = codec.importGraph(codec.toJson(codec.export(g, analysis)));
        assertEquals(g.edges(), restored.edges());
    }

    @Test
    public void testUnknownPropertiesAreIgnored() {
        ProcessGraph g = codec.importGraph("""
                { "process": { "id": "p", "name": "P", "owner": "ops" },
                  "nodes": [ { "id": "a", "kind": "start", "colour": "green" } ],
                  "version": 3 }
                """);

        assertEquals(1, g.nodeCount());
        assertEquals("a", g.node("a").label());
        assertEquals(0, g.edgeCount());
    }

    @Test(expected = GraphValidationException.class)
    public void testMalformedJson() {
        codec.fromJson("{ \"process\": ");
    }

    @Test
    public void testUnknownKindsAreAllReported() {
        try {
            codec.importGraph("""
                    { "process": { "id": "p" },
                      "nodes": [ { "id": "a", "kind": "Decision" }, { "id": "b", "kind": "Lane" } ] }
                    """);
            fail("expected GraphValidationException");
        } catch (GraphValidationException e) {
            assertEquals(2, e.problems().size());
        }
    }

    @Test(expected = GraphValidationException.class)
    public void testMissingProcessId() {
        codec.importGraph("{ \"nodes\": [] }");
    }

    @Test(expected = GraphValidationException.class)
    public void testEdgeToUnknownNode() {
        codec.importGraph("""
                { "process": { "id": "p" },
                  "nodes": [ { "id": "a", "kind": "Start" } ],
                  "edges": [ { "from": "a", "to": "zzz" } ] }
                """);
    }

    @Test
    public void testNullNodeEntryIsReported() {
        try {
            codec.importGraph("""
                    { "process": { "id": "p" },
                      "nodes": [ { "id": "a", "kind": "Start" }, null ] }
                    """);
            fail("expected GraphValidationException");
        } catch (GraphValidationException e) {
            assertEquals(List.of("null node at position 1"), e.problems());
        }
    }

    @Test
    public void testNullEdgeEntryIsReported() {
        try {
            codec.importGraph("""
                    { "process": { "id": "p" },
                      "nodes": [ { "id": "a", "kind": "Start" }, { "id": "b", "kind": "End" } ],
                      "edges": [ { "from": "a", "to": "b" }, null ] }
                    """);
            fail("expected GraphValidationException");
        } catch (GraphValidationException e) {
            assertEquals(List.of("null edge at position 1"), e.problems());
        }
    }

    @Test
    public void testNullDocumentIsRejected() {
        try {
            codec.importGraph("null");
            fail("expected GraphValidationException");
        } catch (GraphValidationException e) {
            assertEquals(List.of("document is empty"), e.problems());
        }
    }
}
