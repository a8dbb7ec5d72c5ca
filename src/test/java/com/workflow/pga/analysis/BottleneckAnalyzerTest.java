package com.workflow.pga.analysis;

import com.workflow.pga.model.ProcessGraph;
import com.workflow.pga.model.ProcessNode;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class BottleneckAnalyzerTest {

    private final BottleneckAnalyzer analyzer = new BottleneckAnalyzer();

    @Test
    public void testLinearGraphHasNoBottleneck() {
        ProcessGraph g = ProcessGraph.builder("p", "Linear")
                .addNode(ProcessNode.start("Start"))
                .addNode(ProcessNode.task("A"))
                .addNode(ProcessNode.end("End"))
                .addEdge("Start", "A").addEdge("A", "End")
                .build();

        assertTrue(analyzer.analyze(g).isEmpty());
    }

    @Test
    public void testDiamondJoin() {
        List<BottleneckRecord> records = analyzer.analyze(PathEnumeratorTest.diamond());

        assertEquals(List.of(new BottleneckRecord("C", 2)), records);
    }

    @Test
    public void testParallelEdgesCountOnce() {
        ProcessGraph g = ProcessGraph.builder("p", "Parallel")
                .addNode(ProcessNode.start("S"))
                .addNode(ProcessNode.end("E"))
                .addEdge("S", "E").addEdge("S", "E").addEdge("S", "E")
                .build();

        assertTrue(analyzer.analyze(g).isEmpty());
    }

    @Test
    public void testRankingByCountThenId() {
        // J3 has three distinct sources, Jb and Ja two each
        ProcessGraph g = ProcessGraph.builder("p", "Joins")
                .addNode(ProcessNode.task("X"))
                .addNode(ProcessNode.task("Y"))
                .addNode(ProcessNode.task("Z"))
                .addNode(ProcessNode.task("Jb"))
                .addNode(ProcessNode.task("J3"))
                .addNode(ProcessNode.task("Ja"))
                .addEdge("X", "Jb").addEdge("Y", "Jb").addEdge("Y", "Jb")
                .addEdge("X", "J3").addEdge("Y", "J3").addEdge("Z", "J3")
                .addEdge("Z", "Ja").addEdge("X", "Ja")
                .build();

        assertEquals(List.of(
                new BottleneckRecord("J3", 3),
                new BottleneckRecord("Ja", 2),
                new BottleneckRecord("Jb", 2)), analyzer.analyze(g));
    }

    @Test
    public void testLoopBackEdgeCountsAsBranch() {
        // Start -> A -> B -> A: A is entered from Start and from B
        ProcessGraph g = ProcessGraph.builder("p", "Loop")
                .addNode(ProcessNode.start("Start"))
                .addNode(ProcessNode.task("A"))
                .addNode(ProcessNode.task("B"))
                .addEdge("Start", "A").addEdge("A", "B").addEdge("B", "A")
                .build();

        List<BottleneckRecord> records = analyzer.analyze(g);
        assertEquals(1, records.size());
        assertEquals("A", records.get(0).nodeId());
        for (BottleneckRecord r : records)
            assertTrue(r.distinctPredecessorCount() > 1);
    }
}
