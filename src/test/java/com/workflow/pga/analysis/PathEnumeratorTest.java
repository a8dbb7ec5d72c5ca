package com.workflow.pga.analysis;

import com.workflow.pga.api.UnknownNodeException;
import com.workflow.pga.model.NodeKind;
import com.workflow.pga.model.ProcessGraph;
import com.workflow.pga.model.ProcessNode;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.Assert.*;

public class PathEnumeratorTest {

    private final PathEnumerator enumerator = new PathEnumerator();

    static ProcessGraph diamond() {
        // Start -> A, Start -> B, A -> C, B -> C, C -> End
        return ProcessGraph.builder("diamond", "Diamond")
                .addNode(ProcessNode.start("Start"))
                .addNode(ProcessNode.task("A"))
                .addNode(ProcessNode.task("B"))
                .addNode(ProcessNode.task("C"))
                .addNode(ProcessNode.end("End"))
                .addEdge("Start", "A").addEdge("Start", "B")
                .addEdge("A", "C").addEdge("B", "C").addEdge("C", "End")
                .build();
    }

    @Test
    public void testLinearGraphHasOnePath() {
        ProcessGraph g = ProcessGraph.builder("linear", "Linear")
                .addNode(ProcessNode.start("Start"))
                .addNode(ProcessNode.task("A"))
                .addNode(ProcessNode.task("B"))
                .addNode(ProcessNode.task("C"))
                .addNode(ProcessNode.end("End"))
                .addEdge("Start", "A").addEdge("A", "B").addEdge("B", "C").addEdge("C", "End")
                .build();

        PathSet paths = enumerator.enumerate(g);

        assertEquals(1, paths.size());
        assertEquals(List.of("Start", "A", "B", "C", "End"), paths.paths().get(0));
        assertFalse(paths.isTruncated());
    }

    @Test
    public void testDiamondPathsInDiscoveryOrder() {
        PathSet paths = enumerator.enumerate(diamond());

        assertEquals(2, paths.size());
        assertEquals(List.of("Start", "A", "C", "End"), paths.paths().get(0));
        assertEquals(List.of("Start", "B", "C", "End"), paths.paths().get(1));
        assertEquals(paths.paths().get(0).size(), paths.paths().get(1).size());
    }

    @Test
    public void testFeedbackLoopTerminatesWithSimplePathsOnly() {
        // Start -> A -> B -> A, A -> End
        ProcessGraph g = ProcessGraph.builder("loop", "Loop")
                .addNode(ProcessNode.start("Start"))
                .addNode(ProcessNode.task("A"))
                .addNode(ProcessNode.task("B"))
                .addNode(ProcessNode.end("End"))
                .addEdge("Start", "A").addEdge("A", "B").addEdge("B", "A").addEdge("A", "End")
                .build();

        PathSet paths = enumerator.enumerate(g);

        assertEquals(1, paths.size());
        assertEquals(List.of("Start", "A", "End"), paths.paths().get(0));
        for (List<String> p : paths.paths())
            assertEquals("path revisits a node: " + p, p.size(), new HashSet<>(p).size());
    }

    @Test
    public void testLoopWithoutExitYieldsNoPath() {
        // Start -> A -> B -> A; End unreachable
        ProcessGraph g = ProcessGraph.builder("trap", "Trap")
                .addNode(ProcessNode.start("Start"))
                .addNode(ProcessNode.task("A"))
                .addNode(ProcessNode.task("B"))
                .addNode(ProcessNode.end("End"))
                .addEdge("Start", "A").addEdge("A", "B").addEdge("B", "A")
                .build();

        assertTrue(enumerator.enumerate(g).isEmpty());
    }

    @Test
    public void testStartWithoutOutgoingEdges() {
        ProcessGraph g = ProcessGraph.builder("p", "Isolated start")
                .addNode(ProcessNode.start("S"))
                .addNode(ProcessNode.end("E"))
                .build();

        PathSet paths = enumerator.enumerate(g);
        assertTrue(paths.isEmpty());
        assertFalse(paths.isTruncated());
    }

    @Test
    public void testNoEndNodes() {
        ProcessGraph g = ProcessGraph.builder("p", "Endless")
                .addNode(ProcessNode.start("S"))
                .addNode(ProcessNode.task("A"))
                .addEdge("S", "A")
                .build();

        assertTrue(enumerator.enumerate(g).isEmpty());
    }

    @Test
    public void testParallelEdgesDoNotDuplicatePaths() {
        ProcessGraph g = ProcessGraph.builder("p", "Parallel")
                .addNode(ProcessNode.start("S"))
                .addNode(ProcessNode.task("A"))
                .addNode(ProcessNode.end("E"))
                .addEdge("S", "A").addEdge("S", "A").addEdge("A", "E")
                .build();

        PathSet paths = enumerator.enumerate(g);
        assertEquals(1, paths.size());
        assertEquals(List.of("S", "A", "E"), paths.paths().get(0));
    }

    @Test
    public void testEveryStartEndPairIsSearched() {
        // S1 -> A -> E1, A -> E2, S2 -> E2
        ProcessGraph g = ProcessGraph.builder("p", "Pairs")
                .addNode(ProcessNode.start("S1"))
                .addNode(ProcessNode.start("S2"))
                .addNode(ProcessNode.task("A"))
                .addNode(ProcessNode.end("E1"))
                .addNode(ProcessNode.end("E2"))
                .addEdge("S1", "A").addEdge("A", "E1").addEdge("A", "E2").addEdge("S2", "E2")
                .build();

        PathSet paths = enumerator.enumerate(g);

        assertEquals(List.of(
                List.of("S1", "A", "E1"),
                List.of("S1", "A", "E2"),
                List.of("S2", "E2")), paths.paths());
    }

    @Test
    public void testEnumerateByKindsAndIds() {
        ProcessGraph g = ProcessGraph.builder("p", "Events")
                .addNode(ProcessNode.start("S"))
                .addNode(ProcessNode.of("Timer", NodeKind.EVENT))
                .addNode(ProcessNode.task("A"))
                .addNode(ProcessNode.end("E"))
                .addEdge("S", "Timer").addEdge("Timer", "A").addEdge("A", "E")
                .build();

        assertEquals(List.of(List.of("Timer", "A", "E")),
                enumerator.enumerate(g, NodeKind.EVENT, NodeKind.END).paths());
        assertEquals(List.of(List.of("Timer", "A")), enumerator.enumerate(g, "Timer", "A").paths());
        assertEquals(List.of(List.of("A")), enumerator.enumerate(g, "A", "A").paths());
    }

    @Test(expected = UnknownNodeException.class)
    public void testEnumerateUnknownId() {
        enumerator.enumerate(diamond(), "Start", "Nope");
    }

    @Test
    public void testLengthLimitKeepsPartialResults() {
        // S -> E directly, and S -> A -> B -> C -> E
        ProcessGraph g = ProcessGraph.builder("p", "Long and short")
                .addNode(ProcessNode.start("S"))
                .addNode(ProcessNode.task("A"))
                .addNode(ProcessNode.task("B"))
                .addNode(ProcessNode.task("C"))
                .addNode(ProcessNode.end("E"))
                .addEdge("S", "E")
                .addEdge("S", "A").addEdge("A", "B").addEdge("B", "C").addEdge("C", "E")
                .build();

        PathSet paths = new PathEnumerator(3, 0).enumerate(g);

        assertEquals(List.of(List.of("S", "E")), paths.paths());
        assertTrue(paths.isTruncated());
        PathLimitExceeded signal = paths.limitSignals().get(0);
        assertEquals("S", signal.startId());
        assertEquals("E", signal.endId());
        assertEquals(PathLimitExceeded.Reason.PATH_LENGTH, signal.reason());
        assertEquals(3, signal.limit());
    }

    @Test
    public void testCountLimitKeepsPartialResults() {
        ProcessGraph g = ProcessGraph.builder("p", "Fan")
                .addNode(ProcessNode.start("S"))
                .addNode(ProcessNode.task("A"))
                .addNode(ProcessNode.task("B"))
                .addNode(ProcessNode.task("C"))
                .addNode(ProcessNode.end("E"))
                .addEdge("S", "A").addEdge("S", "B").addEdge("S", "C")
                .addEdge("A", "E").addEdge("B", "E").addEdge("C", "E")
                .build();

        PathSet paths = new PathEnumerator(0, 2).enumerate(g);

        assertEquals(2, paths.size());
        assertEquals(List.of("S", "A", "E"), paths.paths().get(0));
        assertEquals(PathLimitExceeded.Reason.PATH_COUNT, paths.limitSignals().get(0).reason());

        // Exactly at the bound is not exceeding it
        PathSet exact = new PathEnumerator(0, 3).enumerate(g);
        assertEquals(3, exact.size());
        assertFalse(exact.isTruncated());
    }

    @Test
    public void testDefaultLengthBoundIsTwiceNodeCount() {
        assertEquals(10, enumerator.maxPathLength(diamond()));
        assertEquals(4, new PathEnumerator(4, 0).maxPathLength(diamond()));
    }

    @Test
    public void testAllPathsAreSimpleOnCyclicGraph() {
        ProcessGraph g = ProcessGraph.builder("p", "Tangle")
                .addNode(ProcessNode.start("S"))
                .addNode(ProcessNode.task("A"))
                .addNode(ProcessNode.task("B"))
                .addNode(ProcessNode.task("C"))
                .addNode(ProcessNode.end("E"))
                .addEdge("S", "A").addEdge("S", "B")
                .addEdge("A", "B").addEdge("B", "A")
                .addEdge("A", "C").addEdge("B", "C").addEdge("C", "A")
                .addEdge("C", "E").addEdge("B", "E")
                .build();

        PathSet paths = enumerator.enumerate(g);

        assertFalse(paths.isEmpty());
        for (List<String> p : paths.paths()) {
            assertEquals("path revisits a node: " + p, p.size(), new HashSet<>(p).size());
            assertEquals(NodeKind.START, g.node(p.get(0)).kind());
            assertEquals(NodeKind.END, g.node(p.get(p.size() - 1)).kind());
        }
        assertEquals(paths.size(), new HashSet<>(paths.paths()).size());
    }

    @Test
    public void testPathSetHelpers() {
        PathSet paths = enumerator.enumerate(diamond());

        assertEquals(1, paths.containing("A").size());
        assertEquals(2, paths.containing("C").size());
        assertEquals(List.of("Start", "A", "C", "End"), paths.longest().orElseThrow());
        assertEquals(List.of("Start", "A", "C", "End"), paths.shortest().orElseThrow());
        assertFalse(PathSet.empty().longest().isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeLimitRejected() {
        new PathEnumerator(-1, 0);
    }
}
