package sanalysis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlFlowGraphTest {

    private ControlFlowGraph graph;
    private FlowNode a;
    private FlowNode b;
    private FlowNode c;

    @BeforeEach
    void setUp() {
        graph = new ControlFlowGraph();
        a = graph.createNode("a = 1", null, null);
        b = graph.createNode("if a", null, null);
        c = graph.createNode("return a", null, null);
    }

    @Test
    void testNodeIdsFollowInsertionOrder() {
        assertEquals(List.of("n0", "n1", "n2"), List.of(a.getId(), b.getId(), c.getId()));
        assertEquals(1, graph.indexOf(b));
    }

    @Test
    void testAddEdgeIsIdempotent() {
        graph.addEdge(a, b);
        graph.addEdge(a, b);
        graph.addEdge(b, c);

        assertEquals(2, graph.getEdges().size());
        assertEquals(List.of(b), graph.getSuccessors(a));
        assertEquals(List.of(a), graph.getPredecessors(b));
    }

    @Test
    void testSuccessorsInEdgeInsertionOrder() {
        graph.addEdge(b, c);
        graph.addEdge(b, a);

        assertEquals(List.of(c, a), graph.getSuccessors(b));
    }

    @Test
    void testUnknownNodeHasNoNeighbours() {
        FlowNode stranger = new FlowNode(42, "stranger", null, null);

        assertTrue(graph.getSuccessors(stranger).isEmpty());
        assertTrue(graph.getPredecessors(stranger).isEmpty());
        assertEquals(-1, graph.indexOf(stranger));
    }

    @Test
    void testSourcesAndSinksByDegree() {
        graph.addEdge(a, b);
        graph.addEdge(b, c);

        assertEquals(List.of(a), graph.getSources());
        assertEquals(List.of(c), graph.getSinks());
    }

    @Test
    void testNodesWithSameLabelAreDistinct() {
        FlowNode first = graph.createNode("x = 1", null, null);
        FlowNode second = graph.createNode("x = 1", null, null);

        assertNotEquals(first, second);
        assertEquals(5, graph.getNodes().size());
    }

    @Test
    void testEdgePairs() {
        graph.addEdge(a, b);
        graph.addEdge(b, c);
        graph.addEdge(b, a);

        assertEquals(3, graph.getEdgePairs().size());
        assertTrue(graph.getEdgePairs().contains(new EdgePair(a, b, c)));
        assertTrue(graph.getEdgePairs().contains(new EdgePair(a, b, a)));
        assertTrue(graph.getEdgePairs().contains(new EdgePair(b, a, b)));
    }

    @Test
    void testLoopClosingEdgeIsTagged() {
        graph.addEdge(a, b);
        graph.addLoopClosingEdge(c, a);

        assertTrue(graph.hasEdge(c, a));
        assertTrue(graph.isLoopClosingEdge(c, a));
        assertFalse(graph.isLoopClosingEdge(a, b));
    }

    @Test
    void testFrozenGraphRejectsMutation() {
        graph.freeze();

        assertTrue(graph.isFrozen());
        assertThrows(IllegalStateException.class, () -> graph.addEdge(a, c));
        assertThrows(IllegalStateException.class, () -> graph.createNode("late", null, null));
    }

    @Test
    void testDotExport() {
        graph.addEdge(a, b);
        graph.addLoopClosingEdge(c, a);

        String dot = graph.toDot();

        assertTrue(dot.startsWith("digraph CFG {"));
        assertTrue(dot.contains("\"n0\" [label=\"n0: a = 1\"];"));
        assertTrue(dot.contains("\"n0\" -> \"n1\";"));
        assertTrue(dot.contains("\"n2\" -> \"n0\" [style=dashed];"));
    }

    @Test
    void testFindNode() {
        assertEquals(b, graph.findNode("n1").orElse(null));
        assertFalse(graph.findNode("n9").isPresent());
    }
}
