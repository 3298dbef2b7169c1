package coverage;

import org.junit.jupiter.api.Test;
import sanalysis.ControlFlowGraph;
import sanalysis.EdgePair;
import sanalysis.FlowEdge;
import sanalysis.FlowNode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static sanalysis.GraphFixtures.graph;

class FlowPathTest {

    private final ControlFlowGraph cfg = graph(4, new int[]{0, 1}, new int[]{1, 2}, new int[]{2, 1}, new int[]{1, 3});
    private final List<FlowNode> n = cfg.getNodes();

    @Test
    void testEdgesAndPairs() {
        FlowPath path = FlowPath.of(n.get(0), n.get(1), n.get(2), n.get(1));

        assertEquals(List.of(new FlowEdge(n.get(0), n.get(1)), new FlowEdge(n.get(1), n.get(2)),
                new FlowEdge(n.get(2), n.get(1))), path.edges());
        assertEquals(List.of(new EdgePair(n.get(0), n.get(1), n.get(2)), new EdgePair(n.get(1), n.get(2), n.get(1))),
                path.edgePairs());
        assertTrue(path.containsEdge(n.get(2), n.get(1)));
        assertFalse(path.containsEdge(n.get(1), n.get(0)));
        assertEquals(2, path.count(n.get(1)));
    }

    @Test
    void testSplicing() {
        FlowPath middle = FlowPath.of(n.get(1), n.get(2));

        FlowPath joined = middle.prependPath(FlowPath.of(n.get(0), n.get(1)))
                .appendPath(FlowPath.of(n.get(2), n.get(1), n.get(3)));

        assertEquals("n0 -> n1 -> n2 -> n1 -> n3", joined.toString());
        assertEquals("n1 -> n2", middle.toString(), "Paths are immutable");
    }

    @Test
    void testDescribeUsesLabels() {
        assertEquals("n0:node 0 -> n1:node 1", FlowPath.of(n.get(0), n.get(1)).describe());
    }

    @Test
    void testSelfRepeat() {
        assertTrue(FlowPath.of(n.get(0), n.get(1), n.get(1)).endsWithSelfRepeat());
        assertFalse(FlowPath.of(n.get(1), n.get(2), n.get(1)).endsWithSelfRepeat());
        assertFalse(FlowPath.of(n.get(1)).endsWithSelfRepeat());
    }

    @Test
    void testEmptyPathRejected() {
        assertThrows(IllegalArgumentException.class, () -> FlowPath.of(List.of()));
    }
}
