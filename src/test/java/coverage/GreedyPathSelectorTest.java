package coverage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sanalysis.ControlFlowGraph;
import sanalysis.FlowNode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static sanalysis.GraphFixtures.graph;

class GreedyPathSelectorTest {

    private ControlFlowGraph cfg;
    private List<FlowNode> n;
    private GreedyPathSelector<FlowNode> selector;

    @BeforeEach
    void setUp() {
        // diamond 0 -> {1, 2} -> 3 plus an isolated node 4
        cfg = graph(5, new int[]{0, 1}, new int[]{0, 2}, new int[]{1, 3}, new int[]{2, 3});
        n = cfg.getNodes();
        selector = new GreedyPathSelector<>(FlowPath::getNodes);
    }

    @Test
    void testCoversUniverse() {
        FlowPath left = FlowPath.of(n.get(0), n.get(1), n.get(3));
        FlowPath right = FlowPath.of(n.get(0), n.get(2), n.get(3));

        Selection<FlowNode> selection = selector.select(n.subList(0, 4), List.of(left, right));

        assertEquals(List.of(left, right), selection.getSelected());
        assertTrue(selection.isComplete());
    }

    @Test
    void testPicksLargestGainFirst() {
        FlowPath shortPath = FlowPath.of(n.get(1), n.get(3));
        FlowPath longPath = FlowPath.of(n.get(0), n.get(1), n.get(3));
        FlowPath other = FlowPath.of(n.get(0), n.get(2), n.get(3));

        Selection<FlowNode> selection = selector.select(n.subList(0, 4), List.of(shortPath, longPath, other));

        assertEquals(List.of(longPath, other), selection.getSelected());
    }

    @Test
    void testTiesGoToFirstCandidate() {
        FlowPath left = FlowPath.of(n.get(0), n.get(1), n.get(3));
        FlowPath right = FlowPath.of(n.get(0), n.get(2), n.get(3));

        Selection<FlowNode> selection = selector.select(List.of(n.get(0), n.get(3)), List.of(right, left));

        assertEquals(List.of(right), selection.getSelected());
    }

    @Test
    void testReportsUnreachableElements() {
        FlowPath left = FlowPath.of(n.get(0), n.get(1), n.get(3));
        FlowPath right = FlowPath.of(n.get(0), n.get(2), n.get(3));

        Selection<FlowNode> selection = selector.select(n, List.of(left, right, left));

        assertFalse(selection.isComplete());
        assertEquals(1, selection.getUncovered().size());
        assertTrue(selection.getUncovered().contains(n.get(4)));
        assertEquals(2, selection.getSelected().size(), "Paths adding nothing must not be selected");
    }

    @Test
    void testEmptyUniverseSelectsNothing() {
        Selection<FlowNode> selection = selector.select(List.of(), List.of(FlowPath.of(n.get(4))));

        assertTrue(selection.getSelected().isEmpty());
        assertTrue(selection.isComplete());
    }
}
