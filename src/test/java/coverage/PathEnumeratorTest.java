package coverage;

import org.junit.jupiter.api.Test;
import sanalysis.ControlFlowGraph;
import sanalysis.ControlFlowGraphBuilder;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static sanalysis.GraphFixtures.graph;
import static tree.TreeFixtures.*;

class PathEnumeratorTest {

    private static ControlFlowGraph whileLoopGraph() {
        return new ControlFlowGraphBuilder().build(function("count",
                simple("i = 0", 1),
                whileLoop("i < 3", 2, simple("print(i)", 3), simple("i += 1", 4)),
                ret("return i", 5)));
    }

    private static List<String> ids(PathEnumeration enumeration) {
        return enumeration.getPaths().stream().map(FlowPath::toString).collect(Collectors.toList());
    }

    @Test
    void testBranchesEndAtSinks() {
        ControlFlowGraph cfg = graph(3, new int[]{0, 1}, new int[]{0, 2});

        PathEnumeration enumeration = new PathEnumerator(LoopPolicy.EDGE_ONCE).enumerate(cfg);

        assertEquals(List.of("n0 -> n1", "n0 -> n2"), ids(enumeration));
        assertFalse(enumeration.isTruncated());
    }

    @Test
    void testBackEdgeTakenOnceUnderNodePolicy() {
        PathEnumeration enumeration =
                new PathEnumerator(LoopPolicy.NODE_ONCE_UNLESS_BACK_EDGE).enumerate(whileLoopGraph());

        assertEquals(List.of("n0 -> n1 -> n3", "n0 -> n1 -> n2 -> n1 -> n3"), ids(enumeration));
    }

    @Test
    void testEdgeOncePolicyTerminatesOnLoop() {
        PathEnumeration enumeration = new PathEnumerator(LoopPolicy.EDGE_ONCE).enumerate(whileLoopGraph());

        assertEquals(List.of("n0 -> n1 -> n3", "n0 -> n1 -> n2 -> n1 -> n3"), ids(enumeration));
    }

    @Test
    void testVisitCountPolicyDropsDeadEnds() {
        PathEnumeration enumeration =
                new PathEnumerator(LoopPolicy.VISIT_COUNT_BELOW_TWO).enumerate(whileLoopGraph());

        assertEquals(List.of("n0 -> n1 -> n3", "n0 -> n1 -> n2 -> n1 -> n3"), ids(enumeration));
    }

    @Test
    void testSelfRepeatFinishesPath() {
        ControlFlowGraph cfg = graph(3, new int[]{0, 1}, new int[]{1, 1}, new int[]{1, 2});

        PathEnumeration finishing =
                new PathEnumerator(LoopPolicy.VISIT_COUNT_BELOW_TWO, true, PathLimits.defaults()).enumerate(cfg);
        PathEnumeration continuing =
                new PathEnumerator(LoopPolicy.VISIT_COUNT_BELOW_TWO, false, PathLimits.defaults()).enumerate(cfg);

        assertEquals(List.of("n0 -> n1 -> n1", "n0 -> n1 -> n2"), ids(finishing));
        assertEquals(List.of("n0 -> n1 -> n2", "n0 -> n1 -> n1 -> n2"), ids(continuing));
    }

    @Test
    void testPathCeilingTruncates() {
        ControlFlowGraph cfg = graph(3, new int[]{0, 1}, new int[]{0, 2});

        PathEnumeration enumeration =
                new PathEnumerator(LoopPolicy.EDGE_ONCE, false, new PathLimits(1, 100)).enumerate(cfg);

        assertTrue(enumeration.isTruncated());
        assertEquals(List.of("n0 -> n1"), ids(enumeration));
    }

    @Test
    void testExpansionCeilingTruncates() {
        ControlFlowGraph cfg = graph(3, new int[]{0, 1}, new int[]{0, 2});

        PathEnumeration enumeration =
                new PathEnumerator(LoopPolicy.EDGE_ONCE, false, new PathLimits(100, 2)).enumerate(cfg);

        assertTrue(enumeration.isTruncated());
        assertEquals(1, enumeration.getPaths().size());
    }

    @Test
    void testReachingCeilingWithNothingLeftIsNotTruncation() {
        PathEnumeration enumeration =
                new PathEnumerator(LoopPolicy.EDGE_ONCE, false, new PathLimits(1, 100)).enumerate(graph(1));

        assertFalse(enumeration.isTruncated());
        assertEquals(List.of("n0"), ids(enumeration));
    }

    @Test
    void testGraphWithoutSourcesYieldsNothing() {
        ControlFlowGraph cycle = graph(2, new int[]{0, 1}, new int[]{1, 0});

        assertTrue(new PathEnumerator(LoopPolicy.EDGE_ONCE).enumerate(cycle).getPaths().isEmpty());
        assertTrue(new PathEnumerator(LoopPolicy.EDGE_ONCE).enumerate(graph(0)).getPaths().isEmpty());
    }

    @Test
    void testRejectsInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> new PathLimits(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new PathEnumerator(null));
    }
}
