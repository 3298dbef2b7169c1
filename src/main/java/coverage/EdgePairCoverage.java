package coverage;

import sanalysis.ControlFlowGraph;

/**
 * Selects paths until every pair of adjacent edges (a->b->c) is traversed.
 */
public class EdgePairCoverage extends AbstractGraphCoverage {

    public EdgePairCoverage() {
        this(PathLimits.defaults());
    }

    public EdgePairCoverage(PathLimits limits) {
        super(limits);
    }

    @Override
    public CoverageCriterion getCriterion() {
        return CoverageCriterion.EDGE_PAIR;
    }

    @Override
    public CoverageResult cover(String functionName, ControlFlowGraph graph) {
        return coverUniverse(functionName, graph, LoopPolicy.NODE_ONCE_UNLESS_BACK_EDGE,
                graph.getEdgePairs(), FlowPath::edgePairs);
    }
}
