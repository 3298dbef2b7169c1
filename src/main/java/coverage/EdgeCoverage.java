package coverage;

import sanalysis.ControlFlowGraph;

/**
 * Selects paths until every edge is traversed. Candidate paths use each edge at most once,
 * which still lets a loop-closing edge appear.
 */
public class EdgeCoverage extends AbstractGraphCoverage {

    public EdgeCoverage() {
        this(PathLimits.defaults());
    }

    public EdgeCoverage(PathLimits limits) {
        super(limits);
    }

    @Override
    public CoverageCriterion getCriterion() {
        return CoverageCriterion.EDGE;
    }

    @Override
    public CoverageResult cover(String functionName, ControlFlowGraph graph) {
        return coverUniverse(functionName, graph, LoopPolicy.EDGE_ONCE, graph.getEdges(), FlowPath::edges);
    }
}
