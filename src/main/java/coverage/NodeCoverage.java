package coverage;

import sanalysis.ControlFlowGraph;

/**
 * Selects paths until every flow node is visited. Candidate paths may re-enter a node only
 * over a loop-closing edge.
 */
public class NodeCoverage extends AbstractGraphCoverage {

    public NodeCoverage() {
        this(PathLimits.defaults());
    }

    public NodeCoverage(PathLimits limits) {
        super(limits);
    }

    @Override
    public CoverageCriterion getCriterion() {
        return CoverageCriterion.NODE;
    }

    @Override
    public CoverageResult cover(String functionName, ControlFlowGraph graph) {
        return coverUniverse(functionName, graph, LoopPolicy.NODE_ONCE_UNLESS_BACK_EDGE,
                graph.getNodes(), FlowPath::getNodes);
    }
}
