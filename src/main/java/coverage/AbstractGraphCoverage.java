package coverage;

import generation.CoverageTarget;
import generation.TestCaseProjector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sanalysis.ControlFlowGraph;
import sanalysis.ControlFlowGraphBuilder;
import tree.FunctionDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Shared pipeline of the graph based criteria: build the graph, enumerate candidate paths,
 * select paths and project them to coverage targets.
 */
public abstract class AbstractGraphCoverage extends CoverageGenerator {
    private static final Logger logger = LoggerFactory.getLogger(AbstractGraphCoverage.class);

    private final ControlFlowGraphBuilder builder = new ControlFlowGraphBuilder();
    private final TestCaseProjector projector = new TestCaseProjector();
    protected final PathLimits limits;

    protected AbstractGraphCoverage(PathLimits limits) {
        this.limits = limits == null ? PathLimits.defaults() : limits;
    }

    @Override
    public CoverageResult generate(FunctionDefinition function) {
        ControlFlowGraph graph = builder.build(function);
        if (!graph.isEmpty() && graph.getSources().isEmpty()) {
            logger.warn("CFG for {} has no source node (body starts with a loop), no paths can be enumerated",
                    function.getName());
        }
        CoverageResult result = cover(function.getName(), graph);
        if (result.isComplete()) {
            logger.info("{} for {}: {} targets", getName(), function.getName(), result.getTargets().size());
        } else {
            logger.warn("{} for {} is partial: {} targets, uncovered {}, truncated {}", getName(),
                    function.getName(), result.getTargets().size(), result.getUncovered(), result.isTruncated());
        }
        return result;
    }

    /**
     * Runs the criterion on an already built graph.
     */
    public abstract CoverageResult cover(String functionName, ControlFlowGraph graph);

    /**
     * Enumerates candidates with {@code policy} and greedily covers {@code universe}.
     */
    protected <T> CoverageResult coverUniverse(String functionName, ControlFlowGraph graph, LoopPolicy policy,
                                               Collection<T> universe,
                                               Function<FlowPath, ? extends Collection<T>> coveredBy) {
        PathEnumeration enumeration = new PathEnumerator(policy, false, limits).enumerate(graph);
        Selection<T> selection = new GreedyPathSelector<T>(coveredBy).select(universe, enumeration.getPaths());

        List<String> uncovered = new ArrayList<>();
        for (T element : selection.getUncovered()) {
            uncovered.add(String.valueOf(element));
        }
        return result(functionName, graph, selection.getSelected(), uncovered, enumeration.isTruncated());
    }

    protected CoverageResult result(String functionName, ControlFlowGraph graph, List<FlowPath> paths,
                                    List<String> uncovered, boolean truncated) {
        List<CoverageTarget> targets = projector.project(getCriterion(), functionName, graph, paths);
        return new CoverageResult(getCriterion(), functionName, graph, paths, targets, uncovered, truncated);
    }
}
