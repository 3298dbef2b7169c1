package coverage;

import generation.CoverageTarget;
import sanalysis.ControlFlowGraph;

import java.util.List;

/**
 * Outcome of one coverage generation call.
 * <p>
 * A result is partial when some universe elements could not be covered by any enumerated path
 * ({@link #getUncovered()}) or when path enumeration was cut off by its limits
 * ({@link #isTruncated()}). {@link #isComplete()} is true only when neither happened.
 */
public class CoverageResult {
    private final CoverageCriterion criterion;
    private final String functionName;
    private final ControlFlowGraph graph;
    private final List<FlowPath> selectedPaths;
    private final List<CoverageTarget> targets;
    private final List<String> uncovered;
    private final boolean truncated;

    public CoverageResult(CoverageCriterion criterion, String functionName, ControlFlowGraph graph,
                          List<FlowPath> selectedPaths, List<CoverageTarget> targets,
                          List<String> uncovered, boolean truncated) {
        this.criterion = criterion;
        this.functionName = functionName;
        this.graph = graph;
        this.selectedPaths = List.copyOf(selectedPaths);
        this.targets = List.copyOf(targets);
        this.uncovered = List.copyOf(uncovered);
        this.truncated = truncated;
    }

    public CoverageCriterion getCriterion() { return criterion; }

    public String getFunctionName() { return functionName; }

    /**
     * @return the analysed graph, null for criteria that do not build one
     */
    public ControlFlowGraph getGraph() { return graph; }

    public List<FlowPath> getSelectedPaths() { return selectedPaths; }

    public List<CoverageTarget> getTargets() { return targets; }

    /**
     * @return the universe elements left uncovered, rendered as node ids, {@code a->b} edges or
     * {@code a->b->c} edge pairs
     */
    public List<String> getUncovered() { return uncovered; }

    public boolean isTruncated() { return truncated; }

    public boolean isComplete() {
        return uncovered.isEmpty() && !truncated;
    }
}
