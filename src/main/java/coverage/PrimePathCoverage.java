package coverage;

import sanalysis.ControlFlowGraph;
import sanalysis.FlowNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Maximal prime path coverage.
 * <p>
 * Paths are enumerated from the sources allowing each node at most two visits, so one loop
 * iteration is represented. A path is finished at a sink or when a node directly repeats
 * itself. The finished paths are then maximalized: starting from the longest remaining path,
 * other finished paths are spliced on at the left and right ends, and every spliced result
 * becomes a target. There is no separate cover step; nodes that lie on no prime path are
 * reported as uncovered.
 */
public class PrimePathCoverage extends AbstractGraphCoverage {

    public PrimePathCoverage() {
        this(PathLimits.defaults());
    }

    public PrimePathCoverage(PathLimits limits) {
        super(limits);
    }

    @Override
    public CoverageCriterion getCriterion() {
        return CoverageCriterion.PRIME_PATH;
    }

    @Override
    public CoverageResult cover(String functionName, ControlFlowGraph graph) {
        PathEnumeration enumeration =
                new PathEnumerator(LoopPolicy.VISIT_COUNT_BELOW_TWO, true, limits).enumerate(graph);
        List<FlowPath> primePaths = maximalize(enumeration.getPaths());
        return result(functionName, graph, primePaths, unvisitedNodes(graph, primePaths), enumeration.isTruncated());
    }

    /**
     * Splices finished paths into maximal ones. A candidate is spliced when it shares the
     * joining node and brings at least one node the current path does not contain yet;
     * spliced candidates are consumed.
     */
    static List<FlowPath> maximalize(List<FlowPath> finishedPaths) {
        List<FlowPath> primePaths = new ArrayList<>();
        List<FlowPath> remaining = new ArrayList<>(finishedPaths);

        while (!remaining.isEmpty()) {
            FlowPath extended = remaining.remove(longestIndex(remaining));

            for (FlowPath candidate : new ArrayList<>(remaining)) {
                if (candidate.last().equals(extended.first()) && !extended.containsAllNodesOf(candidate)) {
                    extended = extended.prependPath(candidate);
                    remaining.remove(candidate);
                }
            }

            for (FlowPath candidate : new ArrayList<>(remaining)) {
                if (candidate.first().equals(extended.last()) && !extended.containsAllNodesOf(candidate)) {
                    extended = extended.appendPath(candidate);
                    remaining.remove(candidate);
                }
            }

            primePaths.add(extended);
        }
        return primePaths;
    }

    private static List<String> unvisitedNodes(ControlFlowGraph graph, List<FlowPath> paths) {
        List<String> unvisited = new ArrayList<>();
        for (FlowNode node : graph.getNodes()) {
            if (paths.stream().noneMatch(path -> path.contains(node))) {
                unvisited.add(node.getId());
            }
        }
        return unvisited;
    }

    private static int longestIndex(List<FlowPath> paths) {
        int best = 0;
        for (int i = 1; i < paths.size(); i++) {
            if (paths.get(i).size() > paths.get(best).size()) {
                best = i;
            }
        }
        return best;
    }
}
