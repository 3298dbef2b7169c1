package coverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sanalysis.ControlFlowGraph;
import sanalysis.FlowNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Breadth-first enumeration of paths from every source node of a graph.
 * <p>
 * A path is finished when its last node is a sink or, if requested, when its last node repeats
 * the one before it. A path none of whose successors is allowed by the {@link LoopPolicy} is
 * dropped.
 */
public class PathEnumerator {
    private static final Logger logger = LoggerFactory.getLogger(PathEnumerator.class);

    private final LoopPolicy policy;
    private final boolean finishOnSelfRepeat;
    private final PathLimits limits;

    public PathEnumerator(LoopPolicy policy) {
        this(policy, false, PathLimits.defaults());
    }

    public PathEnumerator(LoopPolicy policy, boolean finishOnSelfRepeat, PathLimits limits) {
        if (policy == null || limits == null) {
            throw new IllegalArgumentException("Loop policy and limits are required");
        }
        this.policy = policy;
        this.finishOnSelfRepeat = finishOnSelfRepeat;
        this.limits = limits;
    }

    public PathEnumeration enumerate(ControlFlowGraph graph) {
        List<FlowPath> finished = new ArrayList<>();
        Deque<FlowPath> queue = new ArrayDeque<>();
        for (FlowNode source : graph.getSources()) {
            queue.add(FlowPath.of(source));
        }

        int expansions = 0;
        boolean truncated = false;
        while (!queue.isEmpty()) {
            if (expansions >= limits.getMaxExpansions()) {
                truncated = true;
                break;
            }
            expansions++;

            FlowPath path = queue.removeFirst();
            List<FlowNode> successors = graph.getSuccessors(path.last());

            if (successors.isEmpty() || (finishOnSelfRepeat && path.endsWithSelfRepeat())) {
                finished.add(path);
                if (finished.size() >= limits.getMaxPaths() && !queue.isEmpty()) {
                    truncated = true;
                    break;
                }
                continue;
            }
            for (FlowNode successor : successors) {
                if (policy.allows(graph, path, successor)) {
                    queue.add(path.append(successor));
                }
            }
        }

        if (truncated) {
            logger.warn("Path enumeration ({}) stopped at {} after {} expansions, {} paths kept",
                    policy, limits, expansions, finished.size());
        } else {
            logger.debug("Path enumeration ({}) produced {} paths in {} expansions",
                    policy, finished.size(), expansions);
        }
        return new PathEnumeration(finished, truncated);
    }
}
