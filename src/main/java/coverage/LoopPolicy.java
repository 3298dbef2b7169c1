package coverage;

import sanalysis.ControlFlowGraph;
import sanalysis.FlowNode;

/**
 * Decides whether a path may be extended to a successor. Each policy bounds how often a path
 * can go around a cycle, which is what makes path enumeration terminate.
 */
public enum LoopPolicy {

    /**
     * A directed edge may be traversed at most once per path.
     */
    EDGE_ONCE {
        @Override
        public boolean allows(ControlFlowGraph graph, FlowPath path, FlowNode successor) {
            return !path.containsEdge(path.last(), successor);
        }
    },

    /**
     * A node may appear once per path, except when it is reached over a loop-closing edge.
     */
    NODE_ONCE_UNLESS_BACK_EDGE {
        @Override
        public boolean allows(ControlFlowGraph graph, FlowPath path, FlowNode successor) {
            return !path.contains(successor) || graph.isLoopClosingEdge(path.last(), successor);
        }
    },

    /**
     * A node may appear at most twice per path, i.e. one full loop iteration.
     */
    VISIT_COUNT_BELOW_TWO {
        @Override
        public boolean allows(ControlFlowGraph graph, FlowPath path, FlowNode successor) {
            return path.count(successor) < 2;
        }
    };

    public abstract boolean allows(ControlFlowGraph graph, FlowPath path, FlowNode successor);
}
