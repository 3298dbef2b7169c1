package sanalysis;

import java.util.Objects;

/**
 * A possible one-step transfer of control between two flow nodes.
 */
public class FlowEdge {
    public final FlowNode from;
    public final FlowNode to;

    public FlowEdge(FlowNode from, FlowNode to) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FlowEdge)) return false;
        FlowEdge other = (FlowEdge) obj;
        return from.getId().equals(other.from.getId()) && to.getId().equals(other.to.getId());
    }

    @Override
    public int hashCode() {
        return Objects.hash(from.getId(), to.getId());
    }

    @Override
    public String toString() {
        return from.getId() + "->" + to.getId();
    }
}
