package sanalysis;

import java.util.Objects;

/**
 * Two edges sharing their middle node: {@code first -> middle -> last}.
 */
public class EdgePair {
    public final FlowNode first;
    public final FlowNode middle;
    public final FlowNode last;

    public EdgePair(FlowNode first, FlowNode middle, FlowNode last) {
        this.first = Objects.requireNonNull(first, "first");
        this.middle = Objects.requireNonNull(middle, "middle");
        this.last = Objects.requireNonNull(last, "last");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EdgePair)) return false;
        EdgePair other = (EdgePair) obj;
        return first.equals(other.first) && middle.equals(other.middle) && last.equals(other.last);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, middle, last);
    }

    @Override
    public String toString() {
        return first.getId() + "->" + middle.getId() + "->" + last.getId();
    }
}
