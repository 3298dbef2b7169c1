package sanalysis;

import tree.SourceStatement;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A vertex of the control flow graph: one statement, one statement header, or a merged
 * run of straight-line statements. Identity is the index inside the owning graph.
 */
public class FlowNode {
    private final int index;
    private final String label;
    private final SourceStatement origin;
    private final SortedSet<Integer> lines;

    FlowNode(int index, String label, SourceStatement origin, SortedSet<Integer> lines) {
        this.index = index;
        this.label = label == null ? "" : label.replace("\n", " ").trim();
        this.origin = origin;
        this.lines = lines == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(lines));
    }

    public int getIndex() { return index; }

    public String getId() { return "n" + index; }

    public String getLabel() { return label; }

    /**
     * Statement the node was created for. Only meant for labels and debugging.
     */
    public SourceStatement getOrigin() { return origin; }

    public SortedSet<Integer> getLines() { return lines; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FlowNode)) return false;
        return index == ((FlowNode) obj).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public String toString() { return getId(); }
}
