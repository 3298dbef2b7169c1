package coverage;

import sanalysis.EdgePair;
import sanalysis.FlowEdge;
import sanalysis.FlowNode;

import java.util.*;
import java.util.stream.Collectors;

/**
 * An execution path through a control flow graph: a non-empty node sequence in which every
 * consecutive pair is an edge. Paths are immutable values.
 */
public final class FlowPath {
    private final List<FlowNode> nodes;

    private FlowPath(List<FlowNode> nodes) {
        this.nodes = nodes;
    }

    public static FlowPath of(FlowNode... nodes) {
        return of(Arrays.asList(nodes));
    }

    public static FlowPath of(List<FlowNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("A path needs at least one node");
        }
        return new FlowPath(List.copyOf(nodes));
    }

    public FlowPath append(FlowNode node) {
        List<FlowNode> extended = new ArrayList<>(nodes.size() + 1);
        extended.addAll(nodes);
        extended.add(node);
        return new FlowPath(Collections.unmodifiableList(extended));
    }

    /**
     * Splices {@code left} in front of this path. The last node of {@code left} must be the
     * first node of this path and appears once in the result.
     */
    public FlowPath prependPath(FlowPath left) {
        List<FlowNode> joined = new ArrayList<>(left.nodes.subList(0, left.nodes.size() - 1));
        joined.addAll(nodes);
        return new FlowPath(Collections.unmodifiableList(joined));
    }

    /**
     * Splices {@code right} after this path. The first node of {@code right} must be the
     * last node of this path and appears once in the result.
     */
    public FlowPath appendPath(FlowPath right) {
        List<FlowNode> joined = new ArrayList<>(nodes);
        joined.addAll(right.nodes.subList(1, right.nodes.size()));
        return new FlowPath(Collections.unmodifiableList(joined));
    }

    public List<FlowNode> getNodes() { return nodes; }

    public FlowNode first() { return nodes.get(0); }

    public FlowNode last() { return nodes.get(nodes.size() - 1); }

    public int size() { return nodes.size(); }

    public boolean contains(FlowNode node) {
        return nodes.contains(node);
    }

    public int count(FlowNode node) {
        int count = 0;
        for (FlowNode candidate : nodes) {
            if (candidate.equals(node)) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return true when every node of {@code other} appears somewhere in this path.
     */
    public boolean containsAllNodesOf(FlowPath other) {
        return new HashSet<>(nodes).containsAll(other.nodes);
    }

    public boolean containsEdge(FlowNode from, FlowNode to) {
        for (int i = 0; i + 1 < nodes.size(); i++) {
            if (nodes.get(i).equals(from) && nodes.get(i + 1).equals(to)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true when the last node directly repeats the one before it.
     */
    public boolean endsWithSelfRepeat() {
        return nodes.size() >= 2 && last().equals(nodes.get(nodes.size() - 2));
    }

    public List<FlowEdge> edges() {
        List<FlowEdge> edges = new ArrayList<>();
        for (int i = 0; i + 1 < nodes.size(); i++) {
            edges.add(new FlowEdge(nodes.get(i), nodes.get(i + 1)));
        }
        return edges;
    }

    public List<EdgePair> edgePairs() {
        List<EdgePair> pairs = new ArrayList<>();
        for (int i = 0; i + 2 < nodes.size(); i++) {
            pairs.add(new EdgePair(nodes.get(i), nodes.get(i + 1), nodes.get(i + 2)));
        }
        return pairs;
    }

    /**
     * @return the union of the source lines of all nodes on the path.
     */
    public SortedSet<Integer> getLines() {
        SortedSet<Integer> lines = new TreeSet<>();
        for (FlowNode node : nodes) {
            lines.addAll(node.getLines());
        }
        return lines;
    }

    /**
     * @return {@code n0:label -> n1:label ...}
     */
    public String describe() {
        return nodes.stream()
                .map(node -> node.getId() + ":" + node.getLabel())
                .collect(Collectors.joining(" -> "));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FlowPath)) return false;
        return nodes.equals(((FlowPath) obj).nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return nodes.stream().map(FlowNode::getId).collect(Collectors.joining(" -> "));
    }
}
