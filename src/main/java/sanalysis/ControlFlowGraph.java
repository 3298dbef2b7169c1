package sanalysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tree.SourceStatement;

import java.util.*;

/**
 * Control flow graph of one function body.
 * <p>
 * Nodes keep their insertion order, which is also their numbering. Edges form an insertion
 * ordered set, so adding the same (from, to) pair twice has no effect. Only
 * {@link ControlFlowGraphBuilder} mutates a graph; once it is frozen every mutation fails.
 * Queries on nodes that are not part of the graph return empty results.
 */
public class ControlFlowGraph {
    private static final Logger logger = LoggerFactory.getLogger(ControlFlowGraph.class);

    private final List<FlowNode> nodes = new ArrayList<>();
    private final Set<FlowEdge> edges = new LinkedHashSet<>();
    private final Set<FlowEdge> loopClosingEdges = new LinkedHashSet<>();
    private final Map<FlowNode, List<FlowNode>> successors = new HashMap<>();
    private final Map<FlowNode, List<FlowNode>> predecessors = new HashMap<>();
    private boolean frozen;

    FlowNode createNode(String label, SourceStatement origin, SortedSet<Integer> lines) {
        FlowNode node = new FlowNode(nodes.size(), label, origin, lines);
        addNode(node);
        return node;
    }

    void addNode(FlowNode node) {
        checkMutable();
        nodes.add(node);
    }

    void addEdge(FlowNode from, FlowNode to) {
        checkMutable();
        FlowEdge edge = new FlowEdge(from, to);
        if (edges.add(edge)) {
            successors.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
            predecessors.computeIfAbsent(to, k -> new ArrayList<>()).add(from);
        }
    }

    /**
     * Adds an edge that closes a loop, from a body exit back to the loop header.
     */
    void addLoopClosingEdge(FlowNode from, FlowNode to) {
        addEdge(from, to);
        loopClosingEdges.add(new FlowEdge(from, to));
    }

    void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Control flow graph is frozen");
        }
    }

    public List<FlowNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public Set<FlowEdge> getEdges() {
        return Collections.unmodifiableSet(edges);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public boolean hasEdge(FlowNode from, FlowNode to) {
        return edges.contains(new FlowEdge(from, to));
    }

    public boolean isLoopClosingEdge(FlowNode from, FlowNode to) {
        return loopClosingEdges.contains(new FlowEdge(from, to));
    }

    public Set<FlowEdge> getLoopClosingEdges() {
        return Collections.unmodifiableSet(loopClosingEdges);
    }

    public List<FlowNode> getSuccessors(FlowNode node) {
        List<FlowNode> result = successors.get(node);
        return result == null ? Collections.emptyList() : Collections.unmodifiableList(result);
    }

    public List<FlowNode> getPredecessors(FlowNode node) {
        List<FlowNode> result = predecessors.get(node);
        return result == null ? Collections.emptyList() : Collections.unmodifiableList(result);
    }

    /**
     * @return nodes without incoming edges, in node order.
     */
    public List<FlowNode> getSources() {
        List<FlowNode> sources = new ArrayList<>();
        for (FlowNode node : nodes) {
            if (getPredecessors(node).isEmpty()) {
                sources.add(node);
            }
        }
        return sources;
    }

    /**
     * @return nodes without outgoing edges, in node order.
     */
    public List<FlowNode> getSinks() {
        List<FlowNode> sinks = new ArrayList<>();
        for (FlowNode node : nodes) {
            if (getSuccessors(node).isEmpty()) {
                sinks.add(node);
            }
        }
        return sinks;
    }

    /**
     * @return the insertion position of the node, or -1 when it is not part of this graph.
     */
    public int indexOf(FlowNode node) {
        return nodes.indexOf(node);
    }

    public Optional<FlowNode> findNode(String id) {
        return nodes.stream().filter(node -> node.getId().equals(id)).findFirst();
    }

    /**
     * @return every (a, b, c) such that a->b and b->c are edges, in edge order.
     */
    public Set<EdgePair> getEdgePairs() {
        Set<EdgePair> pairs = new LinkedHashSet<>();
        for (FlowEdge first : edges) {
            for (FlowNode next : getSuccessors(first.to)) {
                pairs.add(new EdgePair(first.from, first.to, next));
            }
        }
        return pairs;
    }

    public void printGraph() {
        logger.info("Nodes:");
        for (FlowNode node : nodes) {
            logger.info("  {}: {}", node.getId(), node.getLabel());
        }
        logger.info("Edges:");
        for (FlowEdge edge : edges) {
            logger.info("  {} -> {}", edge.from.getId(), edge.to.getId());
        }
    }

    /**
     * Renders the graph in Graphviz DOT format. Loop-closing edges are drawn dashed.
     */
    public String toDot() {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph CFG {").append(System.lineSeparator());
        for (FlowNode node : nodes) {
            String safeLabel = node.getLabel()
                    .replace("\\", "\\\\")
                    .replace("\"", "\\\"");
            sb.append(String.format("  \"%s\" [label=\"%s: %s\"];%n", node.getId(), node.getId(), safeLabel));
        }
        for (FlowEdge edge : edges) {
            String style = loopClosingEdges.contains(edge) ? " [style=dashed]" : "";
            sb.append(String.format("  \"%s\" -> \"%s\"%s;%n", edge.from.getId(), edge.to.getId(), style));
        }
        sb.append("}").append(System.lineSeparator());
        return sb.toString();
    }
}
