package generation;

import coverage.CoverageCriterion;
import coverage.FlowPath;
import sanalysis.ControlFlowGraph;
import sanalysis.EdgePair;
import sanalysis.FlowEdge;
import sanalysis.FlowNode;
import tree.SourceStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * Turns selected paths into {@link CoverageTarget}s. Names follow
 * {@code <function>_<criterion tag>_<index>}; descriptions are plain text lines.
 */
public class TestCaseProjector {

    public List<CoverageTarget> project(CoverageCriterion criterion, String functionName,
                                        ControlFlowGraph graph, List<FlowPath> paths) {
        List<CoverageTarget> targets = new ArrayList<>();
        for (int index = 0; index < paths.size(); index++) {
            FlowPath path = paths.get(index);
            SortedSet<Integer> lines = path.getLines();
            targets.add(new CoverageTarget(
                    functionName + "_" + criterion.getTag() + "_" + index,
                    describe(criterion, graph, path, index, lines),
                    lines,
                    stubBody(functionName)));
        }
        return targets;
    }

    public List<CoverageTarget> projectStatements(String functionName, List<SourceStatement> statements) {
        List<CoverageTarget> targets = new ArrayList<>();
        for (int index = 0; index < statements.size(); index++) {
            SourceStatement statement = statements.get(index);
            String text = statement.getText().replace("\n", " ").trim();
            targets.add(new CoverageTarget(
                    functionName + "_" + CoverageCriterion.STATEMENT.getTag() + "_" + index,
                    "Write a test case that hits: `" + text + "`",
                    statement.getLines(),
                    stubBody(functionName)));
        }
        return targets;
    }

    private String describe(CoverageCriterion criterion, ControlFlowGraph graph, FlowPath path, int index,
                            SortedSet<Integer> lines) {
        StringBuilder sb = new StringBuilder();
        switch (criterion) {
            case NODE:
                sb.append("Node Path ").append(index).append(": ").append(path.describe()).append('\n');
                sb.append("Covered nodes: ").append(path.getNodes().stream()
                        .map(FlowNode::getId).distinct().collect(Collectors.joining(", "))).append('\n');
                break;
            case EDGE:
                sb.append("Nodes: ").append(nodes(graph)).append('\n');
                sb.append("Edges: ").append(edges(graph)).append('\n');
                sb.append("Path ").append(index).append(": ").append(path).append('\n');
                sb.append("Expected edges: ").append(path.edges().stream()
                        .map(FlowEdge::toString).collect(Collectors.joining(", "))).append('\n');
                break;
            case EDGE_PAIR:
                sb.append("Edge-Pair Path ").append(index).append(": ").append(path.getNodes().stream()
                        .map(node -> node.getId() + ":" + node.getLabel() + " [lines: " + joinLines(node.getLines()) + "]")
                        .collect(Collectors.joining(" -> "))).append('\n');
                sb.append("Expected edge-pairs: ").append(path.edgePairs().stream()
                        .map(EdgePair::toString).collect(Collectors.joining(", "))).append('\n');
                break;
            case PRIME_PATH:
                sb.append("Nodes: ").append(nodes(graph)).append('\n');
                sb.append("Edges: ").append(edges(graph)).append('\n');
                sb.append("Prime Path ").append(index).append(": ").append(path.describe()).append('\n');
                break;
            default:
                sb.append("Path ").append(index).append(": ").append(path.describe()).append('\n');
        }
        sb.append("Expected lines: ").append(joinLines(lines));
        return sb.toString();
    }

    private static String nodes(ControlFlowGraph graph) {
        return graph.getNodes().stream()
                .map(node -> node.getId() + ":" + node.getLabel())
                .collect(Collectors.joining(", "));
    }

    private static String edges(ControlFlowGraph graph) {
        return graph.getEdges().stream().map(FlowEdge::toString).collect(Collectors.joining(", "));
    }

    private static String joinLines(SortedSet<Integer> lines) {
        return lines.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }

    private static String stubBody(String functionName) {
        return functionName + "(/* inputs that drive this path */);";
    }
}
