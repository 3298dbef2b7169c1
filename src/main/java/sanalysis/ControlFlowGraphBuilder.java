package sanalysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tree.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Builds the control flow graph of one function body.
 * <p>
 * The builder walks the statement tree depth first and threads a frontier through it: the
 * nodes whose outgoing edges are still pending. Every construction step receives the
 * frontier that flows into it and returns the frontier that flows out of it; frontiers are
 * never modified in place. Consecutive straight-line statements are merged into one node.
 * No synthetic entry or exit node is created, so sources and sinks are found by degree.
 * <p>
 * A builder holds no state between calls and can be shared.
 */
public class ControlFlowGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ControlFlowGraphBuilder.class);

    static final String LINEAR_SEPARATOR = " ; ";
    static final String MATCH_MERGE_LABEL = "match_end";

    /**
     * Builds and freezes the graph for the given function.
     */
    public ControlFlowGraph build(FunctionDefinition function) {
        if (function == null) {
            throw new IllegalArgumentException("Function is required");
        }
        ControlFlowGraph graph = new ControlFlowGraph();
        logger.debug("=== Build CFG for function: {} ===", function.getName());

        connectBlock(graph, function.getBody(), Collections.emptyList());

        graph.freeze();
        logger.debug("=== Finished CFG for function: {} ===", function.getName());
        logger.info("CFG for {}: {} nodes, {} edges", function.getName(),
                graph.getNodes().size(), graph.getEdges().size());
        return graph;
    }

    /**
     * Connects a block of statements, buffering straight-line statements so that each run
     * becomes a single node.
     *
     * @return the exit frontier of the block
     */
    List<FlowNode> connectBlock(ControlFlowGraph graph, List<SourceStatement> statements, List<FlowNode> entry) {
        List<FlowNode> frontier = entry;
        List<SourceStatement> linearBuffer = new ArrayList<>();

        for (SourceStatement statement : statements) {
            if (statement.getKind().isStraightLine()) {
                linearBuffer.add(statement);
                continue;
            }
            if (!linearBuffer.isEmpty()) {
                frontier = handleLinear(graph, linearBuffer, frontier);
                linearBuffer = new ArrayList<>();
            }
            frontier = connectStatement(graph, statement, frontier);
        }

        if (!linearBuffer.isEmpty()) {
            frontier = handleLinear(graph, linearBuffer, frontier);
        }
        return frontier;
    }

    private List<FlowNode> connectStatement(ControlFlowGraph graph, SourceStatement statement, List<FlowNode> frontier) {
        switch (statement.getKind()) {
            case CONDITIONAL:
                return handleIf(graph, (ConditionalStatement) statement, frontier);
            case WHILE:
                return handleWhile(graph, (WhileLoop) statement, frontier);
            case FOR:
                return handleFor(graph, (ForLoop) statement, frontier);
            case MATCH:
                return handleMatch(graph, (MatchStatement) statement, frontier);
            case TRY:
                return handleTry(graph, (TryStatement) statement, frontier);
            case RETURN:
                return handleReturn(graph, (ReturnStatement) statement, frontier);
            default:
                return handleLinear(graph, Collections.singletonList(statement), frontier);
        }
    }

    private List<FlowNode> handleLinear(ControlFlowGraph graph, List<SourceStatement> statements, List<FlowNode> frontier) {
        StringBuilder label = new StringBuilder();
        SortedSet<Integer> lines = new TreeSet<>();
        for (SourceStatement statement : statements) {
            if (label.length() > 0) {
                label.append(LINEAR_SEPARATOR);
            }
            label.append(statement.getText());
            lines.addAll(statement.getLines());
        }
        FlowNode node = graph.createNode(label.toString(), statements.get(0), lines);
        logger.debug("Added LINEAR node {}: {}", node.getId(), node.getLabel());
        wire(graph, frontier, node);
        return List.of(node);
    }

    private List<FlowNode> handleReturn(ControlFlowGraph graph, ReturnStatement statement, List<FlowNode> frontier) {
        FlowNode node = graph.createNode(statement.getText(), statement, statement.getLines());
        logger.debug("Added RETURN node {}: {}", node.getId(), node.getLabel());
        wire(graph, frontier, node);
        return Collections.emptyList();
    }

    private List<FlowNode> handleIf(ControlFlowGraph graph, ConditionalStatement statement, List<FlowNode> frontier) {
        String label = "if " + orPlaceholder(statement.getCondition(), "");
        FlowNode condNode = graph.createNode(label, statement, statement.getHeaderLines());
        logger.debug("Added IF node {}: {}", condNode.getId(), condNode.getLabel());
        wire(graph, frontier, condNode);

        List<FlowNode> thenExits = connectBlock(graph, statement.getThenBlock(), List.of(condNode));
        List<FlowNode> elseExits = statement.hasElse()
                ? connectBlock(graph, statement.getElseBlock(), List.of(condNode))
                : List.of(condNode);

        logger.debug("IF exits: then={}, else={}", thenExits, elseExits);
        return concat(thenExits, elseExits);
    }

    private List<FlowNode> handleWhile(ControlFlowGraph graph, WhileLoop statement, List<FlowNode> frontier) {
        String label = "while " + orPlaceholder(statement.getCondition(), "");
        FlowNode condNode = graph.createNode(label, statement, statement.getHeaderLines());
        logger.debug("Added WHILE node {}: {}", condNode.getId(), condNode.getLabel());
        return connectLoop(graph, condNode, statement.getBody(), frontier);
    }

    private List<FlowNode> handleFor(ControlFlowGraph graph, ForLoop statement, List<FlowNode> frontier) {
        String label = statement.getHeader() != null && !statement.getHeader().isBlank()
                ? statement.getHeader()
                : "for " + orPlaceholder(statement.getTarget(), "target")
                        + " in " + orPlaceholder(statement.getIterable(), "iterable");
        FlowNode forNode = graph.createNode(label, statement, statement.getHeaderLines());
        logger.debug("Added FOR node {}: {}", forNode.getId(), forNode.getLabel());
        return connectLoop(graph, forNode, statement.getBody(), frontier);
    }

    /**
     * Wires the header, builds the body from it and closes the loop from every body exit.
     * The header itself is the exit taken when the loop test fails.
     */
    private List<FlowNode> connectLoop(ControlFlowGraph graph, FlowNode header, List<SourceStatement> body,
                                       List<FlowNode> frontier) {
        wire(graph, frontier, header);
        if (body.isEmpty()) {
            return List.of(header);
        }
        List<FlowNode> bodyExits = connectBlock(graph, body, List.of(header));
        for (FlowNode exit : bodyExits) {
            graph.addLoopClosingEdge(exit, header);
            logger.debug("Back edge: {} -> {}", exit.getId(), header.getId());
        }
        return List.of(header);
    }

    private List<FlowNode> handleMatch(ControlFlowGraph graph, MatchStatement statement, List<FlowNode> frontier) {
        String label = "match " + orPlaceholder(statement.getSubject(), "");
        FlowNode matchNode = graph.createNode(label, statement, statement.getHeaderLines());
        logger.debug("Added MATCH node {}: {}", matchNode.getId(), matchNode.getLabel());
        wire(graph, frontier, matchNode);

        List<FlowNode> caseExits = new ArrayList<>();
        if (statement.getCases().isEmpty()) {
            caseExits.add(matchNode);
        }
        for (MatchCase matchCase : statement.getCases()) {
            String caseLabel = "case " + orPlaceholder(matchCase.getPattern(), "_");
            FlowNode caseNode = graph.createNode(caseLabel, statement, lineSet(matchCase.getLine()));
            graph.addEdge(matchNode, caseNode);
            logger.debug("Added CASE node {}: {}", caseNode.getId(), caseNode.getLabel());

            caseExits.addAll(connectBlock(graph, matchCase.getBody(), List.of(caseNode)));
        }

        FlowNode mergeNode = graph.createNode(MATCH_MERGE_LABEL, statement, null);
        logger.debug("Added MERGE node {}", mergeNode.getId());
        wire(graph, caseExits, mergeNode);
        return List.of(mergeNode);
    }

    /**
     * Any statement of the try body may raise, so every try body exit reaches every handler.
     * The finally block is entered from the last try body exit and from every handler exit.
     */
    private List<FlowNode> handleTry(ControlFlowGraph graph, TryStatement statement, List<FlowNode> frontier) {
        FlowNode tryNode = graph.createNode("try", statement, statement.getHeaderLines());
        logger.debug("Added TRY node {}", tryNode.getId());
        wire(graph, frontier, tryNode);

        List<FlowNode> tryExits = connectBlock(graph, statement.getTryBody(), List.of(tryNode));

        List<FlowNode> handlerNodes = new ArrayList<>();
        for (ExceptHandler handler : statement.getHandlers()) {
            FlowNode handlerNode = graph.createNode(handlerLabel(handler), statement, lineSet(handler.getLine()));
            logger.debug("Added EXCEPT node {}: {}", handlerNode.getId(), handlerNode.getLabel());
            handlerNodes.add(handlerNode);
        }
        for (FlowNode tryExit : tryExits) {
            for (FlowNode handlerNode : handlerNodes) {
                graph.addEdge(tryExit, handlerNode);
            }
        }

        List<FlowNode> handlerExits = new ArrayList<>();
        for (int i = 0; i < handlerNodes.size(); i++) {
            List<SourceStatement> handlerBody = statement.getHandlers().get(i).getBody();
            handlerExits.addAll(connectBlock(graph, handlerBody, List.of(handlerNodes.get(i))));
        }

        if (!statement.hasFinally()) {
            return concat(tryExits, handlerExits);
        }

        FlowNode finallyNode = graph.createNode("finally", statement, lineSet(statement.getFinallyLine()));
        logger.debug("Added FINALLY node {}", finallyNode.getId());
        List<FlowNode> finallyEntries = new ArrayList<>();
        if (!tryExits.isEmpty()) {
            finallyEntries.add(tryExits.get(tryExits.size() - 1));
        }
        finallyEntries.addAll(handlerExits);
        wire(graph, finallyEntries, finallyNode);

        return connectBlock(graph, statement.getFinallyBody(), List.of(finallyNode));
    }

    private static String handlerLabel(ExceptHandler handler) {
        String type = blankToNull(handler.getExceptionType());
        String target = blankToNull(handler.getTargetName());
        if (type != null && target != null) {
            return "except " + type + " as " + target;
        } else if (type != null) {
            return "except " + type;
        }
        return "except _";
    }

    private static void wire(ControlFlowGraph graph, List<FlowNode> frontier, FlowNode node) {
        for (FlowNode previous : frontier) {
            graph.addEdge(previous, node);
            logger.debug("Edge: {} -> {}", previous.getId(), node.getId());
        }
    }

    private static List<FlowNode> concat(List<FlowNode> first, List<FlowNode> second) {
        List<FlowNode> result = new ArrayList<>(first.size() + second.size());
        result.addAll(first);
        result.addAll(second);
        return Collections.unmodifiableList(result);
    }

    private static SortedSet<Integer> lineSet(int line) {
        SortedSet<Integer> lines = new TreeSet<>();
        if (line > 0) {
            lines.add(line);
        }
        return lines;
    }

    private static String orPlaceholder(String text, String placeholder) {
        String value = blankToNull(text);
        if (value == null) {
            logger.debug("Missing child text, using placeholder '{}'", placeholder);
            return placeholder;
        }
        return value;
    }

    private static String blankToNull(String text) {
        return text == null || text.isBlank() ? null : text.trim();
    }
}
