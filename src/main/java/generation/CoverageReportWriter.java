package generation;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import coverage.CoverageResult;
import coverage.FlowPath;
import sanalysis.FlowEdge;
import sanalysis.FlowNode;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Serializes a {@link CoverageResult} to JSON.
 */
public class CoverageReportWriter {
    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public String toJson(CoverageResult result) {
        return gson.toJson(toReport(result));
    }

    public void write(CoverageResult result, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(toReport(result), writer);
        }
    }

    private Report toReport(CoverageResult result) {
        Report report = new Report();
        report.function = result.getFunctionName();
        report.criterion = result.getCriterion().getDisplayName();
        report.complete = result.isComplete();
        report.truncated = result.isTruncated();
        report.uncovered = new ArrayList<>(result.getUncovered());

        if (result.getGraph() != null) {
            for (FlowNode node : result.getGraph().getNodes()) {
                NodeEntry entry = new NodeEntry();
                entry.id = node.getId();
                entry.label = node.getLabel();
                entry.lines = new ArrayList<>(node.getLines());
                report.nodes.add(entry);
            }
            for (FlowEdge edge : result.getGraph().getEdges()) {
                report.edges.add(edge.toString());
            }
        }
        for (int i = 0; i < result.getTargets().size(); i++) {
            CoverageTarget target = result.getTargets().get(i);
            TargetEntry entry = new TargetEntry();
            entry.name = target.getName();
            entry.description = target.getDescription();
            entry.expectedLines = new ArrayList<>(target.getExpectedLines());
            if (i < result.getSelectedPaths().size()) {
                FlowPath path = result.getSelectedPaths().get(i);
                for (FlowNode node : path.getNodes()) {
                    entry.path.add(node.getId());
                }
            }
            report.targets.add(entry);
        }
        return report;
    }

    // Field names are the JSON keys.
    private static class Report {
        String function;
        String criterion;
        boolean complete;
        boolean truncated;
        List<String> uncovered = new ArrayList<>();
        List<NodeEntry> nodes = new ArrayList<>();
        List<String> edges = new ArrayList<>();
        List<TargetEntry> targets = new ArrayList<>();
    }

    private static class NodeEntry {
        String id;
        String label;
        List<Integer> lines;
    }

    private static class TargetEntry {
        String name;
        String description;
        List<Integer> expectedLines;
        List<String> path = new ArrayList<>();
    }
}
