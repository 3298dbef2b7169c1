package cli;

import coverage.CoverageCriterion;
import coverage.CoverageResult;
import coverage.PathLimits;
import generation.CoverageReportWriter;
import generation.CoverageTarget;
import generation.TestSkeletonRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import parsing.JavaMethodReader;
import parsing.SourceReadException;
import sanalysis.ControlFlowGraph;
import sanalysis.ControlFlowGraphBuilder;
import tree.FunctionDefinition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command line entry point.
 * <pre>
 * Main &lt;source.java&gt; &lt;method&gt; [criterion|all] [outputDir]
 * </pre>
 * Without an output directory the targets are only logged.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_READ_FAILURE = 2;

    private static final String DEFAULT_CRITERION = "edge";

    public static void main(String[] args) {
        int status = new Main().run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    int run(String[] args) {
        if (args.length < 2) {
            System.out.println("Usage: java cli.Main <source.java> <method> [criterion|all] [outputDir]");
            System.out.println("Criteria: " + Arrays.toString(CoverageCriterion.values()));
            return EXIT_USAGE;
        }
        Path sourcePath = Paths.get(args[0]);
        String methodName = args[1];
        String criterionName = args.length >= 3 ? args[2] : DEFAULT_CRITERION;
        Path outputDir = args.length >= 4 ? Paths.get(args[3]) : null;

        List<CoverageCriterion> criteria;
        try {
            criteria = "all".equalsIgnoreCase(criterionName)
                    ? Arrays.asList(CoverageCriterion.values())
                    : List.of(CoverageCriterion.fromName(criterionName));
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            return EXIT_USAGE;
        }

        PathLimits limits;
        try {
            limits = PathLimits.defaults();
        } catch (IllegalArgumentException e) {
            logger.error("Invalid path limits: {}", e.getMessage());
            return EXIT_USAGE;
        }

        FunctionDefinition function;
        try {
            function = new JavaMethodReader().readMethod(sourcePath, methodName);
        } catch (SourceReadException e) {
            logger.error("Could not read {} from {}: {}", methodName, sourcePath, e.getMessage());
            return EXIT_READ_FAILURE;
        }

        ControlFlowGraph graph = new ControlFlowGraphBuilder().build(function);
        graph.printGraph();

        List<CoverageResult> results = new ArrayList<>();
        for (CoverageCriterion criterion : criteria) {
            CoverageResult result = criterion.newGenerator(limits).generate(function);
            results.add(result);
            logResult(result);
        }

        if (outputDir != null) {
            try {
                writeArtifacts(function, graph, results, outputDir);
            } catch (IOException e) {
                logger.error("Failed to write artifacts to {}: {}", outputDir, e.getMessage());
                return EXIT_READ_FAILURE;
            }
        }
        return EXIT_OK;
    }

    private void logResult(CoverageResult result) {
        logger.info("{} for {}: {} targets{}", result.getCriterion().getDisplayName(), result.getFunctionName(),
                result.getTargets().size(), result.isComplete() ? "" : " (partial)");
        for (CoverageTarget target : result.getTargets()) {
            logger.info("  {} lines {}", target.getName(), target.getExpectedLines());
        }
    }

    private void writeArtifacts(FunctionDefinition function, ControlFlowGraph graph, List<CoverageResult> results,
                                Path outputDir) throws IOException {
        Files.createDirectories(outputDir);

        Path dotFile = outputDir.resolve(function.getName() + "_cfg.dot");
        Files.writeString(dotFile, graph.toDot());
        logger.info("CFG exported to: {}", dotFile);

        CoverageReportWriter reportWriter = new CoverageReportWriter();
        for (CoverageResult result : results) {
            Path reportFile = outputDir.resolve(function.getName() + "_" + result.getCriterion().getTag() + ".json");
            reportWriter.write(result, reportFile);
            logger.info("Report written to: {}", reportFile);
        }

        String className = TestSkeletonRenderer.defaultClassName(function.getName());
        Path skeletonFile = outputDir.resolve(className + ".java");
        Files.writeString(skeletonFile,
                new TestSkeletonRenderer().render(className, results.toArray(new CoverageResult[0])));
        logger.info("Test skeleton written to: {}", skeletonFile);
    }
}
