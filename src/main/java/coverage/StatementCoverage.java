package coverage;

import generation.CoverageTarget;
import generation.TestCaseProjector;
import tree.FunctionDefinition;

import java.util.Collections;
import java.util.List;

/**
 * One target per top-level statement of the function body. Does not build a graph.
 */
public class StatementCoverage extends CoverageGenerator {
    private final TestCaseProjector projector = new TestCaseProjector();

    @Override
    public CoverageCriterion getCriterion() {
        return CoverageCriterion.STATEMENT;
    }

    @Override
    public CoverageResult generate(FunctionDefinition function) {
        List<CoverageTarget> targets = projector.projectStatements(function.getName(), function.getBody());
        return new CoverageResult(getCriterion(), function.getName(), null,
                Collections.emptyList(), targets, Collections.emptyList(), false);
    }
}
