package coverage;

import tree.FunctionDefinition;

/**
 * Generates coverage targets for one function according to one criterion.
 */
public abstract class CoverageGenerator {

    public abstract CoverageCriterion getCriterion();

    public String getName() {
        return getCriterion().getDisplayName();
    }

    public abstract CoverageResult generate(FunctionDefinition function);
}
