package coverage;

import java.util.Locale;

/**
 * The supported adequacy criteria. The tag is used in generated target names.
 */
public enum CoverageCriterion {
    STATEMENT("Statement Coverage", "statement"),
    NODE("Node Coverage", "node"),
    EDGE("Edge Coverage", "edge"),
    EDGE_PAIR("Edge-Pair Coverage", "edgepair"),
    PRIME_PATH("Prime Path Coverage", "prime");

    private final String displayName;
    private final String tag;

    CoverageCriterion(String displayName, String tag) {
        this.displayName = displayName;
        this.tag = tag;
    }

    public String getDisplayName() { return displayName; }

    public String getTag() { return tag; }

    public CoverageGenerator newGenerator() {
        return newGenerator(PathLimits.defaults());
    }

    public CoverageGenerator newGenerator(PathLimits limits) {
        switch (this) {
            case STATEMENT:
                return new StatementCoverage();
            case NODE:
                return new NodeCoverage(limits);
            case EDGE:
                return new EdgeCoverage(limits);
            case EDGE_PAIR:
                return new EdgePairCoverage(limits);
            case PRIME_PATH:
                return new PrimePathCoverage(limits);
            default:
                throw new IllegalStateException("Unhandled criterion " + this);
        }
    }

    /**
     * Resolves a criterion from its tag or constant name, ignoring case and dashes.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static CoverageCriterion fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
            for (CoverageCriterion criterion : values()) {
                if (criterion.tag.equals(normalized)
                        || criterion.name().toLowerCase(Locale.ROOT).replace("_", "").equals(normalized)) {
                    return criterion;
                }
            }
        }
        throw new IllegalArgumentException("Unknown coverage criterion: " + name);
    }
}
