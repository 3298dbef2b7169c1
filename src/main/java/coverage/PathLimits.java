package coverage;

/**
 * Ceiling on path enumeration. The number of candidate paths can grow exponentially with
 * nesting, so enumeration stops once either limit is reached and reports a truncated result.
 * <p>
 * Defaults can be overridden with the {@code pathcov.maxPaths} and
 * {@code pathcov.maxExpansions} system properties.
 */
public class PathLimits {
    public static final int DEFAULT_MAX_PATHS = 10_000;
    public static final int DEFAULT_MAX_EXPANSIONS = 1_000_000;

    private final int maxPaths;
    private final int maxExpansions;

    public PathLimits(int maxPaths, int maxExpansions) {
        if (maxPaths < 1 || maxExpansions < 1) {
            throw new IllegalArgumentException("Path limits must be positive: " + maxPaths + ", " + maxExpansions);
        }
        this.maxPaths = maxPaths;
        this.maxExpansions = maxExpansions;
    }

    public static PathLimits defaults() {
        return new PathLimits(
                Integer.getInteger("pathcov.maxPaths", DEFAULT_MAX_PATHS),
                Integer.getInteger("pathcov.maxExpansions", DEFAULT_MAX_EXPANSIONS));
    }

    public int getMaxPaths() { return maxPaths; }

    public int getMaxExpansions() { return maxExpansions; }

    @Override
    public String toString() {
        return "PathLimits{maxPaths=" + maxPaths + ", maxExpansions=" + maxExpansions + "}";
    }
}
