package coverage;

import java.util.List;

/**
 * Finished paths produced by {@link PathEnumerator}. {@code truncated} is set when the
 * enumeration hit its {@link PathLimits} before the queue was exhausted.
 */
public class PathEnumeration {
    private final List<FlowPath> paths;
    private final boolean truncated;

    public PathEnumeration(List<FlowPath> paths, boolean truncated) {
        this.paths = List.copyOf(paths);
        this.truncated = truncated;
    }

    public List<FlowPath> getPaths() { return paths; }

    public boolean isTruncated() { return truncated; }
}
