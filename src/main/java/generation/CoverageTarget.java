package generation;

import java.util.Collections;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One test to write: a name, a description of the path it has to drive, the source lines it
 * is expected to execute and an optional stub body.
 */
public class CoverageTarget {
    private final String name;
    private final String description;
    private final SortedSet<Integer> expectedLines;
    private final String body;

    public CoverageTarget(String name, String description, SortedSet<Integer> expectedLines, String body) {
        this.name = name;
        this.description = description == null ? "" : description;
        this.expectedLines = expectedLines == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(expectedLines));
        this.body = body;
    }

    public String getName() { return name; }

    public String getDescription() { return description; }

    public SortedSet<Integer> getExpectedLines() { return expectedLines; }

    public Optional<String> getBody() { return Optional.ofNullable(body); }

    @Override
    public String toString() {
        return name + " " + expectedLines;
    }
}
