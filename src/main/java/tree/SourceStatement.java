package tree;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Base class for one statement of a function body.
 * Line numbers are 1-based; a begin line of 0 means the position is unknown.
 */
public abstract class SourceStatement {
    private final String text;
    private final StatementKind kind;
    private final int beginLine;
    private final int endLine;

    protected SourceStatement(String text, StatementKind kind, int beginLine, int endLine) {
        if (kind == null) {
            throw new IllegalArgumentException("Statement kind is required");
        }
        this.text = text == null ? "" : text;
        this.kind = kind;
        this.beginLine = Math.max(0, beginLine);
        this.endLine = Math.max(this.beginLine, endLine);
    }

    public String getText() { return text; }
    public StatementKind getKind() { return kind; }
    public int getBeginLine() { return beginLine; }
    public int getEndLine() { return endLine; }

    /**
     * @return every line the statement spans, empty when the position is unknown.
     */
    public SortedSet<Integer> getLines() {
        if (beginLine == 0) {
            return Collections.emptySortedSet();
        }
        SortedSet<Integer> lines = new TreeSet<>();
        for (int line = beginLine; line <= endLine; line++) {
            lines.add(line);
        }
        return lines;
    }

    /**
     * @return the line of the statement header, which is the only line a compound
     * statement's own flow node claims.
     */
    public SortedSet<Integer> getHeaderLines() {
        if (beginLine == 0) {
            return Collections.emptySortedSet();
        }
        SortedSet<Integer> lines = new TreeSet<>();
        lines.add(beginLine);
        return lines;
    }

    @Override
    public String toString() {
        return kind + "@" + beginLine + ": " + text;
    }
}
