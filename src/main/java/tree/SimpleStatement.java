package tree;

/**
 * A statement without internal branching (assignment, call, raise, break ...).
 */
public class SimpleStatement extends SourceStatement {

    public SimpleStatement(String text, int beginLine, int endLine) {
        this(text, StatementKind.SIMPLE, beginLine, endLine);
    }

    public SimpleStatement(String text, StatementKind kind, int beginLine, int endLine) {
        super(text, kind, beginLine, endLine);
        if (!kind.isStraightLine()) {
            throw new IllegalArgumentException("Not a straight-line kind: " + kind);
        }
    }
}
