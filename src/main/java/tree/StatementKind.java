package tree;

/**
 * The statement kinds the flow graph builder distinguishes.
 * Anything that is not one of the structured kinds is {@link #SIMPLE} or {@link #OTHER}
 * and ends up in a straight-line run.
 */
public enum StatementKind {
    SIMPLE,
    CONDITIONAL,
    WHILE,
    FOR,
    MATCH,
    TRY,
    RETURN,
    OTHER;

    public boolean isStraightLine() {
        return this == SIMPLE || this == OTHER;
    }
}
