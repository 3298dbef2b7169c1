package tree;

import java.util.Collections;
import java.util.List;

/**
 * if / else. An elif chain is a nested conditional as the only statement of the else block.
 */
public class ConditionalStatement extends SourceStatement {
    private final String condition;
    private final List<SourceStatement> thenBlock;
    private final List<SourceStatement> elseBlock;

    /**
     * @param condition condition text, may be null for a malformed statement
     * @param elseBlock null when there is no else part
     */
    public ConditionalStatement(String text, String condition, List<SourceStatement> thenBlock,
                                List<SourceStatement> elseBlock, int beginLine, int endLine) {
        super(text, StatementKind.CONDITIONAL, beginLine, endLine);
        this.condition = condition;
        this.thenBlock = thenBlock == null ? Collections.emptyList() : List.copyOf(thenBlock);
        this.elseBlock = elseBlock == null ? null : List.copyOf(elseBlock);
    }

    public String getCondition() { return condition; }
    public List<SourceStatement> getThenBlock() { return thenBlock; }
    public List<SourceStatement> getElseBlock() { return elseBlock; }
    public boolean hasElse() { return elseBlock != null; }
}
