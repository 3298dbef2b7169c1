package tree;

import java.util.Collections;
import java.util.List;

public class TryStatement extends SourceStatement {
    private final List<SourceStatement> tryBody;
    private final List<ExceptHandler> handlers;
    private final List<SourceStatement> finallyBody;
    private final int finallyLine;

    /**
     * @param finallyBody null when there is no finally part
     */
    public TryStatement(String text, List<SourceStatement> tryBody, List<ExceptHandler> handlers,
                        List<SourceStatement> finallyBody, int finallyLine, int beginLine, int endLine) {
        super(text, StatementKind.TRY, beginLine, endLine);
        this.tryBody = tryBody == null ? Collections.emptyList() : List.copyOf(tryBody);
        this.handlers = handlers == null ? Collections.emptyList() : List.copyOf(handlers);
        this.finallyBody = finallyBody == null ? null : List.copyOf(finallyBody);
        this.finallyLine = Math.max(0, finallyLine);
    }

    public List<SourceStatement> getTryBody() { return tryBody; }
    public List<ExceptHandler> getHandlers() { return handlers; }
    public List<SourceStatement> getFinallyBody() { return finallyBody; }
    public boolean hasFinally() { return finallyBody != null; }
    public int getFinallyLine() { return finallyLine; }
}
