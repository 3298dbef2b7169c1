package tree;

import java.util.Collections;
import java.util.List;

public class ExceptHandler {
    private final String exceptionType;
    private final String targetName;
    private final int line;
    private final List<SourceStatement> body;

    /**
     * @param exceptionType caught type, null for a bare handler
     * @param targetName    name the exception is bound to, may be null
     */
    public ExceptHandler(String exceptionType, String targetName, int line, List<SourceStatement> body) {
        this.exceptionType = exceptionType;
        this.targetName = targetName;
        this.line = Math.max(0, line);
        this.body = body == null ? Collections.emptyList() : List.copyOf(body);
    }

    public String getExceptionType() { return exceptionType; }
    public String getTargetName() { return targetName; }
    public int getLine() { return line; }
    public List<SourceStatement> getBody() { return body; }
}
