package tree;

import java.util.Collections;
import java.util.List;

public class MatchCase {
    private final String pattern;
    private final int line;
    private final List<SourceStatement> body;

    public MatchCase(String pattern, int line, List<SourceStatement> body) {
        this.pattern = pattern;
        this.line = Math.max(0, line);
        this.body = body == null ? Collections.emptyList() : List.copyOf(body);
    }

    public String getPattern() { return pattern; }
    public int getLine() { return line; }
    public List<SourceStatement> getBody() { return body; }
}
