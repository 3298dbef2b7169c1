package tree;

import java.util.Collections;
import java.util.List;

public class WhileLoop extends SourceStatement {
    private final String condition;
    private final List<SourceStatement> body;

    public WhileLoop(String text, String condition, List<SourceStatement> body, int beginLine, int endLine) {
        super(text, StatementKind.WHILE, beginLine, endLine);
        this.condition = condition;
        this.body = body == null ? Collections.emptyList() : List.copyOf(body);
    }

    public String getCondition() { return condition; }
    public List<SourceStatement> getBody() { return body; }
}
