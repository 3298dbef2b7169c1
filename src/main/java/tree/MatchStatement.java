package tree;

import java.util.Collections;
import java.util.List;

/**
 * Pattern dispatch (match/case, switch).
 */
public class MatchStatement extends SourceStatement {
    private final String subject;
    private final List<MatchCase> cases;

    public MatchStatement(String text, String subject, List<MatchCase> cases, int beginLine, int endLine) {
        super(text, StatementKind.MATCH, beginLine, endLine);
        this.subject = subject;
        this.cases = cases == null ? Collections.emptyList() : List.copyOf(cases);
    }

    public String getSubject() { return subject; }
    public List<MatchCase> getCases() { return cases; }
}
