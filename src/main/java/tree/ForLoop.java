package tree;

import java.util.Collections;
import java.util.List;

/**
 * Iteration over an iterable ({@code for target in iterable}). Front ends whose loop header
 * does not fit that shape pass the verbatim header instead.
 */
public class ForLoop extends SourceStatement {
    private final String target;
    private final String iterable;
    private final String header;
    private final List<SourceStatement> body;

    public ForLoop(String text, String target, String iterable, List<SourceStatement> body,
                   int beginLine, int endLine) {
        this(text, target, iterable, null, body, beginLine, endLine);
    }

    public ForLoop(String text, String target, String iterable, String header, List<SourceStatement> body,
                   int beginLine, int endLine) {
        super(text, StatementKind.FOR, beginLine, endLine);
        this.target = target;
        this.iterable = iterable;
        this.header = header;
        this.body = body == null ? Collections.emptyList() : List.copyOf(body);
    }

    public String getTarget() { return target; }
    public String getIterable() { return iterable; }
    public String getHeader() { return header; }
    public List<SourceStatement> getBody() { return body; }
}
