package tree;

import java.util.List;

/**
 * One function handed to the analysis: its name and top-level statements.
 */
public class FunctionDefinition {
    private final String name;
    private final List<SourceStatement> body;

    public FunctionDefinition(String name, List<SourceStatement> body) {
        if (body == null) {
            throw new IllegalArgumentException("Function body is required, use an empty list instead");
        }
        this.name = name;
        this.body = List.copyOf(body);
    }

    /**
     * @return the function name, or {@code "func"} when the front end could not determine one.
     */
    public String getName() {
        return name == null || name.isBlank() ? "func" : name;
    }

    public List<SourceStatement> getBody() { return body; }
}
