package tree;

public class ReturnStatement extends SourceStatement {

    public ReturnStatement(String text, int beginLine, int endLine) {
        super(text, StatementKind.RETURN, beginLine, endLine);
    }
}
