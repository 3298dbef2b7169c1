package tree;

import java.util.Arrays;
import java.util.List;

/**
 * Short-hand constructors for statement trees used across the tests.
 * Every statement spans a single line.
 */
public final class TreeFixtures {

    private TreeFixtures() {
    }

    public static FunctionDefinition function(String name, SourceStatement... body) {
        return new FunctionDefinition(name, Arrays.asList(body));
    }

    public static List<SourceStatement> block(SourceStatement... statements) {
        return Arrays.asList(statements);
    }

    public static SimpleStatement simple(String text, int line) {
        return new SimpleStatement(text, line, line);
    }

    public static ReturnStatement ret(String text, int line) {
        return new ReturnStatement(text, line, line);
    }

    public static ConditionalStatement ifThen(String condition, int line, List<SourceStatement> thenBlock) {
        return new ConditionalStatement("if " + condition + ":", condition, thenBlock, null, line, line);
    }

    public static ConditionalStatement ifElse(String condition, int line, List<SourceStatement> thenBlock,
                                              List<SourceStatement> elseBlock) {
        return new ConditionalStatement("if " + condition + ":", condition, thenBlock, elseBlock, line, line);
    }

    public static WhileLoop whileLoop(String condition, int line, SourceStatement... body) {
        return new WhileLoop("while " + condition + ":", condition, Arrays.asList(body), line, line);
    }

    public static ForLoop forLoop(String target, String iterable, int line, SourceStatement... body) {
        return new ForLoop("for " + target + " in " + iterable + ":", target, iterable, Arrays.asList(body),
                line, line);
    }

    public static MatchStatement match(String subject, int line, MatchCase... cases) {
        return new MatchStatement("match " + subject + ":", subject, Arrays.asList(cases), line, line);
    }

    public static MatchCase matchCase(String pattern, int line, SourceStatement... body) {
        return new MatchCase(pattern, line, Arrays.asList(body));
    }

    public static TryStatement tryExcept(int line, List<SourceStatement> tryBody, ExceptHandler... handlers) {
        return new TryStatement("try:", tryBody, Arrays.asList(handlers), null, 0, line, line);
    }

    public static TryStatement tryFinally(int line, List<SourceStatement> tryBody, List<ExceptHandler> handlers,
                                          int finallyLine, List<SourceStatement> finallyBody) {
        return new TryStatement("try:", tryBody, handlers, finallyBody, finallyLine, line, line);
    }

    public static ExceptHandler handler(String type, String name, int line, SourceStatement... body) {
        return new ExceptHandler(type, name, line, Arrays.asList(body));
    }
}
