package parsing;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tree.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads Java methods with JavaParser and converts their bodies into statement trees.
 * <p>
 * Blocks, labeled statements and synchronized bodies are flattened into the enclosing block.
 * {@code do ... while} becomes a while loop, {@code switch} a match, and {@code throw},
 * {@code break} and {@code continue} are kept as simple statements.
 */
public class JavaMethodReader {
    private static final Logger logger = LoggerFactory.getLogger(JavaMethodReader.class);

    /**
     * Reads the first method called {@code methodName} from a source file.
     */
    public FunctionDefinition readMethod(Path sourceFile, String methodName) {
        return findMethod(parseFile(sourceFile), methodName, sourceFile.toString());
    }

    /**
     * Reads the first method called {@code methodName} from source code.
     */
    public FunctionDefinition readMethodFromSource(String source, String methodName) {
        return findMethod(parseSource(source), methodName, "<source>");
    }

    /**
     * Reads every method with a body from a source file, in declaration order.
     */
    public List<FunctionDefinition> readAllMethods(Path sourceFile) {
        CompilationUnit cu = parseFile(sourceFile);
        List<FunctionDefinition> functions = new ArrayList<>();
        for (MethodDeclaration method : cu.findAll(MethodDeclaration.class)) {
            if (method.getBody().isPresent()) {
                functions.add(convert(method));
            } else {
                logger.debug("Skipping method without a body: {}", method.getName());
            }
        }
        return functions;
    }

    public FunctionDefinition convert(MethodDeclaration method) {
        List<SourceStatement> body = method.getBody()
                .map(block -> convertBlock(block.getStatements()))
                .orElseGet(ArrayList::new);
        return new FunctionDefinition(method.getNameAsString(), body);
    }

    private CompilationUnit parseFile(Path sourceFile) {
        try {
            return StaticJavaParser.parse(sourceFile);
        } catch (IOException e) {
            throw new SourceReadException("Error reading source file " + sourceFile + ": " + e.getMessage(), e);
        } catch (ParseProblemException e) {
            throw new SourceReadException("Error parsing source file " + sourceFile + ": " + e.getMessage(), e);
        }
    }

    private CompilationUnit parseSource(String source) {
        try {
            return StaticJavaParser.parse(source);
        } catch (ParseProblemException e) {
            throw new SourceReadException("Error parsing source code: " + e.getMessage(), e);
        }
    }

    private FunctionDefinition findMethod(CompilationUnit cu, String methodName, String origin) {
        return cu.findAll(MethodDeclaration.class).stream()
                .filter(method -> method.getNameAsString().equals(methodName))
                .findFirst()
                .map(this::convert)
                .orElseThrow(() -> new SourceReadException("No method '" + methodName + "' in " + origin));
    }

    private List<SourceStatement> convertBlock(List<Statement> statements) {
        List<SourceStatement> result = new ArrayList<>();
        for (Statement statement : statements) {
            convertInto(statement, result);
        }
        return result;
    }

    private List<SourceStatement> convertBody(Statement statement) {
        List<SourceStatement> result = new ArrayList<>();
        convertInto(statement, result);
        return result;
    }

    private void convertInto(Statement stmt, List<SourceStatement> out) {
        if (stmt.isBlockStmt()) {
            out.addAll(convertBlock(stmt.asBlockStmt().getStatements()));
        } else if (stmt.isLabeledStmt()) {
            convertInto(stmt.asLabeledStmt().getStatement(), out);
        } else if (stmt.isSynchronizedStmt()) {
            out.addAll(convertBlock(stmt.asSynchronizedStmt().getBody().getStatements()));
        } else if (stmt.isEmptyStmt()) {
            // nothing to execute
        } else if (stmt.isIfStmt()) {
            out.add(convertIf(stmt.asIfStmt()));
        } else if (stmt.isWhileStmt()) {
            WhileStmt whileStmt = stmt.asWhileStmt();
            out.add(new WhileLoop(text(whileStmt), whileStmt.getCondition().toString(),
                    convertBody(whileStmt.getBody()), beginLine(whileStmt), endLine(whileStmt)));
        } else if (stmt.isDoStmt()) {
            DoStmt doStmt = stmt.asDoStmt();
            out.add(new WhileLoop(text(doStmt), doStmt.getCondition().toString(),
                    convertBody(doStmt.getBody()), beginLine(doStmt), endLine(doStmt)));
        } else if (stmt.isForStmt()) {
            out.add(convertFor(stmt.asForStmt()));
        } else if (stmt.isForEachStmt()) {
            ForEachStmt forEach = stmt.asForEachStmt();
            String target = forEach.getVariable().getVariables().isEmpty()
                    ? null
                    : forEach.getVariable().getVariables().get(0).getNameAsString();
            out.add(new ForLoop(text(forEach), target, forEach.getIterable().toString(),
                    convertBody(forEach.getBody()), beginLine(forEach), endLine(forEach)));
        } else if (stmt.isSwitchStmt()) {
            out.add(convertSwitch(stmt.asSwitchStmt()));
        } else if (stmt.isTryStmt()) {
            out.add(convertTry(stmt.asTryStmt()));
        } else if (stmt.isReturnStmt()) {
            out.add(new ReturnStatement(text(stmt), beginLine(stmt), endLine(stmt)));
        } else {
            StatementKind kind = stmt.isExpressionStmt() || stmt.isThrowStmt() || stmt.isBreakStmt()
                    || stmt.isContinueStmt() ? StatementKind.SIMPLE : StatementKind.OTHER;
            out.add(new SimpleStatement(text(stmt), kind, beginLine(stmt), endLine(stmt)));
        }
    }

    private ConditionalStatement convertIf(IfStmt ifStmt) {
        List<SourceStatement> elseBlock = ifStmt.getElseStmt()
                .map(this::convertBody)
                .orElse(null);
        return new ConditionalStatement(text(ifStmt), ifStmt.getCondition().toString(),
                convertBody(ifStmt.getThenStmt()), elseBlock, beginLine(ifStmt), endLine(ifStmt));
    }

    private ForLoop convertFor(ForStmt forStmt) {
        String header = "for ("
                + joined(forStmt.getInitialization()) + "; "
                + forStmt.getCompare().map(Expression::toString).orElse("") + "; "
                + joined(forStmt.getUpdate()) + ")";
        return new ForLoop(text(forStmt), null, null, header, convertBody(forStmt.getBody()),
                beginLine(forStmt), endLine(forStmt));
    }

    private MatchStatement convertSwitch(SwitchStmt switchStmt) {
        List<MatchCase> cases = new ArrayList<>();
        for (SwitchEntry entry : switchStmt.getEntries()) {
            String pattern = entry.getLabels().isEmpty() ? "default" : joined(entry.getLabels());
            cases.add(new MatchCase(pattern, beginLine(entry), convertBlock(entry.getStatements())));
        }
        return new MatchStatement(text(switchStmt), switchStmt.getSelector().toString(), cases,
                beginLine(switchStmt), endLine(switchStmt));
    }

    private TryStatement convertTry(TryStmt tryStmt) {
        List<ExceptHandler> handlers = new ArrayList<>();
        for (CatchClause clause : tryStmt.getCatchClauses()) {
            handlers.add(new ExceptHandler(clause.getParameter().getType().asString(),
                    clause.getParameter().getNameAsString(), beginLine(clause),
                    convertBlock(clause.getBody().getStatements())));
        }
        List<SourceStatement> finallyBody = tryStmt.getFinallyBlock()
                .map(block -> convertBlock(block.getStatements()))
                .orElse(null);
        int finallyLine = tryStmt.getFinallyBlock().map(JavaMethodReader::beginLine).orElse(0);
        return new TryStatement(text(tryStmt), convertBlock(tryStmt.getTryBlock().getStatements()),
                handlers, finallyBody, finallyLine, beginLine(tryStmt), endLine(tryStmt));
    }

    private static String joined(List<? extends Node> nodes) {
        return nodes.stream().map(Node::toString).collect(Collectors.joining(", "));
    }

    private static String text(Node node) {
        return node.toString().replace("\n", " ").replaceAll("\\s+", " ").trim();
    }

    private static int beginLine(Node node) {
        return node.getBegin().map(position -> position.line).orElse(0);
    }

    private static int endLine(Node node) {
        return node.getEnd().map(position -> position.line).orElse(0);
    }
}
