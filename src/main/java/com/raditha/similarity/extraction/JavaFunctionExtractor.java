package com.raditha.similarity.extraction;

import com.github.javaparser.JavaParser;
import com.github.javaparser.JavaToken;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import com.raditha.similarity.model.AstNode;
import com.raditha.similarity.model.FunctionInfo;
import com.raditha.similarity.model.FunctionMetrics;
import com.raditha.similarity.model.FunctionSignature;
import com.raditha.similarity.model.LineRange;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts {@link FunctionInfo} records from Java source files.
 * <p>
 * Every method and constructor with a body becomes one function. Parameters,
 * local variables, lambda parameters and catch parameters are marked as
 * locals so they are renamed during canonicalization; method, field and type
 * names are kept verbatim.
 */
public class JavaFunctionExtractor {

    private final JavaParser parser;

    public JavaFunctionExtractor() {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(configuration);
    }

    /**
     * Parse source text and extract its functions.
     *
     * @param source   Java source code
     * @param filePath Path recorded on every function
     * @throws IllegalArgumentException if the source does not parse
     */
    public List<FunctionInfo> extract(String source, String filePath) {
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new IllegalArgumentException("Cannot parse " + filePath + ": " + result.getProblems());
        }
        return extract(result.getResult().get(), filePath);
    }

    /**
     * Extract all functions of a compilation unit.
     *
     * @param cu       Compilation unit to extract from
     * @param filePath Path recorded on every function
     * @return functions in source order
     */
    public List<FunctionInfo> extract(CompilationUnit cu, String filePath) {
        List<FunctionInfo> functions = new ArrayList<>();
        cu.accept(new CallableVisitor(functions, filePath), null);
        return functions;
    }

    /**
     * Visitor to extract a function from each method and constructor.
     */
    private class CallableVisitor extends VoidVisitorAdapter<Void> {
        private final List<FunctionInfo> functions;
        private final String filePath;

        CallableVisitor(List<FunctionInfo> functions, String filePath) {
            this.functions = functions;
            this.filePath = filePath;
        }

        @Override
        public void visit(MethodDeclaration method, Void arg) {
            super.visit(method, arg);
            // Skip methods without body (abstract, interface methods)
            method.getBody().ifPresent(body ->
                    functions.add(createFunction(method, body, method.getType().asString(), filePath)));
        }

        @Override
        public void visit(ConstructorDeclaration constructor, Void arg) {
            super.visit(constructor, arg);
            functions.add(createFunction(constructor, constructor.getBody(), constructor.getNameAsString(), filePath));
        }
    }

    private FunctionInfo createFunction(CallableDeclaration<?> declaration, BlockStmt body, String returnType,
                                        String filePath) {
        Range range = declaration.getRange()
                .orElseThrow(() -> new IllegalStateException("Declaration missing range"));
        LineRange lines = LineRange.from(range);

        List<String> parameterTypes = declaration.getParameters().stream()
                .map(p -> p.getType().asString() + (p.isVarArgs() ? "..." : ""))
                .toList();
        FunctionSignature signature = new FunctionSignature(declaration.getNameAsString(), parameterTypes, returnType);

        Set<String> locals = collectLocals(declaration, body);
        AstNode ast = convert(body, locals);

        String id = String.format("%s#%s(%s):%d", filePath, declaration.getNameAsString(),
                String.join(",", parameterTypes), lines.startLine());

        return new FunctionInfo(
                id,
                declaration.getNameAsString(),
                filePath,
                lines.startLine(),
                lines.endLine(),
                ast,
                tokensOf(declaration),
                signature,
                new FunctionMetrics(lines.getLineCount(), cyclomaticComplexity(body)));
    }

    /**
     * Names of parameters and every variable declared inside the body.
     */
    private Set<String> collectLocals(CallableDeclaration<?> declaration, BlockStmt body) {
        Set<String> locals = new HashSet<>();
        for (Parameter parameter : declaration.getParameters()) {
            locals.add(parameter.getNameAsString());
        }
        body.findAll(VariableDeclarator.class).forEach(v -> locals.add(v.getNameAsString()));
        body.findAll(Parameter.class).forEach(p -> locals.add(p.getNameAsString()));
        return locals;
    }

    /**
     * Convert a JavaParser subtree into the language neutral tree.
     */
    AstNode convert(Node node, Set<String> locals) {
        String kind = node.getClass().getSimpleName();

        if (node instanceof NameExpr nameExpr) {
            return identifier(nameExpr.getName(), locals, true);
        }
        if (node instanceof SimpleName simpleName) {
            Optional<Node> parent = simpleName.getParentNode();
            boolean declaresLocal = parent.isPresent()
                    && (parent.get() instanceof VariableDeclarator || parent.get() instanceof Parameter);
            return identifier(simpleName, locals, declaresLocal);
        }
        if (node instanceof LiteralExpr literal) {
            return AstNode.literal(kind, literalText(literal));
        }
        if (node instanceof Type type) {
            return AstNode.name(kind, type.asString());
        }
        if (node instanceof Name name) {
            return AstNode.name(kind, name.asString());
        }
        if (node instanceof Modifier modifier) {
            return AstNode.name(kind, modifier.getKeyword().asString());
        }

        List<AstNode> children = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (!(child instanceof Comment)) {
                children.add(convert(child, locals));
            }
        }
        return new AstNode(kind, operatorOf(node), AstNode.Role.NODE, children);
    }

    private static AstNode identifier(SimpleName name, Set<String> locals, boolean mayBeLocal) {
        String text = name.asString();
        if (mayBeLocal && locals.contains(text)) {
            return AstNode.local(text);
        }
        return AstNode.name("SimpleName", text);
    }

    private static String literalText(LiteralExpr literal) {
        if (literal instanceof LiteralStringValueExpr value) {
            return value.getValue();
        }
        if (literal instanceof BooleanLiteralExpr bool) {
            return String.valueOf(bool.getValue());
        }
        return literal.toString();
    }

    private static String operatorOf(Node node) {
        if (node instanceof BinaryExpr binary) {
            return binary.getOperator().asString();
        }
        if (node instanceof UnaryExpr unary) {
            return unary.getOperator().asString();
        }
        if (node instanceof AssignExpr assign) {
            return assign.getOperator().asString();
        }
        return null;
    }

    /**
     * Lexical tokens of the declaration, without whitespace and comments.
     */
    private static List<String> tokensOf(Node declaration) {
        List<String> tokens = new ArrayList<>();
        declaration.getTokenRange().ifPresent(range -> {
            for (JavaToken token : range) {
                if (!token.getCategory().isWhitespaceOrComment()) {
                    tokens.add(token.getText());
                }
            }
        });
        return tokens;
    }

    /**
     * McCabe complexity: one plus every decision point.
     */
    static int cyclomaticComplexity(BlockStmt body) {
        int decisions = body.findAll(IfStmt.class).size()
                + body.findAll(ForStmt.class).size()
                + body.findAll(ForEachStmt.class).size()
                + body.findAll(WhileStmt.class).size()
                + body.findAll(DoStmt.class).size()
                + body.findAll(CatchClause.class).size()
                + body.findAll(ConditionalExpr.class).size()
                + (int) body.findAll(SwitchEntry.class).stream().filter(e -> !e.getLabels().isEmpty()).count()
                + (int) body.findAll(BinaryExpr.class).stream()
                        .filter(b -> b.getOperator() == BinaryExpr.Operator.AND
                                || b.getOperator() == BinaryExpr.Operator.OR)
                        .count();
        return 1 + decisions;
    }
}
