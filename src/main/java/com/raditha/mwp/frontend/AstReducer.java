package com.raditha.mwp.frontend;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.raditha.mwp.ast.Assignment;
import com.raditha.mwp.ast.BinaryOp;
import com.raditha.mwp.ast.Compound;
import com.raditha.mwp.ast.Constant;
import com.raditha.mwp.ast.For;
import com.raditha.mwp.ast.FunctionDef;
import com.raditha.mwp.ast.Identifier;
import com.raditha.mwp.ast.If;
import com.raditha.mwp.ast.Node;
import com.raditha.mwp.ast.UnaryOp;
import com.raditha.mwp.ast.While;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a parsed function onto the reduced grammar.
 * <ul>
 * <li>{@code int x;} is dropped and {@code int x = e;} becomes {@code x = e}</li>
 * <li>{@code x op= e} becomes {@code x = x op e}</li>
 * <li>{@code do ... while} is analysed as {@code while}</li>
 * <li>{@code break}, {@code continue}, {@code return} and empty statements are skipped</li>
 * </ul>
 * Anything else is left out and counted in the {@link SyntaxCoverage}.
 */
public class AstReducer {

    private static final Logger logger = LoggerFactory.getLogger(AstReducer.class);

    private static final Map<AssignExpr.Operator, String> COMPOUND_OPERATORS = Map.of(
            AssignExpr.Operator.PLUS, "+",
            AssignExpr.Operator.MINUS, "-",
            AssignExpr.Operator.MULTIPLY, "*");

    private static final List<String> ARITHMETIC = List.of("+", "-", "*");

    private final SyntaxCoverage coverage = new SyntaxCoverage();

    public SyntaxCoverage coverage() {
        return coverage;
    }

    /**
     * Reduce a function. A function without a body keeps a null body.
     */
    public FunctionDef reduce(MethodDeclaration method) {
        List<String> parameters = method.getParameters().stream().map(p -> p.getNameAsString()).toList();
        Compound body = method.getBody().map(this::block).orElse(null);
        logger.debug("Reduced {} to {}", method.getNameAsString(), body);
        return new FunctionDef(method.getNameAsString(), parameters, VariableCollector.collect(method), body);
    }

    private Compound block(Statement statement) {
        List<Node> nodes = new ArrayList<>();
        if (statement instanceof BlockStmt block) {
            block.getStatements().forEach(s -> nodes.addAll(statement(s)));
        } else {
            nodes.addAll(statement(statement));
        }
        return new Compound(nodes);
    }

    private List<Node> statement(Statement statement) {
        if (statement instanceof BlockStmt block) {
            return List.of(block(block));
        } else if (statement instanceof ExpressionStmt expressionStmt) {
            return expressionStatement(expressionStmt.getExpression());
        } else if (statement instanceof IfStmt ifStmt) {
            Compound otherwise = ifStmt.getElseStmt().map(this::block).orElse(Compound.EMPTY);
            return List.of(new If(ifStmt.getCondition().toString(), block(ifStmt.getThenStmt()), otherwise));
        } else if (statement instanceof WhileStmt whileStmt) {
            return List.of(new While(whileStmt.getCondition().toString(), block(whileStmt.getBody())));
        } else if (statement instanceof DoStmt doStmt) {
            return List.of(new While(doStmt.getCondition().toString(), block(doStmt.getBody())));
        } else if (statement instanceof ForStmt forStmt) {
            return List.of(forLoop(forStmt));
        } else if (statement.isBreakStmt() || statement.isContinueStmt()
                || statement.isReturnStmt() || statement.isEmptyStmt()) {
            return List.of();
        }
        coverage.omit(statement.getClass().getSimpleName());
        return List.of();
    }

    private Node forLoop(ForStmt loop) {
        String header = "for (" + loop.getInitialization() + "; "
                + loop.getCompare().map(Expression::toString).orElse("") + "; " + loop.getUpdate() + ")";
        Optional<String> control = LoopCompatibility.controlVariable(loop);
        if (control.isEmpty()) {
            coverage.omit("incompatible for loop");
        }
        return new For(header, block(loop.getBody()), control.isPresent(), control.orElse(null));
    }

    private List<Node> expressionStatement(Expression expression) {
        if (expression.isVariableDeclarationExpr()) {
            List<Node> nodes = new ArrayList<>();
            for (VariableDeclarator v : expression.asVariableDeclarationExpr().getVariables()) {
                v.getInitializer().ifPresent(init -> assignment(v.getNameAsString(), init).ifPresent(nodes::add));
            }
            return nodes;
        } else if (expression.isAssignExpr()) {
            AssignExpr assign = expression.asAssignExpr();
            if (!assign.getTarget().isNameExpr()) {
                coverage.omit("assignment to " + assign.getTarget().getClass().getSimpleName());
                return List.of();
            }
            String target = assign.getTarget().asNameExpr().getNameAsString();
            if (assign.getOperator() == AssignExpr.Operator.ASSIGN) {
                return assignment(target, assign.getValue()).map(List::of).orElse(List.of());
            }
            String op = COMPOUND_OPERATORS.get(assign.getOperator());
            Optional<Node> operand = operand(assign.getValue());
            if (op == null || operand.isEmpty()) {
                coverage.omit("compound assignment " + assign.getOperator().asString());
                return List.of();
            }
            return List.of(new Assignment(target, new BinaryOp(op, new Identifier(target), operand.get())));
        } else if (expression.isUnaryExpr()) {
            UnaryExpr unary = expression.asUnaryExpr();
            if (unary.getExpression().isNameExpr() && isStep(unary)) {
                String op = unary.getOperator() == UnaryExpr.Operator.PREFIX_INCREMENT
                        || unary.getOperator() == UnaryExpr.Operator.POSTFIX_INCREMENT ? "++" : "--";
                return List.of(new UnaryOp(op, new Identifier(unary.getExpression().asNameExpr().getNameAsString())));
            }
        }
        coverage.omit(expression.getClass().getSimpleName());
        return List.of();
    }

    private Optional<Node> assignment(String target, Expression value) {
        Optional<Node> reduced = value(value);
        if (reduced.isEmpty()) {
            coverage.omit("assignment of " + unwrap(value).getClass().getSimpleName());
        }
        return reduced.map(v -> (Node) new Assignment(target, v));
    }

    /**
     * Right hand side of an assignment: an operand, a unary operation on an
     * operand, or an arithmetic operation on two operands.
     */
    private Optional<Node> value(Expression expression) {
        Expression e = unwrap(expression);
        if (e instanceof BinaryExpr binary) {
            String op = binary.getOperator().asString();
            Optional<Node> left = operand(binary.getLeft());
            Optional<Node> right = operand(binary.getRight());
            if (!ARITHMETIC.contains(op) || left.isEmpty() || right.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new BinaryOp(op, left.get(), right.get()));
        }
        if (e instanceof UnaryExpr unary && isStep(unary)) {
            // x = y++ reads as x = y + 1
            Expression inner = unwrap(unary.getExpression());
            if (!inner.isNameExpr()) {
                return Optional.empty();
            }
            String op = unary.getOperator() == UnaryExpr.Operator.PREFIX_INCREMENT
                    || unary.getOperator() == UnaryExpr.Operator.POSTFIX_INCREMENT ? "+" : "-";
            return Optional.of(new BinaryOp(op, new Identifier(inner.asNameExpr().getNameAsString()),
                    new Constant("1")));
        }
        if (e instanceof UnaryExpr unary) {
            Expression inner = unwrap(unary.getExpression());
            if (unary.getOperator() == UnaryExpr.Operator.MINUS && inner.isIntegerLiteralExpr()) {
                return Optional.of(new Constant("-" + inner));
            }
            return operand(inner).map(o -> new UnaryOp(unary.getOperator().asString(), o));
        }
        return operand(e);
    }

    /**
     * A variable or an integral constant.
     */
    private Optional<Node> operand(Expression expression) {
        Expression e = unwrap(expression);
        if (e.isNameExpr()) {
            return Optional.of(new Identifier(e.asNameExpr().getNameAsString()));
        }
        if (e.isIntegerLiteralExpr() || e.isLongLiteralExpr() || e.isCharLiteralExpr() || e.isBooleanLiteralExpr()) {
            return Optional.of(new Constant(e.toString()));
        }
        return Optional.empty();
    }

    private static boolean isStep(UnaryExpr unary) {
        UnaryExpr.Operator op = unary.getOperator();
        return op == UnaryExpr.Operator.PREFIX_INCREMENT || op == UnaryExpr.Operator.POSTFIX_INCREMENT
                || op == UnaryExpr.Operator.PREFIX_DECREMENT || op == UnaryExpr.Operator.POSTFIX_DECREMENT;
    }

    private static Expression unwrap(Expression expression) {
        Expression e = expression;
        while (e.isEnclosedExpr()) {
            e = e.asEnclosedExpr().getInner();
        }
        return e;
    }
}
