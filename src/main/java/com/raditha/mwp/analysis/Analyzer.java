package com.raditha.mwp.analysis;

import com.raditha.mwp.algebra.Polynomial;
import com.raditha.mwp.algebra.Scalar;
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
import com.raditha.mwp.choice.Choices;
import com.raditha.mwp.config.AnalysisConfig;
import com.raditha.mwp.relation.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Translates a function into its mwp relation.
 * <p>
 * Each statement yields a relation. Statements in sequence are composed,
 * branches are summed and loop bodies are closed under the fixpoint followed by
 * the loop correction. Every binary assignment between variables consumes one
 * choice index. The choice counter belongs to a single call to
 * {@link #analyze(FunctionDef, int)}, so concurrent analyses do not interfere.
 */
public class Analyzer {

    private static final Logger logger = LoggerFactory.getLogger(Analyzer.class);

    private final AnalysisConfig config;

    /**
     * Create analyzer with default configuration.
     */
    public Analyzer() {
        this(AnalysisConfig.defaults());
    }

    /**
     * Create analyzer with custom configuration.
     */
    public Analyzer(AnalysisConfig config) {
        this.config = config;
    }

    public AnalysisConfig config() {
        return config;
    }

    /**
     * Choice counter for one analysis run.
     */
    private static final class Run {
        private int index;

        Run(int startIndex) {
            this.index = startIndex;
        }

        int next() {
            return index++;
        }
    }

    public AnalysisResult analyze(FunctionDef function) {
        return analyze(function, 0);
    }

    /**
     * Analyze one function.
     *
     * @param function   the function, with its collected variables
     * @param startIndex first choice index to use
     * @return the relation, the next free index and, if enabled, the safe choices
     * @throws IllegalArgumentException if the function has no body to analyze
     */
    public AnalysisResult analyze(FunctionDef function, int startIndex) {
        if (!function.hasBody()) {
            throw new IllegalArgumentException("Function " + function.name() + " has no analyzable body");
        }
        logger.debug("Analysing {} over {}", function.name(), function.variables());

        Run run = new Run(startIndex);
        Relation relation = Relation.identity(function.variables());
        boolean stoppedEarly = false;

        // Step 1: compose the statements of the body
        for (Node statement : function.body().statements()) {
            relation = relation.compose(translate(statement, run));
            if (config.stopOnInfinity() && relation.hasInfinity() && unconditionallyInfinite(relation)) {
                logger.info("{}: infinity is unconditional, stopping early", function.name());
                stoppedEarly = true;
                break;
            }
        }

        // Step 2: derive the safe choices
        Choices choices = null;
        boolean infinite = stoppedEarly;
        if (stoppedEarly) {
            choices = Choices.infinite(Choices.DEFAULT_DOMAIN, run.index);
        } else if (config.evaluate()) {
            choices = Choices.generate(Choices.DEFAULT_DOMAIN, run.index, relation.infinityWitnesses(),
                    config.reduction());
            infinite = choices.infinite();
        }
        return new AnalysisResult(function.name(), relation, startIndex, run.index, choices, infinite, stoppedEarly);
    }

    private boolean unconditionallyInfinite(Relation relation) {
        return config.reduction().reducer()
                .minimize(Choices.DEFAULT_DOMAIN, relation.infinityWitnesses())
                .contains(List.of());
    }

    /**
     * Relation of a single statement.
     */
    private Relation translate(Node node, Run run) {
        if (node instanceof Assignment assignment) {
            return assignment(assignment, run);
        } else if (node instanceof UnaryOp unary && unary.isIncrementOrDecrement()
                && unary.operand() instanceof Identifier id) {
            String op = "++".equals(unary.operator()) ? "+" : "-";
            return assignment(new Assignment(id.name(), new BinaryOp(op, id, new Constant("1"))), run);
        } else if (node instanceof If branch) {
            return sequence(branch.thenBranch(), run).sum(sequence(branch.elseBranch(), run));
        } else if (node instanceof While whileLoop) {
            return loop(whileLoop.body(), run);
        } else if (node instanceof For forLoop) {
            if (forLoop.compatible()) {
                return loop(forLoop.body(), run);
            }
            logger.warn("Skipping for loop without a single control variable: {}", forLoop.header());
            return Relation.empty();
        } else if (node instanceof Compound block) {
            return sequence(block, run);
        }
        logger.warn("Unsupported statement reached analysis, it should have been filtered: {}", node);
        return Relation.empty();
    }

    private Relation sequence(Compound block, Run run) {
        Relation relation = Relation.empty();
        for (Node statement : block.statements()) {
            relation = relation.compose(translate(statement, run));
        }
        return relation;
    }

    private Relation loop(Compound body, Run run) {
        return sequence(body, run)
                .fixpoint(config.fixpointIterationLimit())
                .whileCorrection();
    }

    private Relation assignment(Assignment assignment, Run run) {
        String target = assignment.target();
        Node value = assignment.value();
        if (value instanceof Constant) {
            return Relation.zero(List.of(target));
        } else if (value instanceof Identifier source) {
            return copy(target, source.name(), run);
        } else if (value instanceof UnaryOp) {
            return Relation.identity(List.of(target));
        } else if (value instanceof BinaryOp binary) {
            return binary(target, binary, run);
        }
        logger.warn("Unsupported assignment to {}: {}", target, value);
        return Relation.empty();
    }

    /**
     * {@code x = y}: x takes the value of y and loses its own. A copy between
     * distinct variables consumes a choice index, {@code x = x} does not.
     */
    private static Relation copy(String target, String source, Run run) {
        if (target.equals(source)) {
            return Relation.empty();
        }
        run.next();
        List<String> variables = List.of(target, source);
        return Relation.replaceColumn(variables, List.of(Polynomial.ZERO, Polynomial.UNIT), target);
    }

    private Relation binary(String target, BinaryOp binary, Run run) {
        String op = binary.operator();
        if (!"+".equals(op) && !"-".equals(op) && !"*".equals(op)) {
            logger.warn("Unsupported operator {} in assignment to {}", op, target);
            return Relation.empty();
        }
        if (!isOperand(binary.left()) || !isOperand(binary.right())) {
            logger.warn("Unsupported operands in assignment to {}: {}", target, binary);
            return Relation.empty();
        }
        String left = binary.left() instanceof Identifier l ? l.name() : null;
        String right = binary.right() instanceof Identifier r ? r.name() : null;
        if (left == null && right == null) {
            return Relation.zero(List.of(target));
        }

        int index = run.next();
        List<String> operands = new ArrayList<>();
        List<Polynomial> rows = new ArrayList<>();
        if (left == null || right == null) {
            operands.add(left != null ? left : right);
            rows.add(Polynomial.fromScalars(index, Scalar.M, Scalar.M, Scalar.M));
        } else if ("*".equals(op)) {
            operands.add(left);
            rows.add(Polynomial.fromScalars(index, Scalar.W, Scalar.W, Scalar.W));
            if (!left.equals(right)) {
                operands.add(right);
                rows.add(Polynomial.fromScalars(index, Scalar.W, Scalar.W, Scalar.W));
            }
        } else if (left.equals(right)) {
            operands.add(left);
            rows.add(Polynomial.fromScalars(index, Scalar.W, Scalar.P, Scalar.W));
        } else {
            operands.add(left);
            rows.add(Polynomial.fromScalars(index, Scalar.W, Scalar.M, Scalar.P));
            operands.add(right);
            rows.add(Polynomial.fromScalars(index, Scalar.W, Scalar.P, Scalar.M));
        }
        return column(target, operands, rows);
    }

    /**
     * Identity relation over the target and its operands with the target's column
     * built from the operand rows; the target's own row is zero unless it is an operand.
     */
    private static Relation column(String target, List<String> operands, List<Polynomial> rows) {
        Set<String> ordered = new LinkedHashSet<>();
        ordered.add(target);
        ordered.addAll(operands);
        List<String> variables = List.copyOf(ordered);
        List<Polynomial> vector = new ArrayList<>(variables.size());
        for (String variable : variables) {
            int k = operands.indexOf(variable);
            vector.add(k >= 0 ? rows.get(k) : Polynomial.ZERO);
        }
        return Relation.replaceColumn(variables, vector, target);
    }

    private static boolean isOperand(Node node) {
        return node instanceof Identifier || node instanceof Constant;
    }
}
