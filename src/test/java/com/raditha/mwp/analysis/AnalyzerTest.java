package com.raditha.mwp.analysis;

import com.raditha.mwp.algebra.Monomial;
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
import com.raditha.mwp.ast.Unsupported;
import com.raditha.mwp.ast.While;
import com.raditha.mwp.choice.ReductionStrategy;
import com.raditha.mwp.config.AnalysisConfig;
import com.raditha.mwp.relation.Relation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzerTest {

    private Analyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new Analyzer();
    }

    private static Node assign(String target, Node value) {
        return new Assignment(target, value);
    }

    private static Node binary(String op, String left, String right) {
        return new BinaryOp(op, new Identifier(left), new Identifier(right));
    }

    private static FunctionDef function(List<String> variables, Node... statements) {
        return new FunctionDef("f", variables, variables, Compound.of(statements));
    }

    @Test
    void testDoublingHasWeakPolyWeakDiagonal() {
        AnalysisResult result = analyzer.analyze(function(List.of("X1"), assign("X1", binary("+", "X1", "X1"))));

        assertEquals(Polynomial.fromScalars(0, Scalar.W, Scalar.P, Scalar.W), result.relation().get("X1", "X1"));
        assertEquals(1, result.index());
        assertFalse(result.infinite());
        assertEquals(List.of(List.of(0, 1, 2)), result.choices().allowed());
    }

    @Test
    void testDistinctOperandsUseBothPatterns() {
        AnalysisResult result = analyzer.analyze(
                function(List.of("x", "y", "z"), assign("x", binary("+", "y", "z"))));
        Relation r = result.relation();

        assertEquals(Polynomial.fromScalars(0, Scalar.W, Scalar.M, Scalar.P), r.get("y", "x"));
        assertEquals(Polynomial.fromScalars(0, Scalar.W, Scalar.P, Scalar.M), r.get("z", "x"));
        assertTrue(r.get("x", "x").isZero(), "x is overwritten");
        assertEquals(Polynomial.UNIT, r.get("y", "y"));
    }

    @Test
    void testOperandRowsFollowNamesNotPositions() {
        // x = y + x: the pattern of the left operand belongs to y
        AnalysisResult result = analyzer.analyze(function(List.of("x", "y"), assign("x", binary("+", "y", "x"))));

        assertEquals(Polynomial.fromScalars(0, Scalar.W, Scalar.M, Scalar.P), result.relation().get("y", "x"));
        assertEquals(Polynomial.fromScalars(0, Scalar.W, Scalar.P, Scalar.M), result.relation().get("x", "x"));
    }

    @Test
    void testMultiplication() {
        AnalysisResult result = analyzer.analyze(function(List.of("x", "y"),
                assign("x", binary("*", "x", "y")),
                assign("y", binary("*", "y", "y"))));
        Polynomial weak0 = Polynomial.fromScalars(0, Scalar.W, Scalar.W, Scalar.W);

        assertEquals(weak0, result.relation().get("x", "x"));
        assertEquals(weak0, result.relation().get("y", "x"));
        assertEquals(2, result.index());
    }

    @Test
    void testConstantOperandIsMaximal() {
        AnalysisResult result = analyzer.analyze(function(List.of("x", "y"),
                assign("x", new BinaryOp("+", new Identifier("y"), new Constant("1")))));

        assertEquals(Polynomial.fromScalars(0, Scalar.M, Scalar.M, Scalar.M), result.relation().get("y", "x"));
        assertEquals(1, result.index());
    }

    @Test
    void testConstantAssignment() {
        AnalysisResult result = analyzer.analyze(function(List.of("x", "y"),
                assign("x", new Constant("5")),
                assign("y", new BinaryOp("*", new Constant("2"), new Constant("3")))));

        assertTrue(result.relation().get("x", "x").isZero());
        assertTrue(result.relation().get("y", "y").isZero());
        assertEquals(0, result.index(), "constant assignments consume no choice");
    }

    @Test
    void testCopyAssignment() {
        AnalysisResult result = analyzer.analyze(function(List.of("x", "y"), assign("x", new Identifier("y"))));

        assertEquals(Polynomial.UNIT, result.relation().get("y", "x"));
        assertTrue(result.relation().get("x", "x").isZero());
        assertEquals(1, result.index());
    }

    @Test
    void testCopyConsumesChoiceIndex() {
        AnalysisResult result = analyzer.analyze(function(List.of("a", "b", "x", "y", "z"),
                assign("x", new Identifier("y")),
                assign("z", binary("+", "a", "b"))));

        assertEquals(2, result.index());
        assertEquals(Polynomial.fromScalars(1, Scalar.W, Scalar.M, Scalar.P), result.relation().get("a", "z"));
        assertEquals(Polynomial.fromScalars(1, Scalar.W, Scalar.P, Scalar.M), result.relation().get("b", "z"));
    }

    @Test
    void testSelfCopyAndUnaryAreIdentity() {
        AnalysisResult result = analyzer.analyze(function(List.of("x", "y"),
                assign("x", new Identifier("x")),
                assign("y", new UnaryOp("-", new Identifier("y")))));

        assertEquals(Relation.identity(List.of("x", "y")), result.relation());
        assertEquals(0, result.index());
    }

    @Test
    void testIncrementStatement() {
        AnalysisResult result = analyzer.analyze(function(List.of("x"), new UnaryOp("++", new Identifier("x"))));

        assertEquals(Polynomial.fromScalars(0, Scalar.M, Scalar.M, Scalar.M), result.relation().get("x", "x"));
    }

    @Test
    void testUnsupportedOperatorAndNodeAreNoOps() {
        AnalysisResult result = analyzer.analyze(function(List.of("x", "y"),
                assign("x", binary("/", "x", "y")),
                new Unsupported("call to foo")));

        assertEquals(Relation.identity(List.of("x", "y")), result.relation());
        assertEquals(0, result.index());
    }

    @Test
    void testIfSumsBranches() {
        Node branch = new If("x > 0",
                Compound.of(assign("x", binary("+", "x", "y"))),
                Compound.EMPTY);
        AnalysisResult result = analyzer.analyze(function(List.of("x", "y"), branch));

        Polynomial diagonal = result.relation().get("x", "x");
        assertTrue(diagonal.monomials().contains(new Monomial(Scalar.M)), "else path keeps x");
        assertEquals(4, diagonal.monomials().size());
        assertEquals(1, result.index());
    }

    @Test
    void testWhileLoopIsInfinite() {
        Node loop = new While("X0 > 0", Compound.of(assign("X0", binary("+", "X0", "X1"))));
        AnalysisResult result = analyzer.analyze(function(List.of("X0", "X1"), loop));

        assertTrue(result.relation().get("X0", "X0").hasInfinity());
        assertTrue(result.infinite());
        assertEquals(List.of(List.of()), result.choices().allowed());
    }

    @Test
    void testCompatibleForLoopIsAnalysedLikeWhile() {
        Compound body = Compound.of(assign("x", binary("+", "x", "y")));
        Relation viaFor = analyzer.analyze(function(List.of("n", "x", "y"),
                new For("for (i = 0; i < n; i++)", body, true, "n"))).relation();
        Relation viaWhile = analyzer.analyze(function(List.of("n", "x", "y"),
                new While("i < n", body))).relation();

        assertEquals(viaWhile, viaFor);
    }

    @Test
    void testIncompatibleForLoopIsSkipped() {
        Compound body = Compound.of(assign("x", binary("+", "x", "y")));
        AnalysisResult result = analyzer.analyze(function(List.of("x", "y"),
                new For("for (;;)", body, false, null)));

        assertEquals(Relation.identity(List.of("x", "y")), result.relation());
        assertEquals(0, result.index());
    }

    @Test
    void testIndicesContinueFromStart() {
        AnalysisResult result = analyzer.analyze(function(List.of("x"), assign("x", binary("+", "x", "x"))), 5);

        assertEquals(5, result.startIndex());
        assertEquals(6, result.index());
        assertEquals(Polynomial.fromScalars(5, Scalar.W, Scalar.P, Scalar.W), result.relation().get("x", "x"));
    }

    @Test
    void testRunsAreIndependent() {
        FunctionDef f = function(List.of("x"), assign("x", binary("+", "x", "x")));
        assertEquals(analyzer.analyze(f), analyzer.analyze(f));
    }

    @Test
    void testStopOnInfinity() {
        Node loop = new While("X0 > 0", Compound.of(assign("X0", binary("+", "X0", "X1"))));
        Node after = assign("X1", binary("+", "X1", "X1"));
        AnalysisConfig config = new AnalysisConfig(100, ReductionStrategy.SET, true, true, false, "output");

        AnalysisResult stopped = new Analyzer(config).analyze(function(List.of("X0", "X1"), loop, after));
        AnalysisResult full = analyzer.analyze(function(List.of("X0", "X1"), loop, after));

        assertTrue(stopped.stoppedEarly());
        assertTrue(stopped.infinite());
        assertEquals(1, stopped.index());
        assertEquals(2, full.index());
        assertFalse(full.stoppedEarly());
    }

    @Test
    void testEvaluationCanBeSkipped() {
        AnalysisResult result = new Analyzer(AnalysisConfig.fast())
                .analyze(function(List.of("x"), assign("x", binary("+", "x", "x"))));
        assertFalse(result.evaluated());
        assertFalse(result.infinite());
        assertNotNull(result.relation());
    }

    @Test
    void testEmptyBodyIsUnanalyzable() {
        FunctionDef empty = new FunctionDef("g", List.of(), List.of(), Compound.EMPTY);
        FunctionDef absent = new FunctionDef("h", List.of(), List.of(), null);
        assertThrows(IllegalArgumentException.class, () -> analyzer.analyze(empty));
        assertThrows(IllegalArgumentException.class, () -> analyzer.analyze(absent));
    }

    @Test
    void testFixpointLimitIsEnforced() {
        Node loop = new While("X0 > 0", Compound.of(assign("X0", binary("+", "X0", "X1"))));
        AnalysisConfig config = new AnalysisConfig(1, ReductionStrategy.SET, true, false, false, "output");
        Analyzer limited = new Analyzer(config);
        FunctionDef f = function(List.of("X0", "X1"), loop);
        assertThrows(IllegalStateException.class, () -> limited.analyze(f));
    }
}
