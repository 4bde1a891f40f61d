package com.raditha.mwp.frontend;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.raditha.mwp.ast.Assignment;
import com.raditha.mwp.ast.BinaryOp;
import com.raditha.mwp.ast.Compound;
import com.raditha.mwp.ast.Constant;
import com.raditha.mwp.ast.For;
import com.raditha.mwp.ast.FunctionDef;
import com.raditha.mwp.ast.Identifier;
import com.raditha.mwp.ast.If;
import com.raditha.mwp.ast.UnaryOp;
import com.raditha.mwp.ast.While;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AstReducerTest {

    private AstReducer reducer;

    @BeforeEach
    void setUp() {
        reducer = new AstReducer();
    }

    private FunctionDef reduce(String source) {
        MethodDeclaration method = SourceParser.functions(SourceParser.parse(source)).get(0);
        return reducer.reduce(method);
    }

    private static Identifier id(String name) {
        return new Identifier(name);
    }

    @Test
    void testAssignments() {
        FunctionDef f = reduce("""
                void f(int x, int y) {
                    int z = x + y;
                    int w;
                    x += y;
                    y++;
                    z = -5;
                    z = (x);
                    w = x * 2;
                }
                """);

        assertEquals(List.of("x", "y"), f.parameters());
        assertEquals(List.of("w", "x", "y", "z"), f.variables());
        assertEquals(List.of(
                new Assignment("z", new BinaryOp("+", id("x"), id("y"))),
                new Assignment("x", new BinaryOp("+", id("x"), id("y"))),
                new UnaryOp("++", id("y")),
                new Assignment("z", new Constant("-5")),
                new Assignment("z", id("x")),
                new Assignment("w", new BinaryOp("*", id("x"), new Constant("2")))), f.body().statements());
        assertTrue(reducer.coverage().isFull());
    }

    @Test
    void testUnaryValue() {
        FunctionDef f = reduce("void f(int x) { x = -x; }");
        assertEquals(List.of(new Assignment("x", new UnaryOp("-", id("x")))), f.body().statements());
    }

    @Test
    void testStepValueIsAddition() {
        FunctionDef f = reduce("""
                void f(int x, int y) {
                    x = y++;
                    x = --y;
                    int z = (y--);
                }
                """);

        assertEquals(List.of(
                new Assignment("x", new BinaryOp("+", id("y"), new Constant("1"))),
                new Assignment("x", new BinaryOp("-", id("y"), new Constant("1"))),
                new Assignment("z", new BinaryOp("-", id("y"), new Constant("1")))), f.body().statements());
        assertTrue(reducer.coverage().isFull());
    }

    @Test
    void testOmittedConstructsAreCounted() {
        FunctionDef f = reduce("""
                void f(int x, int y) {
                    x = x / y;
                    foo(x);
                    x %= 2;
                    x = x + y + 1;
                    return;
                }
                """);

        assertTrue(f.body().isEmpty());
        assertFalse(f.hasBody());
        SyntaxCoverage coverage = reducer.coverage();
        assertEquals(2, coverage.count("assignment of BinaryExpr"));
        assertEquals(1, coverage.count("MethodCallExpr"));
        assertEquals(1, coverage.count("compound assignment %="));
        assertEquals(3, coverage.omitted().size());
    }

    @Test
    void testControlFlow() {
        FunctionDef f = reduce("""
                void f(int x, int y, int n) {
                    if (x > y) x = x - y; else { y = y - x; }
                    while (x > 0) { x--; break; }
                    do { y = x; } while (y > 0);
                    for (int i = 0; i < n; i++) { x = y; }
                }
                """);
        List<?> statements = f.body().statements();

        assertEquals(new If("x > y",
                Compound.of(new Assignment("x", new BinaryOp("-", id("x"), id("y")))),
                Compound.of(new Assignment("y", new BinaryOp("-", id("y"), id("x"))))), statements.get(0));
        assertEquals(new While("x > 0", Compound.of(new UnaryOp("--", id("x")))), statements.get(1));
        assertEquals(new While("y > 0", Compound.of(new Assignment("y", id("x")))), statements.get(2));

        For loop = (For) statements.get(3);
        assertTrue(loop.compatible());
        assertEquals("n", loop.controlVariable());
        assertEquals(Compound.of(new Assignment("x", id("y"))), loop.body());
        assertTrue(reducer.coverage().isFull());
    }

    @Test
    void testIfWithoutElse() {
        FunctionDef f = reduce("void f(int x) { if (x > 0) x = 1; }");
        If branch = (If) f.body().statements().get(0);
        assertTrue(branch.elseBranch().isEmpty());
    }

    @Test
    void testIncompatibleForLoop() {
        FunctionDef f = reduce("void f(int n) { int i; for (i = 0; i < n; i++) { n = n + 1; } }");
        For loop = (For) f.body().statements().get(0);

        assertFalse(loop.compatible());
        assertNull(loop.controlVariable());
        assertEquals(1, reducer.coverage().count("incompatible for loop"));
    }

    @Test
    void testFunctionWithoutBody() {
        FunctionDef f = reduce("abstract void f(int x);");
        assertNull(f.body());
        assertFalse(f.hasBody());
        assertEquals(List.of("x"), f.variables());
    }
}
