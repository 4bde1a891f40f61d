package com.raditha.mwp.frontend;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.body.MethodDeclaration;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VariableCollectorTest {

    @Test
    void testParametersLocalsAndNames() {
        MethodDeclaration method = SourceParser.functions(SourceParser.parse(
                "void f(int b, int a) { int d; c = a + b; while (e > 0) { d = 1; } }")).get(0);
        assertEquals(List.of("a", "b", "c", "d", "e"), VariableCollector.collect(method));
    }

    @Test
    void testUnusedParameterIsKept() {
        MethodDeclaration method = SourceParser.functions(SourceParser.parse("void f(int z) { }")).get(0);
        assertEquals(List.of("z"), VariableCollector.collect(method));
    }

    @Test
    void testExpression() {
        assertEquals(Set.of("x", "y"), VariableCollector.collect(StaticJavaParser.parseExpression("x < y + 1")));
    }
}
