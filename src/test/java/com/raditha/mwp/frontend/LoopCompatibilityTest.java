package com.raditha.mwp.frontend;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.stmt.ForStmt;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LoopCompatibilityTest {

    private static Optional<String> control(String loop) {
        ForStmt stmt = StaticJavaParser.parseStatement(loop).asForStmt();
        return LoopCompatibility.controlVariable(stmt);
    }

    @Test
    void testCountingUp() {
        assertEquals(Optional.of("n"), control("for (i = 0; i < n; i++) { x = x + y; }"));
        assertEquals(Optional.of("n"), control("for (int i = 0; i < n; i++) x++;"));
    }

    @Test
    void testCountingDownFromCopy() {
        assertEquals(Optional.of("n"), control("for (i = n; i > 0; i--) { x++; }"));
    }

    @Test
    void testControlModifiedInBody() {
        assertTrue(control("for (i = 0; i < n; i++) { n = n + 1; }").isEmpty());
    }

    @Test
    void testControlReadInBody() {
        assertTrue(control("for (i = 0; i < n; i++) { x = n; }").isEmpty());
    }

    @Test
    void testAmbiguousControl() {
        assertTrue(control("for (i = 0; i < n && i < m; i++) { x++; }").isEmpty());
        assertTrue(control("for (;;) { x++; }").isEmpty());
        assertTrue(control("for (i = 0; i < 10; i++) { x++; }").isEmpty());
    }
}
