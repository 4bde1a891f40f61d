package com.raditha.mwp.frontend;

import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ForStmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides whether a for loop has the shape "repeat the body X times".
 * <p>
 * The control candidates are the variables of the condition plus the variables
 * the initializer copies from, minus the variables the loop declares and its
 * iterators (assigned in the initializer or changed by the update). The loop is
 * compatible when exactly one candidate remains and the body does not use it.
 */
public class LoopCompatibility {

    private static final Logger logger = LoggerFactory.getLogger(LoopCompatibility.class);

    private LoopCompatibility() {
    }

    /**
     * @return the control variable, or empty when the loop is not compatible
     */
    public static Optional<String> controlVariable(ForStmt loop) {
        Set<String> iterators = new HashSet<>();
        Set<String> declared = new HashSet<>();
        Set<String> copied = new HashSet<>();

        for (Expression init : loop.getInitialization()) {
            if (init instanceof VariableDeclarationExpr declaration) {
                declaration.getVariables().forEach(v -> {
                    declared.add(v.getNameAsString());
                    v.getInitializer().filter(Expression::isNameExpr)
                            .ifPresent(e -> copied.add(e.asNameExpr().getNameAsString()));
                });
            } else if (init instanceof AssignExpr assign && assign.getOperator() == AssignExpr.Operator.ASSIGN) {
                if (assign.getTarget().isNameExpr()) {
                    iterators.add(assign.getTarget().asNameExpr().getNameAsString());
                }
                if (assign.getValue().isNameExpr()) {
                    copied.add(assign.getValue().asNameExpr().getNameAsString());
                }
            }
        }
        loop.getUpdate().forEach(u -> iterators.addAll(VariableCollector.collect(u)));

        Set<String> candidates = new TreeSet<>(copied);
        loop.getCompare().ifPresent(c -> candidates.addAll(VariableCollector.collect(c)));
        candidates.removeAll(declared);
        candidates.removeAll(iterators);

        if (candidates.size() != 1) {
            logger.debug("Loop needs exactly one control variable, found {}", candidates);
            return Optional.empty();
        }
        String control = candidates.iterator().next();
        if (VariableCollector.collect(loop.getBody()).contains(control)) {
            logger.debug("Control variable {} cannot occur in the loop body", control);
            return Optional.empty();
        }
        return Optional.of(control);
    }
}
