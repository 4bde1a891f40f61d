package com.raditha.mwp.ast;

/**
 * A unary operation. As a statement, {@code ++} and {@code --} stand for an
 * increment or decrement of the operand.
 */
public record UnaryOp(String operator, Node operand) implements Node {

    public boolean isIncrementOrDecrement() {
        return "++".equals(operator) || "--".equals(operator);
    }
}
