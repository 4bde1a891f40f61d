package com.raditha.mwp.ast;

/**
 * {@code target = value}, where value is a constant, an identifier, a unary
 * operation or a binary operation over constants and identifiers.
 */
public record Assignment(String target, Node value) implements Node {
    public Assignment {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("Assignment target cannot be empty");
        }
        if (value == null) {
            throw new IllegalArgumentException("Assignment value cannot be null");
        }
    }
}
