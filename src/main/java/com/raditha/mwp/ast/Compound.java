package com.raditha.mwp.ast;

import java.util.List;

/**
 * A sequence of statements.
 */
public record Compound(List<Node> statements) implements Node {

    public static final Compound EMPTY = new Compound(List.of());

    public Compound {
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    public static Compound of(Node... statements) {
        return new Compound(List.of(statements));
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
