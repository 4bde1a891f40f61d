package com.raditha.mwp.ast;

/**
 * A conditional. The condition is kept as text only; the analysis treats both
 * branches as possible.
 *
 * @param elseBranch may be empty but never null
 */
public record If(String condition, Compound thenBranch, Compound elseBranch) implements Node {
    public If {
        if (thenBranch == null) {
            thenBranch = Compound.EMPTY;
        }
        if (elseBranch == null) {
            elseBranch = Compound.EMPTY;
        }
    }
}
