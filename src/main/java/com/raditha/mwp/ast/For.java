package com.raditha.mwp.ast;

/**
 * A for loop.
 *
 * @param header          the loop header as source text
 * @param body            the loop body
 * @param compatible      true when the loop iterates a fixed number of times
 *                        given by a single control variable not modified in the body
 * @param controlVariable the control variable of a compatible loop, null otherwise
 */
public record For(String header, Compound body, boolean compatible, String controlVariable) implements Node {
    public For {
        if (body == null) {
            body = Compound.EMPTY;
        }
    }
}
