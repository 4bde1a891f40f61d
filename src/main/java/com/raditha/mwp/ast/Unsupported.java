package com.raditha.mwp.ast;

/**
 * A construct outside the reduced grammar.
 */
public record Unsupported(String description) implements Node {
}
