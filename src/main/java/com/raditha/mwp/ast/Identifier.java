package com.raditha.mwp.ast;

public record Identifier(String name) implements Node {
}
