package com.raditha.mwp.ast;

public record Constant(String value) implements Node {
}
