package com.raditha.mwp.ast;

public record BinaryOp(String operator, Node left, Node right) implements Node {
}
