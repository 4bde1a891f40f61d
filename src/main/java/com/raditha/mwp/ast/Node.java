package com.raditha.mwp.ast;

/**
 * The reduced grammar the analysis consumes.
 * The frontend guarantees that only these shapes reach the analysis;
 * anything it cannot express becomes {@link Unsupported}.
 */
public sealed interface Node
        permits Assignment, BinaryOp, UnaryOp, Constant, Identifier,
        If, While, For, Compound, FunctionDef, Unsupported {
}
