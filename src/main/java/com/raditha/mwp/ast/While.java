package com.raditha.mwp.ast;

public record While(String condition, Compound body) implements Node {
    public While {
        if (body == null) {
            body = Compound.EMPTY;
        }
    }
}
