package com.solfmt.plugins.solidity.ast;

import java.io.IOException;

/** A brace-delimited statement block, from its opening to its closing brace inclusive. */
public final class Block extends Node {

    public Block(Loc loc) {
        super(loc);
    }

    @Override
    public void accept(NodeVisitor visitor) throws IOException {
        visitor.visit(this);
    }
}
