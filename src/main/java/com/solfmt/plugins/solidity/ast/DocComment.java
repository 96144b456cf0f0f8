package com.solfmt.plugins.solidity.ast;

import java.io.IOException;

/** One NatSpec entry, {@code @tag value}. */
public final class DocComment extends Node {
    private final String tag;
    private final String value;

    public DocComment(Loc loc, String tag, String value) {
        super(loc);
        this.tag = tag;
        this.value = value;
    }

    public String getTag() {
        return tag;
    }

    public String getValue() {
        return value;
    }

    @Override
    public void accept(NodeVisitor visitor) throws IOException {
        visitor.visit(this);
    }
}
