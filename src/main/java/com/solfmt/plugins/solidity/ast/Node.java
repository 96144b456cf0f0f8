package com.solfmt.plugins.solidity.ast;

import java.io.IOException;

/**
 * Base class of all syntax tree nodes. Every node knows the byte range it was parsed from.
 */
public abstract class Node {
    private final Loc loc;

    protected Node(Loc loc) {
        this.loc = loc;
    }

    public Loc getLoc() {
        return loc;
    }

    /**
     * Double dispatch to the {@link NodeVisitor} overload for this node's kind.
     */
    public abstract void accept(NodeVisitor visitor) throws IOException;
}
