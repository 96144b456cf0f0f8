package com.solfmt.plugins.solidity.ast;

import java.io.IOException;
import java.util.List;

/**
 * One entry of an {@code is} list, such as {@code Ownable} or {@code ERC20("Token", "TKN")}.
 * Only its source range is modelled, plus the comments written after it in the list.
 */
public final class InheritanceSpecifier extends Node {
    private final List<Comment> comments;

    public InheritanceSpecifier(Loc loc, List<Comment> comments) {
        super(loc);
        this.comments = List.copyOf(comments);
    }

    public InheritanceSpecifier(Loc loc) {
        this(loc, List.of());
    }

    public List<Comment> getComments() {
        return comments;
    }

    @Override
    public void accept(NodeVisitor visitor) throws IOException {
        visitor.visit(this);
    }
}
