package com.solfmt.plugins.solidity.ast;

import java.io.IOException;
import java.util.List;

/** {@code import "path";} */
public final class PlainImport extends ImportDirective {

    public PlainImport(Loc loc, String path, List<Comment> detachedComments) {
        super(loc, path, detachedComments);
    }

    @Override
    public void accept(NodeVisitor visitor) throws IOException {
        visitor.visit(this);
    }
}
