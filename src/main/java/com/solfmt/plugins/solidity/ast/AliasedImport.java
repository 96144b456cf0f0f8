package com.solfmt.plugins.solidity.ast;

import java.io.IOException;
import java.util.List;

/** {@code import "path" as Alias;}, also produced for {@code import * as Alias from "path";}. */
public final class AliasedImport extends ImportDirective {
    private final String alias;

    public AliasedImport(Loc loc, String path, String alias, List<Comment> detachedComments) {
        super(loc, path, detachedComments);
        this.alias = alias;
    }

    public String getAlias() {
        return alias;
    }

    @Override
    public void accept(NodeVisitor visitor) throws IOException {
        visitor.visit(this);
    }
}
