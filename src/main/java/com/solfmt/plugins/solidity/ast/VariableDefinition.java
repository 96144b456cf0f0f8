package com.solfmt.plugins.solidity.ast;

import java.io.IOException;
import java.util.List;

/** A state or file-level variable; {@code declaration} excludes the terminating {@code ;}. */
public final class VariableDefinition extends Declaration implements ContractPart {
    private final Loc declaration;

    public VariableDefinition(Loc loc, List<DocComment> docs, List<Comment> detachedComments, Loc declaration) {
        super(loc, docs, detachedComments);
        this.declaration = declaration;
    }

    public Loc getDeclaration() {
        return declaration;
    }

    @Override
    public void accept(NodeVisitor visitor) throws IOException {
        visitor.visit(this);
    }
}
