package com.solfmt.plugins.solidity.ast;

import java.io.IOException;
import java.util.List;

/**
 * A definition whose layout is not modelled ({@code struct}, {@code event}, {@code error},
 * {@code using}, {@code type}). It is reproduced verbatim; {@code terminated} definitions end
 * with a {@code ;} that is not part of {@code declaration}.
 */
public final class OpaqueDefinition extends Declaration implements ContractPart {
    private final String keyword;
    private final Loc declaration;
    private final boolean terminated;

    public OpaqueDefinition(Loc loc, List<DocComment> docs, List<Comment> detachedComments, String keyword,
                            Loc declaration, boolean terminated) {
        super(loc, docs, detachedComments);
        this.keyword = keyword;
        this.declaration = declaration;
        this.terminated = terminated;
    }

    public String getKeyword() {
        return keyword;
    }

    public Loc getDeclaration() {
        return declaration;
    }

    public boolean isTerminated() {
        return terminated;
    }

    @Override
    public void accept(NodeVisitor visitor) throws IOException {
        visitor.visit(this);
    }
}
