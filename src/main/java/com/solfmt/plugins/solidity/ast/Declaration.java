package com.solfmt.plugins.solidity.ast;

import java.util.List;

/**
 * A named definition that may carry NatSpec documentation. Its location spans from the first
 * attached doc comment to the declaration's terminating <code>;</code> or <code>}</code>.
 */
public abstract class Declaration extends SourceUnitPart {
    private final List<DocComment> docs;
    private final List<Comment> detachedComments;

    protected Declaration(Loc loc, List<DocComment> docs, List<Comment> detachedComments) {
        super(loc);
        this.docs = List.copyOf(docs);
        this.detachedComments = List.copyOf(detachedComments);
    }

    public List<DocComment> getDocs() {
        return docs;
    }

    /**
     * Comments that could not stay where they were written: inside a header whose layout is
     * rebuilt, or between the last token of a copied range and its terminator.
     */
    public List<Comment> getDetachedComments() {
        return detachedComments;
    }
}
