package com.solfmt.plugins.solidity.ast;

import java.io.IOException;

/**
 * A comment between declarations that is not attached as documentation. Its text includes the
 * comment delimiters.
 */
public final class Comment extends SourceUnitPart implements ContractPart {
    private final String text;
    private final boolean trailing;

    public Comment(Loc loc, String text, boolean trailing) {
        super(loc);
        this.text = text;
        this.trailing = trailing;
    }

    public String getText() {
        return text;
    }

    /** Whether the comment sits on the same line as the end of the preceding part. */
    public boolean isTrailing() {
        return trailing;
    }

    public boolean isBlock() {
        return text.startsWith("/*");
    }

    @Override
    public void accept(NodeVisitor visitor) throws IOException {
        visitor.visit(this);
    }
}
