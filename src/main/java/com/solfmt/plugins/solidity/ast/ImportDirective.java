package com.solfmt.plugins.solidity.ast;

import java.util.List;

/** Common shape of the three import forms: every import names the imported file. */
public abstract class ImportDirective extends SourceUnitPart {
    private final String path;
    private final List<Comment> detachedComments;

    protected ImportDirective(Loc loc, String path, List<Comment> detachedComments) {
        super(loc);
        this.path = path;
        this.detachedComments = List.copyOf(detachedComments);
    }

    /** The path literal's content, without quotes and with escapes left as written. */
    public String getPath() {
        return path;
    }

    /** Comments written inside the directive outside any symbol list; they are moved before it. */
    public List<Comment> getDetachedComments() {
        return detachedComments;
    }
}
