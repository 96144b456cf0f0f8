package com.solfmt.plugins.solidity.ast;

import java.io.IOException;
import java.util.List;

/** {@code pragma <name> <value>;} where the value is kept as raw text. */
public final class PragmaDirective extends SourceUnitPart {
    public static final String SOLIDITY = "solidity";

    private final String name;
    private final String value;
    private final List<Comment> detachedComments;

    public PragmaDirective(Loc loc, String name, String value, List<Comment> detachedComments) {
        super(loc);
        this.name = name;
        this.value = value;
        this.detachedComments = List.copyOf(detachedComments);
    }

    public String getName() {
        return name;
    }

    /**
     * The pragma value without surrounding whitespace or comments; empty for {@code pragma name;}.
     * Comments found inside the directive are kept in {@link #getDetachedComments()}.
     */
    public String getValue() {
        return value;
    }

    /** Comments written inside the directive; they are moved before it. */
    public List<Comment> getDetachedComments() {
        return detachedComments;
    }

    public boolean isVersionPragma() {
        return SOLIDITY.equals(name);
    }

    @Override
    public void accept(NodeVisitor visitor) throws IOException {
        visitor.visit(this);
    }
}
