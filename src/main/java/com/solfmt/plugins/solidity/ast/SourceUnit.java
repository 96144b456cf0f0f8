package com.solfmt.plugins.solidity.ast;

import java.io.IOException;
import java.util.List;

/** Root of a parsed file: its top-level parts in source order. */
public final class SourceUnit extends Node {
    private final List<SourceUnitPart> parts;

    public SourceUnit(Loc loc, List<SourceUnitPart> parts) {
        super(loc);
        this.parts = List.copyOf(parts);
    }

    public List<SourceUnitPart> getParts() {
        return parts;
    }

    @Override
    public void accept(NodeVisitor visitor) throws IOException {
        visitor.visit(this);
    }
}
