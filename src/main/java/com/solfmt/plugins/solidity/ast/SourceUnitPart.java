package com.solfmt.plugins.solidity.ast;

/** A node that may appear at the top level of a file. */
public abstract class SourceUnitPart extends Node {

    protected SourceUnitPart(Loc loc) {
        super(loc);
    }
}
