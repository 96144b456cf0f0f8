package com.solfmt.plugins.solidity.ast;

import java.io.IOException;
import java.util.List;

/**
 * A contract, abstract contract, interface or library: its inheritance list and body members.
 */
public final class ContractDefinition extends Declaration {
    private final ContractKind kind;
    private final String name;
    private final List<InheritanceSpecifier> bases;
    private final List<ContractPart> parts;

    public ContractDefinition(Loc loc, List<DocComment> docs, List<Comment> detachedComments, ContractKind kind,
                              String name, List<InheritanceSpecifier> bases, List<ContractPart> parts) {
        super(loc, docs, detachedComments);
        this.kind = kind;
        this.name = name;
        this.bases = List.copyOf(bases);
        this.parts = List.copyOf(parts);
    }

    public ContractKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public List<InheritanceSpecifier> getBases() {
        return bases;
    }

    public List<ContractPart> getParts() {
        return parts;
    }

    @Override
    public void accept(NodeVisitor visitor) throws IOException {
        visitor.visit(this);
    }
}
