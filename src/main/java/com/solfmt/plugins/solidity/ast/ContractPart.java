package com.solfmt.plugins.solidity.ast;

import java.io.IOException;

/** A node that may appear inside the body of a contract, interface or library. */
public interface ContractPart {

    Loc getLoc();

    void accept(NodeVisitor visitor) throws IOException;
}
