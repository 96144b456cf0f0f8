package com.solfmt.plugins.solidity.ast;

/** The flavours of contract-like aggregate definitions. */
public enum ContractKind {
    CONTRACT("contract"),
    ABSTRACT_CONTRACT("abstract contract"),
    INTERFACE("interface"),
    LIBRARY("library");

    private final String keyword;

    ContractKind(String keyword) {
        this.keyword = keyword;
    }

    /** The declaring keyword(s) as written in source. */
    public String getKeyword() {
        return keyword;
    }
}
