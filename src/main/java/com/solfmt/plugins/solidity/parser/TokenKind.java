package com.solfmt.plugins.solidity.parser;

enum TokenKind {
    IDENTIFIER,
    NUMBER,
    STRING,
    PUNCTUATION,
    LINE_COMMENT,
    BLOCK_COMMENT,
    DOC_LINE_COMMENT,
    DOC_BLOCK_COMMENT,
    /** A run of bytes that cannot start any other token, such as non-ASCII bytes. */
    OTHER,
    EOF;

    boolean isComment() {
        return this == LINE_COMMENT || this == BLOCK_COMMENT || this == DOC_LINE_COMMENT
                || this == DOC_BLOCK_COMMENT;
    }

    boolean isDocComment() {
        return this == DOC_LINE_COMMENT || this == DOC_BLOCK_COMMENT;
    }
}
