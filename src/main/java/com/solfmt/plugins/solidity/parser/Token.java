package com.solfmt.plugins.solidity.parser;

import com.solfmt.plugins.solidity.ast.Loc;

/**
 * A lexical token. {@code text} is the token's ASCII spelling for identifiers, numbers and
 * punctuation; for other kinds it is empty and the content is read from the source by range.
 */
final class Token {
    final TokenKind kind;
    final int start;
    final int end;
    final String text;

    Token(TokenKind kind, int start, int end, String text) {
        this.kind = kind;
        this.start = start;
        this.end = end;
        this.text = text;
    }

    boolean is(String spelling) {
        return (kind == TokenKind.IDENTIFIER || kind == TokenKind.PUNCTUATION) && text.equals(spelling);
    }

    Loc loc() {
        return new Loc(start, end);
    }

    @Override
    public String toString() {
        return kind == TokenKind.EOF ? "end of file" : kind + (text.isEmpty() ? "" : " '" + text + "'");
    }
}
