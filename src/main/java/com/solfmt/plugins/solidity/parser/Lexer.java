package com.solfmt.plugins.solidity.parser;

import com.solfmt.plugins.solidity.ast.SourceText;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Solidity source bytes into tokens. Comments are kept as tokens so that the parser can
 * attach or preserve them; whitespace is dropped.
 *
 * <p>Only the distinctions the declaration-level parser needs are made: operators are emitted one
 * byte at a time, and numbers are any run of alphanumerics, dots and underscores starting with a
 * digit.
 */
final class Lexer {
    private final SourceText source;
    private final int length;
    private int pos;

    Lexer(SourceText source) {
        this.source = source;
        this.length = source.length();
    }

    List<Token> tokenize() throws ParseException {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = next();
            tokens.add(token);
        } while (token.kind != TokenKind.EOF);
        return tokens;
    }

    private Token next() throws ParseException {
        skipWhitespace();
        if (pos >= length) {
            return new Token(TokenKind.EOF, length, length, "");
        }

        int start = pos;
        int c = peek(0);
        if (c == '/' && peek(1) == '/') {
            return lineComment(start);
        }
        if (c == '/' && peek(1) == '*') {
            return blockComment(start);
        }
        if (c == '"' || c == '\'') {
            return stringLiteral(start, c);
        }
        if (isIdentifierStart(c)) {
            while (isIdentifierPart(peek(0))) {
                pos++;
            }
            return spelled(TokenKind.IDENTIFIER, start);
        }
        if (isDigit(c)) {
            while (isIdentifierPart(peek(0)) || peek(0) == '.') {
                pos++;
            }
            return spelled(TokenKind.NUMBER, start);
        }
        if (c >= 0x80) {
            while (peek(0) >= 0x80) {
                pos++;
            }
            return new Token(TokenKind.OTHER, start, pos, "");
        }
        pos++;
        return spelled(TokenKind.PUNCTUATION, start);
    }

    private Token lineComment(int start) {
        while (pos < length && source.byteAt(pos) != '\n') {
            pos++;
        }
        int end = pos;
        if (end > start && source.byteAt(end - 1) == '\r') {
            end--;
        }
        // "///" is NatSpec, "////" and longer runs are ordinary comments
        boolean doc = peekAt(start + 2) == '/' && peekAt(start + 3) != '/';
        return new Token(doc ? TokenKind.DOC_LINE_COMMENT : TokenKind.LINE_COMMENT, start, end, "");
    }

    private Token blockComment(int start) throws ParseException {
        pos += 2;
        while (pos < length && !(peek(0) == '*' && peek(1) == '/')) {
            pos++;
        }
        if (pos >= length) {
            throw error("unterminated comment", start);
        }
        pos += 2;
        // "/**/" is an empty ordinary comment, not the start of NatSpec
        boolean doc = peekAt(start + 2) == '*' && peekAt(start + 3) != '/';
        return new Token(doc ? TokenKind.DOC_BLOCK_COMMENT : TokenKind.BLOCK_COMMENT, start, pos, "");
    }

    private Token stringLiteral(int start, int quote) throws ParseException {
        pos++;
        while (true) {
            int c = peek(0);
            if (c == -1 || c == '\n') {
                throw error("unterminated string literal", start);
            }
            if (c == '\\') {
                pos += 2;
            } else {
                pos++;
                if (c == quote) {
                    return new Token(TokenKind.STRING, start, pos, "");
                }
            }
        }
    }

    private void skipWhitespace() {
        while (pos < length) {
            int c = peek(0);
            if (c != ' ' && c != '\t' && c != '\n' && c != '\r' && c != '\f') {
                return;
            }
            pos++;
        }
    }

    private Token spelled(TokenKind kind, int start) {
        StringBuilder sb = new StringBuilder(pos - start);
        for (int i = start; i < pos; i++) {
            sb.append((char) source.byteAt(i));
        }
        return new Token(kind, start, pos, sb.toString());
    }

    private int peek(int ahead) {
        return peekAt(pos + ahead);
    }

    private int peekAt(int offset) {
        return offset < length ? source.byteAt(offset) & 0xff : -1;
    }

    private ParseException error(String message, int offset) {
        return new ParseException(message, source.lineOf(offset), source.columnOf(offset));
    }

    private static boolean isIdentifierStart(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(int c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }
}
