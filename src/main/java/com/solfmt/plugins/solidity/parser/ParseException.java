package com.solfmt.plugins.solidity.parser;

/**
 * A syntax error, positioned at a 1-based line and column of the source.
 */
public class ParseException extends Exception {
    private final int line;
    private final int column;
    private final String reason;

    public ParseException(String message, int line, int column) {
        super(line + ":" + column + ": " + message);
        this.reason = message;
        this.line = line;
        this.column = column;
    }

    public ParseException(String message, int line, int column, Throwable cause) {
        this(message, line, column);
        initCause(cause);
    }

    /** The message without its position prefix. */
    public String getReason() {
        return reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
