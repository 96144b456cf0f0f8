package com.solfmt.plugins.solidity.format;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Indentation-aware text writer with a stack of capture buffers.
 *
 * <p>Text is indented lazily: after a line break the writer remembers that an indent is pending
 * and emits {@code level * tabWidth} spaces in front of the next non-empty line. Only the first
 * line of each {@link #write} call is indented this way; further lines inside the same text are
 * written as they are, which keeps verbatim source ranges intact.
 *
 * <p>{@link #beginCapture()} redirects output into a fresh buffer so a fragment can be rendered
 * and measured before its layout is chosen. Captures nest, are closed in LIFO order by
 * {@link #endCapture()}, and leave the state of the line being built untouched.
 */
public final class LayoutWriter {
    private final Appendable sink;
    private final int tabWidth;

    private int level;
    private boolean pendingIndent = true;
    private int currentLineLength;
    private final Deque<Capture> captures = new ArrayDeque<>();

    public LayoutWriter(Appendable sink, int tabWidth) {
        if (tabWidth <= 0) {
            throw new IllegalArgumentException("tabWidth must be positive: " + tabWidth);
        }
        this.sink = sink;
        this.tabWidth = tabWidth;
    }

    /**
     * Writes {@code text}, indenting it first if it starts a line.
     *
     * @throws IOException if the underlying sink rejects the write
     */
    public void write(String text) throws IOException {
        if (text.isEmpty()) {
            return;
        }
        Appendable target = captures.isEmpty() ? sink : captures.peek().buffer;

        if (pendingIndent && text.charAt(0) != '\n') {
            String indentation = " ".repeat(getLevel() * tabWidth);
            target.append(indentation);
            currentLineLength += indentation.length();
        }
        target.append(text);

        int lastBreak = text.lastIndexOf('\n');
        if (lastBreak >= 0) {
            currentLineLength = text.length() - lastBreak - 1;
        } else {
            currentLineLength += text.length();
        }
        pendingIndent = text.charAt(text.length() - 1) == '\n';
    }

    public void writeLine() throws IOException {
        write("\n");
    }

    public void writeLine(String text) throws IOException {
        write(text);
        writeLine();
    }

    public void indent(int delta) {
        setLevel(getLevel() + delta);
    }

    /** Lowers the indentation level, never below zero. */
    public void dedent(int delta) {
        setLevel(Math.max(0, getLevel() - delta));
    }

    /** The indentation level of the innermost capture, or the global level. */
    public int getLevel() {
        return captures.isEmpty() ? level : captures.peek().level;
    }

    private void setLevel(int newLevel) {
        if (captures.isEmpty()) {
            level = newLevel;
        } else {
            captures.peek().level = newLevel;
        }
    }

    public int getTabWidth() {
        return tabWidth;
    }

    /** Whether the next non-empty write starts a new physical line. */
    public boolean isPendingIndent() {
        return pendingIndent;
    }

    /** Characters written since the last line break, indentation included. */
    public int getCurrentLineLength() {
        return currentLineLength;
    }

    /**
     * Starts capturing output. The captured fragment is rendered inline: it starts without
     * indentation, and lines it breaks are indented at the current level.
     */
    public void beginCapture() {
        captures.push(new Capture(getLevel(), pendingIndent, currentLineLength));
        pendingIndent = false;
        currentLineLength = 0;
    }

    /**
     * Stops the innermost capture and returns what was written to it.
     *
     * @throws IllegalStateException if no capture is active
     */
    public String endCapture() {
        if (captures.isEmpty()) {
            throw new IllegalStateException("endCapture() without matching beginCapture()");
        }
        Capture capture = captures.pop();
        pendingIndent = capture.savedPendingIndent;
        currentLineLength = capture.savedLineLength;
        return capture.buffer.toString();
    }

    /** Number of captures currently open. */
    public int getCaptureDepth() {
        return captures.size();
    }

    private static final class Capture {
        private final StringBuilder buffer = new StringBuilder();
        private final boolean savedPendingIndent;
        private final int savedLineLength;
        private int level;

        private Capture(int level, boolean savedPendingIndent, int savedLineLength) {
            this.level = level;
            this.savedPendingIndent = savedPendingIndent;
            this.savedLineLength = savedLineLength;
        }
    }
}
