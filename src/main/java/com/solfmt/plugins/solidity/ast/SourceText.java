package com.solfmt.plugins.solidity.ast;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The raw bytes of a source file. Node spans are byte offsets into this buffer.
 */
public final class SourceText {
    private final byte[] bytes;
    private volatile int[] lineStarts;

    private SourceText(byte[] bytes) {
        this.bytes = bytes;
    }

    public static SourceText of(byte[] bytes) {
        return new SourceText(Arrays.copyOf(bytes, bytes.length));
    }

    public static SourceText of(String text) {
        return new SourceText(text.getBytes(StandardCharsets.UTF_8));
    }

    public int length() {
        return bytes.length;
    }

    public byte byteAt(int offset) {
        return bytes[offset];
    }

    /**
     * Decodes the bytes of {@code loc} as UTF-8.
     *
     * @throws CharacterCodingException if the span is not well-formed UTF-8
     */
    public String text(Loc loc) throws CharacterCodingException {
        return text(loc.getStart(), loc.getEnd());
    }

    public String text(int start, int end) throws CharacterCodingException {
        checkRange(start, end);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder.decode(ByteBuffer.wrap(bytes, start, end - start)).toString();
    }

    /**
     * Counts line feeds in {@code [start, end)}.
     */
    public int countLineBreaks(int start, int end) {
        checkRange(start, end);
        int count = 0;
        for (int i = start; i < end; i++) {
            if (bytes[i] == '\n') {
                count++;
            }
        }
        return count;
    }

    /**
     * 1-based line of a byte offset.
     */
    public int lineOf(int offset) {
        int[] starts = lineStarts();
        int index = Arrays.binarySearch(starts, offset);
        return index >= 0 ? index + 1 : -index - 1;
    }

    /**
     * 1-based column (in bytes) of a byte offset.
     */
    public int columnOf(int offset) {
        return offset - lineStarts()[lineOf(offset) - 1] + 1;
    }

    private int[] lineStarts() {
        if (lineStarts == null) {
            int lines = countLineBreaks(0, bytes.length) + 1;
            int[] starts = new int[lines];
            int line = 1;
            for (int i = 0; i < bytes.length; i++) {
                if (bytes[i] == '\n') {
                    starts[line++] = i + 1;
                }
            }
            lineStarts = starts;
        }
        return lineStarts;
    }

    private void checkRange(int start, int end) {
        if (start < 0 || end < start || end > bytes.length) {
            throw new IndexOutOfBoundsException(
                    "Range [" + start + ", " + end + ") outside source of length " + bytes.length);
        }
    }
}
