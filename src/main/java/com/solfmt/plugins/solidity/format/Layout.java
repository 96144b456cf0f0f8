package com.solfmt.plugins.solidity.format;

import java.io.IOException;
import java.util.List;

/**
 * Single-line versus one-item-per-line decisions for rendered lists.
 *
 * <p>A list is judged as a whole: either its joined form fits on the line being written, or every
 * item goes on its own line. Items are never packed several to a line.
 */
final class Layout {

    private Layout() {
    }

    /**
     * Whether {@code items} joined by {@code separator} fit on the line currently being written,
     * counting the indentation that is still pending and the text already on the line.
     */
    static boolean fitsOnOneLine(LayoutWriter writer, int lineLength, List<String> items, String separator) {
        int indentation = writer.isPendingIndent() ? writer.getLevel() * writer.getTabWidth() : 0;
        return indentation + writer.getCurrentLineLength() + String.join(separator, items).length() <= lineLength;
    }

    /**
     * Writes {@code items} joined by {@code separator}, or one per line with the separator (trailing
     * whitespace removed) ending every line but the last.
     */
    static void writeSeparated(LayoutWriter writer, List<String> items, String separator, boolean multiline)
            throws IOException {
        if (!multiline) {
            writer.write(String.join(separator, items));
            return;
        }

        String lineTerminator = separator.stripTrailing();
        for (int i = 0; i < items.size(); i++) {
            writer.write(items.get(i));
            if (i != items.size() - 1) {
                writer.writeLine(lineTerminator);
            }
        }
    }
}
