package com.solfmt.plugins.solidity.format;

import com.solfmt.plugins.solidity.ast.Loc;
import com.solfmt.plugins.solidity.ast.SourceText;

/**
 * Blank-line policy between sibling members, driven only by the spacing in the original source.
 *
 * <p>The whitespace after a member's terminator holds one line break for the end of its own line,
 * so {@code n} breaks before the next member mean {@code n - 1} blank lines.
 */
final class BlankLines {

    private BlankLines() {
    }

    /**
     * Whether one blank line separates {@code previous} and {@code next} in the output: only when the
     * source had more than one blank line between them. A single blank line is dropped.
     */
    static boolean separate(SourceText source, Loc previous, Loc next) {
        return blankLinesBetween(source, previous, next) > 1;
    }

    /**
     * Whether the source had at least one blank line between the two ranges.
     */
    static boolean hadBlankLine(SourceText source, Loc previous, Loc next) {
        return blankLinesBetween(source, previous, next) > 0;
    }

    static int blankLinesBetween(SourceText source, Loc previous, Loc next) {
        if (next.getStart() <= previous.getEnd()) {
            return 0;
        }
        return Math.max(0, source.countLineBreaks(previous.getEnd(), next.getStart()) - 1);
    }
}
