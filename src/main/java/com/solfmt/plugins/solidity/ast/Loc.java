package com.solfmt.plugins.solidity.ast;

import java.util.Objects;

/**
 * A byte range {@code [start, end)} into a {@link SourceText}.
 */
public final class Loc {
    private final int start;
    private final int end;

    public Loc(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid source range [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    /**
     * Returns the smallest range covering both this range and {@code other}.
     */
    public Loc union(Loc other) {
        return new Loc(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Loc)) {
            return false;
        }
        Loc other = (Loc) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
