package org.pragmatica.nix.tree;

import com.google.common.base.Preconditions;

/**
 * A range of char offsets in source text, from start (inclusive) to end (exclusive).
 */
public record TextRange(int start, int end) {

    public TextRange {
        Preconditions.checkArgument(start >= 0 && start <= end, "invalid text range [%s, %s)", start, end);
    }

    public static TextRange of(int start, int end) {
        return new TextRange(start, end);
    }

    public static TextRange at(int offset) {
        return new TextRange(offset, offset);
    }

    public static TextRange ofLength(int start, int length) {
        return new TextRange(start, start + length);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Check if the offset lies inside the range. The end offset is excluded.
     */
    public boolean contains(int offset) {
        return start <= offset && offset < end;
    }

    /**
     * Check if the offset lies inside the range or on its end.
     */
    public boolean containsInclusive(int offset) {
        return start <= offset && offset <= end;
    }

    public boolean containsRange(TextRange other) {
        return start <= other.start && other.end <= end;
    }

    public TextRange cover(TextRange other) {
        return new TextRange(Math.min(start, other.start), Math.max(end, other.end));
    }

    public String extract(String source) {
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
