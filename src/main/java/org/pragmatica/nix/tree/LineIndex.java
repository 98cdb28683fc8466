package org.pragmatica.nix.tree;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Maps char offsets of a source text to line/column locations.
 */
public final class LineIndex {
    private final int[] lineStarts;
    private final int length;

    private LineIndex(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    public static LineIndex of(String source) {
        int lines = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                lines++;
            }
        }
        var starts = new int[lines];
        int line = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts[line++] = i + 1;
            }
        }
        return new LineIndex(starts, source.length());
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public SourceLocation location(int offset) {
        Preconditions.checkArgument(offset >= 0 && offset <= length, "offset %s is outside [0, %s]", offset, length);
        int found = Arrays.binarySearch(lineStarts, offset);
        int lineIndex = found >= 0
                        ? found
                        : -found - 2;
        return SourceLocation.at(lineIndex + 1, offset - lineStarts[lineIndex] + 1, offset);
    }

    public SourceSpan span(TextRange range) {
        return SourceSpan.of(location(range.start()), location(range.end()));
    }
}
