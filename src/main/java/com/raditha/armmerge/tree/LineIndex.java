package com.raditha.armmerge.tree;

import com.github.javaparser.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between JavaParser's 1-based line/column positions and character offsets.
 * {@code \n}, {@code \r\n} and {@code \r} all end a line; a tab is one column.
 */
public class LineIndex {

    private final int length;
    private final int[] lineStarts;

    public LineIndex(String text) {
        this.length = text.length();
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            } else if (c == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Offset of the character at {@code line}:{@code column}.
     * The column just past the end of a line is accepted and maps to the line break.
     */
    public int offsetOf(int line, int column) {
        if (line < 1 || line > lineStarts.length) {
            throw new IllegalArgumentException("Line " + line + " is outside 1.." + lineStarts.length);
        }
        if (column < 1) {
            throw new IllegalArgumentException("Column must be >= 1, got: " + column);
        }
        int offset = lineStarts[line - 1] + column - 1;
        int lineEnd = line < lineStarts.length ? lineStarts[line] : length;
        if (offset > lineEnd) {
            throw new IllegalArgumentException("Column " + column + " is past the end of line " + line);
        }
        return offset;
    }

    public int offsetOf(Position position) {
        return offsetOf(position.line, position.column);
    }

    /**
     * The 1-based position of {@code offset}. The text length itself maps to the
     * position just after the last character.
     */
    public Position positionOf(int offset) {
        if (offset < 0 || offset > length) {
            throw new IllegalArgumentException("Offset " + offset + " is outside 0.." + length);
        }
        int line = lineOf(offset);
        return new Position(line + 1, offset - lineStarts[line] + 1);
    }

    private int lineOf(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }
}
