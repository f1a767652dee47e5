package com.raditha.armmerge.model;

/**
 * A half-open range of character offsets into the source text.
 * Offsets are UTF-16 code units, the same unit {@link String#length()} uses.
 *
 * @param start first offset covered by the range (inclusive)
 * @param end   offset just past the last covered character (exclusive)
 */
public record TextRange(int start, int end) {

    public TextRange {
        if (start < 0) {
            throw new IllegalArgumentException("start must be >= 0, got: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("end must be >= start, got: " + start + ".." + end);
        }
    }

    /**
     * Create a range from its start offset and length.
     */
    public static TextRange ofLength(int start, int length) {
        return new TextRange(start, start + length);
    }

    public int length() {
        return end - start;
    }

    /**
     * True when {@code start <= offset <= end}, so a cursor placed right after the
     * last character still counts as inside.
     */
    public boolean containsInclusive(int offset) {
        return start <= offset && offset <= end;
    }

    /**
     * True when {@code other} lies completely within this range.
     */
    public boolean covers(TextRange other) {
        return start <= other.start && other.end <= end;
    }

    /**
     * Slice the text this range covers out of {@code text}.
     */
    public String slice(String text) {
        if (end > text.length()) {
            throw new IllegalArgumentException(
                    "Range " + this + " exceeds text of length " + text.length());
        }
        return text.substring(start, end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
