package com.raditha.armmerge.model;

import java.util.Objects;

/**
 * Replace the text in {@code range} with {@code replacement}.
 */
public record TextEdit(TextRange range, String replacement) {

    public TextEdit {
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(replacement, "replacement");
    }

    /**
     * Apply this edit to {@code text} and return the result.
     */
    public String apply(String text) {
        if (range.end() > text.length()) {
            throw new IllegalArgumentException(
                    "Edit range " + range + " exceeds text of length " + text.length());
        }
        return text.substring(0, range.start()) + replacement + text.substring(range.end());
    }

    /**
     * How much longer (or, when negative, shorter) the text becomes.
     */
    public int lengthDelta() {
        return replacement.length() - range.length();
    }
}
