package com.raditha.armmerge.model;

import java.util.Objects;

/**
 * One pattern of a match arm, as written in the source.
 *
 * @param kind  placeholder or ordinary pattern
 * @param text  the original source text of the pattern
 * @param range where the pattern sits in the source
 */
public record Pattern(PatternKind kind, String text, TextRange range) {

    public Pattern {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(range, "range");
    }

    public boolean isPlaceholder() {
        return kind == PatternKind.PLACEHOLDER;
    }
}
