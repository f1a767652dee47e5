package com.raditha.armmerge.model;

import java.util.Objects;

/**
 * A piece of source text together with the range it was sliced from.
 * Used for arm bodies and guards, whose text is compared and copied verbatim.
 *
 * @param text  exact source text, whitespace and formatting included
 * @param range location of the text in the source
 */
public record SourceFragment(String text, TextRange range) {

    public SourceFragment {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(range, "range");
    }

    /**
     * Slice a fragment out of the full source text.
     */
    public static SourceFragment of(String source, TextRange range) {
        return new SourceFragment(range.slice(source), range);
    }

    /**
     * Character-for-character comparison of the rendered text.
     */
    public boolean sameTextAs(SourceFragment other) {
        return other != null && text.equals(other.text);
    }
}
