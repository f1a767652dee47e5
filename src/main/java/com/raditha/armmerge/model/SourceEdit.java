package com.raditha.armmerge.model;

import java.util.Objects;

/**
 * Everything a host needs to carry out a refactoring: the range to highlight,
 * the single replacement to make and where the cursor goes afterwards.
 *
 * @param target       range to highlight, in the original text
 * @param edit         the replacement
 * @param cursorOffset cursor position in the edited text
 */
public record SourceEdit(TextRange target, TextEdit edit, int cursorOffset) {

    public SourceEdit {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(edit, "edit");
        if (cursorOffset < 0) {
            throw new IllegalArgumentException("cursorOffset must be >= 0, got: " + cursorOffset);
        }
    }

    public String applyTo(String text) {
        return edit.apply(text);
    }
}
