package com.raditha.armmerge.model;

/**
 * The pattern variants the merge refactoring has to tell apart.
 */
public enum PatternKind {
    /**
     * Matches every value: {@code _} in a match expression, {@code default} in a Java switch.
     */
    PLACEHOLDER,

    /**
     * Any other pattern. Its text is carried over verbatim when arms are merged.
     */
    OTHER
}
