package com.raditha.armmerge.model;

import java.util.List;
import java.util.Objects;

/**
 * The arm list of a single match construct.
 * Only arms are listed; separators, comments and other trivia between them are not,
 * so the arm at {@code index + 1} is always the next arm sibling.
 *
 * @param range the range of the whole construct
 * @param arms  the arms in source order
 */
public record MatchBlock(TextRange range, List<MatchArm> arms) {

    public MatchBlock {
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(arms, "arms");
        arms = List.copyOf(arms);
        for (int i = 1; i < arms.size(); i++) {
            if (arms.get(i).range().start() < arms.get(i - 1).range().end()) {
                throw new IllegalArgumentException("Arms must be in source order and must not overlap: "
                        + arms.get(i - 1).range() + " and " + arms.get(i).range());
            }
        }
    }
}
