package com.raditha.armmerge.model;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One branch of a match construct.
 *
 * @param patterns the alternated patterns of the arm, in source order (never empty)
 * @param guard    the guard condition, or null when the arm has none
 * @param body     the body expression, or null when the arm has none
 * @param range    the whole arm, ending where its body ends
 */
public record MatchArm(
        List<Pattern> patterns,
        @Nullable SourceFragment guard,
        @Nullable SourceFragment body,
        TextRange range) {

    public MatchArm {
        Objects.requireNonNull(patterns, "patterns");
        Objects.requireNonNull(range, "range");
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("An arm needs at least one pattern");
        }
        patterns = List.copyOf(patterns);
    }

    public boolean hasGuard() {
        return guard != null;
    }

    public boolean hasBody() {
        return body != null;
    }

    public Optional<SourceFragment> getGuard() {
        return Optional.ofNullable(guard);
    }

    public Optional<SourceFragment> getBody() {
        return Optional.ofNullable(body);
    }

    /**
     * Whether any of this arm's patterns matches everything.
     */
    public boolean containsPlaceholder() {
        return patterns.stream().anyMatch(Pattern::isPlaceholder);
    }
}
