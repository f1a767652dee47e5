package com.raditha.armmerge.refactoring;

import com.raditha.armmerge.model.MatchArm;
import com.raditha.armmerge.model.MatchDialect;
import com.raditha.armmerge.model.Pattern;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the text of the arm that replaces a run.
 */
public class PatternMerger {

    /**
     * Merge the patterns of a run into one arm.
     * <p>
     * If any arm of the run holds a placeholder pattern, the merged pattern is the first
     * such placeholder alone, in its original text, so {@code case null, default} keeps
     * its {@code null}. Otherwise every pattern of every arm is kept, left to right,
     * in its original text and joined with the dialect's alternation separator.
     * The body is the anchor's body exactly as written.
     *
     * @param run     the arms to merge, anchor first
     * @param dialect the syntax to render with
     */
    public MergedArm merge(List<MatchArm> run, MatchDialect dialect) {
        if (run.isEmpty()) {
            throw new IllegalArgumentException("Cannot merge an empty run");
        }
        String bodyText = run.get(0).getBody()
                .orElseThrow(() -> new IllegalArgumentException("The first arm of a run must have a body"))
                .text();

        Optional<Pattern> placeholderPattern = run.stream()
                .flatMap(arm -> arm.patterns().stream())
                .filter(Pattern::isPlaceholder)
                .findFirst();
        boolean placeholder = placeholderPattern.isPresent();
        String patternText = placeholder
                ? placeholderPattern.get().text()
                : run.stream()
                        .flatMap(arm -> arm.patterns().stream())
                        .map(Pattern::text)
                        .collect(Collectors.joining(dialect.alternationSeparator()));

        return new MergedArm(patternText, placeholder, bodyText,
                dialect.renderArm(patternText, placeholder, bodyText));
    }
}
