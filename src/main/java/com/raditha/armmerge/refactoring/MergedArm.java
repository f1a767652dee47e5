package com.raditha.armmerge.refactoring;

/**
 * The single arm a run is rewritten into.
 *
 * @param patternText the merged pattern list, or the placeholder label as written
 * @param placeholder true when a placeholder in the run swallowed every other pattern
 * @param bodyText    the anchor's body, verbatim
 * @param text        the rendered arm that replaces the run
 */
public record MergedArm(String patternText, boolean placeholder, String bodyText, String text) {
}
