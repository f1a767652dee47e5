package com.raditha.armmerge.model;

/**
 * The tokens used to write a match arm in a particular syntax.
 */
public enum MatchDialect {

    /**
     * {@code A | B => body}, with {@code _} as the placeholder pattern.
     */
    MATCH_EXPRESSION("", " | ", "=>"),

    /**
     * Java switch rules: {@code case A, B -> body}. The placeholder is {@code default}
     * or {@code case null, default}, written as a whole label.
     */
    JAVA_SWITCH("case ", ", ", "->");

    // written in front of an ordinary pattern list, never in front of a placeholder label
    private final String patternPrefix;
    private final String alternationSeparator;
    private final String arrow;

    MatchDialect(String patternPrefix, String alternationSeparator, String arrow) {
        this.patternPrefix = patternPrefix;
        this.alternationSeparator = alternationSeparator;
        this.arrow = arrow;
    }

    public String alternationSeparator() {
        return alternationSeparator;
    }

    public String arrow() {
        return arrow;
    }

    /**
     * Render an arm from an already joined pattern list and the verbatim body text.
     *
     * @param patternText the merged pattern list, or a placeholder label as written
     * @param placeholder true when {@code patternText} is a placeholder label
     * @param bodyText    the body, copied as written
     * @return {@code <patterns> <arrow> <body>}
     */
    public String renderArm(String patternText, boolean placeholder, String bodyText) {
        String prefix = placeholder ? "" : patternPrefix;
        return prefix + patternText + " " + arrow + " " + bodyText;
    }
}
