package com.raditha.armmerge.config;

import com.github.javaparser.ParserConfiguration;
import com.raditha.armmerge.cli.MergeMode;

import java.util.Objects;

/**
 * Settings for a merge run.
 *
 * @param languageLevel Java language level used to parse source files
 * @param mode          whether to preview or write the change
 * @param contextLines  context lines around each hunk of the preview diff
 * @param backup        copy the file to {@code <name>.bak} before writing it
 */
public record MergeConfig(
        ParserConfiguration.LanguageLevel languageLevel,
        MergeMode mode,
        int contextLines,
        boolean backup) {

    public MergeConfig {
        Objects.requireNonNull(languageLevel, "languageLevel");
        Objects.requireNonNull(mode, "mode");
        if (contextLines < 0) {
            throw new IllegalArgumentException("contextLines must be >= 0");
        }
    }

    /**
     * Defaults: Java 21 syntax, preview only, three context lines, keep a backup.
     */
    public static MergeConfig defaults() {
        return new MergeConfig(
                ParserConfiguration.LanguageLevel.JAVA_21,
                MergeMode.DRY_RUN,
                3,
                true);
    }
}
