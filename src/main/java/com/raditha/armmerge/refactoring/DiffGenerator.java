package com.raditha.armmerge.refactoring;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.raditha.armmerge.model.SourceEdit;

import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs for refactoring previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Diff the source against the result of applying {@code edit} to it.
     *
     * @param fileName name shown in the diff headers
     * @param original the source before the edit
     * @param edit     the edit to preview
     */
    public String generateUnifiedDiff(String fileName, String original, SourceEdit edit) {
        return generateUnifiedDiff(fileName, original, edit.applyTo(original), DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String fileName, String original, String revised, int contextLines) {
        if (contextLines < 0) {
            throw new IllegalArgumentException("contextLines must be >= 0, got: " + contextLines);
        }
        List<String> originalLines = toLines(original);
        List<String> revisedLines = toLines(revised);

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> toLines(String text) {
        return Arrays.asList(text.split("\r\n|\r|\n", -1));
    }
}
