package com.raditha.armmerge.refactoring;

import com.raditha.armmerge.model.ArmTree;
import com.raditha.armmerge.model.MatchArm;
import com.raditha.armmerge.model.MatchBlock;
import com.raditha.armmerge.model.MatchDialect;
import com.raditha.armmerge.model.Pattern;
import com.raditha.armmerge.model.PatternKind;
import com.raditha.armmerge.model.SourceFragment;
import com.raditha.armmerge.model.TextRange;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Builds match expression source text and its tree side by side.
 * A {@code <|>} anywhere in the appended text marks the cursor and is removed.
 * The patterns {@code _}, {@code default} and {@code case null, default} are placeholders.
 */
class MatchFixture {

    static final String CURSOR = "<|>";

    private final StringBuilder text = new StringBuilder();
    private final List<MatchArm> arms = new ArrayList<>();
    private int blockStart = -1;
    private int cursor = -1;

    /**
     * Append plain text (separators, comments, surrounding code).
     */
    MatchFixture text(String raw) {
        append(raw);
        return this;
    }

    /**
     * Append the header of the construct and mark where the block starts.
     */
    MatchFixture open(String header) {
        blockStart = text.length();
        append(header);
        return this;
    }

    MatchFixture arm(Consumer<ArmSpec> spec) {
        ArmSpec arm = new ArmSpec();
        spec.accept(arm);
        arms.add(arm.build());
        return this;
    }

    /**
     * Shorthand for an arm with one pattern and a body.
     */
    MatchFixture arm(String pattern, String body) {
        return arm(a -> a.pattern(pattern).body(body));
    }

    ArmTree tree() {
        int start = blockStart < 0 ? 0 : blockStart;
        MatchBlock block = new MatchBlock(new TextRange(start, text.length()), arms);
        return new ArmTree(text.toString(), MatchDialect.MATCH_EXPRESSION, List.of(block));
    }

    int cursor() {
        if (cursor < 0) {
            throw new IllegalStateException("Fixture has no " + CURSOR + " marker");
        }
        return cursor;
    }

    private static boolean isPlaceholder(String pattern) {
        return "_".equals(pattern) || "default".equals(pattern) || "case null, default".equals(pattern);
    }

    private TextRange append(String raw) {
        int start = text.length();
        int marker = raw.indexOf(CURSOR);
        if (marker >= 0) {
            if (cursor >= 0) {
                throw new IllegalStateException("Fixture has more than one cursor marker");
            }
            cursor = start + marker;
            raw = raw.substring(0, marker) + raw.substring(marker + CURSOR.length());
        }
        text.append(raw);
        return new TextRange(start, text.length());
    }

    class ArmSpec {
        private final List<String> patterns = new ArrayList<>();
        private String separator = " | ";
        private String arrow = " => ";
        private String guard;
        private String body;

        ArmSpec pattern(String pattern) {
            patterns.add(pattern);
            return this;
        }

        ArmSpec separator(String separator) {
            this.separator = separator;
            return this;
        }

        ArmSpec arrow(String arrow) {
            this.arrow = arrow;
            return this;
        }

        ArmSpec guard(String guard) {
            this.guard = guard;
            return this;
        }

        ArmSpec body(String body) {
            this.body = body;
            return this;
        }

        private MatchArm build() {
            int start = text.length();
            List<Pattern> built = new ArrayList<>();
            for (int i = 0; i < patterns.size(); i++) {
                if (i > 0) {
                    append(separator);
                }
                TextRange range = append(patterns.get(i));
                String patternText = text.substring(range.start(), range.end());
                PatternKind kind = isPlaceholder(patternText) ? PatternKind.PLACEHOLDER : PatternKind.OTHER;
                built.add(new Pattern(kind, patternText, range));
            }
            SourceFragment guardFragment = null;
            if (guard != null) {
                append(" if ");
                TextRange range = append(guard);
                guardFragment = SourceFragment.of(text.toString(), range);
            }
            SourceFragment bodyFragment = null;
            if (body != null) {
                append(arrow);
                TextRange range = append(body);
                bodyFragment = SourceFragment.of(text.toString(), range);
            }
            return new MatchArm(built, guardFragment, bodyFragment, new TextRange(start, text.length()));
        }
    }
}
