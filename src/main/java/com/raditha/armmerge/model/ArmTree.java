package com.raditha.armmerge.model;

import java.util.List;
import java.util.Objects;

/**
 * Plain {@link MatchTree} built by a parser front end or assembled directly.
 *
 * @param text    the source text every range refers to
 * @param dialect how merged arms are rendered
 * @param blocks  all match constructs of the source
 */
public record ArmTree(String text, MatchDialect dialect, List<MatchBlock> blocks) implements MatchTree {

    public ArmTree {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(dialect, "dialect");
        Objects.requireNonNull(blocks, "blocks");
        blocks = List.copyOf(blocks);
        for (MatchBlock block : blocks) {
            if (block.range().end() > text.length()) {
                throw new IllegalArgumentException("Block " + block.range()
                        + " lies outside text of length " + text.length());
            }
        }
    }
}
