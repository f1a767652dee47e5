package com.raditha.armmerge.refactoring;

import com.raditha.armmerge.model.MatchArm;
import com.raditha.armmerge.model.MatchBlock;
import com.raditha.armmerge.model.MatchTree;
import com.raditha.armmerge.model.SourceFragment;
import com.raditha.armmerge.model.TextRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Finds the arm enclosing the cursor and decides whether a merge may start there.
 */
public class AnchorLocator {

    private static final Logger logger = LoggerFactory.getLogger(AnchorLocator.class);

    /**
     * Locate the anchor arm for a cursor.
     * <p>
     * The innermost arm containing the cursor is chosen; when two arms are equally
     * small (the cursor sits on the boundary between them) the one starting at the
     * cursor wins. Arms with a guard or without a body never anchor a merge.
     *
     * @param tree   the tree snapshot
     * @param cursor absolute cursor offset
     * @return the anchor, or empty when no merge can start at the cursor
     */
    public Optional<Anchor> locate(MatchTree tree, int cursor) {
        if (cursor < 0) {
            throw new IllegalArgumentException("Cursor offset must be >= 0, got: " + cursor);
        }

        MatchBlock bestBlock = null;
        int bestIndex = -1;
        for (MatchBlock block : tree.blocks()) {
            for (int i = 0; i < block.arms().size(); i++) {
                TextRange range = block.arms().get(i).range();
                if (range.containsInclusive(cursor)
                        && (bestBlock == null || isBetter(range, bestBlock.arms().get(bestIndex).range()))) {
                    bestBlock = block;
                    bestIndex = i;
                }
            }
        }

        if (bestBlock == null) {
            logger.debug("No match arm at offset {}", cursor);
            return Optional.empty();
        }

        MatchArm arm = bestBlock.arms().get(bestIndex);
        if (arm.hasGuard()) {
            logger.debug("Arm at {} has a guard, not merging", arm.range());
            return Optional.empty();
        }
        Optional<SourceFragment> body = arm.getBody();
        if (body.isEmpty()) {
            logger.debug("Arm at {} has no body, not merging", arm.range());
            return Optional.empty();
        }

        return Optional.of(new Anchor(bestBlock, bestIndex, classify(arm, body.get(), cursor)));
    }

    private static boolean isBetter(TextRange candidate, TextRange current) {
        if (candidate.length() != current.length()) {
            return candidate.length() < current.length();
        }
        return candidate.start() > current.start();
    }

    private static CursorPosition classify(MatchArm arm, SourceFragment body, int cursor) {
        if (body.range().containsInclusive(cursor)) {
            return CursorPosition.inBody(arm.range().end() - cursor);
        }
        return CursorPosition.inPattern(cursor);
    }
}
