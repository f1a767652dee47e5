package com.raditha.armmerge.refactoring;

import com.raditha.armmerge.model.MatchArm;
import com.raditha.armmerge.model.MatchBlock;
import com.raditha.armmerge.model.SourceFragment;

/**
 * The arm under the cursor, where every merge starts.
 *
 * @param block  the match construct that owns the arm
 * @param index  position of the arm within {@code block.arms()}
 * @param cursor where the cursor sat relative to the arm
 */
public record Anchor(MatchBlock block, int index, CursorPosition cursor) {

    public Anchor {
        if (index < 0 || index >= block.arms().size()) {
            throw new IllegalArgumentException("Arm index " + index + " out of bounds for block with "
                    + block.arms().size() + " arms");
        }
    }

    public MatchArm arm() {
        return block.arms().get(index);
    }

    /**
     * The anchor's body. Only anchors with a body are ever created.
     */
    public SourceFragment body() {
        return arm().getBody().orElseThrow(() -> new IllegalStateException("Anchor arm has no body"));
    }
}
