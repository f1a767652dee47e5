package com.raditha.armmerge.refactoring;

/**
 * Moves the cursor across the merge edit.
 */
public class CursorRemapper {

    /**
     * Compute the cursor offset in the edited text.
     * <p>
     * A cursor in the anchor's body keeps its distance to the end of the body, which
     * ends the merged arm as well. A cursor elsewhere in the anchor keeps its absolute
     * offset: the merged arm starts where the anchor started and begins with the
     * anchor's own patterns. Either way the result is kept inside the merged arm.
     *
     * @param cursor       the classified original cursor
     * @param runStart     offset where the replaced region (and the merged arm) starts
     * @param mergedLength length of the merged arm text
     */
    public int remap(CursorPosition cursor, int runStart, int mergedLength) {
        int mergedEnd = runStart + mergedLength;
        int offset = cursor.isInBody()
                ? mergedEnd - cursor.value()
                : cursor.value();
        return Math.max(runStart, Math.min(offset, mergedEnd));
    }
}
