package com.raditha.armmerge.refactoring;

import com.raditha.armmerge.model.MatchArm;
import com.raditha.armmerge.model.SourceEdit;
import com.raditha.armmerge.model.TextEdit;
import com.raditha.armmerge.model.TextRange;

import java.util.List;

/**
 * Packages a merge into a {@link SourceEdit}. Applying it is up to the caller.
 */
public class EditEmitter {

    /**
     * @param anchor     the arm under the cursor; its range is the highlight target
     * @param run        the arms being replaced, anchor first
     * @param mergedText the replacement for the whole run
     * @param cursor     the remapped cursor offset
     */
    public SourceEdit emit(MatchArm anchor, List<MatchArm> run, String mergedText, int cursor) {
        TextRange replaced = new TextRange(
                run.get(0).range().start(),
                run.get(run.size() - 1).range().end());
        return new SourceEdit(anchor.range(), new TextEdit(replaced, mergedText), cursor);
    }
}
