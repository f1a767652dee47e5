package com.raditha.armmerge.refactoring;

import com.raditha.armmerge.model.MatchArm;
import com.raditha.armmerge.model.SourceFragment;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the arms that can be merged into the anchor.
 * <p>
 * Only the arms after the anchor are candidates. Arms before it are never looked at,
 * even when their body matches.
 */
public class RunCollector {

    /**
     * Walk forward from the anchor while the arms have no guard and a body whose text
     * equals the anchor's body exactly.
     *
     * @return the run, starting with the anchor arm; a single element means nothing to merge
     */
    public List<MatchArm> collect(Anchor anchor) {
        SourceFragment anchorBody = anchor.body();
        List<MatchArm> arms = anchor.block().arms();

        List<MatchArm> run = new ArrayList<>();
        run.add(anchor.arm());
        for (int i = anchor.index() + 1; i < arms.size(); i++) {
            MatchArm candidate = arms.get(i);
            if (!canJoin(candidate, anchorBody)) {
                break;
            }
            run.add(candidate);
        }
        return run;
    }

    private static boolean canJoin(MatchArm candidate, SourceFragment anchorBody) {
        if (candidate.hasGuard()) {
            return false;
        }
        return candidate.getBody()
                .map(body -> body.sameTextAs(anchorBody))
                .orElse(false);
    }
}
