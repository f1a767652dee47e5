package com.raditha.armmerge.refactoring;

import com.raditha.armmerge.model.MatchArm;
import com.raditha.armmerge.model.MatchTree;
import com.raditha.armmerge.model.SourceEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Merges consecutive match arms that have the same body.
 * <p>
 * Given
 * <pre>
 * match action {
 *     Action::Move(..) =&gt; foo(),
 *     Action::Stop =&gt; foo(),
 * }
 * </pre>
 * with the cursor in the first arm, the result is
 * <pre>
 * match action {
 *     Action::Move(..) | Action::Stop =&gt; foo(),
 * }
 * </pre>
 * Arms are merged forward from the arm under the cursor, as long as they carry no
 * guard and their body text is identical. If any merged arm is a placeholder, the
 * merged arm becomes the placeholder.
 */
public class MergeMatchArms {

    public static final AssistId ID = new AssistId("merge_match_arms", "MergeMatchArms");
    public static final String LABEL = "Merge match arms";

    private static final Logger logger = LoggerFactory.getLogger(MergeMatchArms.class);

    private final AnchorLocator anchorLocator;
    private final RunCollector runCollector;
    private final PatternMerger patternMerger;
    private final CursorRemapper cursorRemapper;
    private final EditEmitter editEmitter;

    public MergeMatchArms() {
        this(new AnchorLocator(), new RunCollector(), new PatternMerger(), new CursorRemapper(), new EditEmitter());
    }

    public MergeMatchArms(AnchorLocator anchorLocator, RunCollector runCollector, PatternMerger patternMerger,
            CursorRemapper cursorRemapper, EditEmitter editEmitter) {
        this.anchorLocator = anchorLocator;
        this.runCollector = runCollector;
        this.patternMerger = patternMerger;
        this.cursorRemapper = cursorRemapper;
        this.editEmitter = editEmitter;
    }

    /**
     * Try to merge the arms at {@code cursor}.
     *
     * @param tree   the parsed source
     * @param cursor absolute cursor offset
     * @return the assist, or empty when the operation does not apply at the cursor
     */
    public Optional<Assist> apply(MatchTree tree, int cursor) {
        Objects.requireNonNull(tree, "tree");

        Optional<Anchor> located = anchorLocator.locate(tree, cursor);
        if (located.isEmpty()) {
            return Optional.empty();
        }
        Anchor anchor = located.get();

        List<MatchArm> run = runCollector.collect(anchor);
        if (run.size() <= 1) {
            logger.debug("No following arm shares the body of the arm at {}", anchor.arm().range());
            return Optional.empty();
        }

        MergedArm merged = patternMerger.merge(run, tree.dialect());
        int runStart = run.get(0).range().start();
        int newCursor = cursorRemapper.remap(anchor.cursor(), runStart, merged.text().length());
        SourceEdit edit = editEmitter.emit(anchor.arm(), run, merged.text(), newCursor);

        logger.debug("Merging {} arms into '{}'", run.size(), merged.text());
        return Optional.of(new Assist(ID, LABEL, edit));
    }
}
