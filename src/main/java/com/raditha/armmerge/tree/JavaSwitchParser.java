package com.raditha.armmerge.tree;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.PatternExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.raditha.armmerge.model.ArmTree;
import com.raditha.armmerge.model.MatchArm;
import com.raditha.armmerge.model.MatchBlock;
import com.raditha.armmerge.model.MatchDialect;
import com.raditha.armmerge.model.Pattern;
import com.raditha.armmerge.model.PatternKind;
import com.raditha.armmerge.model.SourceFragment;
import com.raditha.armmerge.model.TextRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads the switch statements and switch expressions of a Java source file into a
 * {@link com.raditha.armmerge.model.MatchTree}.
 * <p>
 * Every switch becomes a block and every entry an arm. Arrow entries
 * ({@code case A, B -> body}) carry their labels as patterns, their {@code when}
 * clause as the guard and everything from the first body statement to the end of the
 * entry as the body. {@code default} and {@code case null, default} become a single
 * placeholder pattern. Colon entries ({@code case A:}) are arms without a body.
 */
public class JavaSwitchParser {

    private static final Logger logger = LoggerFactory.getLogger(JavaSwitchParser.class);
    private static final String DEFAULT_KEYWORD = "default";

    private final ParserConfiguration.LanguageLevel languageLevel;

    public JavaSwitchParser() {
        this(ParserConfiguration.LanguageLevel.JAVA_21);
    }

    public JavaSwitchParser(ParserConfiguration.LanguageLevel languageLevel) {
        this.languageLevel = languageLevel;
    }

    /**
     * Parse a compilation unit.
     *
     * @param source the complete text of a Java file
     * @return the snapshot, with ranges pointing into {@code source}
     * @throws IllegalArgumentException if the source does not parse
     */
    public ArmTree parse(String source) {
        JavaParser parser = new JavaParser(new ParserConfiguration().setLanguageLevel(languageLevel));
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Unable to parse source: " + problems);
        }
        CompilationUnit cu = result.getResult().get();

        LineIndex index = new LineIndex(source);
        List<MatchBlock> blocks = new ArrayList<>();
        for (SwitchStmt stmt : cu.findAll(SwitchStmt.class)) {
            blocks.add(toBlock(stmt, stmt.getEntries(), source, index));
        }
        for (SwitchExpr expr : cu.findAll(SwitchExpr.class)) {
            blocks.add(toBlock(expr, expr.getEntries(), source, index));
        }
        blocks.sort(Comparator.comparingInt(b -> b.range().start()));

        logger.debug("Found {} switch blocks", blocks.size());
        return new ArmTree(source, MatchDialect.JAVA_SWITCH, blocks);
    }

    private MatchBlock toBlock(Node switchNode, NodeList<SwitchEntry> entries, String source, LineIndex index) {
        List<MatchArm> arms = new ArrayList<>();
        for (SwitchEntry entry : entries) {
            arms.add(toArm(entry, source, index));
        }
        return new MatchBlock(rangeOf(switchNode, index), arms);
    }

    private MatchArm toArm(SwitchEntry entry, String source, LineIndex index) {
        TextRange armRange = rangeOf(entry, index);

        List<Pattern> patterns = new ArrayList<>();
        if (entry.isDefault() || entry.getLabels().isEmpty()) {
            // default, or case null, default: one placeholder label written as it stands
            TextRange label = new TextRange(armRange.start(), defaultKeywordEnd(entry, source, index, armRange));
            patterns.add(new Pattern(PatternKind.PLACEHOLDER, label.slice(source), label));
        } else {
            for (Expression label : entry.getLabels()) {
                TextRange range = rangeOf(label, index);
                patterns.add(new Pattern(PatternKind.OTHER, range.slice(source), range));
            }
        }

        SourceFragment guard = entry.getGuard()
                .map(g -> SourceFragment.of(source, rangeOf(g, index)))
                .orElse(null);

        SourceFragment body = null;
        if (entry.getType() != SwitchEntry.Type.STATEMENT_GROUP && entry.getStatements().isNonEmpty()
                && canShareLabel(entry)) {
            int bodyStart = rangeOf(entry.getStatement(0), index).start();
            body = SourceFragment.of(source, new TextRange(bodyStart, armRange.end()));
        }

        return new MatchArm(patterns, guard, body, armRange);
    }

    /**
     * Type and record patterns declare bindings and a lone {@code null} may only be
     * combined with {@code default}, so neither can be joined into another case label.
     * Such entries are read without a body and never take part in a merge.
     */
    private static boolean canShareLabel(SwitchEntry entry) {
        if (entry.isDefault()) {
            return true;
        }
        for (Expression label : entry.getLabels()) {
            if (label instanceof PatternExpr || label.isNullLiteralExpr()) {
                return false;
            }
        }
        return true;
    }

    private static int defaultKeywordEnd(SwitchEntry entry, String source, LineIndex index, TextRange armRange) {
        NodeList<Expression> labels = entry.getLabels();
        int searchFrom = labels.isEmpty() ? armRange.start() : rangeOf(labels.get(labels.size() - 1), index).end();
        int at = source.indexOf(DEFAULT_KEYWORD, searchFrom);
        if (at < 0 || at + DEFAULT_KEYWORD.length() > armRange.end()) {
            throw new IllegalStateException("No default keyword in switch entry at " + armRange);
        }
        return at + DEFAULT_KEYWORD.length();
    }

    private static TextRange rangeOf(Node node, LineIndex index) {
        Range range = node.getRange()
                .orElseThrow(() -> new IllegalStateException("Node has no range: " + node));
        return new TextRange(index.offsetOf(range.begin), index.offsetOf(range.end) + 1);
    }
}
