package com.raditha.armmerge.model;

import java.util.List;

/**
 * An immutable snapshot of parsed source, reduced to what the merge refactoring reads:
 * the source text, the syntax used to render arms, and every match construct in it.
 * Nested constructs appear as blocks of their own.
 */
public interface MatchTree {

    String text();

    MatchDialect dialect();

    List<MatchBlock> blocks();
}
