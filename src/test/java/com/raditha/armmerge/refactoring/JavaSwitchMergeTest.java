package com.raditha.armmerge.refactoring;

import com.raditha.armmerge.model.ArmTree;
import com.raditha.armmerge.tree.JavaSwitchParser;
import org.junit.jupiter.api.Test;

import static com.raditha.armmerge.refactoring.AssistChecks.checkAssist;
import static com.raditha.armmerge.refactoring.AssistChecks.checkNotApplicable;

/**
 * Merging switch rules in Java source parsed with JavaParser.
 */
class JavaSwitchMergeTest {

    private final JavaSwitchParser parser = new JavaSwitchParser();

    private void check(String before, String after) {
        int cursor = before.indexOf(MatchFixture.CURSOR);
        String source = before.replace(MatchFixture.CURSOR, "");
        ArmTree tree = parser.parse(source);
        checkAssist(tree, cursor, after);
    }

    private void checkRejected(String before) {
        int cursor = before.indexOf(MatchFixture.CURSOR);
        ArmTree tree = parser.parse(before.replace(MatchFixture.CURSOR, ""));
        checkNotApplicable(tree, cursor);
    }

    @Test
    void testMergesRulesWithSameExpression() {
        check("""
                class Colors {
                    int weight(Color c) {
                        return switch (c) {
                            case RED -> 1<|>;
                            case GREEN -> 1;
                            case BLUE -> 2;
                        };
                    }
                }
                """, """
                class Colors {
                    int weight(Color c) {
                        return switch (c) {
                            case RED, GREEN -> 1<|>;
                            case BLUE -> 2;
                        };
                    }
                }
                """);
    }

    @Test
    void testMergesLabelListsAndBlocks() {
        check("""
                class Colors {
                    void paint(Color c) {
                        switch (c) {
                            case <|>RED, ORANGE -> { warm(); }
                            case YELLOW -> { warm(); }
                            case BLUE -> { cold(); }
                        }
                    }
                }
                """, """
                class Colors {
                    void paint(Color c) {
                        switch (c) {
                            case <|>RED, ORANGE, YELLOW -> { warm(); }
                            case BLUE -> { cold(); }
                        }
                    }
                }
                """);
    }

    @Test
    void testDefaultSwallowsTheLabels() {
        check("""
                class Colors {
                    int weight(Color c) {
                        return switch (c) {
                            case RED -> 1;
                            case GREEN -> 0<|>;
                            default -> 0;
                        };
                    }
                }
                """, """
                class Colors {
                    int weight(Color c) {
                        return switch (c) {
                            case RED -> 1;
                            default -> 0<|>;
                        };
                    }
                }
                """);
    }

    @Test
    void testGuardedRuleIsNotMerged() {
        checkRejected("""
                class Shapes {
                    String describe(Object o) {
                        return switch (o) {
                            case Integer i when i > 5 -> "n<|>umber";
                            case String s -> "number";
                            default -> "other";
                        };
                    }
                }
                """);
    }

    @Test
    void testColonEntriesAreNotMerged() {
        checkRejected("""
                class Legacy {
                    void run(int x) {
                        switch (x) {
                            case 1<|>:
                                break;
                            case 2:
                                break;
                        }
                    }
                }
                """);
    }

    @Test
    void testInnerSwitchIsMergedWhenCursorIsInside() {
        check("""
                class Nested {
                    int pick(int a, int b) {
                        return switch (a) {
                            case 1 -> switch (b) {
                                case 1 -> 10<|>;
                                case 2 -> 10;
                                default -> 20;
                            };
                            default -> 0;
                        };
                    }
                }
                """, """
                class Nested {
                    int pick(int a, int b) {
                        return switch (a) {
                            case 1 -> switch (b) {
                                case 1, 2 -> 10<|>;
                                default -> 20;
                            };
                            default -> 0;
                        };
                    }
                }
                """);
    }

    @Test
    void testNullDefaultKeepsTheNullLabel() {
        check("""
                class Names {
                    int code(String s) {
                        return switch (s) {
                            case "a" -> 0<|>;
                            case null, default -> 0;
                        };
                    }
                }
                """, """
                class Names {
                    int code(String s) {
                        return switch (s) {
                            case null, default -> 0<|>;
                        };
                    }
                }
                """);
    }

    @Test
    void testTypePatternsAreNotJoined() {
        checkRejected("""
                class Shapes {
                    int rank(Object o) {
                        return switch (o) {
                            case String s -> 1<|>;
                            case Integer i -> 1;
                            default -> 2;
                        };
                    }
                }
                """);
    }

    @Test
    void testRecordPatternIsNotJoined() {
        checkRejected("""
                class Shapes {
                    record Point(int x, int y) {}

                    int rank(Object o) {
                        return switch (o) {
                            case Point(int x, int y) -> 1<|>;
                            case String s -> 1;
                            default -> 2;
                        };
                    }
                }
                """);
    }

    @Test
    void testLoneNullLabelIsNotJoined() {
        checkRejected("""
                class Names {
                    int code(String s) {
                        return switch (s) {
                            case "a" -> 1<|>;
                            case null -> 1;
                            default -> 2;
                        };
                    }
                }
                """);
        checkRejected("""
                class Names {
                    int code(String s) {
                        return switch (s) {
                            case null -> 1<|>;
                            case "a" -> 1;
                            default -> 2;
                        };
                    }
                }
                """);
    }

    @Test
    void testPatternRuleWithWhenEndsTheRun() {
        check("""
                class Colors {
                    String tone(Color c) {
                        return switch (c) {
                            case RED -> "warm"<|>;
                            case ORANGE -> "warm";
                            case Color d when d.isDark() -> "warm";
                            case YELLOW -> "warm";
                            default -> "cold";
                        };
                    }
                }
                """, """
                class Colors {
                    String tone(Color c) {
                        return switch (c) {
                            case RED, ORANGE -> "warm"<|>;
                            case Color d when d.isDark() -> "warm";
                            case YELLOW -> "warm";
                            default -> "cold";
                        };
                    }
                }
                """);
    }

    @Test
    void testLeadingDefaultSwallowsFollowingRules() {
        check("""
                class Colors {
                    int weight(Color c) {
                        return switch (c) {
                            def<|>ault -> 0;
                            case RED -> 0;
                            case GREEN -> 1;
                        };
                    }
                }
                """, """
                class Colors {
                    int weight(Color c) {
                        return switch (c) {
                            def<|>ault -> 0;
                            case GREEN -> 1;
                        };
                    }
                }
                """);
    }

    @Test
    void testRuleAfterDefaultDoesNotMergeBackwards() {
        check("""
                class Colors {
                    int weight(Color c) {
                        return switch (c) {
                            default -> 0;
                            case RED -> 0<|>;
                            case GREEN -> 0;
                            case BLUE -> 1;
                        };
                    }
                }
                """, """
                class Colors {
                    int weight(Color c) {
                        return switch (c) {
                            default -> 0;
                            case RED, GREEN -> 0<|>;
                            case BLUE -> 1;
                        };
                    }
                }
                """);
        checkRejected("""
                class Colors {
                    int weight(Color c) {
                        return switch (c) {
                            default -> 0;
                            case RED -> 0<|>;
                            case BLUE -> 1;
                        };
                    }
                }
                """);
    }
}
