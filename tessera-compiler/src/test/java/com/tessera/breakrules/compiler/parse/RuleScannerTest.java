package com.tessera.breakrules.compiler.parse;

import com.tessera.breakrules.api.exceptions.RuleSyntaxException;
import com.tessera.breakrules.api.model.RuleErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleScannerTest {

    private static ParsedRules parse(String rules) {
        return new RuleScanner(rules).parse();
    }

    @Nested
    @DisplayName("Well-formed rules")
    class WellFormed {

        @Test
        @DisplayName("Should parse variables and rules into the forward tree")
        void shouldParseVariablesAndRules() {
            ParsedRules parsed = parse("$A = [a-z]; $A $A*;");

            assertThat(parsed.ruleCount()).isEqualTo(1);
            assertThat(parsed.variableCount()).isEqualTo(1);
            assertThat(parsed.root(RuleTree.FORWARD)).isNotEqualTo(RuleNode.NONE);
            assertThat(parsed.defaultTree()).isEqualTo(RuleTree.FORWARD);
            assertThat(parsed.statusValues().toIntArray()).containsExactly(0);
            assertThat(parsed.setLeaves()).extracting(SetLeaf::sourceText).containsExactly("[a-z]", "any");
        }

        @Test
        @DisplayName("Should default the reverse tree to any-star")
        void shouldDefaultReverseTree() {
            ParsedRules parsed = parse("a;");

            int reverse = parsed.root(RuleTree.REVERSE);
            RuleNode star = parsed.arena().get(reverse);
            assertThat(star.type()).isEqualTo(NodeType.STAR);
            RuleNode any = parsed.arena().get(star.left());
            assertThat(any.type()).isEqualTo(NodeType.SET_REF);
            assertThat(parsed.setLeaves().get(any.setLeaf()).codePoints().size()).isEqualTo(0x110000L);
            assertThat(parsed.root(RuleTree.SAFE_FORWARD)).isEqualTo(RuleNode.NONE);
        }

        @Test
        @DisplayName("Should share one leaf between identical set expressions")
        void shouldShareIdenticalSets() {
            ParsedRules parsed = parse("[a-z] [0-9]; [a-z]+;");

            assertThat(parsed.setLeaves()).extracting(SetLeaf::sourceText)
                    .containsExactly("[a-z]", "[0-9]", "any");
            assertThat(parsed.ruleCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should record options and route rules to the selected trees")
        void shouldRecordOptions() {
            ParsedRules parsed = parse("""
                    !!chain;
                    !!LBCMNoChain;
                    !!lookAheadHardBreak;
                    !!forward;
                    a b;
                    !!reverse;
                    b a;
                    !c;
                    !!safe_forward;
                    d;
                    """);

            assertThat(parsed.options()).isEqualTo(new RuleOptions(true, true, true, false));
            assertThat(parsed.root(RuleTree.FORWARD)).isNotEqualTo(RuleNode.NONE);
            assertThat(parsed.root(RuleTree.REVERSE)).isNotEqualTo(RuleNode.NONE);
            assertThat(parsed.root(RuleTree.SAFE_REVERSE)).isNotEqualTo(RuleNode.NONE);
            assertThat(parsed.root(RuleTree.SAFE_FORWARD)).isNotEqualTo(RuleNode.NONE);
            assertThat(parsed.defaultTree()).isEqualTo(RuleTree.SAFE_FORWARD);
        }

        @Test
        @DisplayName("Should collect distinct status tags in first-seen order")
        void shouldCollectStatusTags() {
            ParsedRules parsed = parse("[a-z]+ {200}; [0-9]+ {100}; [A-Z]+ {200};");

            assertThat(parsed.statusValues().toIntArray()).containsExactly(0, 200, 100);
        }

        @Test
        @DisplayName("Should append an end mark to look-ahead rules")
        void shouldAppendEndMarkToLookAheadRules() {
            ParsedRules parsed = parse("[a-z]+ / [0-9];");

            RuleNode root = parsed.arena().get(parsed.root(RuleTree.FORWARD));
            assertThat(root.type()).isEqualTo(NodeType.CAT);
            assertThat(root.isRuleRoot()).isTrue();
            RuleNode end = parsed.arena().get(root.right());
            assertThat(end.type()).isEqualTo(NodeType.END_MARK);
            assertThat(end.val()).isEqualTo(1);
            assertThat(end.isLookAheadEnd()).isTrue();
        }

        @Test
        @DisplayName("Should mark rules with a caret as not chaining in")
        void shouldMarkNoChainRules() {
            ParsedRules parsed = parse("^a b;");

            RuleNode root = parsed.arena().get(parsed.root(RuleTree.FORWARD));
            assertThat(root.isRuleRoot()).isTrue();
            assertThat(root.isChainIn()).isFalse();
        }

        @Test
        @DisplayName("Should parse set operations, properties and escapes")
        void shouldParseSetsAndEscapes() {
            ParsedRules parsed = parse("""
                    $L = [[a-z] - [aeiou]];
                    $D = [\\p{Nd} & [0-9]];
                    $L $D 'x''y' \\u0041 \\x{1F600};
                    """);

            SetLeaf consonants = parsed.setLeaves().get(0);
            assertThat(consonants.codePoints().contains('b')).isTrue();
            assertThat(consonants.codePoints().contains('a')).isFalse();
            SetLeaf digits = parsed.setLeaves().get(1);
            assertThat(digits.codePoints().size()).isEqualTo(10L);
            assertThat(parsed.setLeaves()).extracting(SetLeaf::sourceText)
                    .contains("x", "'", "y", "A", new String(Character.toChars(0x1F600)));
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
                "[\\p{Line_Break=Alphabetic}]",
                "[\\p{Word_Break=ALetter}]",
                "[\\p{Grapheme_Cluster_Break=Extend}]",
                "[\\p{Extended_Pictographic}]",
                "[[:Line_Break=Numeric:]]",
                "\\p{Sentence_Break=Upper}"})
        @DisplayName("Should resolve the Unicode break properties")
        void shouldResolveBreakProperties(String set) {
            ParsedRules parsed = parse("$X = " + set + "; $X+;");

            SetLeaf leaf = parsed.setLeaves().get(0);
            assertThat(leaf.sourceText()).isEqualTo(set);
            assertThat(leaf.codePoints().isEmpty()).isFalse();
        }

        @Test
        @DisplayName("Should substitute set variables inside sets, markers included")
        void shouldSubstituteSetVariables() {
            ParsedRules parsed = parse("""
                    $Start = [{bof} a-c];
                    $Letters = [[$Start x] - [b]];
                    $Letters;
                    """);

            SetLeaf letters = parsed.setLeaves().get(1);
            assertThat(letters.sourceText()).isEqualTo("[[$Start x] - [b]]");
            assertThat(letters.containsBeginOfText()).isTrue();
            assertThat(letters.codePoints().contains('a')).isTrue();
            assertThat(letters.codePoints().contains('b')).isFalse();
            assertThat(letters.codePoints().contains('x')).isTrue();
        }

        @Test
        @DisplayName("Should keep bof and eof markers of a set")
        void shouldKeepTextBoundaryMarkers() {
            ParsedRules parsed = parse("[{bof} a] b;");

            SetLeaf leaf = parsed.setLeaves().get(0);
            assertThat(leaf.containsBeginOfText()).isTrue();
            assertThat(leaf.containsEndOfText()).isFalse();
            assertThat(leaf.codePoints().contains('a')).isTrue();
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class SyntaxErrors {

        static Stream<Arguments> errors() {
            return Stream.of(
                    Arguments.of("$A = [a-z;", RuleErrorCode.UNCLOSED_SET),
                    Arguments.of("a b", RuleErrorCode.SEMICOLON_EXPECTED),
                    Arguments.of("(a b;", RuleErrorCode.MISMATCHED_PAREN),
                    Arguments.of("a b);", RuleErrorCode.MISMATCHED_PAREN),
                    Arguments.of("$A = a; $A = b; $A;", RuleErrorCode.VARIABLE_REDEFINITION),
                    Arguments.of("$B;", RuleErrorCode.UNDEFINED_VARIABLE),
                    Arguments.of("'ab\ncd';", RuleErrorCode.NEW_LINE_IN_QUOTED_STRING),
                    Arguments.of("\\u12;", RuleErrorCode.HEX_DIGITS_EXPECTED),
                    Arguments.of("!!nonsense; a;", RuleErrorCode.UNRECOGNIZED_OPTION),
                    Arguments.of("a {x};", RuleErrorCode.MALFORMED_RULE_TAG),
                    Arguments.of("[\\p{NoSuchProperty}];", RuleErrorCode.MALFORMED_SET),
                    Arguments.of("[z-a];", RuleErrorCode.MALFORMED_SET),
                    Arguments.of("[a] ; [[a] & [b]];", RuleErrorCode.RULE_EMPTY_SET),
                    Arguments.of("$A = [a-z]; [$B];", RuleErrorCode.UNDEFINED_VARIABLE),
                    Arguments.of("$A = abc; [$A];", RuleErrorCode.MALFORMED_SET),
                    Arguments.of("[{abc} d];", RuleErrorCode.MALFORMED_SET),
                    Arguments.of("a = b;", RuleErrorCode.ASSIGN_ERROR),
                    Arguments.of("$A = a / b; $A;", RuleErrorCode.RULE_SYNTAX),
                    Arguments.of("a / b / c;", RuleErrorCode.RULE_SYNTAX),
                    Arguments.of("a {5}*;", RuleErrorCode.RULE_SYNTAX),
                    Arguments.of("!!reverse; a;", RuleErrorCode.RULE_SYNTAX),
                    Arguments.of("!!quoted_literals_only; a;", RuleErrorCode.RULE_SYNTAX));
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @MethodSource("errors")
        @DisplayName("Should report the matching error code")
        void shouldReportErrorCode(String rules, RuleErrorCode expected) {
            assertThatThrownBy(() -> parse(rules))
                    .isInstanceOfSatisfying(RuleSyntaxException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(expected));
        }

        @Test
        @DisplayName("Should locate an unclosed set at its opening bracket")
        void shouldLocateUnclosedSet() {
            assertThatThrownBy(() -> parse("$A = [a-z;"))
                    .isInstanceOfSatisfying(RuleSyntaxException.class, e -> {
                        assertThat(e.getLocation().line()).isEqualTo(1);
                        assertThat(e.getLocation().offset()).isEqualTo(5);
                        assertThat(e.getLocation().preContext()).isEqualTo("$A = ");
                        assertThat(e.getLocation().postContext()).isEqualTo("[a-z;");
                    });
        }

        @Test
        @DisplayName("Should locate an undefined variable inside a set at its dollar sign")
        void shouldLocateUndefinedSetVariable() {
            assertThatThrownBy(() -> parse("[a-z] [x $Missing];"))
                    .isInstanceOfSatisfying(RuleSyntaxException.class, e -> {
                        assertThat(e.getErrorCode()).isEqualTo(RuleErrorCode.UNDEFINED_VARIABLE);
                        assertThat(e.getLocation().offset()).isEqualTo(9);
                        assertThat(e.getLocation().postContext()).startsWith("$Missing");
                    });
        }

        @Test
        @DisplayName("Should locate a later unclosed set at its opening bracket")
        void shouldLocateLaterUnclosedSet() {
            assertThatThrownBy(() -> parse("[a-z]+; [abc"))
                    .isInstanceOfSatisfying(RuleSyntaxException.class, e -> {
                        assertThat(e.getErrorCode()).isEqualTo(RuleErrorCode.UNCLOSED_SET);
                        assertThat(e.getLocation().line()).isEqualTo(1);
                        assertThat(e.getLocation().offset()).isEqualTo(8);
                    });
        }

        @Test
        @DisplayName("Should count lines and offsets in code points")
        void shouldCountLinesInCodePoints() {
            String rules = "a;\r\n😀 $Missing;";

            assertThatThrownBy(() -> parse(rules))
                    .isInstanceOfSatisfying(RuleSyntaxException.class, e -> {
                        assertThat(e.getErrorCode()).isEqualTo(RuleErrorCode.UNDEFINED_VARIABLE);
                        assertThat(e.getLocation().line()).isEqualTo(2);
                        assertThat(e.getLocation().offset()).isEqualTo(2);
                    });
        }

        @Test
        @DisplayName("Should refuse to parse twice")
        void shouldRefuseSecondParse() {
            RuleScanner scanner = new RuleScanner("a;");
            scanner.parse();

            assertThatThrownBy(scanner::parse).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Rule stripping")
    class Stripping {

        @Test
        @DisplayName("Should drop comments and white space after semicolons")
        void shouldStripCommentsAndSpaces() {
            String rules = "$A = [a-z];   # letters\n  $A+;\n";

            assertThat(RuleScanner.stripRules(rules)).isEqualTo("$A = [a-z];$A+;");
        }

        @Test
        @DisplayName("Should keep hash characters inside quotes, sets and escapes")
        void shouldKeepQuotedHashes() {
            String rules = "'#' [#] \\#;";

            assertThat(RuleScanner.stripRules(rules)).isEqualTo(rules);
        }
    }
}
