package com.tessera.breakrules.compiler.table;

import com.tessera.breakrules.api.exceptions.RuleCompilationException;
import com.tessera.breakrules.api.model.RuleErrorCode;
import com.tessera.breakrules.compiler.parse.ParsedRules;
import com.tessera.breakrules.compiler.parse.RuleScanner;
import com.tessera.breakrules.compiler.sets.CategoryBuilder;
import com.tessera.breakrules.runtime.model.RuleDataFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableBuilderTest {

    private static final String MARKS = "\u0301\u0301\u0301";

    private CategoryBuilder categories;

    private TableBuilder build(String rules) {
        return build(rules, RuleDataFormat.MAX_STATES);
    }

    private TableBuilder build(String rules, int maxStates) {
        ParsedRules parsed = new RuleScanner(rules).parse();
        categories = new CategoryBuilder(parsed.setLeaves());
        categories.buildRanges();
        TableBuilder tables = new TableBuilder(parsed, categories, maxStates);
        tables.buildForwardTable();
        return tables;
    }

    private int run(TableBuilder tables, String text) {
        int state = 1;
        for (int i = 0; i < text.length(); i++) {
            state = tables.transition(state, categories.categoryOf(text.charAt(i)));
        }
        return state;
    }

    @Test
    @DisplayName("Should build a stop state, a start state and an accepting loop")
    void shouldBuildSimpleTable() {
        TableBuilder tables = build("$A = [a-z]; $A $A*;");
        int letter = categories.categoryOf('a');

        assertThat(tables.stateCount()).isEqualTo(3);
        for (int c = 0; c < tables.numCategories(); c++) {
            assertThat(tables.transition(0, c)).isZero();
        }
        int afterOne = tables.transition(1, letter);
        assertThat(afterOne).isEqualTo(2);
        assertThat(tables.transition(afterOne, letter)).isEqualTo(afterOne);
        assertThat(tables.accepting(1)).isZero();
        assertThat(tables.accepting(afterOne)).isEqualTo(-1);
        assertThat(tables.transition(1, categories.categoryOf('5'))).isZero();
    }

    @Test
    @DisplayName("Should flag look-ahead states with the rule number")
    void shouldFlagLookAhead() {
        TableBuilder tables = build("[a-z]+ / [0-9];");

        int inWord = run(tables, "ab");
        assertThat(tables.lookAhead(inWord)).isEqualTo(1);
        assertThat(tables.accepting(inWord)).isZero();

        int matched = run(tables, "ab7");
        assertThat(tables.accepting(matched)).isEqualTo(1);
        assertThat(tables.lookAhead(matched)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should point tagged states at their status value")
    void shouldIndexStatusTags() {
        TableBuilder tables = build("[0-9]+ {100}; [a-z]+ {200};");

        assertThat(tables.tagIndex(run(tables, "42"))).isEqualTo(1);
        assertThat(tables.tagIndex(run(tables, "abc"))).isEqualTo(2);
        assertThat(tables.tagIndex(1)).isZero();
    }

    @Test
    @DisplayName("Should continue a match into a following rule only when chaining")
    void shouldChainRules() {
        TableBuilder plain = build("[a-z] [a-z];");
        assertThat(run(plain, "abc")).isZero();

        TableBuilder chained = build("!!chain; [a-z] [a-z];");
        assertThat(run(chained, "abc")).isNotZero();

        TableBuilder noChainIn = build("!!chain; ^[a-z] [a-z];");
        assertThat(run(noChainIn, "abc")).isZero();
    }

    @Test
    @DisplayName("Should not chain from combining marks under LBCMNoChain")
    void shouldNotChainFromCombiningMarks() {
        TableBuilder chained = build("!!chain; \\u0301 \\u0301;");
        assertThat(run(chained, MARKS)).isNotZero();

        TableBuilder noChain = build("!!chain; !!LBCMNoChain; \\u0301 \\u0301;");
        assertThat(run(noChain, MARKS)).isZero();
    }

    @Test
    @DisplayName("Should set table flags for look-ahead hard break and {bof}")
    void shouldExportFlags() {
        TableBuilder tables = build("!!lookAheadHardBreak; [{bof}] [a-z];");
        ByteBuffer buffer = ByteBuffer.allocate(tables.getTableSize()).order(RuleDataFormat.BYTE_ORDER);

        tables.exportTable(buffer);

        assertThat(buffer.position()).isEqualTo(tables.getTableSize());
        assertThat(buffer.getInt(0)).isEqualTo(tables.stateCount());
        assertThat(buffer.getInt(4)).isEqualTo(RuleDataFormat.rowLength(tables.numCategories()));
        assertThat(buffer.getInt(8)).isEqualTo(
                RuleDataFormat.FLAG_LOOKAHEAD_HARD_BREAK | RuleDataFormat.FLAG_BOF_REQUIRED);
        assertThat(tables.transition(1, 1)).isNotZero();
    }

    @Test
    @DisplayName("Should write rows as accepting, look-ahead, tag index and next states")
    void shouldExportRows() {
        TableBuilder tables = build("$A = [a-z]; $A $A*;");
        ByteBuffer buffer = ByteBuffer.allocate(tables.getTableSize()).order(RuleDataFormat.BYTE_ORDER);
        tables.exportTable(buffer);
        int rowLength = RuleDataFormat.rowLength(tables.numCategories());
        int row2 = RuleDataFormat.STATE_TABLE_HEADER_SIZE + 2 * rowLength;
        int letter = categories.categoryOf('q');

        assertThat(buffer.getShort(row2)).isEqualTo((short) -1);
        assertThat(buffer.getShort(row2 + 2)).isZero();
        assertThat(buffer.getShort(row2 + 4)).isZero();
        assertThat(Short.toUnsignedInt(buffer.getShort(row2 + RuleDataFormat.ROW_HEADER_SIZE + 2 * letter)))
                .isEqualTo(2);
    }

    @Test
    @DisplayName("Should fail when the table grows past the state limit")
    void shouldEnforceStateLimit() {
        assertThatThrownBy(() -> build("$A = [a-z]; $A $A*;", 2))
                .isInstanceOfSatisfying(RuleCompilationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(RuleErrorCode.INTERNAL_ERROR));
    }

    @Test
    @DisplayName("Should stop the safe table after a pair that always reaches one state")
    void shouldBuildSafeReverseTable() {
        TableBuilder tables = build("$A = [a-z]; $A $A*;");
        tables.buildSafeReverseTable();

        assertThat(tables.safeStateCount()).isEqualTo(3);
        for (int c = 0; c < tables.numCategories(); c++) {
            assertThat(tables.safeTransition(0, c)).isZero();
            assertThat(tables.safeTransition(1, c)).isEqualTo(2);
            assertThat(tables.safeTransition(2, c)).isZero();
        }
        assertThat(tables.getSafeTableSize())
                .isEqualTo(RuleDataFormat.STATE_TABLE_HEADER_SIZE + 3 * RuleDataFormat.rowLength(tables.numCategories()));
    }

    @Test
    @DisplayName("Should keep unsafe pairs running in the safe table")
    void shouldKeepUnsafePairs() {
        TableBuilder tables = build("a b; b c;");
        tables.buildSafeReverseTable();
        int a = categories.categoryOf('a');
        int b = categories.categoryOf('b');

        int c = categories.categoryOf('c');

        int afterB = tables.safeTransition(1, b);
        assertThat(afterB).isNotZero();
        assertThat(tables.safeTransition(afterB, a)).isNotZero();
        assertThat(tables.safeTransition(afterB, c)).isZero();
    }
}
