package com.tessera.breakrules.compiler.table;

import com.tessera.breakrules.compiler.parse.ParsedRules;
import com.tessera.breakrules.compiler.parse.RuleScanner;
import com.tessera.breakrules.compiler.sets.CategoryBuilder;
import com.tessera.breakrules.runtime.model.RuleDataFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class TableMinimizerTest {

    private CategoryBuilder categories;
    private TableBuilder tables;

    private MinimizationReport minimize(String rules) {
        ParsedRules parsed = new RuleScanner(rules).parse();
        categories = new CategoryBuilder(parsed.setLeaves());
        categories.buildRanges();
        tables = new TableBuilder(parsed, categories, RuleDataFormat.MAX_STATES);
        tables.buildForwardTable();
        return new TableMinimizer(tables, categories).minimize();
    }

    @Test
    @DisplayName("Should merge two sets that are used identically into one category")
    void shouldMergeIdenticallyUsedSets() {
        ParsedRules parsed = new RuleScanner("$X = [a-c]; $Y = [x-z]; ($X | $Y) [0-9];").parse();
        categories = new CategoryBuilder(parsed.setLeaves());
        categories.buildRanges();
        int before = categories.getNumCharCategories();
        tables = new TableBuilder(parsed, categories, RuleDataFormat.MAX_STATES);
        tables.buildForwardTable();

        MinimizationReport report = new TableMinimizer(tables, categories).minimize();

        assertThat(categories.getNumCharCategories()).isEqualTo(before - 1);
        assertThat(report.columnsMerged()).isEqualTo(1);
        assertThat(categories.categoryOf('b')).isEqualTo(categories.categoryOf('y'));
        assertThat(categories.categoryOf('b')).isNotEqualTo(categories.categoryOf('5'));
        assertThat(tables.numCategories()).isEqualTo(categories.getNumCharCategories());
    }

    @Test
    @DisplayName("Should alternate state and column merging until nothing changes")
    void shouldReachFixedPointAcrossPasses() {
        MinimizationReport report = minimize("a b | c b;");

        assertThat(report.statesMerged()).isEqualTo(1);
        assertThat(report.columnsMerged()).isEqualTo(1);
        assertThat(report.passes()).isEqualTo(3);
        assertThat(tables.stateCount()).isEqualTo(4);
        assertThat(categories.categoryOf('a')).isEqualTo(categories.categoryOf('c'));
    }

    @Test
    @DisplayName("Should report no change for an already minimal table")
    void shouldLeaveMinimalTableAlone() {
        MinimizationReport report = minimize("$A = [a-z]; $A $A*;");

        assertThat(report.changedAnything()).isFalse();
        assertThat(report.passes()).isEqualTo(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "$A = [a-z]; $A $A*;",
            "a b | c b;",
            "$X = [a-c]; $Y = [x-z]; ($X | $Y) [0-9];",
            "!!chain; [a-z]+ [0-9]* {10}; [A-Z] / [a-z]; [{bof}] [.,];",
            "$L = [\\p{L}]; $D = [\\p{Nd}]; $L+ ($D | $L)* {200}; $D+ {100}; .;"
    })
    @DisplayName("Should leave no duplicate columns or states behind")
    void shouldLeaveNoDuplicates(String rules) {
        minimize(rules);

        assertThat(tables.findDuplCharClassFrom(new IntPair(3, 0))).isFalse();
        assertThat(tables.removeDuplicateStates()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = {"[a-z] [a-z];", "[{bof}] a | [{eof}] b;", "x y z;"})
    @DisplayName("Should keep the reserved categories")
    void shouldKeepReservedCategories(String rules) {
        minimize(rules);

        assertThat(categories.getNumCharCategories()).isGreaterThanOrEqualTo(3);
        assertThat(tables.numCategories()).isEqualTo(categories.getNumCharCategories());
    }
}
