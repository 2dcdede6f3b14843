package com.tessera.breakrules.compiler;

import com.tessera.breakrules.api.CompilationListener;
import com.tessera.breakrules.api.model.CompileResult;
import com.tessera.breakrules.api.model.CompileStatus;
import com.tessera.breakrules.api.model.RuleErrorCode;
import com.tessera.breakrules.compiler.parse.RuleScanner;
import com.tessera.breakrules.runtime.model.RuleDataFormat;
import com.tessera.breakrules.runtime.model.RuleDataHeader;
import com.tessera.breakrules.runtime.model.Section;
import com.tessera.breakrules.runtime.model.SectionExtent;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.ByteBuffer;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class RuleBuilderTest {

    private static final Tracer TRACER = OpenTelemetry.noop().getTracer("test");
    private static final String LETTERS = "$A = [a-z]; $A $A*;";

    private static CompileResult build(String rules) {
        try (RuleBuilder builder = new RuleBuilder(rules, CompileStatus.ok(), CompilerConfig.defaults(), TRACER, null)) {
            return builder.build();
        }
    }

    private static ByteBuffer wrap(byte[] data) {
        return ByteBuffer.wrap(data).order(RuleDataFormat.BYTE_ORDER);
    }

    @Nested
    @DisplayName("Successful builds")
    class Success {

        @Test
        @DisplayName("Should produce a blob with a valid header")
        void shouldProduceBlob() {
            CompileResult result = build(LETTERS);

            assertThat(result.isSuccess()).isTrue();
            RuleDataHeader header = RuleDataHeader.readFrom(wrap(result.data()));
            assertThat(header.magic()).isEqualTo(RuleDataFormat.MAGIC);
            assertThat(header.formatVersion()).containsExactly(RuleDataFormat.formatVersion());
            assertThat(header.length()).isEqualTo(result.data().length);
            assertThat(header.categoryCount()).isGreaterThanOrEqualTo(4);
            assertThat(header.section(Section.STATUS_TABLE).length()).isEqualTo(4);
            assertThat(result.stats().dataLength()).isEqualTo(result.data().length);
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
                "$AL = [\\p{Line_Break=Alphabetic}]; $AL+;",
                "$ALetter = [\\p{Word_Break=ALetter}]; $ALetter+;",
                "$Extend = [\\p{Grapheme_Cluster_Break=Extend}]; . $Extend*;",
                "$ExtPict = [\\p{Extended_Pictographic}]; $ExtPict+;"})
        @DisplayName("Should compile rules written with Unicode break properties")
        void shouldCompileBreakProperties(String rules) {
            CompileResult result = build(rules);

            assertThat(result.isSuccess()).as("%s", result.status()).isTrue();
            assertThat(result.stats().categoriesAfterOptimization()).isGreaterThanOrEqualTo(4);
        }

        @Test
        @DisplayName("Should size the forward table from its states and categories")
        void shouldSizeForwardTable() {
            CompileResult result = build(LETTERS);
            RuleDataHeader header = RuleDataHeader.readFrom(wrap(result.data()));

            long expected = RuleDataFormat.stateTableSize(
                    result.stats().statesAfterOptimization(), header.categoryCount());
            assertThat(header.section(Section.FORWARD_TABLE).length()).isEqualTo((int) expected);
            long safeExpected = RuleDataFormat.stateTableSize(
                    result.stats().safeTableStates(), header.categoryCount());
            assertThat(header.section(Section.SAFE_TABLE).length()).isEqualTo((int) safeExpected);
        }

        @Test
        @DisplayName("Should store one status value per distinct tag plus the default")
        void shouldStoreStatusValues() {
            CompileResult result = build("[a-z]+ {100}; [0-9]+ {200};");
            ByteBuffer data = wrap(result.data());
            SectionExtent status = RuleDataHeader.readFrom(data).section(Section.STATUS_TABLE);

            assertThat(status.length()).isEqualTo(12);
            int[] values = new int[3];
            for (int i = 0; i < values.length; i++) {
                values[i] = data.getInt(status.offset() + i * Integer.BYTES);
            }
            assertThat(values).containsExactlyInAnyOrder(0, 100, 200);
            assertThat(values[0]).isZero();
            assertThat(result.stats().statusTagCount()).isEqualTo(3);
        }

        @ParameterizedTest
        @ValueSource(strings = {
                LETTERS,
                "[a-z]+ {100}; [0-9]+ {200};",
                "!!chain; $L = [\\p{L}]; $L+ / [0-9]; [{bof}] .;"
        })
        @DisplayName("Should place every section aligned, in order, with zero padding")
        void shouldLayOutSections(String rules) {
            byte[] blob = build(rules).orElseThrow();
            ByteBuffer data = wrap(blob);
            RuleDataHeader header = RuleDataHeader.readFrom(data);

            for (int i = RuleDataFormat.OFFSET_RESERVED; i < RuleDataFormat.HEADER_SIZE; i++) {
                assertThat(blob[i]).as("reserved header byte %d", i).isZero();
            }
            long expectedOffset = RuleDataFormat.HEADER_SIZE;
            for (Section section : Section.values()) {
                SectionExtent extent = header.section(section);
                assertThat(extent.offset() % 8).as("%s alignment", section).isZero();
                assertThat((long) extent.offset()).as("%s offset", section).isEqualTo(expectedOffset);
                long storageEnd = section == Section.RULE_SOURCE ? extent.end() + 2 : extent.end();
                long paddedEnd = RuleDataFormat.align8(storageEnd);
                for (long p = storageEnd; p < paddedEnd; p++) {
                    assertThat(blob[(int) p]).as("%s padding at %d", section, p).isZero();
                }
                expectedOffset = paddedEnd;
            }
            assertThat(expectedOffset).isEqualTo(blob.length);
        }

        @Test
        @DisplayName("Should embed the stripped rule source with a terminator")
        void shouldEmbedRuleSource() {
            String rules = "# letters\n$A = [a-z];  # the set\n$A $A*;\n";
            byte[] blob = build(rules).orElseThrow();
            ByteBuffer data = wrap(blob);
            SectionExtent source = RuleDataHeader.readFrom(data).section(Section.RULE_SOURCE);

            StringBuilder text = new StringBuilder();
            for (int i = 0; i < source.length() / 2; i++) {
                text.append(data.getChar(source.offset() + 2 * i));
            }
            assertThat(text.toString()).isEqualTo(RuleScanner.stripRules(rules));
            assertThat(data.getChar(source.offset() + source.length())).isEqualTo('\0');
        }

        @Test
        @DisplayName("Should write the trie signature at the start of the trie section")
        void shouldWriteTrie() {
            ByteBuffer data = wrap(build(LETTERS).orElseThrow());
            SectionExtent trie = RuleDataHeader.readFrom(data).section(Section.TRIE);

            assertThat(data.getInt(trie.offset())).isEqualTo(RuleDataFormat.TRIE_SIGNATURE);
        }

        @Test
        @DisplayName("Should produce identical bytes for identical input")
        void shouldBeDeterministic() {
            String rules = "!!chain; $L = [\\p{L}]; $D = [0-9]; $L+ ($D | $L)* {200}; $D+ {100}; .;";

            byte[] first = build(rules).orElseThrow();
            byte[] second = build(rules).orElseThrow();

            assertThat(Arrays.equals(first, second)).isTrue();
        }

        @Test
        @DisplayName("Should report the category merge in the statistics")
        void shouldReportCategoryMerge() {
            CompileResult result = build("$X = [a-c]; $Y = [x-z]; ($X | $Y) [0-9];");

            assertThat(result.stats().categoriesAfterOptimization())
                    .isEqualTo(result.stats().categoriesBeforeOptimization() - 1);
            assertThat(result.stats().optimizationPasses()).isGreaterThanOrEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should report a syntax error with its location and no blob")
        void shouldReportSyntaxError() {
            CompileResult result = build("$A = [a-z;");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.data()).isNull();
            assertThat(result.status().errorCode()).isEqualTo(RuleErrorCode.UNCLOSED_SET);
            assertThat(result.status().location()).isNotNull();
            assertThat(result.status().location().line()).isEqualTo(1);
            assertThat(result.status().location().offset()).isEqualTo(5);
        }

        @Test
        @DisplayName("Should report INTERNAL_ERROR when the state limit is hit")
        void shouldReportStateLimit() {
            CompilerConfig config = CompilerConfig.builder().maxStates(2).build();
            try (RuleBuilder builder = new RuleBuilder(LETTERS, CompileStatus.ok(), config, TRACER, null)) {
                CompileResult result = builder.build();

                assertThat(result.status().errorCode()).isEqualTo(RuleErrorCode.INTERNAL_ERROR);
                assertThat(result.data()).isNull();
            }
        }

        @Test
        @DisplayName("Should do nothing when handed a failed status")
        void shouldFailFast() {
            CompilationListener listener = mock(CompilationListener.class);
            CompileStatus incoming = CompileStatus.failure(RuleErrorCode.MEMORY_ALLOCATION_ERROR, "earlier failure");
            RuleBuilder builder = new RuleBuilder(LETTERS, incoming, CompilerConfig.defaults(), TRACER, listener);

            CompileResult result = builder.build();

            assertThat(result.status()).isSameAs(incoming);
            assertThat(builder.hasAllocatedState()).isFalse();
            verifyNoInteractions(listener);
            builder.close();
            builder.close();
        }

        @Test
        @DisplayName("Should refuse a second build")
        void shouldRefuseSecondBuild() {
            RuleBuilder builder = new RuleBuilder(LETTERS, CompileStatus.ok(), CompilerConfig.defaults(), TRACER, null);
            builder.build();

            assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Should release intermediate state on close")
        void shouldReleaseOnClose() {
            RuleBuilder builder = new RuleBuilder(LETTERS, CompileStatus.ok(), CompilerConfig.defaults(), TRACER, null);
            byte[] blob = builder.build().orElseThrow();
            assertThat(builder.hasAllocatedState()).isTrue();

            builder.close();

            assertThat(builder.hasAllocatedState()).isFalse();
            assertThat(blob).isNotEmpty();
        }
    }
}
