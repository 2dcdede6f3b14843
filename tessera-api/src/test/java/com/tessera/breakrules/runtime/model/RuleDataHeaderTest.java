package com.tessera.breakrules.runtime.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleDataHeaderTest {

    @Test
    @DisplayName("Should write fields little-endian at their fixed offsets")
    void shouldWriteFieldsAtFixedOffsets() {
        RuleDataHeader header = RuleDataHeader.builder()
                .length(256)
                .categoryCount(7)
                .section(Section.FORWARD_TABLE, new SectionExtent(80, 40))
                .section(Section.RULE_SOURCE, new SectionExtent(200, 10))
                .section(Section.STATUS_TABLE, new SectionExtent(192, 4))
                .build();

        ByteBuffer buffer = ByteBuffer.allocate(RuleDataFormat.HEADER_SIZE);
        header.writeTo(buffer);
        byte[] bytes = buffer.array();

        assertThat(bytes[0]).isEqualTo((byte) 0xA0);
        assertThat(bytes[1]).isEqualTo((byte) 0xB1);
        assertThat(bytes[4]).isEqualTo((byte) 5);
        ByteBuffer le = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        assertThat(le.getInt(8)).isEqualTo(256);
        assertThat(le.getInt(12)).isEqualTo(7);
        assertThat(le.getInt(16)).isEqualTo(80);
        assertThat(le.getInt(20)).isEqualTo(40);
        assertThat(le.getInt(40)).isEqualTo(200);
        assertThat(le.getInt(44)).isEqualTo(10);
        assertThat(le.getInt(48)).isEqualTo(192);
        assertThat(le.getInt(52)).isEqualTo(4);
        for (int i = RuleDataFormat.OFFSET_RESERVED; i < RuleDataFormat.HEADER_SIZE; i++) {
            assertThat(bytes[i]).isZero();
        }
    }

    @Test
    @DisplayName("Should read back what was written")
    void shouldReadBackWrittenHeader() {
        RuleDataHeader header = RuleDataHeader.builder()
                .length(4096)
                .categoryCount(12)
                .section(Section.FORWARD_TABLE, new SectionExtent(80, 100))
                .section(Section.SAFE_TABLE, new SectionExtent(184, 60))
                .section(Section.TRIE, new SectionExtent(248, 1000))
                .section(Section.STATUS_TABLE, new SectionExtent(1248, 8))
                .section(Section.RULE_SOURCE, new SectionExtent(1256, 30))
                .build();
        ByteBuffer buffer = ByteBuffer.allocate(RuleDataFormat.HEADER_SIZE);
        header.writeTo(buffer);

        RuleDataHeader decoded = RuleDataHeader.readFrom(buffer);

        assertThat(decoded).isEqualTo(header);
        assertThat(decoded.section(Section.TRIE).end()).isEqualTo(1248);
    }

    @Test
    @DisplayName("Should reject a buffer shorter than the header")
    void shouldRejectShortBuffer() {
        assertThatThrownBy(() -> RuleDataHeader.readFrom(ByteBuffer.allocate(40)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("header needs 80");
    }

    @Test
    @DisplayName("Should round sizes up to multiples of eight")
    void shouldAlignToEight() {
        assertThat(RuleDataFormat.align8(0)).isZero();
        assertThat(RuleDataFormat.align8(1)).isEqualTo(8);
        assertThat(RuleDataFormat.align8(8)).isEqualTo(8);
        assertThat(RuleDataFormat.align8(81)).isEqualTo(88);
        assertThat(RuleDataFormat.stateTableSize(3, 5)).isEqualTo(16 + 3 * 18);
    }

    @Test
    @DisplayName("Should keep the format version intact when a caller modifies its copy")
    void shouldProtectFormatVersion() {
        byte[] version = RuleDataFormat.formatVersion();
        version[0] = 9;

        assertThat(RuleDataFormat.formatVersion()).containsExactly(5, 0, 0, 0);
        assertThat(RuleDataHeader.builder().build().formatVersion()[0])
                .isEqualTo((byte) RuleDataFormat.FORMAT_VERSION_MAJOR);
        assertThat(RuleDataFormat.formatVersionString()).isEqualTo("5.0.0.0");
    }
}
