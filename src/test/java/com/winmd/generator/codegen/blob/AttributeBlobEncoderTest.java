package com.winmd.generator.codegen.blob;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HexFormat;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the byte-level blob encodings.
 */
class AttributeBlobEncoderTest {

    @Test
    void testLittleEndianByteOrder() {
        assertThat(AttributeBlobEncoder.hex(AttributeBlobEncoder.littleEndian(0x12345678L, 4))).isEqualTo("78 56 34 12");
        assertThat(AttributeBlobEncoder.hex(AttributeBlobEncoder.littleEndian(1, 2))).isEqualTo("01 00");
    }

    @ParameterizedTest
    @CsvSource({
            "0, 1",
            "255, 1",
            "65535, 2",
            "4294967295, 4",
            "9223372036854775807, 8"
    })
    void testLittleEndianInverts(long number, int byteCount) {
        byte[] encoded = AttributeBlobEncoder.littleEndian(number, byteCount);

        assertThat(encoded).hasSize(byteCount);
        assertThat(AttributeBlobEncoder.fromLittleEndian(encoded)).isEqualTo(number);
    }

    @Test
    void testLittleEndianRejectsOverflow() {
        assertThatThrownBy(() -> AttributeBlobEncoder.littleEndian(0x10000, 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not fit");
    }

    @Test
    void testLittleEndianRejectsNegative() {
        assertThatThrownBy(() -> AttributeBlobEncoder.littleEndian(-1, 4))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testReorderGuidSwapsLeadingFields() {
        byte[] canonical = HexFormat.of().parseHex("23170F6940C1278A0000000500090000");

        byte[] reordered = AttributeBlobEncoder.reorderGuid(canonical);

        assertThat(AttributeBlobEncoder.hex(reordered)).isEqualTo("69 0F 17 23 C1 40 8A 27 00 00 00 05 00 09 00 00");
    }

    @Test
    void testReorderGuidRequiresSixteenBytes() {
        assertThatThrownBy(() -> AttributeBlobEncoder.reorderGuid(new byte[15]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testPascalString() {
        assertThat(AttributeBlobEncoder.hex(AttributeBlobEncoder.pascalString("CountConst")))
                .isEqualTo("0A 43 6F 75 6E 74 43 6F 6E 73 74");
        assertThat(AttributeBlobEncoder.pascalString("")).containsExactly(0);
        assertThat(AttributeBlobEncoder.pascalString("x".repeat(127))).hasSize(128);
    }

    @Test
    void testPascalStringTooLong() {
        assertThatThrownBy(() -> AttributeBlobEncoder.pascalString("x".repeat(128)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("too long");
    }

    @ParameterizedTest
    @CsvSource({
            "0, 00",
            "127, 7F",
            "128, 80 80",
            "16383, BF FF",
            "16384, C0 00 40 00",
            "536870911, DF FF FF FF"
    })
    void testCompressedLength(int length, String expectedHex) {
        assertThat(AttributeBlobEncoder.hex(AttributeBlobEncoder.compressedLength(length))).isEqualTo(expectedHex);
    }

    @Test
    void testCompressedLengthTooLarge() {
        assertThatThrownBy(() -> AttributeBlobEncoder.compressedLength(0x2000_0000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCompressedStringUsesUtf8ByteLength() {
        byte[] encoded = AttributeBlobEncoder.compressedString("x".repeat(200));

        assertThat(encoded).hasSize(202);
        assertThat(AttributeBlobEncoder.hex(new byte[] {encoded[0], encoded[1]})).isEqualTo("80 C8");
        assertThat(AttributeBlobEncoder.hex(AttributeBlobEncoder.compressedString("é"))).isEqualTo("02 C3 A9");
    }
}
