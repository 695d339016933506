package com.winmd.generator.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class GuidConstantTest {

    @Test
    void testParseWithAndWithoutBraces() {
        GuidConstant plain = GuidConstant.parse("A", "23170f69-40c1-278a-1000-000110070000");
        GuidConstant braced = GuidConstant.parse("A", "{23170F69-40C1-278A-1000-000110070000}");

        assertThat(plain.getBytes()).isEqualTo(braced.getBytes());
        assertThat(plain.getDisplay()).isEqualTo("23170F69-40C1-278A-1000-000110070000");
        assertThat(plain.getBytes()[0]).isEqualTo((byte) 0x23);
    }

    @ParameterizedTest
    @ValueSource(strings = {"{23170F69-40C1-278A-1000-000110070000", "23170F69-40C1-278A-1000-00011007000", "not a guid"})
    void testMalformedGuids(String text) {
        assertThatThrownBy(() -> GuidConstant.parse("A", text))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testBytesAreCopied() {
        GuidConstant guid = GuidConstant.of("A", new byte[16]);

        guid.getBytes()[0] = 1;

        assertThat(guid.getBytes()[0]).isZero();
    }
}
