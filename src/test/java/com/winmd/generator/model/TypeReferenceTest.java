package com.winmd.generator.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TypeReferenceTest {

    @Test
    void testToStringShowsPointerStars() {
        assertThat(TypeReference.of("BYTE", 2)).hasToString("BYTE**");
    }

    @Test
    void testEnrichedReferenceRemembersEnum() {
        TypeReference enriched = TypeReference.of("Mode").enrichedTo(TypeReference.of("UINT32"), "Mode");

        assertThat(enriched.getBaseName()).isEqualTo("UINT32");
        assertThat(enriched.getBackingEnum()).contains("Mode");
        assertThat(TypeReference.of("UINT32").getBackingEnum()).isEmpty();
    }

    @Test
    void testInvalidReferences() {
        assertThatThrownBy(() -> TypeReference.of(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeReference.of("BYTE", -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
