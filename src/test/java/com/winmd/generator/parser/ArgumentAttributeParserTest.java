package com.winmd.generator.parser;

import com.winmd.generator.model.ArgumentAttribute;
import com.winmd.generator.model.ArraySizeSpec;
import com.winmd.generator.parser.exception.SemanticException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ArgumentAttributeParser.
 */
class ArgumentAttributeParserTest {

    private static final SourceLocation LOCATION = new SourceLocation("test.txt", 3);

    private final ArgumentAttributeParser parser = new ArgumentAttributeParser();

    @Test
    void testEmptyTextHasNoAttributes() {
        ArgumentAttributeParser.ParsedAttributes parsed = parser.parse("", LOCATION);

        assertThat(parsed.getAttributes()).isEmpty();
        assertThat(parsed.getArraySize().isPresent()).isFalse();
    }

    @Test
    void testFlagsAndCountInArgument() {
        ArgumentAttributeParser.ParsedAttributes parsed = parser.parse("const com_out ca2", LOCATION);

        assertThat(parsed.getAttributes()).containsExactlyInAnyOrder(ArgumentAttribute.CONST, ArgumentAttribute.COM_OUT);
        assertThat(parsed.getArraySize()).isEqualTo(ArraySizeSpec.countParamIndex(2));
    }

    @Test
    void testConstantCount() {
        ArgumentAttributeParser.ParsedAttributes parsed = parser.parse("cc16", LOCATION);

        assertThat(parsed.getArraySize().getKind()).isEqualTo(ArraySizeSpec.Kind.COUNT_CONST);
        assertThat(parsed.getArraySize().getValue()).isEqualTo(16);
    }

    @Test
    void testBothCountKindsConflict() {
        assertThatThrownBy(() -> parser.parse("ca1 cc4", LOCATION))
                .isInstanceOf(SemanticException.class)
                .hasMessageContaining("conflicting array size attributes");
    }

    @Test
    void testTwoCountsInArgumentConflict() {
        assertThatThrownBy(() -> parser.parse("ca1 ca2", LOCATION))
                .isInstanceOf(SemanticException.class)
                .hasMessageContaining("conflicting");
    }

    @Test
    void testUnknownWordIsRejected() {
        assertThatThrownBy(() -> parser.parse("const retval", LOCATION))
                .isInstanceOf(SemanticException.class)
                .hasMessage("test.txt:3: unknown argument attribute 'retval'");
    }

    @Test
    void testCountParamIndexOutOfRange() {
        assertThatThrownBy(() -> parser.parse("ca65536", LOCATION))
                .isInstanceOf(SemanticException.class)
                .hasMessageContaining("ca65536");
    }
}
