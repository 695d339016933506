package com.winmd.generator.parser;

import com.winmd.generator.model.ArgumentAttribute;
import com.winmd.generator.model.ArraySizeSpec;
import com.winmd.generator.parser.exception.SemanticException;
import lombok.Value;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the space separated attribute words of an argument declaration.
 *
 * Words: {@code const}, {@code com_out}, {@code ca<N>} (element count in argument N),
 * {@code cc<N>} (constant element count). At most one count word is allowed.
 */
class ArgumentAttributeParser {

    private static final Pattern COUNT_IN_ARG = Pattern.compile("^ca([0-9]+)$");
    private static final Pattern CONST_COUNT = Pattern.compile("^cc([0-9]+)$");

    @Value
    static class ParsedAttributes {
        Set<ArgumentAttribute> attributes;
        ArraySizeSpec arraySize;
    }

    ParsedAttributes parse(String attributeText, SourceLocation location) {
        Set<ArgumentAttribute> attributes = EnumSet.noneOf(ArgumentAttribute.class);
        ArraySizeSpec arraySize = ArraySizeSpec.none();

        if (attributeText == null || attributeText.isBlank()) {
            return new ParsedAttributes(attributes, arraySize);
        }

        for (String rawWord : attributeText.split(" ")) {
            String word = rawWord.strip();
            if (word.isEmpty()) {
                continue;
            }

            Matcher countInArg = COUNT_IN_ARG.matcher(word);
            Matcher constCount = CONST_COUNT.matcher(word);
            if (countInArg.matches() || constCount.matches()) {
                if (arraySize.isPresent()) {
                    throw new SemanticException(location,
                            "conflicting array size attributes: at most one of ca<N> and cc<N> may be given");
                }
                arraySize = countInArg.matches()
                        ? countParamIndex(countInArg.group(1), location)
                        : constCount(constCount.group(1), location);
                continue;
            }

            ArgumentAttribute attribute = ArgumentAttribute.fromKeyword(word)
                    .orElseThrow(() -> new SemanticException(location, "unknown argument attribute '" + word + "'"));
            attributes.add(attribute);
        }

        return new ParsedAttributes(attributes, arraySize);
    }

    private static ArraySizeSpec countParamIndex(String digits, SourceLocation location) {
        try {
            return ArraySizeSpec.countParamIndex(Integer.parseInt(digits));
        } catch (IllegalArgumentException e) {
            throw new SemanticException(location, "invalid count parameter index 'ca" + digits + "': " + e.getMessage(), e);
        }
    }

    private static ArraySizeSpec constCount(String digits, SourceLocation location) {
        try {
            return ArraySizeSpec.countConst(Long.parseLong(digits));
        } catch (IllegalArgumentException e) {
            throw new SemanticException(location, "invalid constant count 'cc" + digits + "': " + e.getMessage(), e);
        }
    }
}
