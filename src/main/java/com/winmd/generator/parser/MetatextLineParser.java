package com.winmd.generator.parser;

import com.winmd.generator.parser.exception.GrammarException;

import java.util.Arrays;
import java.util.Optional;

/**
 * Splits a raw metatext line into a command and its fields.
 *
 * Format:
 * - fields are separated by single TAB characters (no quoting or escaping)
 * - {@code #} starts a comment running to the end of the line
 * - blank and comment-only lines produce nothing
 */
public class MetatextLineParser {

    public Optional<MetatextLine> parse(String rawLine, SourceLocation location) {
        String text = stripLineTerminator(rawLine);

        int hashIndex = text.indexOf('#');
        if (hashIndex != -1) {
            text = text.substring(0, hashIndex);
        }
        text = text.stripTrailing();

        if (text.isBlank()) {
            return Optional.empty();
        }

        String[] pieces = text.split("\t", -1);
        MetatextCommand command = MetatextCommand.fromKeyword(pieces[0])
                .orElseThrow(() -> new GrammarException(location, "unknown command '" + pieces[0] + "'"));

        return Optional.of(new MetatextLine(command, Arrays.asList(pieces).subList(1, pieces.length), location));
    }

    private static String stripLineTerminator(String rawLine) {
        int end = rawLine.length();
        while (end > 0 && (rawLine.charAt(end - 1) == '\n' || rawLine.charAt(end - 1) == '\r')) {
            end--;
        }
        return rawLine.substring(0, end);
    }
}
