package com.winmd.generator.parser.exception;

import com.winmd.generator.parser.SourceLocation;

/**
 * A metatext file could not be read: missing, unreadable or not valid UTF-8.
 * The location is the {@code include} line, or the file itself for the primary input.
 */
public class SourceReadException extends DefinitionException {

    private static final long serialVersionUID = 1L;

    public SourceReadException(SourceLocation location, String detail, Throwable cause) {
        super(location, detail, cause);
    }
}
