package com.winmd.generator.parser.exception;

import com.winmd.generator.parser.SourceLocation;

/**
 * A well-formed declaration with an invalid value: duplicate names, out-of-range
 * numbers, conflicting attributes, include cycles.
 */
public class SemanticException extends DefinitionException {

    private static final long serialVersionUID = 1L;

    public SemanticException(SourceLocation location, String detail) {
        super(location, detail, null);
    }

    public SemanticException(SourceLocation location, String detail, Throwable cause) {
        super(location, detail, cause);
    }
}
