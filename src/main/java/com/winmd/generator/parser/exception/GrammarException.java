package com.winmd.generator.parser.exception;

import com.winmd.generator.parser.SourceLocation;

/**
 * Unknown command keyword or wrong number of fields.
 */
public class GrammarException extends DefinitionException {

    private static final long serialVersionUID = 1L;

    public GrammarException(SourceLocation location, String detail) {
        super(location, detail, null);
    }
}
