package com.winmd.generator.parser.exception;

import com.winmd.generator.parser.SourceLocation;

/**
 * A command was issued without the declaration it has to attach to.
 */
public class ContextException extends DefinitionException {

    private static final long serialVersionUID = 1L;

    private final String missingContext;

    public ContextException(SourceLocation location, String command, String missingContext) {
        super(location, "\"" + command + "\" entry without a previous \"" + missingContext + "\" entry", null);
        this.missingContext = missingContext;
    }

    public String getMissingContext() {
        return missingContext;
    }
}
