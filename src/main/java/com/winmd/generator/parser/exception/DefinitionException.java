package com.winmd.generator.parser.exception;

import com.winmd.generator.parser.SourceLocation;

import java.util.Objects;

/**
 * Base class of all fatal errors raised while collecting metatext declarations.
 * The message is prefixed with the offending file and line.
 */
public abstract class DefinitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient SourceLocation location;
    private final String detail;

    protected DefinitionException(SourceLocation location, String detail, Throwable cause) {
        super(location + ": " + detail, cause);
        this.location = Objects.requireNonNull(location, "location");
        this.detail = detail;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * The message without the location prefix.
     */
    public String getDetail() {
        return detail;
    }
}
