package com.winmd.generator.codegen.render;

/**
 * The model references something the renderer cannot resolve, or the template failed.
 */
public class RenderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
