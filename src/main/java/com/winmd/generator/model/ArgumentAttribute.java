package com.winmd.generator.model;

import java.util.Optional;

/**
 * Marker attributes an argument can carry.
 */
public enum ArgumentAttribute {
    /**
     * Pointee is not modified by the callee.
     */
    CONST("const"),

    /**
     * Out pointer receiving a COM interface (released by the caller).
     */
    COM_OUT("com_out");

    private final String keyword;

    ArgumentAttribute(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static Optional<ArgumentAttribute> fromKeyword(String word) {
        for (ArgumentAttribute attribute : values()) {
            if (attribute.keyword.equals(word)) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }
}
