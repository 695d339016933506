package com.winmd.generator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Data flow direction of a function argument.
 */
public enum ArgumentDirection {
    IN("in"),
    OUT("out"),
    INOUT("inout");

    private final String keyword;

    ArgumentDirection(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean isIn() {
        return this == IN || this == INOUT;
    }

    public boolean isOut() {
        return this == OUT || this == INOUT;
    }

    public static Optional<ArgumentDirection> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        return switch (keyword.toLowerCase(Locale.ROOT)) {
            case "in" -> Optional.of(IN);
            case "out" -> Optional.of(OUT);
            case "inout" -> Optional.of(INOUT);
            default -> Optional.empty();
        };
    }
}
