package com.winmd.generator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Calling conventions accepted by {@code pinvokeimpl}.
 */
public enum CallingConvention {
    WINAPI("winapi"),
    CDECL("cdecl"),
    STDCALL("stdcall"),
    THISCALL("thiscall"),
    FASTCALL("fastcall");

    private final String ilKeyword;

    CallingConvention(String ilKeyword) {
        this.ilKeyword = ilKeyword;
    }

    public String getIlKeyword() {
        return ilKeyword;
    }

    public static Optional<CallingConvention> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        String normalized = keyword.trim().toLowerCase(Locale.ROOT);
        for (CallingConvention convention : values()) {
            if (convention.ilKeyword.equals(normalized)) {
                return Optional.of(convention);
            }
        }
        return Optional.empty();
    }
}
