package com.winmd.generator.model;

import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * A reference to a named type plus a pointer indirection depth.
 *
 * The backing enumeration is only ever set by enrichment; declarations always
 * produce unbacked references.
 */
@Value
public class TypeReference {
    @NonNull
    String baseName;
    int pointerDepth;
    String backingEnum;

    private TypeReference(String baseName, int pointerDepth, String backingEnum) {
        if (baseName == null || baseName.isBlank()) {
            throw new IllegalArgumentException("type name must not be blank");
        }
        if (pointerDepth < 0) {
            throw new IllegalArgumentException("pointer depth must be at least 0, got " + pointerDepth);
        }
        this.baseName = baseName;
        this.pointerDepth = pointerDepth;
        this.backingEnum = backingEnum;
    }

    public static TypeReference of(String baseName, int pointerDepth) {
        return new TypeReference(baseName, pointerDepth, null);
    }

    public static TypeReference of(String baseName) {
        return of(baseName, 0);
    }

    /**
     * Returns the reference rewritten to an enumeration's underlying integer type,
     * remembering the enumeration it came from.
     */
    public TypeReference enrichedTo(TypeReference enumBaseType, String enumName) {
        return new TypeReference(enumBaseType.getBaseName(), enumBaseType.getPointerDepth(), enumName);
    }

    public Optional<String> getBackingEnum() {
        return Optional.ofNullable(backingEnum);
    }

    public boolean isEnumBacked() {
        return backingEnum != null;
    }

    @Override
    public String toString() {
        return baseName + "*".repeat(pointerDepth);
    }
}
