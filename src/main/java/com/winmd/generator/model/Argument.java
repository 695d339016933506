package com.winmd.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A single argument of a function, function pointer or interface method.
 */
@Value
public class Argument {
    @NonNull
    String name;
    @NonNull
    TypeReference type;
    @NonNull
    ArgumentDirection direction;
    boolean optional;
    @NonNull
    Set<ArgumentAttribute> attributes;
    @NonNull
    ArraySizeSpec arraySize;

    @Builder
    public Argument(String name, TypeReference type, ArgumentDirection direction, boolean optional,
                    Set<ArgumentAttribute> attributes, ArraySizeSpec arraySize) {
        this.name = name;
        this.type = type;
        this.direction = direction;
        this.optional = optional;
        this.attributes = (attributes == null || attributes.isEmpty())
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(attributes));
        this.arraySize = arraySize != null ? arraySize : ArraySizeSpec.none();
    }

    public boolean hasAttribute(ArgumentAttribute attribute) {
        return attributes.contains(attribute);
    }

    /**
     * Whether rendering this argument produces any custom attribute.
     */
    public boolean needsParamMetadata() {
        return !attributes.isEmpty() || arraySize.isPresent() || type.isEnumBacked();
    }
}
