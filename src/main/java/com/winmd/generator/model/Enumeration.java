package com.winmd.generator.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An enumeration over an integer base type. Variants keep their declaration order.
 */
@Getter
public class Enumeration {
    private final String name;
    private final TypeReference baseType;
    private final IntegerType integerType;
    private final boolean flags;
    @Getter(AccessLevel.NONE)
    private final Map<String, EnumVariant> variantsByName = new LinkedHashMap<>();

    public Enumeration(String name, TypeReference baseType, IntegerType integerType, boolean flags) {
        this.name = Objects.requireNonNull(name, "name");
        this.baseType = Objects.requireNonNull(baseType, "baseType");
        if (baseType.getPointerDepth() != 0) {
            throw new IllegalArgumentException("enum base type must not be a pointer: " + baseType);
        }
        this.integerType = Objects.requireNonNull(integerType, "integerType");
        this.flags = flags;
    }

    public boolean hasVariant(String variantName) {
        return variantsByName.containsKey(variantName);
    }

    public Optional<EnumVariant> findVariant(String variantName) {
        return Optional.ofNullable(variantsByName.get(variantName));
    }

    public void addVariant(EnumVariant variant) {
        Objects.requireNonNull(variant, "variant");
        if (variantsByName.containsKey(variant.getName())) {
            throw new IllegalStateException("duplicate variant " + variant.getName() + " in enum " + name);
        }
        if (!integerType.fits(variant.getValue())) {
            throw new IllegalArgumentException("value " + variant.getValue() + " of variant " + variant.getName()
                    + " does not fit " + integerType.getIlName());
        }
        variantsByName.put(variant.getName(), variant);
    }

    public Collection<EnumVariant> getVariants() {
        return Collections.unmodifiableCollection(variantsByName.values());
    }

}
