package com.winmd.generator.codegen.render;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Fully resolved, template-ready view of a metadata model.
 * Every type is already in IL syntax and every blob already hex encoded.
 */
@Value
@Builder
public class IlDocument {
    @NonNull
    String name;
    /** Assembly version in {@code major:minor:build:revision} form. */
    @NonNull
    String version;
    @NonNull
    @Singular
    List<String> moduleExterns;
    @NonNull
    @Singular
    List<IlDelegate> delegates;
    @NonNull
    @Singular
    List<IlMethod> functions;
    @NonNull
    @Singular
    List<IlGuidField> guidConstants;
    @NonNull
    @Singular("comInterface")
    List<IlInterface> interfaces;
    @NonNull
    @Singular("enumeration")
    List<IlEnum> enums;
    @NonNull
    @Singular
    List<IlStruct> structs;

    public boolean isHasApis() {
        return !functions.isEmpty() || !guidConstants.isEmpty();
    }
}
