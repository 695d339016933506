package com.winmd.generator.codegen.render;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IlEnum {
    @NonNull
    String name;
    @NonNull
    String baseType;
    /** Present only for flags enumerations. */
    IlAttribute flags;
    @NonNull
    @Singular
    List<Literal> literals;

    @Value
    public static class Literal {
        @NonNull
        String name;
        @NonNull
        String value;
    }
}
