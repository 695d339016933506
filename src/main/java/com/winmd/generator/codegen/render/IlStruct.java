package com.winmd.generator.codegen.render;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IlStruct {
    @NonNull
    String name;
    @NonNull
    @Singular
    List<Field> fields;

    @Value
    public static class Field {
        @NonNull
        String type;
        @NonNull
        String name;
    }
}
