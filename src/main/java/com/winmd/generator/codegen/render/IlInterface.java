package com.winmd.generator.codegen.render;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IlInterface {
    @NonNull
    String name;
    @NonNull
    String baseType;
    @NonNull
    IlAttribute guid;
    @NonNull
    @Singular
    List<IlMethod> methods;
}
