package com.winmd.generator.codegen.render;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A method signature ready for output. {@code dll} and {@code callingConvention}
 * are only filled in for P/Invoke entry points.
 */
@Value
@Builder
public class IlMethod {
    @NonNull
    String name;
    @NonNull
    String returnType;
    @NonNull
    String parameters;
    @NonNull
    @Singular("paramAttribute")
    List<IlParamAttributes> paramAttributes;
    @NonNull
    @Builder.Default
    String dll = "";
    @NonNull
    @Builder.Default
    String callingConvention = "";
}
