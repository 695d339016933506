package com.winmd.generator.codegen.render;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Custom attributes attached to the parameter at a one-based {@code .param} index.
 */
@Value
@Builder
public class IlParamAttributes {
    int index;
    @NonNull
    @Singular
    List<IlAttribute> attributes;
}
