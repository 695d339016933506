package com.winmd.generator.codegen.render;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class IlGuidField {
    @NonNull
    String name;
    @NonNull
    IlAttribute guid;
}
