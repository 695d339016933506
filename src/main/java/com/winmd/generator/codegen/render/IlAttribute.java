package com.winmd.generator.codegen.render;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One {@code .custom} line: constructor reference plus the hex encoded blob.
 */
@Value
@Builder
public class IlAttribute {
    @NonNull
    String constructor;
    @NonNull
    String hex;
    @NonNull
    @Builder.Default
    String comment = "";
}
