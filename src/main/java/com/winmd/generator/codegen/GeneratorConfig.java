package com.winmd.generator.codegen;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * Configuration for one metatext to IL generation run.
 */
@Value
@Builder
public class GeneratorConfig {
    public static final String DEFAULT_TEMPLATE = "metadata.il.ftl";

    @NonNull
    Path inputPath;
    @NonNull
    Path outputPath;
    @NonNull
    @Builder.Default
    String templateName = DEFAULT_TEMPLATE;
}
