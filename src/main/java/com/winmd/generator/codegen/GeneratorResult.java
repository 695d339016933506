package com.winmd.generator.codegen;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Result of a generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private int importedDlls;
    private int functions;
    private int functionPointers;
    private int interfaces;
    private int enumerations;
    private int structs;
    private int guidConstants;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
