package com.winmd.generator.cli.output;

import com.winmd.generator.codegen.GeneratorConfig;
import com.winmd.generator.codegen.GeneratorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible only for printing CLI output for the generate command.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GeneratorConfig config) {
        log.info("=================================================");
        log.info("winmd IL Generator");
        log.info("=================================================");
        log.info("Input: {}", config.getInputPath().toAbsolutePath());
        log.info("Output: {}", config.getOutputPath().toAbsolutePath());
        log.info("=================================================");
    }

    public void printResults(GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath().toAbsolutePath());
        log.info("Imported DLLs: {}", result.getImportedDlls());
        log.info("Functions: {}", result.getFunctions());
        log.info("Function Pointers: {}", result.getFunctionPointers());
        log.info("Interfaces: {}", result.getInterfaces());
        log.info("Enumerations: {}", result.getEnumerations());
        log.info("Structs: {}", result.getStructs());
        log.info("GUID Constants: {}", result.getGuidConstants());
        log.info("");
        log.info("Assemble with:");
        log.info("   ilasm /dll {}", result.getOutputPath().toAbsolutePath());
        log.info("=================================================");
    }
}
