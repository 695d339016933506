package com.winmd.generator.cli;

import com.winmd.generator.cli.output.GenerateResultsPrinter;
import com.winmd.generator.codegen.GeneratorConfig;
import com.winmd.generator.codegen.GeneratorResult;
import com.winmd.generator.codegen.IlGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command compiling one metatext file into ILAsm source.
 */
@Command(
        name = "metatext2il",
        mixinStandardHelpOptions = true,
        version = "winmd-il-generator 1.0.0",
        description = "Compiles a metatext interface description into ILAsm source for a .winmd metadata assembly."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Parameters(index = "0", paramLabel = "INPUT", description = "Metatext definition file")
    private Path inputPath;

    @Parameters(index = "1", paramLabel = "OUTPUT", description = "IL file to write; replaced if it exists")
    private Path outputPath;

    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        try {
            if (!Files.isRegularFile(inputPath)) {
                log.error("Input file does not exist or is not a regular file: {}", inputPath);
                return 1;
            }

            GeneratorConfig config = GeneratorConfig.builder()
                    .inputPath(inputPath)
                    .outputPath(outputPath)
                    .build();

            printer.printBanner(config);

            GeneratorResult result = new IlGenerator(config).generate();
            if (!result.isSuccess()) {
                log.error("Generation failed: {}", result.getErrorMessage());
                return 1;
            }

            printer.printResults(result);
            return 0;

        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }
}
