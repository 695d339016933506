package com.winmd.generator;

import com.winmd.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the winmd IL generator.
 * Compiles a metatext interface description into ILAsm source that {@code ilasm}
 * assembles into a Windows metadata ({@code .winmd}) file.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand()).execute(args);
        System.exit(exitCode);
    }
}
