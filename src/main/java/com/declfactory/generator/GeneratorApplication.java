package com.declfactory.generator;

import com.declfactory.generator.cli.ExpandCommand;
import picocli.CommandLine;

/**
 * Main entry point for the declaration factory.
 * Expands {@code @Template} declarations over the matrices bound by {@code @Basis}
 * declarations and writes plain Java sources.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ExpandCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
