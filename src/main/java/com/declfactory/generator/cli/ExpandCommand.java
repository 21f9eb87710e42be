package com.declfactory.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.declfactory.generator.cli.exception.OptionsValidationException;
import com.declfactory.generator.cli.model.ExpandOptions;
import com.declfactory.generator.cli.model.ValidatedExpandOptions;
import com.declfactory.generator.cli.output.ExpandResultsPrinter;
import com.declfactory.generator.cli.validation.ExpandOptionsValidator;
import com.declfactory.generator.codegen.ExpanderResult;
import com.declfactory.generator.codegen.SourceExpander;
import com.declfactory.generator.codegen.model.core.context.ExpanderConfig;
import com.declfactory.generator.expansion.EmptyMatrixPolicy;
import com.declfactory.generator.expansion.ExpansionConfig;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command expanding template declarations into plain Java sources.
 */
@Command(
        name = "expand",
        mixinStandardHelpOptions = true,
        version = "declaration-factory 1.0.0",
        description = "Expands @Template declarations over the matrices bound by @Basis declarations."
)
public class ExpandCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExpandCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private ExpandOptions options = new ExpandOptions();

    private final ExpandOptionsValidator validator = new ExpandOptionsValidator();
    private final ExpandResultsPrinter printer = new ExpandResultsPrinter();

    @Override
    public Integer call() {
        try {
            if (options.isVerbose()) {
                enableDebugLogging();
            }

            ValidatedExpandOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            ExpanderResult result = new SourceExpander(toConfig(validated)).expand();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return EXIT_FAILURE;
            }

            printer.printSuccess(options, result);
            return EXIT_OK;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("Invalid option: {}", error));
            return EXIT_INVALID_OPTIONS;
        } catch (Exception e) {
            log.error("Expansion failed with exception", e);
            return EXIT_FAILURE;
        }
    }

    private ExpanderConfig toConfig(ValidatedExpandOptions v) {
        ExpansionConfig expansion = ExpansionConfig.builder()
                .basisMarker(options.getBasisMarker())
                .templateMarker(options.getTemplateMarker())
                .emptyMatrixPolicy(options.isStrictEmpty() ? EmptyMatrixPolicy.FAIL : EmptyMatrixPolicy.EXPAND_TO_NOTHING)
                .build();

        return ExpanderConfig.builder()
                .inputs(v.getNormalizedInputs())
                .outputDir(v.getNormalizedOutputDir())
                .extension(options.getExtension())
                .dryRun(options.isDryRun())
                .expansion(expansion)
                .build();
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger("com.declfactory");
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.DEBUG);
        }
    }
}
