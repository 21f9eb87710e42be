package com.declfactory.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.declfactory.generator.cli.model.ExpandOptions;
import com.declfactory.generator.cli.model.ValidatedExpandOptions;
import com.declfactory.generator.codegen.ExpanderResult;
import com.declfactory.generator.codegen.model.output.ExpandedFile;

/**
 * Responsible only for printing CLI output for the "expand" command.
 * No validation, no execution.
 */
public class ExpandResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ExpandResultsPrinter.class);

    public void printBanner(ExpandOptions o, ValidatedExpandOptions v) {
        log.info("=================================================");
        log.info("Declaration Factory");
        log.info("=================================================");
        log.info("Inputs: {}", v.getNormalizedInputs());
        log.info("Extension: {}", o.getExtension());
        log.info("Output Directory: {}", v.getNormalizedOutputDir() != null ? v.getNormalizedOutputDir() : "None");
        log.info("Markers: @{} / @{}", o.getBasisMarker(), o.getTemplateMarker());
        log.info("Empty Matrices: {}", o.isStrictEmpty() ? "fail" : "expand to nothing");
        if (o.isDryRun()) {
            log.info("Dry Run: no files will be written");
        }
        log.info("=================================================");
    }

    public void printSuccess(ExpandOptions o, ExpanderResult result) {
        log.info("");
        log.info("=================================================");
        log.info("EXPANSION SUCCESSFUL");
        log.info("=================================================");
        if (result.getOutputPath() != null) {
            log.info("Output Path: {}", result.getOutputPath());
        }
        log.info("Sources Processed: {}", result.getFilesDiscovered());
        log.info("Files Written: {}", result.getFilesWritten());
        log.info("Matrix Bindings: {}", result.getBindingsDeclared());
        log.info("Templates Expanded: {}", result.getTemplatesExpanded());
        log.info("Instances Emitted: {}", result.getInstancesEmitted());
        if (result.getEmptyExpansions() > 0) {
            log.warn("Templates Expanded To Nothing: {}", result.getEmptyExpansions());
        }

        if (o.isVerbose()) {
            log.info("");
            for (ExpandedFile file : result.getFiles()) {
                log.info("  {} -> {} ({} instance(s))", file.getSource(),
                        file.getTarget() != null ? file.getTarget() : "-", file.getStats().getInstancesEmitted());
            }
        }
        log.info("=================================================");
    }

    public void printFailure(ExpanderResult result) {
        log.error("Expansion failed: {}", result.getErrorMessage());
        if (result.getFailingFile() != null) {
            log.error("Failing file: {}", result.getFailingFile());
        }
    }
}
