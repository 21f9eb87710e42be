package com.declfactory.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.declfactory.generator.codegen.model.core.context.ExpanderConfig;
import com.declfactory.generator.codegen.model.core.context.ToolDiagnostics;
import com.declfactory.generator.codegen.model.input.SourceFile;
import com.declfactory.generator.codegen.model.output.ExpandedFile;
import com.declfactory.generator.codegen.source.SourceDiscoveryService;
import com.declfactory.generator.codegen.source.SourceParserService;
import com.declfactory.generator.codegen.util.FileWriteUtil;
import com.declfactory.generator.expansion.ExpansionStats;
import com.declfactory.generator.expansion.TemplateExpander;
import com.declfactory.generator.expansion.exception.ExpansionException;
import com.github.javaparser.ast.CompilationUnit;

/**
 * Expands every template source of a run and writes the results under the output directory.
 * All files are expanded before the first one is written, so a failing file leaves the
 * output untouched.
 */
public class SourceExpander {
    private static final Logger log = LoggerFactory.getLogger(SourceExpander.class);

    private final ExpanderConfig config;
    private final SourceDiscoveryService discoveryService;
    private final SourceParserService parserService;
    private final TemplateExpander templateExpander;

    public SourceExpander(ExpanderConfig config) {
        this.config = config;
        this.discoveryService = new SourceDiscoveryService();
        this.parserService = new SourceParserService(config.getExpansion());
        this.templateExpander = new TemplateExpander(config.getExpansion());
    }

    public ExpanderResult expand() {
        Path current = null;
        try {
            log.info("Starting template expansion...");

            // Step 1: Discover sources
            log.info("Step 1: Discovering template sources...");
            List<SourceFile> sources = discoveryService.discoverSources(config.getInputs(), config.getExtension());
            if (sources.isEmpty()) {
                return ExpanderResult.failure("No sources ending with " + config.getExtension()
                        + " found in " + config.getInputs());
            }
            log.info("Found {} source file(s)", sources.size());

            // Step 2: Parse and expand, in memory only
            log.info("Step 2: Expanding templates...");
            List<ExpandedFile> expanded = new ArrayList<>();
            ExpansionStats total = new ExpansionStats();
            for (SourceFile source : sources) {
                current = source.path();
                ToolDiagnostics diagnostics = new ToolDiagnostics();
                Optional<CompilationUnit> unit = parserService.parse(source.path(), diagnostics);
                if (diagnostics.hasErrors() || unit.isEmpty()) {
                    return ExpanderResult.fileFailure(source.path(), diagnostics.errorSummary());
                }
                ExpansionStats stats = templateExpander.expand(unit.get());
                total.add(stats);
                expanded.add(ExpandedFile.builder()
                        .source(source.path())
                        .target(targetOf(source))
                        .contents(unit.get().toString())
                        .stats(stats)
                        .build());
                log.debug("Expanded {}: {}", source.relativePath(), stats);
            }
            current = null;

            // Step 3: Write outputs
            int written = 0;
            if (config.isDryRun()) {
                log.info("Step 3: Dry run, skipping writes");
            } else {
                log.info("Step 3: Writing expanded sources...");
                for (ExpandedFile file : expanded) {
                    current = file.getTarget();
                    FileWriteUtil.safeWriteString(file.getTarget(), file.getContents());
                    written++;
                }
            }

            log.info("Template expansion complete!");

            return ExpanderResult.builder()
                    .success(true)
                    .outputPath(config.getOutputDir())
                    .filesDiscovered(sources.size())
                    .filesWritten(written)
                    .bindingsDeclared(total.getBindingsDeclared())
                    .templatesExpanded(total.getTemplatesExpanded())
                    .instancesEmitted(total.getInstancesEmitted())
                    .emptyExpansions(total.getEmptyExpansions())
                    .files(List.copyOf(expanded))
                    .build();

        } catch (ExpansionException e) {
            log.error("Expansion failed in {}: {}", current, e.getMessage());
            return ExpanderResult.fileFailure(current, e.getMessage());
        } catch (IOException e) {
            log.error("I/O failure", e);
            return ExpanderResult.fileFailure(current, "I/O failure: " + e.getMessage());
        } catch (Exception e) {
            log.error("Expansion failed", e);
            return ExpanderResult.failure(e.getMessage());
        }
    }

    private Path targetOf(SourceFile source) {
        if (config.getOutputDir() == null) {
            return null;
        }
        return config.getOutputDir().resolve(source.relativePath().toString()).normalize();
    }
}
