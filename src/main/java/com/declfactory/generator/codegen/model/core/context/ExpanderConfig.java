package com.declfactory.generator.codegen.model.core.context;

import java.nio.file.Path;
import java.util.List;

import com.declfactory.generator.expansion.ExpansionConfig;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Configuration for a batch expansion run.
 */
@Data
@Builder
public class ExpanderConfig {

    /**
     * Template sources: files, or directories walked recursively.
     */
    @Singular
    private List<Path> inputs;

    /**
     * Root the expanded files are written under, mirroring their path relative to the input.
     */
    private Path outputDir;

    /**
     * File name suffix of template sources inside input directories.
     */
    @Builder.Default
    private String extension = ".java";

    /**
     * Whether this is a dry run (no files written).
     */
    private boolean dryRun;

    @Builder.Default
    private ExpansionConfig expansion = ExpansionConfig.defaults();
}
