package com.declfactory.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import com.declfactory.generator.codegen.model.output.ExpandedFile;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a batch expansion run.
 */
@Data
@Builder
public class ExpanderResult {
    private boolean success;
    private String errorMessage;
    private Path failingFile;
    private Path outputPath;

    private int filesDiscovered;
    private int filesWritten;

    private int bindingsDeclared;
    private int templatesExpanded;
    private int instancesEmitted;
    private int emptyExpansions;

    @Builder.Default
    private List<ExpandedFile> files = List.of();

    public static ExpanderResult failure(String errorMessage) {
        return ExpanderResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static ExpanderResult fileFailure(Path file, String errorMessage) {
        return ExpanderResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .failingFile(file)
                .build();
    }
}
