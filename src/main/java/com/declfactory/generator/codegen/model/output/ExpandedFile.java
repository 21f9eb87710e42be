package com.declfactory.generator.codegen.model.output;

import java.nio.file.Path;

import com.declfactory.generator.expansion.ExpansionStats;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * An expanded source: where it came from, where it goes, and what it contains.
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class ExpandedFile {

    @NonNull
    Path source;

    /** Null on a dry run without output directory. */
    Path target;

    @NonNull
    String contents;

    @NonNull
    ExpansionStats stats;
}
