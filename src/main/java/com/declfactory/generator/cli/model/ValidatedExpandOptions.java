package com.declfactory.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ExpandCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedExpandOptions {
    List<Path> normalizedInputs;
    Path normalizedOutputDir;
}
