package com.declfactory.generator.codegen.model.input;

import java.nio.file.Path;

/**
 * A template source and the input root it was found under.
 * For a file given directly, the root is its parent directory.
 */
public record SourceFile(Path root, Path path) {

    public Path relativePath() {
        return root.relativize(path);
    }
}
