package com.declfactory.generator.codegen.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.declfactory.generator.codegen.model.input.SourceFile;

import lombok.NoArgsConstructor;

@NoArgsConstructor
public class SourceDiscoveryService {

    /**
     * Files are taken as given; directories are walked recursively for files with the extension.
     * Results are sorted within each directory so runs are reproducible.
     */
    public List<SourceFile> discoverSources(List<Path> inputs, String extension) throws IOException {
        List<SourceFile> sources = new ArrayList<>();
        for (Path input : inputs) {
            Path normalized = input.toAbsolutePath().normalize();
            if (Files.isDirectory(normalized)) {
                sources.addAll(walk(normalized, extension));
            } else {
                sources.add(new SourceFile(normalized.getParent(), normalized));
            }
        }
        return sources;
    }

    private List<SourceFile> walk(Path root, String extension) throws IOException {
        try (Stream<Path> stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(extension))
                    .sorted()
                    .map(path -> new SourceFile(root, path))
                    .collect(Collectors.toList());
        }
    }
}
