package com.declfactory.generator.codegen.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.declfactory.generator.codegen.model.core.context.ToolDiagnostics;
import com.declfactory.generator.expansion.ExpansionConfig;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;

/**
 * Parses template sources. Parse problems are reported into the diagnostics, not thrown.
 */
public class SourceParserService {
    private static final Logger log = LoggerFactory.getLogger(SourceParserService.class);

    private final JavaParser parser;

    public SourceParserService(ExpansionConfig config) {
        this.parser = new JavaParser(config.parserConfiguration());
    }

    public Optional<CompilationUnit> parse(Path path, ToolDiagnostics diagnostics) throws IOException {
        String source = Files.readString(path, StandardCharsets.UTF_8);
        ParseResult<CompilationUnit> result = parser.parse(source);

        for (Problem problem : result.getProblems()) {
            String line = problem.getLocation()
                    .flatMap(location -> location.getBegin().getRange())
                    .map(range -> ":" + range.begin.line)
                    .orElse("");
            diagnostics.getErrors().add(path + line + ": " + problem.getMessage());
        }
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            return Optional.empty();
        }
        log.debug("Parsed {}", path);
        return result.getResult();
    }
}
