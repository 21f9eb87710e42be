package com.declfactory.generator.expansion;

import java.util.stream.Collectors;

import com.declfactory.generator.expansion.exception.ExpansionException;
import com.declfactory.generator.expansion.rewrite.TreeRewriteDriver;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;

import lombok.Getter;
import lombok.NonNull;

/**
 * Entry point of the expansion engine: parse, expand, print.
 */
public class TemplateExpander {

    @Getter
    private final ExpansionConfig config;
    private final JavaParser parser;
    private final TreeRewriteDriver driver;

    public TemplateExpander(@NonNull ExpansionConfig config) {
        this.config = config;
        this.parser = new JavaParser(config.parserConfiguration());
        this.driver = new TreeRewriteDriver(config);
    }

    public TemplateExpander() {
        this(ExpansionConfig.defaults());
    }

    /**
     * Expands every template in the unit, in place. On failure the unit may be partially
     * rewritten and must be discarded.
     */
    public ExpansionStats expand(CompilationUnit unit) {
        ExpansionContext context = new ExpansionContext(config);
        driver.rewrite(unit, context);
        return context.getStats();
    }

    public CompilationUnit parse(String source) {
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new ExpansionException("Source does not parse: " + result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.joining("; ")));
        }
        return result.getResult().get();
    }

    public String expandSource(String source) {
        CompilationUnit unit = parse(source);
        expand(unit);
        return unit.toString();
    }
}
