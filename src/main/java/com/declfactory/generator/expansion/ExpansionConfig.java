package com.declfactory.generator.expansion;

import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ParserConfiguration.LanguageLevel;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings of the expansion engine.
 */
@Value
@Builder(toBuilder = true)
public class ExpansionConfig {

    public static final String DEFAULT_BASIS_MARKER = "Basis";
    public static final String DEFAULT_TEMPLATE_MARKER = "Template";

    /**
     * Simple name of the scope-binding annotation.
     */
    @NonNull
    @Builder.Default
    String basisMarker = DEFAULT_BASIS_MARKER;

    /**
     * Simple name of the loop annotation.
     */
    @NonNull
    @Builder.Default
    String templateMarker = DEFAULT_TEMPLATE_MARKER;

    @NonNull
    @Builder.Default
    EmptyMatrixPolicy emptyMatrixPolicy = EmptyMatrixPolicy.EXPAND_TO_NOTHING;

    /**
     * Java version the template sources are parsed as.
     */
    @NonNull
    @Builder.Default
    LanguageLevel languageLevel = LanguageLevel.JAVA_17;

    public static ExpansionConfig defaults() {
        return ExpansionConfig.builder().build();
    }

    public ParserConfiguration parserConfiguration() {
        return new ParserConfiguration().setLanguageLevel(languageLevel);
    }
}
