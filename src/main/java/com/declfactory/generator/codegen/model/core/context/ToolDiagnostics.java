package com.declfactory.generator.codegen.model.core.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Errors accumulated while reading template sources.
 *
 * Pure structure only: no logging, no IO.
 */
@Getter
public class ToolDiagnostics {
    private final List<String> errors = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public String errorSummary() {
        return errors.size() + " error(s):" + System.lineSeparator()
                + String.join(System.lineSeparator(), errors);
    }
}
