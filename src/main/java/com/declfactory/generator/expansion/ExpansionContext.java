package com.declfactory.generator.expansion;

import com.declfactory.generator.expansion.scope.ScopeStack;

import lombok.Getter;
import lombok.NonNull;

/**
 * State of one traversal, passed explicitly into every rewrite call.
 * Never shared between traversals.
 */
@Getter
public final class ExpansionContext {

    @NonNull
    private final ExpansionConfig config;

    private final ScopeStack scope = new ScopeStack();

    private final ExpansionStats stats = new ExpansionStats();

    public ExpansionContext(@NonNull ExpansionConfig config) {
        this.config = config;
    }
}
