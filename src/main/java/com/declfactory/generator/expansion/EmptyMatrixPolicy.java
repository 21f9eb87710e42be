package com.declfactory.generator.expansion;

/**
 * What a loop over an empty matrix does.
 */
public enum EmptyMatrixPolicy {
    /** Zero combinations: the templated declaration disappears from the output. */
    EXPAND_TO_NOTHING,
    /** An empty axis is a fatal error. */
    FAIL
}
