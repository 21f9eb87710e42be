package com.declfactory.generator.expansion.declaration;

import java.util.List;

/**
 * A declaration copy with its markers removed, together with the removed markers' payloads.
 */
public record StrippedDeclaration<T>(Declaration template, List<T> markers) {
}
