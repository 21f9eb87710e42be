package com.declfactory.generator.expansion.attribute;

import java.util.Optional;

import com.github.javaparser.ast.expr.AnnotationExpr;

/**
 * Recognizes a marker annotation and parses its payload.
 * Returns empty for annotations that are not the marker; throws for a malformed marker.
 */
@FunctionalInterface
public interface MarkerRecognizer<T> {

    Optional<T> recognize(AnnotationExpr annotation);
}
