package com.declfactory.generator.expansion.attribute;

import java.util.Optional;

import com.github.javaparser.ast.expr.AnnotationExpr;

import lombok.experimental.UtilityClass;

@UtilityClass
public class Markers {

    /**
     * Matches {@code @Name} as well as any qualified {@code @some.pkg.Name}.
     */
    public boolean isNamed(AnnotationExpr annotation, String markerName) {
        return annotation.getName().getIdentifier().equals(markerName);
    }

    /**
     * Recognizer that hands back the marker annotation itself.
     */
    public MarkerRecognizer<AnnotationExpr> named(String markerName) {
        return annotation -> isNamed(annotation, markerName) ? Optional.of(annotation) : Optional.empty();
    }

    public boolean anyNamed(Iterable<AnnotationExpr> annotations, String markerName) {
        for (AnnotationExpr annotation : annotations) {
            if (isNamed(annotation, markerName)) {
                return true;
            }
        }
        return false;
    }
}
