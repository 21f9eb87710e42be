package com.declfactory.generator.expansion.attribute;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AnnotationExpr;

/**
 * Removes marker annotations from a declaration's annotation list without losing documentation.
 *
 * A comment owned by a removed annotation moves forward onto the next surviving annotation.
 * If nothing survives after it, it is handed back as the orphaned comment and the caller
 * attaches it to the declaration itself. The input list is never modified.
 */
public class AttributeExtractor {

    /**
     * @return empty if the recognizer matched nothing
     */
    public <T> Optional<Extraction<T>> extract(NodeList<AnnotationExpr> attributes, MarkerRecognizer<T> recognizer) {
        List<T> matches = new ArrayList<>();
        NodeList<AnnotationExpr> kept = new NodeList<>();
        Comment carried = null;

        for (AnnotationExpr attribute : attributes) {
            Optional<T> recognized = recognizer.recognize(attribute);
            if (recognized.isPresent()) {
                matches.add(recognized.get());
                carried = CommentMerger.merge(carried, attribute.getComment().orElse(null));
                continue;
            }
            AnnotationExpr survivor = attribute.clone();
            if (carried != null) {
                survivor.setComment(CommentMerger.merge(carried, survivor.getComment().orElse(null)));
                carried = null;
            }
            kept.add(survivor);
        }

        if (matches.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Extraction<>(kept, List.copyOf(matches), carried));
    }
}
