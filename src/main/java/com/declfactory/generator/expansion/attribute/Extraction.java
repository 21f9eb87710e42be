package com.declfactory.generator.expansion.attribute;

import java.util.List;
import java.util.Optional;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AnnotationExpr;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of removing markers from an annotation list.
 */
@Value
public class Extraction<T> {

    /** The surviving annotations, as fresh copies. */
    @NonNull
    NodeList<AnnotationExpr> remaining;

    /** Payloads of the removed markers, in source order. Never empty. */
    @NonNull
    List<T> matches;

    /** Documentation of removed markers that no surviving annotation could adopt. */
    @Getter(AccessLevel.NONE)
    Comment orphanedComment;

    public Optional<Comment> orphanedComment() {
        return Optional.ofNullable(orphanedComment);
    }
}
