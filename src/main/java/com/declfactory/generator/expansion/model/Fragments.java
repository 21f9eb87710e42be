package com.declfactory.generator.expansion.model;

import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.Expression;

import lombok.experimental.UtilityClass;

/**
 * Helpers for expression fragments: the opaque values bound to loop variables.
 */
@UtilityClass
public class Fragments {

    /**
     * Returns a parentless copy of the fragment with every comment removed,
     * so that it adopts the formatting of whatever position it is copied into.
     */
    public Expression detach(Expression fragment) {
        Expression copy = fragment.clone();
        copy.getAllContainedComments().forEach(Comment::remove);
        copy.removeComment();
        return copy;
    }
}
