package com.declfactory.generator.expansion.attribute;

import com.github.javaparser.ast.comments.BlockComment;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.comments.JavadocComment;

import lombok.experimental.UtilityClass;

/**
 * A node owns at most one comment, so documentation moved onto a node that already has one
 * is merged into a single comment instead of replacing it.
 */
@UtilityClass
public class CommentMerger {

    /**
     * Merges a carried comment in front of an existing one. Either may be null.
     * Always returns a fresh, unattached comment (or null if both are null).
     */
    public Comment merge(Comment carried, Comment existing) {
        if (carried == null) {
            return existing == null ? null : existing.clone();
        }
        if (existing == null) {
            return carried.clone();
        }
        String content = carried.getContent().stripTrailing() + "\n" + existing.getContent();
        if (carried.isJavadocComment() || existing.isJavadocComment()) {
            return new JavadocComment(content);
        }
        return new BlockComment(content);
    }
}
