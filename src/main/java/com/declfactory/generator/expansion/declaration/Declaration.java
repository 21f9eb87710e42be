package com.declfactory.generator.expansion.declaration;

import java.util.Optional;

import com.declfactory.generator.expansion.attribute.AttributeExtractor;
import com.declfactory.generator.expansion.attribute.CommentMerger;
import com.declfactory.generator.expansion.attribute.Extraction;
import com.declfactory.generator.expansion.attribute.MarkerRecognizer;
import com.declfactory.generator.expansion.exception.ExpansionException;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AnnotationExpr;

/**
 * A declaration that can take part in expansion.
 *
 * The set of shapes is closed: every variant is listed in {@link DeclarationVisitor},
 * so adding one breaks every dispatch site at compile time.
 */
public abstract class Declaration {

    Declaration() {
    }

    /**
     * The node that occupies this declaration's slot in its enclosing container.
     */
    public abstract Node node();

    /**
     * The declaration's annotations (live list, not a copy).
     */
    public abstract NodeList<AnnotationExpr> getAttributes();

    abstract void setAttributes(NodeList<AnnotationExpr> attributes);

    /**
     * Deep, parentless copy.
     */
    public abstract Declaration copy();

    public abstract <R> R accept(DeclarationVisitor<R> visitor);

    /**
     * The node that carries the declaration's leading documentation.
     */
    protected Node commentHost() {
        return node();
    }

    public Optional<Comment> getLeadingComment() {
        return commentHost().getComment();
    }

    /**
     * Copies this declaration without the annotations the recognizer matches.
     * Documentation owned by a removed annotation that no surviving annotation adopts
     * ends up in front of the declaration's own documentation.
     *
     * @return empty if nothing matched
     */
    public <T> Optional<StrippedDeclaration<T>> strip(AttributeExtractor extractor, MarkerRecognizer<T> recognizer) {
        Optional<Extraction<T>> extraction = extractor.extract(getAttributes(), recognizer);
        if (extraction.isEmpty()) {
            return Optional.empty();
        }
        Declaration template = copy();
        template.setAttributes(extraction.get().getRemaining());
        extraction.get().orphanedComment().ifPresent(orphan -> {
            Node host = template.commentHost();
            host.setComment(CommentMerger.merge(orphan, host.getComment().orElse(null)));
        });
        return Optional.of(new StrippedDeclaration<>(template, extraction.get().getMatches()));
    }

    public String describe() {
        return ExpansionException.describe(node());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + describe() + "]";
    }
}
