package com.declfactory.generator.expansion.instantiate;

import java.util.Optional;

import com.declfactory.generator.expansion.model.Substitution;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.visitor.ModifierVisitor;
import com.github.javaparser.ast.visitor.Visitable;

/**
 * Replaces bound identifiers while walking a (copied) declaration.
 *
 * <ul>
 * <li>a name expression becomes a copy of the bound fragment;</li>
 * <li>an unqualified type without type arguments becomes the type the fragment denotes;</li>
 * <li>any other identifier (declared names, unqualified calls) is renamed when the fragment is a plain name.</li>
 * </ul>
 * Names selected from a scope, as in {@code list.size()} or {@code point.x}, are never rewritten.
 */
class SubstitutionVisitor extends ModifierVisitor<Substitution> {

    @Override
    public Visitable visit(NameExpr n, Substitution substitution) {
        Optional<Expression> bound = substitution.lookup(n.getNameAsString());
        if (bound.isEmpty()) {
            return super.visit(n, substitution);
        }
        return relocate(bound.get().clone(), n);
    }

    @Override
    public Visitable visit(ClassOrInterfaceType n, Substitution substitution) {
        if (n.getScope().isPresent() || n.getTypeArguments().isPresent()) {
            return super.visit(n, substitution);
        }
        Optional<Expression> bound = substitution.lookup(n.getNameAsString());
        if (bound.isEmpty()) {
            return super.visit(n, substitution);
        }
        Type type = TypeFragments.toType(bound.get(), n.getNameAsString(), n);
        for (AnnotationExpr annotation : n.getAnnotations()) {
            type.getAnnotations().add(annotation.clone());
        }
        return relocate(type, n);
    }

    @Override
    public Visitable visit(SimpleName n, Substitution substitution) {
        if (isSelectedMember(n)) {
            return super.visit(n, substitution);
        }
        Optional<Expression> bound = substitution.lookup(n.getIdentifier()).filter(Expression::isNameExpr);
        if (bound.isEmpty()) {
            return super.visit(n, substitution);
        }
        return relocate(new SimpleName(bound.get().asNameExpr().getNameAsString()), n);
    }

    private static boolean isSelectedMember(SimpleName n) {
        Optional<Node> parent = n.getParentNode();
        if (parent.isEmpty()) {
            return false;
        }
        if (parent.get() instanceof MethodCallExpr call) {
            return call.getScope().isPresent() && call.getName() == n;
        }
        if (parent.get() instanceof FieldAccessExpr access) {
            return access.getName() == n;
        }
        return false;
    }

    private static <N extends Node> N relocate(N replacement, Node original) {
        original.getComment().ifPresent(comment -> replacement.setComment(comment.clone()));
        return replacement;
    }
}
