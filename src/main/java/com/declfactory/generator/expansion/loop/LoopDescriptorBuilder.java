package com.declfactory.generator.expansion.loop;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.declfactory.generator.expansion.exception.ExpansionException;
import com.declfactory.generator.expansion.model.ExpressionMatrix;
import com.declfactory.generator.expansion.model.LoopDescriptor;
import com.declfactory.generator.expansion.model.LoopThread;
import com.declfactory.generator.expansion.scope.ScopeStack;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;

/**
 * Turns loop markers into loop threads.
 *
 * <pre>
 * &#64;Template(T = {Integer, Long}, width = widths)
 * </pre>
 * gives two threads: {@code T} over an inline list, {@code width} over the matrix bound to
 * {@code widths} in the enclosing scope. Sources are resolved here, once.
 */
public class LoopDescriptorBuilder {

    public LoopDescriptor build(List<AnnotationExpr> markers, ScopeStack scope) {
        List<LoopThread> threads = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (AnnotationExpr marker : markers) {
            if (!marker.isNormalAnnotationExpr() || marker.asNormalAnnotationExpr().getPairs().isEmpty()) {
                throw new ExpansionException("@" + marker.getNameAsString()
                        + " requires named arguments, e.g. @" + marker.getNameAsString() + "(T = {A, B})", marker);
            }
            NormalAnnotationExpr loop = marker.asNormalAnnotationExpr();
            for (MemberValuePair argument : loop.getPairs()) {
                String binding = argument.getNameAsString();
                if (!seen.add(binding)) {
                    throw new ExpansionException("@" + marker.getNameAsString()
                            + " binds loop variable '" + binding + "' more than once", marker);
                }
                threads.add(new LoopThread(binding, source(binding, argument.getValue(), scope, marker)));
            }
        }
        return new LoopDescriptor(threads);
    }

    private ExpressionMatrix source(String binding, Expression value, ScopeStack scope, AnnotationExpr marker) {
        if (value.isArrayInitializerExpr()) {
            return ExpressionMatrix.of(binding, value.asArrayInitializerExpr().getValues());
        }
        if (value.isArrayCreationExpr() && value.asArrayCreationExpr().getInitializer().isPresent()) {
            ArrayInitializerExpr literal = value.asArrayCreationExpr().getInitializer().get();
            return ExpressionMatrix.of(binding, literal.getValues());
        }
        if (value.isNameExpr()) {
            return scope.resolve(value.asNameExpr().getNameAsString(), marker);
        }
        throw new ExpansionException("@" + marker.getNameAsString() + " matrix for '" + binding
                + "' must be an array literal or the name of a binding", marker);
    }
}
