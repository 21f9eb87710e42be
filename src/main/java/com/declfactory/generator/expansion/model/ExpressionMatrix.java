package com.declfactory.generator.expansion.model;

import java.util.List;
import java.util.stream.Collectors;

import com.github.javaparser.ast.expr.Expression;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Ordered list of expression fragments bound to one name.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExpressionMatrix {

    @NonNull
    String binding;

    @NonNull
    List<Expression> elements;

    /**
     * Builds a matrix from detached copies of the given fragments.
     */
    public static ExpressionMatrix of(String binding, List<? extends Expression> fragments) {
        List<Expression> elements = fragments.stream()
                .map(Fragments::detach)
                .collect(Collectors.toUnmodifiableList());
        return new ExpressionMatrix(binding, elements);
    }

    public int size() {
        return elements.size();
    }

    public Expression get(int index) {
        return elements.get(index);
    }

    @Override
    public String toString() {
        return binding + elements.stream().map(Expression::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
