package com.declfactory.generator.expansion.scope;

import com.declfactory.generator.expansion.exception.ExpansionException;
import com.declfactory.generator.expansion.model.ExpressionMatrix;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.expr.Expression;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class ScopeStackTest {

    @Test
    void testLookupPrefersInnermostFrame() {
        ScopeStack scope = new ScopeStack();
        scope.push(Map.of("m", matrix("m", "1", "2")));
        scope.push(Map.of("m", matrix("m", "3")));

        assertThat(scope.lookup("m")).hasValueSatisfying(m -> assertThat(render(m)).containsExactly("3"));

        scope.pop();
        assertThat(scope.lookup("m")).hasValueSatisfying(m -> assertThat(render(m)).containsExactly("1", "2"));
    }

    @Test
    void testLookupFallsThroughToOuterFrames() {
        ScopeStack scope = new ScopeStack();
        scope.push(Map.of("outer", matrix("outer", "a")));
        scope.push(Map.of("inner", matrix("inner", "b")));

        assertThat(scope.lookup("outer")).isPresent();
        assertThat(scope.lookup("inner")).isPresent();
        assertThat(scope.lookup("missing")).isEmpty();
    }

    @Test
    void testEmptyFrameIsNotPushed() {
        ScopeStack scope = new ScopeStack();

        assertThat(scope.push(Map.of())).isFalse();
        assertThat(scope.depth()).isZero();
    }

    @Test
    void testPopOnEmptyStackFails() {
        assertThatThrownBy(() -> new ScopeStack().pop())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testResolveUndefinedNameIsFatal() {
        ScopeStack scope = new ScopeStack();

        assertThatThrownBy(() -> scope.resolve("widths", null))
                .isInstanceOf(ExpansionException.class)
                .hasMessageContaining("'widths' is not defined");
    }

    @Test
    void testBlockReleasesItsFramesOnly() {
        ScopeStack scope = new ScopeStack();
        scope.push(Map.of("outer", matrix("outer", "a")));

        try (ScopeStack.Block block = scope.open()) {
            block.push(Map.of("x", matrix("x", "1")));
            block.push(Map.of("y", matrix("y", "2")));
            assertThat(scope.depth()).isEqualTo(3);
        }

        assertThat(scope.depth()).isEqualTo(1);
        assertThat(scope.lookup("outer")).isPresent();
        assertThat(scope.lookup("x")).isEmpty();
    }

    @Test
    void testBlockReleasesFramesWhenTraversalFails() {
        ScopeStack scope = new ScopeStack();

        assertThatThrownBy(() -> {
            try (ScopeStack.Block block = scope.open()) {
                block.push(Map.of("x", matrix("x", "1")));
                throw new ExpansionException("boom");
            }
        }).isInstanceOf(ExpansionException.class);

        assertThat(scope.depth()).isZero();
    }

    private static ExpressionMatrix matrix(String name, String... fragments) {
        List<Expression> elements = Arrays.stream(fragments)
                .map(source -> StaticJavaParser.<Expression>parseExpression(source))
                .collect(Collectors.toList());
        return ExpressionMatrix.of(name, elements);
    }

    private static List<String> render(ExpressionMatrix matrix) {
        return matrix.getElements().stream().map(Expression::toString).collect(Collectors.toList());
    }
}
