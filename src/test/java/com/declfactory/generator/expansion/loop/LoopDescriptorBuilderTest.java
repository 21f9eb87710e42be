package com.declfactory.generator.expansion.loop;

import com.declfactory.generator.expansion.exception.ExpansionException;
import com.declfactory.generator.expansion.model.ExpressionMatrix;
import com.declfactory.generator.expansion.model.LoopDescriptor;
import com.declfactory.generator.expansion.model.LoopThread;
import com.declfactory.generator.expansion.scope.ScopeStack;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class LoopDescriptorBuilderTest {

    private final LoopDescriptorBuilder builder = new LoopDescriptorBuilder();

    @Test
    void testInlineMatricesInDeclarationOrder() {
        LoopDescriptor loops = builder.build(markers("@Template(T = {Integer, Long}, n = {1, 2, 3})"), new ScopeStack());

        assertThat(loops.bindings()).containsExactly("T", "n");
        assertThat(render(loops.getThreads().get(0))).containsExactly("Integer", "Long");
        assertThat(render(loops.getThreads().get(1))).containsExactly("1", "2", "3");
        assertThat(loops.combinationCount()).isEqualTo(6);
    }

    @Test
    void testArrayCreationIsAcceptedInline() {
        LoopDescriptor loops = builder.build(markers("@Template(n = new int[] {4, 5})"), new ScopeStack());

        assertThat(render(loops.getThreads().get(0))).containsExactly("4", "5");
    }

    @Test
    void testNamedMatrixResolvesThroughScope() {
        ScopeStack scope = new ScopeStack();
        scope.push(Map.of("widths", ExpressionMatrix.of("widths", expressions("8", "16"))));

        LoopDescriptor loops = builder.build(markers("@Template(w = widths)"), scope);

        LoopThread thread = loops.getThreads().get(0);
        assertThat(thread.binding()).isEqualTo("w");
        assertThat(render(thread)).containsExactly("8", "16");
    }

    @Test
    void testSeveralMarkersConcatenateThreads() {
        LoopDescriptor loops = builder.build(markers("@Template(a = {1})", "@Template(b = {2, 3})"), new ScopeStack());

        assertThat(loops.bindings()).containsExactly("a", "b");
        assertThat(loops.combinationCount()).isEqualTo(2);
    }

    @Test
    void testUndefinedMatrixIsFatal() {
        assertThatThrownBy(() -> builder.build(markers("@Template(w = widths)"), new ScopeStack()))
                .isInstanceOf(ExpansionException.class)
                .hasMessageContaining("'widths' is not defined");
    }

    @Test
    void testDuplicateLoopVariableIsFatal() {
        assertThatThrownBy(() -> builder.build(markers("@Template(a = {1})", "@Template(a = {2})"), new ScopeStack()))
                .isInstanceOf(ExpansionException.class)
                .hasMessageContaining("'a' more than once");
    }

    @Test
    void testMarkerWithoutNamedArgumentsIsFatal() {
        assertThatThrownBy(() -> builder.build(markers("@Template"), new ScopeStack()))
                .isInstanceOf(ExpansionException.class)
                .hasMessageContaining("requires named arguments");
        assertThatThrownBy(() -> builder.build(markers("@Template({1, 2})"), new ScopeStack()))
                .isInstanceOf(ExpansionException.class)
                .hasMessageContaining("requires named arguments");
    }

    @Test
    void testMalformedMatrixIsFatal() {
        assertThatThrownBy(() -> builder.build(markers("@Template(a = 1 + 2)"), new ScopeStack()))
                .isInstanceOf(ExpansionException.class)
                .hasMessageContaining("must be an array literal or the name of a binding");
    }

    private static List<AnnotationExpr> markers(String... sources) {
        return Arrays.stream(sources).map(StaticJavaParser::parseAnnotation).collect(Collectors.toList());
    }

    private static List<Expression> expressions(String... sources) {
        return Arrays.stream(sources)
                .map(source -> StaticJavaParser.<Expression>parseExpression(source))
                .collect(Collectors.toList());
    }

    private static List<String> render(LoopThread thread) {
        return thread.matrix().getElements().stream().map(Expression::toString).collect(Collectors.toList());
    }
}
