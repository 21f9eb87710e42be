package com.declfactory.generator.expansion.scope;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.declfactory.generator.expansion.attribute.AttributeExtractor;
import com.declfactory.generator.expansion.attribute.MarkerRecognizer;
import com.declfactory.generator.expansion.attribute.Markers;
import com.declfactory.generator.expansion.declaration.Declaration;
import com.declfactory.generator.expansion.declaration.DeclarationVisitor;
import com.declfactory.generator.expansion.declaration.EnumConstant;
import com.declfactory.generator.expansion.declaration.LocalType;
import com.declfactory.generator.expansion.declaration.LocalVariable;
import com.declfactory.generator.expansion.declaration.MemberDeclaration;
import com.declfactory.generator.expansion.exception.ExpansionException;
import com.declfactory.generator.expansion.model.ExpressionMatrix;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;

import lombok.RequiredArgsConstructor;

/**
 * Reads scope-binding declarations.
 *
 * <pre>
 * &#64;Basis static final Object[] widths = {8, 16, 32};
 * </pre>
 * binds {@code widths} to the three literals for the siblings that follow.
 * Every variable of the declaration must be initialized with an array literal.
 */
@RequiredArgsConstructor
public class BasisReader {

    private final AttributeExtractor extractor;
    private final String markerName;

    /**
     * @return the bindings, or empty if the declaration does not carry the scope-binding marker
     */
    public Optional<Map<String, ExpressionMatrix>> read(Declaration declaration) {
        MarkerRecognizer<AnnotationExpr> recognizer = annotation -> {
            if (!Markers.isNamed(annotation, markerName)) {
                return Optional.empty();
            }
            boolean hasArguments = annotation.isSingleMemberAnnotationExpr()
                    || (annotation.isNormalAnnotationExpr() && annotation.asNormalAnnotationExpr().getPairs().isNonEmpty());
            if (hasArguments) {
                throw new ExpansionException("@" + markerName + " takes no arguments", declaration.node());
            }
            return Optional.of(annotation);
        };
        if (extractor.extract(declaration.getAttributes(), recognizer).isEmpty()) {
            return Optional.empty();
        }

        Map<String, ExpressionMatrix> bindings = new LinkedHashMap<>();
        for (VariableDeclarator variable : variablesOf(declaration)) {
            String name = variable.getNameAsString();
            if (bindings.containsKey(name)) {
                throw new ExpansionException("@" + markerName + " binds '" + name + "' twice", declaration.node());
            }
            bindings.put(name, ExpressionMatrix.of(name, arrayElements(variable, declaration)));
        }
        return Optional.of(bindings);
    }

    private List<VariableDeclarator> variablesOf(Declaration declaration) {
        return declaration.accept(new DeclarationVisitor<List<VariableDeclarator>>() {
            @Override
            public List<VariableDeclarator> visit(MemberDeclaration member) {
                if (!member.getBody().isFieldDeclaration()) {
                    throw notAVariable(declaration);
                }
                return member.getBody().asFieldDeclaration().getVariables();
            }

            @Override
            public List<VariableDeclarator> visit(EnumConstant constant) {
                throw notAVariable(declaration);
            }

            @Override
            public List<VariableDeclarator> visit(LocalVariable variable) {
                return variable.getVariables().getVariables();
            }

            @Override
            public List<VariableDeclarator> visit(LocalType type) {
                throw notAVariable(declaration);
            }
        });
    }

    private List<Expression> arrayElements(VariableDeclarator variable, Declaration declaration) {
        Expression initializer = variable.getInitializer().orElseThrow(() -> new ExpansionException(
                "@" + markerName + " variable '" + variable.getNameAsString() + "' has no initializer",
                declaration.node()));
        if (initializer.isArrayInitializerExpr()) {
            return initializer.asArrayInitializerExpr().getValues();
        }
        if (initializer.isArrayCreationExpr() && initializer.asArrayCreationExpr().getInitializer().isPresent()) {
            return initializer.asArrayCreationExpr().getInitializer().get().getValues();
        }
        throw new ExpansionException("@" + markerName + " variable '" + variable.getNameAsString()
                + "' must be initialized with an array literal", declaration.node());
    }

    private ExpansionException notAVariable(Declaration declaration) {
        return new ExpansionException("@" + markerName + " can only mark a variable declaration", declaration.node());
    }
}
