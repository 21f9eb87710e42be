package com.declfactory.generator.expansion.declaration;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;

import lombok.NonNull;

/**
 * A member of a type body, or a top-level type: fields, methods, constructors,
 * nested types, annotation members.
 */
public final class MemberDeclaration extends Declaration {

    private final BodyDeclaration<?> body;

    public MemberDeclaration(@NonNull BodyDeclaration<?> body) {
        if (body.isEnumConstantDeclaration()) {
            throw new IllegalArgumentException("Enum constants are wrapped by EnumConstant");
        }
        this.body = body;
    }

    public BodyDeclaration<?> getBody() {
        return body;
    }

    @Override
    public BodyDeclaration<?> node() {
        return body;
    }

    @Override
    public NodeList<AnnotationExpr> getAttributes() {
        return body.getAnnotations();
    }

    @Override
    void setAttributes(NodeList<AnnotationExpr> attributes) {
        body.setAnnotations(attributes);
    }

    @Override
    public MemberDeclaration copy() {
        return new MemberDeclaration(body.clone());
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
