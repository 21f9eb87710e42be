package com.declfactory.generator.expansion.declaration;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public final class EnumConstant extends Declaration {

    @NonNull
    private final EnumConstantDeclaration constant;

    public EnumConstantDeclaration getConstant() {
        return constant;
    }

    @Override
    public EnumConstantDeclaration node() {
        return constant;
    }

    @Override
    public NodeList<AnnotationExpr> getAttributes() {
        return constant.getAnnotations();
    }

    @Override
    void setAttributes(NodeList<AnnotationExpr> attributes) {
        constant.setAnnotations(attributes);
    }

    @Override
    public EnumConstant copy() {
        return new EnumConstant(constant.clone());
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
