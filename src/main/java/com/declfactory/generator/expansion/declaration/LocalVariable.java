package com.declfactory.generator.expansion.declaration;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;

import lombok.NonNull;

/**
 * A local variable declaration statement. The annotations live on the declaration
 * expression, the documentation on the statement.
 */
public final class LocalVariable extends Declaration {

    private final ExpressionStmt statement;

    public LocalVariable(@NonNull ExpressionStmt statement) {
        if (!statement.getExpression().isVariableDeclarationExpr()) {
            throw new IllegalArgumentException("Not a local variable declaration: " + statement);
        }
        this.statement = statement;
    }

    public ExpressionStmt getStatement() {
        return statement;
    }

    public VariableDeclarationExpr getVariables() {
        return statement.getExpression().asVariableDeclarationExpr();
    }

    @Override
    public ExpressionStmt node() {
        return statement;
    }

    @Override
    public NodeList<AnnotationExpr> getAttributes() {
        return getVariables().getAnnotations();
    }

    @Override
    void setAttributes(NodeList<AnnotationExpr> attributes) {
        getVariables().setAnnotations(attributes);
    }

    @Override
    public LocalVariable copy() {
        return new LocalVariable(statement.clone());
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
