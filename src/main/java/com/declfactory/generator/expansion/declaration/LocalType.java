package com.declfactory.generator.expansion.declaration;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.stmt.Statement;

import lombok.NonNull;

/**
 * A class or record declared inside a block.
 */
public final class LocalType extends Declaration {

    private final Statement statement;
    private final TypeDeclaration<?> type;

    public LocalType(@NonNull Statement statement) {
        if (statement.isLocalClassDeclarationStmt()) {
            this.type = statement.asLocalClassDeclarationStmt().getClassDeclaration();
        } else if (statement.isLocalRecordDeclarationStmt()) {
            this.type = statement.asLocalRecordDeclarationStmt().getRecordDeclaration();
        } else {
            throw new IllegalArgumentException("Not a local type declaration: " + statement);
        }
        this.statement = statement;
    }

    public Statement getStatement() {
        return statement;
    }

    public TypeDeclaration<?> getType() {
        return type;
    }

    @Override
    public Statement node() {
        return statement;
    }

    @Override
    protected Node commentHost() {
        return statement.getComment().isPresent() ? statement : type;
    }

    @Override
    public NodeList<AnnotationExpr> getAttributes() {
        return type.getAnnotations();
    }

    @Override
    void setAttributes(NodeList<AnnotationExpr> attributes) {
        type.setAnnotations(attributes);
    }

    @Override
    public LocalType copy() {
        return new LocalType(statement.clone());
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
