package com.declfactory.generator.expansion.declaration;

import java.util.Optional;

import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.stmt.Statement;

import lombok.experimental.UtilityClass;

/**
 * Classifies container elements into declaration shapes.
 */
@UtilityClass
public class Declarations {

    public Declaration ofMember(BodyDeclaration<?> member) {
        if (member.isEnumConstantDeclaration()) {
            return new EnumConstant(member.asEnumConstantDeclaration());
        }
        return new MemberDeclaration(member);
    }

    /**
     * @return empty for statements that do not declare anything annotatable
     */
    public Optional<Declaration> ofStatement(Statement statement) {
        if (statement.isExpressionStmt() && statement.asExpressionStmt().getExpression().isVariableDeclarationExpr()) {
            return Optional.of(new LocalVariable(statement.asExpressionStmt()));
        }
        if (statement.isLocalClassDeclarationStmt() || statement.isLocalRecordDeclarationStmt()) {
            return Optional.of(new LocalType(statement));
        }
        return Optional.empty();
    }
}
