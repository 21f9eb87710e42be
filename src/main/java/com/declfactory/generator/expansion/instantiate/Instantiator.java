package com.declfactory.generator.expansion.instantiate;

import com.declfactory.generator.expansion.declaration.Declaration;
import com.declfactory.generator.expansion.declaration.DeclarationVisitor;
import com.declfactory.generator.expansion.declaration.EnumConstant;
import com.declfactory.generator.expansion.declaration.LocalType;
import com.declfactory.generator.expansion.declaration.LocalVariable;
import com.declfactory.generator.expansion.declaration.MemberDeclaration;
import com.declfactory.generator.expansion.exception.ExpansionException;
import com.declfactory.generator.expansion.model.Substitution;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;

/**
 * Produces one concrete declaration from a template and a substitution.
 * The template itself is never modified.
 */
public class Instantiator {

    private final SubstitutionVisitor substituter = new SubstitutionVisitor();

    public Declaration instantiate(Declaration template, Substitution substitution) {
        Declaration copy = template.copy();
        try {
            return copy.accept(new DeclarationVisitor<Declaration>() {
                @Override
                public Declaration visit(MemberDeclaration member) {
                    return new MemberDeclaration((BodyDeclaration<?>) member.getBody().accept(substituter, substitution));
                }

                @Override
                public Declaration visit(EnumConstant constant) {
                    return new EnumConstant((EnumConstantDeclaration) constant.getConstant().accept(substituter, substitution));
                }

                @Override
                public Declaration visit(LocalVariable variable) {
                    return new LocalVariable((ExpressionStmt) variable.getStatement().accept(substituter, substitution));
                }

                @Override
                public Declaration visit(LocalType type) {
                    return new LocalType((Statement) type.getStatement().accept(substituter, substitution));
                }
            });
        } catch (ClassCastException e) {
            throw new ExpansionException("Substitution " + substitution
                    + " puts a value where the syntax does not allow it", template.node(), e);
        }
    }
}
