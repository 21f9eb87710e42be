package com.declfactory.generator.expansion.declaration;

/**
 * Exhaustive dispatch over the declaration shapes that expansion understands.
 */
public interface DeclarationVisitor<R> {
    R visit(MemberDeclaration member);
    R visit(EnumConstant constant);
    R visit(LocalVariable variable);
    R visit(LocalType type);
}
