package com.declfactory.generator.expansion.instantiate;

import com.declfactory.generator.expansion.exception.ExpansionException;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;

import lombok.experimental.UtilityClass;

/**
 * Reads an expression fragment as a type, for loop variables used in type positions.
 * {@code Integer}, {@code java.util.List}, {@code int.class} and {@code String[].class} denote types.
 */
@UtilityClass
class TypeFragments {

    Type toType(Expression fragment, String binding, Node site) {
        if (fragment.isClassExpr()) {
            return fragment.asClassExpr().getType().clone();
        }
        if (fragment.isTypeExpr()) {
            return fragment.asTypeExpr().getType().clone();
        }
        if (fragment.isNameExpr() || fragment.isFieldAccessExpr()) {
            return toClassType(fragment, binding, site);
        }
        throw notAType(fragment, binding, site);
    }

    private ClassOrInterfaceType toClassType(Expression fragment, String binding, Node site) {
        if (fragment.isNameExpr()) {
            return new ClassOrInterfaceType(null, fragment.asNameExpr().getNameAsString());
        }
        if (fragment.isFieldAccessExpr()) {
            FieldAccessExpr access = fragment.asFieldAccessExpr();
            return new ClassOrInterfaceType(toClassType(access.getScope(), binding, site), access.getNameAsString());
        }
        throw notAType(fragment, binding, site);
    }

    private ExpansionException notAType(Expression fragment, String binding, Node site) {
        return new ExpansionException("Loop variable '" + binding + "' is used as a type, but its value '"
                + fragment + "' does not denote a type", site);
    }
}
