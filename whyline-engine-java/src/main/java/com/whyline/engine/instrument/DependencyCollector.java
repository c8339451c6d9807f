package com.whyline.engine.instrument;

import org.eclipse.jdt.core.dom.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the simple names an expression reads, in source order without duplicates.
 *
 * Excluded: method and label names, names in type or annotation position, the member
 * part of a qualified name or field access, and names bound inside the fragment itself
 * (lambda parameters, pattern variables). Capitalized receivers such as {@code Math} in
 * {@code Math.max(a, b)} are taken for type names. {@code this.total} reads {@code total}.
 */
public final class DependencyCollector {

    private DependencyCollector() {}

    public static List<String> namesRead(ASTNode fragment) {
        if (fragment == null) return List.of();
        Set<String> bound = new HashSet<>();
        fragment.accept(new ASTVisitor() {
            @Override
            public boolean visit(SimpleName node) {
                if (node.isDeclaration()) bound.add(node.getIdentifier());
                return false;
            }
        });

        Set<String> read = new LinkedHashSet<>();
        fragment.accept(new ASTVisitor() {
            @Override
            public boolean visit(SimpleName node) {
                if (!bound.contains(node.getIdentifier()) && isVariableRead(node)) {
                    read.add(node.getIdentifier());
                }
                return false;
            }

            @Override
            public boolean visit(MarkerAnnotation node) { return false; }

            @Override
            public boolean visit(NormalAnnotation node) { return false; }

            @Override
            public boolean visit(SingleMemberAnnotation node) { return false; }
        });
        return new ArrayList<>(read);
    }

    static boolean isVariableRead(SimpleName name) {
        if (name.isDeclaration()) return false;
        StructuralPropertyDescriptor location = name.getLocationInParent();
        ASTNode parent = name.getParent();

        if (location == MethodInvocation.NAME_PROPERTY
            || location == SuperMethodInvocation.NAME_PROPERTY
            || location == ExpressionMethodReference.NAME_PROPERTY
            || location == TypeMethodReference.NAME_PROPERTY
            || location == SuperMethodReference.NAME_PROPERTY
            || location == SuperFieldAccess.NAME_PROPERTY
            || location == QualifiedName.NAME_PROPERTY
            || location == LabeledStatement.LABEL_PROPERTY
            || location == BreakStatement.LABEL_PROPERTY
            || location == ContinueStatement.LABEL_PROPERTY
            || location == MemberValuePair.NAME_PROPERTY
            || location == ThisExpression.QUALIFIER_PROPERTY
            || location == SuperFieldAccess.QUALIFIER_PROPERTY
            || location == SuperMethodInvocation.QUALIFIER_PROPERTY) {
            return false;
        }
        if (location == FieldAccess.NAME_PROPERTY) {
            return ((FieldAccess) parent).getExpression() instanceof ThisExpression;
        }
        if (parent instanceof SwitchCase || isInTypePosition(name)) {
            return false;
        }
        if (isReceiver(location) && Character.isUpperCase(name.getIdentifier().charAt(0))) {
            return false;
        }
        return !(location == QualifiedName.QUALIFIER_PROPERTY && isPackagePrefix(name));
    }

    /** {@code java} in {@code java.util.List.of(a)}: the chain reaches a type name that is then used as one. */
    private static boolean isPackagePrefix(SimpleName head) {
        ASTNode n = head.getParent();
        while (n instanceof QualifiedName qualified) {
            if (Character.isUpperCase(qualified.getName().getIdentifier().charAt(0))) {
                return qualified.getParent() instanceof QualifiedName
                    || qualified.getLocationInParent() == MethodInvocation.EXPRESSION_PROPERTY;
            }
            n = n.getParent();
        }
        return false;
    }

    private static boolean isReceiver(StructuralPropertyDescriptor location) {
        return location == MethodInvocation.EXPRESSION_PROPERTY
            || location == QualifiedName.QUALIFIER_PROPERTY
            || location == FieldAccess.EXPRESSION_PROPERTY
            || location == ExpressionMethodReference.EXPRESSION_PROPERTY;
    }

    private static boolean isInTypePosition(ASTNode node) {
        ASTNode current = node;
        while (current.getParent() instanceof Name) {
            current = current.getParent();
        }
        return current.getParent() instanceof Type;
    }
}
