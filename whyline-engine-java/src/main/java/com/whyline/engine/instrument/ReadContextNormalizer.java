package com.whyline.engine.instrument;

import org.eclipse.jdt.core.dom.*;

/**
 * Produces expressions that read back a value the original code just wrote or is about
 * to return, for use as arguments of recorder calls.
 *
 * Fragments are deep-copied, since a node can only have one parent. A fragment that
 * cannot be evaluated a second time without changing the program (writes, {@code ++},
 * method calls, object or array creation) or that is not a plain value (lambdas,
 * method references) is replaced by a string literal naming it.
 */
final class ReadContextNormalizer {

    static final String NOT_REEVALUATED = "<not re-evaluated: ";

    private final AST ast;
    private final String source;

    ReadContextNormalizer(AST ast, String source) {
        this.ast = ast;
        this.source = source;
    }

    /** A read of {@code fragment}, or a descriptive literal when re-reading is unsafe. */
    Expression toReadContext(Expression fragment) {
        if (!isPure(fragment)) {
            return literal(NOT_REEVALUATED + text(fragment) + ">");
        }
        return (Expression) ASTNode.copySubtree(ast, fragment);
    }

    /** A plain read of a declared or assigned simple name. */
    SimpleName readOf(SimpleName name) {
        return ast.newSimpleName(name.getIdentifier());
    }

    StringLiteral literal(String value) {
        StringLiteral literal = ast.newStringLiteral();
        literal.setLiteralValue(value);
        return literal;
    }

    String text(ASTNode node) {
        return source.substring(node.getStartPosition(), node.getStartPosition() + node.getLength());
    }

    /** No writes, no calls, no allocation, no functional expressions. */
    static boolean isPure(Expression fragment) {
        Detector detector = new Detector();
        fragment.accept(detector);
        return !detector.found;
    }

    private static final class Detector extends ASTVisitor {
        private boolean found;

        private boolean flag() {
            found = true;
            return false;
        }

        @Override public boolean visit(Assignment node) { return flag(); }
        @Override public boolean visit(PostfixExpression node) { return flag(); }
        @Override public boolean visit(ClassInstanceCreation node) { return flag(); }
        @Override public boolean visit(ArrayCreation node) { return flag(); }
        @Override public boolean visit(ArrayInitializer node) { return flag(); }
        @Override public boolean visit(LambdaExpression node) { return flag(); }
        @Override public boolean visit(ExpressionMethodReference node) { return flag(); }
        @Override public boolean visit(TypeMethodReference node) { return flag(); }
        @Override public boolean visit(SuperMethodReference node) { return flag(); }
        @Override public boolean visit(CreationReference node) { return flag(); }
        @Override public boolean visit(SwitchExpression node) { return flag(); }
        @Override public boolean visit(MethodInvocation node) { return flag(); }
        @Override public boolean visit(SuperMethodInvocation node) { return flag(); }

        @Override
        public boolean visit(PrefixExpression node) {
            PrefixExpression.Operator op = node.getOperator();
            if (op == PrefixExpression.Operator.INCREMENT || op == PrefixExpression.Operator.DECREMENT) {
                return flag();
            }
            return true;
        }
    }
}
