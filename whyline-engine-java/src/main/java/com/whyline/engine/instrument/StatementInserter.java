package com.whyline.engine.instrument;

import org.eclipse.jdt.core.dom.*;
import org.eclipse.jdt.core.dom.rewrite.ASTRewrite;
import org.eclipse.jdt.core.dom.rewrite.ListRewrite;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Places new statements around existing ones through an {@link ASTRewrite}.
 * Several statements inserted after the same anchor keep their insertion order.
 */
final class StatementInserter {

    private final ASTRewrite rewrite;
    private final Map<Statement, Statement> lastInsertedAfter = new HashMap<>();

    StatementInserter(ASTRewrite rewrite) {
        this.rewrite = rewrite;
    }

    /** Whether statements can be inserted next to {@code statement}. */
    boolean canInsertAround(Statement statement) {
        ASTNode parent = statement.getParent();
        if (parent instanceof Block) return true;
        if (parent instanceof SwitchStatement || parent instanceof SwitchExpression) {
            // arrow labels take a single statement
            return !hasArrowLabels(statementsOf(parent));
        }
        return false;
    }

    void insertAfter(Statement anchor, Statement statement) {
        ListRewrite list = listFor(anchor);
        Statement previous = lastInsertedAfter.getOrDefault(anchor, anchor);
        list.insertAfter(statement, previous, null);
        lastInsertedAfter.put(anchor, statement);
    }

    void insertBefore(Statement anchor, Statement statement) {
        listFor(anchor).insertBefore(statement, anchor, null);
    }

    void insertFirst(Block block, Statement statement) {
        rewrite.getListRewrite(block, Block.STATEMENTS_PROPERTY).insertFirst(statement, null);
    }

    void insertLast(Block block, Statement statement) {
        rewrite.getListRewrite(block, Block.STATEMENTS_PROPERTY).insertLast(statement, null);
    }

    private ListRewrite listFor(Statement anchor) {
        ASTNode parent = anchor.getParent();
        if (parent instanceof Block) {
            return rewrite.getListRewrite(parent, Block.STATEMENTS_PROPERTY);
        }
        if (parent instanceof SwitchStatement) {
            return rewrite.getListRewrite(parent, SwitchStatement.STATEMENTS_PROPERTY);
        }
        if (parent instanceof SwitchExpression) {
            return rewrite.getListRewrite(parent, SwitchExpression.STATEMENTS_PROPERTY);
        }
        throw new IllegalStateException("statement is not part of a statement list: " + anchor);
    }

    private static List<?> statementsOf(ASTNode switchNode) {
        return switchNode instanceof SwitchStatement s ? s.statements() : ((SwitchExpression) switchNode).statements();
    }

    private static boolean hasArrowLabels(List<?> statements) {
        for (Object s : statements) {
            if (s instanceof SwitchCase c && c.isSwitchLabeledRule()) return true;
        }
        return false;
    }
}
