package com.whyline.engine.instrument;

import org.eclipse.jdt.core.dom.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Braces every single-statement body of if/else, loops and labelled expression
 * statements, so that each instrumented statement ends up in a statement list.
 * Works on the text and inserts no line breaks, so line numbers are unchanged.
 * {@code else if} chains keep their shape.
 */
final class BlockBodyNormalizer extends ASTVisitor {

    private record Insertion(int offset, char brace) {}

    private final List<Insertion> insertions = new ArrayList<>();

    static String normalize(String source, CompilationUnit unit) {
        BlockBodyNormalizer normalizer = new BlockBodyNormalizer();
        unit.accept(normalizer);
        if (normalizer.insertions.isEmpty()) return source;

        List<Insertion> sorted = new ArrayList<>(normalizer.insertions);
        sorted.sort(Comparator.comparingInt(Insertion::offset).reversed());
        StringBuilder out = new StringBuilder(source);
        for (Insertion insertion : sorted) {
            out.insert(insertion.offset(), insertion.brace());
        }
        return out.toString();
    }

    @Override
    public boolean visit(IfStatement node) {
        brace(node.getThenStatement());
        Statement elseStatement = node.getElseStatement();
        if (elseStatement != null && !(elseStatement instanceof IfStatement)) {
            brace(elseStatement);
        }
        return true;
    }

    @Override
    public boolean visit(ForStatement node) {
        brace(node.getBody());
        return true;
    }

    @Override
    public boolean visit(EnhancedForStatement node) {
        brace(node.getBody());
        return true;
    }

    @Override
    public boolean visit(WhileStatement node) {
        brace(node.getBody());
        return true;
    }

    @Override
    public boolean visit(DoStatement node) {
        brace(node.getBody());
        return true;
    }

    @Override
    public boolean visit(LabeledStatement node) {
        // labels on loops must stay on the loop for labelled continue
        if (node.getBody() instanceof ExpressionStatement) {
            brace(node.getBody());
        }
        return true;
    }

    private void brace(Statement body) {
        if (body == null || body instanceof Block) return;
        insertions.add(new Insertion(body.getStartPosition(), '{'));
        insertions.add(new Insertion(body.getStartPosition() + body.getLength(), '}'));
    }
}
