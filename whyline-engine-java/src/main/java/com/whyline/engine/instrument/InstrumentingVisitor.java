package com.whyline.engine.instrument;

import com.whyline.recorder.EventKind;
import org.eclipse.jdt.core.dom.*;
import org.eclipse.jdt.core.dom.rewrite.ASTRewrite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks a block-normalized compilation unit and schedules recorder calls on an
 * {@link ASTRewrite}: after assignments, at function entry, before or around returns,
 * at the top of each branch and loop body. The original statements are never touched,
 * except for wrapped return values and the synthetic else blocks of if chains.
 */
final class InstrumentingVisitor extends ASTVisitor {

    private final CompilationUnit unit;
    private final ASTRewrite rewrite;
    private final ProbeCallFactory probes;
    private final ReadContextNormalizer reads;
    private final StatementInserter inserter;
    private final LocalScopes scopes = new LocalScopes();
    private final Deque<String> functions = new ArrayDeque<>();
    private final String scriptClassName;
    private final List<String> scriptBindingNames;

    InstrumentingVisitor(CompilationUnit unit, String source, String fileName,
                         String scriptClassName, List<String> scriptBindingNames) {
        this.unit = unit;
        this.rewrite = ASTRewrite.create(unit.getAST());
        this.probes = new ProbeCallFactory(unit.getAST(), fileName);
        this.reads = new ReadContextNormalizer(unit.getAST(), source);
        this.inserter = new StatementInserter(rewrite);
        this.scriptClassName = scriptClassName;
        this.scriptBindingNames = scriptBindingNames;
    }

    ASTRewrite rewrite() {
        return rewrite;
    }

    int probeCount() {
        return probes.probeCount();
    }

    // -----------------------------------------------------------------------
    // Types and functions
    // -----------------------------------------------------------------------

    @Override
    public boolean visit(TypeDeclaration node) {
        addRecorderField(node);
        return true;
    }

    @Override
    public boolean visit(RecordDeclaration node) {
        addRecorderField(node);
        return true;
    }

    private void addRecorderField(AbstractTypeDeclaration node) {
        if (!(node.getParent() instanceof CompilationUnit) || !ProbeCallFactory.holdsRecorderField(node)) return;
        rewrite.getListRewrite(node, node.getBodyDeclarationsProperty())
            .insertFirst(probes.recorderField(node.getName().getIdentifier()), null);
    }

    @Override
    public boolean visit(MethodDeclaration node) {
        scopes.pushBarrier();
        List<String> parameters = parameterNames(node);
        parameters.forEach(p -> scopes.declare(p, true));
        String function = node.getName().getIdentifier();
        functions.push(function);
        if (node.getBody() != null) {
            recordFunctionEntry(node, function, parameters);
        }
        return true;
    }

    @Override
    public void endVisit(MethodDeclaration node) {
        functions.pop();
        scopes.pop();
    }

    private void recordFunctionEntry(MethodDeclaration node, String function, List<String> parameters) {
        Block body = node.getBody();
        Map<String, Expression> payload = probes.payload();
        payload.put("function", probes.string(function));
        payload.put("declaringType", probes.string(typeName(node)));
        payload.put("parameters", probes.stringList(parameters));
        payload.put("args", probes.argumentList(parameters));
        ExpressionStatement entry = probes.event(body, scopes.visible(), lineOf(node.getName()),
            EventKind.FUNCTION_ENTRY, payload);

        List<?> statements = body.statements();
        Object first = statements.isEmpty() ? null : statements.get(0);
        if (first instanceof ConstructorInvocation || first instanceof SuperConstructorInvocation) {
            inserter.insertAfter((Statement) first, entry);
        } else {
            inserter.insertFirst(body, entry);
        }
    }

    @Override
    public boolean visit(LambdaExpression node) {
        scopes.pushBarrier();
        for (Object parameter : node.parameters()) {
            scopes.declare(((VariableDeclaration) parameter).getName().getIdentifier(), true);
        }
        functions.push("<lambda>");
        return true;
    }

    @Override
    public void endVisit(LambdaExpression node) {
        functions.pop();
        scopes.pop();
    }

    @Override
    public boolean visit(Initializer node) {
        scopes.pushBarrier();
        functions.push(Modifier.isStatic(node.getModifiers()) ? "<clinit>" : "<init>");
        return true;
    }

    @Override
    public void endVisit(Initializer node) {
        functions.pop();
        scopes.pop();
    }

    // -----------------------------------------------------------------------
    // Scopes
    // -----------------------------------------------------------------------

    @Override
    public boolean visit(Block node) {
        scopes.push();
        if (node.getLocationInParent() == TryStatement.BODY_PROPERTY) {
            for (Object resource : ((TryStatement) node.getParent()).resources()) {
                if (resource instanceof VariableDeclarationExpression declaration) {
                    for (Object fragment : declaration.fragments()) {
                        scopes.declare(((VariableDeclarationFragment) fragment).getName().getIdentifier(), true);
                    }
                }
            }
        }
        return true;
    }

    @Override
    public void endVisit(Block node) {
        if (isScriptMainBody(node)) {
            publishScriptBindings(node);
        }
        scopes.pop();
    }

    @Override
    public boolean visit(CatchClause node) {
        scopes.push();
        scopes.declare(node.getException().getName().getIdentifier(), true);
        return true;
    }

    @Override
    public void endVisit(CatchClause node) {
        scopes.pop();
    }

    @Override
    public boolean visit(SwitchStatement node) {
        scopes.push();
        return true;
    }

    @Override
    public void endVisit(SwitchStatement node) {
        scopes.pop();
    }

    @Override
    public boolean visit(SwitchExpression node) {
        scopes.push();
        return true;
    }

    @Override
    public void endVisit(SwitchExpression node) {
        scopes.pop();
    }

    @Override
    public boolean visit(SwitchCase node) {
        scopes.enterSwitchLabel();
        return true;
    }

    // -----------------------------------------------------------------------
    // Assignments
    // -----------------------------------------------------------------------

    @Override
    public void endVisit(VariableDeclarationStatement node) {
        List<VariableDeclarationFragment> initialized = new ArrayList<>();
        for (Object f : node.fragments()) {
            VariableDeclarationFragment fragment = (VariableDeclarationFragment) f;
            scopes.declare(fragment.getName().getIdentifier(), fragment.getInitializer() != null);
            if (fragment.getInitializer() != null) initialized.add(fragment);
        }
        if (!inserter.canInsertAround(node)) return;
        for (VariableDeclarationFragment fragment : initialized) {
            Map<String, Expression> payload = probes.payload();
            payload.put("targetName", probes.string(fragment.getName().getIdentifier()));
            payload.put("value", reads.readOf(fragment.getName()));
            payload.put("dependsOn", probes.stringList(DependencyCollector.namesRead(fragment.getInitializer())));
            inserter.insertAfter(node, probes.event(node, scopes.visible(), lineOf(node), EventKind.ASSIGN, payload));
        }
    }

    @Override
    public void endVisit(ExpressionStatement node) {
        Expression expression = node.getExpression();
        if (expression instanceof Assignment assignment
            && assignment.getLeftHandSide() instanceof SimpleName name
            && assignment.getOperator() == Assignment.Operator.ASSIGN) {
            scopes.markAssigned(name.getIdentifier());
        }
        if (!inserter.canInsertAround(node)) return;

        Statement record = null;
        if (expression instanceof Assignment assignment) {
            record = assignmentEvent(node, assignment);
        } else if (expression instanceof PostfixExpression postfix) {
            record = stepEvent(node, postfix.getOperand(), postfix.getOperator().toString());
        } else if (expression instanceof PrefixExpression prefix
            && (prefix.getOperator() == PrefixExpression.Operator.INCREMENT
                || prefix.getOperator() == PrefixExpression.Operator.DECREMENT)) {
            record = stepEvent(node, prefix.getOperand(), prefix.getOperator().toString());
        } else if (expression instanceof MethodInvocation call) {
            record = mutatingCallEvent(node, call);
        }
        if (record != null) {
            inserter.insertAfter(node, record);
        }
    }

    private Statement assignmentEvent(ExpressionStatement node, Assignment assignment) {
        Expression target = assignment.getLeftHandSide();
        boolean augmented = assignment.getOperator() != Assignment.Operator.ASSIGN;
        Set<String> dependsOn = new LinkedHashSet<>();
        Map<String, Expression> payload = probes.payload();
        EventKind kind;

        if (target instanceof SimpleName name) {
            kind = augmented ? EventKind.AUGMENTED_ASSIGN : EventKind.ASSIGN;
            if (augmented) dependsOn.add(name.getIdentifier());
            payload.put("targetName", probes.string(name.getIdentifier()));
        } else if (target instanceof ArrayAccess element) {
            kind = augmented ? EventKind.AUGMENTED_ASSIGN : EventKind.INDEX_ASSIGN;
            dependsOn.addAll(DependencyCollector.namesRead(element.getArray()));
            dependsOn.addAll(DependencyCollector.namesRead(element.getIndex()));
            payload.put("targetName", probes.string(reads.text(target)));
            payload.put("container", reads.toReadContext(element.getArray()));
            payload.put("index", reads.toReadContext(element.getIndex()));
        } else if (isMemberTarget(target)) {
            kind = augmented ? EventKind.AUGMENTED_ASSIGN : EventKind.ATTRIBUTE_ASSIGN;
            Expression owner = memberOwner(target);
            if (owner != null) dependsOn.addAll(DependencyCollector.namesRead(owner));
            if (augmented) dependsOn.addAll(DependencyCollector.namesRead(target));
            payload.put("targetName", probes.string(reads.text(target)));
            payload.put("attribute", probes.string(memberName(target)));
            if (owner != null && !looksLikeTypeName(owner)) {
                payload.put("object", reads.toReadContext(owner));
            } else if (target instanceof SuperFieldAccess) {
                payload.put("object", unit.getAST().newThisExpression());
            }
        } else {
            return null;
        }

        if (augmented) payload.put("operator", probes.string(assignment.getOperator().toString()));
        payload.put("value", target instanceof SimpleName name ? reads.readOf(name) : reads.toReadContext(target));
        dependsOn.addAll(DependencyCollector.namesRead(assignment.getRightHandSide()));
        payload.put("dependsOn", probes.stringList(new ArrayList<>(dependsOn)));
        return probes.event(node, scopes.visible(), lineOf(node), kind, payload);
    }

    /** {@code x++}, {@code --count} and friends, recorded as augmented assignments. */
    private Statement stepEvent(ExpressionStatement node, Expression operand, String operator) {
        Map<String, Expression> payload = probes.payload();
        payload.put("targetName", probes.string(operand instanceof SimpleName name ? name.getIdentifier() : reads.text(operand)));
        payload.put("operator", probes.string(operator));
        payload.put("value", operand instanceof SimpleName name ? reads.readOf(name) : reads.toReadContext(operand));
        payload.put("dependsOn", probes.stringList(DependencyCollector.namesRead(operand)));
        return probes.event(node, scopes.visible(), lineOf(node), EventKind.AUGMENTED_ASSIGN, payload);
    }

    /**
     * Library calls that write into a container: {@code list.set(i, v)} is an element
     * write, {@code Arrays.fill(a, from, to, v)} and {@code System.arraycopy} write a range.
     */
    private Statement mutatingCallEvent(ExpressionStatement node, MethodInvocation call) {
        String method = call.getName().getIdentifier();
        Expression receiver = call.getExpression();
        List<?> args = call.arguments();
        Map<String, Expression> payload = probes.payload();
        Set<String> dependsOn = new LinkedHashSet<>();
        EventKind kind;

        if (receiver != null && isNamed(receiver, "Arrays") && method.equals("fill") && args.size() == 4) {
            Expression array = (Expression) args.get(0);
            kind = EventKind.SLICE_ASSIGN;
            payload.put("targetName", probes.string(reads.text(array)));
            payload.put("container", reads.toReadContext(array));
            payload.put("from", reads.toReadContext((Expression) args.get(1)));
            payload.put("to", reads.toReadContext((Expression) args.get(2)));
            payload.put("value", reads.toReadContext((Expression) args.get(3)));
        } else if (receiver != null && isNamed(receiver, "System") && method.equals("arraycopy") && args.size() == 5) {
            Expression destination = (Expression) args.get(2);
            kind = EventKind.SLICE_ASSIGN;
            payload.put("targetName", probes.string(reads.text(destination)));
            payload.put("container", reads.toReadContext(destination));
            payload.put("from", reads.toReadContext((Expression) args.get(3)));
            payload.put("to", sum((Expression) args.get(3), (Expression) args.get(4)));
        } else if (receiver != null && !looksLikeTypeName(receiver) && method.equals("set") && args.size() == 2) {
            kind = EventKind.INDEX_ASSIGN;
            payload.put("targetName", probes.string(reads.text(receiver)));
            payload.put("container", reads.toReadContext(receiver));
            payload.put("index", reads.toReadContext((Expression) args.get(0)));
            payload.put("value", reads.toReadContext((Expression) args.get(1)));
        } else {
            return null;
        }
        dependsOn.addAll(DependencyCollector.namesRead(receiver));
        for (Object arg : args) dependsOn.addAll(DependencyCollector.namesRead((ASTNode) arg));
        payload.put("dependsOn", probes.stringList(new ArrayList<>(dependsOn)));
        return probes.event(node, scopes.visible(), lineOf(node), kind, payload);
    }

    // -----------------------------------------------------------------------
    // Returns
    // -----------------------------------------------------------------------

    @Override
    public boolean visit(ReturnStatement node) {
        if (functions.isEmpty()) return true;
        String function = functions.peek();
        Expression value = node.getExpression();
        int line = lineOf(node);

        if (value != null && !ReadContextNormalizer.isPure(value)) {
            // evaluate once, record, hand the value back
            Expression moved = (Expression) rewrite.createMoveTarget(value);
            rewrite.replace(value, probes.recordReturn(node, scopes.visible(), line, function, moved), null);
            return true;
        }
        if (!inserter.canInsertAround(node)) return true;
        Map<String, Expression> payload = probes.payload();
        payload.put("function", probes.string(function));
        payload.put("value", value == null ? unit.getAST().newNullLiteral() : reads.toReadContext(value));
        inserter.insertBefore(node, probes.event(node, scopes.visible(), line, EventKind.RETURN, payload));
        return true;
    }

    // -----------------------------------------------------------------------
    // Control flow
    // -----------------------------------------------------------------------

    @Override
    public boolean visit(IfStatement node) {
        if (node.getLocationInParent() == IfStatement.ELSE_STATEMENT_PROPERTY) {
            return true; // handled with the head of its chain
        }
        IfStatement current = node;
        String decision = "then";
        while (true) {
            Expression condition = current.getExpression();
            int line = lineOf(current);
            if (current.getThenStatement() instanceof Block then) {
                inserter.insertFirst(then, branchEvent(current, line, condition, true, decision));
            }
            Statement otherwise = current.getElseStatement();
            if (otherwise instanceof IfStatement next) {
                current = next;
                decision = "elif";
                continue;
            }
            if (otherwise instanceof Block elseBlock) {
                inserter.insertFirst(elseBlock, branchEvent(current, line, condition, false, "else"));
            } else if (otherwise == null) {
                Block skip = unit.getAST().newBlock();
                skip.statements().add(branchEvent(current, line, condition, false, "implicit-skip"));
                rewrite.set(current, IfStatement.ELSE_STATEMENT_PROPERTY, skip, null);
            }
            return true;
        }
    }

    private Statement branchEvent(IfStatement at, int line, Expression condition, boolean result, String decision) {
        Map<String, Expression> payload = probes.payload();
        payload.put("condition", probes.string(reads.text(condition)));
        payload.put("result", probes.bool(result));
        payload.put("decision", probes.string(decision));
        payload.put("dependsOn", probes.stringList(DependencyCollector.namesRead(condition)));
        return probes.event(at, scopes.visible(), line, EventKind.BRANCH, payload);
    }

    @Override
    public boolean visit(WhileStatement node) {
        if (node.getBody() instanceof Block body) {
            Map<String, Expression> payload = probes.payload();
            payload.put("condition", probes.string(reads.text(node.getExpression())));
            payload.put("result", probes.bool(true));
            payload.put("dependsOn", probes.stringList(DependencyCollector.namesRead(node.getExpression())));
            inserter.insertFirst(body, probes.event(node, scopes.visible(), lineOf(node), EventKind.WHILE_CONDITION, payload));
        }
        return true;
    }

    @Override
    public boolean visit(DoStatement node) {
        if (node.getBody() instanceof Block body) {
            Map<String, Expression> payload = probes.payload();
            payload.put("condition", probes.string(reads.text(node.getExpression())));
            payload.put("dependsOn", probes.stringList(DependencyCollector.namesRead(node.getExpression())));
            inserter.insertFirst(body, probes.event(node, scopes.visible(), lineOf(node), EventKind.LOOP_ITERATION, payload));
        }
        return true;
    }

    @Override
    public boolean visit(ForStatement node) {
        scopes.push();
        String loopVariable = null;
        for (Object init : node.initializers()) {
            if (init instanceof VariableDeclarationExpression declaration) {
                for (Object f : declaration.fragments()) {
                    VariableDeclarationFragment fragment = (VariableDeclarationFragment) f;
                    scopes.declare(fragment.getName().getIdentifier(), fragment.getInitializer() != null);
                    if (loopVariable == null && fragment.getInitializer() != null) {
                        loopVariable = fragment.getName().getIdentifier();
                    }
                }
            } else if (init instanceof Assignment assignment && assignment.getLeftHandSide() instanceof SimpleName name) {
                scopes.markAssigned(name.getIdentifier());
                if (loopVariable == null) loopVariable = name.getIdentifier();
            }
        }
        if (node.getBody() instanceof Block body) {
            Map<String, Expression> payload = probes.payload();
            if (loopVariable != null && scopes.visible().contains(loopVariable)) {
                payload.put("targetName", probes.string(loopVariable));
                payload.put("value", unit.getAST().newSimpleName(loopVariable));
            }
            if (node.getExpression() != null) {
                payload.put("condition", probes.string(reads.text(node.getExpression())));
            }
            payload.put("dependsOn", probes.stringList(DependencyCollector.namesRead(node.getExpression())));
            inserter.insertFirst(body, probes.event(node, scopes.visible(), lineOf(node), EventKind.LOOP_ITERATION, payload));
        }
        return true;
    }

    @Override
    public void endVisit(ForStatement node) {
        scopes.pop();
    }

    @Override
    public boolean visit(EnhancedForStatement node) {
        scopes.push();
        SimpleName variable = node.getParameter().getName();
        scopes.declare(variable.getIdentifier(), true);
        if (node.getBody() instanceof Block body) {
            Map<String, Expression> payload = probes.payload();
            payload.put("targetName", probes.string(variable.getIdentifier()));
            payload.put("value", reads.readOf(variable));
            payload.put("dependsOn", probes.stringList(DependencyCollector.namesRead(node.getExpression())));
            inserter.insertFirst(body, probes.event(node, scopes.visible(), lineOf(node), EventKind.LOOP_ITERATION, payload));
        }
        return true;
    }

    @Override
    public void endVisit(EnhancedForStatement node) {
        scopes.pop();
    }

    // -----------------------------------------------------------------------
    // Script support
    // -----------------------------------------------------------------------

    private boolean isScriptMainBody(Block node) {
        if (scriptClassName == null || !(node.getParent() instanceof MethodDeclaration method)) return false;
        return method.getName().getIdentifier().equals("main")
            && method.getParent() instanceof TypeDeclaration type
            && type.getParent() instanceof CompilationUnit
            && type.getName().getIdentifier().equals(scriptClassName);
    }

    /** Ends the script with {@code __whylineBindings = TraceRecorder.bindings(...)}. */
    private void publishScriptBindings(Block body) {
        List<?> statements = body.statements();
        if (!statements.isEmpty() && !completesNormally((Statement) statements.get(statements.size() - 1))) {
            return;
        }
        Set<String> names = new LinkedHashSet<>(scriptBindingNames);
        names.addAll(scopes.visible());
        names.remove("args");
        AST ast = unit.getAST();
        Assignment publish = ast.newAssignment();
        publish.setLeftHandSide(ast.newSimpleName(ScriptWrapper.BINDINGS_FIELD));
        publish.setRightHandSide(probes.bindingsCall(new ArrayList<>(names)));
        inserter.insertLast(body, ast.newExpressionStatement(publish));
    }

    private static boolean completesNormally(Statement last) {
        if (last instanceof ReturnStatement || last instanceof ThrowStatement) return false;
        if (last instanceof WhileStatement loop) {
            return !(loop.getExpression() instanceof BooleanLiteral literal && literal.booleanValue());
        }
        if (last instanceof ForStatement loop) return loop.getExpression() != null;
        return true;
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private int lineOf(ASTNode node) {
        return unit.getLineNumber(node.getStartPosition());
    }

    private List<String> parameterNames(MethodDeclaration node) {
        List<String> names = new ArrayList<>();
        for (Object p : node.parameters()) {
            names.add(((SingleVariableDeclaration) p).getName().getIdentifier());
        }
        if (node.isCompactConstructor() && node.getParent() instanceof RecordDeclaration record) {
            for (Object c : record.recordComponents()) {
                names.add(((SingleVariableDeclaration) c).getName().getIdentifier());
            }
        }
        return names;
    }

    /** Dotted name of the type declaring {@code node}, {@code <anonymous>} for anonymous classes. */
    private static String typeName(ASTNode node) {
        List<String> parts = new ArrayList<>();
        for (ASTNode n = node.getParent(); n != null; n = n.getParent()) {
            if (n instanceof AnonymousClassDeclaration) {
                if (parts.isEmpty()) return "<anonymous>";
            } else if (n instanceof AbstractTypeDeclaration type) {
                parts.add(0, type.getName().getIdentifier());
            }
        }
        return String.join(".", parts);
    }

    private static boolean isMemberTarget(Expression target) {
        return target instanceof FieldAccess || target instanceof QualifiedName || target instanceof SuperFieldAccess;
    }

    private static Expression memberOwner(Expression target) {
        if (target instanceof FieldAccess access) return access.getExpression();
        if (target instanceof QualifiedName name) return name.getQualifier();
        return null;
    }

    private static String memberName(Expression target) {
        if (target instanceof FieldAccess access) return access.getName().getIdentifier();
        if (target instanceof QualifiedName name) return name.getName().getIdentifier();
        return ((SuperFieldAccess) target).getName().getIdentifier();
    }

    /** {@code Outer.count} names a static field: {@code Outer} is not a value. */
    private static boolean looksLikeTypeName(Expression expression) {
        Expression head = expression;
        while (head instanceof QualifiedName name) head = name.getQualifier();
        return head instanceof SimpleName name && Character.isUpperCase(name.getIdentifier().charAt(0));
    }

    private static boolean isNamed(Expression expression, String simpleName) {
        if (expression instanceof SimpleName name) return name.getIdentifier().equals(simpleName);
        return expression instanceof QualifiedName name && name.getName().getIdentifier().equals(simpleName);
    }

    /** {@code (a) + (b)}, both read back. */
    private Expression sum(Expression left, Expression right) {
        AST ast = unit.getAST();
        InfixExpression sum = ast.newInfixExpression();
        sum.setOperator(InfixExpression.Operator.PLUS);
        sum.setLeftOperand(parenthesized(reads.toReadContext(left)));
        sum.setRightOperand(parenthesized(reads.toReadContext(right)));
        return sum;
    }

    private Expression parenthesized(Expression expression) {
        ParenthesizedExpression parens = unit.getAST().newParenthesizedExpression();
        parens.setExpression(expression);
        return parens;
    }
}
